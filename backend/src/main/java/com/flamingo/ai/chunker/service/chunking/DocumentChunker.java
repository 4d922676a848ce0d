package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.Section;
import java.util.List;

/**
 * Turns a parsed {@link Section} tree into an ordered list of {@link Chunk}s ready for embedding.
 *
 * <p>Implementations must be stateless and safe for concurrent use across documents. A single
 * document is always chunked sequentially.
 *
 * <p>A chunker only chunks: it does not parse, embed or persist.
 */
public interface DocumentChunker {

  /**
   * Produces chunks for every section of the tree.
   *
   * @param documentId stable identifier of the source document
   * @param root root section returned by the structure parser
   * @return ordered chunks; empty for an empty document
   */
  List<Chunk> chunk(String documentId, Section root);
}
