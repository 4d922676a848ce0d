package com.flamingo.ai.chunker.service.chunking.model;

import java.util.List;

/**
 * A bounded-size unit of document text, ready for embedding.
 *
 * @param chunkId stable 16-character hex identity, see {@link
 *     com.flamingo.ai.chunker.service.chunking.ChunkIdentity}
 * @param documentId identifier of the source document
 * @param text chunk text
 * @param tokenCount token count of {@code text} as measured by the configured tokenizer
 * @param chunkType how the text was derived
 * @param sectionPath path of the section the text came from
 * @param paragraphIndex index of the source paragraph in its section; for merged chunks the first
 *     paragraph folded in
 * @param subchunkIndex window position for {@link ChunkType#SPLIT} chunks, {@code null} otherwise
 */
public record Chunk(
    String chunkId,
    String documentId,
    String text,
    int tokenCount,
    ChunkType chunkType,
    List<String> sectionPath,
    int paragraphIndex,
    Integer subchunkIndex) {

  public Chunk {
    sectionPath = List.copyOf(sectionPath);
  }
}
