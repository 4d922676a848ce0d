package com.flamingo.ai.chunker.service.ingestion;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import java.util.List;

/**
 * Persistence seam for chunks, keyed by {@link Chunk#chunkId()}.
 *
 * <p>Writes follow insert-if-absent semantics so that re-ingesting a document is a no-op for
 * chunks already stored. Implementations must be safe for concurrent use.
 */
public interface ChunkStore {

  /**
   * Stores {@code chunk} unless a chunk with the same id exists.
   *
   * @return {@code true} if the chunk was inserted, {@code false} if the id was already present
   */
  boolean insertIfAbsent(Chunk chunk);

  /** Returns the chunks of a document in insertion order; empty when none are stored. */
  List<Chunk> findByDocumentId(String documentId);

  /**
   * Removes every chunk of a document.
   *
   * @return number of chunks removed
   */
  int deleteByDocumentId(String documentId);

  /** Total number of stored chunks. */
  long count();
}
