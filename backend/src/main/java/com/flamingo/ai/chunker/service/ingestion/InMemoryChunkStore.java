package com.flamingo.ai.chunker.service.ingestion;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Repository;

/**
 * {@link ChunkStore} backed by process memory.
 *
 * <p>Chunk ids form a global primary key; each document additionally keeps its chunks in insertion
 * order. Both indexes change under one store-wide write lock, so an id is present in the primary
 * key exactly when it is reachable through its document.
 */
@Repository
public class InMemoryChunkStore implements ChunkStore {

  private final Map<String, Chunk> chunksById = new HashMap<>();
  private final Map<String, Map<String, Chunk>> chunksByDocument = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  public boolean insertIfAbsent(Chunk chunk) {
    lock.writeLock().lock();
    try {
      if (chunksById.putIfAbsent(chunk.chunkId(), chunk) != null) {
        return false;
      }
      chunksByDocument
          .computeIfAbsent(chunk.documentId(), id -> new LinkedHashMap<>())
          .put(chunk.chunkId(), chunk);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<Chunk> findByDocumentId(String documentId) {
    lock.readLock().lock();
    try {
      Map<String, Chunk> bucket = chunksByDocument.get(documentId);
      return bucket == null ? List.of() : List.copyOf(bucket.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int deleteByDocumentId(String documentId) {
    lock.writeLock().lock();
    try {
      Map<String, Chunk> bucket = chunksByDocument.remove(documentId);
      if (bucket == null) {
        return 0;
      }
      bucket.keySet().forEach(chunksById::remove);
      return bucket.size();
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public long count() {
    lock.readLock().lock();
    try {
      return chunksById.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
