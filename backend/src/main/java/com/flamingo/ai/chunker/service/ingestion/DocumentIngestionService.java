package com.flamingo.ai.chunker.service.ingestion;

import com.flamingo.ai.chunker.exception.DocumentNotFoundException;
import com.flamingo.ai.chunker.service.chunking.ChunkingResult;
import com.flamingo.ai.chunker.service.chunking.ChunkingService;
import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chunks documents and writes the chunks to the {@link ChunkStore}.
 *
 * <p>Chunk ids are position-derived, so ingesting the same document twice inserts nothing the
 * second time. Chunking happens before any write: a tokenizer failure leaves the store untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

  private final ChunkingService chunkingService;
  private final ChunkStore chunkStore;
  private final MeterRegistry meterRegistry;

  /**
   * Chunks {@code rawText} and upserts the result.
   *
   * @param documentId stable document identifier
   * @param rawText ATX-header Markdown text
   * @return counts of produced, inserted and skipped chunks
   */
  @Timed(value = "document.ingest", description = "Time to chunk and store a document")
  public IngestionResult ingest(String documentId, String rawText) {
    ChunkingResult result = chunkingService.chunkDocument(documentId, rawText);

    int inserted = 0;
    for (Chunk chunk : result.chunks()) {
      if (chunkStore.insertIfAbsent(chunk)) {
        inserted++;
      }
    }
    int skipped = result.chunks().size() - inserted;

    meterRegistry.counter("chunks_stored_total").increment(inserted);
    meterRegistry.counter("chunks_skipped_total").increment(skipped);
    log.info(
        "Ingested document {}: {} chunks, {} inserted, {} already present",
        documentId,
        result.chunks().size(),
        inserted,
        skipped);

    return new IngestionResult(documentId, result.chunks().size(), inserted, skipped);
  }

  /**
   * Returns the stored chunks of a document.
   *
   * @throws DocumentNotFoundException if nothing is stored for {@code documentId}
   */
  public List<Chunk> getChunks(String documentId) {
    List<Chunk> chunks = chunkStore.findByDocumentId(documentId);
    if (chunks.isEmpty()) {
      throw new DocumentNotFoundException(documentId);
    }
    return chunks;
  }

  /**
   * Removes the stored chunks of a document.
   *
   * @return number of chunks removed
   */
  public int deleteDocument(String documentId) {
    int removed = chunkStore.deleteByDocumentId(documentId);
    log.info("Deleted {} chunks of document {}", removed, documentId);
    return removed;
  }
}
