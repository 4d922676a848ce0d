package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.exception.InvalidDocumentIdException;
import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.Section;
import com.flamingo.ai.chunker.service.parsing.DocumentMetadataExtractor;
import com.flamingo.ai.chunker.service.parsing.OutlineEntry;
import com.flamingo.ai.chunker.service.parsing.StructureParser;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates document chunking: parse the outline, chunk every section, extract metadata.
 *
 * <p>This is the host layer around the chunking core and the only place that logs or records
 * metrics for it. Exceptions from the tokenizer are logged and rethrown unchanged; no partial
 * result is returned for that document.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkingService {

  private final StructureParser structureParser;
  private final DocumentChunker documentChunker;
  private final DocumentMetadataExtractor metadataExtractor;
  private final MeterRegistry meterRegistry;

  /**
   * Chunks a Markdown document.
   *
   * @param documentId stable identifier of the document; chunk ids depend on it
   * @param rawText ATX-header Markdown text
   * @return chunks plus document metadata
   * @throws InvalidDocumentIdException if {@code documentId} is blank
   */
  @Timed(value = "document.chunk", description = "Time to chunk a document")
  public ChunkingResult chunkDocument(String documentId, String rawText) {
    if (documentId == null || documentId.isBlank()) {
      throw new InvalidDocumentIdException(documentId);
    }

    Section root = structureParser.parse(rawText);
    List<Chunk> chunks;
    try {
      chunks = documentChunker.chunk(documentId, root);
    } catch (RuntimeException e) {
      meterRegistry.counter("chunking_failures_total").increment();
      log.error("Chunking failed for document {}: {}", documentId, e.getMessage(), e);
      throw e;
    }

    List<OutlineEntry> outline = metadataExtractor.extractOutline(root);
    String title = metadataExtractor.extractTitle(root, documentId);
    String abstractText = metadataExtractor.extractAbstract(rawText);

    recordMetrics(chunks);
    log.info(
        "Document {} chunked: {} sections, {} chunks", documentId, outline.size() + 1, chunks.size());
    log.debug("Document {} title='{}', outline={}", documentId, title, outline);

    return new ChunkingResult(documentId, title, abstractText, outline, chunks);
  }

  private void recordMetrics(List<Chunk> chunks) {
    DistributionSummary tokens =
        DistributionSummary.builder("chunk_tokens")
            .description("Token count per emitted chunk")
            .register(meterRegistry);
    for (Chunk chunk : chunks) {
      meterRegistry
          .counter("chunks_emitted_total", "chunk_type", chunk.chunkType().value())
          .increment();
      tokens.record(chunk.tokenCount());
    }
  }
}
