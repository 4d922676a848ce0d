package com.flamingo.ai.chunker.api.rest;

import com.flamingo.ai.chunker.api.dto.request.ChunkDocumentRequest;
import com.flamingo.ai.chunker.api.dto.response.ChunkResponse;
import com.flamingo.ai.chunker.api.dto.response.ChunkingResponse;
import com.flamingo.ai.chunker.api.dto.response.IngestionResponse;
import com.flamingo.ai.chunker.api.dto.response.PolicyResponse;
import com.flamingo.ai.chunker.service.chunking.ChunkingPolicy;
import com.flamingo.ai.chunker.service.chunking.ChunkingResult;
import com.flamingo.ai.chunker.service.chunking.ChunkingService;
import com.flamingo.ai.chunker.service.chunking.Tokenizer;
import com.flamingo.ai.chunker.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.chunker.service.ingestion.IngestionResult;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for chunking and ingesting documents. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChunkingController {

  private final ChunkingService chunkingService;
  private final DocumentIngestionService ingestionService;
  private final ChunkingPolicy chunkingPolicy;
  private final Tokenizer tokenizer;

  /** Chunks a document without storing the result. */
  @PostMapping("/documents/{documentId}/chunks")
  public ResponseEntity<ChunkingResponse> chunkDocument(
      @PathVariable String documentId, @Valid @RequestBody ChunkDocumentRequest request) {
    ChunkingResult result = chunkingService.chunkDocument(documentId, request.getContent());
    return ResponseEntity.ok(ChunkingResponse.fromResult(result));
  }

  /** Chunks a document and stores any chunks not already present. */
  @PostMapping("/documents/{documentId}/ingest")
  public ResponseEntity<IngestionResponse> ingestDocument(
      @PathVariable String documentId, @Valid @RequestBody ChunkDocumentRequest request) {
    IngestionResult result = ingestionService.ingest(documentId, request.getContent());
    return ResponseEntity.status(HttpStatus.CREATED).body(IngestionResponse.fromResult(result));
  }

  /** Gets the stored chunks of a document. */
  @GetMapping("/documents/{documentId}/chunks")
  public ResponseEntity<List<ChunkResponse>> getChunks(@PathVariable String documentId) {
    List<ChunkResponse> chunks =
        ingestionService.getChunks(documentId).stream().map(ChunkResponse::fromChunk).toList();
    return ResponseEntity.ok(chunks);
  }

  /** Deletes the stored chunks of a document. */
  @DeleteMapping("/documents/{documentId}/chunks")
  public ResponseEntity<Void> deleteChunks(@PathVariable String documentId) {
    ingestionService.deleteDocument(documentId);
    return ResponseEntity.noContent().build();
  }

  /** Gets the active chunking policy. */
  @GetMapping("/chunking/policy")
  public ResponseEntity<PolicyResponse> getPolicy() {
    return ResponseEntity.ok(
        PolicyResponse.builder()
            .minTokens(chunkingPolicy.minTokens())
            .targetTokens(chunkingPolicy.targetTokens())
            .maxTokens(chunkingPolicy.maxTokens())
            .sentenceOverlap(chunkingPolicy.sentenceOverlap())
            .tokenizer(tokenizer.toString())
            .build());
  }
}
