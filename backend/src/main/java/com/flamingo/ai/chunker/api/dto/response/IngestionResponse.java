package com.flamingo.ai.chunker.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.chunker.service.ingestion.IngestionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an ingested document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IngestionResponse {

  private String documentId;
  private int totalChunks;
  private int insertedChunks;
  private int skippedChunks;

  /** Creates an IngestionResponse from an IngestionResult. */
  public static IngestionResponse fromResult(IngestionResult result) {
    return IngestionResponse.builder()
        .documentId(result.documentId())
        .totalChunks(result.totalChunks())
        .insertedChunks(result.insertedChunks())
        .skippedChunks(result.skippedChunks())
        .build();
  }
}
