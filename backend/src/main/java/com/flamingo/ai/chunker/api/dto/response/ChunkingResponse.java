package com.flamingo.ai.chunker.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.chunker.service.chunking.ChunkingResult;
import com.flamingo.ai.chunker.service.parsing.OutlineEntry;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chunked document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChunkingResponse {

  private String documentId;
  private String title;
  private String abstractText;
  private List<OutlineEntry> outline;
  private int chunkCount;
  private List<ChunkResponse> chunks;

  /** Creates a ChunkingResponse from a ChunkingResult. */
  public static ChunkingResponse fromResult(ChunkingResult result) {
    return ChunkingResponse.builder()
        .documentId(result.documentId())
        .title(result.title())
        .abstractText(result.abstractText())
        .outline(result.outline())
        .chunkCount(result.chunks().size())
        .chunks(result.chunks().stream().map(ChunkResponse::fromChunk).toList())
        .build();
  }
}
