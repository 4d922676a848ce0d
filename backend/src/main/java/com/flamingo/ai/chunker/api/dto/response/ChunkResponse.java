package com.flamingo.ai.chunker.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a single chunk. {@code subchunk_index} is omitted unless the chunk is split. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChunkResponse {

  private String chunkId;
  private String documentId;
  private String text;
  private int tokenCount;
  private String chunkType;
  private List<String> sectionPath;
  private int paragraphIndex;
  private Integer subchunkIndex;

  /** Creates a ChunkResponse from a Chunk. */
  public static ChunkResponse fromChunk(Chunk chunk) {
    return ChunkResponse.builder()
        .chunkId(chunk.chunkId())
        .documentId(chunk.documentId())
        .text(chunk.text())
        .tokenCount(chunk.tokenCount())
        .chunkType(chunk.chunkType().value())
        .sectionPath(chunk.sectionPath())
        .paragraphIndex(chunk.paragraphIndex())
        .subchunkIndex(chunk.subchunkIndex())
        .build();
  }
}
