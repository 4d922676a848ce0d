package com.flamingo.ai.chunker.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO carrying the Markdown text of a document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkDocumentRequest {

  /** ATX-header Markdown. An empty document is valid and yields no chunks. */
  @NotNull(message = "Content is required")
  @Size(max = 5_000_000, message = "Content must not exceed 5000000 characters")
  private String content;
}
