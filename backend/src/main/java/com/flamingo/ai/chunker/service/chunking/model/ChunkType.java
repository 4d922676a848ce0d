package com.flamingo.ai.chunker.service.chunking.model;

/** How a {@link Chunk}'s text was derived from its section's paragraphs. */
public enum ChunkType {
  /** A single paragraph that already fits the token budget. */
  PARAGRAPH("paragraph"),

  /** One or more undersized consecutive paragraphs joined by blank lines. */
  MERGED("merged"),

  /** One sentence window of an oversized paragraph. */
  SPLIT("split");

  private final String value;

  ChunkType(String value) {
    this.value = value;
  }

  /** Lower-case wire name, as stored by the persistence layer. */
  public String value() {
    return value;
  }
}
