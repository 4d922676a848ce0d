package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.exception.ChunkingConfigurationException;

/**
 * Token-budget thresholds applied by {@link SectionChunker}.
 *
 * @param minTokens paragraphs below this size are merged with their neighbours
 * @param targetTokens size a sentence window grows to before it is emitted
 * @param maxTokens paragraphs above this size are split; merges never exceed it
 * @param sentenceOverlap sentences repeated at the start of the next window of a split paragraph
 * @throws ChunkingConfigurationException unless {@code 0 < min < target <= max} and {@code overlap
 *     >= 0}
 */
public record ChunkingPolicy(
    int minTokens, int targetTokens, int maxTokens, int sentenceOverlap) {

  public static final int DEFAULT_MIN_TOKENS = 80;
  public static final int DEFAULT_TARGET_TOKENS = 220;
  public static final int DEFAULT_MAX_TOKENS = 300;
  public static final int DEFAULT_SENTENCE_OVERLAP = 1;

  public ChunkingPolicy {
    if (minTokens <= 0 || targetTokens <= 0 || maxTokens <= 0) {
      throw new ChunkingConfigurationException(
          String.format(
              "Token thresholds must be positive: min=%d, target=%d, max=%d",
              minTokens, targetTokens, maxTokens));
    }
    if (minTokens >= targetTokens) {
      throw new ChunkingConfigurationException(
          String.format("min-tokens (%d) must be below target-tokens (%d)", minTokens, targetTokens));
    }
    if (targetTokens > maxTokens) {
      throw new ChunkingConfigurationException(
          String.format(
              "target-tokens (%d) must not exceed max-tokens (%d)", targetTokens, maxTokens));
    }
    if (sentenceOverlap < 0) {
      throw new ChunkingConfigurationException(
          "sentence-overlap must not be negative: " + sentenceOverlap);
    }
  }

  /** Returns the policy with the stock thresholds (80 / 220 / 300, overlap 1). */
  public static ChunkingPolicy defaults() {
    return new ChunkingPolicy(
        DEFAULT_MIN_TOKENS, DEFAULT_TARGET_TOKENS, DEFAULT_MAX_TOKENS, DEFAULT_SENTENCE_OVERLAP);
  }
}
