package com.flamingo.ai.chunker.config;

import com.flamingo.ai.chunker.service.chunking.ChunkingPolicy;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the chunking engine. */
@Configuration
@ConfigurationProperties(prefix = "chunking")
@Validated
@Getter
@Setter
public class ChunkingConfig {

  /** Paragraphs below this many tokens are merged with their neighbours. */
  @Positive private int minTokens = ChunkingPolicy.DEFAULT_MIN_TOKENS;

  /** Size a sentence window grows to when an oversized paragraph is split. */
  @Positive private int targetTokens = ChunkingPolicy.DEFAULT_TARGET_TOKENS;

  /** Paragraphs above this many tokens are split; merged chunks never exceed it. */
  @Positive private int maxTokens = ChunkingPolicy.DEFAULT_MAX_TOKENS;

  /** Sentences repeated between consecutive windows of a split paragraph. */
  @PositiveOrZero private int sentenceOverlap = ChunkingPolicy.DEFAULT_SENTENCE_OVERLAP;

  /** Tokenizer: "whitespace" (default) or "char-estimate". */
  private String tokenizer = "whitespace";

  /** Characters per token for the "char-estimate" tokenizer. */
  @Positive private int charsPerToken = 4;

  /**
   * Builds the immutable policy from the current values.
   *
   * @throws com.flamingo.ai.chunker.exception.ChunkingConfigurationException when the thresholds
   *     are inconsistent
   */
  public ChunkingPolicy toPolicy() {
    return new ChunkingPolicy(minTokens, targetTokens, maxTokens, sentenceOverlap);
  }
}
