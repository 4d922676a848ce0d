package com.flamingo.ai.chunker.exception;

/**
 * Thrown when chunking thresholds are inconsistent.
 *
 * <p>Raised while the chunking policy is built, normally at application startup. Values are never
 * clamped into range.
 */
public class ChunkingConfigurationException extends RuntimeException {

  public ChunkingConfigurationException(String message) {
    super(message);
  }
}
