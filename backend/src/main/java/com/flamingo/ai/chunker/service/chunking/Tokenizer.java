package com.flamingo.ai.chunker.service.chunking;

/**
 * Counts tokens in a piece of text.
 *
 * <p>Supplied by the host at construction time. The chunker never assumes a particular backend:
 * whitespace counting and real subword tokenizers are equally valid. Implementations shared across
 * threads must be stateless or reentrant.
 */
@FunctionalInterface
public interface Tokenizer {

  /**
   * Counts the tokens in {@code text}.
   *
   * @param text text to measure, never {@code null}
   * @return token count, {@code >= 0}
   */
  int countTokens(String text);
}
