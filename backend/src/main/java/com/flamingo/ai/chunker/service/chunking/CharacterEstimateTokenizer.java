package com.flamingo.ai.chunker.service.chunking;

/**
 * {@link Tokenizer} approximating subword tokenizers by character length.
 *
 * <p>English text averages roughly four characters per token for BPE vocabularies, so the default
 * ratio is 4. Counts are rounded up: any non-empty text is at least one token.
 */
public final class CharacterEstimateTokenizer implements Tokenizer {

  public static final String NAME = "char-estimate";

  private final int charsPerToken;

  public CharacterEstimateTokenizer(int charsPerToken) {
    if (charsPerToken <= 0) {
      throw new IllegalArgumentException("charsPerToken must be positive: " + charsPerToken);
    }
    this.charsPerToken = charsPerToken;
  }

  @Override
  public int countTokens(String text) {
    int length = text.strip().length();
    return (length + charsPerToken - 1) / charsPerToken;
  }

  @Override
  public String toString() {
    return NAME;
  }
}
