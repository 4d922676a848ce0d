package com.flamingo.ai.chunker.service.chunking;

import java.util.regex.Pattern;

/**
 * {@link Tokenizer} that counts whitespace-separated words. Any Unicode white space separates
 * words, including the no-break space. Blank text has zero tokens.
 */
public final class WhitespaceTokenizer implements Tokenizer {

  public static final String NAME = "whitespace";

  private static final Pattern WORD = Pattern.compile("\\S+", Pattern.UNICODE_CHARACTER_CLASS);

  @Override
  public int countTokens(String text) {
    return (int) WORD.matcher(text).results().count();
  }

  @Override
  public String toString() {
    return NAME;
  }
}
