package com.flamingo.ai.chunker.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Tokenizer Tests")
class TokenizerTest {

  @Nested
  @DisplayName("WhitespaceTokenizer")
  class Whitespace {

    private final Tokenizer tokenizer = new WhitespaceTokenizer();

    @Test
    @DisplayName("should count whitespace-separated words")
    void shouldCountWords() {
      assertThat(tokenizer.countTokens("one two\tthree\n\nfour  five")).isEqualTo(5);
    }

    @Test
    @DisplayName("should count zero tokens for blank text")
    void shouldCountZero_forBlank() {
      assertThat(tokenizer.countTokens("")).isZero();
      assertThat(tokenizer.countTokens(" \n\t ")).isZero();
    }

    @Test
    @DisplayName("should split on Unicode spaces such as the no-break space")
    void shouldSplitOnUnicodeSpaces() {
      assertThat(tokenizer.countTokens("alpha\u00A0beta\u2003gamma\u3000delta")).isEqualTo(4);
      assertThat(tokenizer.countTokens("\u00A0\u00A0")).isZero();
    }
  }

  @Nested
  @DisplayName("CharacterEstimateTokenizer")
  class CharacterEstimate {

    @Test
    @DisplayName("should round the character estimate up")
    void shouldRoundUp() {
      Tokenizer tokenizer = new CharacterEstimateTokenizer(4);

      assertThat(tokenizer.countTokens("abcd")).isEqualTo(1);
      assertThat(tokenizer.countTokens("abcde")).isEqualTo(2);
      assertThat(tokenizer.countTokens("  ")).isZero();
    }

    @Test
    @DisplayName("should reject a non-positive ratio")
    void shouldRejectNonPositiveRatio() {
      assertThatThrownBy(() -> new CharacterEstimateTokenizer(0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
