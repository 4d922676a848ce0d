package com.flamingo.ai.chunker.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Heuristic sentence splitter.
 *
 * <p>Breaks after {@code .}, {@code !} or {@code ?} followed by whitespace, except where the
 * punctuation closes a common abbreviation:
 *
 * <ul>
 *   <li>dotted lower/upper-case runs such as {@code e.g.} or {@code U.S.}
 *   <li>capitalised two-letter titles such as {@code Mr.} or {@code Dr.}
 *   <li>single-capital initials such as {@code J. Smith}
 * </ul>
 *
 * <p>Abbreviations outside these shapes still over-split. Stateless and thread-safe.
 */
public final class SentenceSegmenter {

  private static final Pattern SENTENCE_BOUNDARY =
      Pattern.compile(
          "(?<!\\w\\.\\w.)(?<![A-Z][a-z]\\.)(?<!(?:^|\\s)[A-Z]\\.)(?<=[.!?])\\s+",
          Pattern.UNICODE_CHARACTER_CLASS);

  /**
   * Splits {@code text} into trimmed, non-empty sentences in order.
   *
   * @param text paragraph text
   * @return sentences; empty when {@code text} is blank
   */
  public List<String> segment(String text) {
    List<String> sentences = new ArrayList<>();
    for (String fragment : SENTENCE_BOUNDARY.split(text)) {
      String sentence = fragment.strip();
      if (!sentence.isEmpty()) {
        sentences.add(sentence);
      }
    }
    return sentences;
  }
}
