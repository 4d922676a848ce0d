package com.flamingo.ai.chunker.service.parsing;

import com.flamingo.ai.chunker.service.chunking.model.Section;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts document-level metadata stored alongside the chunks: title, abstract and table of
 * contents.
 */
public class DocumentMetadataExtractor {

  /** Abstract length when the document opens with a header. */
  static final int FALLBACK_ABSTRACT_CHARS = 1000;

  /** Upper bound on the abstract length. */
  static final int MAX_ABSTRACT_CHARS = 2000;

  /**
   * Extracts the lead text of a document.
   *
   * <p>Takes every line before the first line starting with {@code #}. When that is blank (the
   * document opens with a header), falls back to the first {@value #FALLBACK_ABSTRACT_CHARS}
   * characters of the whole text.
   *
   * @param rawText document text
   * @return abstract of at most {@value #MAX_ABSTRACT_CHARS} characters; empty for empty input
   */
  public String extractAbstract(String rawText) {
    if (rawText == null || rawText.isEmpty()) {
      return "";
    }

    List<String> leadLines = new ArrayList<>();
    for (String line : rawText.split("\\R", -1)) {
      if (line.startsWith("#")) {
        break;
      }
      leadLines.add(line);
    }

    String lead = String.join("\n", leadLines).strip();
    if (lead.isEmpty()) {
      return rawText.substring(0, Math.min(FALLBACK_ABSTRACT_CHARS, rawText.length()));
    }
    return lead.length() > MAX_ABSTRACT_CHARS ? lead.substring(0, MAX_ABSTRACT_CHARS) : lead;
  }

  /**
   * Flattens the section tree into a table of contents, pre-order, root excluded.
   *
   * @param root parsed root section
   * @return outline entries in document order
   */
  public List<OutlineEntry> extractOutline(Section root) {
    List<OutlineEntry> outline = new ArrayList<>();
    for (Section child : root.subsections()) {
      collectOutline(child, outline);
    }
    return outline;
  }

  /**
   * Picks a display title: the first level-1 header, else the first header of any level, else
   * {@code fallback}.
   *
   * @param root parsed root section
   * @param fallback title to use for documents without headers
   * @return document title
   */
  public String extractTitle(Section root, String fallback) {
    List<OutlineEntry> outline = extractOutline(root);
    return outline.stream()
        .filter(entry -> entry.level() == 1)
        .map(OutlineEntry::title)
        .findFirst()
        .orElseGet(() -> outline.isEmpty() ? fallback : outline.get(0).title());
  }

  private void collectOutline(Section section, List<OutlineEntry> outline) {
    outline.add(new OutlineEntry(section.level(), section.title(), section.path()));
    for (Section child : section.subsections()) {
      collectOutline(child, outline);
    }
  }
}
