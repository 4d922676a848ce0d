package com.flamingo.ai.chunker.service.chunking.model;

import java.util.List;

/**
 * A node in the header-derived outline of a document.
 *
 * <p>Built once by {@link com.flamingo.ai.chunker.service.parsing.StructureParser} and immutable
 * afterwards. Each section exclusively owns its children; there are no parent links.
 *
 * @param title header text that opened this section; empty for the root
 * @param level nesting depth (0 = root, N = level-N header)
 * @param path ancestor titles from the outermost section down to this one, excluding the root;
 *     empty for the root
 * @param content paragraphs belonging directly to this section, not to its descendants
 * @param subsections child sections in document order
 */
public record Section(
    String title, int level, List<String> path, List<String> content, List<Section> subsections) {

  public static final String ROOT_TITLE = "";

  public Section {
    path = List.copyOf(path);
    content = List.copyOf(content);
    subsections = List.copyOf(subsections);
  }

  /** Returns {@code true} for the synthetic root that holds text before the first header. */
  public boolean isRoot() {
    return level == 0;
  }
}
