package com.flamingo.ai.chunker.service.parsing;

import java.util.List;

/**
 * One line of a document's table of contents.
 *
 * @param level header depth (1 = {@code #}, 2 = {@code ##}, ...)
 * @param title header text
 * @param path titles from the outermost section down to this one
 */
public record OutlineEntry(int level, String title, List<String> path) {

  public OutlineEntry {
    path = List.copyOf(path);
  }
}
