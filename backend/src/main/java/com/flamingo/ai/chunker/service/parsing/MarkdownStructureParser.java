package com.flamingo.ai.chunker.service.parsing;

import com.flamingo.ai.chunker.service.chunking.model.Section;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link StructureParser} for ATX-style Markdown outlines ({@code # Title}, {@code ## Sub}, ...).
 *
 * <p>The input is scanned line by line:
 *
 * <ul>
 *   <li>a header line closes the pending paragraph and opens a section whose level is the number of
 *       leading {@code #} characters; open sections at the same or a deeper level are closed first,
 *       so skipped levels simply nest under the nearest shallower ancestor
 *   <li>a blank line closes the pending paragraph
 *   <li>any other line is appended to the pending paragraph; lines are joined with single spaces
 * </ul>
 *
 * <p>Text before the first header belongs to the root section. Other Markdown constructs (lists,
 * code fences, setext headers) are treated as plain paragraph text.
 */
public class MarkdownStructureParser implements StructureParser {

  private static final Pattern ATX_HEADER = Pattern.compile("^(#+)\\s+(.*)$");

  @Override
  public Section parse(String rawText) {
    SectionNode root = new SectionNode(Section.ROOT_TITLE, 0, List.of());
    Deque<SectionNode> stack = new ArrayDeque<>();
    stack.push(root);
    List<String> pendingLines = new ArrayList<>();

    if (rawText != null) {
      for (String line : rawText.split("\\R", -1)) {
        String stripped = line.strip();
        if (stripped.isEmpty()) {
          flushParagraph(pendingLines, stack.peek());
          continue;
        }

        Matcher header = ATX_HEADER.matcher(stripped);
        if (header.matches()) {
          flushParagraph(pendingLines, stack.peek());
          int level = header.group(1).length();
          String title = header.group(2).strip();

          while (stack.size() > 1 && stack.peek().level >= level) {
            stack.pop();
          }
          SectionNode parent = stack.peek();
          List<String> path = new ArrayList<>(parent.path);
          path.add(title);
          SectionNode section = new SectionNode(title, level, path);
          parent.children.add(section);
          stack.push(section);
        } else {
          pendingLines.add(stripped);
        }
      }
    }

    flushParagraph(pendingLines, stack.peek());
    return root.toSection();
  }

  private void flushParagraph(List<String> pendingLines, SectionNode target) {
    if (pendingLines.isEmpty()) {
      return;
    }
    String paragraph = String.join(" ", pendingLines).strip();
    if (!paragraph.isEmpty()) {
      target.content.add(paragraph);
    }
    pendingLines.clear();
  }

  // ---- mutable tree used while parsing ----

  private static final class SectionNode {

    private final String title;
    private final int level;
    private final List<String> path;
    private final List<String> content = new ArrayList<>();
    private final List<SectionNode> children = new ArrayList<>();

    private SectionNode(String title, int level, List<String> path) {
      this.title = title;
      this.level = level;
      this.path = path;
    }

    private Section toSection() {
      List<Section> subsections = new ArrayList<>(children.size());
      for (SectionNode child : children) {
        subsections.add(child.toSection());
      }
      return new Section(title, level, path, content, subsections);
    }
  }
}
