package com.flamingo.ai.chunker.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chunker.service.chunking.model.Section;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DocumentMetadataExtractor Tests")
class DocumentMetadataExtractorTest {

  private final DocumentMetadataExtractor extractor = new DocumentMetadataExtractor();
  private final MarkdownStructureParser parser = new MarkdownStructureParser();

  @Test
  @DisplayName("Should take the lead text before the first header as abstract")
  void shouldExtractLeadAsAbstract() {
    String content = "Alan Turing was a mathematician.\nHe was born in London.\n\n# Early life\n\nBody";

    assertThat(extractor.extractAbstract(content))
        .isEqualTo("Alan Turing was a mathematician.\nHe was born in London.");
  }

  @Test
  @DisplayName("Should fall back to the opening characters when the document starts with a header")
  void shouldFallBackWhenDocumentStartsWithHeader() {
    String content = "# Title\n\n" + "x".repeat(1500);

    String abstractText = extractor.extractAbstract(content);

    assertThat(abstractText).hasSize(1000).startsWith("# Title");
  }

  @Test
  @DisplayName("Should cap long abstracts")
  void shouldCapLongAbstracts() {
    assertThat(extractor.extractAbstract("y".repeat(5000))).hasSize(2000);
  }

  @Test
  @DisplayName("Should return empty abstract for empty input")
  void shouldReturnEmptyAbstract_forEmptyInput() {
    assertThat(extractor.extractAbstract(null)).isEmpty();
    assertThat(extractor.extractAbstract("")).isEmpty();
  }

  @Test
  @DisplayName("Should flatten the section tree into a pre-order outline")
  void shouldExtractOutline() {
    Section root = parser.parse("# A\n## B\n### C\n## D\n# E");

    List<OutlineEntry> outline = extractor.extractOutline(root);

    assertThat(outline).extracting(OutlineEntry::title).containsExactly("A", "B", "C", "D", "E");
    assertThat(outline).extracting(OutlineEntry::level).containsExactly(1, 2, 3, 2, 1);
    assertThat(outline.get(2).path()).containsExactly("A", "B", "C");
  }

  @Test
  @DisplayName("Should prefer the first level-1 header as title")
  void shouldPreferLevelOneTitle() {
    assertThat(extractor.extractTitle(parser.parse("## Intro\n# Main Title\n# Other"), "doc"))
        .isEqualTo("Main Title");
    assertThat(extractor.extractTitle(parser.parse("## Only Sub"), "doc")).isEqualTo("Only Sub");
    assertThat(extractor.extractTitle(parser.parse("no headers"), "doc")).isEqualTo("doc");
  }
}
