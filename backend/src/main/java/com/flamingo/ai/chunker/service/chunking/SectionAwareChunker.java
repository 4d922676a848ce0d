package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.Section;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DocumentChunker} that keeps every chunk inside one section.
 *
 * <p>Walks the tree pre-order: a section's own paragraphs are chunked by {@link SectionChunker}
 * before its subsections are visited in document order. Nothing is merged or split across section
 * boundaries.
 *
 * <p>Any exception raised by the tokenizer aborts the whole document; no partial list escapes.
 */
public class SectionAwareChunker implements DocumentChunker {

  private final SectionChunker sectionChunker;

  public SectionAwareChunker(SectionChunker sectionChunker) {
    this.sectionChunker = sectionChunker;
  }

  @Override
  public List<Chunk> chunk(String documentId, Section root) {
    List<Chunk> result = new ArrayList<>();
    walkSections(documentId, root, result);
    return List.copyOf(result);
  }

  // ---- recursive section walk ----

  private void walkSections(String documentId, Section section, List<Chunk> result) {
    result.addAll(sectionChunker.chunkSection(documentId, section));
    for (Section child : section.subsections()) {
      walkSections(documentId, child, result);
    }
  }
}
