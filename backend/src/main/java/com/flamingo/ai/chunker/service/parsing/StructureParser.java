package com.flamingo.ai.chunker.service.parsing;

import com.flamingo.ai.chunker.service.chunking.model.Section;

/**
 * Parses raw structured text into a {@link Section} tree.
 *
 * <p>Implementations must be stateless so a single instance can be shared across concurrent
 * document-processing threads.
 *
 * <p>A parser only parses: it does not chunk or embed.
 */
public interface StructureParser {

  /**
   * Parses the given document text.
   *
   * @param rawText document text; {@code null} is treated as empty
   * @return the root section (level 0, empty path); never {@code null}
   */
  Section parse(String rawText);
}
