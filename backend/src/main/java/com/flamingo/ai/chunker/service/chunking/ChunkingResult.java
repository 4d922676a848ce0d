package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.parsing.OutlineEntry;
import java.util.List;

/**
 * The composite result of a {@link ChunkingService#chunkDocument} call.
 *
 * @param documentId identifier of the chunked document
 * @param title document title derived from its headers, or the document id when it has none
 * @param abstractText lead text of the document
 * @param outline table of contents in document order
 * @param chunks chunks ready for embedding and storage
 */
public record ChunkingResult(
    String documentId,
    String title,
    String abstractText,
    List<OutlineEntry> outline,
    List<Chunk> chunks) {}
