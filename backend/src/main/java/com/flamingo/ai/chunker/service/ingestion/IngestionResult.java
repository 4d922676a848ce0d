package com.flamingo.ai.chunker.service.ingestion;

/**
 * Outcome of ingesting one document.
 *
 * @param documentId ingested document
 * @param totalChunks chunks produced by the chunker
 * @param insertedChunks chunks newly written to the store
 * @param skippedChunks chunks whose id was already stored
 */
public record IngestionResult(
    String documentId, int totalChunks, int insertedChunks, int skippedChunks) {}
