package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.chunking.model.Chunk;
import com.flamingo.ai.chunker.service.chunking.model.ChunkType;
import com.flamingo.ai.chunker.service.chunking.model.Section;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies the merge/split token policy to the direct paragraphs of one {@link Section}.
 *
 * <p>Paragraphs are visited in order against a single-slot merge buffer:
 *
 * <ul>
 *   <li>below {@code minTokens}: folded into the buffer while the joined text stays within {@code
 *       maxTokens}; otherwise the buffer is flushed as a {@link ChunkType#MERGED} chunk and
 *       restarted with this paragraph
 *   <li>at or above {@code minTokens}: any pending buffer is flushed first (never extended with
 *       this paragraph), then the paragraph is emitted as {@link ChunkType#PARAGRAPH} when it fits
 *       {@code maxTokens}, or split into sentence windows ({@link ChunkType#SPLIT}) when it does not
 * </ul>
 *
 * <p>A merged chunk therefore never exceeds {@code maxTokens}. A split window grows until it
 * reaches {@code targetTokens} and never breaks a sentence, so a window of very long sentences can
 * exceed {@code maxTokens}.
 *
 * <p>Instances hold no per-call state and can be shared across threads when the tokenizer can.
 */
public class SectionChunker {

  static final String PARAGRAPH_SEPARATOR = "\n\n";
  static final String SENTENCE_SEPARATOR = " ";

  private final Tokenizer tokenizer;
  private final ChunkingPolicy policy;
  private final SentenceSegmenter segmenter;

  public SectionChunker(Tokenizer tokenizer, ChunkingPolicy policy) {
    this(tokenizer, policy, new SentenceSegmenter());
  }

  public SectionChunker(Tokenizer tokenizer, ChunkingPolicy policy, SentenceSegmenter segmenter) {
    this.tokenizer = tokenizer;
    this.policy = policy;
    this.segmenter = segmenter;
  }

  /**
   * Chunks the direct paragraphs of {@code section}; subsections are not visited.
   *
   * @param documentId source document identifier
   * @param section section whose {@link Section#content()} is chunked
   * @return chunks in paragraph order, empty when the section has no paragraphs
   */
  public List<Chunk> chunkSection(String documentId, Section section) {
    List<Chunk> chunks = new ArrayList<>();
    List<String> paragraphs = section.content();
    MergeBuffer buffer = null;

    for (int i = 0; i < paragraphs.size(); i++) {
      String paragraph = paragraphs.get(i);
      int tokens = tokenizer.countTokens(paragraph);

      if (tokens < policy.minTokens()) {
        if (buffer == null) {
          buffer = new MergeBuffer(paragraph, i);
          continue;
        }
        String candidate = buffer.text() + PARAGRAPH_SEPARATOR + paragraph;
        if (tokenizer.countTokens(candidate) <= policy.maxTokens()) {
          buffer = new MergeBuffer(candidate, buffer.firstIndex());
        } else {
          chunks.add(flush(documentId, section, buffer));
          buffer = new MergeBuffer(paragraph, i);
        }
        continue;
      }

      if (buffer != null) {
        chunks.add(flush(documentId, section, buffer));
        buffer = null;
      }
      if (tokens <= policy.maxTokens()) {
        chunks.add(
            newChunk(documentId, section, paragraph, tokens, ChunkType.PARAGRAPH, i, null));
      } else {
        chunks.addAll(splitParagraph(documentId, section, paragraph, i));
      }
    }

    if (buffer != null) {
      chunks.add(flush(documentId, section, buffer));
    }
    return chunks;
  }

  /**
   * Splits an oversized paragraph into overlapping sentence windows.
   *
   * <p>Each window accumulates whole sentences until their summed token count reaches {@code
   * targetTokens} or the sentences run out. When sentences remain, the next window restarts {@code
   * min(sentenceOverlap, windowSize - 1)} sentences before the end of the previous one, so every
   * window advances by at least one sentence.
   *
   * @param documentId source document identifier
   * @param section owning section
   * @param text paragraph text
   * @param paragraphIndex index of the paragraph in the section
   * @return split chunks with consecutive sub-chunk indices from 0; empty when {@code text} has no
   *     sentences
   */
  public List<Chunk> splitParagraph(
      String documentId, Section section, String text, int paragraphIndex) {
    List<String> sentences = segmenter.segment(text);
    List<Chunk> windows = new ArrayList<>();

    int cursor = 0;
    int subchunkIndex = 0;
    while (cursor < sentences.size()) {
      int start = cursor;
      int tokenSum = 0;
      while (cursor < sentences.size()) {
        tokenSum += tokenizer.countTokens(sentences.get(cursor));
        cursor++;
        if (tokenSum >= policy.targetTokens()) {
          break;
        }
      }

      String windowText = String.join(SENTENCE_SEPARATOR, sentences.subList(start, cursor));
      windows.add(
          newChunk(
              documentId,
              section,
              windowText,
              tokenSum,
              ChunkType.SPLIT,
              paragraphIndex,
              subchunkIndex));
      subchunkIndex++;

      if (cursor < sentences.size()) {
        int windowSize = cursor - start;
        cursor -= Math.max(0, Math.min(policy.sentenceOverlap(), windowSize - 1));
      }
    }
    return windows;
  }

  private Chunk flush(String documentId, Section section, MergeBuffer buffer) {
    return newChunk(
        documentId,
        section,
        buffer.text(),
        tokenizer.countTokens(buffer.text()),
        ChunkType.MERGED,
        buffer.firstIndex(),
        null);
  }

  private Chunk newChunk(
      String documentId,
      Section section,
      String text,
      int tokenCount,
      ChunkType type,
      int paragraphIndex,
      Integer subchunkIndex) {
    String chunkId =
        ChunkIdentity.deriveId(documentId, section.path(), paragraphIndex, subchunkIndex);
    return new Chunk(
        chunkId,
        documentId,
        text,
        tokenCount,
        type,
        section.path(),
        paragraphIndex,
        subchunkIndex);
  }

  /** Pending undersized paragraphs and the index of the first one. */
  private record MergeBuffer(String text, int firstIndex) {}
}
