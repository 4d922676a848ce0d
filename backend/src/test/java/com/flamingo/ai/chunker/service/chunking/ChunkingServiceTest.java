package com.flamingo.ai.chunker.service.chunking;

import static com.flamingo.ai.chunker.service.chunking.TestTexts.words;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chunker.exception.InvalidDocumentIdException;
import com.flamingo.ai.chunker.service.chunking.model.ChunkType;
import com.flamingo.ai.chunker.service.parsing.DocumentMetadataExtractor;
import com.flamingo.ai.chunker.service.parsing.MarkdownStructureParser;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChunkingService Tests")
class ChunkingServiceTest {

  @Mock private DocumentChunker failingChunker;

  private MeterRegistry meterRegistry;
  private ChunkingService chunkingService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    DocumentChunker chunker =
        new SectionAwareChunker(
            new SectionChunker(new WhitespaceTokenizer(), ChunkingPolicy.defaults()));
    chunkingService =
        new ChunkingService(
            new MarkdownStructureParser(),
            chunker,
            new DocumentMetadataExtractor(),
            meterRegistry);
  }

  @Test
  @DisplayName("should chunk a document and attach its metadata")
  void shouldChunkDocumentWithMetadata() {
    String content =
        "Lead text.\n\n# Turing\n\n" + words("t", 100) + "\n\n## Work\n\nsmall\n\nsmaller";

    ChunkingResult result = chunkingService.chunkDocument("wiki/Turing", content);

    assertThat(result.documentId()).isEqualTo("wiki/Turing");
    assertThat(result.title()).isEqualTo("Turing");
    assertThat(result.abstractText()).isEqualTo("Lead text.");
    assertThat(result.outline()).hasSize(2);
    assertThat(result.chunks()).hasSize(3);
    assertThat(result.chunks().get(2).text()).isEqualTo("small\n\nsmaller");
  }

  @Test
  @DisplayName("should record emitted chunks per type")
  void shouldRecordMetrics() {
    chunkingService.chunkDocument("doc-1", "# A\n\n" + words("a", 100) + "\n\nshort");

    assertThat(
            meterRegistry.counter("chunks_emitted_total", "chunk_type", "paragraph").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("chunks_emitted_total", "chunk_type", "merged").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.summary("chunk_tokens").count()).isEqualTo(2);
    assertThat(meterRegistry.summary("chunk_tokens").totalAmount()).isEqualTo(101.0);
  }

  @Test
  @DisplayName("should return no chunks for an empty document")
  void shouldReturnNoChunks_forEmptyDocument() {
    ChunkingResult result = chunkingService.chunkDocument("empty", "");

    assertThat(result.chunks()).isEmpty();
    assertThat(result.title()).isEqualTo("empty");
  }

  @Test
  @DisplayName("should reject a blank document id")
  void shouldRejectBlankDocumentId() {
    assertThatThrownBy(() -> chunkingService.chunkDocument("  ", "text"))
        .isInstanceOf(InvalidDocumentIdException.class);
  }

  @Test
  @DisplayName("should rethrow chunker failures unchanged and count them")
  void shouldRethrowChunkerFailures() {
    IllegalStateException failure = new IllegalStateException("tokenizer down");
    when(failingChunker.chunk(anyString(), any())).thenThrow(failure);
    ChunkingService service =
        new ChunkingService(
            new MarkdownStructureParser(),
            failingChunker,
            new DocumentMetadataExtractor(),
            meterRegistry);

    assertThatThrownBy(() -> service.chunkDocument("doc-1", "# A\n\ntext")).isSameAs(failure);
    assertThat(meterRegistry.counter("chunking_failures_total").count()).isEqualTo(1.0);
    assertThat(
            meterRegistry.find("chunks_emitted_total").tag("chunk_type", ChunkType.MERGED.value())
                .counter())
        .isNull();
  }

  @Test
  @DisplayName("should not touch the chunker when the document id is invalid")
  void shouldNotTouchChunker_whenDocumentIdInvalid() {
    ChunkingService service =
        new ChunkingService(
            new MarkdownStructureParser(),
            failingChunker,
            new DocumentMetadataExtractor(),
            meterRegistry);

    assertThatThrownBy(() -> service.chunkDocument(null, "text"))
        .isInstanceOf(InvalidDocumentIdException.class);
    verifyNoInteractions(failingChunker);
  }
}
