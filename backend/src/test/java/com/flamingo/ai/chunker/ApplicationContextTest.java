package com.flamingo.ai.chunker;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chunker.service.chunking.ChunkingPolicy;
import com.flamingo.ai.chunker.service.chunking.ChunkingService;
import com.flamingo.ai.chunker.service.chunking.DocumentChunker;
import com.flamingo.ai.chunker.service.chunking.Tokenizer;
import com.flamingo.ai.chunker.service.chunking.WhitespaceTokenizer;
import com.flamingo.ai.chunker.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.chunker.service.ingestion.IngestionResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies the Spring application context loads with the default chunking configuration. */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;
  @Autowired private DocumentIngestionService ingestionService;
  @Autowired private MeterRegistry meterRegistry;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core beans should be available with default settings")
  void coreBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ChunkingService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentChunker.class)).isNotNull();
    assertThat(applicationContext.getBean(Tokenizer.class)).isInstanceOf(WhitespaceTokenizer.class);
    assertThat(applicationContext.getBean(ChunkingPolicy.class))
        .isEqualTo(ChunkingPolicy.defaults());
  }

  @Test
  @DisplayName("Ingestion should run end to end and be timed")
  void ingestionShouldRunEndToEnd() {
    IngestionResult result =
        ingestionService.ingest("context-test", "# Title\n\nA short paragraph.");

    assertThat(result.insertedChunks()).isEqualTo(1);
    assertThat(meterRegistry.find("document.ingest").timer()).isNotNull();
    assertThat(meterRegistry.find("chunk_store_size").gauge()).isNotNull();
  }
}
