package com.flamingo.ai.chunker.config;

import com.flamingo.ai.chunker.service.chunking.ChunkingPolicy;
import com.flamingo.ai.chunker.service.chunking.DocumentChunker;
import com.flamingo.ai.chunker.service.chunking.SectionAwareChunker;
import com.flamingo.ai.chunker.service.chunking.SectionChunker;
import com.flamingo.ai.chunker.service.chunking.Tokenizer;
import com.flamingo.ai.chunker.service.parsing.DocumentMetadataExtractor;
import com.flamingo.ai.chunker.service.parsing.MarkdownStructureParser;
import com.flamingo.ai.chunker.service.parsing.StructureParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the chunking core.
 *
 * <p>The core classes carry no Spring annotations; every collaborator is created here. The {@link
 * Tokenizer} comes from {@link TokenizerAutoConfiguration}.
 */
@Configuration
@Slf4j
public class ChunkingEngineConfig {

  @Bean
  public ChunkingPolicy chunkingPolicy(ChunkingConfig config) {
    ChunkingPolicy policy = config.toPolicy();
    log.info(
        "Chunking policy: min={}, target={}, max={}, overlap={}, tokenizer={}",
        policy.minTokens(),
        policy.targetTokens(),
        policy.maxTokens(),
        policy.sentenceOverlap(),
        config.getTokenizer());
    return policy;
  }

  @Bean
  public StructureParser structureParser() {
    return new MarkdownStructureParser();
  }

  @Bean
  public SectionChunker sectionChunker(Tokenizer tokenizer, ChunkingPolicy chunkingPolicy) {
    return new SectionChunker(tokenizer, chunkingPolicy);
  }

  @Bean
  public DocumentChunker documentChunker(SectionChunker sectionChunker) {
    return new SectionAwareChunker(sectionChunker);
  }

  @Bean
  public DocumentMetadataExtractor documentMetadataExtractor() {
    return new DocumentMetadataExtractor();
  }
}
