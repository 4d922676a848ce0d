package com.flamingo.ai.chunker.config;

import com.flamingo.ai.chunker.service.ingestion.ChunkStore;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on the chunking and ingestion services.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Exposes the number of stored chunks as {@code chunk_store_size}. */
  @Bean
  public MeterBinder chunkStoreMetrics(ChunkStore chunkStore) {
    return registry ->
        Gauge.builder("chunk_store_size", chunkStore, ChunkStore::count)
            .description("Chunks currently held by the chunk store")
            .register(registry);
  }
}
