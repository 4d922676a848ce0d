package com.flamingo.ai.chunker.config;

import com.flamingo.ai.chunker.exception.ChunkingConfigurationException;
import com.flamingo.ai.chunker.service.chunking.CharacterEstimateTokenizer;
import com.flamingo.ai.chunker.service.chunking.Tokenizer;
import com.flamingo.ai.chunker.service.chunking.WhitespaceTokenizer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Default {@link Tokenizer}, selected by {@code chunking.tokenizer}.
 *
 * <p>Registered as an auto-configuration so it is evaluated after the application's own beans; a
 * host that declares a {@link Tokenizer} bean replaces this one.
 */
@AutoConfiguration
public class TokenizerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Tokenizer tokenizer(ChunkingConfig config) {
    String name = config.getTokenizer() == null ? "" : config.getTokenizer().trim().toLowerCase();
    return switch (name) {
      case WhitespaceTokenizer.NAME -> new WhitespaceTokenizer();
      case CharacterEstimateTokenizer.NAME ->
          new CharacterEstimateTokenizer(config.getCharsPerToken());
      default ->
          throw new ChunkingConfigurationException(
              "Unknown chunking.tokenizer '"
                  + config.getTokenizer()
                  + "', expected 'whitespace' or 'char-estimate'");
    };
  }
}
