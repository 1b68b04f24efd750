package com.scholary.textextractor.config;

import com.scholary.textextractor.extract.ExtractorSettings;
import com.scholary.textextractor.pattern.PatternRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for extraction beans.
 *
 * <p>Loads {@link ExtractorProperties} from application.yml and turns them into the immutable
 * default settings shared by all runs.
 */
@Configuration
@EnableConfigurationProperties(ExtractorProperties.class)
public class ExtractorConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractorConfig.class);

  @Bean
  public PatternRegistry patternRegistry() {
    PatternRegistry registry = PatternRegistry.defaults();
    LOGGER.info("Loaded {} extraction rules", registry.size());
    return registry;
  }

  @Bean
  public ExtractorSettings defaultExtractorSettings(ExtractorProperties properties) {
    ExtractorSettings settings = properties.toSettings();
    LOGGER.info(
        "Default extractor settings: extensions={}, minTextLength={}, maxChunkSize={}, dedup={}",
        settings.supportedExtensions(),
        settings.minTextLength(),
        settings.maxChunkSize(),
        settings.deduplicate());
    return settings;
  }
}
