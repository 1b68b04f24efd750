package com.scholary.textextractor.config;

import com.scholary.textextractor.extract.ExtractorSettings;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.LinkedHashSet;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for text extraction.
 *
 * <p>These are the defaults of every run; a request may override the extension list and the
 * thresholds for its own run.
 */
@ConfigurationProperties(prefix = "extractor")
@Validated
public record ExtractorProperties(
    @NotEmpty List<String> supportedExtensions,
    @PositiveOrZero int minTextLength,
    @Positive int maxChunkSize,
    boolean deduplicate,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  public ExtractorSettings toSettings() {
    return new ExtractorSettings(
        new LinkedHashSet<>(supportedExtensions), minTextLength, maxChunkSize, deduplicate);
  }
}
