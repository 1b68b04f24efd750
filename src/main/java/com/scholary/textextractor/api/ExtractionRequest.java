package com.scholary.textextractor.api;

import com.scholary.textextractor.extract.ExtractorSettings;
import com.scholary.textextractor.scan.ExtensionPreset;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * Request for extracting texts from a directory.
 *
 * <p>Unset fields fall back to the configured defaults. The allow-list comes from the first of
 * {@code extensions}, {@code extensionList} and {@code preset} that is set. {@code extensionList}
 * is a comma-separated string such as {@code "py, .cpp"}; one without a usable entry selects
 * {@code .csv, .erb, .erh}.
 */
public record ExtractionRequest(
    @NotBlank String sourceDir,
    @NotBlank String outputDir,
    List<String> extensions,
    String extensionList,
    ExtensionPreset preset,
    @Min(0) Integer minTextLength,
    @Positive Integer maxChunkSize,
    Boolean deduplicate) {

  /** Settings for this run, derived from the configured defaults. */
  public ExtractorSettings toSettings(ExtractorSettings defaults) {
    ExtractorSettings settings = defaults;
    if (extensions != null && !extensions.isEmpty()) {
      settings = settings.withSupportedExtensions(extensions);
    } else if (extensionList != null) {
      settings =
          settings.withSupportedExtensions(ExtractorSettings.parseExtensionList(extensionList));
    } else if (preset != null) {
      settings = settings.withSupportedExtensions(preset.extensions());
    }
    if (minTextLength != null) {
      settings = settings.withMinTextLength(minTextLength);
    }
    if (maxChunkSize != null) {
      settings = settings.withMaxChunkSize(maxChunkSize);
    }
    if (deduplicate != null) {
      settings = settings.withDeduplicate(deduplicate);
    }
    return settings;
  }
}
