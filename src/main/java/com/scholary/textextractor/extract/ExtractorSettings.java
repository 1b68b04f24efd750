package com.scholary.textextractor.extract;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Settings for one extraction run.
 *
 * <p>Built once by the owner of the run and never changed while it executes. Use the {@code with*}
 * methods to derive a modified copy.
 */
public record ExtractorSettings(
    Set<String> supportedExtensions, int minTextLength, int maxChunkSize, boolean deduplicate) {

  public static final int DEFAULT_MIN_TEXT_LENGTH = 3;
  public static final int DEFAULT_MAX_CHUNK_SIZE = 50_000;

  /** Extensions scanned when nothing else is configured. */
  public static final List<String> DEFAULT_EXTENSIONS =
      List.of(
          ".csv", ".erb", ".erh", ".py", ".cpp", ".c", ".h", ".hpp", ".cs", ".java", ".js", ".ts",
          ".jsx", ".tsx", ".xml", ".json", ".yaml", ".yml", ".ini", ".cfg", ".txt", ".lua", ".rpy",
          ".unity", ".prefab", ".asset", ".scene", ".csproj", ".sln");

  /** Fallback for an empty comma-separated extension list. */
  public static final List<String> FALLBACK_EXTENSIONS = List.of(".csv", ".erb", ".erh");

  public ExtractorSettings {
    if (supportedExtensions == null || supportedExtensions.isEmpty()) {
      throw new IllegalArgumentException("At least one file extension is required");
    }
    if (minTextLength < 0) {
      throw new IllegalArgumentException("Minimum text length cannot be negative");
    }
    if (maxChunkSize <= 0) {
      throw new IllegalArgumentException("Maximum chunk size must be positive");
    }
    Set<String> normalized = new LinkedHashSet<>();
    for (String extension : supportedExtensions) {
      String ext = normalizeExtension(extension);
      if (!ext.isEmpty()) {
        normalized.add(ext);
      }
    }
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("At least one file extension is required");
    }
    supportedExtensions = Collections.unmodifiableSet(normalized);
  }

  public static ExtractorSettings defaults() {
    return new ExtractorSettings(
        new LinkedHashSet<>(DEFAULT_EXTENSIONS),
        DEFAULT_MIN_TEXT_LENGTH,
        DEFAULT_MAX_CHUNK_SIZE,
        false);
  }

  public ExtractorSettings withSupportedExtensions(Collection<String> extensions) {
    return new ExtractorSettings(
        new LinkedHashSet<>(extensions), minTextLength, maxChunkSize, deduplicate);
  }

  public ExtractorSettings withMinTextLength(int length) {
    return new ExtractorSettings(supportedExtensions, length, maxChunkSize, deduplicate);
  }

  public ExtractorSettings withMaxChunkSize(int size) {
    return new ExtractorSettings(supportedExtensions, minTextLength, size, deduplicate);
  }

  public ExtractorSettings withDeduplicate(boolean enabled) {
    return new ExtractorSettings(supportedExtensions, minTextLength, maxChunkSize, enabled);
  }

  /**
   * Normalize an extension to the allow-list form.
   *
   * <p>{@code " JSON "} and {@code ".json"} both become {@code ".json"}. Blank input gives an empty
   * string.
   */
  public static String normalizeExtension(String extension) {
    if (extension == null) {
      return "";
    }
    String ext = extension.trim().toLowerCase(Locale.ROOT);
    if (ext.isEmpty()) {
      return "";
    }
    return ext.startsWith(".") ? ext : "." + ext;
  }

  /**
   * Parse a comma-separated extension list such as {@code "py, .CPP,js"}.
   *
   * <p>Returns {@link #FALLBACK_EXTENSIONS} when the input holds no usable entry.
   */
  public static List<String> parseExtensionList(String text) {
    if (text == null || text.isBlank()) {
      return FALLBACK_EXTENSIONS;
    }
    Set<String> extensions = new LinkedHashSet<>();
    for (String part : text.split(",")) {
      String ext = normalizeExtension(part);
      if (!ext.isEmpty()) {
        extensions.add(ext);
      }
    }
    return extensions.isEmpty() ? FALLBACK_EXTENSIONS : List.copyOf(extensions);
  }
}
