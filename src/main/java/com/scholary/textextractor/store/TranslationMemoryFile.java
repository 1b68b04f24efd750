package com.scholary.textextractor.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stores a translation mapping as a JSON object.
 *
 * <p>Format:
 *
 * <pre>
 * {
 *   "Hello there" : "Bonjour",
 *   "New game" : "Nouvelle partie"
 * }
 * </pre>
 */
@Component
public class TranslationMemoryFile {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranslationMemoryFile.class);

  private static final TypeReference<LinkedHashMap<String, String>> MAPPING_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public TranslationMemoryFile(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public void save(Map<String, String> translations, Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(translations);
    AtomicFileWriter.write(file, json);
    LOGGER.info("Saved {} translations to {}", translations.size(), file);
  }

  public Map<String, String> load(Path file) throws IOException {
    Map<String, String> translations = objectMapper.readValue(file.toFile(), MAPPING_TYPE);
    LOGGER.info("Loaded {} translations from {}", translations.size(), file);
    return translations;
  }

  /**
   * Add translations to the memory file, creating it if missing.
   *
   * <p>Entries already in the file are kept unless {@code translations} has the same original, in
   * which case the new translation wins.
   *
   * @return the full mapping now stored in {@code file}
   */
  public Map<String, String> merge(Map<String, String> translations, Path file)
      throws IOException {
    Map<String, String> merged =
        Files.exists(file) ? new LinkedHashMap<>(load(file)) : new LinkedHashMap<>();
    merged.putAll(translations);
    save(merged, file);
    return merged;
  }
}
