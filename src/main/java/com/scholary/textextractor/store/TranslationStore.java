package com.scholary.textextractor.store;

import com.scholary.textextractor.extract.TextChunk;
import com.scholary.textextractor.logging.StructuredLogger;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Persists extracted texts as translator worksheets and reads finished worksheets back.
 *
 * <p>Persist writes one {@code <basename>_extracted.txt} report per distinct {@link
 * TextChunk#filePath()} and a single {@value WorksheetFormat#MASTER_FILE_NAME} listing every chunk.
 * Reapply reads the master worksheet and returns original-to-translation pairs. It never touches
 * the source files.
 */
@Component
public class TranslationStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranslationStore.class);

  private final ExtractedTextWriter writer;
  private final WorksheetParser parser;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public TranslationStore(ExtractedTextWriter writer, WorksheetParser parser) {
    this.writer = writer;
    this.parser = parser;
  }

  /**
   * Write the per-file reports and the master worksheet.
   *
   * <p>Groups whose paths share a file name, such as the same name in different directories, are
   * written to {@code <basename>_<k>_extracted.txt} from the second one on.
   *
   * @param chunks chunks in aggregate order
   * @param outputDir directory to write into, created if missing
   * @return the files written, master worksheet last
   * @throws PersistException if the directory or a file cannot be written
   */
  public List<Path> persist(List<TextChunk> chunks, Path outputDir) {
    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new PersistException("Failed to create output directory: " + outputDir, e);
    }

    Map<String, List<TextChunk>> groups = new LinkedHashMap<>();
    for (TextChunk chunk : chunks) {
      groups.computeIfAbsent(chunk.filePath(), k -> new ArrayList<>()).add(chunk);
    }

    List<Path> written = new ArrayList<>();
    Map<String, Integer> baseNameUses = new HashMap<>();

    for (Map.Entry<String, List<TextChunk>> group : groups.entrySet()) {
      String baseName = baseName(group.getKey());
      int use = baseNameUses.merge(baseName, 1, Integer::sum);
      String fileName =
          (use == 1 ? baseName : baseName + "_" + use) + WorksheetFormat.EXTRACTED_FILE_SUFFIX;

      Path target = outputDir.resolve(fileName);
      write(target, writer.writeExtractedTexts(group.getKey(), group.getValue()));
      structuredLogger.logOutputWritten(
          target.toString(), group.getKey(), group.getValue().size());
      written.add(target);
    }

    Path master = outputDir.resolve(WorksheetFormat.MASTER_FILE_NAME);
    write(master, writer.writeMasterWorksheet(chunks));
    structuredLogger.logOutputWritten(master.toString(), "*", chunks.size());
    written.add(master);

    LOGGER.info(
        "Saved extracted texts: outputDir={}, groups={}, chunks={}",
        outputDir,
        groups.size(),
        chunks.size());
    return written;
  }

  /**
   * Read a worksheet and return its translations.
   *
   * @param worksheet the master worksheet, usually filled in by a translator
   * @return original text to translation, in worksheet order
   * @throws IOException if the worksheet cannot be read
   */
  public Map<String, String> reapply(Path worksheet) throws IOException {
    Map<String, String> translations = parseWorksheet(worksheet).translations();
    LOGGER.info("Loaded {} translations from {}", translations.size(), worksheet);
    return translations;
  }

  /**
   * Parse a worksheet into records, keeping track of rejected ones.
   *
   * @throws IOException if the worksheet cannot be read
   */
  public WorksheetParseResult parseWorksheet(Path worksheet) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(worksheet, StandardCharsets.UTF_8)) {
      return parser.parse(reader);
    }
  }

  private void write(Path target, byte[] content) {
    try {
      AtomicFileWriter.write(target, content);
    } catch (IOException e) {
      throw new PersistException("Failed to write " + target, e);
    }
  }

  private static String baseName(String filePath) {
    String normalized = filePath.replace('\\', '/');
    int slash = normalized.lastIndexOf('/');
    return slash < 0 ? normalized : normalized.substring(slash + 1);
  }
}
