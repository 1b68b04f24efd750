package com.scholary.textextractor.extract;

import com.scholary.textextractor.logging.StructuredLogger;
import com.scholary.textextractor.pattern.ExtractionRule;
import com.scholary.textextractor.pattern.PatternRegistry;
import com.scholary.textextractor.text.TextCleaner;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies the pattern registry to files, line by line.
 *
 * <p>Every rule runs over every raw line. Each capture is cleaned with {@link TextCleaner} and
 * kept if the cleaned text is at least {@code minTextLength} chars long. A line may therefore
 * produce the same text several times, once per rule that matched it.
 *
 * <p>Files are decoded as UTF-8 with malformed input replaced, so binary-ish assets do not abort
 * the read.
 */
@Component
public class ExtractionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionEngine.class);

  private final PatternRegistry patternRegistry;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public ExtractionEngine(PatternRegistry patternRegistry) {
    this.patternRegistry = patternRegistry;
  }

  /**
   * Extract chunks from one file.
   *
   * <p>An unreadable file is reported in the returned outcome and contributes no chunks; it never
   * throws.
   *
   * @param file the file to read
   * @param minTextLength shortest cleaned text to keep
   * @return the chunks found, or a failed outcome
   */
  public FileExtraction extractFromFile(Path file, int minTextLength) {
    String filePath = file.toString();
    List<TextChunk> chunks = new ArrayList<>();
    int lineNumber = 0;

    try (BufferedReader reader = openLenient(file)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        chunks.addAll(extractFromLine(filePath, lineNumber, line, minTextLength));
      }
    } catch (IOException e) {
      structuredLogger.logFileFailed(filePath, e.getClass().getSimpleName(), e.getMessage());
      return FileExtraction.failed(file, e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    structuredLogger.logFileExtracted(filePath, lineNumber, chunks.size());
    return FileExtraction.succeeded(file, chunks);
  }

  /**
   * Extract chunks from a single raw line.
   *
   * @param filePath path recorded on each chunk
   * @param lineNumber 1-based line number
   * @param line the raw line without its terminator
   * @param minTextLength shortest cleaned text to keep
   * @return chunks in rule order, then match order
   */
  public List<TextChunk> extractFromLine(
      String filePath, int lineNumber, String line, int minTextLength) {
    List<TextChunk> chunks = new ArrayList<>();

    for (ExtractionRule rule : patternRegistry.rules()) {
      Matcher matcher = rule.pattern().matcher(line);
      while (matcher.find()) {
        String text = TextCleaner.clean(matcher.group(1));
        if (text.length() < minTextLength) {
          continue;
        }
        chunks.add(
            TextChunk.of(
                text,
                filePath,
                lineNumber,
                matcher.start(1),
                matcher.end(1),
                line,
                matcher.group()));
      }
    }

    return chunks;
  }

  private BufferedReader openLenient(Path file) throws IOException {
    return new BufferedReader(
        new InputStreamReader(
            Files.newInputStream(file),
            StandardCharsets.UTF_8
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)));
  }
}
