package com.scholary.textextractor.store;

import com.scholary.textextractor.logging.StructuredLogger;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads a master worksheet back into records.
 *
 * <p>A record starts at an {@code ID:} line and ends at {@code ---} or at the next {@code ID:}.
 * Lines that carry none of the known labels (the header, blank lines) are ignored.
 *
 * <p>A record is rejected, never repaired, when it has a {@code Translation:} line before any
 * {@code Original:} line, or a non-numeric {@code ID:} or {@code Line:} value. Rejection only
 * affects that record.
 */
@Component
public class WorksheetParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorksheetParser.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public WorksheetParseResult parse(BufferedReader reader) throws IOException {
    List<TranslationRecord> records = new ArrayList<>();
    List<WorksheetParseException> rejected = new ArrayList<>();
    RecordBuilder current = null;

    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;

      if (line.startsWith(WorksheetFormat.ID)) {
        finish(current, records, rejected);
        current = new RecordBuilder(lineNumber);
        current.id = line.substring(WorksheetFormat.ID.length());
        continue;
      }
      if (line.trim().equals(WorksheetFormat.RECORD_END)) {
        finish(current, records, rejected);
        current = null;
        continue;
      }

      String translation = translationValue(line);
      if (translation == null
          && !line.startsWith(WorksheetFormat.FILE)
          && !line.startsWith(WorksheetFormat.LINE)
          && !line.startsWith(WorksheetFormat.ORIGINAL)) {
        continue;
      }
      if (current == null) {
        current = new RecordBuilder(lineNumber);
      }
      if (current.error != null) {
        continue;
      }

      if (translation != null) {
        if (current.original == null) {
          current.error =
              new WorksheetParseException(
                  current.id, lineNumber, "Translation without a preceding Original");
        } else {
          current.translation = WorksheetFormat.unescape(translation);
        }
      } else if (line.startsWith(WorksheetFormat.FILE)) {
        current.file = line.substring(WorksheetFormat.FILE.length());
      } else if (line.startsWith(WorksheetFormat.LINE)) {
        current.line = line.substring(WorksheetFormat.LINE.length());
        current.lineFieldAt = lineNumber;
      } else {
        current.original =
            WorksheetFormat.unescape(line.substring(WorksheetFormat.ORIGINAL.length()));
      }
    }
    finish(current, records, rejected);

    LOGGER.info("Parsed worksheet: records={}, rejected={}", records.size(), rejected.size());
    return new WorksheetParseResult(records, rejected);
  }

  /** Value of a translation line, or null if the line is not one. */
  private static String translationValue(String line) {
    if (line.startsWith(WorksheetFormat.TRANSLATION)) {
      return line.substring(WorksheetFormat.TRANSLATION.length());
    }
    // Editors often strip the trailing space of an empty field.
    if (line.equals(WorksheetFormat.TRANSLATION.trim())) {
      return "";
    }
    return null;
  }

  private void finish(
      RecordBuilder builder,
      List<TranslationRecord> records,
      List<WorksheetParseException> rejected) {
    if (builder == null) {
      return;
    }
    try {
      builder.build().ifPresent(records::add);
    } catch (WorksheetParseException e) {
      structuredLogger.logRecordRejected(e.getRecordId(), e.getLineNumber(), e.getMessage());
      rejected.add(e);
    }
  }

  private static final class RecordBuilder {
    private final int startLine;
    private String id;
    private String file;
    private String line;
    private int lineFieldAt;
    private String original;
    private String translation;
    private WorksheetParseException error;

    RecordBuilder(int startLine) {
      this.startLine = startLine;
    }

    Optional<TranslationRecord> build() {
      if (error != null) {
        throw error;
      }
      if (original == null) {
        return Optional.empty();
      }
      int parsedId = parseNumber(id, startLine, "ID");
      int parsedLine = parseNumber(line, lineFieldAt, "Line");
      return Optional.of(
          new TranslationRecord(
              parsedId, file, parsedLine, original, translation == null ? "" : translation));
    }

    private int parseNumber(String value, int lineNumber, String label) {
      if (value == null) {
        return 0;
      }
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        throw new WorksheetParseException(
            id, lineNumber, label + " is not a number: '" + value + "'");
      }
    }
  }
}
