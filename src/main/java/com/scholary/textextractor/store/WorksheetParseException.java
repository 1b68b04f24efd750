package com.scholary.textextractor.store;

/**
 * A malformed worksheet record.
 *
 * <p>The offending record is rejected as a whole. Parsing resumes at the next record.
 */
public class WorksheetParseException extends RuntimeException {

  private final String recordId;
  private final int lineNumber;

  public WorksheetParseException(String recordId, int lineNumber, String message) {
    super(String.format("Record %s (line %d): %s", recordId, lineNumber, message));
    this.recordId = recordId;
    this.lineNumber = lineNumber;
  }

  /** The raw {@code ID:} value, or null if the record had none. */
  public String getRecordId() {
    return recordId;
  }

  public int getLineNumber() {
    return lineNumber;
  }
}
