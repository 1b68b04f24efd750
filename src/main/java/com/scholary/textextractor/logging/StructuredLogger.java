package com.scholary.textextractor.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of a single log call, so a JSON or
 * pattern layout can index them.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a file that produced chunks (or none). */
  public void logFileExtracted(String file, int linesRead, int chunksFound) {
    try {
      MDC.put("event_type", "file_extracted");
      MDC.put("file", file);
      MDC.put("linesRead", String.valueOf(linesRead));
      MDC.put("chunksFound", String.valueOf(chunksFound));

      logger.debug("File extracted: file={}, lines={}, chunks={}", file, linesRead, chunksFound);
    } finally {
      clearEventFields();
    }
  }

  /** Log a file that could not be read. The batch continues. */
  public void logFileFailed(String file, String errorType, String message) {
    try {
      MDC.put("event_type", "file_failed");
      MDC.put("file", file);
      MDC.put("errorType", errorType);

      logger.error(
          "Error reading file: file={}, error={}, message={}", file, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log an oversized chunk being split into fragments. */
  public void logChunkSplit(String file, int lineNumber, int textLength, int fragments) {
    try {
      MDC.put("event_type", "chunk_split");
      MDC.put("file", file);
      MDC.put("lineNumber", String.valueOf(lineNumber));
      MDC.put("textLength", String.valueOf(textLength));
      MDC.put("fragments", String.valueOf(fragments));

      logger.debug(
          "Chunk split: file={}, line={}, length={}, fragments={}",
          file,
          lineNumber,
          textLength,
          fragments);
    } finally {
      clearEventFields();
    }
  }

  /** Log one output file written by persist. */
  public void logOutputWritten(String outputFile, String group, int chunks) {
    try {
      MDC.put("event_type", "output_written");
      MDC.put("outputFile", outputFile);
      MDC.put("group", group);
      MDC.put("chunks", String.valueOf(chunks));

      logger.debug("Output written: file={}, group={}, chunks={}", outputFile, group, chunks);
    } finally {
      clearEventFields();
    }
  }

  /** Log a worksheet record that was rejected instead of guessed. */
  public void logRecordRejected(String recordId, int lineNumber, String message) {
    try {
      MDC.put("event_type", "worksheet_record_rejected");
      MDC.put("recordId", String.valueOf(recordId));
      MDC.put("lineNumber", String.valueOf(lineNumber));

      logger.warn(
          "Worksheet record rejected: id={}, line={}, reason={}", recordId, lineNumber, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String jobId, int filesProcessed, int totalFiles, int percentComplete, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("jobId", jobId);
      MDC.put("filesProcessed", String.valueOf(filesProcessed));
      MDC.put("totalFiles", String.valueOf(totalFiles));
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: jobId={}, phase={}, files={}/{}, progress={}%",
          jobId,
          phase,
          filesProcessed,
          totalFiles,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String sourceDir) {
    MDC.put("jobId", jobId);
    MDC.put("sourceDir", sourceDir);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("sourceDir");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("file");
    MDC.remove("linesRead");
    MDC.remove("chunksFound");
    MDC.remove("errorType");
    MDC.remove("lineNumber");
    MDC.remove("textLength");
    MDC.remove("fragments");
    MDC.remove("outputFile");
    MDC.remove("group");
    MDC.remove("chunks");
    MDC.remove("recordId");
    MDC.remove("filesProcessed");
    MDC.remove("totalFiles");
    MDC.remove("percentComplete");
    MDC.remove("phase");
  }
}
