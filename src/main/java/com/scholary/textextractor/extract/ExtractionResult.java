package com.scholary.textextractor.extract;

import java.util.List;

/**
 * Output of one extraction run.
 *
 * <p>{@code totalFilesProcessed} counts the scanned files, including those that failed to open.
 * {@code totalTextsFound} counts chunks after splitting. {@code processingTime} is wall-clock
 * seconds.
 */
public record ExtractionResult(
    List<TextChunk> chunks,
    int totalFilesProcessed,
    int totalTextsFound,
    double processingTime,
    List<String> failedFiles) {

  public ExtractionResult {
    chunks = List.copyOf(chunks);
    failedFiles = List.copyOf(failedFiles);
  }
}
