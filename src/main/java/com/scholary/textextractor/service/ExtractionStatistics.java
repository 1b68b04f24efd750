package com.scholary.textextractor.service;

import com.scholary.textextractor.extract.ExtractionResult;
import com.scholary.textextractor.extract.TextChunk;

/**
 * Summary figures for one extraction run.
 *
 * <p>Large and very large texts are those longer than {@value #LARGE_TEXT_CHARS} and {@value
 * #VERY_LARGE_TEXT_CHARS} chars.
 */
public record ExtractionStatistics(
    int filesProcessed,
    int failedFiles,
    int textsFound,
    double processingTime,
    double averageTextsPerFile,
    int largeTexts,
    int veryLargeTexts,
    int maxTextLength,
    double averageTextLength) {

  public static final int LARGE_TEXT_CHARS = 1000;
  public static final int VERY_LARGE_TEXT_CHARS = 10_000;

  public static ExtractionStatistics from(ExtractionResult result) {
    int large = 0;
    int veryLarge = 0;
    int max = 0;
    long totalLength = 0;

    for (TextChunk chunk : result.chunks()) {
      int length = chunk.text().length();
      if (length > LARGE_TEXT_CHARS) {
        large++;
      }
      if (length > VERY_LARGE_TEXT_CHARS) {
        veryLarge++;
      }
      max = Math.max(max, length);
      totalLength += length;
    }

    int texts = result.totalTextsFound();
    int files = result.totalFilesProcessed();

    return new ExtractionStatistics(
        files,
        result.failedFiles().size(),
        texts,
        result.processingTime(),
        files > 0 ? (double) texts / files : 0.0,
        large,
        veryLarge,
        max,
        result.chunks().isEmpty() ? 0.0 : (double) totalLength / result.chunks().size());
  }
}
