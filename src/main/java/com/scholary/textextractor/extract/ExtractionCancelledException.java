package com.scholary.textextractor.extract;

/**
 * Thrown when a run is cancelled between files.
 *
 * <p>Nothing has been persisted at that point; the partial chunk list is discarded.
 */
public class ExtractionCancelledException extends RuntimeException {

  private final int filesProcessed;
  private final int totalFiles;

  public ExtractionCancelledException(int filesProcessed, int totalFiles) {
    super(String.format("Extraction cancelled after %d of %d files", filesProcessed, totalFiles));
    this.filesProcessed = filesProcessed;
    this.totalFiles = totalFiles;
  }

  public int getFilesProcessed() {
    return filesProcessed;
  }

  public int getTotalFiles() {
    return totalFiles;
  }
}
