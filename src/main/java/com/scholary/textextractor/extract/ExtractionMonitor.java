package com.scholary.textextractor.extract;

/**
 * Observes a running extraction and can ask it to stop.
 *
 * <p>Both methods are called between files, never while a file is being read. The cancel check
 * runs before each file and once more after the last one, so a run is never reported complete
 * after a cancel request.
 */
public interface ExtractionMonitor {

  /** Monitor that ignores progress and never cancels. */
  ExtractionMonitor NONE = new ExtractionMonitor() {};

  /**
   * Called after each file.
   *
   * @param filesProcessed files finished so far
   * @param totalFiles files found by the scan
   */
  default void onFileProcessed(int filesProcessed, int totalFiles) {}

  /** Return true to stop the run before the next file, or before it is packaged. */
  default boolean isCancelled() {
    return false;
  }
}
