package com.scholary.textextractor.service;

import com.scholary.textextractor.extract.ChunkDeduplicator;
import com.scholary.textextractor.extract.ChunkSplitter;
import com.scholary.textextractor.extract.ExtractionCancelledException;
import com.scholary.textextractor.extract.ExtractionEngine;
import com.scholary.textextractor.extract.ExtractionMonitor;
import com.scholary.textextractor.extract.ExtractionResult;
import com.scholary.textextractor.extract.ExtractorSettings;
import com.scholary.textextractor.extract.FileExtraction;
import com.scholary.textextractor.extract.TextChunk;
import com.scholary.textextractor.scan.FileScanner;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs the extraction pipeline over a directory.
 *
 * <p>Scan, extract each file, optionally drop duplicate captures, split oversized chunks, then
 * package the chunks with run statistics. A file that cannot be read is counted and listed as
 * failed but does not stop the run.
 */
@Service
public class TextExtractionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TextExtractionService.class);

  private final FileScanner fileScanner;
  private final ExtractionEngine extractionEngine;
  private final ChunkSplitter chunkSplitter;

  public TextExtractionService(
      FileScanner fileScanner, ExtractionEngine extractionEngine, ChunkSplitter chunkSplitter) {
    this.fileScanner = fileScanner;
    this.extractionEngine = extractionEngine;
    this.chunkSplitter = chunkSplitter;
  }

  public ExtractionResult extractTexts(Path root, ExtractorSettings settings) {
    return extractTexts(root, settings, ExtractionMonitor.NONE);
  }

  /**
   * Extract all texts under {@code root}.
   *
   * @param root directory to scan
   * @param settings run settings, read-only for the whole run
   * @param monitor progress callback and cancellation check
   * @return chunks and statistics
   * @throws ExtractionCancelledException if the monitor cancels the run
   */
  public ExtractionResult extractTexts(
      Path root, ExtractorSettings settings, ExtractionMonitor monitor) {
    long startNanos = System.nanoTime();
    boolean ownsCorrelationId = MDC.get("correlationId") == null;
    if (ownsCorrelationId) {
      MDC.put("correlationId", UUID.randomUUID().toString());
    }

    try {
      LOGGER.info(
          "Starting extraction: root={}, extensions={}, minTextLength={}, maxChunkSize={}",
          root,
          settings.supportedExtensions().size(),
          settings.minTextLength(),
          settings.maxChunkSize());

      List<Path> files = fileScanner.scan(root, settings.supportedExtensions());
      LOGGER.info("Found {} files to process", files.size());

      List<TextChunk> chunks = new ArrayList<>();
      List<String> failedFiles = new ArrayList<>();

      for (int i = 0; i < files.size(); i++) {
        if (monitor.isCancelled()) {
          LOGGER.info("Extraction cancelled after {} of {} files", i, files.size());
          throw new ExtractionCancelledException(i, files.size());
        }

        FileExtraction extraction =
            extractionEngine.extractFromFile(files.get(i), settings.minTextLength());
        if (extraction.failed()) {
          failedFiles.add(extraction.file().toString());
        } else {
          chunks.addAll(extraction.chunks());
        }

        monitor.onFileProcessed(i + 1, files.size());
      }

      // A cancel during the last file, or on an empty scan, must still stop the run.
      if (monitor.isCancelled()) {
        LOGGER.info("Extraction cancelled after all {} files", files.size());
        throw new ExtractionCancelledException(files.size(), files.size());
      }

      if (settings.deduplicate()) {
        int before = chunks.size();
        chunks = ChunkDeduplicator.deduplicate(chunks);
        LOGGER.info("Removed {} duplicate captures", before - chunks.size());
      }

      List<TextChunk> bounded = chunkSplitter.split(chunks, settings.maxChunkSize());

      double processingTime = (System.nanoTime() - startNanos) / 1_000_000 / 1000.0;

      LOGGER.info(
          "Extraction complete: files={}, failed={}, texts={}, time={}s",
          files.size(),
          failedFiles.size(),
          bounded.size(),
          processingTime);

      return new ExtractionResult(
          bounded, files.size(), bounded.size(), processingTime, failedFiles);

    } finally {
      if (ownsCorrelationId) {
        MDC.remove("correlationId");
      }
    }
  }
}
