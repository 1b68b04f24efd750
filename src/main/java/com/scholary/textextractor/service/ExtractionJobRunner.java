package com.scholary.textextractor.service;

import com.scholary.textextractor.api.ExtractionResponse;
import com.scholary.textextractor.api.JobStatusResponse.Status;
import com.scholary.textextractor.extract.ExtractionCancelledException;
import com.scholary.textextractor.extract.ExtractionMonitor;
import com.scholary.textextractor.extract.ExtractionResult;
import com.scholary.textextractor.job.ExtractionJob;
import com.scholary.textextractor.job.JobRepository;
import com.scholary.textextractor.logging.StructuredLogger;
import com.scholary.textextractor.store.TranslationStore;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Executes extraction jobs on the async executor.
 *
 * <p>Progress runs from 0 to 90 while files are extracted and reaches 100 once the worksheets are
 * persisted. A cancel request is honoured between files; nothing is written for a cancelled job.
 */
@Service
public class ExtractionJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionJobRunner.class);
  private static final int EXTRACTION_PROGRESS_SHARE = 90;

  private final TextExtractionService extractionService;
  private final TranslationStore translationStore;
  private final JobRepository jobRepository;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public ExtractionJobRunner(
      TextExtractionService extractionService,
      TranslationStore translationStore,
      JobRepository jobRepository) {
    this.extractionService = extractionService;
    this.translationStore = translationStore;
    this.jobRepository = jobRepository;
  }

  /**
   * Process a job asynchronously.
   *
   * <p>This runs in the pool configured by {@code AsyncConfig}. The job status is updated as
   * processing progresses.
   */
  @Async
  public void runAsync(ExtractionJob job) {
    run(job);
  }

  /** Process a job on the calling thread. */
  public void run(ExtractionJob job) {
    StructuredLogger.setJobContext(job.getJobId(), job.getSourceDir().toString());
    LOGGER.info("Starting processing for job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      ExtractionResult result =
          extractionService.extractTexts(job.getSourceDir(), job.getSettings(), monitorFor(job));

      structuredLogger.logJobProgress(
          job.getJobId(),
          result.totalFilesProcessed(),
          result.totalFilesProcessed(),
          EXTRACTION_PROGRESS_SHARE,
          "persisting");

      List<Path> written = translationStore.persist(result.chunks(), job.getOutputDir());

      job.setResult(result);
      job.setResponse(
          new ExtractionResponse(
              ExtractionStatistics.from(result),
              result.failedFiles(),
              written.stream().map(Path::toString).toList()));
      job.setStatus(Status.COMPLETED);
      job.setProgress(100);
      jobRepository.save(job);

      LOGGER.info("Completed processing for job: {}", job.getJobId());

    } catch (ExtractionCancelledException e) {
      LOGGER.info(
          "Job cancelled: jobId={}, files={}/{}",
          job.getJobId(),
          e.getFilesProcessed(),
          e.getTotalFiles());
      job.setStatus(Status.CANCELLED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } catch (Exception e) {
      LOGGER.error("Processing failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private ExtractionMonitor monitorFor(ExtractionJob job) {
    return new ExtractionMonitor() {
      @Override
      public void onFileProcessed(int filesProcessed, int totalFiles) {
        int percent = filesProcessed * EXTRACTION_PROGRESS_SHARE / totalFiles;
        job.setProgress(percent);
        structuredLogger.logJobProgress(
            job.getJobId(), filesProcessed, totalFiles, percent, "extracting");
      }

      @Override
      public boolean isCancelled() {
        return job.isCancelRequested();
      }
    };
  }
}
