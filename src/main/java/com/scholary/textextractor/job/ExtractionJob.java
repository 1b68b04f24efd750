package com.scholary.textextractor.job;

import com.scholary.textextractor.api.ExtractionResponse;
import com.scholary.textextractor.api.JobStatusResponse.Status;
import com.scholary.textextractor.extract.ExtractionResult;
import com.scholary.textextractor.extract.ExtractorSettings;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Represents an async extraction job.
 *
 * <p>Tracks the job's state, progress, and result. Stored in memory using Caffeine cache. The
 * worker thread writes the state and HTTP threads read it, hence the volatile fields.
 */
public class ExtractionJob {

  private final String jobId;
  private final Path sourceDir;
  private final Path outputDir;
  private final ExtractorSettings settings;
  private final Instant createdAt;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile ExtractionResult result;
  private volatile ExtractionResponse response;
  private volatile String error;
  private volatile boolean cancelRequested;

  public ExtractionJob(String jobId, Path sourceDir, Path outputDir, ExtractorSettings settings) {
    this.jobId = jobId;
    this.sourceDir = sourceDir;
    this.outputDir = outputDir;
    this.settings = settings;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public Path getSourceDir() {
    return sourceDir;
  }

  public Path getOutputDir() {
    return outputDir;
  }

  public ExtractorSettings getSettings() {
    return settings;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public ExtractionResult getResult() {
    return result;
  }

  public void setResult(ExtractionResult result) {
    this.result = result;
  }

  public ExtractionResponse getResponse() {
    return response;
  }

  public void setResponse(ExtractionResponse response) {
    this.response = response;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  public boolean isCancelRequested() {
    return cancelRequested;
  }

  public void requestCancel() {
    this.cancelRequested = true;
  }

  /** True once the job can no longer change state. */
  public boolean isFinished() {
    return status == Status.COMPLETED || status == Status.FAILED || status == Status.CANCELLED;
  }
}
