package com.scholary.textextractor.api;

import com.scholary.textextractor.api.JobStatusResponse.Status;
import com.scholary.textextractor.extract.ExtractorSettings;
import com.scholary.textextractor.extract.TextChunk;
import com.scholary.textextractor.job.ExtractionJob;
import com.scholary.textextractor.job.JobRepository;
import com.scholary.textextractor.scan.ExtensionPreset;
import com.scholary.textextractor.service.ExtractionJobRunner;
import com.scholary.textextractor.store.TranslationMemoryFile;
import com.scholary.textextractor.store.TranslationStore;
import com.scholary.textextractor.store.WorksheetParseResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for text extraction.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Asynchronous extraction (returns job ID immediately)
 *   <li>Job status polling, chunk listing and cancellation
 *   <li>Reading translations out of a filled-in worksheet
 *   <li>Listing the default extensions and presets
 * </ul>
 */
@RestController
@Tag(name = "Extraction", description = "Text extraction and translation worksheet API")
public class ExtractionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionController.class);

  private final ExtractionJobRunner jobRunner;
  private final JobRepository jobRepository;
  private final TranslationStore translationStore;
  private final TranslationMemoryFile translationMemoryFile;
  private final ExtractorSettings defaultSettings;

  public ExtractionController(
      ExtractionJobRunner jobRunner,
      JobRepository jobRepository,
      TranslationStore translationStore,
      TranslationMemoryFile translationMemoryFile,
      ExtractorSettings defaultSettings) {
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
    this.translationStore = translationStore;
    this.translationMemoryFile = translationMemoryFile;
    this.defaultSettings = defaultSettings;
  }

  /** Start asynchronous extraction job. */
  @PostMapping("/api/extract")
  @Operation(
      summary = "Start extraction",
      description = "Start asynchronous extraction job and return job ID for status polling")
  public ResponseEntity<AsyncJobResponse> extract(@Valid @RequestBody ExtractionRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info(
        "Extraction request: sourceDir={}, outputDir={}", request.sourceDir(), request.outputDir());

    ExtractionJob job;
    try {
      job =
          new ExtractionJob(
              jobId,
              Path.of(request.sourceDir()),
              Path.of(request.outputDir()),
              request.toSettings(defaultSettings));
    } catch (IllegalArgumentException e) {
      // Invalid paths and settings both surface here.
      LOGGER.warn("Rejected extraction request: {}", e.getMessage());
      return ResponseEntity.badRequest().build();
    }
    jobRepository.save(job);
    LOGGER.info("Created async extraction job: {}", jobId);

    try {
      jobRunner.runAsync(job);
    } catch (TaskRejectedException e) {
      // Queue full: the job would never start, so do not leave it behind as pending.
      LOGGER.warn("Extraction queue full, rejected job: {}", jobId);
      jobRepository.delete(jobId);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }

    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an async job. If the job is completed, includes statistics
   * and the written files.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an extraction job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(toStatusResponse(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  /** List the chunks of a completed job. */
  @GetMapping("/api/jobs/{id}/chunks")
  @Operation(summary = "Get job chunks", description = "List the chunks of a completed job")
  public ResponseEntity<List<TextChunk>> getJobChunks(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                job.getStatus() == Status.COMPLETED
                    ? ResponseEntity.ok(job.getResult().chunks())
                    : ResponseEntity.status(HttpStatus.CONFLICT).<List<TextChunk>>build())
        .orElse(ResponseEntity.notFound().build());
  }

  /** Request cancellation; the job stops before its next file. */
  @DeleteMapping("/api/jobs/{id}")
  @Operation(summary = "Cancel job", description = "Stop an extraction job before its next file")
  public ResponseEntity<JobStatusResponse> cancelJob(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job -> {
              if (!job.isFinished()) {
                job.requestCancel();
                LOGGER.info("Cancellation requested for job: {}", id);
              }
              return ResponseEntity.accepted().body(toStatusResponse(job));
            })
        .orElse(ResponseEntity.notFound().build());
  }

  /**
   * Read translations from a worksheet.
   *
   * <p>When {@code memoryFile} is set, the translations are merged into that JSON file.
   */
  @PostMapping("/api/translations/reapply")
  @Operation(
      summary = "Read worksheet translations",
      description = "Parse a filled-in master worksheet into an original-to-translation mapping")
  public ResponseEntity<ReapplyResponse> reapply(@Valid @RequestBody ReapplyRequest request) {
    try {
      WorksheetParseResult parsed =
          translationStore.parseWorksheet(Path.of(request.worksheetPath()));
      Map<String, String> translations = parsed.translations();

      Integer memoryEntries = null;
      if (request.memoryFile() != null && !request.memoryFile().isBlank()) {
        memoryEntries =
            translationMemoryFile.merge(translations, Path.of(request.memoryFile())).size();
      }

      return ResponseEntity.ok(
          new ReapplyResponse(
              translations,
              parsed.records().size(),
              parsed.translatedRecords(),
              parsed.rejected().size(),
              parsed.translationProgress(),
              request.memoryFile(),
              memoryEntries));
    } catch (IOException | InvalidPathException e) {
      LOGGER.error("Failed to read translations: worksheet={}", request.worksheetPath(), e);
      return ResponseEntity.badRequest().build();
    }
  }

  /** Default extensions and presets. */
  @GetMapping("/api/extensions")
  @Operation(summary = "List extensions", description = "Default extension allow-list and presets")
  public ExtensionsResponse getExtensions() {
    Map<String, List<String>> presets = new LinkedHashMap<>();
    for (ExtensionPreset preset : ExtensionPreset.values()) {
      presets.put(preset.name(), preset.extensions());
    }
    return new ExtensionsResponse(List.copyOf(defaultSettings.supportedExtensions()), presets);
  }

  private static JobStatusResponse toStatusResponse(ExtractionJob job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getStatus(),
        job.getProgress(),
        job.getCreatedAt(),
        job.getResponse(),
        job.getError());
  }
}
