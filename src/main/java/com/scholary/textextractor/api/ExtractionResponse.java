package com.scholary.textextractor.api;

import com.scholary.textextractor.service.ExtractionStatistics;
import java.util.List;

/**
 * Result of a completed extraction job.
 *
 * <p>The chunks themselves are served separately by {@code GET /api/jobs/{id}/chunks}.
 */
public record ExtractionResponse(
    ExtractionStatistics statistics, List<String> failedFiles, List<String> outputFiles) {}
