package com.scholary.textextractor.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request for reading translations out of a filled-in worksheet.
 *
 * <p>If {@code memoryFile} is set the mapping is also merged into that JSON file.
 */
public record ReapplyRequest(@NotBlank String worksheetPath, String memoryFile) {}
