package com.scholary.textextractor.api;

import java.util.Map;

/**
 * Translations found in a worksheet.
 *
 * <p>{@code memoryEntries} is the size of the memory file after the merge, or null when no memory
 * file was requested.
 */
public record ReapplyResponse(
    Map<String, String> translations,
    int records,
    int translatedRecords,
    int rejectedRecords,
    double translationProgress,
    String memoryFile,
    Integer memoryEntries) {}
