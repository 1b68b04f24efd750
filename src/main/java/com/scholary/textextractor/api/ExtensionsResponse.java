package com.scholary.textextractor.api;

import java.util.List;
import java.util.Map;

/** Default extension allow-list and the named presets. */
public record ExtensionsResponse(List<String> defaults, Map<String, List<String>> presets) {}
