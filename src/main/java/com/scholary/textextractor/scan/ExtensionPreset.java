package com.scholary.textextractor.scan;

import java.util.List;

/** Named extension allow-lists for common kinds of source trees. */
public enum ExtensionPreset {
  CODE(List.of(".py", ".cpp", ".c", ".h", ".hpp", ".cs", ".java")),

  WEB(List.of(".html", ".css", ".js", ".ts", ".jsx", ".tsx", ".json", ".xml")),

  ALL(
      List.of(
          ".py", ".cpp", ".c", ".h", ".hpp", ".cs", ".java", ".js", ".ts", ".jsx", ".tsx", ".html",
          ".css", ".xml", ".json", ".yaml", ".yml", ".ini", ".cfg", ".txt", ".lua", ".rpy",
          ".unity", ".prefab", ".asset", ".scene"));

  private final List<String> extensions;

  ExtensionPreset(List<String> extensions) {
    this.extensions = extensions;
  }

  public List<String> extensions() {
    return extensions;
  }
}
