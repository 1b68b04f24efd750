package com.scholary.textextractor.extract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One piece of extracted text with its provenance.
 *
 * <p>Columns are char offsets of the capture group in the raw line, before cleaning. {@code
 * context} is the whole raw line and {@code originalText} the full rule match, delimiters
 * included.
 *
 * <p>A chunk produced by splitting an oversized chunk is a fragment: it keeps the source file in
 * {@code sourceFile} and its zero-based position in {@code fragmentIndex}. Unsplit chunks have a
 * null fragment index.
 */
public record TextChunk(
    String text,
    String sourceFile,
    Integer fragmentIndex,
    int lineNumber,
    int columnStart,
    int columnEnd,
    String context,
    String originalText) {

  static final String FRAGMENT_SUFFIX = "_chunk_";

  public TextChunk {
    if (text == null) {
      throw new IllegalArgumentException("Text cannot be null");
    }
    if (sourceFile == null) {
      throw new IllegalArgumentException("Source file cannot be null");
    }
    if (lineNumber < 1) {
      throw new IllegalArgumentException("Line number must be >= 1");
    }
    if (columnStart < 0 || columnEnd < columnStart) {
      throw new IllegalArgumentException("Column end must be >= column start >= 0");
    }
    if (fragmentIndex != null && fragmentIndex < 0) {
      throw new IllegalArgumentException("Fragment index cannot be negative");
    }
  }

  /** A chunk taken straight from a source line. */
  public static TextChunk of(
      String text,
      String sourceFile,
      int lineNumber,
      int columnStart,
      int columnEnd,
      String context,
      String originalText) {
    return new TextChunk(
        text, sourceFile, null, lineNumber, columnStart, columnEnd, context, originalText);
  }

  /**
   * Derive fragment {@code index} of {@code source} holding {@code text}.
   *
   * <p>All provenance fields are copied; the source chunk is left untouched.
   */
  public static TextChunk fragmentOf(TextChunk source, String text, int index) {
    return new TextChunk(
        text,
        source.sourceFile(),
        index,
        source.lineNumber(),
        source.columnStart(),
        source.columnEnd(),
        source.context(),
        source.originalText());
  }

  /**
   * The path as written to output files.
   *
   * <p>Fragments carry a {@code _chunk_<n>} suffix so that each forms its own group on persist.
   */
  @JsonProperty("filePath")
  public String filePath() {
    return fragmentIndex == null ? sourceFile : sourceFile + FRAGMENT_SUFFIX + fragmentIndex;
  }

  @JsonIgnore
  public boolean isFragment() {
    return fragmentIndex != null;
  }
}
