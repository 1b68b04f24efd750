package com.scholary.textextractor.extract;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of extracting one file.
 *
 * <p>A failed file has no chunks and a non-null error message. A file with no matches is a
 * success with an empty chunk list.
 */
public record FileExtraction(Path file, List<TextChunk> chunks, String error) {

  public FileExtraction {
    chunks = List.copyOf(chunks);
  }

  public static FileExtraction succeeded(Path file, List<TextChunk> chunks) {
    return new FileExtraction(file, chunks, null);
  }

  public static FileExtraction failed(Path file, String error) {
    return new FileExtraction(file, List.of(), error);
  }

  public boolean failed() {
    return error != null;
  }
}
