package com.scholary.textextractor.extract;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Optional filter that drops repeated captures of the same text on the same line.
 *
 * <p>Two chunks are duplicates when file, line and cleaned text are equal. The first one in rule
 * order wins, which keeps the span of the generic quoted-literal rule over the key rules.
 */
public final class ChunkDeduplicator {

  private ChunkDeduplicator() {}

  public static List<TextChunk> deduplicate(List<TextChunk> chunks) {
    Set<List<Object>> seen = new HashSet<>();
    List<TextChunk> result = new ArrayList<>(chunks.size());
    for (TextChunk chunk : chunks) {
      if (seen.add(List.of(chunk.filePath(), chunk.lineNumber(), chunk.text()))) {
        result.add(chunk);
      }
    }
    return result;
  }
}
