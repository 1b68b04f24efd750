package com.scholary.textextractor.extract;

import com.scholary.textextractor.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounds chunk text to a maximum length.
 *
 * <p>Chunks within the bound pass through as they are. Longer chunks are cut into fragments,
 * preferring to cut at a space:
 *
 * <pre>
 * max = 10, text = "hello brave new world"
 * fragment 0: "hello"        (cut at the space at index 5, space dropped)
 * fragment 1: "brave new"    (cut at the space at index 15, space dropped)
 * fragment 2: "world"
 * </pre>
 *
 * <p>When no space lies after the fragment start the cut is made at exactly {@code max} chars, even
 * mid-word.
 */
@Component
public class ChunkSplitter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkSplitter.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /**
   * Split every oversized chunk.
   *
   * @param chunks chunks in aggregate order
   * @param maxChunkSize longest text allowed in the output
   * @return chunks in the same order, oversized ones replaced by their fragments
   */
  public List<TextChunk> split(List<TextChunk> chunks, int maxChunkSize) {
    if (maxChunkSize <= 0) {
      throw new IllegalArgumentException("Maximum chunk size must be positive");
    }

    List<TextChunk> result = new ArrayList<>(chunks.size());
    for (TextChunk chunk : chunks) {
      if (chunk.text().length() <= maxChunkSize) {
        result.add(chunk);
        continue;
      }

      List<String> pieces = splitText(chunk.text(), maxChunkSize);
      for (int i = 0; i < pieces.size(); i++) {
        result.add(TextChunk.fragmentOf(chunk, pieces.get(i), i));
      }
      structuredLogger.logChunkSplit(
          chunk.filePath(), chunk.lineNumber(), chunk.text().length(), pieces.size());
    }
    return result;
  }

  /**
   * Cut a text into pieces of at most {@code maxChunkSize} chars.
   *
   * <p>A cut made at a space drops that one space, so joining the pieces with a single space at
   * each such cut restores the input.
   */
  public static List<String> splitText(String text, int maxChunkSize) {
    List<String> pieces = new ArrayList<>();
    int start = 0;

    while (start < text.length()) {
      int end = Math.min(start + maxChunkSize, text.length());

      if (end < text.length()) {
        int lastSpace = text.lastIndexOf(' ', end);
        if (lastSpace > start) {
          end = lastSpace;
        }
      }

      pieces.add(text.substring(start, end));

      start = end;
      if (start < text.length() && text.charAt(start) == ' ') {
        start++;
      }
    }

    return pieces;
  }
}
