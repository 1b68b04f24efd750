package com.scholary.textextractor.store;

import com.scholary.textextractor.extract.TextChunk;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders extracted texts in the two translator-facing formats.
 *
 * <p>Both formats are UTF-8 text with {@code ---} closing each block.
 */
@Component
public class ExtractedTextWriter {

  /**
   * Write the per-file report.
   *
   * <p>Format:
   *
   * <pre>
   * === EXTRACTED TEXTS FROM: data/dialog.json ===
   *
   * Line 3:
   * Context:   "greeting": "Hello there",
   * Text: Hello there
   * Original: "Hello there"
   * ---
   *
   * </pre>
   */
  public byte[] writeExtractedTexts(String filePath, List<TextChunk> chunks) {
    StringBuilder out = new StringBuilder();
    out.append(WorksheetFormat.EXTRACTED_HEADER_PREFIX)
        .append(filePath)
        .append(WorksheetFormat.EXTRACTED_HEADER_SUFFIX)
        .append("\n\n");

    for (TextChunk chunk : chunks) {
      out.append("Line ").append(chunk.lineNumber()).append(":\n");
      out.append("Context: ").append(chunk.context()).append("\n");
      out.append("Text: ").append(chunk.text()).append("\n");
      out.append("Original: ").append(chunk.originalText()).append("\n");
      out.append(WorksheetFormat.RECORD_END).append("\n\n");
    }

    return out.toString().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Write the master worksheet.
   *
   * <p>Format:
   *
   * <pre>
   * === MASTER TRANSLATION FILE ===
   *
   * ID: 1
   * File: data/dialog.json
   * Line: 3
   * Original: Hello there
   * Translation:
   * ---
   *
   * </pre>
   *
   * <p>IDs start at 1 and follow the chunk order. The translator fills in the value after {@code
   * Translation: }.
   */
  public byte[] writeMasterWorksheet(List<TextChunk> chunks) {
    StringBuilder out = new StringBuilder();
    out.append(WorksheetFormat.MASTER_HEADER).append("\n\n");

    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      out.append(WorksheetFormat.ID).append(i + 1).append("\n");
      out.append(WorksheetFormat.FILE).append(chunk.filePath()).append("\n");
      out.append(WorksheetFormat.LINE).append(chunk.lineNumber()).append("\n");
      out.append(WorksheetFormat.ORIGINAL)
          .append(WorksheetFormat.escape(chunk.text()))
          .append("\n");
      out.append(WorksheetFormat.TRANSLATION).append("\n");
      out.append(WorksheetFormat.RECORD_END).append("\n\n");
    }

    return out.toString().getBytes(StandardCharsets.UTF_8);
  }
}
