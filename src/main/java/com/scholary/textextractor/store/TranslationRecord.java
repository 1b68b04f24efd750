package com.scholary.textextractor.store;

/**
 * One entry of the master worksheet.
 *
 * <p>{@code translation} is empty until a translator fills it in.
 */
public record TranslationRecord(
    int id, String file, int line, String original, String translation) {

  /** True if the translator left a real value, not an empty or single-space placeholder. */
  public boolean isTranslated() {
    return translation != null && !translation.isEmpty() && !translation.equals(" ");
  }
}
