package com.scholary.textextractor.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Records read from a worksheet, plus the ones that were rejected. */
public record WorksheetParseResult(
    List<TranslationRecord> records, List<WorksheetParseException> rejected) {

  public WorksheetParseResult {
    records = List.copyOf(records);
    rejected = List.copyOf(rejected);
  }

  /**
   * Original text to translation, for translated records only.
   *
   * <p>When the same original appears twice the later translation wins.
   */
  public Map<String, String> translations() {
    Map<String, String> translations = new LinkedHashMap<>();
    for (TranslationRecord record : records) {
      if (record.isTranslated()) {
        translations.put(record.original(), record.translation());
      }
    }
    return translations;
  }

  public int translatedRecords() {
    int translated = 0;
    for (TranslationRecord record : records) {
      if (record.isTranslated()) {
        translated++;
      }
    }
    return translated;
  }

  /** Share of records that carry a translation, in percent; 0 for an empty worksheet. */
  public double translationProgress() {
    if (records.isEmpty()) {
      return 0.0;
    }
    return translatedRecords() * 100.0 / records.size();
  }
}
