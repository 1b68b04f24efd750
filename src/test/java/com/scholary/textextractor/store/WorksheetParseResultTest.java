package com.scholary.textextractor.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.util.List;
import org.junit.jupiter.api.Test;

class WorksheetParseResultTest {

  @Test
  void translationProgress_shouldBePercentOfTranslatedRecords() {
    WorksheetParseResult result =
        new WorksheetParseResult(
            List.of(
                new TranslationRecord(1, "menu.py", 3, "Start", "Démarrer"),
                new TranslationRecord(2, "menu.py", 4, "Quit", ""),
                new TranslationRecord(3, "menu.py", 5, "Load", " "),
                new TranslationRecord(4, "menu.py", 6, "Save", "Sauver")),
            List.of(new WorksheetParseException("5", 30, "missing Original")));

    assertThat(result.translatedRecords()).isEqualTo(2);
    assertThat(result.translationProgress()).isEqualTo(50.0);
    assertThat(result.translations())
        .containsExactly(entry("Start", "Démarrer"), entry("Save", "Sauver"));
  }

  @Test
  void translationProgress_shouldBeZeroForEmptyWorksheet() {
    WorksheetParseResult result = new WorksheetParseResult(List.of(), List.of());

    assertThat(result.translatedRecords()).isZero();
    assertThat(result.translationProgress()).isZero();
  }

  @Test
  void translations_shouldLetLaterDuplicateWin() {
    WorksheetParseResult result =
        new WorksheetParseResult(
            List.of(
                new TranslationRecord(1, "a.py", 1, "Start", "Démarrer"),
                new TranslationRecord(2, "b.py", 9, "Start", "Commencer")),
            List.of());

    assertThat(result.translations()).containsExactly(entry("Start", "Commencer"));
  }
}
