package com.scholary.textextractor.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.scholary.textextractor.extract.TextChunk;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranslationStoreTest {

  @TempDir Path tempDir;

  private TranslationStore store;

  @BeforeEach
  void setUp() {
    store = new TranslationStore(new ExtractedTextWriter(), new WorksheetParser());
  }

  @Test
  void persist_shouldWriteOneReportPerFileAndMasterLast() throws IOException {
    List<TextChunk> chunks =
        List.of(
            chunk("New game", "src/menu.py", 2),
            chunk("Good morning", "src/dialog.py", 5),
            chunk("Quit", "src/menu.py", 7));
    Path out = tempDir.resolve("out");

    List<Path> written = store.persist(chunks, out);

    assertThat(written)
        .containsExactly(
            out.resolve("menu.py_extracted.txt"),
            out.resolve("dialog.py_extracted.txt"),
            out.resolve("master_translation.txt"));
    assertThat(Files.readString(out.resolve("menu.py_extracted.txt")))
        .startsWith("=== EXTRACTED TEXTS FROM: src/menu.py ===\n\n")
        .contains("Line 2:\n", "Text: New game\n", "Line 7:\n", "Text: Quit\n")
        .doesNotContain("Good morning");
    assertThat(Files.readString(out.resolve("master_translation.txt")))
        .contains("ID: 1\nFile: src/menu.py\nLine: 2\nOriginal: New game\n")
        .contains("ID: 2\nFile: src/dialog.py\nLine: 5\nOriginal: Good morning\n")
        .contains("ID: 3\nFile: src/menu.py\nLine: 7\nOriginal: Quit\n");
  }

  @Test
  void persist_shouldNumberReportsWhoseBaseNamesCollide() throws IOException {
    List<TextChunk> chunks =
        List.of(
            chunk("Alpha text", "a/strings.xml", 1),
            chunk("Beta text", "b/strings.xml", 1),
            chunk("Gamma text", "c\\strings.xml", 1));

    List<Path> written = store.persist(chunks, tempDir);

    assertThat(written)
        .containsExactly(
            tempDir.resolve("strings.xml_extracted.txt"),
            tempDir.resolve("strings.xml_2_extracted.txt"),
            tempDir.resolve("strings.xml_3_extracted.txt"),
            tempDir.resolve("master_translation.txt"));
    assertThat(Files.readString(tempDir.resolve("strings.xml_2_extracted.txt")))
        .contains("b/strings.xml", "Beta text");
  }

  @Test
  void persist_shouldWriteFragmentsToTheirOwnReports() throws IOException {
    TextChunk source = chunk("first second", "story.rpy", 4);
    List<TextChunk> fragments =
        List.of(
            TextChunk.fragmentOf(source, "first", 0), TextChunk.fragmentOf(source, "second", 1));

    store.persist(fragments, tempDir);

    assertThat(tempDir.resolve("story.rpy_chunk_0_extracted.txt")).exists();
    assertThat(tempDir.resolve("story.rpy_chunk_1_extracted.txt")).exists();
    assertThat(Files.readString(tempDir.resolve("master_translation.txt")))
        .contains("File: story.rpy_chunk_0\n", "File: story.rpy_chunk_1\n");
  }

  @Test
  void persist_shouldWriteOnlyMasterHeaderForNoChunks() throws IOException {
    List<Path> written = store.persist(List.of(), tempDir);

    assertThat(written).containsExactly(tempDir.resolve("master_translation.txt"));
    assertThat(Files.readString(tempDir.resolve("master_translation.txt")))
        .isEqualTo("=== MASTER TRANSLATION FILE ===\n\n");
  }

  @Test
  void persist_shouldOverwriteAndLeaveNoTemporaryFiles() throws IOException {
    store.persist(List.of(chunk("Old text", "a.py", 1)), tempDir);
    store.persist(List.of(chunk("New text", "a.py", 1)), tempDir);

    assertThat(Files.readString(tempDir.resolve("a.py_extracted.txt")))
        .contains("New text")
        .doesNotContain("Old text");
    try (Stream<Path> files = Files.list(tempDir)) {
      assertThat(files.map(p -> p.getFileName().toString()))
          .containsExactlyInAnyOrder("a.py_extracted.txt", "master_translation.txt");
    }
  }

  @Test
  void persist_shouldFailWhenOutputDirectoryIsAFile() throws IOException {
    Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");

    assertThatThrownBy(() -> store.persist(List.of(chunk("Some text", "a.py", 1)), blocker))
        .isInstanceOf(PersistException.class)
        .hasMessageContaining("output directory");
  }

  @Test
  void persist_shouldLeaveNoPartialOutputWhenAReportCannotBeWritten() throws IOException {
    Path occupied = Files.createDirectories(tempDir.resolve("menu.py_extracted.txt"));
    Files.writeString(occupied.resolve("keep.txt"), "in the way");

    assertThatThrownBy(() -> store.persist(List.of(chunk("Some text", "menu.py", 1)), tempDir))
        .isInstanceOf(PersistException.class)
        .hasMessageContaining("menu.py_extracted.txt");

    try (Stream<Path> files = Files.list(tempDir)) {
      assertThat(files.map(p -> p.getFileName().toString()))
          .containsExactly("menu.py_extracted.txt");
    }
    assertThat(occupied).isDirectory();
    assertThat(tempDir.resolve("master_translation.txt")).doesNotExist();
  }

  @Test
  void reapply_shouldReturnFilledInTranslations() throws IOException {
    List<TextChunk> chunks =
        List.of(
            chunk("New game", "menu.py", 2),
            chunk("Load game", "menu.py", 3),
            chunk("Quit", "menu.py", 4));
    store.persist(chunks, tempDir);
    Path master = tempDir.resolve("master_translation.txt");
    String filled =
        Files.readString(master)
            .replaceFirst(
                "Original: New game\nTranslation: ",
                "Original: New game\nTranslation: Nouvelle partie")
            .replaceFirst(
                "Original: Quit\nTranslation: ", "Original: Quit\nTranslation: Quitter");
    Files.writeString(master, filled);

    Map<String, String> translations = store.reapply(master);

    assertThat(translations)
        .containsExactly(entry("New game", "Nouvelle partie"), entry("Quit", "Quitter"));
  }

  @Test
  void reapply_shouldRestoreEscapedLineBreaks() throws IOException {
    store.persist(List.of(chunk("Line one\nLine two", "a.py", 1)), tempDir);
    Path master = tempDir.resolve("master_translation.txt");
    Files.writeString(
        master,
        Files.readString(master)
            .replace("Translation: \n", "Translation: Ligne un\\nLigne deux\n"));

    assertThat(store.reapply(master))
        .containsExactly(entry("Line one\nLine two", "Ligne un\nLigne deux"));
  }

  @Test
  void reapply_shouldSkipMalformedRecordAndKeepOthers() throws IOException {
    Path worksheet = tempDir.resolve("worksheet.txt");
    Files.writeString(
        worksheet,
        "=== MASTER TRANSLATION FILE ===\n\n"
            + "ID: 1\nFile: a.py\nLine: 1\nTranslation: orphan\nOriginal: Broken\n---\n\n"
            + "ID: 2\nFile: a.py\nLine: 2\nOriginal: Hello\nTranslation: Bonjour\n---\n\n",
        StandardCharsets.UTF_8);

    WorksheetParseResult result = store.parseWorksheet(worksheet);

    assertThat(result.rejected()).hasSize(1);
    assertThat(result.rejected().get(0).getRecordId()).isEqualTo("1");
    assertThat(result.rejected().get(0)).hasMessageContaining("Translation without");
    assertThat(store.reapply(worksheet)).containsExactly(entry("Hello", "Bonjour"));
  }

  @Test
  void reapply_shouldFailForMissingWorksheet() {
    assertThatThrownBy(() -> store.reapply(tempDir.resolve("missing.txt")))
        .isInstanceOf(IOException.class);
  }

  private static TextChunk chunk(String text, String file, int line) {
    return TextChunk.of(text, file, line, 0, text.length(), "ctx", "\"" + text + "\"");
  }
}
