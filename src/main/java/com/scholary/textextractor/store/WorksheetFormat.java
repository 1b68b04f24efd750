package com.scholary.textextractor.store;

/**
 * Field labels and value escaping of the master worksheet.
 *
 * <p>The labels and their order are what {@link WorksheetParser} reads back, so they must not
 * change. {@code Original} and {@code Translation} values are escaped so that a text containing a
 * line break still occupies one line: LF becomes {@code \n} and CR becomes {@code \r}. A backslash
 * is doubled only where it would otherwise be read back as an escape, that is before {@code n},
 * {@code r}, another backslash or a line break. Paths such as {@code C:\temp dir} stay readable
 * for the translator.
 *
 * <p>Worksheets written by older tools that did no escaping at all read back the same, except that
 * a literal {@code \n}, {@code \r} or {@code \\} in them becomes a line break or one backslash.
 */
public final class WorksheetFormat {

  public static final String MASTER_FILE_NAME = "master_translation.txt";
  public static final String EXTRACTED_FILE_SUFFIX = "_extracted.txt";

  public static final String MASTER_HEADER = "=== MASTER TRANSLATION FILE ===";
  public static final String EXTRACTED_HEADER_PREFIX = "=== EXTRACTED TEXTS FROM: ";
  public static final String EXTRACTED_HEADER_SUFFIX = " ===";

  public static final String ID = "ID: ";
  public static final String FILE = "File: ";
  public static final String LINE = "Line: ";
  public static final String ORIGINAL = "Original: ";
  public static final String TRANSLATION = "Translation: ";
  public static final String RECORD_END = "---";

  private WorksheetFormat() {}

  public static String escape(String value) {
    if (value.indexOf('\\') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
      return value;
    }
    StringBuilder escaped = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\\') {
        escaped.append(needsDoubling(value, i + 1) ? "\\\\" : "\\");
      } else if (c == '\n') {
        escaped.append("\\n");
      } else if (c == '\r') {
        escaped.append("\\r");
      } else {
        escaped.append(c);
      }
    }
    return escaped.toString();
  }

  private static boolean needsDoubling(String value, int next) {
    if (next == value.length()) {
      return false;
    }
    char c = value.charAt(next);
    return c == '\\' || c == 'n' || c == 'r' || c == '\n' || c == '\r';
  }

  /**
   * Reverse {@link #escape}. Unknown escapes and a trailing lone backslash are kept as written.
   */
  public static String unescape(String value) {
    if (value.indexOf('\\') < 0) {
      return value;
    }
    StringBuilder unescaped = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c != '\\' || i + 1 == value.length()) {
        unescaped.append(c);
        continue;
      }
      char next = value.charAt(i + 1);
      if (next == '\\') {
        unescaped.append('\\');
      } else if (next == 'n') {
        unescaped.append('\n');
      } else if (next == 'r') {
        unescaped.append('\r');
      } else {
        unescaped.append(c).append(next);
      }
      i++;
    }
    return unescaped.toString();
  }
}
