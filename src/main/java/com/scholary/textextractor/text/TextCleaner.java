package com.scholary.textextractor.text;

/**
 * Unescapes and trims captured text.
 *
 * <p>Substitutions run in a fixed order and the backslash step runs last, so {@code \\n} becomes a
 * backslash followed by a line feed rather than a literal {@code \n}.
 *
 * <p>Trimming removes space, tab, line feed, vertical tab, form feed and carriage return only.
 * Other control characters are part of the text.
 */
public final class TextCleaner {

  private static final String[][] ESCAPES = {
    {"\\n", "\n"},
    {"\\t", "\t"},
    {"\\r", "\r"},
    {"\\\"", "\""},
    {"\\'", "'"},
    {"\\\\", "\\"}
  };

  private TextCleaner() {}

  /**
   * Clean a captured value.
   *
   * @param text raw capture group content
   * @return the unescaped value without leading or trailing whitespace
   */
  public static String clean(String text) {
    String cleaned = text;
    for (String[] escape : ESCAPES) {
      cleaned = cleaned.replace(escape[0], escape[1]);
    }
    return trimWhitespace(cleaned);
  }

  private static String trimWhitespace(String text) {
    int start = 0;
    int end = text.length();
    while (start < end && isWhitespace(text.charAt(start))) {
      start++;
    }
    while (end > start && isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(start, end);
  }

  private static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\u000B' || c == '\f' || c == '\r';
  }
}
