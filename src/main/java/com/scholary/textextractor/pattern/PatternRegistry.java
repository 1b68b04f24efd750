package com.scholary.textextractor.pattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, immutable set of extraction rules.
 *
 * <p>Rules are not mutually exclusive. Every rule runs over every line, so a value matched by a
 * key rule such as {@code name: "Hello"} is matched again by the generic double-quote rule. The
 * engine keeps both; removing duplicates is the job of {@code ChunkDeduplicator}.
 *
 * <p>Default order:
 *
 * <ol>
 *   <li>double-quoted literal, honouring {@code \"} and {@code \\}
 *   <li>single-quoted literal, same escaping
 *   <li>{@code key: "value"} / {@code key = 'value'} for each of {@link #KEYS}
 *   <li>{@code <key>value</key>} for each of {@link #TAGS}
 * </ol>
 */
public final class PatternRegistry {

  /** Keys recognised in key/value assignments. */
  public static final List<String> KEYS =
      List.of("text", "label", "message", "title", "description", "name", "value", "content");

  /** Tags recognised as XML-style pairs. */
  public static final List<String> TAGS =
      List.of(
          "text", "string", "message", "label", "title", "description", "name", "value", "content");

  private static final String DOUBLE_QUOTED = "\"([^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+)\"";
  private static final String SINGLE_QUOTED = "'([^'\\\\]*+(?:\\\\.[^'\\\\]*+)*+)'";

  private final List<ExtractionRule> rules;

  public PatternRegistry(List<ExtractionRule> rules) {
    if (rules == null || rules.isEmpty()) {
      throw new IllegalArgumentException("Pattern registry needs at least one rule");
    }
    this.rules = List.copyOf(rules);
  }

  /** The rule set used for game and application source trees. */
  public static PatternRegistry defaults() {
    List<ExtractionRule> rules = new ArrayList<>();
    rules.add(ExtractionRule.of("double-quoted", DOUBLE_QUOTED));
    rules.add(ExtractionRule.of("single-quoted", SINGLE_QUOTED));
    for (String key : KEYS) {
      rules.add(ExtractionRule.of("key:" + key, key + "\\s*[:=]\\s*[\"']([^\"']+)[\"']"));
    }
    for (String tag : TAGS) {
      rules.add(ExtractionRule.of("tag:" + tag, "<" + tag + ">([^<]+)</" + tag + ">"));
    }
    return new PatternRegistry(rules);
  }

  public List<ExtractionRule> rules() {
    return rules;
  }

  public int size() {
    return rules.size();
  }
}
