package com.scholary.textextractor.pattern;

import java.util.regex.Pattern;

/**
 * A named text matcher with exactly one capturing group.
 *
 * <p>Group 1 is the candidate text; the whole match (group 0) is kept as the original span,
 * delimiters included.
 */
public record ExtractionRule(String name, Pattern pattern) {

  public ExtractionRule {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Rule name cannot be blank");
    }
    if (pattern == null) {
      throw new IllegalArgumentException("Rule pattern cannot be null");
    }
    int groups = pattern.matcher("").groupCount();
    if (groups != 1) {
      throw new IllegalArgumentException(
          "Rule '" + name + "' must have exactly one capturing group, found " + groups);
    }
  }

  public static ExtractionRule of(String name, String regex) {
    return new ExtractionRule(name, Pattern.compile(regex));
  }
}
