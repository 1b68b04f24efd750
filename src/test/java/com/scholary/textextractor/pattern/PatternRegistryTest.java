package com.scholary.textextractor.pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.regex.Matcher;
import org.junit.jupiter.api.Test;

class PatternRegistryTest {

  private final PatternRegistry registry = PatternRegistry.defaults();

  @Test
  void defaults_shouldListQuotedThenKeyThenTagRules() {
    List<String> names = registry.rules().stream().map(ExtractionRule::name).toList();

    assertThat(registry.size())
        .isEqualTo(2 + PatternRegistry.KEYS.size() + PatternRegistry.TAGS.size());
    assertThat(names.get(0)).isEqualTo("double-quoted");
    assertThat(names.get(1)).isEqualTo("single-quoted");
    assertThat(names.get(2)).isEqualTo("key:text");
    assertThat(names.get(2 + PatternRegistry.KEYS.size())).isEqualTo("tag:text");
    assertThat(names).contains("key:content", "tag:string", "tag:content");
  }

  @Test
  void doubleQuotedRule_shouldHonourEscapedQuotes() {
    Matcher matcher = rule("double-quoted").pattern().matcher("say(\"He said \\\"hi\\\"\");");

    assertThat(matcher.find()).isTrue();
    assertThat(matcher.group(1)).isEqualTo("He said \\\"hi\\\"");
  }

  @Test
  void singleQuotedRule_shouldMatchEachLiteral() {
    Matcher matcher = rule("single-quoted").pattern().matcher("a = 'first'; b = 'second'");

    assertThat(matcher.find()).isTrue();
    assertThat(matcher.group(1)).isEqualTo("first");
    assertThat(matcher.find()).isTrue();
    assertThat(matcher.group(1)).isEqualTo("second");
  }

  @Test
  void keyRule_shouldAcceptColonOrEqualsAndEitherQuote() {
    ExtractionRule title = rule("key:title");

    assertThat(title.pattern().matcher("title: \"Main Menu\"").find()).isTrue();
    assertThat(title.pattern().matcher("title = 'Main Menu'").find()).isTrue();
    assertThat(title.pattern().matcher("title \"Main Menu\"").find()).isFalse();
  }

  @Test
  void tagRule_shouldCaptureElementBody() {
    Matcher matcher = rule("tag:string").pattern().matcher("<string>Start game</string>");

    assertThat(matcher.find()).isTrue();
    assertThat(matcher.group(1)).isEqualTo("Start game");
    assertThat(matcher.group()).isEqualTo("<string>Start game</string>");
  }

  @Test
  void doubleQuotedRule_shouldNotBacktrackCatastrophically() {
    String hostile = "\"" + "\\a".repeat(5_000);

    assertThat(rule("double-quoted").pattern().matcher(hostile).find()).isFalse();
  }

  @Test
  void rule_shouldRejectPatternWithoutExactlyOneGroup() {
    assertThatThrownBy(() -> ExtractionRule.of("none", "\"[^\"]+\""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("exactly one capturing group");
    assertThatThrownBy(() -> ExtractionRule.of("two", "(a)(b)"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_shouldRejectEmptyRuleList() {
    assertThatThrownBy(() -> new PatternRegistry(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rules_shouldBeImmutable() {
    assertThatThrownBy(() -> registry.rules().clear())
        .isInstanceOf(UnsupportedOperationException.class);
  }

  private ExtractionRule rule(String name) {
    return registry.rules().stream()
        .filter(r -> r.name().equals(name))
        .findFirst()
        .orElseThrow();
  }
}
