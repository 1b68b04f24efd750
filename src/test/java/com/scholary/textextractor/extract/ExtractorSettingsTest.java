package com.scholary.textextractor.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExtractorSettingsTest {

  @Test
  void defaults_shouldMatchDocumentedValues() {
    ExtractorSettings settings = ExtractorSettings.defaults();

    assertThat(settings.minTextLength()).isEqualTo(3);
    assertThat(settings.maxChunkSize()).isEqualTo(50_000);
    assertThat(settings.deduplicate()).isFalse();
    assertThat(settings.supportedExtensions())
        .hasSize(29)
        .contains(".csv", ".erb", ".erh", ".py", ".rpy", ".sln");
  }

  @Test
  void constructor_shouldNormalizeExtensions() {
    ExtractorSettings settings =
        new ExtractorSettings(
            new LinkedHashSet<>(List.of(" PY", ".Json", "", ".py")), 3, 10, false);

    assertThat(settings.supportedExtensions()).containsExactly(".py", ".json");
  }

  @Test
  void constructor_shouldRejectInvalidValues() {
    assertThatThrownBy(() -> new ExtractorSettings(Set.of(), 3, 10, false))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ExtractorSettings(Set.of(" "), 3, 10, false))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ExtractorSettings(Set.of(".py"), -1, 10, false))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ExtractorSettings(Set.of(".py"), 3, 0, false))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void withMethods_shouldDeriveCopies() {
    ExtractorSettings base = ExtractorSettings.defaults();

    ExtractorSettings derived =
        base.withSupportedExtensions(List.of("lua"))
            .withMinTextLength(5)
            .withMaxChunkSize(100)
            .withDeduplicate(true);

    assertThat(derived.supportedExtensions()).containsExactly(".lua");
    assertThat(derived.minTextLength()).isEqualTo(5);
    assertThat(derived.maxChunkSize()).isEqualTo(100);
    assertThat(derived.deduplicate()).isTrue();
    assertThat(base.minTextLength()).isEqualTo(3);
  }

  @Test
  void supportedExtensions_shouldBeImmutable() {
    assertThatThrownBy(() -> ExtractorSettings.defaults().supportedExtensions().add(".md"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void parseExtensionList_shouldSplitAndNormalize() {
    assertThat(ExtractorSettings.parseExtensionList("py, .CPP,js,,py"))
        .containsExactly(".py", ".cpp", ".js");
  }

  @Test
  void parseExtensionList_shouldFallBackWhenEmpty() {
    assertThat(ExtractorSettings.parseExtensionList(" ")).containsExactly(".csv", ".erb", ".erh");
    assertThat(ExtractorSettings.parseExtensionList(" , ,"))
        .containsExactly(".csv", ".erb", ".erh");
    assertThat(ExtractorSettings.parseExtensionList(null)).containsExactly(".csv", ".erb", ".erh");
  }
}
