package com.example.funnel.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.funnel.model.EmailStep;
import com.example.funnel.model.Phase;
import com.example.funnel.trigger.TriggerKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class StepCatalogTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void shippedCatalogLoadsInOrderWithRecognizedTriggers() {
    final StepCatalog catalog =
        StepCatalog.load(new ClassPathResource("catalog/funnel-steps.json"), objectMapper);

    assertThat(catalog.sequenceKey()).isEqualTo("funnel_30d");
    assertThat(catalog.size()).isEqualTo(22);
    assertThat(catalog.steps())
        .allSatisfy(
            step -> assertThat(step.trigger().kind()).isNotEqualTo(TriggerKind.UNRECOGNIZED));
    assertThat(catalog.steps())
        .extracting(EmailStep::position)
        .containsExactlyElementsOf(
            IntStream.rangeClosed(1, 22).boxed().toList());
  }

  @Test
  void shippedCatalogStartsWithWelcomeAndEndsWithExit() {
    final StepCatalog catalog =
        StepCatalog.load(new ClassPathResource("catalog/funnel-steps.json"), objectMapper);

    final EmailStep welcome = catalog.stepAt(1).orElseThrow();
    assertThat(welcome.key()).isEqualTo("d0_welcome");
    assertThat(welcome.delayMinutes()).isEqualTo(10);
    assertThat(welcome.trigger().kind()).isEqualTo(TriggerKind.ALWAYS_TRUE);
    assertThat(welcome.phase()).isEqualTo(Phase.ACTIVATION);
    assertThat(catalog.stepAt(22).orElseThrow().key()).isEqualTo("d30_exit");
    assertThat(catalog.stepAt(23)).isEmpty();
    assertThat(catalog.stepAt(0)).isEmpty();
    assertThat(catalog.find("d1_smartlink_nudge").orElseThrow().trigger().kind())
        .isEqualTo(TriggerKind.COMPOUND_NEGATIVE);
  }

  @Test
  void phaseDefaultsFromDayOffset() {
    final StepCatalog catalog =
        StepCatalog.fromDocument(
            new CatalogDocument("seq", List.of(entry("a", 3), entry("b", 15), entry("c", 28))));

    assertThat(catalog.steps())
        .extracting(EmailStep::phase)
        .containsExactly(Phase.ACTIVATION, Phase.UPSELL, Phase.URGENCY);
  }

  @Test
  void rejectsDuplicateKeys() {
    final CatalogDocument document = new CatalogDocument("seq", List.of(entry("a", 0), entry("a", 1)));

    assertThatThrownBy(() -> StepCatalog.fromDocument(document))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("duplicate step key: a");
  }

  @Test
  void rejectsDecreasingDayOffset() {
    final CatalogDocument document = new CatalogDocument("seq", List.of(entry("a", 5), entry("b", 2)));

    assertThatThrownBy(() -> StepCatalog.fromDocument(document))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("day offset ordering");
  }

  @Test
  void rejectsMissingFallbackCopy() {
    final CatalogDocument document =
        new CatalogDocument(
            "seq",
            List.of(
                new CatalogDocument.Entry(
                    "a", 0, null, "signup_completed", 10, null, null, "Subject", " ", null, null,
                    null)));

    assertThatThrownBy(() -> StepCatalog.fromDocument(document))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("fallback");
  }

  @Test
  void rejectsEmptyCatalogAndMissingSequenceKey() {
    assertThatThrownBy(() -> StepCatalog.fromDocument(new CatalogDocument("seq", List.of())))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(
            () -> StepCatalog.fromDocument(new CatalogDocument(" ", List.of(entry("a", 0)))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("sequence_key");
  }

  private static CatalogDocument.Entry entry(String key, int dayOffset) {
    return new CatalogDocument.Entry(
        key,
        dayOffset,
        null,
        "days_since_signup_" + dayOffset,
        dayOffset * 1440,
        null,
        null,
        "Subject " + key,
        "Body " + key,
        null,
        null,
        null);
  }
}
