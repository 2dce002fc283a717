/*
 * Where: Funnel step catalog
 * What: Ordered, validated list of funnel steps loaded once from a JSON resource
 * Why: Every pass reads the same immutable step definitions
 */
package com.example.funnel.catalog;

import com.example.funnel.model.EmailStep;
import com.example.funnel.model.Phase;
import com.example.funnel.trigger.TriggerDescriptors;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

public final class StepCatalog {

  private static final Logger logger = LoggerFactory.getLogger(StepCatalog.class);

  private final String sequenceKey;
  private final List<EmailStep> steps;

  StepCatalog(String sequenceKey, List<EmailStep> steps) {
    this.sequenceKey = sequenceKey;
    this.steps = List.copyOf(steps);
  }

  public static StepCatalog load(Resource resource, ObjectMapper objectMapper) {
    final CatalogDocument document;
    try (InputStream in = resource.getInputStream()) {
      document = objectMapper.readValue(in, CatalogDocument.class);
    } catch (IOException ex) {
      throw new IllegalStateException("step catalog could not be read: " + resource, ex);
    }
    final StepCatalog catalog = fromDocument(document);
    logger.info(
        "step catalog loaded sequenceKey={} steps={} resource={}",
        catalog.sequenceKey(),
        catalog.size(),
        resource);
    return catalog;
  }

  static StepCatalog fromDocument(CatalogDocument document) {
    if (document == null || document.steps() == null || document.steps().isEmpty()) {
      throw new IllegalStateException("step catalog has no steps");
    }
    if (isBlank(document.sequenceKey())) {
      throw new IllegalStateException("step catalog sequence_key is required");
    }
    final List<EmailStep> steps = new ArrayList<>();
    final Set<String> keys = new HashSet<>();
    int previousDayOffset = Integer.MIN_VALUE;
    int position = 0;
    for (CatalogDocument.Entry entry : document.steps()) {
      position++;
      final EmailStep step = toStep(entry, position);
      if (!keys.add(step.key())) {
        throw new IllegalStateException("duplicate step key: " + step.key());
      }
      if (step.dayOffset() < previousDayOffset) {
        throw new IllegalStateException(
            "step " + step.key() + " breaks day offset ordering (" + step.dayOffset() + " < "
                + previousDayOffset + ")");
      }
      previousDayOffset = step.dayOffset();
      steps.add(step);
    }
    return new StepCatalog(document.sequenceKey(), steps);
  }

  private static EmailStep toStep(CatalogDocument.Entry entry, int position) {
    if (isBlank(entry.key())) {
      throw new IllegalStateException("step at position " + position + " has no key");
    }
    final String key = entry.key().trim();
    final int dayOffset = requireNonNegative(entry.dayOffset(), key, "day_offset");
    final int delayMinutes = requireNonNegative(entry.delayMinutes(), key, "delay_minutes");
    if (isBlank(entry.fallbackSubject()) || isBlank(entry.fallbackBody())) {
      throw new IllegalStateException("step " + key + " must define fallback subject and body");
    }
    final Phase phase =
        isBlank(entry.phase()) ? Phase.forDayOffset(dayOffset) : Phase.fromValue(entry.phase());
    return new EmailStep(
        key,
        position,
        dayOffset,
        phase,
        entry.trigger(),
        TriggerDescriptors.parse(entry.trigger()),
        delayMinutes,
        entry.subjectPrompt(),
        entry.bodyPrompt(),
        entry.fallbackSubject(),
        entry.fallbackBody(),
        entry.ctaPath(),
        entry.offerTag(),
        entry.couponCode());
  }

  private static int requireNonNegative(Integer value, String key, String field) {
    if (value == null || value < 0) {
      throw new IllegalStateException("step " + key + " needs " + field + " >= 0");
    }
    return value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  public String sequenceKey() {
    return sequenceKey;
  }

  public List<EmailStep> steps() {
    return steps;
  }

  public int size() {
    return steps.size();
  }

  public Optional<EmailStep> find(String key) {
    return steps.stream().filter(step -> step.key().equals(key)).findFirst();
  }

  /** Step at a 1-based position; empty once the catalog is exhausted. */
  public Optional<EmailStep> stepAt(int position) {
    if (position < 1 || position > steps.size()) {
      return Optional.empty();
    }
    return Optional.of(steps.get(position - 1));
  }
}
