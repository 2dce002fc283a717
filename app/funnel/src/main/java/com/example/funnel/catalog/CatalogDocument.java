/*
 * Where: Funnel step catalog
 * What: JSON shape of the catalog resource
 * Why: Keeps Jackson binding apart from the validated EmailStep model
 */
package com.example.funnel.catalog;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
record CatalogDocument(String sequenceKey, List<Entry> steps) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record Entry(
      String key,
      Integer dayOffset,
      String phase,
      String trigger,
      Integer delayMinutes,
      String subjectPrompt,
      String bodyPrompt,
      String fallbackSubject,
      String fallbackBody,
      String ctaPath,
      String offerTag,
      String couponCode) {}
}
