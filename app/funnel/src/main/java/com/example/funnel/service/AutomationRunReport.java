package com.example.funnel.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of one automation pass. {@code skipped} counts steps whose trigger could not be
 * evaluated; steps that were not yet due or not eligible are not counted. {@code busy} means
 * another automation pass was still running and this one did nothing.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AutomationRunReport(
    boolean enabled,
    boolean configured,
    int users,
    int sent,
    int skipped,
    int failed,
    boolean busy) {

  static AutomationRunReport disabled() {
    return new AutomationRunReport(false, true, 0, 0, 0, 0, false);
  }

  static AutomationRunReport notConfigured() {
    return new AutomationRunReport(true, false, 0, 0, 0, 0, false);
  }

  static AutomationRunReport busyReport() {
    return new AutomationRunReport(true, true, 0, 0, 0, 0, true);
  }
}
