package com.example.funnel.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of one job pass. {@code skipped} is the number of pending jobs left untouched because
 * the transport was not configured; {@code expired} counts SENDING jobs failed by the lease sweep.
 * {@code busy} means another jobs pass was still running and this one did nothing.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobRunReport(
    boolean enabled,
    boolean configured,
    int claimed,
    int sent,
    int failed,
    int retried,
    int skipped,
    int expired,
    boolean busy) {

  static JobRunReport disabled() {
    return new JobRunReport(false, true, 0, 0, 0, 0, 0, 0, false);
  }

  static JobRunReport notConfigured(int pending) {
    return new JobRunReport(true, false, 0, 0, 0, 0, pending, 0, false);
  }

  static JobRunReport busyReport() {
    return new JobRunReport(true, true, 0, 0, 0, 0, 0, 0, true);
  }
}
