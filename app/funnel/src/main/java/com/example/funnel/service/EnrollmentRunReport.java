package com.example.funnel.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Outcome of one enrollment pass; {@code busy} means another enrollment pass was still running. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnrollmentRunReport(
    boolean enabled,
    boolean configured,
    int due,
    int sent,
    int advanced,
    int completed,
    int retried,
    int conflicts,
    boolean busy) {

  static EnrollmentRunReport disabled() {
    return new EnrollmentRunReport(false, true, 0, 0, 0, 0, 0, 0, false);
  }

  static EnrollmentRunReport notConfigured() {
    return new EnrollmentRunReport(true, false, 0, 0, 0, 0, 0, 0, false);
  }

  static EnrollmentRunReport busyReport() {
    return new EnrollmentRunReport(true, true, 0, 0, 0, 0, 0, 0, true);
  }
}
