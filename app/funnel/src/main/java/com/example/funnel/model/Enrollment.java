/*
 * Where: Funnel domain model
 * What: A user's cursor through the step catalog under relative scheduling
 * Why: The enrollment scheduler advances it one step per successful send
 */
package com.example.funnel.model;

import java.time.Instant;
import java.util.UUID;

public record Enrollment(
    UUID id,
    String userId,
    String sequenceKey,
    int currentStep,
    int stepAttempts,
    EnrollmentStatus status,
    Instant nextRunAt,
    String contextJson,
    Instant createdAt,
    Instant updatedAt,
    Instant lastSentAt,
    String lastError) {

  public int nextStepPosition() {
    return currentStep + 1;
  }
}
