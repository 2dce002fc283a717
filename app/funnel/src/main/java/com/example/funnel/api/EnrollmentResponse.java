package com.example.funnel.api;

import com.example.funnel.model.Enrollment;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnrollmentResponse(
    String id,
    String userId,
    String sequenceKey,
    int currentStep,
    String status,
    Instant nextRunAt,
    Instant lastSentAt,
    String lastError) {

  static EnrollmentResponse from(Enrollment enrollment) {
    return new EnrollmentResponse(
        enrollment.id().toString(),
        enrollment.userId(),
        enrollment.sequenceKey(),
        enrollment.currentStep(),
        enrollment.status().name(),
        enrollment.nextRunAt(),
        enrollment.lastSentAt(),
        enrollment.lastError());
  }
}
