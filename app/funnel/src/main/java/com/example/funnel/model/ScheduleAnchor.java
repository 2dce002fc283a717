/*
 * Where: Funnel domain model
 * What: Timestamps a delay can be anchored on
 * Why: One value feeds both anchoring strategies so callers never pick the anchor themselves
 */
package com.example.funnel.model;

import java.time.Instant;
import java.util.Objects;

public record ScheduleAnchor(Instant signupAt, Instant enrolledAt, Instant lastSentAt) {

  public static ScheduleAnchor forUser(UserSnapshot user) {
    return new ScheduleAnchor(user.createdAt(), null, null);
  }

  public static ScheduleAnchor forEnrollment(Instant enrolledAt, Instant lastSentAt) {
    return new ScheduleAnchor(null, enrolledAt, lastSentAt);
  }

  public Instant resolve(ScheduleStrategy strategy) {
    return switch (strategy) {
      case ABSOLUTE -> Objects.requireNonNull(signupAt, "signupAt is required for ABSOLUTE");
      case RELATIVE -> {
        if (lastSentAt != null) {
          yield lastSentAt;
        }
        yield Objects.requireNonNull(enrolledAt, "enrolledAt is required for RELATIVE");
      }
    };
  }
}
