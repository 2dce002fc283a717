/*
 * Where: Funnel domain model
 * What: Read-only view of a user for one evaluation pass
 * Why: Triggers and copy must see the same user state for every step in the pass
 */
package com.example.funnel.model;

import java.time.Instant;
import java.util.Locale;

public record UserSnapshot(
    String id,
    String email,
    String firstName,
    String fullName,
    String plan,
    Instant createdAt,
    Instant lastLoginAt) {

  public static final String FREE_PLAN = "free";
  private static final String DEFAULT_FIRST_NAME = "there";

  public String displayFirstName() {
    if (firstName != null && !firstName.isBlank()) {
      return firstName.trim();
    }
    if (fullName != null && !fullName.isBlank()) {
      return fullName.trim().split("\\s+")[0];
    }
    return DEFAULT_FIRST_NAME;
  }

  public Instant lastActivityAt() {
    return lastLoginAt == null ? createdAt : lastLoginAt;
  }

  public boolean onPaidPlan() {
    return plan != null && !plan.isBlank() && !FREE_PLAN.equals(plan.trim().toLowerCase(Locale.ROOT));
  }

  public boolean hasEmail() {
    return email != null && !email.isBlank();
  }
}
