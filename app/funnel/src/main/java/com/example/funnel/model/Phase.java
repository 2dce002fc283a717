/*
 * Where: Funnel domain model
 * What: Coarse funnel stage a step belongs to
 * Why: Offers and copy tone change as the user moves through the 30 days
 */
package com.example.funnel.model;

import java.util.Locale;

public enum Phase {
  ACTIVATION,
  VALUE,
  UPSELL,
  URGENCY;

  public static Phase forDayOffset(int dayOffset) {
    if (dayOffset <= 6) {
      return ACTIVATION;
    }
    if (dayOffset <= 14) {
      return VALUE;
    }
    if (dayOffset <= 24) {
      return UPSELL;
    }
    return URGENCY;
  }

  public static Phase fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("phase is required");
    }
    return Phase.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
