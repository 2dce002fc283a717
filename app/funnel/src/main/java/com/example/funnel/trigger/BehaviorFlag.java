/*
 * Where: Funnel trigger model
 * What: Behavioral facts a compound trigger can test
 * Why: Each flag maps to one on-demand lookup, or to the plan field of the snapshot
 */
package com.example.funnel.trigger;

public enum BehaviorFlag {
  HAS_SMART_LINK,
  HAS_USED_AI,
  HAS_CALENDAR_CONNECTED,
  HAS_AD_CAMPAIGN,
  /** Derived from {@code UserSnapshot.plan}; never queried. */
  ON_PAID_PLAN
}
