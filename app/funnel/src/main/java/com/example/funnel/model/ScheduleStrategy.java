package com.example.funnel.model;

/** Which timestamp a step's delay is measured from. */
public enum ScheduleStrategy {
  /** Delay counts from signup. */
  ABSOLUTE,
  /** Delay counts from the previous send, or from enrollment for the first step. */
  RELATIVE
}
