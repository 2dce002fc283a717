package com.example.funnel.trigger;

public enum TriggerKind {
  ALWAYS_TRUE,
  ELAPSED_DAYS,
  COMPOUND_NEGATIVE,
  COMPOUND_POSITIVE,
  INACTIVITY_DAYS,
  UNRECOGNIZED
}
