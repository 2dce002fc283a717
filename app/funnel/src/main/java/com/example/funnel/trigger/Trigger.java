/*
 * Where: Funnel trigger model
 * What: Closed set of trigger descriptors a step can carry
 * Why: Evaluation switches over TriggerKind, so a new kind fails compilation until it is handled
 */
package com.example.funnel.trigger;

import java.time.Duration;
import java.util.Objects;

public sealed interface Trigger
    permits Trigger.AlwaysTrue,
        Trigger.ElapsedDays,
        Trigger.CompoundNegative,
        Trigger.CompoundPositive,
        Trigger.InactivityDays,
        Trigger.Unrecognized {

  TriggerKind kind();

  record AlwaysTrue() implements Trigger {
    @Override
    public TriggerKind kind() {
      return TriggerKind.ALWAYS_TRUE;
    }
  }

  /** Signup happened at least {@code days} days ago. */
  record ElapsedDays(int days) implements Trigger {
    public ElapsedDays {
      if (days < 0) {
        throw new IllegalArgumentException("days must be >= 0");
      }
    }

    public Duration duration() {
      return Duration.ofDays(days);
    }

    @Override
    public TriggerKind kind() {
      return TriggerKind.ELAPSED_DAYS;
    }
  }

  /** Elapsed AND the flag is NOT set. */
  record CompoundNegative(ElapsedDays elapsed, BehaviorFlag flag) implements Trigger {
    public CompoundNegative {
      Objects.requireNonNull(elapsed, "elapsed");
      Objects.requireNonNull(flag, "flag");
    }

    @Override
    public TriggerKind kind() {
      return TriggerKind.COMPOUND_NEGATIVE;
    }
  }

  /** Elapsed AND the flag IS set. */
  record CompoundPositive(ElapsedDays elapsed, BehaviorFlag flag) implements Trigger {
    public CompoundPositive {
      Objects.requireNonNull(elapsed, "elapsed");
      Objects.requireNonNull(flag, "flag");
    }

    @Override
    public TriggerKind kind() {
      return TriggerKind.COMPOUND_POSITIVE;
    }
  }

  /** Last login (or signup when the user never logged in) is at least {@code days} days ago. */
  record InactivityDays(int days) implements Trigger {
    public InactivityDays {
      if (days < 0) {
        throw new IllegalArgumentException("days must be >= 0");
      }
    }

    public Duration duration() {
      return Duration.ofDays(days);
    }

    @Override
    public TriggerKind kind() {
      return TriggerKind.INACTIVITY_DAYS;
    }
  }

  /** A descriptor string the parser could not map; evaluating it is an error. */
  record Unrecognized(String descriptor) implements Trigger {
    @Override
    public TriggerKind kind() {
      return TriggerKind.UNRECOGNIZED;
    }
  }
}
