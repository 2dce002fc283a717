/*
 * Where: Funnel service layer
 * What: Decides whether a step's trigger holds for a user at a given instant
 * Why: Both pathways share one evaluation, and an unknown trigger surfaces as an error
 */
package com.example.funnel.service;

import com.example.funnel.model.EmailStep;
import com.example.funnel.model.UserSnapshot;
import com.example.funnel.trigger.BehaviorFlag;
import com.example.funnel.trigger.Trigger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TriggerEvaluator {

  private final BehaviorStateLookup behaviorStateLookup;
  private final Clock clock;

  public boolean evaluate(UserSnapshot user, EmailStep step) {
    return evaluate(user, step, new CachedBehaviorState(user, behaviorStateLookup), clock.instant());
  }

  /**
   * @throws TriggerEvaluationException when the trigger is unrecognized or a flag lookup fails
   */
  public boolean evaluate(
      UserSnapshot user, EmailStep step, CachedBehaviorState state, Instant now) {
    final Trigger trigger = step.trigger();
    if (trigger == null) {
      throw new TriggerEvaluationException(step.key(), "step has no trigger");
    }
    return switch (trigger.kind()) {
      case ALWAYS_TRUE -> true;
      case ELAPSED_DAYS -> elapsed(user, (Trigger.ElapsedDays) trigger, now);
      case COMPOUND_NEGATIVE -> {
        final Trigger.CompoundNegative compound = (Trigger.CompoundNegative) trigger;
        yield elapsed(user, compound.elapsed(), now) && !flag(step, state, compound.flag());
      }
      case COMPOUND_POSITIVE -> {
        final Trigger.CompoundPositive compound = (Trigger.CompoundPositive) trigger;
        yield elapsed(user, compound.elapsed(), now) && flag(step, state, compound.flag());
      }
      case INACTIVITY_DAYS ->
          reached(user.lastActivityAt(), ((Trigger.InactivityDays) trigger).duration(), now);
      case UNRECOGNIZED ->
          throw new TriggerEvaluationException(
              step.key(),
              "unrecognized trigger '" + ((Trigger.Unrecognized) trigger).descriptor() + "'");
    };
  }

  private boolean elapsed(UserSnapshot user, Trigger.ElapsedDays elapsed, Instant now) {
    return reached(user.createdAt(), elapsed.duration(), now);
  }

  private boolean reached(Instant anchor, Duration duration, Instant now) {
    return !now.isBefore(anchor.plus(duration));
  }

  private boolean flag(EmailStep step, CachedBehaviorState state, BehaviorFlag flag) {
    try {
      return state.isSet(flag);
    } catch (RuntimeException ex) {
      throw new TriggerEvaluationException(step.key(), "behavior lookup failed flag=" + flag, ex);
    }
  }
}
