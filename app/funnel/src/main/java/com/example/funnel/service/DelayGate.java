/*
 * Where: Funnel service layer
 * What: Computes when a step becomes due under an anchoring strategy
 * Why: Absolute and relative scheduling differ only in the anchor, so one gate serves both
 */
package com.example.funnel.service;

import com.example.funnel.model.EmailStep;
import com.example.funnel.model.ScheduleAnchor;
import com.example.funnel.model.ScheduleStrategy;
import java.time.Instant;
import org.springframework.stereotype.Component;

@Component
public class DelayGate {

  public Instant dueAt(ScheduleStrategy strategy, ScheduleAnchor anchor, EmailStep step) {
    return anchor.resolve(strategy).plus(step.delay());
  }

  public boolean isDue(
      ScheduleStrategy strategy, ScheduleAnchor anchor, EmailStep step, Instant now) {
    return !now.isBefore(dueAt(strategy, anchor, step));
  }
}
