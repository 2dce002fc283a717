/*
 * Where: Funnel domain model
 * What: One catalog entry of the funnel
 * Why: Trigger, delay, prompts and fallback copy travel together through every pass
 */
package com.example.funnel.model;

import com.example.funnel.trigger.Trigger;
import java.time.Duration;

public record EmailStep(
    String key,
    int position,
    int dayOffset,
    Phase phase,
    String triggerKey,
    Trigger trigger,
    int delayMinutes,
    String subjectPrompt,
    String bodyPrompt,
    String fallbackSubject,
    String fallbackBody,
    String ctaPath,
    String offerTag,
    String couponCode) {

  public Duration delay() {
    return Duration.ofMinutes(delayMinutes);
  }

  public boolean hasCta() {
    return ctaPath != null && !ctaPath.isBlank();
  }
}
