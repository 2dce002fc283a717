package com.example.funnel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SendMeta(
    String phase,
    String trigger,
    Integer delayMinutes,
    String offerTag,
    String couponCode,
    ScheduleStrategy strategy,
    CopySource copySource,
    String providerMessageId) {

  public static SendMeta of(
      EmailStep step, ScheduleStrategy strategy, CopySource copySource, String providerMessageId) {
    return new SendMeta(
        step.phase().value(),
        step.triggerKey(),
        step.delayMinutes(),
        step.offerTag(),
        step.couponCode(),
        strategy,
        copySource,
        providerMessageId);
  }
}
