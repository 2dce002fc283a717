/*
 * Where: Funnel automation worker
 * What: Runs the per-step automation pass on a schedule
 * Why: A failed pass is logged and the next tick starts from a clean poll
 */
package com.example.funnel.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "funnel.automation.enabled", havingValue = "true", matchIfMissing = true)
public class AutomationStepWorker {

  private static final Logger logger = LoggerFactory.getLogger(AutomationStepWorker.class);

  private final AutomationStepRunner automationStepRunner;

  @Scheduled(
      initialDelayString = "${funnel.automation.initial-delay:PT30S}",
      fixedDelayString = "${funnel.automation.poll-interval:PT5M}")
  public void run() {
    try {
      automationStepRunner.runOnce();
    } catch (RuntimeException ex) {
      logger.error("automation pass aborted", ex);
    }
  }
}
