/*
 * Where: Funnel job worker
 * What: Drains due email jobs on a schedule
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
@ConditionalOnProperty(name = "funnel.jobs.enabled", havingValue = "true", matchIfMissing = true)
public class EmailJobWorker {

  private static final Logger logger = LoggerFactory.getLogger(EmailJobWorker.class);

  private final EmailJobRunner emailJobRunner;

  @Scheduled(
      initialDelayString = "${funnel.jobs.initial-delay:PT30S}",
      fixedDelayString = "${funnel.jobs.poll-interval:PT5M}")
  public void run() {
    try {
      emailJobRunner.runOnce();
    } catch (RuntimeException ex) {
      logger.error("jobs pass aborted", ex);
    }
  }
}
