/*
 * Where: Funnel enrollment worker
 * What: Advances due enrollments on a schedule
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
@ConditionalOnProperty(name = "funnel.enrollment.enabled", havingValue = "true", matchIfMissing = true)
public class EnrollmentWorker {

  private static final Logger logger = LoggerFactory.getLogger(EnrollmentWorker.class);

  private final EnrollmentScheduler enrollmentScheduler;

  @Scheduled(
      initialDelayString = "${funnel.enrollment.initial-delay:PT30S}",
      fixedDelayString = "${funnel.enrollment.poll-interval:PT5M}")
  public void run() {
    try {
      enrollmentScheduler.runOnce();
    } catch (RuntimeException ex) {
      logger.error("enrollments pass aborted", ex);
    }
  }
}
