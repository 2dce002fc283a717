/*
 * Where: Funnel service layer
 * What: Direct per-step pathway; evaluates every catalog step for every recent signup
 * Why: Steps are anchored on signup time, so a user who fell behind can get several steps in one pass
 */
package com.example.funnel.service;

import com.example.funnel.catalog.StepCatalog;
import com.example.funnel.config.AutomationProperties;
import com.example.funnel.model.EmailStep;
import com.example.funnel.model.ScheduleAnchor;
import com.example.funnel.model.ScheduleStrategy;
import com.example.funnel.model.UserSnapshot;
import com.example.funnel.repository.UserSnapshotRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AutomationStepRunner {

  private static final Logger logger = LoggerFactory.getLogger(AutomationStepRunner.class);
  static final String PASS = "automation";

  private final StepCatalog catalog;
  private final UserSnapshotRepository userSnapshotRepository;
  private final BehaviorStateLookup behaviorStateLookup;
  private final TriggerEvaluator triggerEvaluator;
  private final DelayGate delayGate;
  private final IdempotencyLedger ledger;
  private final StepDelivery stepDelivery;
  private final UserContextFactory userContextFactory;
  private final AutomationSettings automationSettings;
  private final EmailTransport transport;
  private final AutomationProperties properties;
  private final PassExecution passExecution;
  private final FunnelMetrics metrics;
  private final Clock clock;

  public AutomationRunReport runOnce() {
    return passExecution.run(PASS, this::runPass, AutomationRunReport::busyReport);
  }

  private AutomationRunReport runPass() {
    if (!automationSettings.isEnabled()) {
      logger.info("automation pass skipped because email automation is disabled");
      return AutomationRunReport.disabled();
    }
    final List<String> missing = transport.missingConfiguration();
    if (!missing.isEmpty()) {
      logger.error("automation pass skipped because transport is not configured missing={}", missing);
      return AutomationRunReport.notConfigured();
    }
    final Instant now = clock.instant();
    final Tally tally = new Tally();
    Instant afterCreatedAt = now.minus(properties.candidateWindow());
    String afterId = "";
    while (true) {
      final List<UserSnapshot> page =
          userSnapshotRepository.findCandidatesPage(
              afterCreatedAt, afterId, properties.userPageSize());
      for (UserSnapshot user : page) {
        tally.users++;
        processUser(user, now, tally);
      }
      if (page.size() < properties.userPageSize()) {
        break;
      }
      final UserSnapshot last = page.get(page.size() - 1);
      afterCreatedAt = last.createdAt();
      afterId = last.id();
    }
    logger.info(
        "automation pass finished users={} sent={} skipped={} failed={}",
        tally.users,
        tally.sent,
        tally.skipped,
        tally.failed);
    return new AutomationRunReport(
        true, true, tally.users, tally.sent, tally.skipped, tally.failed, false);
  }

  private void processUser(UserSnapshot user, Instant now, Tally tally) {
    final CachedBehaviorState state = new CachedBehaviorState(user, behaviorStateLookup);
    final ScheduleAnchor anchor = ScheduleAnchor.forUser(user);
    Map<String, String> context = null;
    for (EmailStep step : catalog.steps()) {
      try {
        if (ledger.hasSent(user.id(), step.key())) {
          continue;
        }
        if (!triggerEvaluator.evaluate(user, step, state, now)) {
          continue;
        }
        if (!delayGate.isDue(ScheduleStrategy.ABSOLUTE, anchor, step, now)) {
          continue;
        }
        if (context == null) {
          context = userContextFactory.forUser(user);
        }
        final DeliveryResult result =
            stepDelivery.deliver(user, step, ScheduleStrategy.ABSOLUTE, context);
        if (result.sent()) {
          tally.sent++;
        } else {
          tally.failed++;
        }
      } catch (TriggerEvaluationException ex) {
        tally.skipped++;
        metrics.recordTriggerError();
        logger.warn(
            "step skipped because trigger could not be evaluated userId={} stepKey={} message={}",
            user.id(),
            step.key(),
            ex.getMessage());
      } catch (FunnelConfigurationException | DataAccessException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        tally.failed++;
        logger.warn("step failed userId={} stepKey={}", user.id(), step.key(), ex);
      }
    }
  }

  private static final class Tally {
    private int users;
    private int sent;
    private int skipped;
    private int failed;
  }
}
