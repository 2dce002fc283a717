/*
 * Where: Funnel service layer
 * What: Relative pathway; walks each enrollment through the catalog one step at a time
 * Why: Every step is anchored on the previous send, and a failed step is retried rather than skipped
 */
package com.example.funnel.service;

import com.example.funnel.catalog.StepCatalog;
import com.example.funnel.config.EnrollmentProperties;
import com.example.funnel.model.EmailStep;
import com.example.funnel.model.Enrollment;
import com.example.funnel.model.RetryPolicy;
import com.example.funnel.model.ScheduleAnchor;
import com.example.funnel.model.ScheduleStrategy;
import com.example.funnel.model.UserSnapshot;
import com.example.funnel.repository.EnrollmentRepository;
import com.example.funnel.repository.UserSnapshotRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EnrollmentScheduler {

  private static final Logger logger = LoggerFactory.getLogger(EnrollmentScheduler.class);
  static final String PASS = "enrollments";
  private static final TypeReference<Map<String, String>> CONTEXT_TYPE = new TypeReference<>() {};

  enum StepOutcome {
    SENT,
    ADVANCED,
    COMPLETED,
    RETRIED,
    CONFLICT
  }

  private final StepCatalog catalog;
  private final EnrollmentRepository enrollmentRepository;
  private final UserSnapshotRepository userSnapshotRepository;
  private final BehaviorStateLookup behaviorStateLookup;
  private final TriggerEvaluator triggerEvaluator;
  private final DelayGate delayGate;
  private final IdempotencyLedger ledger;
  private final StepDelivery stepDelivery;
  private final UserContextFactory userContextFactory;
  private final AutomationSettings automationSettings;
  private final EmailTransport transport;
  private final EnrollmentProperties properties;
  private final PassExecution passExecution;
  private final FunnelMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Creates an ACTIVE enrollment, or returns the existing one untouched.
   *
   * @param sequenceKey null selects the catalog's sequence
   * @throws IllegalArgumentException for a blank user id or an unknown sequence
   */
  public Enrollment enroll(String userId, String sequenceKey, Map<String, String> context) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("user_id is required");
    }
    final String key = sequenceKey == null || sequenceKey.isBlank() ? catalog.sequenceKey() : sequenceKey;
    if (!catalog.sequenceKey().equals(key)) {
      throw new IllegalArgumentException("unknown sequence_key: " + key);
    }
    final Instant now = clock.instant();
    final EmailStep first =
        catalog.stepAt(1).orElseThrow(() -> new IllegalStateException("catalog is empty"));
    final ScheduleAnchor anchor = ScheduleAnchor.forEnrollment(now, null);
    final boolean created =
        enrollmentRepository.insertIfAbsent(
            UUID.randomUUID(),
            userId,
            key,
            writeContext(context == null ? Map.of() : context),
            delayGate.dueAt(ScheduleStrategy.RELATIVE, anchor, first),
            now);
    final Enrollment enrollment =
        enrollmentRepository
            .findByUserAndSequence(userId, key)
            .orElseThrow(() -> new IllegalStateException("enrollment vanished after upsert"));
    if (created) {
      logger.info(
          "enrollment created id={} userId={} sequenceKey={} nextRunAt={}",
          enrollment.id(),
          userId,
          key,
          enrollment.nextRunAt());
    } else {
      logger.info(
          "enrollment already exists id={} userId={} status={}",
          enrollment.id(),
          userId,
          enrollment.status());
    }
    return enrollment;
  }

  public EnrollmentRunReport runOnce() {
    return passExecution.run(
        PASS, () -> runPass(properties.batchSize()), EnrollmentRunReport::busyReport);
  }

  private EnrollmentRunReport runPass(int limit) {
    if (!automationSettings.isEnabled()) {
      logger.info("enrollment pass skipped because email automation is disabled");
      return EnrollmentRunReport.disabled();
    }
    final List<String> missing = transport.missingConfiguration();
    if (!missing.isEmpty()) {
      logger.error("enrollment pass skipped because transport is not configured missing={}", missing);
      return EnrollmentRunReport.notConfigured();
    }
    return pollDue(limit);
  }

  /** Processes ACTIVE enrollments whose next run is due, oldest first. */
  public EnrollmentRunReport pollDue(int limit) {
    final List<Enrollment> due = enrollmentRepository.findDue(clock.instant(), limit);
    int sent = 0;
    int advanced = 0;
    int completed = 0;
    int retried = 0;
    int conflicts = 0;
    for (Enrollment enrollment : due) {
      switch (process(enrollment)) {
        case SENT -> sent++;
        case ADVANCED -> advanced++;
        case COMPLETED -> completed++;
        case RETRIED -> retried++;
        case CONFLICT -> conflicts++;
      }
    }
    logger.info(
        "enrollment pass finished due={} sent={} advanced={} completed={} retried={} conflicts={}",
        due.size(),
        sent,
        advanced,
        completed,
        retried,
        conflicts);
    return new EnrollmentRunReport(
        true, true, due.size(), sent, advanced, completed, retried, conflicts, false);
  }

  @VisibleForTesting
  StepOutcome process(Enrollment enrollment) {
    final Instant now = clock.instant();
    final Optional<EmailStep> next = catalog.stepAt(enrollment.nextStepPosition());
    if (next.isEmpty()) {
      final int updated =
          enrollmentRepository.markCompleted(enrollment.id(), enrollment.currentStep(), now);
      if (updated == 0) {
        return StepOutcome.CONFLICT;
      }
      logger.info(
          "enrollment completed id={} userId={} steps={}",
          enrollment.id(),
          enrollment.userId(),
          enrollment.currentStep());
      return StepOutcome.COMPLETED;
    }
    final EmailStep step = next.get();
    final int claimed =
        enrollmentRepository.claim(
            enrollment.id(),
            enrollment.currentStep(),
            enrollment.nextRunAt(),
            now.plus(properties.claimLease()),
            now);
    if (claimed == 0) {
      logger.info(
          "enrollment step already claimed elsewhere id={} stepKey={}", enrollment.id(), step.key());
      return StepOutcome.CONFLICT;
    }
    if (ledger.hasSent(enrollment.userId(), step.key())) {
      logger.info(
          "enrollment step already sent, advancing id={} stepKey={}", enrollment.id(), step.key());
      return advance(enrollment, step, null, now, StepOutcome.ADVANCED);
    }
    final Optional<UserSnapshot> user = userSnapshotRepository.findById(enrollment.userId());
    if (user.isEmpty()) {
      return retry(enrollment, step, "user profile not found");
    }
    if (!user.get().hasEmail()) {
      return retry(enrollment, step, "user has no email address");
    }
    try {
      final CachedBehaviorState state = new CachedBehaviorState(user.get(), behaviorStateLookup);
      if (!triggerEvaluator.evaluate(user.get(), step, state, now)) {
        logger.info(
            "enrollment step not eligible, advancing id={} stepKey={}", enrollment.id(), step.key());
        return advance(enrollment, step, null, now, StepOutcome.ADVANCED);
      }
    } catch (TriggerEvaluationException ex) {
      metrics.recordTriggerError();
      return retry(enrollment, step, ex.getMessage());
    }
    final DeliveryResult result;
    try {
      result =
          stepDelivery.deliver(
              user.get(),
              step,
              ScheduleStrategy.RELATIVE,
              userContextFactory.forUser(user.get(), readContext(enrollment)));
    } catch (FunnelConfigurationException | DataAccessException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("enrollment step failed id={} stepKey={}", enrollment.id(), step.key(), ex);
      return retry(enrollment, step, describe(ex));
    }
    if (!result.sent()) {
      return retry(enrollment, step, result.error());
    }
    return advance(enrollment, step, clock.instant(), now, StepOutcome.SENT);
  }

  /**
   * Moves past {@code step}. The following step is anchored on {@code sentAt}, or on the previous
   * send when nothing was sent. Without a following step the next poll completes the enrollment.
   */
  private StepOutcome advance(
      Enrollment enrollment, EmailStep step, Instant sentAt, Instant now, StepOutcome outcome) {
    final Instant anchorSentAt = sentAt == null ? enrollment.lastSentAt() : sentAt;
    final ScheduleAnchor anchor = ScheduleAnchor.forEnrollment(enrollment.createdAt(), anchorSentAt);
    final Instant nextRunAt =
        catalog
            .stepAt(step.position() + 1)
            .map(following -> delayGate.dueAt(ScheduleStrategy.RELATIVE, anchor, following))
            .orElse(now);
    final int updated =
        enrollmentRepository.markAdvanced(
            enrollment.id(), enrollment.currentStep(), sentAt, nextRunAt, now);
    if (updated == 0) {
      logger.warn("enrollment advance lost a race id={} stepKey={}", enrollment.id(), step.key());
      return StepOutcome.CONFLICT;
    }
    return outcome;
  }

  /** Backoff counts from the moment the failure is known, after any time spent in the transport. */
  private StepOutcome retry(Enrollment enrollment, EmailStep step, String error) {
    final Instant failedAt = clock.instant();
    final RetryPolicy.RetryDecision decision =
        properties.retry().onFailure(enrollment.stepAttempts() + 1, failedAt);
    if (!decision.retry()) {
      logger.warn(
          "enrollment step gave up after attempts={} id={} stepKey={} error={}",
          enrollment.stepAttempts() + 1,
          enrollment.id(),
          step.key(),
          error);
      return advance(enrollment, step, null, failedAt, StepOutcome.ADVANCED);
    }
    final int updated =
        enrollmentRepository.markRetry(
            enrollment.id(),
            enrollment.currentStep(),
            decision.nextAttemptAt(),
            truncateError(error),
            failedAt);
    if (updated == 0) {
      return StepOutcome.CONFLICT;
    }
    logger.warn(
        "enrollment step retry scheduled id={} stepKey={} nextRunAt={} error={}",
        enrollment.id(),
        step.key(),
        decision.nextAttemptAt(),
        error);
    return StepOutcome.RETRIED;
  }

  private Map<String, String> readContext(Enrollment enrollment) {
    if (enrollment.contextJson() == null || enrollment.contextJson().isBlank()) {
      return Map.of();
    }
    try {
      final Map<String, String> context = objectMapper.readValue(enrollment.contextJson(), CONTEXT_TYPE);
      return context == null ? Map.of() : context;
    } catch (JsonProcessingException ex) {
      logger.warn("enrollment context ignored because it is not a string map id={}", enrollment.id());
      return Map.of();
    }
  }

  private String writeContext(Map<String, String> context) {
    try {
      return objectMapper.writeValueAsString(context);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("context is not serializable", ex);
    }
  }

  private String describe(RuntimeException ex) {
    return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }
}
