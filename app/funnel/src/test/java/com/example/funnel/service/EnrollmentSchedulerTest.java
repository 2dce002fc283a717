/*
 * Where: Enrollment scheduler unit tests
 * What: Enrollment upsert, step advance, fixed backoff and completion
 * Why: A failed step must be retried in place and a finished sequence must complete exactly once
 */
package com.example.funnel.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.funnel.catalog.StepCatalog;
import com.example.funnel.config.ContentProperties;
import com.example.funnel.config.EnrollmentProperties;
import com.example.funnel.config.LedgerProperties;
import com.example.funnel.model.Enrollment;
import com.example.funnel.model.EnrollmentStatus;
import com.example.funnel.model.RetryPolicy;
import com.example.funnel.model.SendMeta;
import com.example.funnel.model.UserSnapshot;
import com.example.funnel.repository.EnrollmentRepository;
import com.example.funnel.repository.UserSnapshotRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ClassPathResource;

@ExtendWith(MockitoExtension.class)
class EnrollmentSchedulerTest {

  private static final Instant NOW = Instant.parse("2026-03-05T12:00:00Z");
  private static final Duration CLAIM_LEASE = Duration.ofMinutes(10);
  private static final UUID ENROLLMENT_ID = UUID.fromString("5b8f8a3e-0f4c-4d59-9f0e-0a7c1f0e4b21");
  private static final UserSnapshot ADA =
      new UserSnapshot(
          "u-1", "ada@example.com", "Ada", null, "free", NOW.minus(Duration.ofDays(2)), null);

  @Mock private EnrollmentRepository enrollmentRepository;
  @Mock private UserSnapshotRepository userSnapshotRepository;
  @Mock private BehaviorStateLookup behaviorStateLookup;
  @Mock private AutomationSettings automationSettings;

  private final RecordingEmailTransport transport = new RecordingEmailTransport();
  private final InMemorySendLedgerRepository ledgerTable = new InMemorySendLedgerRepository();
  private final MutableClock clock = new MutableClock(NOW);

  private EnrollmentScheduler scheduler(RetryPolicy retry) {
    return scheduler(retry, "catalog/two-steps.json");
  }

  private EnrollmentScheduler scheduler(RetryPolicy retry, String catalogPath) {
    final ObjectMapper objectMapper = new ObjectMapper();
    final FunnelMetrics metrics = new FunnelMetrics(new SimpleMeterRegistry());
    final ContentProperties content = new ContentProperties("https://app.example.com", null, null);
    final IdempotencyLedger ledger =
        new IdempotencyLedger(ledgerTable, new LedgerProperties(null), metrics);
    final CopyResolver copyResolver =
        new CopyResolver(
            (subject, body, context) -> {
              throw new CopyGenerationException(
                  CopyGenerationException.Reason.NOT_CONFIGURED, "disabled");
            },
            metrics);
    return new EnrollmentScheduler(
        StepCatalog.load(new ClassPathResource(catalogPath), objectMapper),
        enrollmentRepository,
        userSnapshotRepository,
        behaviorStateLookup,
        new TriggerEvaluator(behaviorStateLookup, clock),
        new DelayGate(),
        ledger,
        new StepDelivery(
            copyResolver, new EmailHtmlRenderer(content), transport, ledger, metrics, clock),
        new UserContextFactory(content),
        automationSettings,
        transport,
        new EnrollmentProperties(true, null, 50, 0, CLAIM_LEASE, retry),
        new PassExecution(metrics),
        metrics,
        objectMapper,
        clock);
  }

  private EnrollmentScheduler scheduler() {
    return scheduler(RetryPolicy.fixedUnbounded(Duration.ofMinutes(60)));
  }

  @Test
  void enrollSchedulesFirstStepRelativeToNow() {
    final EnrollmentScheduler scheduler = scheduler();
    final Enrollment stored = enrollment(0, 0, null);
    when(enrollmentRepository.insertIfAbsent(
            any(UUID.class), eq("u-1"), eq("funnel_short"), anyString(), any(), eq(NOW)))
        .thenReturn(true);
    when(enrollmentRepository.findByUserAndSequence("u-1", "funnel_short"))
        .thenReturn(Optional.of(stored));

    final Enrollment enrolled = scheduler.enroll("u-1", null, Map.of("cohort", "spring"));

    assertThat(enrolled).isSameAs(stored);
    final ArgumentCaptor<Instant> nextRunAt = ArgumentCaptor.forClass(Instant.class);
    final ArgumentCaptor<String> contextJson = ArgumentCaptor.forClass(String.class);
    verify(enrollmentRepository)
        .insertIfAbsent(
            any(UUID.class),
            eq("u-1"),
            eq("funnel_short"),
            contextJson.capture(),
            nextRunAt.capture(),
            eq(NOW));
    assertThat(nextRunAt.getValue()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
    assertThat(contextJson.getValue()).isEqualTo("{\"cohort\":\"spring\"}");
  }

  @Test
  void enrollingTwiceReturnsTheExistingEnrollment() {
    final EnrollmentScheduler scheduler = scheduler();
    final Enrollment existing = enrollment(1, 0, NOW.minus(Duration.ofHours(3)));
    when(enrollmentRepository.insertIfAbsent(any(), any(), any(), any(), any(), any()))
        .thenReturn(false);
    when(enrollmentRepository.findByUserAndSequence("u-1", "funnel_short"))
        .thenReturn(Optional.of(existing));

    assertThat(scheduler.enroll("u-1", "funnel_short", null)).isSameAs(existing);
  }

  @Test
  void enrollRejectsUnknownSequenceAndBlankUser() {
    final EnrollmentScheduler scheduler = scheduler();

    assertThatThrownBy(() -> scheduler.enroll("u-1", "other_sequence", Map.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("unknown sequence_key: other_sequence");
    assertThatThrownBy(() -> scheduler.enroll(" ", null, Map.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("user_id is required");
    verifyNoInteractions(enrollmentRepository);
  }

  @Test
  void successfulSendAdvancesAndSchedulesNextStepFromSendTime() {
    final EnrollmentScheduler scheduler = scheduler();
    claimSucceeds();
    when(userSnapshotRepository.findById("u-1")).thenReturn(Optional.of(ADA));
    when(enrollmentRepository.markAdvanced(
            ENROLLMENT_ID, 0, NOW, NOW.plus(Duration.ofMinutes(1440)), NOW))
        .thenReturn(1);

    final EnrollmentScheduler.StepOutcome outcome = scheduler.process(enrollment(0, 0, null));

    assertThat(outcome).isEqualTo(EnrollmentScheduler.StepOutcome.SENT);
    assertThat(transport.sent()).hasSize(1);
    assertThat(transport.sent().get(0).subject()).isEqualTo("Welcome, Ada");
    assertThat(transport.sent().get(0).text()).isEqualTo("Hi Ada,\n\nWelcome (spring).");
    assertThat(ledgerTable.exists("u-1", "s1_welcome")).isTrue();
  }

  @Test
  void failedSendIsRetriedAfterSixtyMinutesOnTheSameStep() {
    final EnrollmentScheduler scheduler = scheduler();
    claimSucceeds();
    transport.rejectWith("mailgun status 502: bad gateway");
    when(userSnapshotRepository.findById("u-1")).thenReturn(Optional.of(ADA));
    when(enrollmentRepository.markRetry(
            ENROLLMENT_ID,
            0,
            NOW.plus(Duration.ofMinutes(60)),
            "mailgun status 502: bad gateway",
            NOW))
        .thenReturn(1);

    final EnrollmentScheduler.StepOutcome outcome = scheduler.process(enrollment(0, 4, null));

    assertThat(outcome).isEqualTo(EnrollmentScheduler.StepOutcome.RETRIED);
    verify(enrollmentRepository, never()).markAdvanced(any(), anyInt(), any(), any(), any());
    assertThat(ledgerTable.all()).isEmpty();
  }

  @Test
  void missingUserIsRetriedNotSkipped() {
    final EnrollmentScheduler scheduler = scheduler();
    claimSucceeds();
    when(userSnapshotRepository.findById("u-1")).thenReturn(Optional.empty());
    when(enrollmentRepository.markRetry(
            ENROLLMENT_ID, 0, NOW.plus(Duration.ofMinutes(60)), "user profile not found", NOW))
        .thenReturn(1);

    assertThat(scheduler.process(enrollment(0, 0, null)))
        .isEqualTo(EnrollmentScheduler.StepOutcome.RETRIED);
  }

  @Test
  void exhaustedBoundedRetryMovesPastTheStep() {
    final EnrollmentScheduler scheduler =
        scheduler(
            new RetryPolicy(
                3, RetryPolicy.BackoffKind.FIXED, Duration.ofMinutes(60), null, 0, 0, 0));
    claimSucceeds();
    transport.rejectWith("mailgun status 500");
    when(userSnapshotRepository.findById("u-1")).thenReturn(Optional.of(ADA));
    final Instant enrolledAt = NOW.minus(Duration.ofHours(5));
    when(enrollmentRepository.markAdvanced(
            ENROLLMENT_ID, 0, null, enrolledAt.plus(Duration.ofMinutes(1440)), NOW))
        .thenReturn(1);

    final EnrollmentScheduler.StepOutcome outcome =
        scheduler.process(enrollment(0, 2, null, enrolledAt));

    assertThat(outcome).isEqualTo(EnrollmentScheduler.StepOutcome.ADVANCED);
    verify(enrollmentRepository, never()).markRetry(any(), anyInt(), any(), any(), any());
  }

  @Test
  void stepAlreadyInLedgerAdvancesWithoutSending() {
    final EnrollmentScheduler scheduler = scheduler();
    claimSucceeds();
    ledgerTable.insertIfAbsent(
        "u-1", "s1_welcome", NOW.minusSeconds(30), new SendMeta(null, null, null, null, null, null, null, null));
    final Instant enrolledAt = NOW.minus(Duration.ofHours(1));
    when(enrollmentRepository.markAdvanced(
            ENROLLMENT_ID, 0, null, enrolledAt.plus(Duration.ofMinutes(1440)), NOW))
        .thenReturn(1);

    assertThat(scheduler.process(enrollment(0, 0, null, enrolledAt)))
        .isEqualTo(EnrollmentScheduler.StepOutcome.ADVANCED);
    assertThat(transport.sent()).isEmpty();
    verifyNoInteractions(userSnapshotRepository);
  }

  @Test
  void lastStepSentSchedulesImmediateCompletion() {
    final EnrollmentScheduler scheduler = scheduler();
    claimSucceeds();
    when(userSnapshotRepository.findById("u-1")).thenReturn(Optional.of(ADA));
    when(enrollmentRepository.markAdvanced(ENROLLMENT_ID, 1, NOW, NOW, NOW)).thenReturn(1);

    assertThat(scheduler.process(enrollment(1, 0, NOW.minus(Duration.ofDays(1)))))
        .isEqualTo(EnrollmentScheduler.StepOutcome.SENT);
    assertThat(transport.sent().get(0).subject()).isEqualTo("Day one, Ada");
  }

  @Test
  void enrollmentPastTheLastStepIsCompleted() {
    final EnrollmentScheduler scheduler = scheduler();
    when(automationSettings.isEnabled()).thenReturn(true);
    when(enrollmentRepository.findDue(NOW, 50)).thenReturn(List.of(enrollment(2, 0, NOW)));
    when(enrollmentRepository.markCompleted(ENROLLMENT_ID, 2, NOW)).thenReturn(1);

    final EnrollmentRunReport report = scheduler.runOnce();

    assertThat(report.due()).isEqualTo(1);
    assertThat(report.completed()).isEqualTo(1);
    assertThat(report.sent()).isZero();
    assertThat(transport.sent()).isEmpty();
  }

  @Test
  void concurrentCompletionIsReportedAsConflict() {
    final EnrollmentScheduler scheduler = scheduler();
    when(enrollmentRepository.markCompleted(ENROLLMENT_ID, 2, NOW)).thenReturn(0);

    assertThat(scheduler.process(enrollment(2, 0, NOW)))
        .isEqualTo(EnrollmentScheduler.StepOutcome.CONFLICT);
  }

  @Test
  void ineligibleStepAdvancesWithoutSendingAndKeepsTheAnchor() {
    final EnrollmentScheduler scheduler =
        scheduler(RetryPolicy.fixedUnbounded(Duration.ofMinutes(60)), "catalog/nudge-steps.json");
    claimSucceeds();
    when(userSnapshotRepository.findById("u-1")).thenReturn(Optional.of(ADA));
    when(behaviorStateLookup.hasSmartLink("u-1")).thenReturn(true);
    final Instant enrolledAt = NOW.minus(Duration.ofHours(1));
    when(enrollmentRepository.markAdvanced(ENROLLMENT_ID, 0, null, NOW, NOW)).thenReturn(1);

    assertThat(scheduler.process(enrollment(0, 0, null, enrolledAt)))
        .isEqualTo(EnrollmentScheduler.StepOutcome.ADVANCED);
    assertThat(transport.sent()).isEmpty();
    assertThat(ledgerTable.all()).isEmpty();
  }

  @Test
  void enrollmentClaimedByAnotherCallerIsNotSent() {
    final EnrollmentScheduler scheduler = scheduler();
    when(enrollmentRepository.claim(ENROLLMENT_ID, 0, NOW, NOW.plus(CLAIM_LEASE), NOW))
        .thenReturn(0);

    assertThat(scheduler.process(enrollment(0, 0, null)))
        .isEqualTo(EnrollmentScheduler.StepOutcome.CONFLICT);
    assertThat(transport.sent()).isEmpty();
    assertThat(ledgerTable.all()).isEmpty();
    verifyNoInteractions(userSnapshotRepository);
    verify(enrollmentRepository, never()).markAdvanced(any(), anyInt(), any(), any(), any());
  }

  @Test
  void overlappingProcessingOfOneEnrollmentSendsOnce() {
    final EnrollmentScheduler scheduler = scheduler();
    final Enrollment polled = enrollment(0, 0, null);
    when(enrollmentRepository.claim(ENROLLMENT_ID, 0, NOW, NOW.plus(CLAIM_LEASE), NOW))
        .thenReturn(1, 0);
    when(userSnapshotRepository.findById("u-1")).thenReturn(Optional.of(ADA));
    when(enrollmentRepository.markAdvanced(
            ENROLLMENT_ID, 0, NOW, NOW.plus(Duration.ofMinutes(1440)), NOW))
        .thenReturn(1);

    final EnrollmentScheduler.StepOutcome first = scheduler.process(polled);
    final EnrollmentScheduler.StepOutcome second = scheduler.process(polled);

    assertThat(first).isEqualTo(EnrollmentScheduler.StepOutcome.SENT);
    assertThat(second).isEqualTo(EnrollmentScheduler.StepOutcome.CONFLICT);
    assertThat(transport.sent()).hasSize(1);
  }

  @Test
  void retryBackoffCountsFromTheFailureNotFromThePollTime() {
    final EnrollmentScheduler scheduler = scheduler();
    claimSucceeds();
    final Instant failedAt = NOW.plus(Duration.ofSeconds(20));
    transport.onSend(() -> clock.set(failedAt));
    transport.rejectWith("mailgun read timed out");
    when(userSnapshotRepository.findById("u-1")).thenReturn(Optional.of(ADA));
    when(enrollmentRepository.markRetry(
            ENROLLMENT_ID,
            0,
            failedAt.plus(Duration.ofMinutes(60)),
            "mailgun read timed out",
            failedAt))
        .thenReturn(1);

    assertThat(scheduler.process(enrollment(0, 0, null)))
        .isEqualTo(EnrollmentScheduler.StepOutcome.RETRIED);
  }

  @Test
  void disabledAutomationPollsNothing() {
    final EnrollmentScheduler scheduler = scheduler();
    when(automationSettings.isEnabled()).thenReturn(false);

    final EnrollmentRunReport report = scheduler.runOnce();

    assertThat(report.enabled()).isFalse();
    verifyNoInteractions(enrollmentRepository);
  }

  @Test
  void missingTransportSettingsPollNothing() {
    final EnrollmentScheduler scheduler = scheduler();
    when(automationSettings.isEnabled()).thenReturn(true);
    transport.missing(List.of("funnel.transport.api-key"));

    final EnrollmentRunReport report = scheduler.runOnce();

    assertThat(report.configured()).isFalse();
    verifyNoInteractions(enrollmentRepository);
  }

  private void claimSucceeds() {
    when(enrollmentRepository.claim(
            eq(ENROLLMENT_ID), anyInt(), eq(NOW), eq(NOW.plus(CLAIM_LEASE)), eq(NOW)))
        .thenReturn(1);
  }

  private Enrollment enrollment(int currentStep, int stepAttempts, Instant lastSentAt) {
    return enrollment(currentStep, stepAttempts, lastSentAt, NOW.minus(Duration.ofHours(1)));
  }

  private Enrollment enrollment(
      int currentStep, int stepAttempts, Instant lastSentAt, Instant createdAt) {
    return new Enrollment(
        ENROLLMENT_ID,
        "u-1",
        "funnel_short",
        currentStep,
        stepAttempts,
        EnrollmentStatus.ACTIVE,
        NOW,
        "{\"cohort\":\"spring\"}",
        createdAt,
        createdAt,
        lastSentAt,
        null);
  }
}
