/*
 * Where: Funnel service layer
 * What: Queues ad-hoc messages and drains the email_jobs table
 * Why: Claiming is a single conditional UPDATE, so the transport call never runs inside a long transaction
 */
package com.example.funnel.service;

import com.example.funnel.config.JobQueueProperties;
import com.example.funnel.model.EmailJob;
import com.example.funnel.model.EmailJobPayload;
import com.example.funnel.model.OutgoingEmail;
import com.example.funnel.model.RetryPolicy;
import com.example.funnel.model.TransportResult;
import com.example.funnel.repository.EmailJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EmailJobRunner {

  private static final Logger logger = LoggerFactory.getLogger(EmailJobRunner.class);
  static final String PASS = "jobs";
  static final String LEASE_EXPIRED = "lease expired";
  private static final String PATHWAY = "job";
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  public enum SendOutcome {
    SENT,
    FAILED,
    RETRY_SCHEDULED,
    RELEASED,
    LOCK_LOST
  }

  private final EmailJobRepository emailJobRepository;
  private final EmailTransport transport;
  private final EmailHtmlRenderer htmlRenderer;
  private final UserContextFactory userContextFactory;
  private final AutomationSettings automationSettings;
  private final JobQueueProperties properties;
  private final PassExecution passExecution;
  private final FunnelMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Renders placeholders and stores the job as PENDING.
   *
   * @throws IllegalArgumentException when recipient, template key, subject or text is missing
   */
  public UUID enqueue(NewEmailJob request) {
    requireText(request.toEmail(), "to_email");
    if (request.toEmail().indexOf('@') <= 0) {
      throw new IllegalArgumentException("to_email is not an email address");
    }
    requireText(request.templateKey(), "template_key");
    requireText(request.subject(), "subject");
    requireText(request.text(), "text");

    final Map<String, String> variables = new HashMap<>(userContextFactory.siteDefaults());
    variables.putAll(request.variables());
    final String subject = TemplateRenderer.render(request.subject(), variables);
    final String text = TemplateRenderer.render(request.text(), variables);
    final String html =
        request.html() == null || request.html().isBlank()
            ? htmlRenderer.render(subject, text)
            : TemplateRenderer.render(request.html(), variables);

    final Instant now = clock.instant();
    final EmailJob job =
        EmailJob.pending(
            UUID.randomUUID(),
            request.userId(),
            request.toEmail().trim(),
            request.templateKey(),
            subject,
            writePayload(new EmailJobPayload(text, html)),
            properties.retry().maxAttempts(),
            request.scheduledAt() == null ? now : request.scheduledAt(),
            now);
    final UUID id = emailJobRepository.insert(job);
    logger.info(
        "email job queued id={} templateKey={} to={} scheduledAt={}",
        id,
        job.templateKey(),
        EmailAddresses.mask(job.toEmail()),
        job.scheduledAt());
    return id;
  }

  public JobRunReport runOnce() {
    return passExecution.run(PASS, this::runPass, JobRunReport::busyReport);
  }

  private JobRunReport runPass() {
    if (!automationSettings.isEnabled()) {
      logger.info("job pass skipped because email automation is disabled");
      return JobRunReport.disabled();
    }
    final List<String> missing = transport.missingConfiguration();
    if (!missing.isEmpty()) {
      final int pending = emailJobRepository.countPending();
      metrics.updateJobsBacklog(pending);
      logger.error(
          "job pass skipped because transport is not configured missing={} pending={}",
          missing,
          pending);
      return JobRunReport.notConfigured(pending);
    }
    final Instant now = clock.instant();
    final int expired = emailJobRepository.failExpiredLeases(now, LEASE_EXPIRED);
    if (expired > 0) {
      logger.warn("email jobs failed after lease expiry count={}", expired);
    }
    metrics.updateJobsBacklog(emailJobRepository.countPending());

    final List<EmailJob> claimed = claimBatch(properties.batchSize());
    int sent = 0;
    int failed = 0;
    int retried = 0;
    int released = 0;
    for (EmailJob job : claimed) {
      switch (send(job)) {
        case SENT -> sent++;
        case FAILED -> failed++;
        case RETRY_SCHEDULED -> retried++;
        case RELEASED -> released++;
        case LOCK_LOST -> logger.warn("email job lock lost id={}", job.id());
      }
    }
    logger.info(
        "job pass finished claimed={} sent={} failed={} retried={} released={} expired={}",
        claimed.size(),
        sent,
        failed,
        retried,
        released,
        expired);
    return new JobRunReport(true, true, claimed.size(), sent, failed, retried, released, expired, false);
  }

  /** Moves up to {@code limit} due PENDING jobs to SENDING under this host's lease. */
  public List<EmailJob> claimBatch(int limit) {
    final Instant now = clock.instant();
    final List<EmailJob> claimed =
        emailJobRepository.claimPending(
            limit, now, now.plus(properties.lease()), resolveLockedBy());
    metrics.recordJobsClaimed(claimed.size());
    return claimed;
  }

  /** Sends a job previously returned by {@link #claimBatch(int)}. */
  public SendOutcome send(EmailJob job) {
    final String lockedBy = job.lockedBy();
    final TransportResult result;
    try {
      final EmailJobPayload payload = readPayload(job.payloadJson());
      result =
          transport.send(
              new OutgoingEmail(job.toEmail(), job.subject(), payload.text(), payload.html()));
    } catch (FunnelConfigurationException ex) {
      logger.error("email job released because transport is not configured id={}", job.id(), ex);
      emailJobRepository.release(job.id(), lockedBy);
      return SendOutcome.RELEASED;
    } catch (RuntimeException ex) {
      return handleFailure(job, describe(ex), lockedBy);
    }
    if (!result.success()) {
      return handleFailure(job, result.error(), lockedBy);
    }
    final int updated =
        emailJobRepository.markSent(job.id(), clock.instant(), result.id(), lockedBy);
    if (updated == 0) {
      logger.warn("email job sent but lock was lost id={}", job.id());
      metrics.recordSend(PATHWAY, "sent");
      return SendOutcome.LOCK_LOST;
    }
    logger.info(
        "email job sent id={} templateKey={} providerMessageId={}",
        job.id(),
        job.templateKey(),
        result.id());
    metrics.recordSend(PATHWAY, "sent");
    return SendOutcome.SENT;
  }

  @VisibleForTesting
  SendOutcome handleFailure(EmailJob job, String error, String lockedBy) {
    final Instant now = clock.instant();
    final String lastError = truncateError(error);
    final RetryPolicy policy = policyFor(job);
    final RetryPolicy.RetryDecision decision = policy.onFailure(job.attempts(), now);
    metrics.recordSend(PATHWAY, "failed");
    if (decision.retry()) {
      final int updated =
          emailJobRepository.markRetry(job.id(), decision.nextAttemptAt(), lastError, lockedBy);
      if (updated == 0) {
        return SendOutcome.LOCK_LOST;
      }
      logger.warn(
          "email job retry scheduled id={} attempts={} nextAttemptAt={} error={}",
          job.id(),
          job.attempts(),
          decision.nextAttemptAt(),
          lastError);
      return SendOutcome.RETRY_SCHEDULED;
    }
    final int updated = emailJobRepository.markFailed(job.id(), lastError, lockedBy);
    if (updated == 0) {
      return SendOutcome.LOCK_LOST;
    }
    logger.warn(
        "email job failed id={} attempts={} error={}", job.id(), job.attempts(), lastError);
    return SendOutcome.FAILED;
  }

  /** The attempt limit is the one snapshotted on the job; backoff comes from the queue policy. */
  private RetryPolicy policyFor(EmailJob job) {
    final RetryPolicy queue = properties.retry();
    return new RetryPolicy(
        job.maxRetries(),
        queue.backoff(),
        queue.backoffBase(),
        queue.backoffMax(),
        queue.backoffExponentBase(),
        queue.backoffJitterMin(),
        queue.backoffJitterMax());
  }

  private EmailJobPayload readPayload(String payloadJson) {
    try {
      final EmailJobPayload payload = objectMapper.readValue(payloadJson, EmailJobPayload.class);
      if (payload == null || payload.text() == null) {
        throw new IllegalStateException("email job payload has no text");
      }
      return payload;
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("email job payload is not valid json", ex);
    }
  }

  private String writePayload(EmailJobPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize email job payload", ex);
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
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " is required");
    }
  }

  @VisibleForTesting
  String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
