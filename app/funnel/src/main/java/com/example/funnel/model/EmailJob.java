/*
 * Where: Funnel domain model
 * What: A queued message in the email_jobs table
 * Why: The job runner claims and sends these independently of the step catalog
 */
package com.example.funnel.model;

import java.time.Instant;
import java.util.UUID;

public record EmailJob(
    UUID id,
    String userId,
    String toEmail,
    String templateKey,
    String subject,
    String payloadJson,
    EmailJobStatus status,
    int attempts,
    int maxRetries,
    Instant scheduledAt,
    String lastError,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    Instant createdAt,
    Instant sentAt,
    String providerMessageId) {

  public static EmailJob pending(
      UUID id,
      String userId,
      String toEmail,
      String templateKey,
      String subject,
      String payloadJson,
      int maxRetries,
      Instant scheduledAt,
      Instant createdAt) {
    return new EmailJob(
        id,
        userId,
        toEmail,
        templateKey,
        subject,
        payloadJson,
        EmailJobStatus.PENDING,
        0,
        maxRetries,
        scheduledAt,
        null,
        null,
        null,
        null,
        createdAt,
        null,
        null);
  }
}
