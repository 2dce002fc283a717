package com.example.funnel.service;

import java.time.Instant;
import java.util.Map;

/** A message to queue. Subject, text and html may contain {@code {{variable}}} placeholders. */
public record NewEmailJob(
    String userId,
    String toEmail,
    String templateKey,
    String subject,
    String text,
    String html,
    Instant scheduledAt,
    Map<String, String> variables) {

  public NewEmailJob {
    variables = variables == null ? Map.of() : Map.copyOf(variables);
  }
}
