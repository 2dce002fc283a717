package com.example.funnel.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EmailJobRequest(
    @NotBlank(message = "to_email is required") @Email(message = "to_email must be an email address")
        String toEmail,
    @NotBlank(message = "template_key is required") String templateKey,
    @NotBlank(message = "subject is required") String subject,
    @NotBlank(message = "text is required") String text,
    String html,
    String userId,
    Instant scheduledAt,
    Map<String, String> variables) {

  public EmailJobRequest {
    variables = variables == null ? Map.of() : Map.copyOf(variables);
  }
}
