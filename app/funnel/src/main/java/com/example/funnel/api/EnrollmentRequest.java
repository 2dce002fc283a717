package com.example.funnel.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnrollmentRequest(
    @NotBlank(message = "user_id is required") String userId,
    String sequenceKey,
    Map<String, String> context) {

  public EnrollmentRequest {
    context = context == null ? Map.of() : Map.copyOf(context);
  }
}
