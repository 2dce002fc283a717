package com.example.funnel.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CopyGenerationRequest(
    String model, String subjectPrompt, String bodyPrompt, Map<String, String> context) {

  public CopyGenerationRequest {
    context = context == null ? Map.of() : Map.copyOf(context);
  }
}
