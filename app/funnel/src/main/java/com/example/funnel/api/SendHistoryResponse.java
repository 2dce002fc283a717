package com.example.funnel.api;

import com.example.funnel.model.SendMeta;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendHistoryResponse(String userId, List<Entry> sends) {

  public SendHistoryResponse {
    sends = sends == null ? List.of() : List.copyOf(sends);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Entry(String stepKey, Instant sentAt, SendMeta meta) {}
}
