package com.example.funnel.api;

import com.example.funnel.service.IdempotencyLedger;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class SendHistoryController {

  private final IdempotencyLedger ledger;

  @GetMapping("/users/{user_id}/sends")
  public SendHistoryResponse list(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId) {
    return new SendHistoryResponse(
        userId,
        ledger.history(userId).stream()
            .map(record -> new SendHistoryResponse.Entry(record.stepKey(), record.sentAt(), record.meta()))
            .toList());
  }
}
