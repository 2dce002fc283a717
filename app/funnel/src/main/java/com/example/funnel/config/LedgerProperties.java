package com.example.funnel.config;

import com.example.funnel.model.LedgerReadFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "funnel.ledger")
public record LedgerProperties(LedgerReadFailurePolicy readFailurePolicy) {

  public LedgerProperties {
    readFailurePolicy =
        readFailurePolicy == null ? LedgerReadFailurePolicy.FAIL_OPEN : readFailurePolicy;
  }
}
