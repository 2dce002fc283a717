/*
 * Where: Funnel service layer
 * What: Transport that only writes the message to the log
 * Why: Local runs and tests exercise the whole pipeline without a mail provider
 */
package com.example.funnel.service;

import com.example.funnel.model.OutgoingEmail;
import com.example.funnel.model.TransportResult;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(
    name = "funnel.transport.provider",
    havingValue = "log",
    matchIfMissing = true)
public class LoggingEmailTransport implements EmailTransport {

  private static final Logger logger = LoggerFactory.getLogger(LoggingEmailTransport.class);

  @Override
  public TransportResult send(OutgoingEmail email) {
    final String id = "log-" + UUID.randomUUID();
    logger.info(
        "email logged to={} subject={} providerMessageId={}",
        EmailAddresses.mask(email.to()),
        email.subject(),
        id);
    return TransportResult.accepted(id);
  }

  @Override
  public List<String> missingConfiguration() {
    return List.of();
  }
}
