/*
 * Where: Funnel service layer
 * What: Resolves copy, renders and sends one catalog step, then records it in the ledger
 * Why: Both scheduling pathways must send and record a step in exactly the same way
 */
package com.example.funnel.service;

import com.example.funnel.model.EmailCopy;
import com.example.funnel.model.EmailStep;
import com.example.funnel.model.OutgoingEmail;
import com.example.funnel.model.ScheduleStrategy;
import com.example.funnel.model.SendMeta;
import com.example.funnel.model.TransportResult;
import com.example.funnel.model.UserSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StepDelivery {

  private static final Logger logger = LoggerFactory.getLogger(StepDelivery.class);

  private final CopyResolver copyResolver;
  private final EmailHtmlRenderer htmlRenderer;
  private final EmailTransport transport;
  private final IdempotencyLedger ledger;
  private final FunnelMetrics metrics;
  private final Clock clock;

  /**
   * Callers check the ledger before calling. A transport rejection is returned as FAILED and
   * nothing is recorded.
   *
   * @throws FunnelConfigurationException when the transport is not configured
   */
  public DeliveryResult deliver(
      UserSnapshot user, EmailStep step, ScheduleStrategy strategy, Map<String, String> context) {
    final String pathway = strategy.name().toLowerCase(Locale.ROOT);
    final EmailCopy copy = copyResolver.resolve(step, context);
    final String html = htmlRenderer.render(copy.subject(), copy.body(), step.ctaPath());
    final TransportResult result =
        transport.send(new OutgoingEmail(user.email(), copy.subject(), copy.body(), html));
    if (!result.success()) {
      logger.warn(
          "step send rejected userId={} stepKey={} error={}", user.id(), step.key(), result.error());
      metrics.recordSend(pathway, "failed");
      return DeliveryResult.failed(copy.source(), result.error());
    }
    final Instant sentAt = clock.instant();
    try {
      ledger.recordSent(
          user.id(), step.key(), SendMeta.of(step, strategy, copy.source(), result.id()), sentAt);
    } catch (DataAccessException ex) {
      // The provider already accepted the message; reporting FAILED would lead to a resend.
      logger.error(
          "step sent but ledger write failed userId={} stepKey={} providerMessageId={}",
          user.id(),
          step.key(),
          result.id(),
          ex);
    }
    logger.info(
        "step sent userId={} stepKey={} copySource={} providerMessageId={}",
        user.id(),
        step.key(),
        copy.source(),
        result.id());
    metrics.recordSend(pathway, "sent");
    return DeliveryResult.sent(copy.source(), result.id());
  }
}
