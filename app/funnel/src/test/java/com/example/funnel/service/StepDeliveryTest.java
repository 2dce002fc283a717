package com.example.funnel.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.funnel.catalog.StepCatalog;
import com.example.funnel.config.ContentProperties;
import com.example.funnel.model.CopySource;
import com.example.funnel.model.EmailStep;
import com.example.funnel.model.OutgoingEmail;
import com.example.funnel.model.ScheduleStrategy;
import com.example.funnel.model.SendMeta;
import com.example.funnel.model.UserSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessResourceFailureException;

class StepDeliveryTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:10:00Z");
  private static final UserSnapshot USER =
      new UserSnapshot("u-1", "ada@example.com", "Ada", null, "free", NOW.minusSeconds(600), null);

  private RecordingEmailTransport transport;
  private IdempotencyLedger ledger;
  private SimpleMeterRegistry registry;
  private StepDelivery delivery;
  private EmailStep welcome;

  @BeforeEach
  void setUp() {
    transport = new RecordingEmailTransport();
    ledger = mock(IdempotencyLedger.class);
    registry = new SimpleMeterRegistry();
    final FunnelMetrics metrics = new FunnelMetrics(registry);
    final CopyResolver copyResolver =
        new CopyResolver(
            (subject, body, context) -> {
              throw new CopyGenerationException(
                  CopyGenerationException.Reason.NOT_CONFIGURED, "disabled");
            },
            metrics);
    delivery =
        new StepDelivery(
            copyResolver,
            new EmailHtmlRenderer(new ContentProperties("https://app.example.com", null, null)),
            transport,
            ledger,
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
    welcome =
        StepCatalog.load(new ClassPathResource("catalog/test-steps.json"), new ObjectMapper())
            .find("d0_welcome")
            .orElseThrow();
  }

  @Test
  void sendsRenderedMessageAndRecordsLedger() {
    final DeliveryResult result =
        delivery.deliver(USER, welcome, ScheduleStrategy.ABSOLUTE, Map.of("first_name", "Ada"));

    assertThat(result.sent()).isTrue();
    assertThat(result.copySource()).isEqualTo(CopySource.FALLBACK);
    final OutgoingEmail email = transport.sent().get(0);
    assertThat(email.to()).isEqualTo("ada@example.com");
    assertThat(email.subject()).isEqualTo("Welcome aboard, Ada");
    assertThat(email.html()).contains("href=\"https://app.example.com/dashboard\"");

    final ArgumentCaptor<SendMeta> meta = ArgumentCaptor.forClass(SendMeta.class);
    verify(ledger).recordSent(eq("u-1"), eq("d0_welcome"), meta.capture(), eq(NOW));
    assertThat(meta.getValue().phase()).isEqualTo("activation");
    assertThat(meta.getValue().strategy()).isEqualTo(ScheduleStrategy.ABSOLUTE);
    assertThat(meta.getValue().providerMessageId()).isEqualTo("msg-1");
    assertThat(registry.get("funnel.send.total").tag("pathway", "absolute").tag("result", "sent").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void rejectedSendIsNotRecorded() {
    transport.rejectWith("mailgun status 500");

    final DeliveryResult result =
        delivery.deliver(USER, welcome, ScheduleStrategy.RELATIVE, Map.of());

    assertThat(result.outcome()).isEqualTo(DeliveryResult.Outcome.FAILED);
    assertThat(result.error()).isEqualTo("mailgun status 500");
    verify(ledger, never()).recordSent(any(), any(), any(), any());
  }

  @Test
  void ledgerWriteFailureAfterAcceptedSendStillCountsAsSent() {
    when(ledger.recordSent(any(), any(), any(), any()))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    final DeliveryResult result =
        delivery.deliver(USER, welcome, ScheduleStrategy.ABSOLUTE, Map.of());

    assertThat(result.sent()).isTrue();
    assertThat(transport.sent()).hasSize(1);
  }
}
