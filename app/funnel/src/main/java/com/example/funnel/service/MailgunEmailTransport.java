/*
 * Where: Funnel service layer
 * What: Sends messages through the Mailgun HTTP API
 * Why: Provider errors and timeouts become rejected results so callers apply their retry policy
 */
package com.example.funnel.service;

import com.example.funnel.config.TransportProperties;
import com.example.funnel.model.OutgoingEmail;
import com.example.funnel.model.TransportResult;
import com.example.funnel.service.dto.MailgunSendResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
@ConditionalOnProperty(name = "funnel.transport.provider", havingValue = "mailgun")
public class MailgunEmailTransport implements EmailTransport {

  private static final Logger logger = LoggerFactory.getLogger(MailgunEmailTransport.class);

  private final RestClient mailgunRestClient;
  private final TransportProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public MailgunEmailTransport(
      @Qualifier("mailgunRestClient") RestClient mailgunRestClient,
      TransportProperties properties) {
    this.mailgunRestClient = mailgunRestClient;
    this.properties = properties;
  }

  @Override
  public TransportResult send(OutgoingEmail email) {
    final List<String> missing = missingConfiguration();
    if (!missing.isEmpty()) {
      throw new FunnelConfigurationException("mailgun transport is not configured", missing);
    }
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("from", properties.fromAddress());
    form.add("to", email.to());
    form.add("subject", email.subject());
    form.add("text", email.text());
    if (email.html() != null && !email.html().isBlank()) {
      form.add("html", email.html());
    }
    try {
      final String id = post(form);
      logger.info(
          "mailgun accepted message to={} providerMessageId={}", EmailAddresses.mask(email.to()), id);
      return TransportResult.accepted(id);
    } catch (EmailTransportException ex) {
      logger.warn(
          "mailgun send failed to={} reason={} message={}",
          EmailAddresses.mask(email.to()),
          ex.reason(),
          ex.getMessage());
      return TransportResult.rejected(ex.getMessage());
    }
  }

  private String post(MultiValueMap<String, String> form) {
    try {
      final MailgunSendResponse response =
          mailgunRestClient
              .post()
              .uri("/v3/{domain}/messages", properties.domain())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .body(MailgunSendResponse.class);
      return response == null ? null : response.id();
    } catch (RestClientResponseException ex) {
      throw new EmailTransportException(
          EmailTransportException.Reason.REJECTED,
          "mailgun status " + ex.getStatusCode().value() + ": " + ex.getResponseBodyAsString(),
          ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        throw new EmailTransportException(
            EmailTransportException.Reason.TIMEOUT, "mailgun request timeout", ex);
      }
      throw new EmailTransportException(
          EmailTransportException.Reason.UNAVAILABLE, "mailgun connection failed", ex);
    } catch (RestClientException ex) {
      throw new EmailTransportException(
          EmailTransportException.Reason.INVALID_RESPONSE, "mailgun response parse failed", ex);
    }
  }

  @Override
  public List<String> missingConfiguration() {
    return properties.missingMailgunSettings();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
