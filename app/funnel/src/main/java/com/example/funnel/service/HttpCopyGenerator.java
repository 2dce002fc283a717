/*
 * Where: Funnel service layer
 * What: Calls the AI copy service over HTTP
 * Why: Transport errors are mapped to CopyGenerationException reasons for the fallback log
 */
package com.example.funnel.service;

import com.example.funnel.config.CopyGenerationProperties;
import com.example.funnel.service.dto.CopyGenerationRequest;
import com.example.funnel.service.dto.CopyGenerationResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class HttpCopyGenerator implements CopyGenerator {

  private static final Logger logger = LoggerFactory.getLogger(HttpCopyGenerator.class);

  private final RestClient copyGeneratorRestClient;
  private final CopyGenerationProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public HttpCopyGenerator(
      @Qualifier("copyGeneratorRestClient") RestClient copyGeneratorRestClient,
      CopyGenerationProperties properties) {
    this.copyGeneratorRestClient = copyGeneratorRestClient;
    this.properties = properties;
  }

  @Override
  public CopyGenerationResponse generate(
      String subjectPrompt, String bodyPrompt, Map<String, String> userContext) {
    if (!properties.enabled()) {
      throw new CopyGenerationException(
          CopyGenerationException.Reason.NOT_CONFIGURED, "ai copy generation is disabled");
    }
    if (!properties.hasCredentials()) {
      throw new CopyGenerationException(
          CopyGenerationException.Reason.NOT_CONFIGURED,
          "ai copy generation is not configured",
          new FunnelConfigurationException("ai copy", List.of("funnel.ai.api-key")));
    }
    final CopyGenerationRequest request =
        new CopyGenerationRequest(properties.model(), subjectPrompt, bodyPrompt, userContext);
    try {
      return requireResponse(
          copyGeneratorRestClient
              .post()
              .uri(properties.generatePath())
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(CopyGenerationResponse.class));
    } catch (RestClientResponseException ex) {
      logger.warn(
          "ai copy request failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new CopyGenerationException(
          CopyGenerationException.Reason.UNAVAILABLE, "ai copy request failed", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        throw new CopyGenerationException(
            CopyGenerationException.Reason.TIMEOUT, "ai copy request timeout", ex);
      }
      throw new CopyGenerationException(
          CopyGenerationException.Reason.UNAVAILABLE, "ai copy connection failed", ex);
    } catch (RestClientException ex) {
      throw new CopyGenerationException(
          CopyGenerationException.Reason.INVALID_RESPONSE, "ai copy response parse failed", ex);
    }
  }

  private CopyGenerationResponse requireResponse(CopyGenerationResponse response) {
    if (response == null || isBlank(response.subject()) || isBlank(response.body())) {
      throw new CopyGenerationException(
          CopyGenerationException.Reason.INVALID_RESPONSE, "ai copy response is incomplete");
    }
    return response;
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

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
