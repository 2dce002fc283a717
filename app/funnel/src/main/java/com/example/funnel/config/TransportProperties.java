/*
 * Where: Funnel configuration binding
 * What: Mail transport selection, credentials and timeouts
 * Why: Missing credentials must be detectable before any job is claimed
 */
package com.example.funnel.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "funnel.transport")
public record TransportProperties(
    Provider provider,
    String baseUrl,
    String domain,
    String apiKey,
    String fromAddress,
    Duration connectTimeout,
    Duration readTimeout) {

  public enum Provider {
    MAILGUN,
    LOG
  }

  public TransportProperties {
    provider = provider == null ? Provider.LOG : provider;
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.mailgun.net" : baseUrl;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(15) : readTimeout;
  }

  /** Names of the settings a Mailgun send needs but that are not set. */
  public List<String> missingMailgunSettings() {
    final List<String> missing = new ArrayList<>();
    if (isBlank(apiKey)) {
      missing.add("funnel.transport.api-key");
    }
    if (isBlank(domain)) {
      missing.add("funnel.transport.domain");
    }
    if (isBlank(fromAddress)) {
      missing.add("funnel.transport.from-address");
    }
    return missing;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
