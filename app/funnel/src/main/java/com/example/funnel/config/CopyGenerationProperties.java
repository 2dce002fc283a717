/*
 * Where: Funnel configuration binding
 * What: Endpoint, credentials and timeouts of the AI copy service
 * Why: A slow generator must not stall a pass, so both timeouts are bounded
 */
package com.example.funnel.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "funnel.ai")
public record CopyGenerationProperties(
    boolean enabled,
    String baseUrl,
    String generatePath,
    String apiKey,
    String model,
    Duration connectTimeout,
    Duration readTimeout) {

  public CopyGenerationProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:8090" : baseUrl;
    generatePath =
        generatePath == null || generatePath.isBlank() ? "/v1/email-copy" : generatePath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(20) : readTimeout;
  }

  public boolean hasCredentials() {
    return apiKey != null && !apiKey.isBlank();
  }
}
