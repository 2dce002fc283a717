/*
 * Where: Funnel configuration
 * What: RestClient for the Mailgun messages API
 * Why: Only built when Mailgun is the selected transport
 */
package com.example.funnel.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "funnel.transport.provider", havingValue = "mailgun")
public class MailgunClientConfig {

  private static final String API_USER = "api";

  @Bean
  RestClient mailgunRestClient(RestClient.Builder builder, TransportProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeaders(
            headers -> {
              if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
                headers.setBasicAuth(API_USER, properties.apiKey());
              }
            })
        .build();
  }
}
