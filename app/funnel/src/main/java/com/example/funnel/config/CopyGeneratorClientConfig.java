/*
 * Where: Funnel configuration
 * What: RestClient dedicated to the AI copy service
 * Why: Its timeouts differ from the mail transport's
 */
package com.example.funnel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class CopyGeneratorClientConfig {

  @Bean
  RestClient copyGeneratorRestClient(
      RestClient.Builder builder, CopyGenerationProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    final RestClient.Builder configured =
        builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory);
    if (properties.hasCredentials()) {
      configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
    }
    return configured.build();
  }
}
