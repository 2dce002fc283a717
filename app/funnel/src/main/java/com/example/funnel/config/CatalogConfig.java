/*
 * Where: Funnel configuration
 * What: Loads the step catalog once at startup
 * Why: An invalid catalog must stop the application instead of failing every pass
 */
package com.example.funnel.config;

import com.example.funnel.catalog.StepCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class CatalogConfig {

  @Bean
  StepCatalog stepCatalog(
      ContentProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    return StepCatalog.load(resourceLoader.getResource(properties.catalogLocation()), objectMapper);
  }
}
