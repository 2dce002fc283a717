/*
 * Where: Funnel service layer
 * What: Reads and writes the global email automation switch
 * Why: Operators toggle sending at runtime, so every pass reads the flag fresh
 */
package com.example.funnel.service;

import com.example.funnel.config.AutomationProperties;
import com.example.funnel.repository.AppSettingsRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AutomationSettings {

  private static final Logger logger = LoggerFactory.getLogger(AutomationSettings.class);
  private static final String ENABLED_FIELD = "enabled";

  private final AppSettingsRepository appSettingsRepository;
  private final AutomationProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** A missing or unreadable setting counts as disabled. */
  public boolean isEnabled() {
    final Optional<String> value = appSettingsRepository.findValueJson(properties.settingKey());
    if (value.isEmpty()) {
      return false;
    }
    try {
      final JsonNode node = objectMapper.readTree(value.get());
      return node != null && node.path(ENABLED_FIELD).asBoolean(false);
    } catch (JsonProcessingException ex) {
      logger.warn("automation setting is not valid json key={}", properties.settingKey(), ex);
      return false;
    }
  }

  public void setEnabled(boolean enabled) {
    final String json;
    try {
      json = objectMapper.writeValueAsString(Map.of(ENABLED_FIELD, enabled));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize automation setting", ex);
    }
    appSettingsRepository.upsert(properties.settingKey(), json, clock.instant());
    logger.info("email automation switched enabled={}", enabled);
  }
}
