/*
 * Where: Funnel configuration binding
 * What: Settings of the per-step automation pass
 * Why: Candidate window and page size bound how many users one pass scans
 */
package com.example.funnel.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "funnel.automation")
public record AutomationProperties(
    boolean enabled,
    Duration pollInterval,
    int userPageSize,
    Duration candidateWindow,
    String settingKey) {

  public AutomationProperties {
    pollInterval = pollInterval == null ? Duration.ofMinutes(5) : pollInterval;
    userPageSize = userPageSize <= 0 ? 200 : userPageSize;
    candidateWindow = candidateWindow == null ? Duration.ofDays(45) : candidateWindow;
    settingKey = settingKey == null || settingKey.isBlank() ? "email_automation" : settingKey;
  }
}
