/*
 * Where: Funnel service layer
 * What: Required credentials or endpoints of a collaborator are not configured
 * Why: Work that needs the collaborator is skipped and logged, never marked failed
 */
package com.example.funnel.service;

import java.util.List;

public class FunnelConfigurationException extends RuntimeException {

  private final List<String> missingSettings;

  public FunnelConfigurationException(String message, List<String> missingSettings) {
    super(message + " missing=" + missingSettings);
    this.missingSettings = List.copyOf(missingSettings);
  }

  public List<String> missingSettings() {
    return missingSettings;
  }
}
