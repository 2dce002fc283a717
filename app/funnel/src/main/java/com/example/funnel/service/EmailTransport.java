package com.example.funnel.service;

import com.example.funnel.model.OutgoingEmail;
import com.example.funnel.model.TransportResult;
import java.util.List;

/** Outbound mail provider. */
public interface EmailTransport {

  /**
   * Delivery problems are reported as a rejected result.
   *
   * @throws FunnelConfigurationException when required credentials are missing
   */
  TransportResult send(OutgoingEmail email);

  /** Setting names that must be provided before anything can be sent; empty when ready. */
  List<String> missingConfiguration();
}
