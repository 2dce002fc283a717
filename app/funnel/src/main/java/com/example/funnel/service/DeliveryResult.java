package com.example.funnel.service;

import com.example.funnel.model.CopySource;

/** What happened when one step was handed to the transport. */
public record DeliveryResult(
    Outcome outcome, CopySource copySource, String providerMessageId, String error) {

  public enum Outcome {
    SENT,
    FAILED
  }

  static DeliveryResult sent(CopySource copySource, String providerMessageId) {
    return new DeliveryResult(Outcome.SENT, copySource, providerMessageId, null);
  }

  static DeliveryResult failed(CopySource copySource, String error) {
    return new DeliveryResult(Outcome.FAILED, copySource, null, error);
  }

  public boolean sent() {
    return outcome == Outcome.SENT;
  }
}
