/*
 * Where: Funnel service layer
 * What: The mail provider refused the message or could not be reached
 * Why: Job and enrollment passes apply different retry policies to the same failure
 */
package com.example.funnel.service;

public class EmailTransportException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    UNAVAILABLE,
    REJECTED,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public EmailTransportException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
