/*
 * Where: Funnel service layer
 * What: The AI copy call failed, timed out or answered with something unusable
 * Why: CopyResolver turns every reason into fallback copy, but logs which one it was
 */
package com.example.funnel.service;

public class CopyGenerationException extends RuntimeException {

  public enum Reason {
    NOT_CONFIGURED,
    TIMEOUT,
    UNAVAILABLE,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public CopyGenerationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public CopyGenerationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
