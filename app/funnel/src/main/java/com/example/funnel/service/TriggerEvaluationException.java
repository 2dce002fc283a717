/*
 * Where: Funnel service layer
 * What: A step's trigger could not be evaluated for a user
 * Why: Callers skip that single step and keep the rest of the pass going
 */
package com.example.funnel.service;

public class TriggerEvaluationException extends RuntimeException {

  private final String stepKey;

  public TriggerEvaluationException(String stepKey, String message) {
    super(message);
    this.stepKey = stepKey;
  }

  public TriggerEvaluationException(String stepKey, String message, Throwable cause) {
    super(message, cause);
    this.stepKey = stepKey;
  }

  public String stepKey() {
    return stepKey;
  }
}
