/*
 * Where: Funnel domain model
 * What: Outcome reported by the mail transport
 * Why: Callers decide between ledger write and failure handling from one value
 */
package com.example.funnel.model;

public record TransportResult(boolean success, String id, String error) {

  public static TransportResult accepted(String id) {
    return new TransportResult(true, id, null);
  }

  public static TransportResult rejected(String error) {
    return new TransportResult(false, null, error);
  }
}
