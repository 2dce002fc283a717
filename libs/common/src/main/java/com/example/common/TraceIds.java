/*
 * Where: Common utilities
 * What: Generates correlation ids for requests and scheduled passes
 * Why: Log lines of one pass can be grouped by a single MDC value
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private static final String RUN_PREFIX = "run-";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String newRunId(String passName) {
    return RUN_PREFIX + passName + "-" + UUID.randomUUID().toString().substring(0, 8);
  }
}
