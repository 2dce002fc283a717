/*
 * Where: Funnel domain model
 * What: Per-queue retry configuration (attempt limit and backoff function)
 * Why: The job queue and the enrollment queue differ only in these values, not in code paths
 */
package com.example.funnel.model;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

public record RetryPolicy(
    int maxAttempts,
    BackoffKind backoff,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax) {

  /** {@code maxAttempts} value meaning "retry forever". */
  public static final int UNBOUNDED = 0;

  public enum BackoffKind {
    FIXED,
    EXPONENTIAL
  }

  public RetryPolicy {
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0");
    }
    backoff = backoff == null ? BackoffKind.FIXED : backoff;
    backoffBase = backoffBase == null ? Duration.ofMinutes(60) : backoffBase;
    backoffMax = backoffMax == null ? backoffBase : backoffMax;
    backoffExponentBase = backoffExponentBase <= 0 ? 2.0d : backoffExponentBase;
    backoffJitterMin = backoffJitterMin <= 0 ? 1.0d : backoffJitterMin;
    backoffJitterMax = backoffJitterMax < backoffJitterMin ? backoffJitterMin : backoffJitterMax;
  }

  /** A single attempt, no retry: the first failure is final. */
  public static RetryPolicy terminal() {
    return new RetryPolicy(1, BackoffKind.FIXED, Duration.ZERO, Duration.ZERO, 0, 0, 0);
  }

  public static RetryPolicy fixedUnbounded(Duration delay) {
    return new RetryPolicy(UNBOUNDED, BackoffKind.FIXED, delay, delay, 0, 0, 0);
  }

  public boolean unbounded() {
    return maxAttempts == UNBOUNDED;
  }

  /**
   * Decides what happens after a failed attempt.
   *
   * @param attemptsMade attempts already made, including the one that just failed
   * @param failedAt time of the failure; backoff counts from here
   */
  public RetryDecision onFailure(int attemptsMade, Instant failedAt) {
    if (!unbounded() && attemptsMade >= maxAttempts) {
      return RetryDecision.giveUp();
    }
    return RetryDecision.retryAt(failedAt.plus(backoffFor(attemptsMade)));
  }

  public Duration backoffFor(int attemptsMade) {
    if (backoff == BackoffKind.FIXED) {
      return backoffBase;
    }
    final int attempt = Math.max(attemptsMade, 1);
    final double exp = backoffBase.toMillis() * Math.pow(backoffExponentBase, attempt - 1);
    final double capped = Math.min(exp, backoffMax.toMillis());
    final double jitter =
        backoffJitterMin
            + ThreadLocalRandom.current().nextDouble() * (backoffJitterMax - backoffJitterMin);
    return Duration.ofMillis((long) Math.ceil(capped * jitter));
  }

  public record RetryDecision(boolean retry, Instant nextAttemptAt) {

    static RetryDecision giveUp() {
      return new RetryDecision(false, null);
    }

    static RetryDecision retryAt(Instant nextAttemptAt) {
      return new RetryDecision(true, nextAttemptAt);
    }
  }
}
