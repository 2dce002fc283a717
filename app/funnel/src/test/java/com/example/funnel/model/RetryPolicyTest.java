package com.example.funnel.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  private static final Instant FAILED_AT = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void terminalPolicyGivesUpAfterFirstAttempt() {
    final RetryPolicy.RetryDecision decision = RetryPolicy.terminal().onFailure(1, FAILED_AT);

    assertThat(decision.retry()).isFalse();
    assertThat(decision.nextAttemptAt()).isNull();
  }

  @Test
  void fixedUnboundedPolicyRetriesForeverWithSameDelay() {
    final RetryPolicy policy = RetryPolicy.fixedUnbounded(Duration.ofMinutes(60));

    for (int attempts : new int[] {1, 5, 500}) {
      final RetryPolicy.RetryDecision decision = policy.onFailure(attempts, FAILED_AT);
      assertThat(decision.retry()).isTrue();
      assertThat(decision.nextAttemptAt()).isEqualTo(FAILED_AT.plus(Duration.ofMinutes(60)));
    }
  }

  @Test
  void boundedPolicyStopsAtMaxAttempts() {
    final RetryPolicy policy =
        new RetryPolicy(3, RetryPolicy.BackoffKind.FIXED, Duration.ofMinutes(5), null, 0, 0, 0);

    assertThat(policy.onFailure(2, FAILED_AT).retry()).isTrue();
    assertThat(policy.onFailure(3, FAILED_AT).retry()).isFalse();
  }

  @Test
  void exponentialBackoffStaysWithinJitterRangeAndCap() {
    final RetryPolicy policy =
        new RetryPolicy(
            10,
            RetryPolicy.BackoffKind.EXPONENTIAL,
            Duration.ofSeconds(10),
            Duration.ofSeconds(60),
            2.0d,
            0.5d,
            1.5d);

    assertThat(policy.backoffFor(2)).isBetween(Duration.ofSeconds(10), Duration.ofSeconds(30));
    assertThat(policy.backoffFor(8)).isBetween(Duration.ofSeconds(30), Duration.ofSeconds(90));
  }

  @Test
  void defaultsAreFilledAndNegativeAttemptsRejected() {
    final RetryPolicy policy = new RetryPolicy(0, null, null, null, 0, 0, 0);

    assertThat(policy.unbounded()).isTrue();
    assertThat(policy.backoff()).isEqualTo(RetryPolicy.BackoffKind.FIXED);
    assertThat(policy.backoffBase()).isEqualTo(Duration.ofMinutes(60));
    assertThatThrownBy(() -> new RetryPolicy(-1, null, null, null, 0, 0, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
