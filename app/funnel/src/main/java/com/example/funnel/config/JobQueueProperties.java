/*
 * Where: Funnel configuration binding
 * What: Poll, claim and retry settings of the email job queue
 * Why: Batch size, lease and retry policy are operational knobs
 */
package com.example.funnel.config;

import com.example.funnel.model.RetryPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "funnel.jobs")
public record JobQueueProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    Duration lease,
    int errorMessageMaxLength,
    RetryPolicy retry) {

  public JobQueueProperties {
    pollInterval = pollInterval == null ? Duration.ofMinutes(5) : pollInterval;
    batchSize = batchSize <= 0 ? 25 : batchSize;
    lease = lease == null ? Duration.ofMinutes(10) : lease;
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
    retry = retry == null ? RetryPolicy.terminal() : retry;
  }
}
