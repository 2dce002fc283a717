/*
 * Where: Funnel configuration binding
 * What: Poll and retry settings of the enrollment scheduler
 * Why: The fixed unbounded backoff is configuration, not a hard-coded branch
 */
package com.example.funnel.config;

import com.example.funnel.model.RetryPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "funnel.enrollment")
public record EnrollmentProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    int errorMessageMaxLength,
    Duration claimLease,
    RetryPolicy retry) {

  public EnrollmentProperties {
    pollInterval = pollInterval == null ? Duration.ofMinutes(5) : pollInterval;
    batchSize = batchSize <= 0 ? 50 : batchSize;
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
    claimLease = claimLease == null ? Duration.ofMinutes(10) : claimLease;
    retry = retry == null ? RetryPolicy.fixedUnbounded(Duration.ofMinutes(60)) : retry;
  }
}
