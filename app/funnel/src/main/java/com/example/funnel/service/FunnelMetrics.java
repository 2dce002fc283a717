/*
 * Where: Funnel service layer
 * What: Micrometer counters for sends, copy sources, passes and claims
 * Why: Failures only surface through logs and metrics, so both have to be there
 */
package com.example.funnel.service;

import com.example.funnel.model.CopySource;
import com.example.funnel.model.LedgerReadFailurePolicy;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class FunnelMetrics {

  private static final String METRIC_SEND_TOTAL = "funnel.send.total";
  private static final String METRIC_COPY_TOTAL = "funnel.copy.total";
  private static final String METRIC_PASS_TOTAL = "funnel.pass.total";
  private static final String METRIC_TRIGGER_ERROR_TOTAL = "funnel.trigger.error.total";
  private static final String METRIC_LEDGER_READ_FAILURE_TOTAL = "funnel.ledger.read.failure.total";
  private static final String METRIC_JOBS_CLAIMED_TOTAL = "funnel.jobs.claimed.total";
  private static final String METRIC_JOBS_BACKLOG = "funnel.jobs.backlog.current";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final AtomicInteger jobsBacklog = new AtomicInteger(0);
  private final Counter jobsClaimed;
  private final Counter triggerErrors;

  public FunnelMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_JOBS_BACKLOG, jobsBacklog, AtomicInteger::get)
        .description("Pending email jobs seen at the start of the last job pass")
        .register(meterRegistry);
    this.jobsClaimed =
        Counter.builder(METRIC_JOBS_CLAIMED_TOTAL)
            .description("Email jobs moved from PENDING to SENDING")
            .register(meterRegistry);
    this.triggerErrors =
        Counter.builder(METRIC_TRIGGER_ERROR_TOTAL)
            .description("Steps skipped because their trigger could not be evaluated")
            .register(meterRegistry);
  }

  public void recordSend(String pathway, String result) {
    counter(METRIC_SEND_TOTAL, "Send outcomes per pathway", Tags.of("pathway", pathway, "result", result))
        .increment();
  }

  public void recordCopySource(CopySource source) {
    counter(
            METRIC_COPY_TOTAL,
            "Resolved copy by source",
            Tags.of("source", source.name().toLowerCase(Locale.ROOT)))
        .increment();
  }

  public void recordPass(String pass, String result) {
    counter(METRIC_PASS_TOTAL, "Scheduled pass outcomes", Tags.of("pass", pass, "result", result))
        .increment();
  }

  public void recordLedgerReadFailure(LedgerReadFailurePolicy policy) {
    counter(
            METRIC_LEDGER_READ_FAILURE_TOTAL,
            "Ledger reads answered by the failure policy",
            Tags.of("policy", policy.name().toLowerCase(Locale.ROOT)))
        .increment();
  }

  public void recordTriggerError() {
    triggerErrors.increment();
  }

  public void recordJobsClaimed(int count) {
    if (count > 0) {
      jobsClaimed.increment(count);
    }
  }

  public void updateJobsBacklog(int pending) {
    jobsBacklog.set(Math.max(pending, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key = name + tags;
    return counters.computeIfAbsent(
        key,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
