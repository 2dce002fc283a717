/*
 * Where: Funnel service layer
 * What: Runs one scheduled pass with a run id in the MDC and records its outcome
 * Why: Every log line of a pass must be traceable to that pass, whether a worker or an operator started it
 */
package com.example.funnel.service;

import com.example.common.TraceIds;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PassExecution {

  private static final Logger logger = LoggerFactory.getLogger(PassExecution.class);

  static final String MDC_RUN_ID = "run_id";
  static final String MDC_PASS = "pass";

  private final FunnelMetrics metrics;
  private final Map<String, ReentrantLock> running = new ConcurrentHashMap<>();

  /**
   * Runs {@code body} unless a pass of the same name is already running in this process, in which
   * case {@code busy} supplies the result and nothing else happens. Exceptions propagate after the
   * failure is counted.
   */
  public <T> T run(String pass, Supplier<T> body, Supplier<T> busy) {
    final ReentrantLock lock = running.computeIfAbsent(pass, ignored -> new ReentrantLock());
    if (!lock.tryLock()) {
      logger.info("pass skipped because it is already running pass={}", pass);
      metrics.recordPass(pass, "busy");
      return busy.get();
    }
    try {
      return runLocked(pass, body);
    } finally {
      lock.unlock();
    }
  }

  private <T> T runLocked(String pass, Supplier<T> body) {
    final String previousRunId = MDC.get(MDC_RUN_ID);
    final String previousPass = MDC.get(MDC_PASS);
    MDC.put(MDC_RUN_ID, TraceIds.newRunId(pass));
    MDC.put(MDC_PASS, pass);
    try {
      final T result = body.get();
      metrics.recordPass(pass, "completed");
      return result;
    } catch (RuntimeException ex) {
      metrics.recordPass(pass, "aborted");
      throw ex;
    } finally {
      restore(MDC_RUN_ID, previousRunId);
      restore(MDC_PASS, previousPass);
    }
  }

  private void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
