/*
 * Where: Funnel service layer
 * What: At-most-once bookkeeping of (user, step) sends
 * Why: Checked before copy is resolved, written only after the transport accepted the message
 */
package com.example.funnel.service;

import com.example.funnel.config.LedgerProperties;
import com.example.funnel.model.LedgerReadFailurePolicy;
import com.example.funnel.model.SendMeta;
import com.example.funnel.model.SendRecord;
import com.example.funnel.repository.SendLedgerRepository;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdempotencyLedger {

  private static final Logger logger = LoggerFactory.getLogger(IdempotencyLedger.class);

  private final SendLedgerRepository sendLedgerRepository;
  private final LedgerProperties properties;
  private final FunnelMetrics metrics;

  /** Whether the step was already sent; a read failure is answered by the configured policy. */
  public boolean hasSent(String userId, String stepKey) {
    try {
      return sendLedgerRepository.exists(userId, stepKey);
    } catch (DataAccessException ex) {
      final LedgerReadFailurePolicy policy = properties.readFailurePolicy();
      logger.warn(
          "ledger read failed userId={} stepKey={} policy={}", userId, stepKey, policy, ex);
      metrics.recordLedgerReadFailure(policy);
      return policy == LedgerReadFailurePolicy.FAIL_CLOSED;
    }
  }

  /** Returns false when a record for the pair already existed. */
  public boolean recordSent(String userId, String stepKey, SendMeta meta, Instant sentAt) {
    final boolean inserted = sendLedgerRepository.insertIfAbsent(userId, stepKey, sentAt, meta);
    if (!inserted) {
      logger.warn("ledger already had send userId={} stepKey={}", userId, stepKey);
    }
    return inserted;
  }

  public List<SendRecord> history(String userId) {
    return sendLedgerRepository.findByUserId(userId);
  }
}
