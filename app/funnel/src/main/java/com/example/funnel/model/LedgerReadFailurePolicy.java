package com.example.funnel.model;

/** What the ledger check answers when the ledger itself cannot be read. */
public enum LedgerReadFailurePolicy {
  /** Treat as not yet sent. A duplicate is possible, a missed message is not. */
  FAIL_OPEN,
  /** Treat as already sent. A missed message is possible, a duplicate is not. */
  FAIL_CLOSED
}
