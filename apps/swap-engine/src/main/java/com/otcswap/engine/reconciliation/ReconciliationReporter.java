package com.otcswap.engine.reconciliation;

public interface ReconciliationReporter {
  void report(ReconciliationResult result);
}
