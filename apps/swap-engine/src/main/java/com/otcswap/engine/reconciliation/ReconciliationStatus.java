package com.otcswap.engine.reconciliation;

public enum ReconciliationStatus {
  BALANCED,
  SURPLUS,
  DEFICIT
}
