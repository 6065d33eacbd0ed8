package com.otcswap.engine.tx;

import com.otcswap.domain.swap.UndoLog;

final class SettlementContext {
  private final UndoLog undoLog = new UndoLog();
  private boolean rollbackOnly;

  UndoLog undoLog() {
    return undoLog;
  }

  boolean isRollbackOnly() {
    return rollbackOnly;
  }

  void markRollbackOnly() {
    rollbackOnly = true;
  }
}
