package com.otcswap.engine.tx;

import com.otcswap.domain.swap.ChangeJournal;
import com.otcswap.domain.swap.UndoLog;

public class TransactionalChangeJournal implements ChangeJournal {
  private final InMemoryTransactionManager transactionManager;

  public TransactionalChangeJournal(InMemoryTransactionManager transactionManager) {
    this.transactionManager = transactionManager;
  }

  @Override
  public void record(Runnable undo) {
    UndoLog undoLog = transactionManager.currentUndoLog();
    if (undoLog == null) {
      throw new IllegalStateException("Engine state changed outside of a settlement transaction");
    }
    undoLog.record(undo);
  }

  /** Journal for collaborators that may also be mutated outside of settlements, e.g. funding. */
  public ChangeJournal whenActive() {
    return undo -> {
      UndoLog undoLog = transactionManager.currentUndoLog();
      if (undoLog != null) {
        undoLog.record(undo);
      }
    };
  }
}
