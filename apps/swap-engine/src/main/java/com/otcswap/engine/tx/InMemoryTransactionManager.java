package com.otcswap.engine.tx;

import com.otcswap.domain.swap.UndoLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.SmartTransactionObject;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Transaction manager for engine state held in memory. Each transaction binds an undo log that
 * collects compensations recorded through {@link TransactionalChangeJournal}; rollback replays
 * them newest first, commit discards them.
 */
public class InMemoryTransactionManager extends AbstractPlatformTransactionManager {
  private static final Logger log = LoggerFactory.getLogger(InMemoryTransactionManager.class);

  @Override
  protected Object doGetTransaction() {
    return new SettlementTransaction(
        (SettlementContext) TransactionSynchronizationManager.getResource(this));
  }

  @Override
  protected boolean isExistingTransaction(Object transaction) {
    return ((SettlementTransaction) transaction).context != null;
  }

  @Override
  protected void doBegin(Object transaction, TransactionDefinition definition) {
    SettlementTransaction settlement = (SettlementTransaction) transaction;
    settlement.context = new SettlementContext();
    TransactionSynchronizationManager.bindResource(this, settlement.context);
    log.debug("Settlement transaction started name={}", definition.getName());
  }

  @Override
  protected void doCommit(DefaultTransactionStatus status) {
    UndoLog undoLog = contextOf(status).undoLog();
    log.debug("Settlement transaction committed changes={}", undoLog.size());
    undoLog.clear();
  }

  @Override
  protected void doRollback(DefaultTransactionStatus status) {
    UndoLog undoLog = contextOf(status).undoLog();
    log.debug("Settlement transaction rolling back changes={}", undoLog.size());
    undoLog.rollback();
  }

  @Override
  protected void doSetRollbackOnly(DefaultTransactionStatus status) {
    contextOf(status).markRollbackOnly();
  }

  @Override
  protected void doCleanupAfterCompletion(Object transaction) {
    TransactionSynchronizationManager.unbindResource(this);
    ((SettlementTransaction) transaction).context = null;
  }

  UndoLog currentUndoLog() {
    SettlementContext context = (SettlementContext) TransactionSynchronizationManager.getResource(this);
    return context == null ? null : context.undoLog();
  }

  private static SettlementContext contextOf(DefaultTransactionStatus status) {
    return ((SettlementTransaction) status.getTransaction()).context;
  }

  private static final class SettlementTransaction implements SmartTransactionObject {
    private SettlementContext context;

    private SettlementTransaction(SettlementContext context) {
      this.context = context;
    }

    @Override
    public boolean isRollbackOnly() {
      return context != null && context.isRollbackOnly();
    }

    @Override
    public void flush() {}
  }
}
