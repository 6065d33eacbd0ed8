package com.otcswap.engine.tx;

import com.otcswap.domain.swap.SwapDomainException;
import com.otcswap.engine.guard.ReentrancyGuard;
import com.otcswap.engine.metrics.SwapTelemetry;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Runs an engine mutation under the reentrancy guard inside one settlement transaction. Any
 * exception undoes every change made by the call.
 */
public class SettlementExecutor {
  private static final Logger log = LoggerFactory.getLogger(SettlementExecutor.class);

  private final ReentrancyGuard guard;
  private final TransactionOperations transactionOperations;
  private final SwapTelemetry telemetry;

  public SettlementExecutor(
      ReentrancyGuard guard, TransactionOperations transactionOperations, SwapTelemetry telemetry) {
    this.guard = guard;
    this.transactionOperations = transactionOperations;
    this.telemetry = telemetry;
  }

  public <T> T execute(String operation, Supplier<T> action) {
    long started = System.nanoTime();
    try {
      T result = guard.enter(operation, () -> transactionOperations.execute(status -> action.get()));
      telemetry.onSettled(operation, System.nanoTime() - started);
      return result;
    } catch (SwapDomainException ex) {
      log.info(
          "Settlement rejected operation={} category={} reason={}",
          operation,
          ex.category(),
          ex.getMessage());
      telemetry.onRejected(operation, ex.category(), ex);
      throw ex;
    } catch (RuntimeException ex) {
      log.error("Settlement failed unexpectedly operation={}", operation, ex);
      telemetry.onRejected(operation, null, ex);
      throw ex;
    }
  }

  public void run(String operation, Runnable action) {
    execute(
        operation,
        () -> {
          action.run();
          return null;
        });
  }
}
