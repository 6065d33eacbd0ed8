package com.otcswap.engine.reconciliation;

import com.otcswap.domain.swap.SwapOrder;
import com.otcswap.domain.swap.SwapOrderStatus;
import com.otcswap.engine.custody.CustodyTransfers;
import com.otcswap.engine.guard.ReentrancyGuard;
import com.otcswap.engine.state.SwapEngineState;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Service;

/**
 * Compares what custody holds per asset with what the engine owes: claimable balances, fee
 * liabilities and the escrow of active orders.
 */
@Service
public class CustodyReconciliationService {
  private final SwapEngineState state;
  private final CustodyTransfers custodyTransfers;
  private final ReentrancyGuard guard;
  private final ReconciliationReporter reporter;
  private final Clock clock;

  public CustodyReconciliationService(
      SwapEngineState state,
      CustodyTransfers custodyTransfers,
      ReentrancyGuard guard,
      ReconciliationReporter reporter,
      Clock clock) {
    this.state = state;
    this.custodyTransfers = custodyTransfers;
    this.guard = guard;
    this.reporter = reporter;
    this.clock = clock;
  }

  /** Reconciles every asset the engine currently knows about. */
  public ReconciliationResult runOnce() {
    return reconcile(guard.read(this::knownAssets));
  }

  public ReconciliationResult reconcile(Collection<String> assets) {
    Instant startedAt = clock.instant();
    Map<String, BigDecimal> expected = new LinkedHashMap<>();
    Map<String, BigDecimal> drift = new LinkedHashMap<>();
    guard.read(
        () -> {
          for (String asset : assets) {
            BigDecimal owed = expectedHoldings(asset);
            expected.put(asset, owed);
            drift.put(asset, custodyTransfers.custodyBalance(asset).subtract(owed));
          }
          return null;
        });
    ReconciliationResult result =
        new ReconciliationResult(
            startedAt, clock.instant(), statusOf(drift), Map.copyOf(expected), Map.copyOf(drift));
    reporter.report(result);
    return result;
  }

  private BigDecimal expectedHoldings(String asset) {
    BigDecimal total =
        state
            .claimableLedger()
            .totalOutstanding(asset)
            .add(state.feeLiabilities().liability(asset));
    for (SwapOrder order : state.orderBook().liveOrders()) {
      if (order.status() == SwapOrderStatus.ACTIVE && order.sellAsset().equals(asset)) {
        total = total.add(order.sellAmount());
      }
    }
    return total;
  }

  private Set<String> knownAssets() {
    Set<String> assets = new TreeSet<>(state.allowlist().list());
    assets.addAll(state.claimableLedger().outstandingAssets());
    assets.addAll(state.feeLiabilities().snapshot().keySet());
    assets.add(state.feeSchedule().feeAsset());
    return assets;
  }

  private static ReconciliationStatus statusOf(Map<String, BigDecimal> drift) {
    boolean surplus = false;
    for (BigDecimal value : drift.values()) {
      if (value.signum() < 0) {
        return ReconciliationStatus.DEFICIT;
      }
      surplus |= value.signum() > 0;
    }
    return surplus ? ReconciliationStatus.SURPLUS : ReconciliationStatus.BALANCED;
  }
}
