package com.otcswap.engine.cleanup;

import com.otcswap.domain.swap.ClaimableLedger;
import com.otcswap.domain.swap.CreditReason;
import com.otcswap.domain.swap.OrderBook;
import com.otcswap.domain.swap.OrderStateException;
import com.otcswap.domain.swap.SwapOrder;
import com.otcswap.domain.swap.SwapOrderStatus;
import com.otcswap.domain.swap.SwapValidationException;
import com.otcswap.engine.config.SwapEngineProperties;
import com.otcswap.engine.events.ClaimCreditedEvent;
import com.otcswap.engine.events.OrderCleanedEvent;
import com.otcswap.engine.metrics.SwapTelemetry;
import com.otcswap.engine.state.SwapEngineState;
import com.otcswap.engine.tx.SettlementExecutor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Permissionless queue sweep. Each call looks only at the order under the cursor: an order still
 * inside its expiry and grace window blocks the queue, so nothing behind it is cleaned first.
 */
@Service
public class CleanupService {
  private static final Logger log = LoggerFactory.getLogger(CleanupService.class);

  private final SwapEngineState state;
  private final SettlementExecutor settlementExecutor;
  private final ApplicationEventPublisher eventPublisher;
  private final SwapEngineProperties properties;
  private final SwapTelemetry telemetry;
  private final Clock clock;

  public CleanupService(
      SwapEngineState state,
      SettlementExecutor settlementExecutor,
      ApplicationEventPublisher eventPublisher,
      SwapEngineProperties properties,
      SwapTelemetry telemetry,
      Clock clock) {
    this.state = state;
    this.settlementExecutor = settlementExecutor;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.telemetry = telemetry;
    this.clock = clock;
  }

  public CleanupResult cleanupExpiredOrders(String caller) {
    CleanupResult result =
        settlementExecutor.execute("cleanupExpiredOrders", () -> doCleanup(caller));
    telemetry.onCleanup(result.outcome().metricTag());
    return result;
  }

  private CleanupResult doCleanup(String caller) {
    if (caller == null || caller.isBlank()) {
      throw new SwapValidationException("Invalid caller");
    }
    OrderBook orderBook = state.orderBook();
    if (!orderBook.hasPendingCleanup()) {
      throw new OrderStateException("No orders to clean up");
    }

    long orderId = orderBook.firstOrderId();
    if (orderBook.isTombstoned(orderId)) {
      orderBook.advanceCursor();
      log.debug("Cleanup skipped tombstone order_id={}", orderId);
      return CleanupResult.skippedTombstone(orderId);
    }

    SwapOrder order = orderBook.require(orderId);
    Instant now = clock.instant();
    if (!order.isEligibleForCleanup(now, properties.getOrderExpiry(), properties.getGracePeriod())) {
      return CleanupResult.notEligible(orderId);
    }

    ClaimableLedger ledger = state.claimableLedger();
    if (order.status() == SwapOrderStatus.ACTIVE) {
      BigDecimal makerBalance =
          ledger.credit(
              order.maker(), order.sellAsset(), order.sellAmount(), CreditReason.ORDER_EXPIRED);
      eventPublisher.publishEvent(
          new ClaimCreditedEvent(
              order.maker(),
              order.sellAsset(),
              order.sellAmount(),
              makerBalance,
              CreditReason.ORDER_EXPIRED,
              orderId,
              now));
    }

    state.feeLiabilities().release(order.feeAsset(), order.feeAmount());
    BigDecimal callerBalance =
        ledger.credit(caller, order.feeAsset(), order.feeAmount(), CreditReason.CLEANUP_REWARD);
    eventPublisher.publishEvent(
        new ClaimCreditedEvent(
            caller,
            order.feeAsset(),
            order.feeAmount(),
            callerBalance,
            CreditReason.CLEANUP_REWARD,
            orderId,
            now));

    orderBook.tombstone(orderId);
    orderBook.advanceCursor();
    eventPublisher.publishEvent(new OrderCleanedEvent(order, caller, order.feeAmount(), now));
    log.info(
        "Swap order cleaned order_id={} status={} cleaned_by={} reward_asset={} reward={}",
        orderId,
        order.status(),
        caller,
        order.feeAsset(),
        order.feeAmount());
    return CleanupResult.cleaned(orderId, order.feeAsset(), order.feeAmount());
  }
}
