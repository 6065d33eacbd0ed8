package com.otcswap.engine.orders;

import com.otcswap.domain.swap.ClaimableLedger;
import com.otcswap.domain.swap.CreditReason;
import com.otcswap.domain.swap.FeeSchedule;
import com.otcswap.domain.swap.OrderStateException;
import com.otcswap.domain.swap.SwapOrder;
import com.otcswap.domain.swap.SwapOrderStatus;
import com.otcswap.domain.swap.SwapValidationException;
import com.otcswap.domain.swap.UnauthorizedCallerException;
import com.otcswap.engine.config.SwapEngineProperties;
import com.otcswap.engine.custody.CustodyTransfers;
import com.otcswap.engine.events.ClaimCreditedEvent;
import com.otcswap.engine.events.OrderCanceledEvent;
import com.otcswap.engine.events.OrderCreatedEvent;
import com.otcswap.engine.events.OrderFilledEvent;
import com.otcswap.engine.state.SwapEngineState;
import com.otcswap.engine.tx.SettlementExecutor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

@Service
public class SwapOrderService {
  private static final Logger log = LoggerFactory.getLogger(SwapOrderService.class);

  private final SwapEngineState state;
  private final SettlementExecutor settlementExecutor;
  private final CustodyTransfers custodyTransfers;
  private final ApplicationEventPublisher eventPublisher;
  private final SwapEngineProperties properties;
  private final Clock clock;

  public SwapOrderService(
      SwapEngineState state,
      SettlementExecutor settlementExecutor,
      CustodyTransfers custodyTransfers,
      ApplicationEventPublisher eventPublisher,
      SwapEngineProperties properties,
      Clock clock) {
    this.state = state;
    this.settlementExecutor = settlementExecutor;
    this.custodyTransfers = custodyTransfers;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  public SwapOrder createOrder(CreateSwapOrderCommand command) {
    return settlementExecutor.execute("createOrder", () -> doCreate(command));
  }

  public SwapOrder fillOrder(long orderId, String caller) {
    return settlementExecutor.execute("fillOrder", () -> doFill(orderId, caller));
  }

  public SwapOrder cancelOrder(long orderId, String caller) {
    return settlementExecutor.execute("cancelOrder", () -> doCancel(orderId, caller));
  }

  private SwapOrder doCreate(CreateSwapOrderCommand command) {
    if (state.isOrderCreationDisabled()) {
      throw new OrderStateException("Order creation is disabled");
    }
    validateCreate(command);

    FeeSchedule fee = state.feeSchedule();
    BigDecimal feeCollected =
        custodyTransfers.pullIntoCustody(fee.feeAsset(), command.maker(), fee.feeAmount());
    if (feeCollected.signum() == 0) {
      throw new SwapValidationException("Fee transfer failed");
    }
    BigDecimal escrowed =
        custodyTransfers.pullIntoCustody(command.sellAsset(), command.maker(), command.sellAmount());
    if (escrowed.signum() == 0) {
      throw new SwapValidationException("No tokens received");
    }

    Instant now = clock.instant();
    SwapOrder order =
        state
            .orderBook()
            .insert(
                id ->
                    SwapOrder.createNew(
                        id,
                        command.maker(),
                        command.taker(),
                        command.sellAsset(),
                        escrowed,
                        command.buyAsset(),
                        command.buyAmount(),
                        new FeeSchedule(fee.feeAsset(), feeCollected),
                        now));
    state.feeLiabilities().accrue(fee.feeAsset(), feeCollected);

    eventPublisher.publishEvent(new OrderCreatedEvent(order, now));
    log.info(
        "Swap order created order_id={} maker={} sell_asset={} sell_amount={} buy_asset={} buy_amount={} fee_asset={} fee_amount={}",
        order.id(),
        order.maker(),
        order.sellAsset(),
        order.sellAmount(),
        order.buyAsset(),
        order.buyAmount(),
        order.feeAsset(),
        order.feeAmount());
    return order;
  }

  private SwapOrder doFill(long orderId, String caller) {
    requireCaller(caller);
    SwapOrder order = state.orderBook().require(orderId);
    if (order.status() != SwapOrderStatus.ACTIVE) {
      throw new OrderStateException("Order is not active");
    }
    Instant now = clock.instant();
    if (order.isExpired(now, properties.getOrderExpiry())) {
      throw new OrderStateException("Order has expired");
    }
    if (!order.isFillableBy(caller)) {
      throw new UnauthorizedCallerException(caller, "Not authorized taker");
    }
    if (order.maker().equals(caller)) {
      throw new SwapValidationException("Maker cannot fill own order");
    }

    SwapOrder filled = order.fill(caller);
    state.orderBook().replace(filled);

    custodyTransfers.deliver(order.buyAsset(), caller, order.maker(), order.buyAmount());
    custodyTransfers.release(order.sellAsset(), caller, order.sellAmount());

    eventPublisher.publishEvent(new OrderFilledEvent(filled, now));
    log.info(
        "Swap order filled order_id={} maker={} taker={}", filled.id(), filled.maker(), caller);
    return filled;
  }

  private SwapOrder doCancel(long orderId, String caller) {
    requireCaller(caller);
    SwapOrder order = state.orderBook().require(orderId);
    if (!order.maker().equals(caller)) {
      throw new UnauthorizedCallerException(caller, "Only maker can cancel");
    }
    if (order.status() != SwapOrderStatus.ACTIVE) {
      throw new OrderStateException("Order is not active");
    }

    SwapOrder canceled = order.cancel();
    state.orderBook().replace(canceled);
    ClaimableLedger ledger = state.claimableLedger();
    BigDecimal balanceAfter =
        ledger.credit(
            order.maker(), order.sellAsset(), order.sellAmount(), CreditReason.ORDER_CANCELED);

    Instant now = clock.instant();
    eventPublisher.publishEvent(new OrderCanceledEvent(canceled, now));
    eventPublisher.publishEvent(
        new ClaimCreditedEvent(
            order.maker(),
            order.sellAsset(),
            order.sellAmount(),
            balanceAfter,
            CreditReason.ORDER_CANCELED,
            order.id(),
            now));
    log.info(
        "Swap order canceled order_id={} maker={} credited_asset={} credited_amount={}",
        canceled.id(),
        canceled.maker(),
        canceled.sellAsset(),
        canceled.sellAmount());
    return canceled;
  }

  private void validateCreate(CreateSwapOrderCommand command) {
    if (command == null) {
      throw new SwapValidationException("Order request must not be null");
    }
    requireCaller(command.maker());
    if (command.sellAsset() == null || command.sellAsset().isBlank()) {
      throw new SwapValidationException("Invalid sell token");
    }
    if (command.buyAsset() == null || command.buyAsset().isBlank()) {
      throw new SwapValidationException("Invalid buy token");
    }
    if (command.sellAmount() == null || command.sellAmount().signum() <= 0) {
      throw new SwapValidationException("Invalid sell amount");
    }
    if (command.buyAmount() == null || command.buyAmount().signum() <= 0) {
      throw new SwapValidationException("Invalid buy amount");
    }
    if (command.sellAsset().equals(command.buyAsset())) {
      throw new SwapValidationException("Cannot swap same token");
    }
    if (!state.allowlist().isAllowed(command.sellAsset())) {
      throw new SwapValidationException("Sell token not allowed");
    }
    if (!state.allowlist().isAllowed(command.buyAsset())) {
      throw new SwapValidationException("Buy token not allowed");
    }
    if (command.taker() != null) {
      if (command.taker().isBlank()) {
        throw new SwapValidationException("Invalid taker");
      }
      if (command.taker().equals(command.maker())) {
        throw new SwapValidationException("Taker cannot be the maker");
      }
    }
  }

  private static void requireCaller(String caller) {
    if (caller == null || caller.isBlank()) {
      throw new SwapValidationException("Invalid caller");
    }
  }
}
