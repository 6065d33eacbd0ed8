package com.otcswap.engine.events;

import com.otcswap.domain.swap.SwapOrder;
import com.otcswap.infra.kafka.contract.payload.ClaimBalanceChangedV1;
import com.otcswap.infra.kafka.contract.payload.EngineConfigChangedV1;
import com.otcswap.infra.kafka.contract.payload.SwapOrderCreatedV1;
import com.otcswap.infra.kafka.contract.payload.SwapOrderUpdatedV1;
import com.otcswap.infra.kafka.producer.ClaimEventProducer;
import com.otcswap.infra.kafka.producer.EngineConfigEventProducer;
import com.otcswap.infra.kafka.producer.SwapOrderEventProducer;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Forwards committed engine events to Kafka. Publish failures are logged, never retried here. */
@Component
@ConditionalOnProperty(prefix = "infra.kafka", name = "enabled", havingValue = "true")
public class SwapEventKafkaRelay {
  private static final Logger log = LoggerFactory.getLogger(SwapEventKafkaRelay.class);

  private final SwapOrderEventProducer orderEventProducer;
  private final ClaimEventProducer claimEventProducer;
  private final EngineConfigEventProducer configEventProducer;

  public SwapEventKafkaRelay(
      SwapOrderEventProducer orderEventProducer,
      ClaimEventProducer claimEventProducer,
      EngineConfigEventProducer configEventProducer) {
    this.orderEventProducer = orderEventProducer;
    this.claimEventProducer = claimEventProducer;
    this.configEventProducer = configEventProducer;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onOrderCreated(OrderCreatedEvent event) {
    SwapOrder order = event.order();
    watch(
        "SwapOrderCreated",
        orderEventProducer.publishOrderCreated(
            new SwapOrderCreatedV1(
                Long.toString(order.id()),
                order.maker(),
                order.taker(),
                order.sellAsset(),
                order.sellAmount(),
                order.buyAsset(),
                order.buyAmount(),
                order.feeAsset(),
                order.feeAmount(),
                order.createdAt())));
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onOrderFilled(OrderFilledEvent event) {
    publishOrderUpdate(event.order(), "FILLED", event.order().taker(), event.occurredAt());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onOrderCanceled(OrderCanceledEvent event) {
    publishOrderUpdate(event.order(), "CANCELED", event.order().maker(), event.occurredAt());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onOrderCleaned(OrderCleanedEvent event) {
    publishOrderUpdate(event.order(), "CLEANED", event.cleanedBy(), event.occurredAt());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onClaimCredited(ClaimCreditedEvent event) {
    watch(
        "ClaimBalanceChanged",
        claimEventProducer.publishClaimBalanceChanged(
            new ClaimBalanceChangedV1(
                event.principal(),
                event.asset(),
                "CREDITED",
                event.amount(),
                event.balanceAfter(),
                event.reason().name(),
                Long.toString(event.orderId()),
                event.occurredAt())));
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onClaimWithdrawn(ClaimWithdrawnEvent event) {
    watch(
        "ClaimBalanceChanged",
        claimEventProducer.publishClaimBalanceChanged(
            new ClaimBalanceChangedV1(
                event.principal(),
                event.asset(),
                "WITHDRAWN",
                event.amount(),
                event.balanceAfter(),
                null,
                null,
                event.occurredAt())));
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onFeeConfigUpdated(FeeConfigUpdatedEvent event) {
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("feeAsset", event.current().feeAsset());
    attributes.put("feeAmount", event.current().feeAmount().toPlainString());
    publishConfigChange("FEE_CONFIG_UPDATED", event.actor(), attributes, event.occurredAt());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onOrderCreationToggled(OrderCreationToggledEvent event) {
    publishConfigChange(
        event.disabled() ? "ORDER_CREATION_DISABLED" : "ORDER_CREATION_ENABLED",
        event.actor(),
        Map.of(),
        event.occurredAt());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onAllowlistUpdated(AllowlistUpdatedEvent event) {
    // One notification per entry, in batch order. An asset may appear more than once.
    for (int i = 0; i < event.assets().size(); i++) {
      publishConfigChange(
          "ALLOWLIST_UPDATED",
          event.actor(),
          Map.of(
              "asset", event.assets().get(i), "allowed", Boolean.toString(event.allowed().get(i))),
          event.occurredAt());
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onOwnershipTransferred(OwnershipTransferredEvent event) {
    publishConfigChange(
        "OWNERSHIP_TRANSFERRED",
        event.previousOwner(),
        Map.of("newOwner", event.newOwner()),
        event.occurredAt());
  }

  private void publishOrderUpdate(SwapOrder order, String transition, String actor, Instant at) {
    watch(
        "SwapOrderUpdated",
        orderEventProducer.publishOrderUpdated(
            new SwapOrderUpdatedV1(
                Long.toString(order.id()),
                order.maker(),
                order.taker(),
                order.status().name(),
                transition,
                order.sellAsset(),
                order.sellAmount(),
                order.buyAsset(),
                order.buyAmount(),
                actor,
                at)));
  }

  private void publishConfigChange(
      String changeType, String actor, Map<String, String> attributes, Instant at) {
    watch(
        "EngineConfigChanged",
        configEventProducer.publishConfigChanged(
            new EngineConfigChangedV1(changeType, actor, attributes, at)));
  }

  private static void watch(String eventType, CompletableFuture<?> publish) {
    publish.whenComplete(
        (result, error) -> {
          if (error != null) {
            log.warn("Swap event publish failed event_type={} error={}", eventType, error.getMessage());
          }
        });
  }
}
