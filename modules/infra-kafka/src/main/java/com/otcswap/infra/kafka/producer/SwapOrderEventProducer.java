package com.otcswap.infra.kafka.producer;

import com.otcswap.infra.kafka.contract.EventEnvelope;
import com.otcswap.infra.kafka.contract.EventTypes;
import com.otcswap.infra.kafka.contract.payload.SwapOrderCreatedV1;
import com.otcswap.infra.kafka.contract.payload.SwapOrderUpdatedV1;
import com.otcswap.infra.kafka.topics.TopicNames;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public class SwapOrderEventProducer {
  private static final int EVENT_VERSION = 1;

  private final EventPublisher eventPublisher;
  private final String producerName;

  public SwapOrderEventProducer(EventPublisher eventPublisher, String producerName) {
    this.eventPublisher = eventPublisher;
    this.producerName = producerName;
  }

  public CompletableFuture<SendResult<String, String>> publishOrderCreated(
      SwapOrderCreatedV1 payload) {
    String key = EventKeys.require(payload.orderId(), "payload.orderId");
    EventEnvelope<SwapOrderCreatedV1> envelope =
        EventEnvelope.of(
            EventTypes.SWAP_ORDER_CREATED, EVENT_VERSION, producerName, key, key, payload);
    return eventPublisher.publish(TopicNames.SWAP_ORDERS_CREATED_V1, key, envelope);
  }

  public CompletableFuture<SendResult<String, String>> publishOrderUpdated(
      SwapOrderUpdatedV1 payload) {
    String key = EventKeys.require(payload.orderId(), "payload.orderId");
    EventEnvelope<SwapOrderUpdatedV1> envelope =
        EventEnvelope.of(
            EventTypes.SWAP_ORDER_UPDATED, EVENT_VERSION, producerName, key, key, payload);
    return eventPublisher.publish(TopicNames.SWAP_ORDERS_UPDATED_V1, key, envelope);
  }
}
