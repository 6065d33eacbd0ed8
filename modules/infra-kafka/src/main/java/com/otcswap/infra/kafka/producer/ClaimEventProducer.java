package com.otcswap.infra.kafka.producer;

import com.otcswap.infra.kafka.contract.EventEnvelope;
import com.otcswap.infra.kafka.contract.EventTypes;
import com.otcswap.infra.kafka.contract.payload.ClaimBalanceChangedV1;
import com.otcswap.infra.kafka.topics.TopicNames;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public class ClaimEventProducer {
  private static final int EVENT_VERSION = 1;

  private final EventPublisher eventPublisher;
  private final String producerName;

  public ClaimEventProducer(EventPublisher eventPublisher, String producerName) {
    this.eventPublisher = eventPublisher;
    this.producerName = producerName;
  }

  public CompletableFuture<SendResult<String, String>> publishClaimBalanceChanged(
      ClaimBalanceChangedV1 payload) {
    String key = EventKeys.require(payload.principal(), "payload.principal");
    String correlationId = payload.orderId() == null ? key : payload.orderId();
    EventEnvelope<ClaimBalanceChangedV1> envelope =
        EventEnvelope.of(
            EventTypes.CLAIM_BALANCE_CHANGED,
            EVENT_VERSION,
            producerName,
            correlationId,
            key,
            payload);
    return eventPublisher.publish(TopicNames.SWAP_CLAIMS_UPDATED_V1, key, envelope);
  }
}
