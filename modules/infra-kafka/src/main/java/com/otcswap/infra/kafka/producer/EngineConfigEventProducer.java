package com.otcswap.infra.kafka.producer;

import com.otcswap.infra.kafka.contract.EventEnvelope;
import com.otcswap.infra.kafka.contract.EventTypes;
import com.otcswap.infra.kafka.contract.payload.EngineConfigChangedV1;
import com.otcswap.infra.kafka.topics.TopicNames;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public class EngineConfigEventProducer {
  private static final int EVENT_VERSION = 1;
  static final String CONFIG_KEY = "swap-engine-config";

  private final EventPublisher eventPublisher;
  private final String producerName;

  public EngineConfigEventProducer(EventPublisher eventPublisher, String producerName) {
    this.eventPublisher = eventPublisher;
    this.producerName = producerName;
  }

  public CompletableFuture<SendResult<String, String>> publishConfigChanged(
      EngineConfigChangedV1 payload) {
    String changeType = EventKeys.require(payload.changeType(), "payload.changeType");
    EventEnvelope<EngineConfigChangedV1> envelope =
        EventEnvelope.of(
            EventTypes.ENGINE_CONFIG_CHANGED,
            EVENT_VERSION,
            producerName,
            changeType,
            CONFIG_KEY,
            payload);
    return eventPublisher.publish(TopicNames.SWAP_CONFIG_UPDATED_V1, CONFIG_KEY, envelope);
  }
}
