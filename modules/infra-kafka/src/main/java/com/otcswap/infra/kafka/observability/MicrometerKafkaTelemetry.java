package com.otcswap.infra.kafka.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerKafkaTelemetry implements KafkaTelemetry {
  private static final String PUBLISH_TOTAL = "swap.kafka.publish.total";

  private final MeterRegistry meterRegistry;

  public MicrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onPublishSuccess(String topic, String key, String eventType, long durationNanos) {
    Counter.builder(PUBLISH_TOTAL)
        .description("Swap engine event publish attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("event_type", safeValue(eventType))
        .tag("outcome", "success")
        .register(meterRegistry)
        .increment();

    Timer.builder("swap.kafka.publish.duration")
        .description("Swap engine event publish latency")
        .tag("topic", safeValue(topic))
        .tag("event_type", safeValue(eventType))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String topic, String key, String eventType, Throwable error) {
    Counter.builder(PUBLISH_TOTAL)
        .description("Swap engine event publish attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("event_type", safeValue(eventType))
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
