package com.otcswap.engine.metrics;

import com.otcswap.domain.swap.SwapErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerSwapTelemetry implements SwapTelemetry {
  private static final String OPERATIONS_TOTAL = "swap.engine.operations";

  private final MeterRegistry meterRegistry;

  public MicrometerSwapTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onSettled(String operation, long durationNanos) {
    Counter.builder(OPERATIONS_TOTAL)
        .description("Engine operations by outcome")
        .tag("operation", operation)
        .tag("outcome", "settled")
        .tag("category", "none")
        .register(meterRegistry)
        .increment();

    Timer.builder("swap.engine.operation.duration")
        .description("Engine operation latency including asset transfers")
        .tag("operation", operation)
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onRejected(String operation, SwapErrorCategory category, Throwable error) {
    Counter.builder(OPERATIONS_TOTAL)
        .description("Engine operations by outcome")
        .tag("operation", operation)
        .tag("outcome", "rejected")
        .tag("category", category == null ? "unexpected" : category.name().toLowerCase())
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onCleanup(String outcome) {
    Counter.builder("swap.engine.cleanup")
        .description("Cleanup invocations by result")
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }
}
