package com.otcswap.engine.metrics;

import com.otcswap.domain.swap.SwapErrorCategory;

public class NoOpSwapTelemetry implements SwapTelemetry {
  @Override
  public void onSettled(String operation, long durationNanos) {}

  @Override
  public void onRejected(String operation, SwapErrorCategory category, Throwable error) {}

  @Override
  public void onCleanup(String outcome) {}
}
