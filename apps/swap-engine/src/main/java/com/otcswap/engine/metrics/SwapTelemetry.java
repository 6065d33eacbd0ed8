package com.otcswap.engine.metrics;

import com.otcswap.domain.swap.SwapErrorCategory;

public interface SwapTelemetry {
  void onSettled(String operation, long durationNanos);

  void onRejected(String operation, SwapErrorCategory category, Throwable error);

  void onCleanup(String outcome);
}
