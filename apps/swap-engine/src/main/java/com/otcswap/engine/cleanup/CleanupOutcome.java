package com.otcswap.engine.cleanup;

public enum CleanupOutcome {
  CLEANED,
  SKIPPED_TOMBSTONE,
  NOT_ELIGIBLE;

  public String metricTag() {
    return name().toLowerCase();
  }
}
