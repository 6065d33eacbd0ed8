package com.otcswap.engine.cleanup;

import java.math.BigDecimal;

/** {@code reward} is zero unless the order was cleaned. */
public record CleanupResult(
    CleanupOutcome outcome, long orderId, String rewardAsset, BigDecimal reward) {
  static CleanupResult cleaned(long orderId, String rewardAsset, BigDecimal reward) {
    return new CleanupResult(CleanupOutcome.CLEANED, orderId, rewardAsset, reward);
  }

  static CleanupResult skippedTombstone(long orderId) {
    return new CleanupResult(CleanupOutcome.SKIPPED_TOMBSTONE, orderId, null, BigDecimal.ZERO);
  }

  static CleanupResult notEligible(long orderId) {
    return new CleanupResult(CleanupOutcome.NOT_ELIGIBLE, orderId, null, BigDecimal.ZERO);
  }
}
