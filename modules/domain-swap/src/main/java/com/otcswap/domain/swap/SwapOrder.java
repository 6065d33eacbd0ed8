package com.otcswap.domain.swap;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An escrowed offer to sell {@code sellAmount} of {@code sellAsset} for {@code buyAmount} of
 * {@code buyAsset}. Until filled, {@code taker} is the only counterparty allowed to fill, or null
 * for an open order; once filled it is the counterparty that actually filled.
 */
public record SwapOrder(
    long id,
    String maker,
    String taker,
    String sellAsset,
    BigDecimal sellAmount,
    String buyAsset,
    BigDecimal buyAmount,
    Instant createdAt,
    SwapOrderStatus status,
    String feeAsset,
    BigDecimal feeAmount) {
  public SwapOrder {
    if (id < 0) {
      throw new SwapValidationException("id must be >= 0");
    }
    requireNonBlank(maker, "maker");
    if (taker != null && taker.isBlank()) {
      throw new SwapValidationException("taker must not be blank when present");
    }
    requireNonBlank(sellAsset, "sellAsset");
    requirePositive(sellAmount, "sellAmount");
    requireNonBlank(buyAsset, "buyAsset");
    requirePositive(buyAmount, "buyAmount");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(status, "status must not be null");
    requireNonBlank(feeAsset, "feeAsset");
    requirePositive(feeAmount, "feeAmount");
  }

  public static SwapOrder createNew(
      long id,
      String maker,
      String restrictedTaker,
      String sellAsset,
      BigDecimal escrowedSellAmount,
      String buyAsset,
      BigDecimal buyAmount,
      FeeSchedule collectedFee,
      Instant now) {
    Objects.requireNonNull(collectedFee, "collectedFee must not be null");
    return new SwapOrder(
        id,
        maker,
        restrictedTaker,
        sellAsset,
        escrowedSellAmount,
        buyAsset,
        buyAmount,
        now,
        SwapOrderStatus.ACTIVE,
        collectedFee.feeAsset(),
        collectedFee.feeAmount());
  }

  public boolean isOpen() {
    return taker == null;
  }

  public boolean isFillableBy(String caller) {
    return taker == null || taker.equals(caller);
  }

  public Instant expiresAt(Duration orderExpiry) {
    return createdAt.plus(orderExpiry);
  }

  public boolean isExpired(Instant now, Duration orderExpiry) {
    return now.isAfter(expiresAt(orderExpiry));
  }

  public boolean isEligibleForCleanup(Instant now, Duration orderExpiry, Duration gracePeriod) {
    return now.isAfter(expiresAt(orderExpiry).plus(gracePeriod));
  }

  public FeeSchedule feeSnapshot() {
    return new FeeSchedule(feeAsset, feeAmount);
  }

  public SwapOrder fill(String filledBy) {
    requireNonBlank(filledBy, "taker");
    SwapOrderStateMachine.validateTransition(status, SwapOrderStatus.FILLED);
    return withStatus(SwapOrderStatus.FILLED, filledBy);
  }

  public SwapOrder cancel() {
    SwapOrderStateMachine.validateTransition(status, SwapOrderStatus.CANCELED);
    return withStatus(SwapOrderStatus.CANCELED, taker);
  }

  private SwapOrder withStatus(SwapOrderStatus nextStatus, String nextTaker) {
    return new SwapOrder(
        id,
        maker,
        nextTaker,
        sellAsset,
        sellAmount,
        buyAsset,
        buyAmount,
        createdAt,
        nextStatus,
        feeAsset,
        feeAmount);
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new SwapValidationException(fieldName + " must be > 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new SwapValidationException(fieldName + " must not be blank");
    }
  }
}
