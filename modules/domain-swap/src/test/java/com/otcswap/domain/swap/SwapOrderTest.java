package com.otcswap.domain.swap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SwapOrderTest {
  private static final Instant CREATED_AT = Instant.parse("2026-03-01T00:00:00Z");
  private static final Duration EXPIRY = Duration.ofDays(7);
  private static final Duration GRACE = Duration.ofDays(7);

  @Test
  void shouldCreateActiveOrderWithFeeSnapshot() {
    SwapOrder order = newOrder(null);

    assertEquals(SwapOrderStatus.ACTIVE, order.status());
    assertTrue(order.isOpen());
    assertEquals(new FeeSchedule("F", new BigDecimal("1")), order.feeSnapshot());
  }

  @Test
  void shouldRecordActualTakerOnFill() {
    SwapOrder filled = newOrder(null).fill("bob");

    assertEquals(SwapOrderStatus.FILLED, filled.status());
    assertEquals("bob", filled.taker());
    assertEquals("F", filled.feeAsset());
    assertThrows(OrderStateException.class, filled::cancel);
  }

  @Test
  void shouldRestrictFillToDesignatedTaker() {
    SwapOrder restricted = newOrder("bob");

    assertTrue(restricted.isFillableBy("bob"));
    assertFalse(restricted.isFillableBy("mallory"));
    assertEquals("bob", restricted.cancel().taker());
  }

  @Test
  void shouldAllowFillUpToExpiryAndCleanupOnlyAfterGrace() {
    SwapOrder order = newOrder(null);
    Instant expiry = CREATED_AT.plus(EXPIRY);

    assertFalse(order.isExpired(expiry, EXPIRY));
    assertTrue(order.isExpired(expiry.plusSeconds(1), EXPIRY));
    assertFalse(order.isEligibleForCleanup(expiry.plus(GRACE), EXPIRY, GRACE));
    assertTrue(order.isEligibleForCleanup(expiry.plus(GRACE).plusSeconds(1), EXPIRY, GRACE));
  }

  @Test
  void shouldRejectNonPositiveAmounts() {
    assertThrows(
        SwapValidationException.class,
        () ->
            SwapOrder.createNew(
                0L,
                "alice",
                null,
                "A",
                BigDecimal.ZERO,
                "B",
                BigDecimal.ONE,
                new FeeSchedule("F", BigDecimal.ONE),
                CREATED_AT));
    assertThrows(SwapValidationException.class, () -> new FeeSchedule("F", new BigDecimal("-1")));
    assertThrows(SwapValidationException.class, () -> new FeeSchedule(" ", BigDecimal.ONE));
  }

  private static SwapOrder newOrder(String taker) {
    return SwapOrder.createNew(
        0L,
        "alice",
        taker,
        "A",
        new BigDecimal("100"),
        "B",
        new BigDecimal("200"),
        new FeeSchedule("F", new BigDecimal("1")),
        CREATED_AT);
  }
}
