package com.otcswap.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

/** {@code transition} is one of FILLED, CANCELED or CLEANED. */
public record SwapOrderUpdatedV1(
    String orderId,
    String maker,
    String taker,
    String status,
    String transition,
    String sellAsset,
    BigDecimal sellAmount,
    String buyAsset,
    BigDecimal buyAmount,
    String actor,
    Instant updatedAt) {}
