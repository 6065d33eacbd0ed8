package com.otcswap.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

public record SwapOrderCreatedV1(
    String orderId,
    String maker,
    String taker,
    String sellAsset,
    BigDecimal sellAmount,
    String buyAsset,
    BigDecimal buyAmount,
    String feeAsset,
    BigDecimal feeAmount,
    Instant createdAt) {}
