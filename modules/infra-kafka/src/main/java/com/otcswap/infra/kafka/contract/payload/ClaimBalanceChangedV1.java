package com.otcswap.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

public record ClaimBalanceChangedV1(
    String principal,
    String asset,
    String change,
    BigDecimal amount,
    BigDecimal balanceAfter,
    String reason,
    String orderId,
    Instant occurredAt) {}
