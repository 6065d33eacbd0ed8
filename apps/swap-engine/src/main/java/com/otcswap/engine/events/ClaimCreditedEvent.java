package com.otcswap.engine.events;

import com.otcswap.domain.swap.CreditReason;
import java.math.BigDecimal;
import java.time.Instant;

public record ClaimCreditedEvent(
    String principal,
    String asset,
    BigDecimal amount,
    BigDecimal balanceAfter,
    CreditReason reason,
    long orderId,
    Instant occurredAt)
    implements SwapEngineEvent {}
