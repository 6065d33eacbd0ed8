package com.otcswap.engine.events;

import java.math.BigDecimal;
import java.time.Instant;

public record ClaimWithdrawnEvent(
    String principal, String asset, BigDecimal amount, BigDecimal balanceAfter, Instant occurredAt)
    implements SwapEngineEvent {}
