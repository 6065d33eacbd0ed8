package com.otcswap.engine.events;

import com.otcswap.domain.swap.SwapOrder;
import java.math.BigDecimal;
import java.time.Instant;

/** {@code order} is the last state of the order before its slot was tombstoned. */
public record OrderCleanedEvent(
    SwapOrder order, String cleanedBy, BigDecimal reward, Instant occurredAt)
    implements SwapEngineEvent {}
