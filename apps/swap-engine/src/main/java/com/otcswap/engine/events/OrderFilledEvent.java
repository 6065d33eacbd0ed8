package com.otcswap.engine.events;

import com.otcswap.domain.swap.SwapOrder;
import java.time.Instant;

public record OrderFilledEvent(SwapOrder order, Instant occurredAt) implements SwapEngineEvent {}
