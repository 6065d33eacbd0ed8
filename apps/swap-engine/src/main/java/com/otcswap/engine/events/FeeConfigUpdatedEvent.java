package com.otcswap.engine.events;

import com.otcswap.domain.swap.FeeSchedule;
import java.time.Instant;

public record FeeConfigUpdatedEvent(
    String actor, FeeSchedule previous, FeeSchedule current, Instant occurredAt)
    implements SwapEngineEvent {}
