package com.otcswap.engine.events;

import java.time.Instant;
import java.util.List;

public record AllowlistUpdatedEvent(
    String actor, List<String> assets, List<Boolean> allowed, Instant occurredAt)
    implements SwapEngineEvent {}
