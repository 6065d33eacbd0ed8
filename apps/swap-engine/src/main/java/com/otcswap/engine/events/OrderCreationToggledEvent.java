package com.otcswap.engine.events;

import java.time.Instant;

public record OrderCreationToggledEvent(String actor, boolean disabled, Instant occurredAt)
    implements SwapEngineEvent {}
