package com.otcswap.engine.events;

import java.time.Instant;

public record OwnershipTransferredEvent(String previousOwner, String newOwner, Instant occurredAt)
    implements SwapEngineEvent {}
