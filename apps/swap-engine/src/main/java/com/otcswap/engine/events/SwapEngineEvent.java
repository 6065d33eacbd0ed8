package com.otcswap.engine.events;

import java.time.Instant;

/** Notification published by the engine; listeners receive it once the settlement commits. */
public interface SwapEngineEvent {
  Instant occurredAt();
}
