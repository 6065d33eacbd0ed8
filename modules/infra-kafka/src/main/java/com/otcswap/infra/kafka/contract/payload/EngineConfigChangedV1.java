package com.otcswap.infra.kafka.contract.payload;

import java.time.Instant;
import java.util.Map;

public record EngineConfigChangedV1(
    String changeType, String actor, Map<String, String> attributes, Instant occurredAt) {}
