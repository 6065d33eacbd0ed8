package com.otcswap.engine.reconciliation;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * {@code driftByAsset} is custody balance minus expected holdings: positive means custody holds
 * more than the engine owes, negative means it holds less.
 */
public record ReconciliationResult(
    Instant startedAt,
    Instant finishedAt,
    ReconciliationStatus status,
    Map<String, BigDecimal> expectedByAsset,
    Map<String, BigDecimal> driftByAsset) {}
