package com.otcswap.engine.health;

import com.otcswap.engine.guard.ReentrancyGuard;
import com.otcswap.engine.state.SwapEngineState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the engine as up while order creation is enabled. A disabled engine still serves
 * fills, cancels, cleanup and withdrawals, so it is reported as {@code DEGRADED} rather than down.
 */
@Component("swapEngine")
public class SwapEngineHealthIndicator implements HealthIndicator {
  private final SwapEngineState state;
  private final ReentrancyGuard guard;

  public SwapEngineHealthIndicator(SwapEngineState state, ReentrancyGuard guard) {
    this.state = state;
    this.guard = guard;
  }

  @Override
  public Health health() {
    return guard.read(
        () -> {
          Health.Builder builder =
              state.isOrderCreationDisabled() ? Health.status("DEGRADED") : Health.up();
          return builder
              .withDetail("orderCreationDisabled", state.isOrderCreationDisabled())
              .withDetail("firstOrderId", state.orderBook().firstOrderId())
              .withDetail("nextOrderId", state.orderBook().nextOrderId())
              .withDetail("allowedAssets", state.allowlist().size())
              .withDetail("owner", state.owner())
              .build();
        });
  }
}
