package com.otcswap.engine.query;

import com.otcswap.domain.swap.FeeSchedule;
import com.otcswap.domain.swap.SwapOrder;
import com.otcswap.domain.swap.SwapOrderStatus;
import com.otcswap.engine.config.SwapEngineProperties;
import com.otcswap.engine.guard.ReentrancyGuard;
import com.otcswap.engine.state.SwapEngineState;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/** Read-only views of engine state, taken under the engine guard. */
@Service
public class SwapQueryService {
  private final SwapEngineState state;
  private final ReentrancyGuard guard;
  private final SwapEngineProperties properties;

  public SwapQueryService(
      SwapEngineState state, ReentrancyGuard guard, SwapEngineProperties properties) {
    this.state = state;
    this.guard = guard;
    this.properties = properties;
  }

  /** Empty for ids never assigned and for tombstoned slots. */
  public Optional<SwapOrder> findOrder(long orderId) {
    return guard.read(() -> state.orderBook().find(orderId));
  }

  public boolean isTombstoned(long orderId) {
    return guard.read(() -> state.orderBook().isTombstoned(orderId));
  }

  /** Orders in the live window, in id order. */
  public List<SwapOrder> liveOrders() {
    return guard.read(() -> state.orderBook().liveOrders());
  }

  public List<SwapOrder> activeOrders() {
    return guard.read(
        () ->
            state.orderBook().liveOrders().stream()
                .filter(order -> order.status() == SwapOrderStatus.ACTIVE)
                .toList());
  }

  public long firstOrderId() {
    return guard.read(() -> state.orderBook().firstOrderId());
  }

  public long nextOrderId() {
    return guard.read(() -> state.orderBook().nextOrderId());
  }

  public boolean isAllowedAsset(String asset) {
    return guard.read(() -> state.allowlist().isAllowed(asset));
  }

  public List<String> allowedAssets() {
    return guard.read(() -> state.allowlist().list());
  }

  public int allowedAssetCount() {
    return guard.read(() -> state.allowlist().size());
  }

  public BigDecimal claimable(String principal, String asset) {
    return guard.read(() -> state.claimableLedger().claimable(principal, asset));
  }

  public List<String> claimableAssets(String principal) {
    return guard.read(() -> state.claimableLedger().claimableAssets(principal));
  }

  public boolean hasClaimableAsset(String principal, String asset) {
    return guard.read(() -> state.claimableLedger().hasClaimableAsset(principal, asset));
  }

  public BigDecimal feeLiability(String asset) {
    return guard.read(() -> state.feeLiabilities().liability(asset));
  }

  public FeeSchedule feeSchedule() {
    return guard.read(state::feeSchedule);
  }

  public boolean isOrderCreationDisabled() {
    return guard.read(state::isOrderCreationDisabled);
  }

  public String owner() {
    return guard.read(state::owner);
  }

  public Duration orderExpiry() {
    return properties.getOrderExpiry();
  }

  public Duration gracePeriod() {
    return properties.getGracePeriod();
  }
}
