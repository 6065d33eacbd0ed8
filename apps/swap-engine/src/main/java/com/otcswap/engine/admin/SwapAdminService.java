package com.otcswap.engine.admin;

import com.otcswap.domain.swap.AssetAllowlist;
import com.otcswap.domain.swap.FeeSchedule;
import com.otcswap.domain.swap.OrderStateException;
import com.otcswap.domain.swap.SwapValidationException;
import com.otcswap.domain.swap.UnauthorizedCallerException;
import com.otcswap.engine.config.SwapEngineProperties;
import com.otcswap.engine.events.AllowlistUpdatedEvent;
import com.otcswap.engine.events.FeeConfigUpdatedEvent;
import com.otcswap.engine.events.OrderCreationToggledEvent;
import com.otcswap.engine.events.OwnershipTransferredEvent;
import com.otcswap.engine.state.SwapEngineState;
import com.otcswap.engine.tx.SettlementExecutor;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/** Owner-only engine controls. */
@Service
public class SwapAdminService {
  private static final Logger log = LoggerFactory.getLogger(SwapAdminService.class);

  private final SwapEngineState state;
  private final SettlementExecutor settlementExecutor;
  private final ApplicationEventPublisher eventPublisher;
  private final SwapEngineProperties properties;
  private final Clock clock;

  public SwapAdminService(
      SwapEngineState state,
      SettlementExecutor settlementExecutor,
      ApplicationEventPublisher eventPublisher,
      SwapEngineProperties properties,
      Clock clock) {
    this.state = state;
    this.settlementExecutor = settlementExecutor;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  public FeeSchedule updateFeeConfig(String caller, String feeAsset, BigDecimal feeAmount) {
    return settlementExecutor.execute(
        "updateFeeConfig",
        () -> {
          requireOwner(caller);
          FeeSchedule previous = state.feeSchedule();
          FeeSchedule next = new FeeSchedule(feeAsset, feeAmount);
          state.updateFeeSchedule(next);
          eventPublisher.publishEvent(
              new FeeConfigUpdatedEvent(caller, previous, next, clock.instant()));
          log.info(
              "Fee config updated actor={} fee_asset={} fee_amount={}",
              caller,
              next.feeAsset(),
              next.feeAmount());
          return next;
        });
  }

  public void disableOrderCreation(String caller) {
    settlementExecutor.run(
        "disableOrderCreation",
        () -> {
          requireOwner(caller);
          if (state.isOrderCreationDisabled()) {
            throw new OrderStateException("Order creation already disabled");
          }
          toggle(caller, true);
        });
  }

  public void enableOrderCreation(String caller) {
    settlementExecutor.run(
        "enableOrderCreation",
        () -> {
          requireOwner(caller);
          if (!state.isOrderCreationDisabled()) {
            throw new OrderStateException("Order creation is not disabled");
          }
          toggle(caller, false);
        });
  }

  public void updateAllowlist(String caller, List<String> assets, List<Boolean> allowed) {
    settlementExecutor.run(
        "updateAllowlist",
        () -> {
          requireOwner(caller);
          validateBatch(assets, allowed);
          AssetAllowlist allowlist = state.allowlist();
          for (int i = 0; i < assets.size(); i++) {
            if (allowed.get(i)) {
              allowlist.add(assets.get(i));
            } else {
              allowlist.remove(assets.get(i));
            }
          }
          eventPublisher.publishEvent(
              new AllowlistUpdatedEvent(
                  caller, List.copyOf(assets), List.copyOf(allowed), clock.instant()));
          log.info(
              "Allowlist updated actor={} entries={} allowed_count={}",
              caller,
              assets.size(),
              allowlist.size());
        });
  }

  public void transferOwnership(String caller, String newOwner) {
    settlementExecutor.run(
        "transferOwnership",
        () -> {
          requireOwner(caller);
          if (newOwner == null || newOwner.isBlank()) {
            throw new SwapValidationException("Invalid owner");
          }
          state.transferOwnership(newOwner);
          eventPublisher.publishEvent(
              new OwnershipTransferredEvent(caller, newOwner, clock.instant()));
          log.info("Ownership transferred previous_owner={} new_owner={}", caller, newOwner);
        });
  }

  private void toggle(String caller, boolean disabled) {
    state.setOrderCreationDisabled(disabled);
    eventPublisher.publishEvent(new OrderCreationToggledEvent(caller, disabled, clock.instant()));
    log.info("Order creation toggled actor={} disabled={}", caller, disabled);
  }

  private void validateBatch(List<String> assets, List<Boolean> allowed) {
    if (assets == null || allowed == null || assets.isEmpty()) {
      throw new SwapValidationException("Empty arrays");
    }
    if (assets.size() != allowed.size()) {
      throw new SwapValidationException("Arrays length mismatch");
    }
    if (assets.size() > properties.getMaxAllowlistBatch()) {
      throw new SwapValidationException(
          "Too many tokens in batch: max " + properties.getMaxAllowlistBatch());
    }
    for (int i = 0; i < assets.size(); i++) {
      AssetAllowlist.requireValidAsset(assets.get(i));
      if (allowed.get(i) == null) {
        throw new SwapValidationException("Invalid allowed flag for " + assets.get(i));
      }
    }
  }

  private void requireOwner(String caller) {
    if (caller == null || !caller.equals(state.owner())) {
      throw new UnauthorizedCallerException(caller, "Caller is not the owner");
    }
  }
}
