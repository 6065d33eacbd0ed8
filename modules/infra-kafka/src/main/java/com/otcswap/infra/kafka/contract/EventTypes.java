package com.otcswap.infra.kafka.contract;

public final class EventTypes {
  public static final String SWAP_ORDER_CREATED = "SwapOrderCreated";
  public static final String SWAP_ORDER_UPDATED = "SwapOrderUpdated";
  public static final String CLAIM_BALANCE_CHANGED = "ClaimBalanceChanged";
  public static final String ENGINE_CONFIG_CHANGED = "EngineConfigChanged";

  private EventTypes() {}
}
