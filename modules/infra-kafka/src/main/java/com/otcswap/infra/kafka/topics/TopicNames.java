package com.otcswap.infra.kafka.topics;

import java.util.List;

public final class TopicNames {
  public static final String SWAP_ORDERS_CREATED_V1 = "swap.orders.created.v1";
  public static final String SWAP_ORDERS_UPDATED_V1 = "swap.orders.updated.v1";
  public static final String SWAP_CLAIMS_UPDATED_V1 = "swap.claims.updated.v1";
  public static final String SWAP_CONFIG_UPDATED_V1 = "swap.config.updated.v1";

  private TopicNames() {}

  public static List<String> all() {
    return List.of(
        SWAP_ORDERS_CREATED_V1,
        SWAP_ORDERS_UPDATED_V1,
        SWAP_CLAIMS_UPDATED_V1,
        SWAP_CONFIG_UPDATED_V1);
  }
}
