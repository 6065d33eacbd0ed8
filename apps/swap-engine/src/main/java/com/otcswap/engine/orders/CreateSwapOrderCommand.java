package com.otcswap.engine.orders;

import java.math.BigDecimal;

/** {@code taker} is null for an order any counterparty may fill. */
public record CreateSwapOrderCommand(
    String maker,
    String taker,
    String sellAsset,
    BigDecimal sellAmount,
    String buyAsset,
    BigDecimal buyAmount) {}
