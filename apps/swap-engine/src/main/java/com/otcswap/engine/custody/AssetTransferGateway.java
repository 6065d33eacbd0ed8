package com.otcswap.engine.custody;

import java.math.BigDecimal;

/**
 * Moves fungible asset balances between principals. Implementations are not trusted: a call may
 * throw, return a failure flag, report success without moving anything, or move a different
 * amount than requested. Callers verify effects through {@link #balanceOf}.
 */
public interface AssetTransferGateway {
  BigDecimal balanceOf(String asset, String holder);

  /** Moves {@code amount} from {@code from} to {@code to}; returns the amount reported moved. */
  BigDecimal transferIn(String asset, String from, String to, BigDecimal amount);

  /** Moves {@code amount} out of engine custody to {@code to}. */
  boolean transferOut(String asset, String to, BigDecimal amount);
}
