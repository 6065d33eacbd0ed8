package com.otcswap.engine.custody;

import java.math.BigDecimal;

/** Invoked by the in-memory backend before an asset moves, like a token callback. */
@FunctionalInterface
public interface TransferHook {
  void beforeTransfer(String asset, String from, String to, BigDecimal amount);
}
