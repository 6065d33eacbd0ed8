package com.otcswap.domain.swap;

public enum SwapOrderStatus {
  ACTIVE,
  FILLED,
  CANCELED;

  public boolean isTerminal() {
    return this == FILLED || this == CANCELED;
  }
}
