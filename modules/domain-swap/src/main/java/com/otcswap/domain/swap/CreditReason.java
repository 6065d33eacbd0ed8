package com.otcswap.domain.swap;

public enum CreditReason {
  ORDER_CANCELED,
  ORDER_EXPIRED,
  CLEANUP_REWARD
}
