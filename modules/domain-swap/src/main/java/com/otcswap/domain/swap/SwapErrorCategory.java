package com.otcswap.domain.swap;

public enum SwapErrorCategory {
  VALIDATION,
  AUTHORIZATION,
  STATE,
  EXTERNAL_EFFECT,
  INVARIANT
}
