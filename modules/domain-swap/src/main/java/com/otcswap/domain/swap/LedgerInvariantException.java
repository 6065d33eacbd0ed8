package com.otcswap.domain.swap;

public class LedgerInvariantException extends SwapDomainException {
  public LedgerInvariantException(String message) {
    super(SwapErrorCategory.INVARIANT, message);
  }
}
