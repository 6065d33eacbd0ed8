package com.otcswap.domain.swap;

import java.math.BigDecimal;

public class InsufficientClaimableException extends SwapValidationException {
  private final String principal;
  private final String asset;
  private final BigDecimal requested;
  private final BigDecimal available;

  public InsufficientClaimableException(
      String principal, String asset, BigDecimal requested, BigDecimal available) {
    super(
        String.format(
            "Insufficient claimable %s for %s: requested=%s, available=%s",
            asset, principal, requested, available));
    this.principal = principal;
    this.asset = asset;
    this.requested = requested;
    this.available = available;
  }

  public String principal() {
    return principal;
  }

  public String asset() {
    return asset;
  }

  public BigDecimal requested() {
    return requested;
  }

  public BigDecimal available() {
    return available;
  }
}
