package com.otcswap.domain.swap;

import java.math.BigDecimal;

public record FeeSchedule(String feeAsset, BigDecimal feeAmount) {
  public FeeSchedule {
    if (feeAsset == null || feeAsset.isBlank()) {
      throw new SwapValidationException("Invalid fee token");
    }
    if (feeAmount == null || feeAmount.signum() <= 0) {
      throw new SwapValidationException("Invalid fee amount");
    }
  }
}
