package com.otcswap.domain.swap;

public class SwapValidationException extends SwapDomainException {
  public SwapValidationException(String message) {
    super(SwapErrorCategory.VALIDATION, message);
  }
}
