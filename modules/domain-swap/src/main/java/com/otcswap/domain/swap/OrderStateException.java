package com.otcswap.domain.swap;

public class OrderStateException extends SwapDomainException {
  public OrderStateException(String message) {
    super(SwapErrorCategory.STATE, message);
  }
}
