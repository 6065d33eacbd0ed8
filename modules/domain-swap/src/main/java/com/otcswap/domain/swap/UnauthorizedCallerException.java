package com.otcswap.domain.swap;

public class UnauthorizedCallerException extends SwapDomainException {
  private final String caller;

  public UnauthorizedCallerException(String caller, String message) {
    super(SwapErrorCategory.AUTHORIZATION, message);
    this.caller = caller;
  }

  public String caller() {
    return caller;
  }
}
