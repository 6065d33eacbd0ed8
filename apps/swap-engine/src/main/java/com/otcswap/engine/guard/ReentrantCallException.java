package com.otcswap.engine.guard;

import com.otcswap.domain.swap.SwapDomainException;
import com.otcswap.domain.swap.SwapErrorCategory;

public class ReentrantCallException extends SwapDomainException {
  private final String operation;

  public ReentrantCallException(String operation) {
    super(SwapErrorCategory.STATE, "ReentrancyGuard: reentrant call to " + operation);
    this.operation = operation;
  }

  public String operation() {
    return operation;
  }
}
