package com.otcswap.domain.swap;

import java.util.Objects;

public class SwapDomainException extends RuntimeException {
  private final SwapErrorCategory category;

  public SwapDomainException(SwapErrorCategory category, String message) {
    super(message);
    this.category = Objects.requireNonNull(category, "category must not be null");
  }

  public SwapDomainException(SwapErrorCategory category, String message, Throwable cause) {
    super(message, cause);
    this.category = Objects.requireNonNull(category, "category must not be null");
  }

  public SwapErrorCategory category() {
    return category;
  }
}
