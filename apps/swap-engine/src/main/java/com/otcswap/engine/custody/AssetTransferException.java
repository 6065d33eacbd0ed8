package com.otcswap.engine.custody;

import com.otcswap.domain.swap.SwapDomainException;
import com.otcswap.domain.swap.SwapErrorCategory;

public class AssetTransferException extends SwapDomainException {
  private final String asset;

  public AssetTransferException(String asset, String message) {
    super(SwapErrorCategory.EXTERNAL_EFFECT, message);
    this.asset = asset;
  }

  public AssetTransferException(String asset, String message, Throwable cause) {
    super(SwapErrorCategory.EXTERNAL_EFFECT, message, cause);
    this.asset = asset;
  }

  public String asset() {
    return asset;
  }
}
