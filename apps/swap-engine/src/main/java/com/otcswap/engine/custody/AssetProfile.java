package com.otcswap.engine.custody;

import java.math.BigDecimal;

/**
 * Behaviour of an asset in the in-memory backend. {@code paused} assets throw on every transfer,
 * {@code reportsFailure} assets refuse without moving anything, {@code silentNoOp} assets report
 * success without moving anything and a positive {@code transferTaxRate} burns that share of each
 * transfer before it reaches the recipient.
 */
public record AssetProfile(
    boolean paused, boolean reportsFailure, boolean silentNoOp, BigDecimal transferTaxRate) {
  public static final AssetProfile STANDARD = new AssetProfile(false, false, false, BigDecimal.ZERO);

  public AssetProfile {
    if (transferTaxRate == null
        || transferTaxRate.signum() < 0
        || transferTaxRate.compareTo(BigDecimal.ONE) > 0) {
      throw new IllegalArgumentException("transferTaxRate must be between 0 and 1");
    }
  }

  public static AssetProfile pausedAsset() {
    return new AssetProfile(true, false, false, BigDecimal.ZERO);
  }

  public static AssetProfile reportingFailure() {
    return new AssetProfile(false, true, false, BigDecimal.ZERO);
  }

  public static AssetProfile silentNoOpAsset() {
    return new AssetProfile(false, false, true, BigDecimal.ZERO);
  }

  public static AssetProfile taxed(BigDecimal rate) {
    return new AssetProfile(false, false, false, rate);
  }
}
