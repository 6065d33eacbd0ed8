package com.otcswap.engine.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "swap.engine")
public class SwapEngineProperties {
  private String owner = "swap-admin";
  private String custodyAccount = "swap-engine-custody";
  private Duration orderExpiry = Duration.ofDays(7);
  private Duration gracePeriod = Duration.ofDays(7);
  private int maxAllowlistBatch = 100;
  private int defaultWithdrawBatch = 50;
  private String feeAsset;
  private BigDecimal feeAmount;
  private List<String> allowedAssets = new ArrayList<>();

  public String getOwner() {
    return owner;
  }

  public void setOwner(String owner) {
    this.owner = owner;
  }

  public String getCustodyAccount() {
    return custodyAccount;
  }

  public void setCustodyAccount(String custodyAccount) {
    this.custodyAccount = custodyAccount;
  }

  public Duration getOrderExpiry() {
    return orderExpiry;
  }

  public void setOrderExpiry(Duration orderExpiry) {
    this.orderExpiry = orderExpiry;
  }

  public Duration getGracePeriod() {
    return gracePeriod;
  }

  public void setGracePeriod(Duration gracePeriod) {
    this.gracePeriod = gracePeriod;
  }

  public int getMaxAllowlistBatch() {
    return maxAllowlistBatch;
  }

  public void setMaxAllowlistBatch(int maxAllowlistBatch) {
    this.maxAllowlistBatch = maxAllowlistBatch;
  }

  public int getDefaultWithdrawBatch() {
    return defaultWithdrawBatch;
  }

  public void setDefaultWithdrawBatch(int defaultWithdrawBatch) {
    this.defaultWithdrawBatch = defaultWithdrawBatch;
  }

  public String getFeeAsset() {
    return feeAsset;
  }

  public void setFeeAsset(String feeAsset) {
    this.feeAsset = feeAsset;
  }

  public BigDecimal getFeeAmount() {
    return feeAmount;
  }

  public void setFeeAmount(BigDecimal feeAmount) {
    this.feeAmount = feeAmount;
  }

  public List<String> getAllowedAssets() {
    return allowedAssets;
  }

  public void setAllowedAssets(List<String> allowedAssets) {
    this.allowedAssets = allowedAssets;
  }
}
