package com.otcswap.engine.state;

import com.otcswap.domain.swap.AssetAllowlist;
import com.otcswap.domain.swap.ChangeJournal;
import com.otcswap.domain.swap.ClaimableLedger;
import com.otcswap.domain.swap.FeeLiabilityBook;
import com.otcswap.domain.swap.FeeSchedule;
import com.otcswap.domain.swap.JournaledValue;
import com.otcswap.domain.swap.OrderBook;
import com.otcswap.domain.swap.SwapValidationException;
import java.util.Collection;

/** All mutable engine state. Every structure records its changes in the same journal. */
public class SwapEngineState {
  private final OrderBook orderBook;
  private final AssetAllowlist allowlist;
  private final ClaimableLedger claimableLedger;
  private final FeeLiabilityBook feeLiabilities;
  private final JournaledValue<FeeSchedule> feeSchedule;
  private final JournaledValue<Boolean> orderCreationDisabled;
  private final JournaledValue<String> owner;

  public SwapEngineState(
      String owner,
      Collection<String> allowedAssets,
      FeeSchedule initialFee,
      ChangeJournal journal) {
    if (owner == null || owner.isBlank()) {
      throw new SwapValidationException("Invalid owner");
    }
    if (initialFee == null) {
      throw new SwapValidationException("Invalid fee token");
    }
    this.orderBook = new OrderBook(journal);
    this.allowlist = new AssetAllowlist(allowedAssets, journal);
    this.claimableLedger = new ClaimableLedger(journal);
    this.feeLiabilities = new FeeLiabilityBook(journal);
    this.feeSchedule = new JournaledValue<>(journal, initialFee);
    this.orderCreationDisabled = new JournaledValue<>(journal, Boolean.FALSE);
    this.owner = new JournaledValue<>(journal, owner);
  }

  public OrderBook orderBook() {
    return orderBook;
  }

  public AssetAllowlist allowlist() {
    return allowlist;
  }

  public ClaimableLedger claimableLedger() {
    return claimableLedger;
  }

  public FeeLiabilityBook feeLiabilities() {
    return feeLiabilities;
  }

  public FeeSchedule feeSchedule() {
    return feeSchedule.get();
  }

  public void updateFeeSchedule(FeeSchedule next) {
    feeSchedule.set(next);
  }

  public boolean isOrderCreationDisabled() {
    return orderCreationDisabled.get();
  }

  public void setOrderCreationDisabled(boolean disabled) {
    orderCreationDisabled.set(disabled);
  }

  public String owner() {
    return owner.get();
  }

  public void transferOwnership(String newOwner) {
    owner.set(newOwner);
  }
}
