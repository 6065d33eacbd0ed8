package com.otcswap.engine.custody;

import com.otcswap.domain.swap.ChangeJournal;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asset backend kept in memory, used for local runs and tests. Balance changes made during a
 * settlement are journaled so they are undone together with engine state.
 */
public class InMemoryAssetTransferGateway implements AssetTransferGateway {
  private static final Logger log = LoggerFactory.getLogger(InMemoryAssetTransferGateway.class);

  private final String custodyAccount;
  private final ChangeJournal journal;
  private final Map<String, Map<String, BigDecimal>> balances = new HashMap<>();
  private final Map<String, AssetProfile> profiles = new ConcurrentHashMap<>();
  private final Map<String, TransferHook> hooks = new ConcurrentHashMap<>();

  public InMemoryAssetTransferGateway(String custodyAccount, ChangeJournal journal) {
    this.custodyAccount = custodyAccount;
    this.journal = journal;
  }

  public void registerAsset(String asset, AssetProfile profile) {
    profiles.put(asset, profile);
  }

  public void registerHook(String asset, TransferHook hook) {
    hooks.put(asset, hook);
  }

  public synchronized void mint(String asset, String holder, BigDecimal amount) {
    if (amount == null || amount.signum() <= 0) {
      throw new IllegalArgumentException("mint amount must be > 0");
    }
    adjust(asset, holder, amount);
    log.debug("Minted asset={} holder={} amount={}", asset, holder, amount);
  }

  @Override
  public synchronized BigDecimal balanceOf(String asset, String holder) {
    Map<String, BigDecimal> byHolder = balances.get(asset);
    if (byHolder == null) {
      return BigDecimal.ZERO;
    }
    return byHolder.getOrDefault(holder, BigDecimal.ZERO);
  }

  @Override
  public BigDecimal transferIn(String asset, String from, String to, BigDecimal amount) {
    AssetProfile profile = profileOf(asset);
    if (profile.reportsFailure()) {
      return BigDecimal.ZERO;
    }
    move(asset, profile, from, to, amount);
    return amount;
  }

  @Override
  public boolean transferOut(String asset, String to, BigDecimal amount) {
    AssetProfile profile = profileOf(asset);
    if (profile.reportsFailure()) {
      return false;
    }
    move(asset, profile, custodyAccount, to, amount);
    return true;
  }

  private void move(String asset, AssetProfile profile, String from, String to, BigDecimal amount) {
    if (profile.paused()) {
      throw new IllegalStateException("Asset " + asset + " is paused");
    }
    TransferHook hook = hooks.get(asset);
    if (hook != null) {
      hook.beforeTransfer(asset, from, to, amount);
    }
    if (profile.silentNoOp()) {
      return;
    }
    synchronized (this) {
      BigDecimal available = balanceOf(asset, from);
      if (available.compareTo(amount) < 0) {
        throw new IllegalStateException(
            "Insufficient " + asset + " balance for " + from + ": " + available + " < " + amount);
      }
      BigDecimal tax =
          amount.multiply(profile.transferTaxRate()).setScale(amount.scale(), RoundingMode.DOWN);
      adjust(asset, from, amount.negate());
      adjust(asset, to, amount.subtract(tax));
    }
  }

  private AssetProfile profileOf(String asset) {
    return profiles.getOrDefault(asset, AssetProfile.STANDARD);
  }

  private void adjust(String asset, String holder, BigDecimal delta) {
    Map<String, BigDecimal> byHolder = balances.computeIfAbsent(asset, key -> new HashMap<>());
    BigDecimal previous = byHolder.get(holder);
    BigDecimal base = previous == null ? BigDecimal.ZERO : previous;
    byHolder.put(holder, base.add(delta));
    journal.record(
        () -> {
          synchronized (this) {
            if (previous == null) {
              byHolder.remove(holder);
            } else {
              byHolder.put(holder, previous);
            }
          }
        });
  }
}
