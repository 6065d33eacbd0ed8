package com.otcswap.domain.swap;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public final class FeeLiabilityBook {
  private final ChangeJournal journal;
  private final Map<String, BigDecimal> liabilities = new HashMap<>();

  public FeeLiabilityBook(ChangeJournal journal) {
    this.journal = Objects.requireNonNull(journal, "journal must not be null");
  }

  public BigDecimal accrue(String asset, BigDecimal amount) {
    AssetAllowlist.requireValidAsset(asset);
    if (amount == null || amount.signum() < 0) {
      throw new LedgerInvariantException("Fee accrual must not be negative");
    }
    return write(asset, liability(asset).add(amount));
  }

  public BigDecimal release(String asset, BigDecimal amount) {
    AssetAllowlist.requireValidAsset(asset);
    if (amount == null || amount.signum() < 0) {
      throw new LedgerInvariantException("Fee release must not be negative");
    }
    BigDecimal current = liability(asset);
    if (current.compareTo(amount) < 0) {
      throw new LedgerInvariantException(
          "Insufficient accumulated fees for " + asset + ": liability=" + current + ", release=" + amount);
    }
    return write(asset, current.subtract(amount));
  }

  public BigDecimal liability(String asset) {
    return liabilities.getOrDefault(asset, BigDecimal.ZERO);
  }

  public Map<String, BigDecimal> snapshot() {
    return Map.copyOf(liabilities);
  }

  private BigDecimal write(String asset, BigDecimal next) {
    BigDecimal previous = liabilities.put(asset, next);
    journal.record(
        () -> {
          if (previous == null) {
            liabilities.remove(asset);
          } else {
            liabilities.put(asset, previous);
          }
        });
    return next;
  }
}
