package com.otcswap.domain.swap;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Amounts owed to principals, keyed by principal and asset. A principal's asset list holds an
 * asset exactly when the owed amount is nonzero.
 */
public final class ClaimableLedger {
  private final ChangeJournal journal;
  private final Map<String, Map<String, BigDecimal>> balances = new HashMap<>();
  private final Map<String, EnumerableSet<String>> assetsByPrincipal = new HashMap<>();
  private final Map<String, BigDecimal> outstandingByAsset = new HashMap<>();

  public ClaimableLedger(ChangeJournal journal) {
    this.journal = Objects.requireNonNull(journal, "journal must not be null");
  }

  public BigDecimal credit(String principal, String asset, BigDecimal amount, CreditReason reason) {
    Objects.requireNonNull(reason, "reason must not be null");
    if (amount == null || amount.signum() == 0) {
      return claimable(principal, asset);
    }
    if (amount.signum() < 0) {
      throw new LedgerInvariantException("Credit amount must not be negative");
    }
    requirePrincipal(principal);
    AssetAllowlist.requireValidAsset(asset);

    BigDecimal next = claimable(principal, asset).add(amount);
    writeBalance(principal, asset, next);
    adjustOutstanding(asset, amount);
    assetsFor(principal).add(asset);
    return next;
  }

  public BigDecimal debit(String principal, String asset, BigDecimal amount) {
    requirePrincipal(principal);
    AssetAllowlist.requireValidAsset(asset);
    if (amount == null || amount.signum() <= 0) {
      throw new SwapValidationException("Amount must be greater than 0");
    }
    BigDecimal available = claimable(principal, asset);
    if (amount.compareTo(available) > 0) {
      throw new InsufficientClaimableException(principal, asset, amount, available);
    }

    BigDecimal next = available.subtract(amount);
    writeBalance(principal, asset, next);
    adjustOutstanding(asset, amount.negate());
    if (next.signum() == 0) {
      removeAsset(principal, asset);
    }
    return next;
  }

  public boolean removeAsset(String principal, String asset) {
    EnumerableSet<String> assets = assetsByPrincipal.get(principal);
    return assets != null && assets.remove(asset);
  }

  public BigDecimal claimable(String principal, String asset) {
    Map<String, BigDecimal> byAsset = balances.get(principal);
    if (byAsset == null) {
      return BigDecimal.ZERO;
    }
    return byAsset.getOrDefault(asset, BigDecimal.ZERO);
  }

  public List<String> claimableAssets(String principal) {
    EnumerableSet<String> assets = assetsByPrincipal.get(principal);
    return assets == null ? List.of() : assets.values();
  }

  public boolean hasClaimableAsset(String principal, String asset) {
    EnumerableSet<String> assets = assetsByPrincipal.get(principal);
    return assets != null && assets.contains(asset);
  }

  public BigDecimal totalOutstanding(String asset) {
    return outstandingByAsset.getOrDefault(asset, BigDecimal.ZERO);
  }

  /** Assets with a nonzero amount owed to at least one principal. */
  public Set<String> outstandingAssets() {
    Set<String> assets = new TreeSet<>();
    for (Map.Entry<String, BigDecimal> entry : outstandingByAsset.entrySet()) {
      if (entry.getValue().signum() != 0) {
        assets.add(entry.getKey());
      }
    }
    return assets;
  }

  private void writeBalance(String principal, String asset, BigDecimal next) {
    Map<String, BigDecimal> byAsset = balances.computeIfAbsent(principal, key -> new HashMap<>());
    BigDecimal previous = byAsset.put(asset, next);
    journal.record(
        () -> {
          if (previous == null) {
            byAsset.remove(asset);
          } else {
            byAsset.put(asset, previous);
          }
        });
  }

  private void adjustOutstanding(String asset, BigDecimal delta) {
    BigDecimal previous = outstandingByAsset.get(asset);
    BigDecimal base = previous == null ? BigDecimal.ZERO : previous;
    outstandingByAsset.put(asset, base.add(delta));
    journal.record(
        () -> {
          if (previous == null) {
            outstandingByAsset.remove(asset);
          } else {
            outstandingByAsset.put(asset, previous);
          }
        });
  }

  private EnumerableSet<String> assetsFor(String principal) {
    return assetsByPrincipal.computeIfAbsent(principal, key -> new EnumerableSet<>(journal));
  }

  private static void requirePrincipal(String principal) {
    if (principal == null || principal.isBlank()) {
      throw new SwapValidationException("Invalid recipient");
    }
  }
}
