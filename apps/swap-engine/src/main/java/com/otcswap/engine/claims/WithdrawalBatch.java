package com.otcswap.engine.claims;

import java.util.List;

/**
 * Outcome of a batch withdrawal. {@code staleEntriesRemoved} counts asset entries that were listed
 * with a zero balance and dropped without a transfer.
 */
public record WithdrawalBatch(
    String principal, List<Withdrawal> withdrawals, int staleEntriesRemoved) {
  public WithdrawalBatch {
    withdrawals = List.copyOf(withdrawals);
  }

  public boolean isEmpty() {
    return withdrawals.isEmpty();
  }
}
