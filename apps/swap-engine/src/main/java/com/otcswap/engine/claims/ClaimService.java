package com.otcswap.engine.claims;

import com.otcswap.domain.swap.AssetAllowlist;
import com.otcswap.domain.swap.ClaimableLedger;
import com.otcswap.domain.swap.SwapValidationException;
import com.otcswap.engine.config.SwapEngineProperties;
import com.otcswap.engine.custody.CustodyTransfers;
import com.otcswap.engine.events.ClaimWithdrawnEvent;
import com.otcswap.engine.state.SwapEngineState;
import com.otcswap.engine.tx.SettlementExecutor;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Pays out claimable balances. The ledger is debited before each outbound transfer; a failed
 * transfer rolls back the whole call, batch withdrawals included.
 */
@Service
public class ClaimService {
  private static final Logger log = LoggerFactory.getLogger(ClaimService.class);

  private final SwapEngineState state;
  private final SettlementExecutor settlementExecutor;
  private final CustodyTransfers custodyTransfers;
  private final ApplicationEventPublisher eventPublisher;
  private final SwapEngineProperties properties;
  private final Clock clock;

  public ClaimService(
      SwapEngineState state,
      SettlementExecutor settlementExecutor,
      CustodyTransfers custodyTransfers,
      ApplicationEventPublisher eventPublisher,
      SwapEngineProperties properties,
      Clock clock) {
    this.state = state;
    this.settlementExecutor = settlementExecutor;
    this.custodyTransfers = custodyTransfers;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  public Withdrawal withdraw(String principal, String asset, BigDecimal amount) {
    return settlementExecutor.execute(
        "withdrawClaim",
        () -> {
          requirePrincipal(principal);
          AssetAllowlist.requireValidAsset(asset);
          return payOut(principal, asset, amount);
        });
  }

  public WithdrawalBatch withdrawAll(String principal) {
    return withdrawAll(principal, properties.getDefaultWithdrawBatch());
  }

  public WithdrawalBatch withdrawAll(String principal, int maxAssets) {
    return settlementExecutor.execute(
        "withdrawAllClaims", () -> doWithdrawAll(principal, maxAssets));
  }

  private WithdrawalBatch doWithdrawAll(String principal, int maxAssets) {
    requirePrincipal(principal);
    if (maxAssets <= 0) {
      throw new SwapValidationException("Max assets must be greater than 0");
    }
    ClaimableLedger ledger = state.claimableLedger();
    List<String> assets = ledger.claimableAssets(principal);
    List<Withdrawal> withdrawals = new ArrayList<>();
    int stale = 0;
    int processed = 0;
    for (int i = assets.size() - 1; i >= 0 && processed < maxAssets; i--, processed++) {
      String asset = assets.get(i);
      BigDecimal amount = ledger.claimable(principal, asset);
      if (amount.signum() == 0) {
        ledger.removeAsset(principal, asset);
        stale++;
        continue;
      }
      withdrawals.add(payOut(principal, asset, amount));
    }
    if (!withdrawals.isEmpty() || stale > 0) {
      log.info(
          "Claims withdrawn principal={} assets={} stale_removed={}",
          principal,
          withdrawals.size(),
          stale);
    }
    return new WithdrawalBatch(principal, withdrawals, stale);
  }

  private Withdrawal payOut(String principal, String asset, BigDecimal amount) {
    BigDecimal remaining = state.claimableLedger().debit(principal, asset, amount);
    custodyTransfers.payout(asset, principal, amount);
    eventPublisher.publishEvent(
        new ClaimWithdrawnEvent(principal, asset, amount, remaining, clock.instant()));
    log.debug(
        "Claim paid principal={} asset={} amount={} remaining={}",
        principal,
        asset,
        amount,
        remaining);
    return new Withdrawal(principal, asset, amount, remaining);
  }

  private static void requirePrincipal(String principal) {
    if (principal == null || principal.isBlank()) {
      throw new SwapValidationException("Invalid caller");
    }
  }
}
