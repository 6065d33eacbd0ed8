package com.otcswap.engine.custody;

import com.otcswap.domain.swap.SwapDomainException;
import java.math.BigDecimal;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Calls the transfer gateway and checks each call against measured balance changes. */
public class CustodyTransfers {
  private static final Logger log = LoggerFactory.getLogger(CustodyTransfers.class);

  private final AssetTransferGateway gateway;
  private final String custodyAccount;

  public CustodyTransfers(AssetTransferGateway gateway, String custodyAccount) {
    this.gateway = gateway;
    this.custodyAccount = custodyAccount;
  }

  public String custodyAccount() {
    return custodyAccount;
  }

  public BigDecimal custodyBalance(String asset) {
    return gateway.balanceOf(asset, custodyAccount);
  }

  /** Pulls {@code amount} from {@code from} into custody and returns what custody actually gained. */
  public BigDecimal pullIntoCustody(String asset, String from, BigDecimal amount) {
    BigDecimal before = custodyBalance(asset);
    BigDecimal reported =
        call(asset, () -> gateway.transferIn(asset, from, custodyAccount, amount));
    BigDecimal received = custodyBalance(asset).subtract(before);
    requireReportedSuccess(asset, from, reported, received);
    if (reported.compareTo(received) != 0) {
      log.warn(
          "Asset transfer reported amount differs from received asset={} from={} requested={} reported={} received={}",
          asset,
          from,
          amount,
          reported,
          received);
    }
    if (received.signum() < 0) {
      throw new AssetTransferException(asset, "Custody balance decreased during transfer in");
    }
    return received;
  }

  /** Moves {@code amount} directly between two principals; the recipient must gain it exactly. */
  public void deliver(String asset, String from, String to, BigDecimal amount) {
    BigDecimal before = gateway.balanceOf(asset, to);
    BigDecimal reported = call(asset, () -> gateway.transferIn(asset, from, to, amount));
    BigDecimal delivered = gateway.balanceOf(asset, to).subtract(before);
    requireReportedSuccess(asset, from, reported, delivered);
    requireExact(asset, amount, delivered, "Buy transfer");
  }

  /** Releases escrow from custody; the recipient must gain {@code amount} exactly. */
  public void release(String asset, String to, BigDecimal amount) {
    BigDecimal before = gateway.balanceOf(asset, to);
    transferOut(asset, to, amount);
    requireExact(asset, amount, gateway.balanceOf(asset, to).subtract(before), "Sell transfer");
  }

  /** Pays a claim out of custody; custody must lose {@code amount} exactly. */
  public void payout(String asset, String to, BigDecimal amount) {
    BigDecimal before = custodyBalance(asset);
    transferOut(asset, to, amount);
    requireExact(asset, amount, before.subtract(custodyBalance(asset)), "Withdrawal");
  }

  private void transferOut(String asset, String to, BigDecimal amount) {
    boolean ok = call(asset, () -> gateway.transferOut(asset, to, amount));
    if (!ok) {
      throw new AssetTransferException(asset, "Transfer of " + asset + " to " + to + " failed");
    }
  }

  private static void requireReportedSuccess(
      String asset, String from, BigDecimal reported, BigDecimal moved) {
    if (reported == null || reported.signum() <= 0) {
      throw new AssetTransferException(
          asset,
          "Transfer of " + asset + " from " + from + " reported failure after moving "
              + moved.toPlainString());
    }
  }

  private static void requireExact(
      String asset, BigDecimal expected, BigDecimal actual, String leg) {
    if (expected.compareTo(actual) != 0) {
      throw new AssetTransferException(
          asset,
          leg + " of " + asset + " moved " + actual.toPlainString() + " instead of "
              + expected.toPlainString());
    }
  }

  private static <T> T call(String asset, Supplier<T> transfer) {
    try {
      return transfer.get();
    } catch (SwapDomainException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new AssetTransferException(asset, "Transfer of " + asset + " failed: " + ex.getMessage(), ex);
    }
  }
}
