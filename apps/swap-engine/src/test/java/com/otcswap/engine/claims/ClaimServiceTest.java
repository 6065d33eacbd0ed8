package com.otcswap.engine.claims;

import static com.otcswap.engine.support.AmountAssertions.assertAmount;
import static com.otcswap.engine.support.SwapEngineFixture.BUY;
import static com.otcswap.engine.support.SwapEngineFixture.CUSTODY;
import static com.otcswap.engine.support.SwapEngineFixture.FEE;
import static com.otcswap.engine.support.SwapEngineFixture.MAKER;
import static com.otcswap.engine.support.SwapEngineFixture.SELL;
import static com.otcswap.engine.support.SwapEngineFixture.amount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.otcswap.domain.swap.InsufficientClaimableException;
import com.otcswap.domain.swap.SwapValidationException;
import com.otcswap.engine.custody.AssetProfile;
import com.otcswap.engine.custody.AssetTransferException;
import com.otcswap.engine.events.ClaimWithdrawnEvent;
import com.otcswap.engine.support.SwapEngineFixture;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClaimServiceTest {
  private SwapEngineFixture engine;

  @BeforeEach
  void setUp() {
    engine = new SwapEngineFixture();
    engine.fund(MAKER, SELL, "100");
    engine.fund(MAKER, BUY, "20");
    engine.fund(MAKER, FEE, "10");
    engine.orders.cancelOrder(engine.createOrder("100", "50").id(), MAKER);
    engine.orders.cancelOrder(
        engine.createOrder(MAKER, null, BUY, "20", SELL, "5").id(), MAKER);
    engine.events.clear();
  }

  @Test
  void shouldKeepAssetDiscoverableAfterPartialWithdrawal() {
    Withdrawal withdrawal = engine.claims.withdraw(MAKER, SELL, amount("40"));

    assertAmount("60", withdrawal.remaining());
    assertAmount("40", engine.balance(MAKER, SELL));
    assertAmount("60", engine.balance(CUSTODY, SELL));
    assertTrue(engine.query.hasClaimableAsset(MAKER, SELL));
    assertEquals(1, engine.events.committed(ClaimWithdrawnEvent.class).size());
  }

  @Test
  void shouldDropAssetWhenFullyWithdrawn() {
    engine.claims.withdraw(MAKER, SELL, amount("100"));

    assertEquals(List.of(BUY), engine.query.claimableAssets(MAKER));
    assertAmount("0", engine.query.claimable(MAKER, SELL));
  }

  @Test
  void shouldRejectWithdrawalAboveClaimable() {
    InsufficientClaimableException ex =
        assertThrows(
            InsufficientClaimableException.class,
            () -> engine.claims.withdraw(MAKER, SELL, amount("100.5")));

    assertEquals(SELL, ex.asset());
    assertAmount("100", ex.available());
    assertAmount("100", engine.query.claimable(MAKER, SELL));
  }

  @Test
  void shouldRejectNonPositiveOrBlankWithdrawal() {
    assertThrows(SwapValidationException.class, () -> engine.claims.withdraw(MAKER, SELL, amount("0")));
    assertThrows(SwapValidationException.class, () -> engine.claims.withdraw(MAKER, " ", amount("1")));
  }

  @Test
  void shouldRestoreClaimWhenPayoutFails() {
    engine.gateway.registerAsset(SELL, AssetProfile.reportingFailure());

    assertThrows(
        AssetTransferException.class, () -> engine.claims.withdraw(MAKER, SELL, amount("100")));

    assertAmount("100", engine.query.claimable(MAKER, SELL));
    assertEquals(List.of(SELL, BUY), engine.query.claimableAssets(MAKER));
    assertTrue(engine.events.committed().isEmpty());
  }

  @Test
  void shouldWithdrawFromEndOfAssetListUpToCap() {
    WithdrawalBatch batch = engine.claims.withdrawAll(MAKER, 1);

    assertEquals(1, batch.withdrawals().size());
    assertEquals(BUY, batch.withdrawals().get(0).asset());
    assertAmount("20", engine.balance(MAKER, BUY));
    assertEquals(List.of(SELL), engine.query.claimableAssets(MAKER));
  }

  @Test
  void shouldDrainEverythingWithDefaultBatch() {
    WithdrawalBatch batch = engine.claims.withdrawAll(MAKER);

    assertEquals(2, batch.withdrawals().size());
    assertTrue(engine.query.claimableAssets(MAKER).isEmpty());
    assertAmount("100", engine.balance(MAKER, SELL));
    assertAmount("20", engine.balance(MAKER, BUY));
  }

  @Test
  void shouldRejectZeroCap() {
    assertThrows(SwapValidationException.class, () -> engine.claims.withdrawAll(MAKER, 0));
  }

  @Test
  void shouldReturnEmptyBatchWhenNothingIsClaimable() {
    WithdrawalBatch batch = engine.claims.withdrawAll("nobody", 5);

    assertTrue(batch.isEmpty());
    assertEquals(0, batch.staleEntriesRemoved());
  }

  @Test
  void shouldKeepEveryClaimWhenAnyBatchTransferFails() {
    engine.gateway.registerAsset(SELL, AssetProfile.pausedAsset());

    assertThrows(AssetTransferException.class, () -> engine.claims.withdrawAll(MAKER, 10));

    assertAmount("100", engine.query.claimable(MAKER, SELL));
    assertAmount("20", engine.query.claimable(MAKER, BUY));
    assertAmount("0", engine.balance(MAKER, BUY));
    assertAmount("20", engine.balance(CUSTODY, BUY));
    assertEquals(List.of(SELL, BUY), engine.query.claimableAssets(MAKER));
  }
}
