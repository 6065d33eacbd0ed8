package com.otcswap.engine;

import static com.otcswap.engine.support.AmountAssertions.assertAmount;
import static com.otcswap.engine.support.SwapEngineFixture.BUY;
import static com.otcswap.engine.support.SwapEngineFixture.CUSTODY;
import static com.otcswap.engine.support.SwapEngineFixture.FEE;
import static com.otcswap.engine.support.SwapEngineFixture.KEEPER;
import static com.otcswap.engine.support.SwapEngineFixture.MAKER;
import static com.otcswap.engine.support.SwapEngineFixture.SELL;
import static com.otcswap.engine.support.SwapEngineFixture.TAKER;
import static com.otcswap.engine.support.SwapEngineFixture.amount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.otcswap.domain.swap.OrderStateException;
import com.otcswap.domain.swap.SwapOrder;
import com.otcswap.domain.swap.SwapOrderStatus;
import com.otcswap.engine.cleanup.CleanupOutcome;
import com.otcswap.engine.custody.AssetProfile;
import com.otcswap.engine.custody.AssetTransferException;
import com.otcswap.engine.reconciliation.ReconciliationStatus;
import com.otcswap.engine.support.SwapEngineFixture;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SwapEngineScenariosTest {
  private static final List<String> ASSETS = List.of(SELL, BUY, FEE);
  private static final List<String> PRINCIPALS = List.of(MAKER, TAKER, KEEPER);

  private SwapEngineFixture engine;

  @BeforeEach
  void setUp() {
    engine = new SwapEngineFixture();
  }

  @Test
  void shouldSwapHundredAForTwoHundredB() {
    engine.fund(MAKER, SELL, "100");
    engine.fund(MAKER, FEE, "1");
    engine.fund(TAKER, BUY, "200");

    SwapOrder order = engine.createOrder("100", "200");
    assertConserved();
    engine.orders.fillOrder(order.id(), TAKER);
    assertConserved();

    assertAmount("200", engine.balance(MAKER, BUY));
    assertAmount("100", engine.balance(TAKER, SELL));
    assertAmount("0", engine.balance(MAKER, FEE));
    assertAmount("1", engine.balance(CUSTODY, FEE));
    assertAmount("1", engine.query.feeLiability(FEE));

    engine.clock.advance(Duration.ofDays(14).plusSeconds(1));
    engine.cleanup.cleanupExpiredOrders(KEEPER);
    engine.claims.withdrawAll(KEEPER);
    assertConserved();

    assertAmount("1", engine.balance(KEEPER, FEE));
    assertAmount("0", engine.balance(CUSTODY, FEE));
  }

  @Test
  void shouldReturnEscrowThroughCancelAndWithdraw() {
    engine.fund(MAKER, SELL, "100");
    engine.fund(MAKER, FEE, "1");

    SwapOrder order = engine.createOrder("100", "200");
    engine.orders.cancelOrder(order.id(), MAKER);
    assertConserved();
    engine.claims.withdraw(MAKER, SELL, amount("100"));
    assertConserved();

    assertAmount("100", engine.balance(MAKER, SELL));
    assertTrue(engine.query.claimableAssets(MAKER).isEmpty());

    engine.clock.advance(Duration.ofDays(14).plusSeconds(1));
    engine.cleanup.cleanupExpiredOrders(KEEPER);
    assertAmount("0", engine.query.claimable(MAKER, SELL));
    assertAmount("1", engine.query.claimable(KEEPER, FEE));
    assertConserved();
  }

  @Test
  void shouldNeverFillExpiredOrTombstonedOrder() {
    engine.fund(MAKER, SELL, "100");
    engine.fund(MAKER, FEE, "1");
    engine.fund(TAKER, BUY, "200");
    SwapOrder order = engine.createOrder("100", "200");

    engine.clock.advance(Duration.ofDays(7).plusSeconds(1));
    assertThrows(OrderStateException.class, () -> engine.orders.fillOrder(order.id(), TAKER));

    engine.clock.advance(Duration.ofDays(7));
    assertEquals(CleanupOutcome.CLEANED, engine.cleanup.cleanupExpiredOrders(KEEPER).outcome());
    assertAmount("100", engine.query.claimable(MAKER, SELL));

    OrderStateException ex =
        assertThrows(OrderStateException.class, () -> engine.orders.fillOrder(order.id(), TAKER));
    assertEquals("Order does not exist", ex.getMessage());
    assertThrows(OrderStateException.class, () -> engine.orders.cancelOrder(order.id(), MAKER));
    assertThrows(OrderStateException.class, () -> engine.cleanup.cleanupExpiredOrders(KEEPER));
    assertAmount("100", engine.query.claimable(MAKER, SELL));
    assertConserved();
  }

  @Test
  void shouldKeepEscrowExactForTaxedSellAsset() {
    engine.gateway.registerAsset(SELL, AssetProfile.taxed(new BigDecimal("0.01")));
    engine.fund(MAKER, SELL, "100.00");
    engine.fund(MAKER, FEE, "1");
    engine.fund(TAKER, BUY, "200");

    SwapOrder order = engine.createOrder("100.00", "200");
    assertAmount("99.00", order.sellAmount());

    assertThrows(AssetTransferException.class, () -> engine.orders.fillOrder(order.id(), TAKER));
    assertEquals(SwapOrderStatus.ACTIVE, engine.query.findOrder(order.id()).orElseThrow().status());
    assertAmount("200", engine.balance(TAKER, BUY));

    engine.orders.cancelOrder(order.id(), MAKER);
    engine.claims.withdrawAll(MAKER);

    assertAmount("98.01", engine.balance(MAKER, SELL));
    assertAmount("0", engine.balance(CUSTODY, SELL));
    assertConserved();
  }

  @Test
  void shouldConserveCustodyAcrossMixedActivity() {
    engine.fund(MAKER, SELL, "1000");
    engine.fund(MAKER, BUY, "1000");
    engine.fund(MAKER, FEE, "50");
    engine.fund(TAKER, BUY, "1000");
    engine.fund(TAKER, SELL, "1000");
    engine.fund(TAKER, FEE, "50");

    SwapOrder first = engine.createOrder("100", "150");
    SwapOrder second = engine.createOrder(TAKER, null, BUY, "80", SELL, "40");
    engine.admin.updateFeeConfig(SwapEngineFixture.OWNER, BUY, new BigDecimal("2.5"));
    SwapOrder third = engine.createOrder(MAKER, TAKER, SELL, "30", BUY, "60");
    assertConserved();

    engine.orders.fillOrder(first.id(), TAKER);
    engine.orders.cancelOrder(second.id(), TAKER);
    assertConserved();

    engine.clock.advance(Duration.ofDays(15));
    engine.cleanup.cleanupExpiredOrders(KEEPER);
    engine.cleanup.cleanupExpiredOrders(KEEPER);
    engine.cleanup.cleanupExpiredOrders(KEEPER);
    assertConserved();
    assertTrue(engine.query.findOrder(third.id()).isEmpty());

    for (String principal : PRINCIPALS) {
      engine.claims.withdrawAll(principal);
    }
    assertConserved();
    for (String asset : ASSETS) {
      assertAmount("0", engine.balance(CUSTODY, asset));
    }
    assertEquals(ReconciliationStatus.BALANCED, engine.reconciliation.runOnce().status());
  }

  private void assertConserved() {
    for (String asset : ASSETS) {
      BigDecimal owed = engine.query.feeLiability(asset);
      for (String principal : PRINCIPALS) {
        owed = owed.add(engine.query.claimable(principal, asset));
      }
      for (SwapOrder order : engine.query.activeOrders()) {
        if (order.sellAsset().equals(asset)) {
          owed = owed.add(order.sellAmount());
        }
      }
      assertEquals(
          0,
          owed.compareTo(engine.balance(CUSTODY, asset)),
          "custody of " + asset + " does not match engine liabilities");
    }
  }
}
