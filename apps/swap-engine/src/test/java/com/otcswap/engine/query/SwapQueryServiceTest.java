package com.otcswap.engine.query;

import static com.otcswap.engine.support.SwapEngineFixture.BUY;
import static com.otcswap.engine.support.SwapEngineFixture.FEE;
import static com.otcswap.engine.support.SwapEngineFixture.MAKER;
import static com.otcswap.engine.support.SwapEngineFixture.SELL;
import static com.otcswap.engine.support.SwapEngineFixture.TAKER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.otcswap.domain.swap.SwapOrder;
import com.otcswap.engine.support.SwapEngineFixture;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class SwapQueryServiceTest {
  @Test
  void shouldListOnlyActiveOrdersInLiveWindow() {
    SwapEngineFixture engine = new SwapEngineFixture();
    engine.fund(MAKER, SELL, "300");
    engine.fund(MAKER, FEE, "10");
    engine.fund(TAKER, BUY, "100");
    SwapOrder filled = engine.createOrder("100", "100");
    SwapOrder canceled = engine.createOrder("100", "100");
    SwapOrder open = engine.createOrder("100", "100");
    engine.orders.fillOrder(filled.id(), TAKER);
    engine.orders.cancelOrder(canceled.id(), MAKER);

    assertEquals(List.of(open.id()), engine.query.activeOrders().stream().map(SwapOrder::id).toList());
    assertEquals(3, engine.query.liveOrders().size());
    assertEquals(0L, engine.query.firstOrderId());
    assertEquals(3L, engine.query.nextOrderId());
  }

  @Test
  void shouldTreatUnassignedIdsAsAbsentButNotTombstoned() {
    SwapEngineFixture engine = new SwapEngineFixture();

    assertTrue(engine.query.findOrder(42L).isEmpty());
    assertFalse(engine.query.isTombstoned(42L));
    assertEquals(Duration.ofDays(7), engine.query.orderExpiry());
    assertEquals(Duration.ofDays(7), engine.query.gracePeriod());
    assertEquals(SwapEngineFixture.OWNER, engine.query.owner());
  }
}
