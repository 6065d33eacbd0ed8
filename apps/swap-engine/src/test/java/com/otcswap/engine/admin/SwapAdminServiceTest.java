package com.otcswap.engine.admin;

import static com.otcswap.engine.support.AmountAssertions.assertAmount;
import static com.otcswap.engine.support.SwapEngineFixture.BUY;
import static com.otcswap.engine.support.SwapEngineFixture.FEE;
import static com.otcswap.engine.support.SwapEngineFixture.MAKER;
import static com.otcswap.engine.support.SwapEngineFixture.OWNER;
import static com.otcswap.engine.support.SwapEngineFixture.SELL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.otcswap.domain.swap.FeeSchedule;
import com.otcswap.domain.swap.OrderStateException;
import com.otcswap.domain.swap.SwapOrder;
import com.otcswap.domain.swap.SwapValidationException;
import com.otcswap.domain.swap.UnauthorizedCallerException;
import com.otcswap.engine.events.AllowlistUpdatedEvent;
import com.otcswap.engine.events.FeeConfigUpdatedEvent;
import com.otcswap.engine.events.OrderCreationToggledEvent;
import com.otcswap.engine.events.OwnershipTransferredEvent;
import com.otcswap.engine.support.SwapEngineFixture;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SwapAdminServiceTest {
  private SwapEngineFixture engine;

  @BeforeEach
  void setUp() {
    engine = new SwapEngineFixture();
  }

  @Test
  void shouldRejectCallsFromNonOwner() {
    assertThrows(
        UnauthorizedCallerException.class,
        () -> engine.admin.updateFeeConfig(MAKER, FEE, BigDecimal.TEN));
    assertThrows(UnauthorizedCallerException.class, () -> engine.admin.disableOrderCreation(MAKER));
    assertThrows(
        UnauthorizedCallerException.class,
        () -> engine.admin.updateAllowlist(MAKER, List.of("DOGE"), List.of(true)));
    assertThrows(
        UnauthorizedCallerException.class, () -> engine.admin.transferOwnership(MAKER, MAKER));
    assertTrue(engine.events.committed().isEmpty());
  }

  @Test
  void shouldApplyNewFeeOnlyToLaterOrders() {
    engine.fund(MAKER, SELL, "200");
    engine.fund(MAKER, FEE, "10");
    SwapOrder before = engine.createOrder("100", "200");

    FeeSchedule updated = engine.admin.updateFeeConfig(OWNER, FEE, new BigDecimal("3"));
    SwapOrder after = engine.createOrder("100", "200");

    assertAmount("3", updated.feeAmount());
    assertAmount("1", engine.query.findOrder(before.id()).orElseThrow().feeAmount());
    assertAmount("3", after.feeAmount());
    assertAmount("4", engine.query.feeLiability(FEE));
    FeeConfigUpdatedEvent event = engine.events.committed(FeeConfigUpdatedEvent.class).get(0);
    assertAmount("1", event.previous().feeAmount());
  }

  @Test
  void shouldRejectInvalidFeeConfig() {
    assertThrows(
        SwapValidationException.class,
        () -> engine.admin.updateFeeConfig(OWNER, " ", BigDecimal.ONE));
    assertThrows(
        SwapValidationException.class,
        () -> engine.admin.updateFeeConfig(OWNER, FEE, BigDecimal.ZERO));
    assertAmount("1", engine.query.feeSchedule().feeAmount());
  }

  @Test
  void shouldToggleOrderCreationOnlyWhenStateChanges() {
    assertThrows(OrderStateException.class, () -> engine.admin.enableOrderCreation(OWNER));

    engine.admin.disableOrderCreation(OWNER);
    assertTrue(engine.query.isOrderCreationDisabled());
    assertThrows(OrderStateException.class, () -> engine.admin.disableOrderCreation(OWNER));

    engine.admin.enableOrderCreation(OWNER);
    assertFalse(engine.query.isOrderCreationDisabled());
    List<OrderCreationToggledEvent> toggles =
        engine.events.committed(OrderCreationToggledEvent.class);
    assertEquals(2, toggles.size());
    assertTrue(toggles.get(0).disabled());
    assertFalse(toggles.get(1).disabled());
  }

  @Test
  void shouldApplyAllowlistBatch() {
    engine.admin.updateAllowlist(OWNER, List.of("DOGE", SELL, "PEPE"), List.of(true, false, true));

    assertTrue(engine.query.isAllowedAsset("DOGE"));
    assertFalse(engine.query.isAllowedAsset(SELL));
    assertEquals(4, engine.query.allowedAssetCount());
    assertEquals(List.of("DOGE", BUY, FEE, "PEPE"), engine.query.allowedAssets());
    assertEquals(1, engine.events.committed(AllowlistUpdatedEvent.class).size());
  }

  @Test
  void shouldApplyRepeatedAllowlistEntriesInOrder() {
    engine.admin.updateAllowlist(OWNER, List.of("DOGE", "DOGE"), List.of(true, false));

    assertFalse(engine.query.isAllowedAsset("DOGE"));
    AllowlistUpdatedEvent event = engine.events.committed(AllowlistUpdatedEvent.class).get(0);
    assertEquals(List.of("DOGE", "DOGE"), event.assets());
    assertEquals(List.of(true, false), event.allowed());
  }

  @Test
  void shouldRejectMalformedAllowlistBatches() {
    engine.properties.setMaxAllowlistBatch(2);

    assertEquals(
        "Empty arrays",
        assertThrows(
                SwapValidationException.class,
                () -> engine.admin.updateAllowlist(OWNER, List.of(), List.of()))
            .getMessage());
    assertEquals(
        "Arrays length mismatch",
        assertThrows(
                SwapValidationException.class,
                () -> engine.admin.updateAllowlist(OWNER, List.of("DOGE"), List.of(true, false)))
            .getMessage());
    assertThrows(
        SwapValidationException.class,
        () ->
            engine.admin.updateAllowlist(
                OWNER, List.of("A1", "A2", "A3"), List.of(true, true, true)));
    assertThrows(
        SwapValidationException.class,
        () -> engine.admin.updateAllowlist(OWNER, List.of("DOGE", " "), List.of(true, true)));
    assertFalse(engine.query.isAllowedAsset("DOGE"));
  }

  @Test
  void shouldHandOverOwnership() {
    engine.admin.transferOwnership(OWNER, "new-owner");

    assertEquals("new-owner", engine.query.owner());
    assertThrows(UnauthorizedCallerException.class, () -> engine.admin.disableOrderCreation(OWNER));
    engine.admin.disableOrderCreation("new-owner");
    assertEquals(
        OWNER, engine.events.committed(OwnershipTransferredEvent.class).get(0).previousOwner());
    assertThrows(
        SwapValidationException.class, () -> engine.admin.transferOwnership("new-owner", " "));
  }
}
