package com.otcswap.domain.swap;

import java.util.EnumSet;
import java.util.Map;

public final class SwapOrderStateMachine {
  private static final Map<SwapOrderStatus, EnumSet<SwapOrderStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          SwapOrderStatus.ACTIVE, EnumSet.of(SwapOrderStatus.FILLED, SwapOrderStatus.CANCELED),
          SwapOrderStatus.FILLED, EnumSet.noneOf(SwapOrderStatus.class),
          SwapOrderStatus.CANCELED, EnumSet.noneOf(SwapOrderStatus.class));

  private SwapOrderStateMachine() {}

  public static boolean canTransition(SwapOrderStatus from, SwapOrderStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<SwapOrderStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(SwapOrderStatus from, SwapOrderStatus to) {
    if (!canTransition(from, to)) {
      throw new OrderStateException("Order is not active: cannot move from " + from + " to " + to);
    }
  }
}
