package com.otcswap.domain.swap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongFunction;

/**
 * Sequence-numbered order slots. Each id is assigned once; a slot holds an order until it is
 * tombstoned. The cleanup cursor only moves forward.
 */
public final class OrderBook {
  private final ChangeJournal journal;
  private final Map<Long, SwapOrder> slots = new HashMap<>();
  private long nextOrderId;
  private long firstOrderId;

  public OrderBook(ChangeJournal journal) {
    this.journal = Objects.requireNonNull(journal, "journal must not be null");
  }

  public SwapOrder insert(LongFunction<SwapOrder> orderFactory) {
    long id = nextOrderId;
    SwapOrder order = orderFactory.apply(id);
    if (order.id() != id) {
      throw new LedgerInvariantException("Order id " + order.id() + " does not match slot " + id);
    }
    slots.put(id, order);
    nextOrderId = id + 1;
    journal.record(
        () -> {
          slots.remove(id);
          nextOrderId = id;
        });
    return order;
  }

  public void replace(SwapOrder order) {
    SwapOrder previous = slots.get(order.id());
    if (previous == null) {
      throw new OrderStateException("Order does not exist");
    }
    slots.put(order.id(), order);
    journal.record(() -> slots.put(previous.id(), previous));
  }

  public SwapOrder tombstone(long id) {
    SwapOrder previous = slots.remove(id);
    if (previous == null) {
      throw new OrderStateException("Order does not exist");
    }
    journal.record(() -> slots.put(id, previous));
    return previous;
  }

  public void advanceCursor() {
    if (firstOrderId >= nextOrderId) {
      throw new LedgerInvariantException("Cleanup cursor cannot pass the next order id");
    }
    long previous = firstOrderId;
    firstOrderId = previous + 1;
    journal.record(() -> firstOrderId = previous);
  }

  public Optional<SwapOrder> find(long id) {
    return Optional.ofNullable(slots.get(id));
  }

  public SwapOrder require(long id) {
    SwapOrder order = slots.get(id);
    if (order == null) {
      throw new OrderStateException("Order does not exist");
    }
    return order;
  }

  public boolean isTombstoned(long id) {
    return id >= 0 && id < nextOrderId && !slots.containsKey(id);
  }

  public boolean hasPendingCleanup() {
    return firstOrderId < nextOrderId;
  }

  public List<SwapOrder> liveOrders() {
    List<SwapOrder> live = new ArrayList<>();
    for (long id = firstOrderId; id < nextOrderId; id++) {
      SwapOrder order = slots.get(id);
      if (order != null) {
        live.add(order);
      }
    }
    return live;
  }

  public long nextOrderId() {
    return nextOrderId;
  }

  public long firstOrderId() {
    return firstOrderId;
  }
}
