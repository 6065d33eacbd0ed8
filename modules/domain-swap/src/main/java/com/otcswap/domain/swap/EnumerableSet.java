package com.otcswap.domain.swap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Set with O(1) membership, insertion and removal plus stable enumeration between mutations.
 * Removal moves the last element into the vacated slot.
 */
public final class EnumerableSet<T> {
  private final ChangeJournal journal;
  private final List<T> elements = new ArrayList<>();
  private final Map<T, Integer> positions = new HashMap<>();

  public EnumerableSet(ChangeJournal journal) {
    this.journal = Objects.requireNonNull(journal, "journal must not be null");
  }

  public boolean contains(T element) {
    return positions.containsKey(element);
  }

  public int size() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public T get(int index) {
    return elements.get(index);
  }

  public List<T> values() {
    return List.copyOf(elements);
  }

  public boolean add(T element) {
    Objects.requireNonNull(element, "element must not be null");
    if (positions.containsKey(element)) {
      return false;
    }
    journal.record(() -> swapRemove(element));
    append(element);
    return true;
  }

  /** Inserts without recording an undo step. Used to build initial state. */
  public boolean seed(T element) {
    Objects.requireNonNull(element, "element must not be null");
    if (positions.containsKey(element)) {
      return false;
    }
    append(element);
    return true;
  }

  public boolean remove(T element) {
    Integer index = positions.get(element);
    if (index == null) {
      return false;
    }
    int slot = index;
    int lastIndex = elements.size() - 1;
    T relocated = slot == lastIndex ? null : elements.get(lastIndex);
    journal.record(() -> restore(element, slot, relocated));
    swapRemove(element);
    return true;
  }

  private void append(T element) {
    positions.put(element, elements.size());
    elements.add(element);
  }

  // Returns the element that was moved into the removed slot, or null if the tail was removed.
  private T swapRemove(T element) {
    int index = positions.remove(element);
    int lastIndex = elements.size() - 1;
    T last = elements.remove(lastIndex);
    if (index == lastIndex) {
      return null;
    }
    elements.set(index, last);
    positions.put(last, index);
    return last;
  }

  private void restore(T element, int slot, T relocated) {
    if (relocated == null) {
      append(element);
      return;
    }
    elements.set(slot, element);
    positions.put(element, slot);
    append(relocated);
  }
}
