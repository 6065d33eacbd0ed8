package com.otcswap.domain.swap;

import java.util.ArrayDeque;
import java.util.Deque;

public final class UndoLog implements ChangeJournal {
  private final Deque<Runnable> entries = new ArrayDeque<>();

  @Override
  public void record(Runnable undo) {
    if (undo == null) {
      throw new IllegalArgumentException("undo must not be null");
    }
    entries.push(undo);
  }

  public void rollback() {
    while (!entries.isEmpty()) {
      entries.pop().run();
    }
  }

  public void clear() {
    entries.clear();
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
