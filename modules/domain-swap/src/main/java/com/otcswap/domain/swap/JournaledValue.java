package com.otcswap.domain.swap;

import java.util.Objects;

public final class JournaledValue<T> {
  private final ChangeJournal journal;
  private T value;

  public JournaledValue(ChangeJournal journal, T initialValue) {
    this.journal = Objects.requireNonNull(journal, "journal must not be null");
    this.value = initialValue;
  }

  public T get() {
    return value;
  }

  public void set(T next) {
    T previous = value;
    journal.record(() -> value = previous);
    value = next;
  }
}
