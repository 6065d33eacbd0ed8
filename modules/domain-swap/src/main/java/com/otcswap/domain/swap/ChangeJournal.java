package com.otcswap.domain.swap;

/**
 * Receives compensating actions for every in-memory mutation so that a failed settlement can be
 * undone. Compensations are replayed in reverse order of recording.
 */
@FunctionalInterface
public interface ChangeJournal {
  ChangeJournal UNTRACKED = undo -> {};

  void record(Runnable undo);
}
