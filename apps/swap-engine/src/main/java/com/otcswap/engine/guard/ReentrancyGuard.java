package com.otcswap.engine.guard;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Serializes engine mutations. A thread already inside a mutation (for example while an asset
 * transfer calls back into the engine) is refused instead of re-entering; other threads wait.
 */
@Component
public class ReentrancyGuard {
  private final ReentrantLock lock = new ReentrantLock(true);

  public <T> T enter(String operation, Supplier<T> action) {
    if (lock.isHeldByCurrentThread()) {
      throw new ReentrantCallException(operation);
    }
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public <T> T read(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public boolean isEntered() {
    return lock.isLocked();
  }
}
