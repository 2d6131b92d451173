package io.caresync.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion: callers holding different keys never block each other,
 * callers holding the same key run one at a time.
 *
 * <p>Locks are reference counted and removed from the table when the last holder or
 * waiter leaves, so the table only grows with the number of keys in use.
 *
 * <p>This class is thread-safe. Locks are reentrant.
 */
public final class KeyedLocks {
  private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

  /**
   * Runs {@code action} while holding the lock for {@code key}.
   */
  public <T> T withLock(String key, Supplier<T> action) {
    Entry entry = acquireEntry(key);
    entry.lock.lock();
    try {
      return action.get();
    } finally {
      entry.lock.unlock();
      releaseEntry(key, entry);
    }
  }

  /**
   * Variant of {@link #withLock(String, Supplier)} for actions throwing checked exceptions.
   */
  public <T, E extends Exception> T withLockChecked(String key, LockedAction<T, E> action) throws E {
    Entry entry = acquireEntry(key);
    entry.lock.lock();
    try {
      return action.run();
    } finally {
      entry.lock.unlock();
      releaseEntry(key, entry);
    }
  }

  /**
   * Runs {@code action} only if the lock for {@code key} can be acquired within {@code timeoutMs}.
   *
   * @return {@code true} if the action ran
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean tryWithLock(String key, long timeoutMs, Runnable action) throws InterruptedException {
    Entry entry = acquireEntry(key);
    boolean locked = false;
    try {
      locked = entry.lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
      if (!locked) {
        return false;
      }
      action.run();
      return true;
    } finally {
      if (locked) {
        entry.lock.unlock();
      }
      releaseEntry(key, entry);
    }
  }

  /**
   * Whether some thread currently holds the lock for {@code key}.
   */
  public boolean isLocked(String key) {
    Entry entry = locks.get(key);
    return entry != null && entry.lock.isLocked();
  }

  int size() {
    return locks.size();
  }

  private Entry acquireEntry(String key) {
    return locks.compute(key, (k, existing) -> {
      Entry e = existing == null ? new Entry() : existing;
      e.users++;
      return e;
    });
  }

  private void releaseEntry(String key, Entry entry) {
    locks.computeIfPresent(key, (k, existing) -> {
      if (existing != entry) {
        return existing;
      }
      existing.users--;
      return existing.users == 0 ? null : existing;
    });
  }

  @FunctionalInterface
  public interface LockedAction<T, E extends Exception> {
    T run() throws E;
  }

  private static final class Entry {
    final ReentrantLock lock = new ReentrantLock();
    // guarded by the map's per-key compute
    int users;
  }
}
