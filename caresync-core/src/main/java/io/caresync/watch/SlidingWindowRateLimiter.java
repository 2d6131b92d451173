package io.caresync.watch;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Allows at most {@code maxEvents} events in any rolling window of the given length.
 *
 * <p>Checking and recording are separate so that a permit is only consumed once the
 * event was actually emitted.
 */
public final class SlidingWindowRateLimiter {
  private final int maxEvents;
  private final Duration window;
  private final Deque<Instant> events = new ArrayDeque<>();

  public SlidingWindowRateLimiter(int maxEvents, Duration window) {
    if (maxEvents <= 0) {
      throw new IllegalArgumentException("maxEvents must be > 0");
    }
    Objects.requireNonNull(window, "window");
    if (window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be > 0");
    }
    this.maxEvents = maxEvents;
    this.window = window;
  }

  /**
   * Whether one more event at {@code now} stays within the limit.
   */
  public synchronized boolean permits(Instant now) {
    evict(now);
    return events.size() < maxEvents;
  }

  public synchronized void record(Instant now) {
    evict(now);
    events.addLast(now);
  }

  synchronized int size() {
    return events.size();
  }

  private void evict(Instant now) {
    Instant windowStart = now.minus(window);
    while (!events.isEmpty() && !events.peekFirst().isAfter(windowStart)) {
      events.removeFirst();
    }
  }
}
