package io.caresync.util;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with optional time-based expiry.
 *
 * <p>With a zero TTL a key stays claimed until released. With a positive TTL a claim
 * older than the TTL may be taken over, which recovers keys held by a stuck worker.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Map<String, Long> inflight = new ConcurrentHashMap<>();
  private final long ttlMs;

  public DefaultInFlightTracker() {
    this(0L);
  }

  public DefaultInFlightTracker(long ttlMs) {
    if (ttlMs < 0) {
      throw new IllegalArgumentException("ttlMs must be >= 0");
    }
    this.ttlMs = ttlMs;
  }

  @Override
  public boolean tryAcquire(String key) {
    long now = System.currentTimeMillis();
    Long existing = inflight.putIfAbsent(key, now);
    if (existing == null) {
      return true;
    }
    return ttlMs > 0 && now - existing > ttlMs && inflight.replace(key, existing, now);
  }

  @Override
  public void release(String key) {
    inflight.remove(key);
  }
}
