package io.caresync.util;

/**
 * Tracks keys that currently have work in flight, so the same key is not
 * scheduled twice concurrently.
 *
 * @see DefaultInFlightTracker
 */
public interface InFlightTracker {

  /**
   * Attempts to claim the key.
   *
   * @return {@code true} if claimed, {@code false} if already in flight
   */
  boolean tryAcquire(String key);

  /**
   * Releases a previously claimed key.
   */
  void release(String key);
}
