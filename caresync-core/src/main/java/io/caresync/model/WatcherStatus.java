package io.caresync.model;

/**
 * Externally visible health of a {@link WatchSubscription}'s watcher.
 */
public enum WatcherStatus {
  ACTIVE,
  /** Source unreachable past the retry budget; still retried with backoff. */
  DEGRADED,
  /** Deactivated by the user or after the inactivity period. */
  INACTIVE
}
