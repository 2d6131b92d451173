package io.caresync.spi;

import io.caresync.model.WatchSubscription;

/**
 * External monitoring collaborator informed when a watcher's source stays unreachable.
 */
public interface WatcherMonitor {

    WatcherMonitor NOOP = new WatcherMonitor() {
        @Override
        public void onDegraded(WatchSubscription subscription, int consecutiveFailures, Throwable lastError) {
        }
    };

    /**
     * Called once when a subscription enters {@link io.caresync.model.WatcherStatus#DEGRADED}.
     */
    void onDegraded(WatchSubscription subscription, int consecutiveFailures, Throwable lastError);

    /**
     * Called once when a degraded subscription polls successfully again.
     */
    default void onRecovered(WatchSubscription subscription) {
    }
}
