package io.caresync.spi;

import io.caresync.model.WatchSubscription;

/**
 * Opens the slot source a watcher polls for one subscription.
 */
@FunctionalInterface
public interface SlotSourceFactory {

    SlotSource open(WatchSubscription subscription);
}
