package io.caresync.spi;

import io.caresync.model.SlotReport;
import io.caresync.model.WatchSubscription;
import io.caresync.watch.WatcherSourceException;

import java.util.List;

/**
 * Pull side of a hospital booking system, opened once per watched subscription.
 *
 * <p>Sources that only push notifications return an empty list from
 * {@link #queryAvailability}; their reports arrive through
 * {@link io.caresync.watch.WatcherSupervisor#onSlotReport}.
 */
public interface SlotSource extends AutoCloseable {

    /**
     * Queries currently available slots for the subscription's hospital, department and doctor.
     *
     * @throws WatcherSourceException if the source is unreachable or answers with an error
     * @throws InterruptedException if the watcher is stopped while waiting
     */
    List<SlotReport> queryAvailability(WatchSubscription subscription)
        throws WatcherSourceException, InterruptedException;

    /**
     * Releases connections or sessions held by this source.
     */
    @Override
    default void close() {
    }
}
