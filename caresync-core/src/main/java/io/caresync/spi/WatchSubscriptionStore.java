package io.caresync.spi;

import io.caresync.model.WatchSubscription;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for watch subscriptions.
 */
public interface WatchSubscriptionStore {

    void insert(Connection conn, WatchSubscription subscription);

    /**
     * Replaces every stored field of an existing subscription.
     *
     * @return the number of rows updated (0 or 1)
     */
    int update(Connection conn, WatchSubscription subscription);

    Optional<WatchSubscription> find(Connection conn, String subscriptionId);

    List<WatchSubscription> listEnabled(Connection conn);

    List<WatchSubscription> listByUser(Connection conn, String userId);

    /**
     * Atomically increments the alert count and sets the last alert time.
     *
     * @return the number of rows updated (0 or 1)
     */
    int recordAlert(Connection conn, String subscriptionId, Instant alertedAt);
}
