package io.caresync.spi;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Durable dedup window: remembers which slots were already alerted for a subscription.
 *
 * <p>A key counts as seen while its recorded time is at or after the window start.
 * Recording a key that is still inside its window leaves the original time untouched,
 * so duplicates never extend the window.
 */
public interface AlertDedupStore {

    /**
     * Whether {@code dedupKey} was recorded at or after {@code windowStart}.
     */
    boolean seenSince(Connection conn, String dedupKey, Instant windowStart);

    /**
     * Records {@code dedupKey} as seen at {@code seenAt} unless it was already seen at or
     * after {@code windowStart}.
     *
     * @return {@code true} if this call recorded the key, {@code false} if it was a duplicate
     */
    boolean tryRecord(Connection conn, String dedupKey, Instant seenAt, Instant windowStart);

    /**
     * Deletes entries recorded before {@code cutoff}.
     *
     * @return number of entries deleted
     */
    int purgeBefore(Connection conn, Instant cutoff);

    /**
     * Times of the entries whose key starts with {@code keyPrefix} recorded at or after
     * {@code since}, oldest first.
     */
    List<Instant> recordedSince(Connection conn, String keyPrefix, Instant since);
}
