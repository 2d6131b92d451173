package io.caresync.spi;

import io.caresync.model.Schedule;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for schedules and their cached conflict references.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Soft-deleted schedules stay in the store with
 * {@link Schedule#deleted()} set. Implementations live in the {@code caresync-jdbc} module.
 *
 * @see io.caresync.jdbc.store.JdbcScheduleStore
 */
public interface ScheduleStore {

    /**
     * Inserts a new schedule, including checklist, reminder offsets and conflict references.
     *
     * @param conn     the JDBC connection (typically within a transaction)
     * @param schedule the schedule to persist
     */
    void insert(Connection conn, Schedule schedule);

    /**
     * Replaces every stored field of an existing schedule.
     *
     * @param conn     the JDBC connection (typically within a transaction)
     * @param schedule the new state
     * @return the number of rows updated (0 or 1)
     */
    int update(Connection conn, Schedule schedule);

    /**
     * Finds a schedule by id, including soft-deleted ones.
     */
    Optional<Schedule> find(Connection conn, String scheduleId);

    /**
     * Finds the schedule a user's external calendar event was mapped to.
     */
    Optional<Schedule> findByExternalEventId(Connection conn, String userId, String externalEventId);

    /**
     * Returns every non-deleted schedule of a child; the input of conflict recomputation.
     */
    List<Schedule> listActiveByChild(Connection conn, String childId);

    /**
     * Returns non-deleted schedules of a child whose interval intersects {@code [from, to)},
     * ordered by start time.
     */
    List<Schedule> listByChild(Connection conn, String childId, Instant from, Instant to);

    /**
     * Returns a user's schedules with something to push
     * ({@link io.caresync.model.Schedule#awaitsPush()}), deletions included,
     * oldest {@code updatedAt} first.
     *
     * @param limit maximum number of rows
     */
    List<Schedule> listPendingPush(Connection conn, String userId, int limit);
}
