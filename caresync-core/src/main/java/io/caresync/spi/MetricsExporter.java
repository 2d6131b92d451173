package io.caresync.spi;

/**
 * Observability hook for exporting scheduling, sync and watcher counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything.
 */
public interface MetricsExporter {

    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of schedules created, updated or deleted.
     */
    void incrementScheduleMutations();

    /**
     * Increments the count of mutations that left the schedule in conflict.
     */
    void incrementConflictsDetected();

    void incrementSyncPassCompleted();

    /**
     * Increments the count of passes that ended early on a transient or credential failure.
     */
    void incrementSyncPassFailed();

    void incrementEventsPushed();

    void incrementEventsPulled();

    /**
     * Increments the count of concurrent edits resolved by the conflict resolver.
     */
    void incrementSyncConflicts();

    void incrementAlertsDelivered();

    void incrementAlertsDeduplicated();

    void incrementAlertsRateLimited();

    void incrementWatcherPollFailures();

    /**
     * Records the number of subscriptions currently being watched.
     */
    default void recordActiveWatchers(int count) {
    }

    /**
     * Records the wall time of one reconciliation pass.
     */
    default void recordSyncPassDurationMs(long durationMs) {
    }

    final class Noop implements MetricsExporter {
        @Override
        public void incrementScheduleMutations() {
        }

        @Override
        public void incrementConflictsDetected() {
        }

        @Override
        public void incrementSyncPassCompleted() {
        }

        @Override
        public void incrementSyncPassFailed() {
        }

        @Override
        public void incrementEventsPushed() {
        }

        @Override
        public void incrementEventsPulled() {
        }

        @Override
        public void incrementSyncConflicts() {
        }

        @Override
        public void incrementAlertsDelivered() {
        }

        @Override
        public void incrementAlertsDeduplicated() {
        }

        @Override
        public void incrementAlertsRateLimited() {
        }

        @Override
        public void incrementWatcherPollFailures() {
        }
    }
}
