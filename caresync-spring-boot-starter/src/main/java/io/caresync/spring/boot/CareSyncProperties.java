package io.caresync.spring.boot;

import io.caresync.sync.SyncConflict;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the care scheduler.
 *
 * @see CareSyncAutoConfiguration
 */
@ConfigurationProperties(prefix = "caresync")
public class CareSyncProperties {

    /**
     * Whether to run the dialect's schema script at startup.
     */
    private boolean initializeSchema = false;

    /**
     * Zone for reminders and watcher time slots. Defaults to the system zone.
     */
    private String zone;

    private final Sync sync = new Sync();
    private final Watch watch = new Watch();
    private final Metrics metrics = new Metrics();

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Sync getSync() {
        return sync;
    }

    public Watch getWatch() {
        return watch;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Retry {
        private long baseDelayMs;
        private long maxDelayMs;

        static Retry of(long baseDelayMs, long maxDelayMs) {
            Retry retry = new Retry();
            retry.baseDelayMs = baseDelayMs;
            retry.maxDelayMs = maxDelayMs;
            return retry;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Sync {
        /**
         * Calendar sync also needs a CalendarClientFactory bean.
         */
        private boolean enabled = true;
        private int workerCount = 4;
        private long intervalMs = 300_000;
        private int maxAttempts = 3;
        private long callTimeoutMs = 10_000;
        /**
         * Timestamps closer than this count as a tie in last-writer-wins resolution.
         */
        private Duration conflictGranularity = Duration.ofSeconds(1);
        private SyncConflict.Side tieBreaker = SyncConflict.Side.LOCAL;
        private final Retry retry = Retry.of(200, 10_000);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getCallTimeoutMs() {
            return callTimeoutMs;
        }

        public void setCallTimeoutMs(long callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
        }

        public Duration getConflictGranularity() {
            return conflictGranularity;
        }

        public void setConflictGranularity(Duration conflictGranularity) {
            this.conflictGranularity = conflictGranularity;
        }

        public SyncConflict.Side getTieBreaker() {
            return tieBreaker;
        }

        public void setTieBreaker(SyncConflict.Side tieBreaker) {
            this.tieBreaker = tieBreaker;
        }

        public Retry getRetry() {
            return retry;
        }
    }

    public static class Watch {
        /**
         * Watching also needs SlotSourceFactory and AlertSink beans.
         */
        private boolean enabled = true;
        private long pollIntervalMs = 60_000;
        private Duration dedupWindow = Duration.ofMinutes(10);
        private int rateLimit = 5;
        private Duration rateLimitWindow = Duration.ofHours(1);
        /**
         * Consecutive failed polls before a watcher is reported degraded.
         */
        private int retryBudget = 5;
        private long housekeepingIntervalMs = 3_600_000;
        private Duration inactivityPeriod = Duration.ofDays(90);
        private final Retry retry = Retry.of(1_000, 300_000);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public Duration getDedupWindow() {
            return dedupWindow;
        }

        public void setDedupWindow(Duration dedupWindow) {
            this.dedupWindow = dedupWindow;
        }

        public int getRateLimit() {
            return rateLimit;
        }

        public void setRateLimit(int rateLimit) {
            this.rateLimit = rateLimit;
        }

        public Duration getRateLimitWindow() {
            return rateLimitWindow;
        }

        public void setRateLimitWindow(Duration rateLimitWindow) {
            this.rateLimitWindow = rateLimitWindow;
        }

        public int getRetryBudget() {
            return retryBudget;
        }

        public void setRetryBudget(int retryBudget) {
            this.retryBudget = retryBudget;
        }

        public long getHousekeepingIntervalMs() {
            return housekeepingIntervalMs;
        }

        public void setHousekeepingIntervalMs(long housekeepingIntervalMs) {
            this.housekeepingIntervalMs = housekeepingIntervalMs;
        }

        public Duration getInactivityPeriod() {
            return inactivityPeriod;
        }

        public void setInactivityPeriod(Duration inactivityPeriod) {
            this.inactivityPeriod = inactivityPeriod;
        }

        public Retry getRetry() {
            return retry;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "caresync";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
