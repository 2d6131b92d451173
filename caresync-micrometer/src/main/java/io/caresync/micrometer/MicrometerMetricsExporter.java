package io.caresync.micrometer;

import io.caresync.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code caresync.schedule.mutations} - schedules created, updated or deleted</li>
 *   <li>{@code caresync.schedule.conflicts} - mutations that left the schedule in conflict</li>
 *   <li>{@code caresync.sync.pass} tagged {@code outcome=completed|failed}</li>
 *   <li>{@code caresync.sync.events} tagged {@code direction=push|pull}</li>
 *   <li>{@code caresync.sync.conflicts} - concurrent edits resolved</li>
 *   <li>{@code caresync.alerts} tagged {@code result=delivered|deduplicated|rate_limited}</li>
 *   <li>{@code caresync.watch.poll.failures}</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code caresync.watch.active} - subscriptions currently watched</li>
 *   <li>{@code caresync.sync.pass.duration} - wall time of reconciliation passes</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter scheduleMutations;
    private final Counter conflictsDetected;
    private final Counter passCompleted;
    private final Counter passFailed;
    private final Counter eventsPushed;
    private final Counter eventsPulled;
    private final Counter syncConflicts;
    private final Counter alertsDelivered;
    private final Counter alertsDeduplicated;
    private final Counter alertsRateLimited;
    private final Counter pollFailures;
    private final Gauge activeWatchersGauge;
    private final Timer passDuration;
    private final AtomicInteger activeWatchers = new AtomicInteger();
    private final List<Meter> meters = new ArrayList<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "caresync"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "caresync");
    }

    /**
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "clinic.caresync"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }
        this.registry = registry;

        this.scheduleMutations = counter(namePrefix + ".schedule.mutations",
            "Schedules created, updated or deleted");
        this.conflictsDetected = counter(namePrefix + ".schedule.conflicts",
            "Mutations that left the schedule in conflict");
        this.passCompleted = counter(namePrefix + ".sync.pass", "Reconciliation passes", "outcome", "completed");
        this.passFailed = counter(namePrefix + ".sync.pass", "Reconciliation passes", "outcome", "failed");
        this.eventsPushed = counter(namePrefix + ".sync.events", "Events exchanged with external calendars",
            "direction", "push");
        this.eventsPulled = counter(namePrefix + ".sync.events", "Events exchanged with external calendars",
            "direction", "pull");
        this.syncConflicts = counter(namePrefix + ".sync.conflicts", "Concurrent edits resolved");
        this.alertsDelivered = counter(namePrefix + ".alerts", "Cancellation slot reports", "result", "delivered");
        this.alertsDeduplicated = counter(namePrefix + ".alerts", "Cancellation slot reports", "result", "deduplicated");
        this.alertsRateLimited = counter(namePrefix + ".alerts", "Cancellation slot reports", "result", "rate_limited");
        this.pollFailures = counter(namePrefix + ".watch.poll.failures", "Failed availability polls");

        this.activeWatchersGauge = Gauge.builder(namePrefix + ".watch.active", activeWatchers, AtomicInteger::get)
            .description("Subscriptions currently watched")
            .register(registry);
        meters.add(activeWatchersGauge);
        this.passDuration = Timer.builder(namePrefix + ".sync.pass.duration")
            .description("Wall time of reconciliation passes")
            .register(registry);
        meters.add(passDuration);
    }

    private Counter counter(String name, String description, String... tags) {
        Counter counter = Counter.builder(name)
            .description(description)
            .tags(tags)
            .register(registry);
        meters.add(counter);
        return counter;
    }

    @Override
    public void incrementScheduleMutations() {
        if (closed) return;
        scheduleMutations.increment();
    }

    @Override
    public void incrementConflictsDetected() {
        if (closed) return;
        conflictsDetected.increment();
    }

    @Override
    public void incrementSyncPassCompleted() {
        if (closed) return;
        passCompleted.increment();
    }

    @Override
    public void incrementSyncPassFailed() {
        if (closed) return;
        passFailed.increment();
    }

    @Override
    public void incrementEventsPushed() {
        if (closed) return;
        eventsPushed.increment();
    }

    @Override
    public void incrementEventsPulled() {
        if (closed) return;
        eventsPulled.increment();
    }

    @Override
    public void incrementSyncConflicts() {
        if (closed) return;
        syncConflicts.increment();
    }

    @Override
    public void incrementAlertsDelivered() {
        if (closed) return;
        alertsDelivered.increment();
    }

    @Override
    public void incrementAlertsDeduplicated() {
        if (closed) return;
        alertsDeduplicated.increment();
    }

    @Override
    public void incrementAlertsRateLimited() {
        if (closed) return;
        alertsRateLimited.increment();
    }

    @Override
    public void incrementWatcherPollFailures() {
        if (closed) return;
        pollFailures.increment();
    }

    @Override
    public void recordActiveWatchers(int count) {
        if (closed) return;
        activeWatchers.set(count);
    }

    @Override
    public void recordSyncPassDurationMs(long durationMs) {
        if (closed) return;
        passDuration.record(Duration.ofMillis(durationMs));
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
