package io.caresync;

import io.caresync.conflict.ConflictDetector;
import io.caresync.model.Schedule;
import io.caresync.reminder.ReminderPlanner;
import io.caresync.retry.RetryPolicy;
import io.caresync.schedule.ScheduleService;
import io.caresync.spi.AlertDedupStore;
import io.caresync.spi.AlertSink;
import io.caresync.spi.CalendarClientFactory;
import io.caresync.spi.ConnectionProvider;
import io.caresync.spi.MetricsExporter;
import io.caresync.spi.ScheduleStore;
import io.caresync.spi.SlotSourceFactory;
import io.caresync.spi.SyncConflictListener;
import io.caresync.spi.SyncLinkStore;
import io.caresync.spi.WatchSubscriptionStore;
import io.caresync.spi.WatcherMonitor;
import io.caresync.sync.ConflictResolver;
import io.caresync.sync.LastWriterWinsResolver;
import io.caresync.sync.SyncEngine;
import io.caresync.sync.SyncStateMachine;
import io.caresync.watch.WatcherSupervisor;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point wiring the {@link ScheduleService}, the {@link SyncEngine} and the
 * {@link WatcherSupervisor} into a single {@link AutoCloseable} unit.
 *
 * <p>The sync engine is created when a {@link CalendarClientFactory} is configured, the
 * watcher supervisor when a {@link SlotSourceFactory} and an {@link AlertSink} are.
 * Local schedule changes waiting for a push request a sync pass for their owner.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (CareScheduler scheduler = CareScheduler.builder()
 *     .connectionProvider(connProvider)
 *     .stores(stores)
 *     .calendarClientFactory(calendars)
 *     .slotSourceFactory(hospitals)
 *     .alertSink(notifier)
 *     .build()) {
 *   MutationResult result = scheduler.schedules().createSchedule(schedule);
 * }
 * }</pre>
 */
public final class CareScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CareScheduler.class.getName());

  private final ScheduleService scheduleService;
  private final SyncEngine syncEngine;
  private final WatcherSupervisor watcherSupervisor;
  private final ReminderPlanner reminderPlanner;
  private final MetricsExporter metrics;

  private CareScheduler(Builder b) {
    Clock clock = b.clock != null ? b.clock : Clock.systemUTC();
    ZoneId zone = b.zone != null ? b.zone : ZoneId.systemDefault();
    this.metrics = b.metrics != null ? b.metrics : MetricsExporter.NOOP;
    SyncStateMachine stateMachine = new SyncStateMachine(
        b.conflictResolver != null ? b.conflictResolver : new LastWriterWinsResolver(), clock);

    ScheduleService.Builder sb = ScheduleService.builder()
        .connectionProvider(b.connectionProvider)
        .scheduleStore(b.scheduleStore)
        .syncLinkStore(b.syncLinkStore)
        .stateMachine(stateMachine)
        .metrics(metrics)
        .clock(clock)
        .changeListener(this::onPendingPush);
    if (b.conflictDetector != null) {
      sb.conflictDetector(b.conflictDetector);
    }
    this.scheduleService = sb.build();

    if (b.calendarClientFactory != null) {
      SyncEngine.Builder eb = SyncEngine.builder()
          .connectionProvider(b.connectionProvider)
          .syncLinkStore(b.syncLinkStore)
          .scheduleStore(b.scheduleStore)
          .scheduleService(scheduleService)
          .clientFactory(b.calendarClientFactory)
          .stateMachine(stateMachine)
          .conflictListener(b.conflictListener)
          .metrics(metrics)
          .clock(clock)
          .workerCount(b.syncWorkerCount)
          .intervalMs(b.syncIntervalMs)
          .maxAttempts(b.syncMaxAttempts)
          .callTimeoutMs(b.syncCallTimeoutMs);
      if (b.syncRetryPolicy != null) {
        eb.retryPolicy(b.syncRetryPolicy);
      }
      this.syncEngine = eb.build();
    } else {
      this.syncEngine = null;
    }

    if (b.slotSourceFactory != null && b.alertSink != null) {
      WatcherSupervisor.Builder wb = WatcherSupervisor.builder()
          .connectionProvider(b.connectionProvider)
          .subscriptionStore(b.subscriptionStore)
          .dedupStore(b.dedupStore)
          .sourceFactory(b.slotSourceFactory)
          .alertSink(b.alertSink)
          .monitor(b.watcherMonitor)
          .metrics(metrics)
          .clock(clock)
          .zone(zone)
          .pollIntervalMs(b.pollIntervalMs)
          .dedupWindow(b.dedupWindow)
          .rateLimit(b.rateLimit)
          .rateLimitWindow(b.rateLimitWindow)
          .retryBudget(b.watcherRetryBudget)
          .housekeepingIntervalMs(b.housekeepingIntervalMs)
          .inactivityPeriod(b.inactivityPeriod);
      if (b.watcherRetryPolicy != null) {
        wb.retryPolicy(b.watcherRetryPolicy);
      }
      this.watcherSupervisor = wb.build();
    } else {
      this.watcherSupervisor = null;
    }
    this.reminderPlanner = new ReminderPlanner(zone);
  }

  public static Builder builder() {
    return new Builder();
  }

  public ScheduleService schedules() {
    return scheduleService;
  }

  /**
   * @throws IllegalStateException if no calendar client factory was configured
   */
  public SyncEngine sync() {
    if (syncEngine == null) {
      throw new IllegalStateException("Calendar sync is not configured");
    }
    return syncEngine;
  }

  /**
   * @throws IllegalStateException if no slot source factory or alert sink was configured
   */
  public WatcherSupervisor watchers() {
    if (watcherSupervisor == null) {
      throw new IllegalStateException("Cancellation watching is not configured");
    }
    return watcherSupervisor;
  }

  public ReminderPlanner reminders() {
    return reminderPlanner;
  }

  public boolean syncEnabled() {
    return syncEngine != null;
  }

  public boolean watchingEnabled() {
    return watcherSupervisor != null;
  }

  private void start() {
    if (syncEngine != null) {
      syncEngine.start();
    }
    if (watcherSupervisor != null) {
      watcherSupervisor.start();
    }
  }

  private void onPendingPush(Schedule schedule) {
    if (syncEngine != null) {
      syncEngine.requestSync(schedule.userId());
    }
  }

  /**
   * Shuts down components in order: watcher supervisor, sync engine, metrics.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (watcherSupervisor != null) {
      try {
        watcherSupervisor.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    if (syncEngine != null) {
      try {
        syncEngine.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link CareScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ScheduleStore scheduleStore;
    private SyncLinkStore syncLinkStore;
    private WatchSubscriptionStore subscriptionStore;
    private AlertDedupStore dedupStore;
    private CalendarClientFactory calendarClientFactory;
    private SlotSourceFactory slotSourceFactory;
    private AlertSink alertSink;
    private WatcherMonitor watcherMonitor;
    private SyncConflictListener conflictListener;
    private ConflictResolver conflictResolver;
    private ConflictDetector conflictDetector;
    private MetricsExporter metrics;
    private RetryPolicy syncRetryPolicy;
    private RetryPolicy watcherRetryPolicy;
    private Clock clock;
    private ZoneId zone;
    private int syncWorkerCount = 4;
    private long syncIntervalMs = 300_000;
    private int syncMaxAttempts = 3;
    private long syncCallTimeoutMs = 10_000;
    private long pollIntervalMs = 60_000;
    private Duration dedupWindow = Duration.ofMinutes(10);
    private int rateLimit = 5;
    private Duration rateLimitWindow = Duration.ofHours(1);
    private int watcherRetryBudget = 5;
    private long housekeepingIntervalMs = 3_600_000;
    private Duration inactivityPeriod = Duration.ofDays(90);
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets all four stores from one bundle.
     */
    public Builder stores(CareStores stores) {
      this.scheduleStore = stores.scheduleStore();
      this.syncLinkStore = stores.syncLinkStore();
      this.subscriptionStore = stores.subscriptionStore();
      this.dedupStore = stores.dedupStore();
      return this;
    }

    public Builder scheduleStore(ScheduleStore scheduleStore) {
      this.scheduleStore = scheduleStore;
      return this;
    }

    public Builder syncLinkStore(SyncLinkStore syncLinkStore) {
      this.syncLinkStore = syncLinkStore;
      return this;
    }

    public Builder subscriptionStore(WatchSubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return this;
    }

    public Builder dedupStore(AlertDedupStore dedupStore) {
      this.dedupStore = dedupStore;
      return this;
    }

    /**
     * Enables calendar sync.
     */
    public Builder calendarClientFactory(CalendarClientFactory calendarClientFactory) {
      this.calendarClientFactory = calendarClientFactory;
      return this;
    }

    /**
     * Enables cancellation watching, together with {@link #alertSink}.
     */
    public Builder slotSourceFactory(SlotSourceFactory slotSourceFactory) {
      this.slotSourceFactory = slotSourceFactory;
      return this;
    }

    public Builder alertSink(AlertSink alertSink) {
      this.alertSink = alertSink;
      return this;
    }

    public Builder watcherMonitor(WatcherMonitor watcherMonitor) {
      this.watcherMonitor = watcherMonitor;
      return this;
    }

    public Builder conflictListener(SyncConflictListener conflictListener) {
      this.conflictListener = conflictListener;
      return this;
    }

    /**
     * Optional. Defaults to {@link LastWriterWinsResolver} with second granularity.
     */
    public Builder conflictResolver(ConflictResolver conflictResolver) {
      this.conflictResolver = conflictResolver;
      return this;
    }

    public Builder conflictDetector(ConflictDetector conflictDetector) {
      this.conflictDetector = conflictDetector;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder syncRetryPolicy(RetryPolicy syncRetryPolicy) {
      this.syncRetryPolicy = syncRetryPolicy;
      return this;
    }

    public Builder watcherRetryPolicy(RetryPolicy watcherRetryPolicy) {
      this.watcherRetryPolicy = watcherRetryPolicy;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Zone for reminders and watcher time-slot matching. Defaults to the system zone.
     */
    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    public Builder syncWorkerCount(int syncWorkerCount) {
      this.syncWorkerCount = syncWorkerCount;
      return this;
    }

    public Builder syncIntervalMs(long syncIntervalMs) {
      this.syncIntervalMs = syncIntervalMs;
      return this;
    }

    public Builder syncMaxAttempts(int syncMaxAttempts) {
      this.syncMaxAttempts = syncMaxAttempts;
      return this;
    }

    public Builder syncCallTimeoutMs(long syncCallTimeoutMs) {
      this.syncCallTimeoutMs = syncCallTimeoutMs;
      return this;
    }

    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    public Builder dedupWindow(Duration dedupWindow) {
      this.dedupWindow = dedupWindow;
      return this;
    }

    public Builder rateLimit(int rateLimit) {
      this.rateLimit = rateLimit;
      return this;
    }

    public Builder rateLimitWindow(Duration rateLimitWindow) {
      this.rateLimitWindow = rateLimitWindow;
      return this;
    }

    public Builder watcherRetryBudget(int watcherRetryBudget) {
      this.watcherRetryBudget = watcherRetryBudget;
      return this;
    }

    public Builder housekeepingIntervalMs(long housekeepingIntervalMs) {
      this.housekeepingIntervalMs = housekeepingIntervalMs;
      return this;
    }

    public Builder inactivityPeriod(Duration inactivityPeriod) {
      this.inactivityPeriod = inactivityPeriod;
      return this;
    }

    /**
     * Builds and starts the scheduler. If starting a component fails, the ones already
     * started are closed before rethrowing.
     *
     * @throws IllegalStateException if build() was already called
     */
    public CareScheduler build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(scheduleStore, "scheduleStore");
      Objects.requireNonNull(syncLinkStore, "syncLinkStore");
      if (slotSourceFactory != null || alertSink != null) {
        Objects.requireNonNull(slotSourceFactory, "slotSourceFactory");
        Objects.requireNonNull(alertSink, "alertSink");
        Objects.requireNonNull(subscriptionStore, "subscriptionStore");
        Objects.requireNonNull(dedupStore, "dedupStore");
      }
      CareScheduler scheduler = new CareScheduler(this);
      try {
        scheduler.start();
      } catch (RuntimeException e) {
        try {
          scheduler.close();
        } catch (RuntimeException closeError) {
          e.addSuppressed(closeError);
        }
        throw e;
      }
      logger.log(Level.INFO, "CareScheduler started (sync={0}, watching={1})",
          new Object[]{scheduler.syncEnabled(), scheduler.watchingEnabled()});
      return scheduler;
    }
  }
}
