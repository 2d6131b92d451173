package io.caresync.watch;

import io.caresync.model.AlertEvent;
import io.caresync.model.SlotReport;
import io.caresync.model.WatchSubscription;
import io.caresync.model.WatcherStatus;
import io.caresync.retry.ExponentialBackoffRetryPolicy;
import io.caresync.retry.RetryPolicy;
import io.caresync.spi.AlertDedupStore;
import io.caresync.spi.AlertSink;
import io.caresync.spi.ConnectionProvider;
import io.caresync.spi.MetricsExporter;
import io.caresync.spi.SlotSource;
import io.caresync.spi.SlotSourceFactory;
import io.caresync.spi.WatchSubscriptionStore;
import io.caresync.spi.WatcherMonitor;
import io.caresync.util.DaemonThreadFactory;
import io.caresync.util.Transactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one {@link CancellationWatcher} per enabled subscription, each on its own
 * single-threaded lane so that a slow or failing hospital source never affects others.
 *
 * <p>Each lane polls its {@link SlotSource} on a fixed delay and also accepts pushed
 * reports through {@link #onSlotReport}; both are processed in arrival order on the lane.
 * Poll failures are retried with exponential backoff. After {@code retryBudget}
 * consecutive failures the subscription is marked {@link WatcherStatus#DEGRADED} and
 * reported to the {@link WatcherMonitor}; polling continues with capped backoff and the
 * first successful poll restores {@link WatcherStatus#ACTIVE}. A source that cannot be
 * opened is treated the same way: the watcher starts anyway and reopening counts as polling.
 *
 * <p>Each subscription's rate limit window outlives its watcher. The first watcher of a
 * subscription in this process seeds the window from the alerts still held by the dedup store.
 *
 * <p>A housekeeping task purges dedup entries older than both the dedup and rate limit
 * windows and deactivates subscriptions
 * without activity for longer than the inactivity period.
 *
 * <p>This class is thread-safe. Create instances via {@link #builder()}.
 */
public final class WatcherSupervisor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WatcherSupervisor.class.getName());

  private final Settings settings;
  private final SlotSourceFactory sourceFactory;
  private final WatcherMonitor monitor;
  private final RetryPolicy retryPolicy;
  private final long pollIntervalMs;
  private final int retryBudget;
  private final long housekeepingIntervalMs;
  private final Duration inactivityPeriod;
  private final Map<String, Lane> lanes = new ConcurrentHashMap<>();
  private final Map<String, SlidingWindowRateLimiter> rateLimiters = new ConcurrentHashMap<>();

  private ScheduledExecutorService housekeeper;
  private ScheduledFuture<?> housekeepingTask;
  private volatile boolean started;
  private volatile boolean closed;

  private WatcherSupervisor(Builder builder) {
    Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
    Objects.requireNonNull(builder.dedupStore, "dedupStore");
    Objects.requireNonNull(builder.alertSink, "alertSink");
    this.sourceFactory = Objects.requireNonNull(builder.sourceFactory, "sourceFactory");

    if (builder.pollIntervalMs <= 0L) {
      throw new IllegalArgumentException("pollIntervalMs must be > 0");
    }
    if (builder.retryBudget <= 0) {
      throw new IllegalArgumentException("retryBudget must be > 0");
    }
    if (builder.dedupWindow.isNegative() || builder.dedupWindow.isZero()) {
      throw new IllegalArgumentException("dedupWindow must be > 0");
    }
    if (builder.rateLimit <= 0) {
      throw new IllegalArgumentException("rateLimit must be > 0");
    }
    if (builder.rateLimitWindow.isNegative() || builder.rateLimitWindow.isZero()) {
      throw new IllegalArgumentException("rateLimitWindow must be > 0");
    }
    if (builder.housekeepingIntervalMs < 0L) {
      throw new IllegalArgumentException("housekeepingIntervalMs must be >= 0");
    }
    if (builder.inactivityPeriod.isNegative() || builder.inactivityPeriod.isZero()) {
      throw new IllegalArgumentException("inactivityPeriod must be > 0");
    }

    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    ZoneId zone = builder.zone != null ? builder.zone : ZoneId.systemDefault();
    this.settings = new Settings(
        builder.connectionProvider,
        builder.subscriptionStore,
        builder.dedupStore,
        builder.alertSink,
        new SlotMatcher(zone),
        builder.dedupWindow,
        builder.rateLimit,
        builder.rateLimitWindow,
        builder.metrics != null ? builder.metrics : MetricsExporter.NOOP,
        clock);
    this.monitor = builder.monitor != null ? builder.monitor : WatcherMonitor.NOOP;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1_000, 300_000);
    this.pollIntervalMs = builder.pollIntervalMs;
    this.retryBudget = builder.retryBudget;
    this.housekeepingIntervalMs = builder.housekeepingIntervalMs;
    this.inactivityPeriod = builder.inactivityPeriod;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts a watcher for every enabled subscription and the housekeeping task.
   * Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("WatcherSupervisor has been closed");
    }
    if (started) {
      return;
    }
    started = true;
    List<WatchSubscription> enabled = Transactions.withConnection(
        settings.connectionProvider(), settings.subscriptionStore()::listEnabled);
    for (WatchSubscription subscription : enabled) {
      launch(subscription);
    }
    if (housekeepingIntervalMs > 0) {
      housekeeper = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("caresync-housekeeping-"));
      housekeepingTask = housekeeper.scheduleWithFixedDelay(this::runHousekeeping,
          housekeepingIntervalMs, housekeepingIntervalMs, TimeUnit.MILLISECONDS);
    }
    logger.log(Level.INFO, "Watcher supervisor started with {0} watchers", lanes.size());
  }

  /**
   * Stores a new subscription and, if it is enabled and the supervisor runs, starts watching it.
   */
  public WatchSubscription subscribe(WatchSubscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    Transactions.inTransaction(settings.connectionProvider(), conn -> {
      settings.subscriptionStore().insert(conn, subscription);
      return null;
    });
    if (subscription.enabled()) {
      synchronized (this) {
        if (started && !closed) {
          launch(subscription);
        }
      }
    }
    return subscription;
  }

  /**
   * Enables a subscription and starts its watcher. A running watcher is left alone.
   *
   * @throws IllegalArgumentException if the subscription does not exist
   */
  public synchronized WatchSubscription startWatching(String subscriptionId) {
    WatchSubscription enabled = Transactions.inTransaction(settings.connectionProvider(), conn -> {
      WatchSubscription current = settings.subscriptionStore().find(conn, subscriptionId)
          .orElseThrow(() -> new IllegalArgumentException("Unknown subscription " + subscriptionId));
      if (current.enabled() && current.status() != WatcherStatus.INACTIVE) {
        return current;
      }
      WatchSubscription updated = current.toBuilder()
          .enabled(true)
          .status(WatcherStatus.ACTIVE)
          .updatedAt(settings.clock().instant())
          .build();
      settings.subscriptionStore().update(conn, updated);
      return updated;
    });
    if (started && !closed) {
      launch(enabled);
    }
    return enabled;
  }

  /**
   * Disables a subscription, cancels its watcher and closes its source.
   *
   * @return {@code true} if a running watcher was stopped
   */
  public synchronized boolean stopWatching(String subscriptionId) {
    Transactions.inTransaction(settings.connectionProvider(), conn -> {
      Optional<WatchSubscription> current = settings.subscriptionStore().find(conn, subscriptionId);
      current.ifPresent(s -> settings.subscriptionStore().update(conn, s.deactivated(settings.clock().instant())));
      return null;
    });
    return halt(subscriptionId);
  }

  /**
   * Webhook intake for one subscription. The report is queued behind any poll in progress.
   *
   * @return {@code false} if the subscription is not being watched
   */
  public boolean onSlotReport(String subscriptionId, SlotReport report) {
    Objects.requireNonNull(report, "report");
    Lane lane = lanes.get(subscriptionId);
    return lane != null && lane.submit(report);
  }

  /**
   * Webhook intake from a hospital: the report is queued on every watcher of that hospital.
   *
   * @return number of watchers the report was queued on
   */
  public int onSlotReport(SlotReport report) {
    Objects.requireNonNull(report, "report");
    int routed = 0;
    for (Lane lane : lanes.values()) {
      if (lane.watcher.subscription().hospitalName().trim().equalsIgnoreCase(report.hospitalName().trim())
          && lane.submit(report)) {
        routed++;
      }
    }
    return routed;
  }

  public boolean isWatching(String subscriptionId) {
    return lanes.containsKey(subscriptionId);
  }

  public int watcherCount() {
    return lanes.size();
  }

  /**
   * Current status of a watched subscription as seen by its watcher.
   */
  public Optional<WatcherStatus> watcherStatus(String subscriptionId) {
    Lane lane = lanes.get(subscriptionId);
    return lane == null ? Optional.empty() : Optional.of(lane.watcher.subscription().status());
  }

  /**
   * Purges expired dedup entries and deactivates long-inactive subscriptions.
   * Called by the housekeeping task; may be invoked directly.
   */
  public void runHousekeeping() {
    if (closed) {
      return;
    }
    try {
      Instant now = settings.clock().instant();
      Duration retention = settings.dedupWindow().compareTo(settings.rateLimitWindow()) >= 0
          ? settings.dedupWindow() : settings.rateLimitWindow();
      int purged = Transactions.withConnection(settings.connectionProvider(),
          conn -> settings.dedupStore().purgeBefore(conn, now.minus(retention)));
      if (purged > 0) {
        logger.log(Level.FINE, "Purged {0} expired dedup entries", purged);
      }

      Instant cutoff = now.minus(inactivityPeriod);
      List<WatchSubscription> enabled = Transactions.withConnection(
          settings.connectionProvider(), settings.subscriptionStore()::listEnabled);
      for (WatchSubscription subscription : enabled) {
        if (subscription.lastActivityAt().isBefore(cutoff)) {
          logger.log(Level.INFO, "Deactivating subscription {0}, inactive since {1}",
              new Object[]{subscription.subscriptionId(), subscription.lastActivityAt()});
          stopWatching(subscription.subscriptionId());
        }
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Watcher housekeeping failed", t);
    }
  }

  /**
   * Stops every watcher and the housekeeping task. Subscriptions stay enabled in the store
   * and are resumed by the next {@link #start()} of a new supervisor.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (housekeepingTask != null) {
      housekeepingTask.cancel(false);
      housekeepingTask = null;
    }
    if (housekeeper != null) {
      housekeeper.shutdownNow();
      try {
        housekeeper.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    for (String subscriptionId : new ArrayList<>(lanes.keySet())) {
      halt(subscriptionId);
    }
  }

  private void launch(WatchSubscription subscription) {
    if (lanes.containsKey(subscription.subscriptionId())) {
      return;
    }
    SlotSource source;
    try {
      source = sourceFactory.open(subscription);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Could not open slot source for subscription "
          + subscription.subscriptionId() + ", retrying on the poll schedule", e);
      source = new ReopeningSource(subscription);
    }
    Lane lane = new Lane(new CancellationWatcher(subscription, source, rateLimiter(subscription), settings));
    lanes.put(subscription.subscriptionId(), lane);
    lane.start();
    settings.metrics().recordActiveWatchers(lanes.size());
    logger.log(Level.FINE, "Watching subscription {0}", subscription.subscriptionId());
  }

  private SlidingWindowRateLimiter rateLimiter(WatchSubscription subscription) {
    return rateLimiters.computeIfAbsent(subscription.subscriptionId(), id -> {
      SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(settings.rateLimit(), settings.rateLimitWindow());
      Instant windowStart = settings.clock().instant().minus(settings.rateLimitWindow());
      try {
        List<Instant> alerted = Transactions.withConnection(settings.connectionProvider(),
            conn -> settings.dedupStore().recordedSince(conn, AlertEvent.dedupKeyPrefix(id), windowStart));
        alerted.forEach(limiter::record);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Could not restore rate limit window of subscription " + id
            + ", starting empty", e);
      }
      return limiter;
    });
  }

  private boolean halt(String subscriptionId) {
    Lane lane = lanes.remove(subscriptionId);
    if (lane == null) {
      return false;
    }
    lane.stop();
    settings.metrics().recordActiveWatchers(lanes.size());
    logger.log(Level.FINE, "Stopped watching subscription {0}", subscriptionId);
    return true;
  }

  private void updateStatus(CancellationWatcher watcher, WatcherStatus status) {
    WatchSubscription updated = Transactions.inTransaction(settings.connectionProvider(), conn -> {
      WatchSubscription current = settings.subscriptionStore()
          .find(conn, watcher.subscription().subscriptionId())
          .orElse(watcher.subscription());
      WatchSubscription next = current.withStatus(status, settings.clock().instant());
      settings.subscriptionStore().update(conn, next);
      return next;
    });
    watcher.subscription(updated);
  }

  /** Collaborators and limits shared by every watcher of this supervisor. */
  record Settings(
      ConnectionProvider connectionProvider,
      WatchSubscriptionStore subscriptionStore,
      AlertDedupStore dedupStore,
      AlertSink alertSink,
      SlotMatcher matcher,
      Duration dedupWindow,
      int rateLimit,
      Duration rateLimitWindow,
      MetricsExporter metrics,
      Clock clock
  ) {
  }

  /** Stands in for a source whose factory failed; every query tries to open it again. */
  private final class ReopeningSource implements SlotSource {
    private final WatchSubscription subscription;
    private volatile SlotSource delegate;

    ReopeningSource(WatchSubscription subscription) {
      this.subscription = subscription;
    }

    @Override
    public List<SlotReport> queryAvailability(WatchSubscription current)
        throws WatcherSourceException, InterruptedException {
      SlotSource opened = delegate;
      if (opened == null) {
        try {
          opened = sourceFactory.open(subscription);
        } catch (RuntimeException e) {
          throw new WatcherSourceException("Could not open slot source: " + e.getMessage(), e);
        }
        delegate = opened;
        logger.log(Level.INFO, "Opened slot source for subscription {0}", subscription.subscriptionId());
      }
      return opened.queryAvailability(current);
    }

    @Override
    public void close() {
      SlotSource opened = delegate;
      if (opened != null) {
        opened.close();
      }
    }
  }

  /** Single-threaded executor owning one watcher's polls and pushed reports. */
  private final class Lane {
    private final CancellationWatcher watcher;
    private final ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> nextPoll;
    private volatile boolean stopped;
    // touched only on the lane thread
    private int consecutiveFailures;

    Lane(CancellationWatcher watcher) {
      this.watcher = watcher;
      this.executor = Executors.newSingleThreadScheduledExecutor(
          new DaemonThreadFactory("caresync-watch-" + watcher.subscription().subscriptionId() + "-"));
    }

    void start() {
      schedulePoll(0L);
    }

    boolean submit(SlotReport report) {
      if (stopped) {
        return false;
      }
      try {
        executor.execute(() -> {
          try {
            watcher.process(report);
          } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to process pushed slot report for subscription "
                + watcher.subscription().subscriptionId(), e);
          }
        });
        return true;
      } catch (RejectedExecutionException e) {
        return false;
      }
    }

    private void schedulePoll(long delayMs) {
      if (stopped) {
        return;
      }
      try {
        nextPoll = executor.schedule(this::poll, delayMs, TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException e) {
        logger.log(Level.FINE, "Lane for {0} is shutting down", watcher.subscription().subscriptionId());
      }
    }

    private void poll() {
      if (stopped) {
        return;
      }
      try {
        watcher.pollOnce();
        onPollSuccess();
        schedulePoll(pollIntervalMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (WatcherSourceException | RuntimeException e) {
        onPollFailure(e);
      }
    }

    private void onPollSuccess() {
      consecutiveFailures = 0;
      WatchSubscription subscription = watcher.subscription();
      if (subscription.status() == WatcherStatus.DEGRADED) {
        updateStatus(watcher, WatcherStatus.ACTIVE);
        logger.log(Level.INFO, "Subscription {0} recovered", subscription.subscriptionId());
        try {
          monitor.onRecovered(watcher.subscription());
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Watcher monitor failed", e);
        }
      }
    }

    private void onPollFailure(Exception error) {
      consecutiveFailures++;
      settings.metrics().incrementWatcherPollFailures();
      WatchSubscription subscription = watcher.subscription();
      long delayMs = retryPolicy.computeDelayMs(consecutiveFailures);
      if (consecutiveFailures == retryBudget && subscription.status() != WatcherStatus.DEGRADED) {
        logger.log(Level.WARNING, "Subscription " + subscription.subscriptionId() + " degraded after "
            + consecutiveFailures + " consecutive poll failures", error);
        try {
          updateStatus(watcher, WatcherStatus.DEGRADED);
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Failed to mark subscription " + subscription.subscriptionId() + " degraded", e);
        }
        try {
          monitor.onDegraded(watcher.subscription(), consecutiveFailures, error);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Watcher monitor failed", e);
        }
      } else {
        logger.log(Level.FINE, "Poll failed for subscription {0} ({1} in a row), retrying in {2}ms: {3}",
            new Object[]{subscription.subscriptionId(), consecutiveFailures, delayMs, error.getMessage()});
      }
      schedulePoll(delayMs);
    }

    void stop() {
      stopped = true;
      ScheduledFuture<?> task = nextPoll;
      if (task != null) {
        task.cancel(true);
      }
      executor.shutdownNow();
      try {
        executor.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      try {
        watcher.source().close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to close slot source of subscription "
            + watcher.subscription().subscriptionId(), e);
      }
    }
  }

  /** Builder for {@link WatcherSupervisor}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private WatchSubscriptionStore subscriptionStore;
    private AlertDedupStore dedupStore;
    private SlotSourceFactory sourceFactory;
    private AlertSink alertSink;
    private WatcherMonitor monitor;
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private ZoneId zone;
    private long pollIntervalMs = 60_000;
    private Duration dedupWindow = Duration.ofMinutes(10);
    private int rateLimit = 5;
    private Duration rateLimitWindow = Duration.ofHours(1);
    private int retryBudget = 5;
    private long housekeepingIntervalMs = 3_600_000;
    private Duration inactivityPeriod = Duration.ofDays(90);

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder subscriptionStore(WatchSubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder dedupStore(AlertDedupStore dedupStore) {
      this.dedupStore = dedupStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder sourceFactory(SlotSourceFactory sourceFactory) {
      this.sourceFactory = sourceFactory;
      return this;
    }

    /** <b>Required.</b> */
    public Builder alertSink(AlertSink alertSink) {
      this.alertSink = alertSink;
      return this;
    }

    public Builder monitor(WatcherMonitor monitor) {
      this.monitor = monitor;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Backoff between failed polls. Defaults to exponential backoff from 1s up to 5 minutes.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Zone for matching preferred dates and time slots. Defaults to the system zone.
     */
    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    /**
     * Optional. Delay between successful polls. Defaults to {@code 60000}.
     */
    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    /**
     * Optional. How long a seen slot suppresses repeat alerts. Defaults to 10 minutes.
     */
    public Builder dedupWindow(Duration dedupWindow) {
      this.dedupWindow = Objects.requireNonNull(dedupWindow, "dedupWindow");
      return this;
    }

    /**
     * Optional. Maximum alerts per subscription per rate limit window. Defaults to {@code 5}.
     */
    public Builder rateLimit(int rateLimit) {
      this.rateLimit = rateLimit;
      return this;
    }

    /**
     * Optional. Defaults to 1 hour.
     */
    public Builder rateLimitWindow(Duration rateLimitWindow) {
      this.rateLimitWindow = Objects.requireNonNull(rateLimitWindow, "rateLimitWindow");
      return this;
    }

    /**
     * Optional. Consecutive poll failures before a subscription is marked degraded. Defaults to {@code 5}.
     */
    public Builder retryBudget(int retryBudget) {
      this.retryBudget = retryBudget;
      return this;
    }

    /**
     * Optional. Delay between housekeeping runs; {@code 0} disables them. Defaults to 1 hour.
     */
    public Builder housekeepingIntervalMs(long housekeepingIntervalMs) {
      this.housekeepingIntervalMs = housekeepingIntervalMs;
      return this;
    }

    /**
     * Optional. Subscriptions without alerts or edits for this long are deactivated. Defaults to 90 days.
     */
    public Builder inactivityPeriod(Duration inactivityPeriod) {
      this.inactivityPeriod = Objects.requireNonNull(inactivityPeriod, "inactivityPeriod");
      return this;
    }

    public WatcherSupervisor build() {
      return new WatcherSupervisor(this);
    }
  }
}
