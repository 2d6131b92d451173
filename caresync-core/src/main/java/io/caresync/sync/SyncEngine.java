package io.caresync.sync;

import io.caresync.model.ExternalEvent;
import io.caresync.model.ExternalEventRef;
import io.caresync.model.LinkStatus;
import io.caresync.model.Schedule;
import io.caresync.model.ScheduleValidationException;
import io.caresync.model.SyncLink;
import io.caresync.retry.ExponentialBackoffRetryPolicy;
import io.caresync.retry.RetryPolicy;
import io.caresync.schedule.ScheduleService;
import io.caresync.spi.CalendarClientFactory;
import io.caresync.spi.ConnectionProvider;
import io.caresync.spi.ExternalCalendarClient;
import io.caresync.spi.MetricsExporter;
import io.caresync.spi.ScheduleStore;
import io.caresync.spi.SyncConflictListener;
import io.caresync.spi.SyncLinkStore;
import io.caresync.util.DaemonThreadFactory;
import io.caresync.util.DefaultInFlightTracker;
import io.caresync.util.InFlightTracker;
import io.caresync.util.KeyedLocks;
import io.caresync.util.Transactions;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reconciles each user's schedules with their external calendar.
 *
 * <p>A pass pulls external changes since the link's watermark and feeds them through the
 * {@link SyncStateMachine}, then pushes pending local changes oldest first, and persists
 * the new watermark only when both directions succeeded. An external change that cannot
 * be merged holds the watermark just before it, so later passes pull it again. Outbound-only
 * links skip the pull, inbound-only links skip the push.
 *
 * <p>Passes for one user are serialized; passes for different users run in parallel on
 * a worker pool. Every calendar call runs with a timeout and bounded retries. A rejected
 * credential is refreshed once; if that fails too the link is marked
 * {@link LinkStatus#SYNC_FAILED} and passes stay suspended until {@link #reauthorize}.
 * A push that keeps failing marks its schedule {@code SYNC_FAILED} and ends the pass.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} enables periodic passes and
 * {@link #requestSync}; {@link #runPass} may always be called directly.
 */
public final class SyncEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncEngine.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SyncLinkStore syncLinkStore;
  private final ScheduleStore scheduleStore;
  private final ScheduleService scheduleService;
  private final CalendarClientFactory clientFactory;
  private final SyncStateMachine stateMachine;
  private final SyncConflictListener conflictListener;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int workerCount;
  private final long intervalMs;
  private final int pushBatchSize;
  private final KeyedLocks userLocks = new KeyedLocks();
  private final InFlightTracker queued = new DefaultInFlightTracker();
  private final TokenCache tokenCache = new TokenCache();
  private final ExecutorService callExecutor;
  private final RemoteCaller caller;

  private ExecutorService workers;
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> periodicTask;
  private volatile boolean started;
  private volatile boolean closed;

  private SyncEngine(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.syncLinkStore = Objects.requireNonNull(builder.syncLinkStore, "syncLinkStore");
    this.scheduleStore = Objects.requireNonNull(builder.scheduleStore, "scheduleStore");
    this.scheduleService = Objects.requireNonNull(builder.scheduleService, "scheduleService");
    this.clientFactory = Objects.requireNonNull(builder.clientFactory, "clientFactory");

    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (builder.intervalMs < 0L) {
      throw new IllegalArgumentException("intervalMs must be >= 0");
    }
    if (builder.maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0");
    }
    if (builder.callTimeoutMs <= 0L) {
      throw new IllegalArgumentException("callTimeoutMs must be > 0");
    }
    if (builder.pushBatchSize <= 0) {
      throw new IllegalArgumentException("pushBatchSize must be > 0");
    }

    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.stateMachine = builder.stateMachine != null
        ? builder.stateMachine : new SyncStateMachine(new LastWriterWinsResolver(), clock);
    this.conflictListener = builder.conflictListener != null ? builder.conflictListener : SyncConflictListener.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.workerCount = builder.workerCount;
    this.intervalMs = builder.intervalMs;
    this.pushBatchSize = builder.pushBatchSize;
    RetryPolicy retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(200, 10_000);
    this.callExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("caresync-sync-call-"));
    this.caller = new RemoteCaller(callExecutor, retryPolicy, builder.maxAttempts, builder.callTimeoutMs);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the worker pool and, when an interval is configured, periodic passes for
   * every runnable link. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SyncEngine has been closed");
    }
    if (started) {
      return;
    }
    workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("caresync-sync-"));
    if (intervalMs > 0) {
      scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("caresync-sync-scheduler-"));
      periodicTask = scheduler.scheduleWithFixedDelay(this::syncAll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }
    started = true;
  }

  /**
   * Queues a pass for one user. Requests for a user already waiting in the queue are
   * coalesced; a request arriving while the user's pass runs queues another pass.
   *
   * @return {@code true} if a new pass was queued
   */
  public boolean requestSync(String userId) {
    Objects.requireNonNull(userId, "userId");
    if (!started || closed) {
      return false;
    }
    if (!queued.tryAcquire(userId)) {
      return false;
    }
    try {
      workers.execute(() -> {
        queued.release(userId);
        try {
          runPass(userId);
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Sync pass crashed for user " + userId, t);
        }
      });
      return true;
    } catch (RejectedExecutionException e) {
      queued.release(userId);
      return false;
    }
  }

  /**
   * Queues passes for every enabled, active link. Called by the periodic scheduler.
   */
  public void syncAll() {
    if (closed) {
      return;
    }
    try {
      List<SyncLink> links = Transactions.withConnection(connectionProvider, syncLinkStore::listRunnable);
      for (SyncLink link : links) {
        requestSync(link.userId());
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Periodic sync scheduling failed", t);
    }
  }

  /**
   * Runs one pass for the user on the calling thread, waiting for any pass already
   * running for the same user.
   */
  public SyncPassResult runPass(String userId) {
    Objects.requireNonNull(userId, "userId");
    if (closed) {
      return SyncPassResult.skipped(userId, "engine closed");
    }
    return userLocks.withLock(userId, () -> {
      long startNanos = System.nanoTime();
      try {
        return doPass(userId);
      } finally {
        metrics.recordSyncPassDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
      }
    });
  }

  /**
   * Stores a new refresh credential, reactivates a suspended link and queues a pass.
   *
   * @throws IllegalArgumentException if the user has no link
   */
  public SyncLink reauthorize(String userId, String refreshCredential) {
    Objects.requireNonNull(refreshCredential, "refreshCredential");
    SyncLink updated = userLocks.withLock(userId, () -> Transactions.inTransaction(connectionProvider, conn -> {
      SyncLink link = syncLinkStore.find(conn, userId)
          .orElseThrow(() -> new IllegalArgumentException("No sync link for user " + userId));
      SyncLink reauthorized = link.reauthorized(refreshCredential, clock.instant());
      syncLinkStore.save(conn, reauthorized);
      return reauthorized;
    }));
    tokenCache.invalidate(userId);
    logger.log(Level.INFO, "Sync link re-authorized for user {0}", userId);
    requestSync(userId);
    return updated;
  }

  /**
   * Creates or replaces a user's link and queues a pass for it.
   */
  public SyncLink saveLink(SyncLink link) {
    Objects.requireNonNull(link, "link");
    userLocks.withLock(link.userId(), () -> Transactions.inTransaction(connectionProvider, conn -> {
      syncLinkStore.save(conn, link);
      return null;
    }));
    tokenCache.invalidate(link.userId());
    if (link.runnable()) {
      requestSync(link.userId());
    }
    return link;
  }

  /**
   * Removes a user's link. Schedules keep their external references.
   */
  public boolean removeLink(String userId) {
    int deleted = userLocks.withLock(userId, () ->
        Transactions.inTransaction(connectionProvider, conn -> syncLinkStore.delete(conn, userId)));
    tokenCache.invalidate(userId);
    return deleted > 0;
  }

  public Optional<SyncLink> findLink(String userId) {
    return Transactions.withConnection(connectionProvider, conn -> syncLinkStore.find(conn, userId));
  }

  private SyncPassResult doPass(String userId) {
    SyncLink link = findLink(userId).orElse(null);
    if (link == null) {
      return SyncPassResult.skipped(userId, "no sync link");
    }
    if (!link.enabled()) {
      return SyncPassResult.skipped(userId, "sync link disabled");
    }
    if (link.status() == LinkStatus.SYNC_FAILED) {
      return new SyncPassResult(userId, SyncPassResult.Outcome.SUSPENDED, 0, 0, List.of(), link.lastError());
    }

    ExternalCalendarClient client = clientFactory.clientFor(link);
    PassProgress progress = new PassProgress();
    try {
      Instant watermark = link.watermark();
      if (link.direction().pulls()) {
        watermark = pull(link, client, progress);
      }
      if (link.direction().pushes()) {
        push(link, client, progress);
      }
      persistWatermark(userId, watermark);
      metrics.incrementSyncPassCompleted();
      logger.log(Level.FINE, "Sync pass completed for user {0}: pulled={1}, pushed={2}, conflicts={3}",
          new Object[]{userId, progress.pulled, progress.pushed, progress.conflicts.size()});
      return progress.result(userId, SyncPassResult.Outcome.COMPLETED, null);
    } catch (SyncCredentialException e) {
      suspend(userId, e);
      metrics.incrementSyncPassFailed();
      return progress.result(userId, SyncPassResult.Outcome.SUSPENDED, e.getMessage());
    } catch (SyncException e) {
      logger.log(Level.WARNING, "Sync pass failed for user " + userId + ", will retry next pass", e);
      metrics.incrementSyncPassFailed();
      return progress.result(userId, SyncPassResult.Outcome.FAILED, e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      metrics.incrementSyncPassFailed();
      return progress.result(userId, SyncPassResult.Outcome.FAILED, "interrupted");
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Sync pass failed for user " + userId, e);
      metrics.incrementSyncPassFailed();
      return progress.result(userId, SyncPassResult.Outcome.FAILED, String.valueOf(e.getMessage()));
    }
  }

  private Instant pull(SyncLink link, ExternalCalendarClient client, PassProgress progress)
      throws SyncException, InterruptedException {
    List<ExternalEvent> events = new ArrayList<>(authorized(link, client, "listChangesSince",
        token -> client.listChangesSince(token, link.calendarId(), link.watermark())));
    events.sort(Comparator.comparing(ExternalEvent::revision));

    Instant watermark = link.watermark();
    Instant held = null;
    for (ExternalEvent event : events) {
      try {
        applyInbound(link, event, progress);
      } catch (ScheduleValidationException e) {
        logger.log(Level.WARNING, "Cannot merge external event {0} for user {1}, retrying next pass: {2}",
            new Object[]{event.eventRef(), link.userId(), e.getMessage()});
        deferInbound(link, event);
        if (held == null) {
          held = event.revision();
        }
      }
      if (held == null && (watermark == null || event.revision().isAfter(watermark))) {
        watermark = event.revision();
      }
    }
    if (held != null) {
      // stop just short of the first unmerged event so the next pull returns it again
      Instant before = held.minusMillis(1);
      watermark = link.watermark() != null && !before.isAfter(link.watermark()) ? link.watermark() : before;
    }
    return watermark;
  }

  private void deferInbound(SyncLink link, ExternalEvent event) {
    Schedule local = locate(link.userId(), event);
    if (local != null) {
      scheduleService.applySyncTransition(local.childId(), local.scheduleId(), stateMachine::onInboundDeferred);
    }
  }

  private void applyInbound(SyncLink link, ExternalEvent event, PassProgress progress) {
    Schedule local = locate(link.userId(), event);
    String childId = local != null ? local.childId()
        : event.childId() != null ? event.childId() : link.defaultChildId();
    if (childId == null) {
      logger.log(Level.FINE, "External event {0} maps to no child, skipped", event.eventRef());
      return;
    }
    Transition transition = scheduleService.applySyncTransition(childId,
        local == null ? null : local.scheduleId(),
        current -> stateMachine.onInbound(current, event, link));
    if (transition.conflict() != null) {
      progress.conflicts.add(transition.conflict());
      metrics.incrementSyncConflicts();
      logger.log(Level.INFO, "Resolved concurrent edit of schedule {0} in favour of {1}",
          new Object[]{transition.conflict().scheduleId(), transition.conflict().winner()});
      try {
        conflictListener.onConflict(transition.conflict());
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Sync conflict listener failed", e);
      }
    }
    if (transition.changed()) {
      progress.pulled++;
      metrics.incrementEventsPulled();
    }
  }

  private Schedule locate(String userId, ExternalEvent event) {
    return Transactions.withConnection(connectionProvider, conn -> {
      if (event.scheduleId() != null) {
        Optional<Schedule> byId = scheduleStore.find(conn, event.scheduleId())
            .filter(s -> s.userId().equals(userId));
        if (byId.isPresent()) {
          return byId.get();
        }
      }
      return scheduleStore.findByExternalEventId(conn, userId, event.eventRef()).orElse(null);
    });
  }

  private void push(SyncLink link, ExternalCalendarClient client, PassProgress progress)
      throws SyncException, InterruptedException {
    List<Schedule> pending = Transactions.withConnection(connectionProvider,
        conn -> scheduleStore.listPendingPush(conn, link.userId(), pushBatchSize));
    for (Schedule schedule : pending) {
      if (schedule.deleted() && schedule.externalEventId() == null) {
        // never reached the external calendar
        applyPushResult(schedule, null);
        continue;
      }
      ExternalEventRef ref;
      try {
        if (schedule.deleted()) {
          authorized(link, client, "deleteEvent", token -> {
            client.deleteEvent(token, link.calendarId(), schedule.externalEventId());
            return null;
          });
          ref = null;
        } else {
          ref = authorized(link, client, "createOrUpdateEvent",
              token -> client.createOrUpdateEvent(token, link.calendarId(), schedule));
        }
      } catch (SyncCredentialException e) {
        throw e;
      } catch (SyncException e) {
        scheduleService.applySyncTransition(schedule.childId(), schedule.scheduleId(), stateMachine::onPushFailed);
        throw e;
      }
      applyPushResult(schedule, ref);
      progress.pushed++;
      metrics.incrementEventsPushed();
    }
  }

  private void applyPushResult(Schedule pushed, ExternalEventRef ref) {
    scheduleService.applySyncTransition(pushed.childId(), pushed.scheduleId(),
        current -> stateMachine.onPushSucceeded(current, pushed, ref));
  }

  private <T> T authorized(SyncLink link, ExternalCalendarClient client, String operation, TokenCall<T> call)
      throws SyncException, InterruptedException {
    AccessToken token = accessToken(link, client);
    try {
      return caller.call(operation, () -> call.call(token));
    } catch (SyncCredentialException e) {
      logger.log(Level.FINE, "{0} rejected the access token for user {1}, refreshing",
          new Object[]{operation, link.userId()});
      tokenCache.invalidate(link.userId());
      AccessToken refreshed = accessToken(link, client);
      return caller.call(operation, () -> call.call(refreshed));
    }
  }

  private AccessToken accessToken(SyncLink link, ExternalCalendarClient client)
      throws SyncException, InterruptedException {
    AccessToken cached = tokenCache.get(link.userId(), clock.instant());
    if (cached != null) {
      return cached;
    }
    if (link.refreshCredential() == null) {
      throw new SyncCredentialException("No refresh credential stored for user " + link.userId());
    }
    AccessToken token = caller.call("refreshAccessToken",
        () -> client.refreshAccessToken(link.accountId(), link.refreshCredential()));
    tokenCache.put(link.userId(), token);
    return token;
  }

  private void persistWatermark(String userId, Instant watermark) {
    Instant now = clock.instant();
    Transactions.inTransaction(connectionProvider, conn -> {
      syncLinkStore.find(conn, userId)
          .ifPresent(current -> syncLinkStore.save(conn, current.withWatermark(watermark, now)));
      return null;
    });
  }

  private void suspend(String userId, SyncCredentialException cause) {
    tokenCache.invalidate(userId);
    logger.log(Level.WARNING, "Credential rejected for user " + userId
        + "; sync suspended until re-authorization", cause);
    Instant now = clock.instant();
    Transactions.inTransaction(connectionProvider, conn -> {
      syncLinkStore.find(conn, userId)
          .ifPresent(current -> syncLinkStore.save(conn, current.credentialFailed(cause.getMessage(), now)));
      return null;
    });
  }

  /**
   * Stops periodic passes and interrupts running ones. Interrupted passes leave the
   * watermark untouched.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (periodicTask != null) {
      periodicTask.cancel(false);
      periodicTask = null;
    }
    shutdown(scheduler);
    shutdown(workers);
    shutdown(callExecutor);
  }

  private static void shutdown(ExecutorService executor) {
    if (executor == null) {
      return;
    }
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  @FunctionalInterface
  private interface TokenCall<T> {
    T call(AccessToken token) throws SyncException;
  }

  private static final class PassProgress {
    int pulled;
    int pushed;
    final List<SyncConflict> conflicts = new ArrayList<>();

    SyncPassResult result(String userId, SyncPassResult.Outcome outcome, String error) {
      return new SyncPassResult(userId, outcome, pulled, pushed, conflicts, error);
    }
  }

  /** Builder for {@link SyncEngine}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SyncLinkStore syncLinkStore;
    private ScheduleStore scheduleStore;
    private ScheduleService scheduleService;
    private CalendarClientFactory clientFactory;
    private SyncStateMachine stateMachine;
    private SyncConflictListener conflictListener;
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private int workerCount = 4;
    private long intervalMs = 300_000;
    private int maxAttempts = 3;
    private long callTimeoutMs = 10_000;
    private int pushBatchSize = 100;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder syncLinkStore(SyncLinkStore syncLinkStore) {
      this.syncLinkStore = syncLinkStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder scheduleStore(ScheduleStore scheduleStore) {
      this.scheduleStore = scheduleStore;
      return this;
    }

    /**
     * <b>Required.</b> Used to persist merged schedules with their conflicts recomputed.
     */
    public Builder scheduleService(ScheduleService scheduleService) {
      this.scheduleService = scheduleService;
      return this;
    }

    /** <b>Required.</b> */
    public Builder clientFactory(CalendarClientFactory clientFactory) {
      this.clientFactory = clientFactory;
      return this;
    }

    /**
     * Optional. Should be the instance given to the {@link ScheduleService}.
     */
    public Builder stateMachine(SyncStateMachine stateMachine) {
      this.stateMachine = stateMachine;
      return this;
    }

    public Builder conflictListener(SyncConflictListener conflictListener) {
      this.conflictListener = conflictListener;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Backoff between attempts of one calendar call.
     * Defaults to exponential backoff from 200ms up to 10s.
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
     * Optional. Number of passes that may run at once. Defaults to {@code 4}.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Optional. Delay between periodic passes; {@code 0} disables them.
     * Defaults to {@code 300000} (5 minutes).
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Optional. Attempts per calendar call, first one included. Defaults to {@code 3}.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Optional. Timeout of a single calendar call. Defaults to {@code 10000}.
     */
    public Builder callTimeoutMs(long callTimeoutMs) {
      this.callTimeoutMs = callTimeoutMs;
      return this;
    }

    /**
     * Optional. Maximum local changes pushed per pass. Defaults to {@code 100}.
     */
    public Builder pushBatchSize(int pushBatchSize) {
      this.pushBatchSize = pushBatchSize;
      return this;
    }

    public SyncEngine build() {
      return new SyncEngine(this);
    }
  }
}
