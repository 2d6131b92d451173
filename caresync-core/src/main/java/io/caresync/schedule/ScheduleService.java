package io.caresync.schedule;

import io.caresync.conflict.ConflictDetector;
import io.caresync.conflict.ConflictGraph;
import io.caresync.conflict.PairwiseConflictDetector;
import io.caresync.model.ConflictInfo;
import io.caresync.model.Schedule;
import io.caresync.model.ScheduleValidationException;
import io.caresync.model.SyncLink;
import io.caresync.model.SyncStatus;
import io.caresync.spi.ConnectionProvider;
import io.caresync.spi.MetricsExporter;
import io.caresync.spi.ScheduleStore;
import io.caresync.spi.SyncLinkStore;
import io.caresync.sync.LastWriterWinsResolver;
import io.caresync.sync.SyncStateMachine;
import io.caresync.sync.Transition;
import io.caresync.util.KeyedLocks;
import io.caresync.util.Transactions;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for schedule mutations coming from the CRUD layer and from sync passes.
 *
 * <p>Every mutation runs under its child's lock and recomputes the child's whole
 * conflict graph inside one transaction, writing the mutated schedule together with
 * every other schedule whose conflict references changed. Conflict references sent
 * by callers are ignored.
 *
 * <p>Local updates and deletions are tagged {@link SyncStatus#PENDING_PUSH} even while
 * no link pushes, so a later pull sees them as local changes. New schedules start
 * {@code PENDING_PUSH} under an enabled, outbound-capable link and {@code UNSYNCED}
 * otherwise. Under such a link the {@link ScheduleChangeListener} is told after commit,
 * which typically requests a sync pass.
 *
 * <p>This class is thread-safe. Create instances via {@link #builder()}.
 */
public final class ScheduleService {
  private static final Logger logger = Logger.getLogger(ScheduleService.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ScheduleStore scheduleStore;
  private final SyncLinkStore syncLinkStore;
  private final ConflictDetector conflictDetector;
  private final SyncStateMachine stateMachine;
  private final KeyedLocks childLocks;
  private final MetricsExporter metrics;
  private final ScheduleChangeListener changeListener;
  private final Clock clock;

  private ScheduleService(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.scheduleStore = Objects.requireNonNull(builder.scheduleStore, "scheduleStore");
    this.syncLinkStore = Objects.requireNonNull(builder.syncLinkStore, "syncLinkStore");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.conflictDetector = builder.conflictDetector != null
        ? builder.conflictDetector : new PairwiseConflictDetector();
    this.stateMachine = builder.stateMachine != null
        ? builder.stateMachine : new SyncStateMachine(new LastWriterWinsResolver(), clock);
    this.childLocks = builder.childLocks != null ? builder.childLocks : new KeyedLocks();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.changeListener = builder.changeListener != null ? builder.changeListener : ScheduleChangeListener.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Stores a new schedule.
   *
   * <p>Sync fields and conflict references on the candidate are reset: the schedule
   * starts {@code UNSYNCED} (or {@code PENDING_PUSH}) with freshly computed conflicts.
   *
   * @param candidate a schedule built (and therefore validated) by the caller
   * @return the stored schedule and its conflicts
   */
  public MutationResult createSchedule(Schedule candidate) {
    Objects.requireNonNull(candidate, "candidate");
    Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    Schedule fresh = candidate.toBuilder()
        .externalEventId(null)
        .externalRevision(null)
        .syncStatus(SyncStatus.UNSYNCED)
        .lastSyncedAt(null)
        .deleted(false)
        .createdAt(now)
        .updatedAt(now)
        .build()
        .withConflicts(Set.of());

    AtomicBoolean outbound = new AtomicBoolean();
    MutationResult result = childLocks.withLock(fresh.childId(), () -> Transactions.inTransaction(connectionProvider, conn -> {
      if (scheduleStore.find(conn, fresh.scheduleId()).isPresent()) {
        throw new ScheduleValidationException("Schedule already exists: " + fresh.scheduleId());
      }
      outbound.set(pushes(conn, fresh.userId()));
      Schedule tagged = stateMachine.onLocalChange(fresh, outbound.get());
      return persistWithConflicts(conn, tagged, true);
    }));
    afterLocalMutation(result, outbound.get());
    return result;
  }

  /**
   * Replaces the user-editable fields of an existing schedule.
   *
   * <p>Identity, ownership, sync linkage and creation time are kept from the stored
   * record. An update that changes nothing visible is returned as is.
   *
   * @throws ScheduleNotFoundException if the schedule does not exist or was deleted
   * @throws ScheduleValidationException if the update tries to move the schedule to another child or user
   */
  public MutationResult updateSchedule(Schedule updated) {
    Objects.requireNonNull(updated, "updated");
    Schedule stored = findSchedule(updated.scheduleId())
        .filter(s -> !s.deleted())
        .orElseThrow(() -> new ScheduleNotFoundException(updated.scheduleId()));
    if (!stored.childId().equals(updated.childId()) || !stored.userId().equals(updated.userId())) {
      throw new ScheduleValidationException("A schedule cannot move to another child or user: " + updated.scheduleId());
    }

    AtomicBoolean outbound = new AtomicBoolean();
    MutationResult result = childLocks.withLock(stored.childId(), () -> Transactions.inTransaction(connectionProvider, conn -> {
      Schedule current = scheduleStore.find(conn, updated.scheduleId())
          .filter(s -> !s.deleted())
          .orElseThrow(() -> new ScheduleNotFoundException(updated.scheduleId()));
      if (current.sameContentAs(updated)) {
        ConflictGraph graph = ConflictGraph.build(conflictDetector, scheduleStore.listActiveByChild(conn, current.childId()));
        return new MutationResult(current, graph.conflictsFor(current.scheduleId()));
      }
      Schedule merged = updated.toBuilder()
          .externalEventId(current.externalEventId())
          .externalRevision(current.externalRevision())
          .syncStatus(current.syncStatus())
          .lastSyncedAt(current.lastSyncedAt())
          .deleted(false)
          .createdAt(current.createdAt())
          .updatedAt(nextModification(current))
          .build();
      outbound.set(pushes(conn, merged.userId()));
      Schedule tagged = stateMachine.onLocalChange(merged, outbound.get());
      return persistWithConflicts(conn, tagged, false);
    }));
    afterLocalMutation(result, outbound.get());
    return result;
  }

  /**
   * Soft-deletes a schedule, removing it from conflict computation. The deletion is
   * pushed to the external calendar like any other local change.
   *
   * @throws ScheduleNotFoundException if the schedule does not exist or was already deleted
   */
  public MutationResult deleteSchedule(String scheduleId) {
    Objects.requireNonNull(scheduleId, "scheduleId");
    Schedule stored = findSchedule(scheduleId)
        .filter(s -> !s.deleted())
        .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));

    AtomicBoolean outbound = new AtomicBoolean();
    MutationResult result = childLocks.withLock(stored.childId(), () -> Transactions.inTransaction(connectionProvider, conn -> {
      Schedule current = scheduleStore.find(conn, scheduleId)
          .filter(s -> !s.deleted())
          .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
      Schedule deleted = current.toBuilder()
          .deleted(true)
          .updatedAt(nextModification(current))
          .build();
      outbound.set(pushes(conn, deleted.userId()));
      Schedule tagged = stateMachine.onLocalChange(deleted, outbound.get());
      return persistWithConflicts(conn, tagged, false);
    }));
    afterLocalMutation(result, outbound.get());
    return result;
  }

  /**
   * Finds a schedule by id, deleted ones included.
   */
  public Optional<Schedule> findSchedule(String scheduleId) {
    return Transactions.withConnection(connectionProvider, conn -> scheduleStore.find(conn, scheduleId));
  }

  /**
   * Lists a child's active schedules intersecting {@code [from, to)} with the conflicts among them.
   */
  public ScheduleListing listSchedules(String childId, Instant from, Instant to) {
    Objects.requireNonNull(childId, "childId");
    if (!to.isAfter(from)) {
      throw new IllegalArgumentException("to must be after from");
    }
    List<Schedule> items = Transactions.withConnection(connectionProvider,
        conn -> scheduleStore.listByChild(conn, childId, from, to));
    ConflictGraph graph = ConflictGraph.build(conflictDetector, items);
    return new ScheduleListing(items, graph.pairs());
  }

  /**
   * Applies a sync-originated transition to one schedule under its child's lock.
   *
   * <p>{@code decide} receives the schedule as currently stored ({@code null} when
   * {@code scheduleId} is {@code null} or unknown) and runs inside the transaction.
   * A changed result is persisted together with the recomputed conflict graph.
   *
   * @return the transition, carrying the persisted schedule when it changed
   */
  public Transition applySyncTransition(String childId, String scheduleId, Function<Schedule, Transition> decide) {
    Objects.requireNonNull(childId, "childId");
    return childLocks.withLock(childId, () -> Transactions.inTransaction(connectionProvider, conn -> {
      Schedule current = scheduleId == null ? null : scheduleStore.find(conn, scheduleId).orElse(null);
      Transition transition = decide.apply(current);
      if (!transition.changed()) {
        return transition;
      }
      Schedule target = transition.result();
      if (!target.childId().equals(childId)) {
        throw new IllegalStateException("Transition moved schedule " + target.scheduleId() + " to another child");
      }
      boolean isNew = current == null && scheduleStore.find(conn, target.scheduleId()).isEmpty();
      MutationResult persisted = persistWithConflicts(conn, target, isNew);
      return transition.withResult(persisted.schedule());
    }));
  }

  private MutationResult persistWithConflicts(Connection conn, Schedule target, boolean isNew) {
    List<Schedule> childSchedules = new ArrayList<>();
    for (Schedule s : scheduleStore.listActiveByChild(conn, target.childId())) {
      if (!s.scheduleId().equals(target.scheduleId())) {
        childSchedules.add(s);
      }
    }
    childSchedules.add(target);
    ConflictGraph graph = ConflictGraph.build(conflictDetector, childSchedules);

    Schedule resolved = graph.resolved(target.scheduleId());
    if (isNew) {
      scheduleStore.insert(conn, resolved);
    } else {
      scheduleStore.update(conn, resolved);
    }
    for (Schedule stale : graph.staleSchedules()) {
      if (!stale.scheduleId().equals(target.scheduleId())) {
        scheduleStore.update(conn, stale);
      }
    }
    List<ConflictInfo> conflicts = graph.conflictsFor(target.scheduleId());
    if (!conflicts.isEmpty()) {
      logger.log(Level.FINE, "Schedule {0} conflicts with {1}",
          new Object[]{resolved.scheduleId(), resolved.conflictWith()});
    }
    return new MutationResult(resolved, conflicts);
  }

  private boolean pushes(Connection conn, String userId) {
    Optional<SyncLink> link = syncLinkStore.find(conn, userId);
    return link.isPresent() && link.get().enabled() && link.get().direction().pushes();
  }

  // millisecond precision, strictly after the stored updatedAt
  private Instant nextModification(Schedule current) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    return now.isAfter(current.updatedAt()) ? now : current.updatedAt().plusMillis(1);
  }

  private void afterLocalMutation(MutationResult result, boolean outbound) {
    metrics.incrementScheduleMutations();
    if (result.hasConflicts()) {
      metrics.incrementConflictsDetected();
    }
    if (outbound && result.schedule().syncStatus() == SyncStatus.PENDING_PUSH) {
      try {
        changeListener.onPendingPush(result.schedule());
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Schedule change listener failed for " + result.schedule().scheduleId(), e);
      }
    }
  }

  /** Builder for {@link ScheduleService}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ScheduleStore scheduleStore;
    private SyncLinkStore syncLinkStore;
    private ConflictDetector conflictDetector;
    private SyncStateMachine stateMachine;
    private KeyedLocks childLocks;
    private MetricsExporter metrics;
    private ScheduleChangeListener changeListener;
    private Clock clock;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder scheduleStore(ScheduleStore scheduleStore) {
      this.scheduleStore = scheduleStore;
      return this;
    }

    /**
     * <b>Required.</b> Consulted to decide whether local changes are tagged for push.
     */
    public Builder syncLinkStore(SyncLinkStore syncLinkStore) {
      this.syncLinkStore = syncLinkStore;
      return this;
    }

    /**
     * Optional. Defaults to {@link PairwiseConflictDetector}.
     */
    public Builder conflictDetector(ConflictDetector conflictDetector) {
      this.conflictDetector = conflictDetector;
      return this;
    }

    /**
     * Optional. Defaults to a state machine with a {@link LastWriterWinsResolver}.
     */
    public Builder stateMachine(SyncStateMachine stateMachine) {
      this.stateMachine = stateMachine;
      return this;
    }

    /**
     * Optional. Per-child locks; share one instance between services working on the same store.
     */
    public Builder childLocks(KeyedLocks childLocks) {
      this.childLocks = childLocks;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder changeListener(ScheduleChangeListener changeListener) {
      this.changeListener = changeListener;
      return this;
    }

    /**
     * Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public ScheduleService build() {
      return new ScheduleService(this);
    }
  }
}
