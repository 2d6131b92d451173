package io.caresync.sync;

import io.caresync.model.ExternalEvent;
import io.caresync.model.ExternalEventRef;
import io.caresync.model.Schedule;
import io.caresync.model.ScheduleCategory;
import io.caresync.model.SyncLink;
import io.caresync.model.SyncStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Pure transition rules for a schedule's {@link SyncStatus}.
 *
 * <p>Local edits move a schedule to {@code PENDING_PUSH} whether or not a link currently
 * pushes, so that edits made while sync is off still count as local changes. Only a
 * schedule that was never pushed stays {@code UNSYNCED} until a pushing link exists;
 * the push queue picks up both. A successful push moves a schedule to {@code SYNCED} and
 * records the external revision, so that the echo of our own write is recognised on the
 * next pull.
 *
 * <p>An inbound change is merged directly when the schedule has no unsent local changes,
 * and goes through the {@link ConflictResolver} otherwise. When the local side wins, the
 * schedule is {@code CONFLICTED} until its version has been pushed over the external one.
 * An inbound change that cannot be merged leaves a synced schedule {@code PENDING_PULL}.
 *
 * <p>Callers persist the returned schedules; this class holds no state.
 */
public final class SyncStateMachine {
  private final ConflictResolver resolver;
  private final Clock clock;

  public SyncStateMachine(ConflictResolver resolver, Clock clock) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Tags a locally created, updated or deleted schedule.
   *
   * @param outbound whether the owner's link pushes local changes
   */
  public Schedule onLocalChange(Schedule schedule, boolean outbound) {
    SyncStatus status = schedule.syncStatus();
    if (status == SyncStatus.PENDING_PUSH || (status == SyncStatus.UNSYNCED && !outbound)) {
      return schedule;
    }
    return schedule.toBuilder().syncStatus(SyncStatus.PENDING_PUSH).build();
  }

  /**
   * Records a successful push of {@code pushed} onto the current stored state.
   *
   * <p>If the schedule was edited again while the push was in flight, the new edit stays
   * {@code PENDING_PUSH}; only the external reference is taken over.
   *
   * @param current the schedule as stored now, or {@code null} if it disappeared
   * @param pushed  the version that was sent
   * @param ref     the provider's answer, or {@code null} for a deletion or a no-op
   */
  public Transition onPushSucceeded(Schedule current, Schedule pushed, ExternalEventRef ref) {
    if (current == null) {
      return Transition.ignored();
    }
    Instant now = clock.instant();
    Schedule.Builder b = current.toBuilder();
    if (ref != null) {
      b.externalEventId(ref.eventRef()).externalRevision(ref.revision());
    }
    if (current.updatedAt().equals(pushed.updatedAt())) {
      b.syncStatus(SyncStatus.SYNCED).lastSyncedAt(now);
    }
    return Transition.of(Transition.Kind.STATUS, b.build());
  }

  /**
   * Marks a schedule whose push failed. Local values are left untouched.
   */
  public Transition onPushFailed(Schedule current) {
    if (current == null || current.syncStatus() == SyncStatus.SYNC_FAILED) {
      return Transition.ignored();
    }
    return Transition.of(Transition.Kind.STATUS,
        current.toBuilder().syncStatus(SyncStatus.SYNC_FAILED).build());
  }

  /**
   * Marks a synced schedule whose external change could not be merged. The change is
   * pulled again by a later pass; schedules with local changes keep their status.
   */
  public Transition onInboundDeferred(Schedule current) {
    if (current == null || current.syncStatus() != SyncStatus.SYNCED) {
      return Transition.ignored();
    }
    return Transition.of(Transition.Kind.STATUS,
        current.toBuilder().syncStatus(SyncStatus.PENDING_PULL).build());
  }

  /**
   * Feeds one pulled external event.
   *
   * @param local the schedule the event maps to, or {@code null} if none exists yet
   * @param event the external change
   * @param link  the owner's link, supplying the user and the default child
   */
  public Transition onInbound(Schedule local, ExternalEvent event, SyncLink link) {
    Instant now = clock.instant();
    if (local == null) {
      return createFromExternal(event, link, now);
    }
    if (local.externalRevision() != null && !event.revision().isAfter(local.externalRevision())) {
      return Transition.ignored();
    }
    if (local.deleted() && event.deleted()) {
      return Transition.of(Transition.Kind.STATUS, local.toBuilder()
          .externalRevision(event.revision())
          .syncStatus(SyncStatus.SYNCED)
          .lastSyncedAt(now)
          .build());
    }
    if (!local.syncStatus().hasLocalChanges()) {
      return applyExternal(local, event, now);
    }

    SyncConflict.Side winner = resolver.resolve(local, event);
    Schedule result;
    if (winner == SyncConflict.Side.EXTERNAL) {
      result = applyExternal(local, event, now).result();
    } else {
      // keep local values; a deleted external event is re-created by the next push
      result = local.toBuilder()
          .syncStatus(SyncStatus.CONFLICTED)
          .externalRevision(event.revision())
          .externalEventId(event.deleted() ? null : local.externalEventId())
          .build();
    }
    SyncConflict conflict = new SyncConflict(link.userId(), local, event, winner, now);
    return new Transition(Transition.Kind.CONFLICT_RESOLVED, result, conflict);
  }

  private Transition createFromExternal(ExternalEvent event, SyncLink link, Instant now) {
    if (event.deleted()) {
      return Transition.ignored();
    }
    String childId = event.childId() != null ? event.childId() : link.defaultChildId();
    if (childId == null) {
      return Transition.ignored();
    }
    Schedule created = Schedule.builder()
        .scheduleId(event.scheduleId())
        .userId(link.userId())
        .childId(childId)
        .title(event.title())
        .category(event.category() == null ? ScheduleCategory.HOSPITAL : event.category())
        .start(event.start())
        .end(event.end())
        .allDay(event.allDay())
        .locationName(event.location())
        .notes(event.notes())
        .externalEventId(event.eventRef())
        .externalRevision(event.revision())
        .syncStatus(SyncStatus.SYNCED)
        .lastSyncedAt(now)
        .createdAt(now)
        .updatedAt(event.revision())
        .build();
    return Transition.of(Transition.Kind.CREATED, created);
  }

  private Transition applyExternal(Schedule local, ExternalEvent event, Instant now) {
    Schedule.Builder b = local.toBuilder()
        .externalEventId(event.eventRef())
        .externalRevision(event.revision())
        .syncStatus(SyncStatus.SYNCED)
        .lastSyncedAt(now)
        .updatedAt(later(local.updatedAt(), event.revision()));
    if (event.deleted()) {
      return Transition.of(Transition.Kind.DELETED, b.deleted(true).build());
    }
    if (event.title() != null) {
      b.title(event.title());
    }
    if (event.category() != null) {
      b.category(event.category());
    }
    if (event.start() != null) {
      b.allDay(event.allDay()).start(event.start()).end(event.end());
    }
    b.locationName(event.location()).notes(event.notes()).deleted(false);
    return Transition.of(Transition.Kind.APPLIED, b.build());
  }

  private static Instant later(Instant a, Instant b) {
    return a.isAfter(b) ? a : b;
  }
}
