package io.caresync.sync;

import io.caresync.model.Schedule;

/**
 * Outcome of feeding one event into the {@link SyncStateMachine}.
 *
 * @param kind     what happened
 * @param result   the schedule to persist, or {@code null} when nothing changes
 * @param conflict the conflict report, present only for {@link Kind#CONFLICT_RESOLVED}
 */
public record Transition(Kind kind, Schedule result, SyncConflict conflict) {

  public enum Kind {
    /** Echo of our own write, stale duplicate, or an event that maps to no child. */
    IGNORED,
    /** A new schedule created from an external event. */
    CREATED,
    /** External values merged into an unmodified local schedule. */
    APPLIED,
    /** External deletion applied as a soft delete. */
    DELETED,
    /** Both sides changed; the resolver picked a winner. */
    CONFLICT_RESOLVED,
    /** A local status change, such as a push result. */
    STATUS
  }

  static Transition ignored() {
    return new Transition(Kind.IGNORED, null, null);
  }

  static Transition of(Kind kind, Schedule result) {
    return new Transition(kind, result, null);
  }

  public boolean changed() {
    return result != null;
  }

  public Transition withResult(Schedule persisted) {
    return new Transition(kind, persisted, conflict);
  }
}
