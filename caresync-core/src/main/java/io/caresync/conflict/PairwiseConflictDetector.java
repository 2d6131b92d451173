package io.caresync.conflict;

import io.caresync.model.ConflictInfo;
import io.caresync.model.ConflictType;
import io.caresync.model.Schedule;
import io.caresync.model.TimeInterval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Linear scan over a child's schedules.
 *
 * <p>Timed schedules conflict when their half-open intervals overlap, so back-to-back
 * appointments do not. An all-day schedule conflicts only with another all-day
 * schedule on the same date and never with a timed one.
 */
public final class PairwiseConflictDetector implements ConflictDetector {

  @Override
  public List<ConflictInfo> detectConflicts(Schedule candidate, Collection<Schedule> existing) {
    List<ConflictInfo> conflicts = new ArrayList<>();
    if (candidate.deleted()) {
      return conflicts;
    }
    for (Schedule other : existing) {
      conflictBetween(candidate, other).ifPresent(conflicts::add);
    }
    return conflicts;
  }

  /**
   * Compares two schedules, reporting the conflict from {@code a}'s point of view.
   */
  public static Optional<ConflictInfo> conflictBetween(Schedule a, Schedule b) {
    if (a.deleted() || b.deleted()
        || a.scheduleId().equals(b.scheduleId())
        || !a.childId().equals(b.childId())) {
      return Optional.empty();
    }
    if (a.allDay() != b.allDay()) {
      return Optional.empty();
    }
    if (a.allDay()) {
      if (!a.date().equals(b.date())) {
        return Optional.empty();
      }
      return Optional.of(new ConflictInfo(a.scheduleId(), b.scheduleId(), b.title(),
          a.start(), a.end(), a.interval().durationMinutes(), ConflictType.SAME_DAY));
    }
    TimeInterval ia = a.interval();
    TimeInterval ib = b.interval();
    TimeInterval overlap = ia.intersection(ib);
    if (overlap == null) {
      return Optional.empty();
    }
    return Optional.of(new ConflictInfo(a.scheduleId(), b.scheduleId(), b.title(),
        overlap.start(), overlap.end(), overlap.durationMinutes(), classify(ia, ib)));
  }

  private static ConflictType classify(TimeInterval a, TimeInterval b) {
    if (a.equals(b)) {
      return ConflictType.FULL_OVERLAP;
    }
    if (a.contains(b) || b.contains(a)) {
      return ConflictType.CONTAINS;
    }
    return ConflictType.PARTIAL_OVERLAP;
  }
}
