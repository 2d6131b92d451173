package io.caresync.conflict;

import io.caresync.model.ConflictInfo;
import io.caresync.model.Schedule;

import java.util.Collection;
import java.util.List;

/**
 * Finds the schedules of a child that a candidate schedule overlaps.
 *
 * <p>Implementations must be symmetric: if {@code a} conflicts with {@code b} then
 * {@code b} conflicts with {@code a}. Deleted schedules and the candidate itself
 * (matched by id) never produce a conflict.
 *
 * @see PairwiseConflictDetector
 */
public interface ConflictDetector {

  /**
   * @param candidate the schedule being created or updated
   * @param existing  the other schedules of the same child
   * @return one entry per conflicting schedule, in the iteration order of {@code existing}
   */
  List<ConflictInfo> detectConflicts(Schedule candidate, Collection<Schedule> existing);
}
