package io.caresync.conflict;

import io.caresync.model.ConflictInfo;
import io.caresync.model.Schedule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Symmetric conflict relation over one child's active schedules.
 *
 * <p>Built from scratch on every mutation, so stale or one-sided references left
 * in the store are healed by the next recomputation.
 */
public final class ConflictGraph {
  private final Map<String, Schedule> schedules;
  private final Map<String, Set<String>> adjacency;
  private final List<ConflictInfo> conflicts;

  private ConflictGraph(Map<String, Schedule> schedules, Map<String, Set<String>> adjacency,
      List<ConflictInfo> conflicts) {
    this.schedules = schedules;
    this.adjacency = adjacency;
    this.conflicts = conflicts;
  }

  /**
   * Builds the graph for a set of schedules. Deleted schedules are kept as isolated nodes.
   */
  public static ConflictGraph build(ConflictDetector detector, Collection<Schedule> active) {
    Objects.requireNonNull(detector, "detector");
    Map<String, Schedule> byId = new LinkedHashMap<>();
    for (Schedule s : active) {
      byId.put(s.scheduleId(), s);
    }
    Map<String, Set<String>> adjacency = new LinkedHashMap<>();
    for (String id : byId.keySet()) {
      adjacency.put(id, new TreeSet<>());
    }
    List<ConflictInfo> pairs = new ArrayList<>();
    List<Schedule> ordered = new ArrayList<>(byId.values());
    for (int i = 0; i < ordered.size(); i++) {
      Schedule a = ordered.get(i);
      List<ConflictInfo> found = detector.detectConflicts(a, ordered.subList(i + 1, ordered.size()));
      for (ConflictInfo info : found) {
        adjacency.get(info.scheduleId()).add(info.otherScheduleId());
        adjacency.get(info.otherScheduleId()).add(info.scheduleId());
        pairs.add(info);
      }
    }
    return new ConflictGraph(byId, adjacency, Collections.unmodifiableList(pairs));
  }

  /**
   * Ids of the schedules conflicting with {@code scheduleId}; empty if unknown.
   */
  public Set<String> conflictsOf(String scheduleId) {
    Set<String> ids = adjacency.get(scheduleId);
    return ids == null ? Set.of() : Collections.unmodifiableSet(ids);
  }

  /**
   * Every conflicting pair, each reported once.
   */
  public List<ConflictInfo> pairs() {
    return conflicts;
  }

  /**
   * Conflicts involving {@code scheduleId}, seen from that schedule.
   */
  public List<ConflictInfo> conflictsFor(String scheduleId) {
    List<ConflictInfo> result = new ArrayList<>();
    for (ConflictInfo info : conflicts) {
      if (info.scheduleId().equals(scheduleId)) {
        result.add(info);
      } else if (info.otherScheduleId().equals(scheduleId)) {
        result.add(new ConflictInfo(scheduleId, info.scheduleId(),
            schedules.get(info.scheduleId()).title(), info.overlapStart(), info.overlapEnd(),
            info.overlapMinutes(), info.type()));
      }
    }
    return result;
  }

  /**
   * Returns the schedules whose cached conflict references differ from the graph,
   * already carrying the corrected references.
   */
  public List<Schedule> staleSchedules() {
    List<Schedule> stale = new ArrayList<>();
    for (Schedule s : schedules.values()) {
      Set<String> expected = adjacency.get(s.scheduleId());
      if (!s.conflictWith().equals(expected)) {
        stale.add(s.withConflicts(expected));
      }
    }
    return stale;
  }

  /**
   * The schedule with its references taken from the graph.
   */
  public Schedule resolved(String scheduleId) {
    Schedule s = schedules.get(scheduleId);
    if (s == null) {
      throw new IllegalArgumentException("unknown schedule: " + scheduleId);
    }
    Set<String> expected = adjacency.get(scheduleId);
    return s.conflictWith().equals(expected) ? s : s.withConflicts(expected);
  }
}
