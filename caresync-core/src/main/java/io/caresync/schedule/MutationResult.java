package io.caresync.schedule;

import io.caresync.model.ConflictInfo;
import io.caresync.model.Schedule;

import java.util.List;
import java.util.Objects;

/**
 * The stored schedule after a mutation, with the conflicts it was found to have.
 */
public record MutationResult(Schedule schedule, List<ConflictInfo> conflicts) {
  public MutationResult {
    Objects.requireNonNull(schedule, "schedule");
    conflicts = List.copyOf(conflicts);
  }

  public boolean hasConflicts() {
    return !conflicts.isEmpty();
  }
}
