package io.caresync.schedule;

import io.caresync.model.ConflictInfo;
import io.caresync.model.Schedule;

import java.util.List;

/**
 * Schedules of a child in a time window, ordered by start, with every conflicting
 * pair among them reported once.
 */
public record ScheduleListing(List<Schedule> items, List<ConflictInfo> conflicts) {
  public ScheduleListing {
    items = List.copyOf(items);
    conflicts = List.copyOf(conflicts);
  }
}
