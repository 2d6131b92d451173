package io.caresync.reminder;

import io.caresync.model.ChecklistItem;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A reminder to send before a schedule, listing what to bring.
 *
 * @param scheduleId    the schedule reminded of
 * @param remindAt      when to send the reminder
 * @param offsetMinutes how long before the schedule's start {@code remindAt} lies
 * @param checklist     user checklist items followed by category defaults
 * @param message       human-readable reminder text
 */
public record Reminder(
    String scheduleId,
    Instant remindAt,
    int offsetMinutes,
    List<ChecklistItem> checklist,
    String message
) {
  public Reminder {
    Objects.requireNonNull(scheduleId, "scheduleId");
    Objects.requireNonNull(remindAt, "remindAt");
    checklist = List.copyOf(checklist);
  }
}
