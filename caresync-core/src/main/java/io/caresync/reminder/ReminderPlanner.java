package io.caresync.reminder;

import io.caresync.model.ChecklistItem;
import io.caresync.model.Schedule;
import io.caresync.model.ScheduleCategory;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Plans the reminders of a schedule: one per reminder offset, each carrying the
 * schedule's checklist merged with the default items for its category.
 */
public final class ReminderPlanner {
  private static final DateTimeFormatter WHEN = DateTimeFormatter.ofPattern("MMM d HH:mm", Locale.ENGLISH);

  private final Map<ScheduleCategory, List<String>> defaults;
  private final ZoneId zone;

  public ReminderPlanner(ZoneId zone) {
    this(defaultChecklists(), zone);
  }

  public ReminderPlanner(Map<ScheduleCategory, List<String>> defaults, ZoneId zone) {
    this.defaults = new EnumMap<>(ScheduleCategory.class);
    this.defaults.putAll(Objects.requireNonNull(defaults, "defaults"));
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Standard items to bring, per category.
   */
  public static Map<ScheduleCategory, List<String>> defaultChecklists() {
    Map<ScheduleCategory, List<String>> m = new EnumMap<>(ScheduleCategory.class);
    m.put(ScheduleCategory.HOSPITAL, List.of(
        "ID card", "Health insurance card", "Referral letter (if any)",
        "Previous test results", "List of current medications"));
    m.put(ScheduleCategory.REHABILITATION, List.of(
        "Comfortable sportswear", "Indoor shoes", "Rehabilitation diary", "Assistive devices (if any)"));
    m.put(ScheduleCategory.THERAPY, List.of(
        "Therapy record sheet", "Observation diary", "A favourite toy"));
    m.put(ScheduleCategory.CHECKUP, List.of(
        "Confirm fasting requirements", "Previous checkup results", "Special case certificate"));
    return m;
  }

  /**
   * Returns the reminders of a schedule ordered by send time; empty for deleted schedules.
   */
  public List<Reminder> plan(Schedule schedule) {
    List<Reminder> reminders = new ArrayList<>();
    if (schedule.deleted()) {
      return reminders;
    }
    List<ChecklistItem> checklist = mergedChecklist(schedule);
    String message = message(schedule, checklist);
    for (int offset : schedule.reminderMinutes()) {
      reminders.add(new Reminder(schedule.scheduleId(),
          schedule.start().minusSeconds(offset * 60L), offset, checklist, message));
    }
    reminders.sort(Comparator.comparing(Reminder::remindAt));
    return reminders;
  }

  /**
   * User items first, then category defaults not already present by name.
   */
  public List<ChecklistItem> mergedChecklist(Schedule schedule) {
    List<ChecklistItem> merged = new ArrayList<>(schedule.checklist());
    Set<String> present = new HashSet<>();
    for (ChecklistItem item : merged) {
      present.add(item.item());
    }
    for (String item : defaults.getOrDefault(schedule.category(), List.of())) {
      if (present.add(item)) {
        merged.add(ChecklistItem.unchecked(item));
      }
    }
    return merged;
  }

  private String message(Schedule schedule, List<ChecklistItem> checklist) {
    StringBuilder sb = new StringBuilder();
    sb.append("Upcoming: '").append(schedule.title()).append("'\n");
    sb.append("Where: ").append(schedule.locationName() != null ? schedule.locationName() : "scheduled location").append('\n');
    sb.append("When: ").append(schedule.allDay()
        ? schedule.date().toString()
        : WHEN.format(schedule.start().atZone(zone))).append('\n');
    if (!checklist.isEmpty()) {
      sb.append("Remember to bring:");
      for (ChecklistItem item : checklist) {
        sb.append("\n  - ").append(item.item());
      }
    }
    return sb.toString();
  }
}
