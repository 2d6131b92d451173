package io.caresync.model;

import java.time.LocalTime;

/**
 * Coarse part-of-day buckets users pick as slot preferences.
 */
public enum TimeSlot {
  MORNING(LocalTime.MIDNIGHT, LocalTime.NOON),
  AFTERNOON(LocalTime.NOON, LocalTime.of(17, 0)),
  EVENING(LocalTime.of(17, 0), LocalTime.MAX);

  private final LocalTime from;
  private final LocalTime until;

  TimeSlot(LocalTime from, LocalTime until) {
    this.from = from;
    this.until = until;
  }

  public boolean includes(LocalTime time) {
    if (this == EVENING) {
      return !time.isBefore(from);
    }
    return !time.isBefore(from) && time.isBefore(until);
  }

  public static TimeSlot of(LocalTime time) {
    for (TimeSlot slot : values()) {
      if (slot.includes(time)) {
        return slot;
      }
    }
    throw new IllegalStateException("No slot for " + time);
  }
}
