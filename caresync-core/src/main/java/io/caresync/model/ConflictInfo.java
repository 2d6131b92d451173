package io.caresync.model;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * One detected conflict between two schedules of the same child.
 *
 * @param scheduleId      the schedule being checked
 * @param otherScheduleId the schedule it conflicts with
 * @param otherTitle      title of the other schedule
 * @param overlapStart    start of the overlapping interval
 * @param overlapEnd      end of the overlapping interval
 * @param overlapMinutes  length of the overlap
 * @param type            how the intervals relate
 */
public record ConflictInfo(
    String scheduleId,
    String otherScheduleId,
    String otherTitle,
    Instant overlapStart,
    Instant overlapEnd,
    long overlapMinutes,
    ConflictType type
) {
  private static final DateTimeFormatter WARNING_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  public ConflictInfo {
    Objects.requireNonNull(scheduleId, "scheduleId");
    Objects.requireNonNull(otherScheduleId, "otherScheduleId");
    Objects.requireNonNull(type, "type");
  }

  /**
   * User-facing warning text, rendering times in the given zone.
   */
  public String warningMessage(String title, ZoneId zone) {
    if (type == ConflictType.SAME_DAY) {
      return "Schedule conflict: '" + title + "' and '" + otherTitle + "' are both all-day on "
          + overlapStart.atZone(zone).toLocalDate() + ".";
    }
    return "Schedule conflict: '" + title + "' and '" + otherTitle + "' overlap for "
        + overlapMinutes + " minutes starting " + WARNING_TIME.format(overlapStart.atZone(zone)) + ".";
  }
}
