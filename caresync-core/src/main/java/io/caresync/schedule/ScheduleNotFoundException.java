package io.caresync.schedule;

/**
 * Thrown when an update or delete names a schedule that does not exist or was deleted.
 */
public final class ScheduleNotFoundException extends IllegalArgumentException {
  public ScheduleNotFoundException(String scheduleId) {
    super("Schedule not found: " + scheduleId);
  }
}
