package io.caresync.model;

/**
 * Thrown when a schedule is malformed (e.g. end not after start). Raised before
 * conflict detection, so the schedule is never persisted.
 */
public final class ScheduleValidationException extends IllegalArgumentException {
  public ScheduleValidationException(String message) {
    super(message);
  }
}
