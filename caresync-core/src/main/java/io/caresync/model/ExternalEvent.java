package io.caresync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An external calendar's view of one event, as returned by a change listing.
 *
 * <p>{@code scheduleId}, {@code childId} and {@code category} are the private
 * properties written when the event was pushed from here; they are {@code null}
 * for events created directly in the external calendar.
 *
 * @param eventRef  external event identifier
 * @param revision  external modification time; strictly increases per event
 * @param deleted   whether the event was removed externally
 */
public record ExternalEvent(
    String eventRef,
    Instant revision,
    boolean deleted,
    String scheduleId,
    String childId,
    ScheduleCategory category,
    String title,
    Instant start,
    Instant end,
    boolean allDay,
    String location,
    String notes
) {
  public ExternalEvent {
    Objects.requireNonNull(eventRef, "eventRef");
    Objects.requireNonNull(revision, "revision");
  }

  public static ExternalEvent deletion(String eventRef, Instant revision) {
    return new ExternalEvent(eventRef, revision, true, null, null, null, null, null, null, false, null, null);
  }
}
