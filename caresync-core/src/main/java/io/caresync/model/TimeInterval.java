package io.caresync.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Half-open time interval {@code [start, end)}.
 *
 * <p>Two intervals overlap only when their open intersection is non-empty, so
 * intervals that merely touch ({@code a.end == b.start}) never overlap.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class TimeInterval implements Comparable<TimeInterval> {
  private final Instant start;
  private final Instant end;

  private TimeInterval(Instant start, Instant end) {
    this.start = start;
    this.end = end;
  }

  /**
   * Creates an interval.
   *
   * @param start inclusive start
   * @param end   exclusive end, strictly after {@code start}
   * @return the interval
   * @throws IllegalArgumentException if {@code end} is not after {@code start}
   */
  public static TimeInterval of(Instant start, Instant end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!end.isAfter(start)) {
      throw new IllegalArgumentException("end must be after start: [" + start + ", " + end + ")");
    }
    return new TimeInterval(start, end);
  }

  /**
   * Creates the interval covering a whole calendar day in the given zone.
   */
  public static TimeInterval wholeDay(LocalDate date, ZoneId zone) {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(zone, "zone");
    return new TimeInterval(
        date.atStartOfDay(zone).toInstant(),
        date.plusDays(1).atStartOfDay(zone).toInstant());
  }

  public Instant start() {
    return start;
  }

  public Instant end() {
    return end;
  }

  public boolean overlaps(TimeInterval other) {
    return start.isBefore(other.end) && other.start.isBefore(end);
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  public boolean contains(TimeInterval other) {
    return !other.start.isBefore(start) && !other.end.isAfter(end);
  }

  /**
   * Returns the overlapping part of both intervals, or {@code null} if they do not overlap.
   */
  public TimeInterval intersection(TimeInterval other) {
    if (!overlaps(other)) {
      return null;
    }
    Instant s = start.isAfter(other.start) ? start : other.start;
    Instant e = end.isBefore(other.end) ? end : other.end;
    return new TimeInterval(s, e);
  }

  public Duration duration() {
    return Duration.between(start, end);
  }

  public long durationMinutes() {
    return duration().toMinutes();
  }

  @Override
  public int compareTo(TimeInterval other) {
    int c = start.compareTo(other.start);
    return c != 0 ? c : end.compareTo(other.end);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TimeInterval that)) return false;
    return start.equals(that.start) && end.equals(that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
