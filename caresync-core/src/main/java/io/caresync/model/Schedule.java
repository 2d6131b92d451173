package io.caresync.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable care appointment for one child, owned by one user.
 *
 * <p>Invariants enforced at construction: a timed schedule ends strictly after it
 * starts; an all-day schedule is normalized to cover the whole day of its start in
 * its {@linkplain #zone() zone}; reminder offsets are non-negative; checklist order
 * is preserved.
 *
 * <p>The {@link #hasConflict()} / {@link #conflictWith()} pair is a cache owned by
 * the conflict detector. The {@linkplain Builder builder} cannot set it; only
 * {@link #withConflicts(Set)} does.
 *
 * @see io.caresync.conflict.ConflictDetector
 * @see io.caresync.sync.SyncStateMachine
 */
public final class Schedule {
  public static final SortedSet<Integer> DEFAULT_REMINDER_MINUTES =
      Collections.unmodifiableSortedSet(new TreeSet<>(List.of(60, 1440)));

  private final String scheduleId;
  private final String childId;
  private final String userId;
  private final String title;
  private final ScheduleCategory category;
  private final Instant start;
  private final Instant end;
  private final boolean allDay;
  private final ZoneId zone;
  private final String locationName;
  private final String locationAddress;
  private final String department;
  private final String doctorName;
  private final List<ChecklistItem> checklist;
  private final SortedSet<Integer> reminderMinutes;
  private final String notes;
  private final String externalEventId;
  private final Instant externalRevision;
  private final SyncStatus syncStatus;
  private final Instant lastSyncedAt;
  private final boolean hasConflict;
  private final Set<String> conflictWith;
  private final boolean deleted;
  private final Instant createdAt;
  private final Instant updatedAt;

  private Schedule(Builder b, Set<String> conflictWith) {
    this.scheduleId = b.scheduleId == null ? UlidCreator.getMonotonicUlid().toString() : b.scheduleId;
    this.childId = require(b.childId, "childId");
    this.userId = require(b.userId, "userId");
    this.title = require(b.title, "title");
    if (b.category == null) {
      throw new ScheduleValidationException("category is required");
    }
    this.category = b.category;
    this.zone = b.zone == null ? ZoneOffset.UTC : b.zone;
    this.allDay = b.allDay;
    if (b.start == null) {
      throw new ScheduleValidationException("start is required");
    }
    if (allDay) {
      LocalDate day = LocalDate.ofInstant(b.start, zone);
      TimeInterval whole = TimeInterval.wholeDay(day, zone);
      this.start = whole.start();
      this.end = whole.end();
    } else {
      if (b.end == null || !b.end.isAfter(b.start)) {
        throw new ScheduleValidationException(
            "end must be after start for timed schedule: start=" + b.start + ", end=" + b.end);
      }
      this.start = b.start;
      this.end = b.end;
    }
    this.locationName = b.locationName;
    this.locationAddress = b.locationAddress;
    this.department = b.department;
    this.doctorName = b.doctorName;
    this.checklist = Collections.unmodifiableList(new ArrayList<>(b.checklist));
    SortedSet<Integer> reminders = new TreeSet<>();
    for (Integer minutes : b.reminderMinutes) {
      if (minutes == null || minutes < 0) {
        throw new ScheduleValidationException("reminder offsets must be >= 0, got: " + minutes);
      }
      reminders.add(minutes);
    }
    this.reminderMinutes = Collections.unmodifiableSortedSet(reminders);
    this.notes = b.notes;
    this.externalEventId = b.externalEventId;
    this.externalRevision = b.externalRevision;
    this.syncStatus = b.syncStatus == null ? SyncStatus.UNSYNCED : b.syncStatus;
    this.lastSyncedAt = b.lastSyncedAt;
    this.deleted = b.deleted;
    Instant now = Instant.now();
    this.createdAt = b.createdAt == null ? now : b.createdAt;
    this.updatedAt = b.updatedAt == null ? this.createdAt : b.updatedAt;
    this.conflictWith = Collections.unmodifiableSet(new TreeSet<>(conflictWith));
    this.hasConflict = !this.conflictWith.isEmpty();
  }

  private static String require(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ScheduleValidationException(field + " is required");
    }
    return value;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-populated with this schedule's values. The conflict cache is
   * carried along unchanged; only {@link #withConflicts(Set)} replaces it.
   */
  public Builder toBuilder() {
    Builder b = new Builder();
    b.scheduleId = scheduleId;
    b.childId = childId;
    b.userId = userId;
    b.title = title;
    b.category = category;
    b.start = start;
    b.end = end;
    b.allDay = allDay;
    b.zone = zone;
    b.locationName = locationName;
    b.locationAddress = locationAddress;
    b.department = department;
    b.doctorName = doctorName;
    b.checklist = new ArrayList<>(checklist);
    b.reminderMinutes = new ArrayList<>(reminderMinutes);
    b.notes = notes;
    b.externalEventId = externalEventId;
    b.externalRevision = externalRevision;
    b.syncStatus = syncStatus;
    b.lastSyncedAt = lastSyncedAt;
    b.deleted = deleted;
    b.createdAt = createdAt;
    b.updatedAt = updatedAt;
    b.conflictWith = conflictWith;
    return b;
  }

  /**
   * Returns a copy carrying the given conflict references. Reserved for the conflict detector.
   */
  public Schedule withConflicts(Set<String> conflictIds) {
    Objects.requireNonNull(conflictIds, "conflictIds");
    return new Schedule(toBuilder(), conflictIds);
  }

  /**
   * The interval used for conflict detection.
   */
  public TimeInterval interval() {
    return TimeInterval.of(start, end);
  }

  /**
   * The calendar date of an all-day schedule in its zone.
   */
  public LocalDate date() {
    return LocalDate.ofInstant(start, zone);
  }

  /**
   * Whether both schedules carry the same user-visible content, ignoring identity,
   * sync linkage, conflict cache and timestamps.
   */
  public boolean sameContentAs(Schedule other) {
    return other != null
        && title.equals(other.title)
        && category == other.category
        && start.equals(other.start)
        && end.equals(other.end)
        && allDay == other.allDay
        && Objects.equals(locationName, other.locationName)
        && Objects.equals(locationAddress, other.locationAddress)
        && Objects.equals(department, other.department)
        && Objects.equals(doctorName, other.doctorName)
        && checklist.equals(other.checklist)
        && reminderMinutes.equals(other.reminderMinutes)
        && Objects.equals(notes, other.notes)
        && deleted == other.deleted;
  }

  public String scheduleId() {
    return scheduleId;
  }

  public String childId() {
    return childId;
  }

  public String userId() {
    return userId;
  }

  public String title() {
    return title;
  }

  public ScheduleCategory category() {
    return category;
  }

  public Instant start() {
    return start;
  }

  public Instant end() {
    return end;
  }

  public boolean allDay() {
    return allDay;
  }

  public ZoneId zone() {
    return zone;
  }

  public String locationName() {
    return locationName;
  }

  public String locationAddress() {
    return locationAddress;
  }

  public String department() {
    return department;
  }

  public String doctorName() {
    return doctorName;
  }

  public List<ChecklistItem> checklist() {
    return checklist;
  }

  public SortedSet<Integer> reminderMinutes() {
    return reminderMinutes;
  }

  public String notes() {
    return notes;
  }

  public String externalEventId() {
    return externalEventId;
  }

  /**
   * Revision (external modification time) of the last external state merged into,
   * or produced from, this schedule. Inbound changes not newer than this are echoes.
   */
  public Instant externalRevision() {
    return externalRevision;
  }

  public SyncStatus syncStatus() {
    return syncStatus;
  }

  public Instant lastSyncedAt() {
    return lastSyncedAt;
  }

  public boolean hasConflict() {
    return hasConflict;
  }

  public Set<String> conflictWith() {
    return conflictWith;
  }

  public boolean deleted() {
    return deleted;
  }

  /**
   * Whether the next push has something to send: local changes, except for a schedule
   * deleted before it was ever pushed.
   */
  public boolean awaitsPush() {
    return syncStatus.hasLocalChanges() && !(deleted && syncStatus == SyncStatus.UNSYNCED);
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Schedule that)) return false;
    return scheduleId.equals(that.scheduleId)
        && sameContentAs(that)
        && childId.equals(that.childId)
        && userId.equals(that.userId)
        && Objects.equals(externalEventId, that.externalEventId)
        && Objects.equals(externalRevision, that.externalRevision)
        && syncStatus == that.syncStatus
        && conflictWith.equals(that.conflictWith)
        && updatedAt.equals(that.updatedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scheduleId, start, end, syncStatus, updatedAt);
  }

  @Override
  public String toString() {
    return "Schedule{id=" + scheduleId
        + ", childId=" + childId
        + ", title=" + title
        + ", category=" + category
        + ", interval=[" + start + ", " + end + ")"
        + (allDay ? ", allDay" : "")
        + ", syncStatus=" + syncStatus
        + (deleted ? ", deleted" : "")
        + (hasConflict ? ", conflictWith=" + conflictWith : "")
        + '}';
  }

  /**
   * Builder for {@link Schedule}. {@link #build()} validates the schedule.
   */
  public static final class Builder {
    private String scheduleId;
    private String childId;
    private String userId;
    private String title;
    private ScheduleCategory category;
    private Instant start;
    private Instant end;
    private boolean allDay;
    private ZoneId zone;
    private String locationName;
    private String locationAddress;
    private String department;
    private String doctorName;
    private List<ChecklistItem> checklist = new ArrayList<>();
    private Collection<Integer> reminderMinutes = new ArrayList<>(DEFAULT_REMINDER_MINUTES);
    private String notes;
    private String externalEventId;
    private Instant externalRevision;
    private SyncStatus syncStatus;
    private Instant lastSyncedAt;
    private boolean deleted;
    private Instant createdAt;
    private Instant updatedAt;
    private Set<String> conflictWith = Set.of();

    private Builder() {
    }

    public Builder scheduleId(String scheduleId) {
      this.scheduleId = scheduleId;
      return this;
    }

    public Builder childId(String childId) {
      this.childId = childId;
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder category(ScheduleCategory category) {
      this.category = category;
      return this;
    }

    public Builder start(Instant start) {
      this.start = start;
      return this;
    }

    public Builder end(Instant end) {
      this.end = end;
      return this;
    }

    /**
     * Sets start and end from an interval.
     */
    public Builder interval(TimeInterval interval) {
      this.start = interval.start();
      this.end = interval.end();
      return this;
    }

    public Builder allDay(boolean allDay) {
      this.allDay = allDay;
      return this;
    }

    /**
     * Zone used to resolve the calendar date of all-day schedules. Defaults to UTC.
     */
    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    public Builder locationName(String locationName) {
      this.locationName = locationName;
      return this;
    }

    public Builder locationAddress(String locationAddress) {
      this.locationAddress = locationAddress;
      return this;
    }

    public Builder department(String department) {
      this.department = department;
      return this;
    }

    public Builder doctorName(String doctorName) {
      this.doctorName = doctorName;
      return this;
    }

    public Builder checklist(List<ChecklistItem> checklist) {
      this.checklist = checklist == null ? new ArrayList<>() : new ArrayList<>(checklist);
      return this;
    }

    public Builder reminderMinutes(Collection<Integer> reminderMinutes) {
      this.reminderMinutes = reminderMinutes == null ? new ArrayList<>() : new ArrayList<>(reminderMinutes);
      return this;
    }

    public Builder notes(String notes) {
      this.notes = notes;
      return this;
    }

    public Builder externalEventId(String externalEventId) {
      this.externalEventId = externalEventId;
      return this;
    }

    public Builder externalRevision(Instant externalRevision) {
      this.externalRevision = externalRevision;
      return this;
    }

    public Builder syncStatus(SyncStatus syncStatus) {
      this.syncStatus = syncStatus;
      return this;
    }

    public Builder lastSyncedAt(Instant lastSyncedAt) {
      this.lastSyncedAt = lastSyncedAt;
      return this;
    }

    public Builder deleted(boolean deleted) {
      this.deleted = deleted;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    /**
     * Builds the schedule. A fresh builder yields no conflict references; a builder from
     * {@link Schedule#toBuilder()} keeps the source's references.
     *
     * @throws ScheduleValidationException if the schedule is malformed
     */
    public Schedule build() {
      return new Schedule(this, conflictWith);
    }
  }
}
