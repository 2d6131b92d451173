package io.caresync.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A user's standing request to be alerted about freed appointment slots at a
 * hospital, optionally narrowed to a department and doctor.
 *
 * <p>Immutable; the {@code with*} methods return modified copies.
 */
public final class WatchSubscription {
  private final String subscriptionId;
  private final String userId;
  private final String childId;
  private final String hospitalName;
  private final String department;
  private final String doctorName;
  private final SortedSet<LocalDate> preferredDates;
  private final Set<TimeSlot> preferredTimeSlots;
  private final boolean enabled;
  private final WatcherStatus status;
  private final Instant lastAlertAt;
  private final int alertCount;
  private final String hospitalPhone;
  private final String reservationUrl;
  private final Instant createdAt;
  private final Instant updatedAt;

  private WatchSubscription(Builder b) {
    this.subscriptionId = b.subscriptionId == null ? UlidCreator.getMonotonicUlid().toString() : b.subscriptionId;
    this.userId = Objects.requireNonNull(b.userId, "userId");
    this.childId = Objects.requireNonNull(b.childId, "childId");
    this.hospitalName = Objects.requireNonNull(b.hospitalName, "hospitalName");
    this.department = b.department;
    this.doctorName = b.doctorName;
    this.preferredDates = Collections.unmodifiableSortedSet(new TreeSet<>(b.preferredDates));
    this.preferredTimeSlots = b.preferredTimeSlots.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(b.preferredTimeSlots));
    this.enabled = b.enabled;
    this.status = b.status == null ? (b.enabled ? WatcherStatus.ACTIVE : WatcherStatus.INACTIVE) : b.status;
    if (b.alertCount < 0) {
      throw new IllegalArgumentException("alertCount must be >= 0");
    }
    this.lastAlertAt = b.lastAlertAt;
    this.alertCount = b.alertCount;
    this.hospitalPhone = b.hospitalPhone;
    this.reservationUrl = b.reservationUrl;
    Instant now = Instant.now();
    this.createdAt = b.createdAt == null ? now : b.createdAt;
    this.updatedAt = b.updatedAt == null ? this.createdAt : b.updatedAt;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.subscriptionId = subscriptionId;
    b.userId = userId;
    b.childId = childId;
    b.hospitalName = hospitalName;
    b.department = department;
    b.doctorName = doctorName;
    b.preferredDates = new TreeSet<>(preferredDates);
    b.preferredTimeSlots = preferredTimeSlots.isEmpty()
        ? EnumSet.noneOf(TimeSlot.class) : EnumSet.copyOf(preferredTimeSlots);
    b.enabled = enabled;
    b.status = status;
    b.lastAlertAt = lastAlertAt;
    b.alertCount = alertCount;
    b.hospitalPhone = hospitalPhone;
    b.reservationUrl = reservationUrl;
    b.createdAt = createdAt;
    b.updatedAt = updatedAt;
    return b;
  }

  public WatchSubscription withStatus(WatcherStatus status, Instant at) {
    return toBuilder().status(status).updatedAt(at).build();
  }

  public WatchSubscription deactivated(Instant at) {
    return toBuilder().enabled(false).status(WatcherStatus.INACTIVE).updatedAt(at).build();
  }

  /**
   * The most recent sign of life: last alert, or last modification.
   */
  public Instant lastActivityAt() {
    if (lastAlertAt != null && lastAlertAt.isAfter(updatedAt)) {
      return lastAlertAt;
    }
    return updatedAt;
  }

  public String subscriptionId() {
    return subscriptionId;
  }

  public String userId() {
    return userId;
  }

  public String childId() {
    return childId;
  }

  public String hospitalName() {
    return hospitalName;
  }

  public String department() {
    return department;
  }

  public String doctorName() {
    return doctorName;
  }

  public SortedSet<LocalDate> preferredDates() {
    return preferredDates;
  }

  public Set<TimeSlot> preferredTimeSlots() {
    return preferredTimeSlots;
  }

  public boolean enabled() {
    return enabled;
  }

  public WatcherStatus status() {
    return status;
  }

  public Instant lastAlertAt() {
    return lastAlertAt;
  }

  public int alertCount() {
    return alertCount;
  }

  public String hospitalPhone() {
    return hospitalPhone;
  }

  public String reservationUrl() {
    return reservationUrl;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  @Override
  public String toString() {
    return "WatchSubscription{id=" + subscriptionId + ", userId=" + userId
        + ", hospital=" + hospitalName + ", department=" + department + ", doctor=" + doctorName
        + ", enabled=" + enabled + ", status=" + status + ", alertCount=" + alertCount + '}';
  }

  public static final class Builder {
    private String subscriptionId;
    private String userId;
    private String childId;
    private String hospitalName;
    private String department;
    private String doctorName;
    private SortedSet<LocalDate> preferredDates = new TreeSet<>();
    private Set<TimeSlot> preferredTimeSlots = EnumSet.noneOf(TimeSlot.class);
    private boolean enabled = true;
    private WatcherStatus status;
    private Instant lastAlertAt;
    private int alertCount;
    private String hospitalPhone;
    private String reservationUrl;
    private Instant createdAt;
    private Instant updatedAt;

    private Builder() {
    }

    public Builder subscriptionId(String subscriptionId) {
      this.subscriptionId = subscriptionId;
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder childId(String childId) {
      this.childId = childId;
      return this;
    }

    public Builder hospitalName(String hospitalName) {
      this.hospitalName = hospitalName;
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

    public Builder preferredDates(Collection<LocalDate> preferredDates) {
      this.preferredDates = preferredDates == null ? new TreeSet<>() : new TreeSet<>(preferredDates);
      return this;
    }

    public Builder preferredTimeSlots(Collection<TimeSlot> preferredTimeSlots) {
      this.preferredTimeSlots = preferredTimeSlots == null || preferredTimeSlots.isEmpty()
          ? EnumSet.noneOf(TimeSlot.class) : EnumSet.copyOf(preferredTimeSlots);
      return this;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder status(WatcherStatus status) {
      this.status = status;
      return this;
    }

    public Builder lastAlertAt(Instant lastAlertAt) {
      this.lastAlertAt = lastAlertAt;
      return this;
    }

    public Builder alertCount(int alertCount) {
      this.alertCount = alertCount;
      return this;
    }

    public Builder hospitalPhone(String hospitalPhone) {
      this.hospitalPhone = hospitalPhone;
      return this;
    }

    public Builder reservationUrl(String reservationUrl) {
      this.reservationUrl = reservationUrl;
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

    public WatchSubscription build() {
      return new WatchSubscription(this);
    }
  }
}
