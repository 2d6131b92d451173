package io.caresync.watch;

import io.caresync.model.SlotReport;
import io.caresync.model.TimeSlot;
import io.caresync.model.WatchSubscription;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides whether a reported slot is relevant to a subscription.
 *
 * <p>The hospital must match; department and doctor must match when the subscription
 * names them. Preferred dates and time slots, when present, are evaluated in the
 * configured zone. Slots that already started are never relevant.
 */
public final class SlotMatcher {
  private final ZoneId zone;

  public SlotMatcher(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public boolean matches(WatchSubscription subscription, SlotReport report, Instant now) {
    if (!report.slotStart().isAfter(now)) {
      return false;
    }
    if (!sameName(subscription.hospitalName(), report.hospitalName())) {
      return false;
    }
    if (subscription.department() != null && !sameName(subscription.department(), report.department())) {
      return false;
    }
    if (subscription.doctorName() != null && !sameName(subscription.doctorName(), report.doctorName())) {
      return false;
    }
    ZonedDateTime local = report.slotStart().atZone(zone);
    if (!subscription.preferredDates().isEmpty()
        && !subscription.preferredDates().contains(local.toLocalDate())) {
      return false;
    }
    return subscription.preferredTimeSlots().isEmpty()
        || subscription.preferredTimeSlots().contains(TimeSlot.of(local.toLocalTime()));
  }

  public ZoneId zone() {
    return zone;
  }

  private static boolean sameName(String expected, String actual) {
    return actual != null && normalize(expected).equals(normalize(actual));
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
