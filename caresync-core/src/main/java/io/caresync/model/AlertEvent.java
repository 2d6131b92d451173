package io.caresync.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * Ephemeral notification that a slot matching a subscription was freed.
 *
 * <p>Owned by the watcher that produced it until handed to the alert sink; only its
 * {@linkplain #dedupKey() dedup key} outlives it, for the length of the dedup window.
 */
public record AlertEvent(
    String alertId,
    String subscriptionId,
    String userId,
    String childId,
    String hospitalName,
    String department,
    String doctorName,
    Instant slotStart,
    String sourceSlotId,
    String dedupKey,
    String hospitalPhone,
    String reservationUrl,
    Instant createdAt
) {
  public AlertEvent {
    Objects.requireNonNull(alertId, "alertId");
    Objects.requireNonNull(subscriptionId, "subscriptionId");
    Objects.requireNonNull(slotStart, "slotStart");
    Objects.requireNonNull(dedupKey, "dedupKey");
  }

  /**
   * Creates an alert for a report that matched a subscription.
   */
  public static AlertEvent of(WatchSubscription subscription, SlotReport report, Instant now) {
    return new AlertEvent(
        UlidCreator.getMonotonicUlid().toString(),
        subscription.subscriptionId(),
        subscription.userId(),
        subscription.childId(),
        report.hospitalName(),
        report.department(),
        report.doctorName(),
        report.slotStart(),
        report.sourceSlotId(),
        dedupKey(subscription.subscriptionId(), report),
        subscription.hospitalPhone(),
        subscription.reservationUrl(),
        now);
  }

  /**
   * Derives the key identifying a previously seen slot for a subscription.
   */
  public static String dedupKey(String subscriptionId, SlotReport report) {
    String slotId = report.sourceSlotId() == null ? "-" : report.sourceSlotId();
    return dedupKeyPrefix(subscriptionId) + report.slotStart().toEpochMilli() + '|' + slotId;
  }

  /** Common start of every dedup key of one subscription. */
  public static String dedupKeyPrefix(String subscriptionId) {
    return subscriptionId + '|';
  }
}
