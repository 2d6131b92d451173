package io.caresync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A candidate freed appointment slot, normalized from either a polled availability
 * query or a pushed webhook notification.
 *
 * @param sourceSlotId provider-reported slot identifier (may be {@code null} if the provider has none)
 * @param hospitalName hospital reporting the slot
 * @param department   department, or {@code null}
 * @param doctorName   doctor, or {@code null}
 * @param slotStart    start of the freed slot
 * @param slotEnd      end of the freed slot, or {@code null} if unknown
 * @param reportedAt   when the provider reported the slot
 */
public record SlotReport(
    String sourceSlotId,
    String hospitalName,
    String department,
    String doctorName,
    Instant slotStart,
    Instant slotEnd,
    Instant reportedAt
) {
  public SlotReport {
    Objects.requireNonNull(hospitalName, "hospitalName");
    Objects.requireNonNull(slotStart, "slotStart");
    if (reportedAt == null) {
      reportedAt = Instant.now();
    }
  }
}
