package io.caresync.model;

public enum ConflictType {
  /** Both schedules cover exactly the same interval. */
  FULL_OVERLAP,
  /** One schedule lies entirely within the other. */
  CONTAINS,
  PARTIAL_OVERLAP,
  /** Two all-day schedules on the same date. */
  SAME_DAY
}
