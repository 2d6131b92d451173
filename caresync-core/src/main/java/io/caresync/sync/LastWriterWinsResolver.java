package io.caresync.sync;

import io.caresync.model.ExternalEvent;
import io.caresync.model.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Picks the side modified later, comparing the local {@code updatedAt} with the external
 * revision after truncating both to a common granularity.
 *
 * <p>External calendars often report modification times at second or coarser resolution,
 * so comparing raw instants would favour whichever side has the finer clock. Truncated
 * ties go to the configured side.
 */
public final class LastWriterWinsResolver implements ConflictResolver {
  private final long granularityMs;
  private final SyncConflict.Side tieBreaker;

  /**
   * Second granularity, ties to the local side.
   */
  public LastWriterWinsResolver() {
    this(Duration.ofSeconds(1), SyncConflict.Side.LOCAL);
  }

  public LastWriterWinsResolver(Duration granularity, SyncConflict.Side tieBreaker) {
    Objects.requireNonNull(granularity, "granularity");
    if (granularity.toMillis() <= 0) {
      throw new IllegalArgumentException("granularity must be >= 1ms, got: " + granularity);
    }
    this.granularityMs = granularity.toMillis();
    this.tieBreaker = Objects.requireNonNull(tieBreaker, "tieBreaker");
  }

  @Override
  public SyncConflict.Side resolve(Schedule local, ExternalEvent external) {
    long localTick = truncate(local.updatedAt());
    long externalTick = truncate(external.revision());
    if (localTick == externalTick) {
      return tieBreaker;
    }
    return localTick > externalTick ? SyncConflict.Side.LOCAL : SyncConflict.Side.EXTERNAL;
  }

  private long truncate(Instant instant) {
    return Math.floorDiv(instant.toEpochMilli(), granularityMs);
  }
}
