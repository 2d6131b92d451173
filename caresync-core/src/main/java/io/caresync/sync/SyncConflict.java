package io.caresync.sync;

import io.caresync.model.ExternalEvent;
import io.caresync.model.Schedule;

import java.time.Instant;
import java.util.Objects;

/**
 * Report of a concurrent edit: the schedule and its external event both changed since
 * they were last reconciled. Produced once per resolution and never retried.
 *
 * @param userId          owner of the sync link
 * @param localVersion    the local schedule before resolution
 * @param externalVersion the external event that raced with it
 * @param winner          the side whose values were kept
 * @param resolvedAt      when the resolution happened
 */
public record SyncConflict(
    String userId,
    Schedule localVersion,
    ExternalEvent externalVersion,
    Side winner,
    Instant resolvedAt
) {
  public SyncConflict {
    Objects.requireNonNull(localVersion, "localVersion");
    Objects.requireNonNull(externalVersion, "externalVersion");
    Objects.requireNonNull(winner, "winner");
  }

  public String scheduleId() {
    return localVersion.scheduleId();
  }

  public enum Side {
    LOCAL,
    EXTERNAL
  }
}
