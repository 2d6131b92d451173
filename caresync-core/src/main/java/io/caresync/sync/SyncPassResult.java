package io.caresync.sync;

import java.util.List;
import java.util.Objects;

/**
 * Summary of one reconciliation pass for a user.
 *
 * @param userId    the link owner
 * @param outcome   how the pass ended
 * @param pulled    inbound events that changed a local schedule
 * @param pushed    local changes written to the external calendar
 * @param conflicts concurrent edits resolved during the pass
 * @param error     failure description for {@code FAILED} and {@code SUSPENDED}, else {@code null}
 */
public record SyncPassResult(
    String userId,
    Outcome outcome,
    int pulled,
    int pushed,
    List<SyncConflict> conflicts,
    String error
) {
  public SyncPassResult {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(outcome, "outcome");
    conflicts = List.copyOf(conflicts);
  }

  static SyncPassResult skipped(String userId, String reason) {
    return new SyncPassResult(userId, Outcome.SKIPPED, 0, 0, List.of(), reason);
  }

  public enum Outcome {
    /** Both directions succeeded and the watermark was persisted. */
    COMPLETED,
    /** No link, link disabled, or nothing to do. */
    SKIPPED,
    /** The link is in {@code SYNC_FAILED} and waits for re-authorization. */
    SUSPENDED,
    /** A transient failure ended the pass early; the watermark is unchanged. */
    FAILED
  }
}
