package io.caresync.model;

/**
 * Per-schedule synchronization state against the external calendar.
 */
public enum SyncStatus {
  /** Never pushed. */
  UNSYNCED(0),
  /** Local change awaiting send. */
  PENDING_PUSH(1),
  /** Local and external agree as of the last merged revision. */
  SYNCED(2),
  /** External change detected, awaiting merge. */
  PENDING_PULL(3),
  /** Both sides changed since the last merged revision; the local version won and awaits re-push. */
  CONFLICTED(4),
  /** Push failed; retried by the next pass. */
  SYNC_FAILED(5);

  private final int code;

  SyncStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Whether the local copy carries changes the external calendar has not seen.
   */
  public boolean hasLocalChanges() {
    return this == UNSYNCED || this == PENDING_PUSH || this == CONFLICTED || this == SYNC_FAILED;
  }

  public static SyncStatus fromCode(int code) {
    for (SyncStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown sync status code: " + code);
  }
}
