package io.caresync.model;

/**
 * Health of a {@link SyncLink}.
 */
public enum LinkStatus {
  ACTIVE,
  /** Credential rejected; passes are suspended until the user re-authorizes. */
  SYNC_FAILED
}
