package io.caresync.model;

public enum SyncDirection {
  OUTBOUND_ONLY,
  INBOUND_ONLY,
  BIDIRECTIONAL;

  public boolean pulls() {
    return this != OUTBOUND_ONLY;
  }

  public boolean pushes() {
    return this != INBOUND_ONLY;
  }
}
