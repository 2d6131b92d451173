package io.caresync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-user configuration and credential bundle for synchronizing with one external
 * calendar account.
 *
 * <p>Immutable; the {@code with*} methods return modified copies. A link is never
 * deleted on credential failure: it moves to {@link LinkStatus#SYNC_FAILED} and
 * stays there until {@link #reauthorized(String, Instant)}.
 */
public final class SyncLink {
  private final String userId;
  private final String accountId;
  private final String refreshCredential;
  private final String calendarId;
  private final SyncDirection direction;
  private final boolean enabled;
  private final LinkStatus status;
  private final Instant watermark;
  private final Instant lastSyncedAt;
  private final String lastError;
  private final String defaultChildId;
  private final Instant updatedAt;

  private SyncLink(Builder b) {
    this.userId = Objects.requireNonNull(b.userId, "userId");
    this.accountId = Objects.requireNonNull(b.accountId, "accountId");
    this.refreshCredential = b.refreshCredential;
    this.calendarId = b.calendarId == null ? "primary" : b.calendarId;
    this.direction = b.direction == null ? SyncDirection.BIDIRECTIONAL : b.direction;
    this.enabled = b.enabled;
    this.status = b.status == null ? LinkStatus.ACTIVE : b.status;
    this.watermark = b.watermark;
    this.lastSyncedAt = b.lastSyncedAt;
    this.lastError = b.lastError;
    this.defaultChildId = b.defaultChildId;
    this.updatedAt = b.updatedAt == null ? Instant.now() : b.updatedAt;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.userId = userId;
    b.accountId = accountId;
    b.refreshCredential = refreshCredential;
    b.calendarId = calendarId;
    b.direction = direction;
    b.enabled = enabled;
    b.status = status;
    b.watermark = watermark;
    b.lastSyncedAt = lastSyncedAt;
    b.lastError = lastError;
    b.defaultChildId = defaultChildId;
    b.updatedAt = updatedAt;
    return b;
  }

  /**
   * Whether reconciliation passes may run for this link.
   */
  public boolean runnable() {
    return enabled && status == LinkStatus.ACTIVE;
  }

  public SyncLink withWatermark(Instant watermark, Instant syncedAt) {
    return toBuilder().watermark(watermark).lastSyncedAt(syncedAt).lastError(null).updatedAt(syncedAt).build();
  }

  public SyncLink credentialFailed(String error, Instant at) {
    return toBuilder().status(LinkStatus.SYNC_FAILED).lastError(error).updatedAt(at).build();
  }

  public SyncLink reauthorized(String refreshCredential, Instant at) {
    return toBuilder().refreshCredential(refreshCredential).status(LinkStatus.ACTIVE)
        .lastError(null).updatedAt(at).build();
  }

  public String userId() {
    return userId;
  }

  public String accountId() {
    return accountId;
  }

  public String refreshCredential() {
    return refreshCredential;
  }

  public String calendarId() {
    return calendarId;
  }

  public SyncDirection direction() {
    return direction;
  }

  public boolean enabled() {
    return enabled;
  }

  public LinkStatus status() {
    return status;
  }

  /**
   * Last external revision reconciled by a completed pass, or {@code null} before the first pass.
   */
  public Instant watermark() {
    return watermark;
  }

  public Instant lastSyncedAt() {
    return lastSyncedAt;
  }

  public String lastError() {
    return lastError;
  }

  /**
   * Child that receives events created directly in the external calendar.
   */
  public String defaultChildId() {
    return defaultChildId;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  @Override
  public String toString() {
    return "SyncLink{userId=" + userId + ", accountId=" + accountId + ", calendarId=" + calendarId
        + ", direction=" + direction + ", enabled=" + enabled + ", status=" + status
        + ", watermark=" + watermark + '}';
  }

  public static final class Builder {
    private String userId;
    private String accountId;
    private String refreshCredential;
    private String calendarId;
    private SyncDirection direction;
    private boolean enabled = true;
    private LinkStatus status;
    private Instant watermark;
    private Instant lastSyncedAt;
    private String lastError;
    private String defaultChildId;
    private Instant updatedAt;

    private Builder() {
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder accountId(String accountId) {
      this.accountId = accountId;
      return this;
    }

    public Builder refreshCredential(String refreshCredential) {
      this.refreshCredential = refreshCredential;
      return this;
    }

    public Builder calendarId(String calendarId) {
      this.calendarId = calendarId;
      return this;
    }

    public Builder direction(SyncDirection direction) {
      this.direction = direction;
      return this;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder status(LinkStatus status) {
      this.status = status;
      return this;
    }

    public Builder watermark(Instant watermark) {
      this.watermark = watermark;
      return this;
    }

    public Builder lastSyncedAt(Instant lastSyncedAt) {
      this.lastSyncedAt = lastSyncedAt;
      return this;
    }

    public Builder lastError(String lastError) {
      this.lastError = lastError;
      return this;
    }

    public Builder defaultChildId(String defaultChildId) {
      this.defaultChildId = defaultChildId;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public SyncLink build() {
      return new SyncLink(this);
    }
  }
}
