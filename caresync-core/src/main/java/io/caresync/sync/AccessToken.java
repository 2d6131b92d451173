package io.caresync.sync;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Short-lived bearer credential obtained from a refresh credential.
 */
public record AccessToken(String value, Instant expiresAt) {
  private static final Duration EXPIRY_SKEW = Duration.ofSeconds(30);

  public AccessToken {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  /**
   * Whether the token expires within a small skew of {@code now}.
   */
  public boolean isExpired(Instant now) {
    return !now.plus(EXPIRY_SKEW).isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "AccessToken{expiresAt=" + expiresAt + '}';
  }
}
