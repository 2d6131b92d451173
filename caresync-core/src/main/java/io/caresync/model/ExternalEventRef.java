package io.caresync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of a successful push: the external event identifier and the revision the
 * external calendar assigned to the write.
 */
public record ExternalEventRef(String eventRef, Instant revision) {
  public ExternalEventRef {
    Objects.requireNonNull(eventRef, "eventRef");
    Objects.requireNonNull(revision, "revision");
  }
}
