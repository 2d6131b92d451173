package io.caresync.sync;

import io.caresync.model.ExternalEvent;
import io.caresync.model.Schedule;

/**
 * Decides which side of a concurrent edit wins.
 *
 * @see LastWriterWinsResolver
 */
@FunctionalInterface
public interface ConflictResolver {

  /**
   * @param local    the locally modified schedule
   * @param external the externally modified event
   * @return the side whose values are kept
   */
  SyncConflict.Side resolve(Schedule local, ExternalEvent external);
}
