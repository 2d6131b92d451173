package io.caresync.spi;

import io.caresync.sync.SyncConflict;

/**
 * Receives each resolved concurrent edit exactly once, with both versions and the winner.
 */
@FunctionalInterface
public interface SyncConflictListener {

    SyncConflictListener NOOP = conflict -> {
    };

    void onConflict(SyncConflict conflict);
}
