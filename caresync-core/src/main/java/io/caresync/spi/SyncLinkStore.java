package io.caresync.spi;

import io.caresync.model.SyncLink;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for per-user sync links.
 */
public interface SyncLinkStore {

    Optional<SyncLink> find(Connection conn, String userId);

    /**
     * Inserts the link or replaces the user's existing one.
     */
    void save(Connection conn, SyncLink link);

    /**
     * @return the number of rows deleted (0 or 1)
     */
    int delete(Connection conn, String userId);

    /**
     * Returns links that are enabled and {@link io.caresync.model.LinkStatus#ACTIVE}.
     */
    List<SyncLink> listRunnable(Connection conn);
}
