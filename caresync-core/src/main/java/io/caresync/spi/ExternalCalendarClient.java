package io.caresync.spi;

import io.caresync.model.ExternalEvent;
import io.caresync.model.ExternalEventRef;
import io.caresync.model.Schedule;
import io.caresync.sync.AccessToken;
import io.caresync.sync.SyncException;

import java.time.Instant;
import java.util.List;

/**
 * Client for one user's external calendar account.
 *
 * <p>Implementations throw {@link io.caresync.sync.SyncTransientException} for network
 * and timeout failures and {@link io.caresync.sync.SyncCredentialException} when the
 * provider rejects a token or refresh credential. Calls may block; the sync engine
 * runs them under a timeout and interrupts them when it expires.
 */
public interface ExternalCalendarClient {

    /**
     * Exchanges the stored refresh credential for a fresh access token.
     */
    AccessToken refreshAccessToken(String accountId, String refreshCredential) throws SyncException;

    /**
     * Lists events changed after {@code since} (all events when {@code since} is {@code null}),
     * deletions included, ordered by revision.
     */
    List<ExternalEvent> listChangesSince(AccessToken token, String calendarId, Instant since)
        throws SyncException;

    /**
     * Creates the event when {@link Schedule#externalEventId()} is {@code null}, otherwise
     * overwrites the referenced event. Implementations store the schedule id, child id and
     * category as private event properties.
     *
     * @return the event reference and the revision the provider assigned to this write
     */
    ExternalEventRef createOrUpdateEvent(AccessToken token, String calendarId, Schedule schedule)
        throws SyncException;

    /**
     * Deletes an event. Deleting an event that no longer exists succeeds.
     */
    void deleteEvent(AccessToken token, String calendarId, String eventRef) throws SyncException;
}
