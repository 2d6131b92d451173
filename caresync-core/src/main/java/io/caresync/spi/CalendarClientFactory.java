package io.caresync.spi;

import io.caresync.model.SyncLink;

/**
 * Creates the calendar client used for one sync link.
 */
@FunctionalInterface
public interface CalendarClientFactory {

    ExternalCalendarClient clientFor(SyncLink link);
}
