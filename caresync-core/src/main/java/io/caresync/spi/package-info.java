/**
 * Service Provider Interfaces the care-scheduling core depends on.
 *
 * <p>Integrators implement these to plug in persistence, connection provisioning,
 * the external calendar, hospital booking sources, alert delivery and metrics.
 *
 * @see io.caresync.spi.ScheduleStore
 * @see io.caresync.spi.ExternalCalendarClient
 * @see io.caresync.spi.SlotSource
 * @see io.caresync.spi.AlertSink
 */
package io.caresync.spi;
