/**
 * Schedule mutations with conflict recomputation and sync tagging.
 *
 * @see io.caresync.schedule.ScheduleService
 */
package io.caresync.schedule;
