/**
 * Conflict detection among one child's schedules.
 */
package io.caresync.conflict;
