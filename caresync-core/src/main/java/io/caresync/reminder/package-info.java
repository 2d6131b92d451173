/**
 * Reminder planning: turns a schedule's reminder offsets into concrete reminders with a
 * category checklist.
 */
package io.caresync.reminder;
