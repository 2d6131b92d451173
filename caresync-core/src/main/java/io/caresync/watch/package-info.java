/**
 * Cancellation watchers and their supervisor.
 */
package io.caresync.watch;
