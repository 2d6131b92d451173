/**
 * Backoff policies used for remote calendar calls and watcher poll retries.
 */
package io.caresync.retry;
