/**
 * Concurrency helpers shared by the sync engine and the watcher supervisor.
 */
package io.caresync.util;
