/**
 * Care-scheduling core: conflict-aware schedule mutations, two-way calendar sync and
 * supervised cancellation watchers.
 *
 * <p>{@link io.caresync.CareScheduler} is the usual entry point.
 */
package io.caresync;
