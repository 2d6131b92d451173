/**
 * Two-way synchronization of schedules with an external calendar.
 *
 * <p>{@link io.caresync.sync.SyncStateMachine} holds the per-schedule transition rules,
 * {@link io.caresync.sync.SyncEngine} runs the per-user reconciliation passes.
 */
package io.caresync.sync;
