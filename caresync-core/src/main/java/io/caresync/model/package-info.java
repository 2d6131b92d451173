/**
 * Domain model of the care-scheduling core.
 *
 * <p>{@link io.caresync.model.TimeInterval} is the leaf interval model; schedules,
 * sync links and watch subscriptions are immutable values persisted through the
 * {@linkplain io.caresync.spi stores}.
 */
package io.caresync.model;
