package io.caresync.schedule;

import io.caresync.model.Schedule;

/**
 * Notified after a local mutation commits that left the schedule waiting to be pushed.
 * Runs on the caller's thread and must not block.
 */
@FunctionalInterface
public interface ScheduleChangeListener {

  ScheduleChangeListener NOOP = schedule -> {
  };

  void onPendingPush(Schedule schedule);
}
