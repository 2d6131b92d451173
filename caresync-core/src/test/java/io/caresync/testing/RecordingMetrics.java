package io.caresync.testing;

import io.caresync.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts every metrics call.
 */
public class RecordingMetrics implements MetricsExporter {
  public final AtomicInteger scheduleMutations = new AtomicInteger();
  public final AtomicInteger conflictsDetected = new AtomicInteger();
  public final AtomicInteger passCompleted = new AtomicInteger();
  public final AtomicInteger passFailed = new AtomicInteger();
  public final AtomicInteger eventsPushed = new AtomicInteger();
  public final AtomicInteger eventsPulled = new AtomicInteger();
  public final AtomicInteger syncConflicts = new AtomicInteger();
  public final AtomicInteger alertsDelivered = new AtomicInteger();
  public final AtomicInteger alertsDeduplicated = new AtomicInteger();
  public final AtomicInteger alertsRateLimited = new AtomicInteger();
  public final AtomicInteger pollFailures = new AtomicInteger();
  public final AtomicInteger activeWatchers = new AtomicInteger();

  @Override
  public void incrementScheduleMutations() {
    scheduleMutations.incrementAndGet();
  }

  @Override
  public void incrementConflictsDetected() {
    conflictsDetected.incrementAndGet();
  }

  @Override
  public void incrementSyncPassCompleted() {
    passCompleted.incrementAndGet();
  }

  @Override
  public void incrementSyncPassFailed() {
    passFailed.incrementAndGet();
  }

  @Override
  public void incrementEventsPushed() {
    eventsPushed.incrementAndGet();
  }

  @Override
  public void incrementEventsPulled() {
    eventsPulled.incrementAndGet();
  }

  @Override
  public void incrementSyncConflicts() {
    syncConflicts.incrementAndGet();
  }

  @Override
  public void incrementAlertsDelivered() {
    alertsDelivered.incrementAndGet();
  }

  @Override
  public void incrementAlertsDeduplicated() {
    alertsDeduplicated.incrementAndGet();
  }

  @Override
  public void incrementAlertsRateLimited() {
    alertsRateLimited.incrementAndGet();
  }

  @Override
  public void incrementWatcherPollFailures() {
    pollFailures.incrementAndGet();
  }

  @Override
  public void recordActiveWatchers(int count) {
    activeWatchers.set(count);
  }
}
