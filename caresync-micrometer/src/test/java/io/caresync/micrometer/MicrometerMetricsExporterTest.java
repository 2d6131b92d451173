package io.caresync.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void scheduleCounters() {
    exporter.incrementScheduleMutations();
    exporter.incrementScheduleMutations();
    exporter.incrementConflictsDetected();
    assertEquals(2.0, counter("caresync.schedule.mutations").count());
    assertEquals(1.0, counter("caresync.schedule.conflicts").count());
  }

  @Test
  void syncPassOutcomesAreTagged() {
    exporter.incrementSyncPassCompleted();
    exporter.incrementSyncPassCompleted();
    exporter.incrementSyncPassFailed();
    assertEquals(2.0, registry.get("caresync.sync.pass").tag("outcome", "completed").counter().count());
    assertEquals(1.0, registry.get("caresync.sync.pass").tag("outcome", "failed").counter().count());
  }

  @Test
  void syncEventDirectionsAreTagged() {
    exporter.incrementEventsPushed();
    exporter.incrementEventsPulled();
    exporter.incrementEventsPulled();
    exporter.incrementSyncConflicts();
    assertEquals(1.0, registry.get("caresync.sync.events").tag("direction", "push").counter().count());
    assertEquals(2.0, registry.get("caresync.sync.events").tag("direction", "pull").counter().count());
    assertEquals(1.0, counter("caresync.sync.conflicts").count());
  }

  @Test
  void alertResultsAreTagged() {
    exporter.incrementAlertsDelivered();
    exporter.incrementAlertsDeduplicated();
    exporter.incrementAlertsDeduplicated();
    exporter.incrementAlertsRateLimited();
    assertEquals(1.0, registry.get("caresync.alerts").tag("result", "delivered").counter().count());
    assertEquals(2.0, registry.get("caresync.alerts").tag("result", "deduplicated").counter().count());
    assertEquals(1.0, registry.get("caresync.alerts").tag("result", "rate_limited").counter().count());
  }

  @Test
  void activeWatchersGauge() {
    exporter.recordActiveWatchers(7);
    Gauge gauge = registry.find("caresync.watch.active").gauge();
    assertNotNull(gauge);
    assertEquals(7.0, gauge.value());
  }

  @Test
  void passDurationTimer() {
    exporter.recordSyncPassDurationMs(250);
    Timer timer = registry.find("caresync.sync.pass.duration").timer();
    assertNotNull(timer);
    assertEquals(1, timer.count());
    assertEquals(250.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry other = new SimpleMeterRegistry();
    MicrometerMetricsExporter prefixed = new MicrometerMetricsExporter(other, "clinic.care");
    prefixed.incrementWatcherPollFailures();
    assertEquals(1.0, other.find("clinic.care.watch.poll.failures").counter().count());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "care."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementAlertsDelivered();
    exporter.close();
    assertNull(registry.find("caresync.schedule.mutations").counter());
    assertNull(registry.find("caresync.watch.active").gauge());
    exporter.incrementAlertsDelivered();
    assertNull(registry.find("caresync.alerts").counter());
  }

  private Counter counter(String name) {
    Counter counter = registry.find(name).counter();
    assertNotNull(counter, "counter " + name);
    return counter;
  }
}
