package io.caresync.watch;

import io.caresync.model.AlertEvent;
import io.caresync.model.SlotReport;
import io.caresync.model.WatchSubscription;
import io.caresync.spi.SlotSource;
import io.caresync.testing.InMemoryAlertDedupStore;
import io.caresync.testing.InMemoryWatchSubscriptionStore;
import io.caresync.testing.MutableClock;
import io.caresync.testing.RecordingMetrics;
import io.caresync.testing.StubConnections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CancellationWatcherTest {
  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final Instant SLOT = Instant.parse("2026-03-10T01:00:00Z");
  private static final String HOSPITAL = "Seoul Children's Hospital";

  private MutableClock clock;
  private InMemoryWatchSubscriptionStore subscriptions;
  private InMemoryAlertDedupStore dedup;
  private RecordingMetrics metrics;
  private List<AlertEvent> delivered;
  private WatchSubscription subscription;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    subscriptions = new InMemoryWatchSubscriptionStore();
    dedup = new InMemoryAlertDedupStore();
    metrics = new RecordingMetrics();
    delivered = new ArrayList<>();
    subscription = WatchSubscription.builder()
        .subscriptionId("sub-1")
        .userId("user-1")
        .childId("child-1")
        .hospitalName(HOSPITAL)
        .department("Rehabilitation")
        .hospitalPhone("02-123-4567")
        .createdAt(NOW)
        .build();
    subscriptions.insert(null, subscription);
  }

  private CancellationWatcher watcher(SlotSource source) {
    WatcherSupervisor.Settings settings = new WatcherSupervisor.Settings(
        StubConnections.provider(), subscriptions, dedup, delivered::add,
        new SlotMatcher(ZoneOffset.UTC), Duration.ofMinutes(10), 5, Duration.ofHours(1), metrics, clock);
    return new CancellationWatcher(subscription, source,
        new SlidingWindowRateLimiter(5, Duration.ofHours(1)), settings);
  }

  private static SlotReport slot(String slotId, Instant start) {
    return new SlotReport(slotId, HOSPITAL, "Rehabilitation", "Dr. Kim", start, start.plusSeconds(1800), NOW);
  }

  @Test
  void matchingSlotIsAlertedAndRecorded() {
    CancellationWatcher watcher = watcher(sub -> List.of());

    assertEquals(CancellationWatcher.Outcome.ALERTED, watcher.process(slot("slot-1", SLOT)));

    assertEquals(1, delivered.size());
    AlertEvent alert = delivered.get(0);
    assertEquals("sub-1", alert.subscriptionId());
    assertEquals("child-1", alert.childId());
    assertEquals(SLOT, alert.slotStart());
    assertEquals("02-123-4567", alert.hospitalPhone());
    assertEquals(NOW, alert.createdAt());
    assertEquals(1, subscriptions.get("sub-1").alertCount());
    assertEquals(NOW, subscriptions.get("sub-1").lastAlertAt());
    assertEquals(1, metrics.alertsDelivered.get());
  }

  @Test
  void nonMatchingSlotIsFiltered() {
    CancellationWatcher watcher = watcher(sub -> List.of());
    SlotReport otherDepartment = new SlotReport("slot-1", HOSPITAL, "Dentistry", null, SLOT, null, NOW);

    assertEquals(CancellationWatcher.Outcome.FILTERED, watcher.process(otherDepartment));
    assertTrue(delivered.isEmpty());
    assertEquals(0, dedup.size());
  }

  @Test
  void sameSlotWithinDedupWindowAlertsOnce() {
    CancellationWatcher watcher = watcher(sub -> List.of());

    watcher.process(slot("slot-1", SLOT));
    clock.advance(Duration.ofMinutes(9));

    assertEquals(CancellationWatcher.Outcome.DUPLICATE, watcher.process(slot("slot-1", SLOT)));
    assertEquals(1, delivered.size());
    assertEquals(1, metrics.alertsDeduplicated.get());
    assertEquals(1, subscriptions.get("sub-1").alertCount());
  }

  @Test
  void sameSlotAfterDedupWindowAlertsAgain() {
    CancellationWatcher watcher = watcher(sub -> List.of());

    watcher.process(slot("slot-1", SLOT));
    clock.advance(Duration.ofMinutes(11));

    assertEquals(CancellationWatcher.Outcome.ALERTED, watcher.process(slot("slot-1", SLOT)));
    assertEquals(2, delivered.size());
    assertEquals(2, subscriptions.get("sub-1").alertCount());
  }

  @Test
  void sixthDistinctSlotWithinAnHourIsRateLimited() {
    CancellationWatcher watcher = watcher(sub -> List.of());

    for (int i = 0; i < 5; i++) {
      clock.advance(Duration.ofMinutes(1));
      assertEquals(CancellationWatcher.Outcome.ALERTED,
          watcher.process(slot("slot-" + i, SLOT.plusSeconds(i * 3600L))));
    }
    clock.advance(Duration.ofMinutes(1));

    assertEquals(CancellationWatcher.Outcome.RATE_LIMITED, watcher.process(slot("slot-5", SLOT.plusSeconds(5 * 3600L))));
    assertEquals(5, delivered.size());
    assertEquals(1, metrics.alertsRateLimited.get());

    clock.advance(Duration.ofMinutes(60));
    assertEquals(CancellationWatcher.Outcome.ALERTED, watcher.process(slot("slot-5", SLOT.plusSeconds(5 * 3600L))));
  }

  @Test
  void rateLimitedSlotIsNotRememberedAsSeen() {
    CancellationWatcher watcher = watcher(sub -> List.of());
    for (int i = 0; i < 5; i++) {
      watcher.process(slot("slot-" + i, SLOT.plusSeconds(i * 3600L)));
    }

    watcher.process(slot("late", SLOT.plusSeconds(99 * 3600L)));

    assertEquals(5, dedup.size());
  }

  @Test
  void sinkFailureStillCountsAsAlerted() {
    WatcherSupervisor.Settings settings = new WatcherSupervisor.Settings(
        StubConnections.provider(), subscriptions, dedup,
        alert -> {
          throw new IllegalStateException("push service down");
        },
        new SlotMatcher(ZoneOffset.UTC), Duration.ofMinutes(10), 5, Duration.ofHours(1), metrics, clock);
    CancellationWatcher watcher = new CancellationWatcher(subscription, sub -> List.of(),
        new SlidingWindowRateLimiter(5, Duration.ofHours(1)), settings);

    assertEquals(CancellationWatcher.Outcome.ALERTED, watcher.process(slot("slot-1", SLOT)));
    assertEquals(CancellationWatcher.Outcome.DUPLICATE, watcher.process(slot("slot-1", SLOT)));
    assertEquals(0, metrics.alertsDelivered.get());
  }

  @Test
  void pollProcessesReportsInOrder() throws Exception {
    CancellationWatcher watcher = watcher(sub -> List.of(
        slot("a", SLOT),
        slot("b", SLOT.plusSeconds(3600)),
        slot("a", SLOT)));

    assertEquals(2, watcher.pollOnce());

    assertEquals(List.of("a", "b"), delivered.stream().map(AlertEvent::sourceSlotId).toList());
  }

  @Test
  void dedupKeyFallsBackWhenSlotHasNoId() {
    SlotReport anonymous = new SlotReport(null, HOSPITAL, null, null, SLOT, null, NOW);

    assertEquals("sub-1|" + SLOT.toEpochMilli() + "|-", AlertEvent.dedupKey("sub-1", anonymous));
  }
}
