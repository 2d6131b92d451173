package io.caresync.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.caresync.CareScheduler;
import io.caresync.jdbc.dialect.Dialects;
import io.caresync.model.AlertEvent;
import io.caresync.model.ExternalEvent;
import io.caresync.model.ExternalEventRef;
import io.caresync.model.Schedule;
import io.caresync.model.ScheduleCategory;
import io.caresync.model.SlotReport;
import io.caresync.model.SyncLink;
import io.caresync.model.SyncStatus;
import io.caresync.model.WatchSubscription;
import io.caresync.schedule.MutationResult;
import io.caresync.schedule.ScheduleListing;
import io.caresync.spi.ExternalCalendarClient;
import io.caresync.sync.AccessToken;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private static final String USER = "user-1";
  private static final Instant START = Instant.now().plus(Duration.ofDays(7)).truncatedTo(ChronoUnit.HOURS);

  private HikariDataSource hikariDs;
  private CareScheduler.Builder builder;

  @BeforeEach
  void setup() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("caresync-test-pool");
    hikariDs = new HikariDataSource(config);
    JdbcCareStores.createSchema(hikariDs, Dialects.get("h2"));

    builder = CareScheduler.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .stores(JdbcCareStores.detect(hikariDs))
        .zone(ZoneOffset.UTC);
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void conflictsArePersistedThroughPool() {
    try (CareScheduler scheduler = builder.build()) {
      scheduler.schedules().createSchedule(schedule("s1", START, 60));
      MutationResult second = scheduler.schedules().createSchedule(schedule("s2", START.plus(Duration.ofMinutes(30)), 60));

      assertTrue(second.hasConflicts());
      assertTrue(scheduler.schedules().findSchedule("s1").orElseThrow().hasConflict());

      ScheduleListing listing = scheduler.schedules()
          .listSchedules("child-1", START.minus(Duration.ofDays(1)), START.plus(Duration.ofDays(1)));
      assertEquals(2, listing.items().size());
      assertEquals(1, listing.conflicts().size());

      scheduler.schedules().deleteSchedule("s2");
      assertFalse(scheduler.schedules().findSchedule("s1").orElseThrow().hasConflict());
    }
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void localScheduleIsPushedThroughPool() throws Exception {
    RecordingCalendar calendar = new RecordingCalendar();

    try (CareScheduler scheduler = builder
        .calendarClientFactory(link -> calendar)
        .syncIntervalMs(0)
        .build()) {
      scheduler.sync().saveLink(SyncLink.builder()
          .userId(USER)
          .accountId("acc")
          .refreshCredential("refresh-1")
          .build());
      scheduler.schedules().createSchedule(schedule("s1", START, 60));

      await(() -> scheduler.schedules().findSchedule("s1").orElseThrow().syncStatus() == SyncStatus.SYNCED);
      Schedule synced = scheduler.schedules().findSchedule("s1").orElseThrow();
      assertNotNull(synced.externalEventId());
      assertEquals(1, calendar.size());
      await(() -> scheduler.sync().findLink(USER).orElseThrow().lastSyncedAt() != null);
    }
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void duplicateReportsAlertOnce() throws Exception {
    List<AlertEvent> alerts = new CopyOnWriteArrayList<>();

    try (CareScheduler scheduler = builder
        .slotSourceFactory(sub -> s -> List.of())
        .alertSink(alerts::add)
        .housekeepingIntervalMs(0)
        .build()) {
      scheduler.watchers().subscribe(WatchSubscription.builder()
          .subscriptionId("sub-1")
          .userId(USER)
          .childId("child-1")
          .hospitalName("Seoul Children's Hospital")
          .build());

      SlotReport report = new SlotReport("slot-1", "Seoul Children's Hospital", null, null,
          START, START.plus(Duration.ofMinutes(30)), Instant.now());
      assertEquals(1, scheduler.watchers().onSlotReport(report));
      await(() -> alerts.size() == 1);

      assertEquals(1, scheduler.watchers().onSlotReport(report));
      Thread.sleep(200);
      assertEquals(1, alerts.size());
    }
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  private static Schedule schedule(String id, Instant start, int minutes) {
    return Schedule.builder()
        .scheduleId(id)
        .userId(USER)
        .childId("child-1")
        .title(id)
        .category(ScheduleCategory.HOSPITAL)
        .start(start)
        .end(start.plus(Duration.ofMinutes(minutes)))
        .build();
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5_000;
    while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertTrue(condition.getAsBoolean(), "condition not met within 5s");
  }

  /** Calendar account kept in memory with strictly increasing revisions. */
  private static final class RecordingCalendar implements ExternalCalendarClient {
    private final Map<String, ExternalEvent> events = new LinkedHashMap<>();
    private Instant lastRevision = Instant.EPOCH;
    private int nextEvent = 1;

    @Override
    public AccessToken refreshAccessToken(String accountId, String refreshCredential) {
      return new AccessToken("token", Instant.now().plus(Duration.ofHours(1)));
    }

    @Override
    public synchronized List<ExternalEvent> listChangesSince(AccessToken token, String calendarId, Instant since) {
      List<ExternalEvent> changed = new ArrayList<>();
      for (ExternalEvent e : events.values()) {
        if (since == null || e.revision().isAfter(since)) {
          changed.add(e);
        }
      }
      return changed;
    }

    @Override
    public synchronized ExternalEventRef createOrUpdateEvent(AccessToken token, String calendarId, Schedule schedule) {
      String ref = schedule.externalEventId() != null ? schedule.externalEventId() : "evt-" + nextEvent++;
      Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
      lastRevision = now.isAfter(lastRevision) ? now : lastRevision.plusMillis(1);
      events.put(ref, new ExternalEvent(ref, lastRevision, false, schedule.scheduleId(), schedule.childId(),
          schedule.category(), schedule.title(), schedule.start(), schedule.end(), schedule.allDay(),
          schedule.locationName(), schedule.notes()));
      return new ExternalEventRef(ref, lastRevision);
    }

    @Override
    public synchronized void deleteEvent(AccessToken token, String calendarId, String eventRef) {
      events.remove(eventRef);
    }

    synchronized int size() {
      return events.size();
    }
  }
}
