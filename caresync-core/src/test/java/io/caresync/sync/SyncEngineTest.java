package io.caresync.sync;

import io.caresync.model.ExternalEvent;
import io.caresync.model.LinkStatus;
import io.caresync.model.Schedule;
import io.caresync.model.SyncDirection;
import io.caresync.model.SyncLink;
import io.caresync.model.SyncStatus;
import io.caresync.schedule.ScheduleService;
import io.caresync.testing.FakeCalendar;
import io.caresync.testing.InMemoryScheduleStore;
import io.caresync.testing.InMemorySyncLinkStore;
import io.caresync.testing.MutableClock;
import io.caresync.testing.RecordingMetrics;
import io.caresync.testing.Schedules;
import io.caresync.testing.StubConnections;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SyncEngineTest {
  private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");
  private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");
  private static final String USER = Schedules.USER;

  private MutableClock clock;
  private InMemoryScheduleStore scheduleStore;
  private InMemorySyncLinkStore linkStore;
  private RecordingMetrics metrics;
  private FakeCalendar calendar;
  private List<SyncConflict> conflicts;
  private ScheduleService service;
  private SyncEngine engine;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    scheduleStore = new InMemoryScheduleStore();
    linkStore = new InMemorySyncLinkStore();
    metrics = new RecordingMetrics();
    calendar = new FakeCalendar(clock);
    conflicts = new CopyOnWriteArrayList<>();
    SyncStateMachine stateMachine = new SyncStateMachine(new LastWriterWinsResolver(), clock);
    service = ScheduleService.builder()
        .connectionProvider(StubConnections.provider())
        .scheduleStore(scheduleStore)
        .syncLinkStore(linkStore)
        .stateMachine(stateMachine)
        .clock(clock)
        .build();
    engine = SyncEngine.builder()
        .connectionProvider(StubConnections.provider())
        .syncLinkStore(linkStore)
        .scheduleStore(scheduleStore)
        .scheduleService(service)
        .clientFactory(link -> calendar)
        .stateMachine(stateMachine)
        .conflictListener(conflicts::add)
        .metrics(metrics)
        .retryPolicy(attempts -> 0L)
        .clock(clock)
        .intervalMs(0)
        .maxAttempts(3)
        .callTimeoutMs(2_000)
        .build();
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  private SyncLink link(SyncDirection direction) {
    return SyncLink.builder()
        .userId(USER)
        .accountId("acc")
        .refreshCredential("refresh-1")
        .direction(direction)
        .defaultChildId("child-1")
        .build();
  }

  private Schedule createAndSync(String scheduleId) {
    service.createSchedule(Schedules.timed(scheduleId, "child-1", T0, 60).build());
    assertEquals(SyncPassResult.Outcome.COMPLETED, engine.runPass(USER).outcome());
    return scheduleStore.get(scheduleId);
  }

  @Test
  void builderValidatesSettings() {
    assertThrows(IllegalArgumentException.class, () -> SyncEngine.builder()
        .connectionProvider(StubConnections.provider())
        .syncLinkStore(linkStore)
        .scheduleStore(scheduleStore)
        .scheduleService(service)
        .clientFactory(link -> calendar)
        .workerCount(0)
        .build());
    assertThrows(NullPointerException.class, () -> SyncEngine.builder()
        .connectionProvider(StubConnections.provider())
        .syncLinkStore(linkStore)
        .scheduleStore(scheduleStore)
        .scheduleService(service)
        .build());
  }

  @Test
  void passWithoutLinkIsSkipped() {
    SyncPassResult result = engine.runPass(USER);

    assertEquals(SyncPassResult.Outcome.SKIPPED, result.outcome());
    assertEquals(0, calendar.listings.get());
  }

  @Test
  void disabledLinkIsSkipped() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL).toBuilder().enabled(false).build());

    assertEquals(SyncPassResult.Outcome.SKIPPED, engine.runPass(USER).outcome());
  }

  @Test
  void pendingScheduleIsPushedAndMarkedSynced() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    service.createSchedule(Schedules.timed("s1", "child-1", T0, 60).title("Pediatrics").build());

    SyncPassResult result = engine.runPass(USER);

    assertEquals(SyncPassResult.Outcome.COMPLETED, result.outcome());
    assertEquals(1, result.pushed());
    Schedule synced = scheduleStore.get("s1");
    assertEquals(SyncStatus.SYNCED, synced.syncStatus());
    assertEquals("evt-1", synced.externalEventId());
    assertEquals(NOW, synced.lastSyncedAt());
    ExternalEvent event = calendar.event("evt-1");
    assertEquals("Pediatrics", event.title());
    assertEquals("s1", event.scheduleId());
    assertEquals(synced.externalRevision(), event.revision());
    assertEquals(1, metrics.passCompleted.get());
    assertEquals(1, metrics.eventsPushed.get());
  }

  @Test
  void echoOfPushedEventIsNotReapplied() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    Schedule synced = createAndSync("s1");
    int writes = scheduleStore.writes.get();

    SyncPassResult second = engine.runPass(USER);

    assertEquals(0, second.pulled());
    assertEquals(0, second.pushed());
    assertEquals(writes, scheduleStore.writes.get());
    assertEquals(synced.externalRevision(), linkStore.get(USER).watermark());
  }

  @Test
  void externalEditIsPulled() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    Schedule synced = createAndSync("s1");
    clock.advance(Duration.ofMinutes(5));
    ExternalEvent edit = calendar.editTitle(synced.externalEventId(), "Rescheduled by clinic");

    SyncPassResult result = engine.runPass(USER);

    assertEquals(1, result.pulled());
    Schedule updated = scheduleStore.get("s1");
    assertEquals("Rescheduled by clinic", updated.title());
    assertEquals(edit.revision(), updated.externalRevision());
    assertEquals(SyncStatus.SYNCED, updated.syncStatus());
    assertEquals(edit.revision(), linkStore.get(USER).watermark());
  }

  @Test
  void externalEventCreatesScheduleForDefaultChild() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    ExternalEvent created = calendar.createExternally("Vaccination", T0, T0.plusSeconds(1800));

    SyncPassResult result = engine.runPass(USER);

    assertEquals(1, result.pulled());
    Schedule imported = scheduleStore.findByExternalEventId(null, USER, created.eventRef()).orElseThrow();
    assertEquals("child-1", imported.childId());
    assertEquals("Vaccination", imported.title());
    assertEquals(SyncStatus.SYNCED, imported.syncStatus());
    assertEquals(0, result.pushed());
  }

  @Test
  void pulledEventRecomputesConflicts() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    createAndSync("s1");
    calendar.createExternally("Overlapping", T0.plusSeconds(600), T0.plusSeconds(2400));

    engine.runPass(USER);

    assertTrue(scheduleStore.get("s1").hasConflict());
  }

  @Test
  void externalDeletionSoftDeletes() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    Schedule synced = createAndSync("s1");
    clock.advance(Duration.ofMinutes(1));
    calendar.deleteExternally(synced.externalEventId());

    engine.runPass(USER);

    assertTrue(scheduleStore.get("s1").deleted());
    assertEquals(0, calendar.deletes.get());
  }

  @Test
  void concurrentEditResolvedForLaterLocalChange() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    Schedule synced = createAndSync("s1");
    clock.advance(Duration.ofMinutes(1));
    calendar.editTitle(synced.externalEventId(), "External title");
    clock.advance(Duration.ofMinutes(1));
    service.updateSchedule(scheduleStore.get("s1").toBuilder().title("Local title").build());

    SyncPassResult result = engine.runPass(USER);

    assertEquals(SyncPassResult.Outcome.COMPLETED, result.outcome());
    assertEquals(1, result.conflicts().size());
    assertEquals(SyncConflict.Side.LOCAL, result.conflicts().get(0).winner());
    assertEquals(result.conflicts(), conflicts);
    assertEquals(1, metrics.syncConflicts.get());
    assertEquals("Local title", calendar.event(synced.externalEventId()).title());
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
  }

  @Test
  void concurrentEditResolvedForLaterExternalChange() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    Schedule synced = createAndSync("s1");
    clock.advance(Duration.ofMinutes(1));
    service.updateSchedule(scheduleStore.get("s1").toBuilder().title("Local title").build());
    clock.advance(Duration.ofMinutes(1));
    calendar.editTitle(synced.externalEventId(), "External title");

    SyncPassResult result = engine.runPass(USER);

    assertEquals(SyncConflict.Side.EXTERNAL, result.conflicts().get(0).winner());
    assertEquals("External title", scheduleStore.get("s1").title());
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
    assertEquals(0, result.pushed());
  }

  @Test
  void transientFailuresAreRetriedWithinAPass() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    calendar.failNext("createOrUpdateEvent", new SyncTransientException("503"), 2);
    service.createSchedule(Schedules.timed("s1", "child-1", T0, 60).build());

    SyncPassResult result = engine.runPass(USER);

    assertEquals(SyncPassResult.Outcome.COMPLETED, result.outcome());
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
    assertEquals(1, calendar.writes.get());
  }

  @Test
  void exhaustedPushMarksScheduleAndRecoversNextPass() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    calendar.failNext("createOrUpdateEvent", new SyncTransientException("503"), 3);
    service.createSchedule(Schedules.timed("s1", "child-1", T0, 60).build());

    SyncPassResult failed = engine.runPass(USER);

    assertEquals(SyncPassResult.Outcome.FAILED, failed.outcome());
    assertEquals("503", failed.error());
    assertEquals(SyncStatus.SYNC_FAILED, scheduleStore.get("s1").syncStatus());
    assertEquals(1, metrics.passFailed.get());
    assertEquals(LinkStatus.ACTIVE, linkStore.get(USER).status());

    SyncPassResult retried = engine.runPass(USER);

    assertEquals(SyncPassResult.Outcome.COMPLETED, retried.outcome());
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
  }

  @Test
  void failedPullLeavesWatermarkUntouched() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    createAndSync("s1");
    engine.runPass(USER);
    Instant watermark = linkStore.get(USER).watermark();
    clock.advance(Duration.ofMinutes(1));
    calendar.createExternally("New", T0.plus(Duration.ofDays(1)), T0.plus(Duration.ofDays(1)).plusSeconds(60));
    calendar.failNext("listChangesSince", new SyncTransientException("timeout"), 3);

    assertEquals(SyncPassResult.Outcome.FAILED, engine.runPass(USER).outcome());
    assertEquals(watermark, linkStore.get(USER).watermark());
  }

  @Test
  void rejectedTokenIsRefreshedOnce() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    createAndSync("s1");
    calendar.expireIssuedTokens();

    SyncPassResult result = engine.runPass(USER);

    assertEquals(SyncPassResult.Outcome.COMPLETED, result.outcome());
    assertEquals(2, calendar.refreshes.get());
  }

  @Test
  void revokedCredentialSuspendsUntilReauthorized() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    calendar.revoke("refresh-1");
    service.createSchedule(Schedules.timed("s1", "child-1", T0, 60).build());

    SyncPassResult suspended = engine.runPass(USER);

    assertEquals(SyncPassResult.Outcome.SUSPENDED, suspended.outcome());
    SyncLink link = linkStore.get(USER);
    assertEquals(LinkStatus.SYNC_FAILED, link.status());
    assertEquals("refresh credential revoked", link.lastError());
    assertEquals(SyncStatus.PENDING_PUSH, scheduleStore.get("s1").syncStatus());

    assertEquals(SyncPassResult.Outcome.SUSPENDED, engine.runPass(USER).outcome());
    assertEquals(1, calendar.refreshes.get());

    engine.reauthorize(USER, "refresh-2");

    assertEquals(LinkStatus.ACTIVE, linkStore.get(USER).status());
    assertEquals(SyncPassResult.Outcome.COMPLETED, engine.runPass(USER).outcome());
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
  }

  @Test
  void missingRefreshCredentialSuspends() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL).toBuilder().refreshCredential(null).build());

    assertEquals(SyncPassResult.Outcome.SUSPENDED, engine.runPass(USER).outcome());
    assertEquals(0, calendar.refreshes.get());
  }

  @Test
  void reauthorizeWithoutLinkFails() {
    assertThrows(IllegalArgumentException.class, () -> engine.reauthorize(USER, "refresh-2"));
  }

  @Test
  void localDeletionIsPushed() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    Schedule synced = createAndSync("s1");
    service.deleteSchedule("s1");

    SyncPassResult result = engine.runPass(USER);

    assertEquals(1, result.pushed());
    assertEquals(1, calendar.deletes.get());
    assertTrue(calendar.event(synced.externalEventId()).deleted());
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
  }

  @Test
  void deletionNeverPushedIsSettledLocally() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    service.createSchedule(Schedules.timed("s1", "child-1", T0, 60).build());
    service.deleteSchedule("s1");

    SyncPassResult result = engine.runPass(USER);

    assertEquals(0, result.pushed());
    assertEquals(0, calendar.writes.get());
    assertEquals(0, calendar.deletes.get());
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
  }

  @Test
  void outboundOnlyLinkNeverPulls() {
    engine.saveLink(link(SyncDirection.OUTBOUND_ONLY));
    calendar.createExternally("Ignored", T0, T0.plusSeconds(600));
    service.createSchedule(Schedules.timed("s1", "child-1", T0.plusSeconds(3600), 60).build());

    SyncPassResult result = engine.runPass(USER);

    assertEquals(0, calendar.listings.get());
    assertEquals(1, result.pushed());
    assertEquals(1, scheduleStore.all().size());
  }

  @Test
  void inboundOnlyLinkNeverPushes() {
    service.createSchedule(Schedules.timed("s1", "child-1", T0, 60).build());
    engine.saveLink(link(SyncDirection.INBOUND_ONLY));
    calendar.createExternally("Imported", T0.plusSeconds(7200), T0.plusSeconds(9000));

    SyncPassResult result = engine.runPass(USER);

    assertEquals(1, result.pulled());
    assertEquals(0, calendar.writes.get());
    assertEquals(SyncStatus.UNSYNCED, scheduleStore.get("s1").syncStatus());
  }

  @Test
  void schedulesCreatedBeforeLinkingArePushed() {
    service.createSchedule(Schedules.timed("s1", "child-1", T0, 60).build());
    assertEquals(SyncStatus.UNSYNCED, scheduleStore.get("s1").syncStatus());
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));

    SyncPassResult result = engine.runPass(USER);

    assertEquals(SyncPassResult.Outcome.COMPLETED, result.outcome());
    assertEquals(1, result.pushed());
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
    assertEquals(1, calendar.liveEvents().size());
  }

  @Test
  void schedulesKeptLocalUnderInboundOnlyLinkArePushedAfterSwitch() {
    engine.saveLink(link(SyncDirection.INBOUND_ONLY));
    service.createSchedule(Schedules.timed("s1", "child-1", T0, 60).build());
    engine.runPass(USER);
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));

    SyncPassResult result = engine.runPass(USER);

    assertEquals(1, result.pushed());
    assertEquals("s1", calendar.liveEvents().get(0).scheduleId());
  }

  @Test
  void editWhileSyncDisabledConflictsWithLaterExternalEdit() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    Schedule synced = createAndSync("s1");
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL).toBuilder().enabled(false).build());
    clock.advance(Duration.ofMinutes(1));
    service.updateSchedule(scheduleStore.get("s1").toBuilder().title("Local title").build());
    assertEquals(SyncStatus.PENDING_PUSH, scheduleStore.get("s1").syncStatus());
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    clock.advance(Duration.ofMinutes(1));
    calendar.editTitle(synced.externalEventId(), "External edit");

    SyncPassResult result = engine.runPass(USER);

    assertEquals(1, result.conflicts().size());
    SyncConflict conflict = result.conflicts().get(0);
    assertEquals(SyncConflict.Side.EXTERNAL, conflict.winner());
    assertEquals("Local title", conflict.localVersion().title());
    assertEquals(result.conflicts(), conflicts);
    assertEquals("External edit", scheduleStore.get("s1").title());
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
  }

  @Test
  void editWhileSyncDisabledWinsOverOlderExternalEdit() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    Schedule synced = createAndSync("s1");
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL).toBuilder().enabled(false).build());
    clock.advance(Duration.ofMinutes(1));
    calendar.editTitle(synced.externalEventId(), "External edit");
    clock.advance(Duration.ofMinutes(1));
    service.updateSchedule(scheduleStore.get("s1").toBuilder().title("Local title").build());
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));

    SyncPassResult result = engine.runPass(USER);

    assertEquals(SyncConflict.Side.LOCAL, result.conflicts().get(0).winner());
    assertEquals(1, result.pushed());
    assertEquals("Local title", calendar.event(synced.externalEventId()).title());
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
  }

  @Test
  void unmergeableExternalChangeIsHeldUntilItCanBeMerged() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    Schedule synced = createAndSync("s1");
    clock.advance(Duration.ofMinutes(1));
    ExternalEvent broken = calendar.reschedule(synced.externalEventId(), T0, T0.minusSeconds(60));
    clock.advance(Duration.ofMinutes(1));
    ExternalEvent later = calendar.createExternally("Later", T0.plus(Duration.ofDays(1)),
        T0.plus(Duration.ofDays(1)).plusSeconds(600));

    SyncPassResult first = engine.runPass(USER);

    assertEquals(SyncPassResult.Outcome.COMPLETED, first.outcome());
    Schedule held = scheduleStore.get("s1");
    assertEquals(SyncStatus.PENDING_PULL, held.syncStatus());
    assertEquals(synced.end(), held.end());
    assertTrue(scheduleStore.findByExternalEventId(null, USER, later.eventRef()).isPresent());
    assertTrue(linkStore.get(USER).watermark().isBefore(broken.revision()));
    assertEquals(0, first.pushed());

    clock.advance(Duration.ofMinutes(1));
    calendar.reschedule(synced.externalEventId(), T0, T0.plusSeconds(5400));

    SyncPassResult second = engine.runPass(USER);

    assertEquals(1, second.pulled());
    assertEquals(T0.plusSeconds(5400), scheduleStore.get("s1").end());
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
    assertEquals(2, scheduleStore.all().size());
    assertFalse(linkStore.get(USER).watermark().isBefore(later.revision()));
  }

  @Test
  void requestSyncNeedsStartedEngine() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));

    assertFalse(engine.requestSync(USER));
  }

  @Test
  void requestedPassRunsOnWorker() throws Exception {
    engine.start();
    linkStore.save(null, link(SyncDirection.BIDIRECTIONAL));
    service.createSchedule(Schedules.timed("s1", "child-1", T0, 60).build());

    engine.requestSync(USER);

    long deadline = System.currentTimeMillis() + 5_000;
    while (scheduleStore.get("s1").syncStatus() != SyncStatus.SYNCED && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertEquals(SyncStatus.SYNCED, scheduleStore.get("s1").syncStatus());
  }

  @Test
  void closedEngineSkipsPasses() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));
    engine.close();

    assertEquals(SyncPassResult.Outcome.SKIPPED, engine.runPass(USER).outcome());
    assertThrows(IllegalStateException.class, engine::start);
  }

  @Test
  void removeLinkStopsSync() {
    engine.saveLink(link(SyncDirection.BIDIRECTIONAL));

    assertTrue(engine.removeLink(USER));
    assertFalse(engine.removeLink(USER));
    assertTrue(engine.findLink(USER).isEmpty());
  }
}
