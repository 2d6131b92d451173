package io.caresync.sync;

import io.caresync.model.ExternalEvent;
import io.caresync.model.ExternalEventRef;
import io.caresync.model.Schedule;
import io.caresync.model.ScheduleCategory;
import io.caresync.model.SyncLink;
import io.caresync.model.SyncStatus;
import io.caresync.testing.MutableClock;
import io.caresync.testing.Schedules;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SyncStateMachineTest {
  private static final Instant NOW = Instant.parse("2026-03-05T12:00:00Z");
  private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");
  private static final Instant R1 = Instant.parse("2026-03-05T10:00:00Z");

  private final MutableClock clock = new MutableClock(NOW);
  private final SyncStateMachine machine = new SyncStateMachine(new LastWriterWinsResolver(), clock);
  private final SyncLink link = SyncLink.builder()
      .userId(Schedules.USER)
      .accountId("acc")
      .defaultChildId("child-1")
      .build();

  private static Schedule synced() {
    return Schedules.timed("s1", "child-1", T0, 60)
        .externalEventId("evt-1")
        .externalRevision(R1)
        .syncStatus(SyncStatus.SYNCED)
        .updatedAt(R1)
        .build();
  }

  private static ExternalEvent edit(Instant revision, String title) {
    return new ExternalEvent("evt-1", revision, false, "s1", "child-1", ScheduleCategory.HOSPITAL,
        title, T0, T0.plusSeconds(3600), false, "Clinic", null);
  }

  @Test
  void localChangeToSyncedScheduleIsPendingEvenWithoutPushingLink() {
    Schedule s = synced();

    assertEquals(SyncStatus.PENDING_PUSH, machine.onLocalChange(s, true).syncStatus());
    assertEquals(SyncStatus.PENDING_PUSH, machine.onLocalChange(s, false).syncStatus());
  }

  @Test
  void neverPushedScheduleStaysUnsyncedUntilALinkPushes() {
    Schedule fresh = Schedules.timed("s1", "child-1", T0, 60).build();

    assertSame(fresh, machine.onLocalChange(fresh, false));
    assertEquals(SyncStatus.PENDING_PUSH, machine.onLocalChange(fresh, true).syncStatus());
    assertTrue(fresh.awaitsPush());
    assertFalse(fresh.toBuilder().deleted(true).build().awaitsPush());
  }

  @Test
  void localEditWhileConflictedOrAwaitingMergeIsPending() {
    Schedule conflicted = synced().toBuilder().syncStatus(SyncStatus.CONFLICTED).build();
    Schedule awaitingMerge = synced().toBuilder().syncStatus(SyncStatus.PENDING_PULL).build();

    assertEquals(SyncStatus.PENDING_PUSH, machine.onLocalChange(conflicted, false).syncStatus());
    assertEquals(SyncStatus.PENDING_PUSH, machine.onLocalChange(awaitingMerge, true).syncStatus());
  }

  @Test
  void echoOfOwnWriteIsIgnored() {
    Transition t = machine.onInbound(synced(), edit(R1, "s1"), link);

    assertEquals(Transition.Kind.IGNORED, t.kind());
    assertFalse(t.changed());
  }

  @Test
  void externalEditAppliedToUnmodifiedSchedule() {
    Instant r2 = R1.plusSeconds(60);

    Transition t = machine.onInbound(synced(), edit(r2, "Moved by phone"), link);

    assertEquals(Transition.Kind.APPLIED, t.kind());
    assertEquals("Moved by phone", t.result().title());
    assertEquals("Clinic", t.result().locationName());
    assertEquals(r2, t.result().externalRevision());
    assertEquals(SyncStatus.SYNCED, t.result().syncStatus());
    assertEquals(NOW, t.result().lastSyncedAt());
    assertNull(t.conflict());
  }

  @Test
  void externalDeletionSoftDeletes() {
    Transition t = machine.onInbound(synced(), ExternalEvent.deletion("evt-1", R1.plusSeconds(1)), link);

    assertEquals(Transition.Kind.DELETED, t.kind());
    assertTrue(t.result().deleted());
  }

  @Test
  void unknownEventCreatesScheduleForDefaultChild() {
    ExternalEvent e = new ExternalEvent("evt-7", R1, false, null, null, null,
        "Walk-in", T0, T0.plusSeconds(1800), false, null, null);

    Transition t = machine.onInbound(null, e, link);

    assertEquals(Transition.Kind.CREATED, t.kind());
    assertEquals("child-1", t.result().childId());
    assertEquals(Schedules.USER, t.result().userId());
    assertEquals(ScheduleCategory.HOSPITAL, t.result().category());
    assertEquals("evt-7", t.result().externalEventId());
    assertEquals(SyncStatus.SYNCED, t.result().syncStatus());
  }

  @Test
  void unknownEventWithoutChildIsIgnored() {
    SyncLink noDefault = link.toBuilder().defaultChildId(null).build();
    ExternalEvent e = new ExternalEvent("evt-7", R1, false, null, null, null,
        "Walk-in", T0, T0.plusSeconds(1800), false, null, null);

    assertFalse(machine.onInbound(null, e, noDefault).changed());
    assertFalse(machine.onInbound(null, ExternalEvent.deletion("evt-8", R1), link).changed());
  }

  @Test
  void concurrentEditWithLaterLocalKeepsLocal() {
    Schedule local = synced().toBuilder()
        .title("Local title")
        .syncStatus(SyncStatus.PENDING_PUSH)
        .updatedAt(R1.plusSeconds(120))
        .build();

    Transition t = machine.onInbound(local, edit(R1.plusSeconds(60), "External title"), link);

    assertEquals(Transition.Kind.CONFLICT_RESOLVED, t.kind());
    assertEquals("Local title", t.result().title());
    assertEquals(SyncStatus.CONFLICTED, t.result().syncStatus());
    assertTrue(t.result().awaitsPush());
    assertEquals(R1.plusSeconds(60), t.result().externalRevision());
    assertEquals(SyncConflict.Side.LOCAL, t.conflict().winner());
    assertEquals(local, t.conflict().localVersion());
    assertEquals("s1", t.conflict().scheduleId());
  }

  @Test
  void concurrentEditWithLaterExternalTakesExternal() {
    Schedule local = synced().toBuilder()
        .title("Local title")
        .syncStatus(SyncStatus.SYNC_FAILED)
        .updatedAt(R1.plusSeconds(60))
        .build();

    Transition t = machine.onInbound(local, edit(R1.plusSeconds(120), "External title"), link);

    assertEquals(SyncConflict.Side.EXTERNAL, t.conflict().winner());
    assertEquals("External title", t.result().title());
    assertEquals(SyncStatus.SYNCED, t.result().syncStatus());
  }

  @Test
  void externalDeleteLosingToLocalEditDropsEventReference() {
    Schedule local = synced().toBuilder()
        .syncStatus(SyncStatus.PENDING_PUSH)
        .updatedAt(R1.plusSeconds(120))
        .build();

    Transition t = machine.onInbound(local, ExternalEvent.deletion("evt-1", R1.plusSeconds(60)), link);

    assertFalse(t.result().deleted());
    assertNull(t.result().externalEventId());
    assertEquals(SyncStatus.CONFLICTED, t.result().syncStatus());
  }

  @Test
  void unmergeableChangeLeavesSyncedScheduleAwaitingMerge() {
    Transition t = machine.onInboundDeferred(synced());

    assertEquals(SyncStatus.PENDING_PULL, t.result().syncStatus());
    assertFalse(t.result().awaitsPush());
    assertFalse(machine.onInboundDeferred(t.result()).changed());
    assertFalse(machine.onInboundDeferred(null).changed());
    Schedule pending = synced().toBuilder().syncStatus(SyncStatus.PENDING_PUSH).build();
    assertFalse(machine.onInboundDeferred(pending).changed());
  }

  @Test
  void awaitingMergeTakesTheNextExternalChange() {
    Schedule awaitingMerge = synced().toBuilder().syncStatus(SyncStatus.PENDING_PULL).build();

    Transition t = machine.onInbound(awaitingMerge, edit(R1.plusSeconds(60), "External title"), link);

    assertEquals(Transition.Kind.APPLIED, t.kind());
    assertNull(t.conflict());
    assertEquals(SyncStatus.SYNCED, t.result().syncStatus());
  }

  @Test
  void pushOfWinningLocalVersionSettlesConflict() {
    Schedule conflicted = synced().toBuilder().syncStatus(SyncStatus.CONFLICTED).build();

    Transition t = machine.onPushSucceeded(conflicted, conflicted, new ExternalEventRef("evt-1", R1.plusSeconds(5)));

    assertEquals(SyncStatus.SYNCED, t.result().syncStatus());
  }

  @Test
  void pushSuccessRecordsReference() {
    Schedule pending = Schedules.timed("s1", "child-1", T0, 60)
        .syncStatus(SyncStatus.PENDING_PUSH)
        .updatedAt(R1)
        .build();
    ExternalEventRef ref = new ExternalEventRef("evt-1", R1.plusSeconds(1));

    Transition t = machine.onPushSucceeded(pending, pending, ref);

    assertEquals("evt-1", t.result().externalEventId());
    assertEquals(R1.plusSeconds(1), t.result().externalRevision());
    assertEquals(SyncStatus.SYNCED, t.result().syncStatus());
    assertEquals(NOW, t.result().lastSyncedAt());
  }

  @Test
  void editDuringPushStaysPending() {
    Schedule pushed = Schedules.timed("s1", "child-1", T0, 60)
        .syncStatus(SyncStatus.PENDING_PUSH)
        .updatedAt(R1)
        .build();
    Schedule current = pushed.toBuilder().title("edited meanwhile").updatedAt(R1.plusSeconds(1)).build();

    Transition t = machine.onPushSucceeded(current, pushed, new ExternalEventRef("evt-1", R1.plusSeconds(2)));

    assertEquals(SyncStatus.PENDING_PUSH, t.result().syncStatus());
    assertEquals("evt-1", t.result().externalEventId());
    assertEquals("edited meanwhile", t.result().title());
  }

  @Test
  void pushOfVanishedScheduleIsIgnored() {
    Schedule pushed = synced();

    assertFalse(machine.onPushSucceeded(null, pushed, null).changed());
  }

  @Test
  void pushFailureMarksOnce() {
    Schedule pending = synced().toBuilder().syncStatus(SyncStatus.PENDING_PUSH).build();

    Transition failed = machine.onPushFailed(pending);

    assertEquals(SyncStatus.SYNC_FAILED, failed.result().syncStatus());
    assertFalse(machine.onPushFailed(failed.result()).changed());
  }
}
