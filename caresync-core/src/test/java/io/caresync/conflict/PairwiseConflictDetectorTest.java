package io.caresync.conflict;

import io.caresync.model.ConflictInfo;
import io.caresync.model.ConflictType;
import io.caresync.model.Schedule;
import io.caresync.testing.Schedules;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PairwiseConflictDetectorTest {
  private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");

  private final PairwiseConflictDetector detector = new PairwiseConflictDetector();

  @Test
  void partialOverlapReportsOverlapWindow() {
    Schedule a = Schedules.timed("a", "child-1", T0, 60).build();
    Schedule b = Schedules.timed("b", "child-1", T0.plusSeconds(30 * 60), 60).title("Speech therapy").build();

    List<ConflictInfo> conflicts = detector.detectConflicts(a, List.of(b));

    assertEquals(1, conflicts.size());
    ConflictInfo info = conflicts.get(0);
    assertEquals("a", info.scheduleId());
    assertEquals("b", info.otherScheduleId());
    assertEquals("Speech therapy", info.otherTitle());
    assertEquals(T0.plusSeconds(30 * 60), info.overlapStart());
    assertEquals(T0.plusSeconds(60 * 60), info.overlapEnd());
    assertEquals(30, info.overlapMinutes());
    assertEquals(ConflictType.PARTIAL_OVERLAP, info.type());
  }

  @Test
  void backToBackSchedulesDoNotConflict() {
    Schedule a = Schedules.timed("a", "child-1", T0, 60).build();
    Schedule b = Schedules.timed("b", "child-1", T0.plusSeconds(3600), 60).build();

    assertTrue(detector.detectConflicts(a, List.of(b)).isEmpty());
  }

  @Test
  void classifiesFullOverlapAndContainment() {
    Schedule a = Schedules.timed("a", "child-1", T0, 60).build();
    Schedule same = Schedules.timed("same", "child-1", T0, 60).build();
    Schedule inner = Schedules.timed("inner", "child-1", T0.plusSeconds(600), 20).build();

    List<ConflictInfo> conflicts = detector.detectConflicts(a, List.of(same, inner));

    assertEquals(ConflictType.FULL_OVERLAP, conflicts.get(0).type());
    assertEquals(ConflictType.CONTAINS, conflicts.get(1).type());
    assertEquals(20, conflicts.get(1).overlapMinutes());
  }

  @Test
  void allDaySchedulesConflictOnlyWithAllDayOnSameDate() {
    LocalDate day = LocalDate.ofInstant(T0, ZoneOffset.UTC);
    Schedule camp = Schedules.allDay("camp", "child-1", day).build();
    Schedule other = Schedules.allDay("other", "child-1", day).build();
    Schedule nextDay = Schedules.allDay("next", "child-1", day.plusDays(1)).build();
    Schedule timed = Schedules.timed("timed", "child-1", T0, 60).build();

    List<ConflictInfo> conflicts = detector.detectConflicts(camp, List.of(other, nextDay, timed));

    assertEquals(1, conflicts.size());
    assertEquals("other", conflicts.get(0).otherScheduleId());
    assertEquals(ConflictType.SAME_DAY, conflicts.get(0).type());
  }

  @Test
  void ignoresDeletedOtherChildrenAndSelf() {
    Schedule a = Schedules.timed("a", "child-1", T0, 60).build();
    Schedule deleted = Schedules.timed("d", "child-1", T0, 60).deleted(true).build();
    Schedule sibling = Schedules.timed("s", "child-2", T0, 60).build();

    assertTrue(detector.detectConflicts(a, List.of(a, deleted, sibling)).isEmpty());
    assertTrue(detector.detectConflicts(deleted, List.of(a)).isEmpty());
  }

  @Test
  void relationIsSymmetric() {
    Schedule a = Schedules.timed("a", "child-1", T0, 60).build();
    Schedule b = Schedules.timed("b", "child-1", T0.plusSeconds(1800), 60).build();

    assertTrue(PairwiseConflictDetector.conflictBetween(a, b).isPresent());
    assertTrue(PairwiseConflictDetector.conflictBetween(b, a).isPresent());
    assertEquals(PairwiseConflictDetector.conflictBetween(a, b).get().overlapMinutes(),
        PairwiseConflictDetector.conflictBetween(b, a).get().overlapMinutes());
  }

  @Test
  void warningMessageUsesZone() {
    Schedule a = Schedules.timed("a", "child-1", T0, 60).title("Checkup").build();
    Schedule b = Schedules.timed("b", "child-1", T0.plusSeconds(1800), 60).title("Therapy").build();

    String message = PairwiseConflictDetector.conflictBetween(a, b).get()
        .warningMessage(a.title(), ZoneOffset.ofHours(9));

    assertEquals("Schedule conflict: 'Checkup' and 'Therapy' overlap for 30 minutes starting 2026-03-10 19:30.",
        message);
  }
}
