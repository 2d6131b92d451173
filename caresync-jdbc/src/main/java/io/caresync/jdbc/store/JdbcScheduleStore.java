package io.caresync.jdbc.store;

import io.caresync.jdbc.JdbcTemplate;
import io.caresync.model.ChecklistItem;
import io.caresync.model.Schedule;
import io.caresync.model.ScheduleCategory;
import io.caresync.model.SyncStatus;
import io.caresync.spi.ScheduleStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * JDBC schedule store.
 *
 * <p>The schedule row lives in {@code care_schedule}; checklist items, reminder
 * offsets and conflict references live in child tables that are rewritten on every
 * update and loaded in one query per table for a batch of schedules.
 */
public final class JdbcScheduleStore implements ScheduleStore {
  static final String TABLE = "care_schedule";
  static final String CHECKLIST_TABLE = "care_schedule_checklist";
  static final String REMINDER_TABLE = "care_schedule_reminder";
  static final String CONFLICT_TABLE = "care_schedule_conflict";
  private static final int IN_CHUNK = 500;

  private static final String COLUMNS =
      "schedule_id, child_id, user_id, title, category, start_at, end_at, all_day, zone_id, " +
      "location_name, location_address, department, doctor_name, notes, external_event_id, " +
      "external_revision, sync_status, last_synced_at, deleted, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<Row> ROW_MAPPER = rs -> new Row(rs.getString("schedule_id"), Schedule.builder()
      .scheduleId(rs.getString("schedule_id"))
      .childId(rs.getString("child_id"))
      .userId(rs.getString("user_id"))
      .title(rs.getString("title"))
      .category(ScheduleCategory.fromCode(rs.getString("category")))
      .start(JdbcTemplate.instant(rs, "start_at"))
      .end(JdbcTemplate.instant(rs, "end_at"))
      .allDay(rs.getBoolean("all_day"))
      .zone(ZoneId.of(rs.getString("zone_id")))
      .locationName(rs.getString("location_name"))
      .locationAddress(rs.getString("location_address"))
      .department(rs.getString("department"))
      .doctorName(rs.getString("doctor_name"))
      .notes(rs.getString("notes"))
      .externalEventId(rs.getString("external_event_id"))
      .externalRevision(JdbcTemplate.instant(rs, "external_revision"))
      .syncStatus(SyncStatus.fromCode(rs.getInt("sync_status")))
      .lastSyncedAt(JdbcTemplate.instant(rs, "last_synced_at"))
      .deleted(rs.getBoolean("deleted"))
      .createdAt(JdbcTemplate.instant(rs, "created_at"))
      .updatedAt(JdbcTemplate.instant(rs, "updated_at")));

  @Override
  public void insert(Connection conn, Schedule schedule) {
    String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ") " +
        "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        schedule.scheduleId(), schedule.childId(), schedule.userId(), schedule.title(),
        schedule.category().code(), schedule.start(), schedule.end(), schedule.allDay(),
        schedule.zone().getId(), schedule.locationName(), schedule.locationAddress(),
        schedule.department(), schedule.doctorName(), schedule.notes(), schedule.externalEventId(),
        schedule.externalRevision(), schedule.syncStatus().code(), schedule.lastSyncedAt(),
        schedule.deleted(), schedule.createdAt(), schedule.updatedAt());
    insertDetails(conn, schedule);
  }

  @Override
  public int update(Connection conn, Schedule schedule) {
    String sql = "UPDATE " + TABLE + " SET " +
        "title=?, category=?, start_at=?, end_at=?, all_day=?, zone_id=?, location_name=?, " +
        "location_address=?, department=?, doctor_name=?, notes=?, external_event_id=?, " +
        "external_revision=?, sync_status=?, last_synced_at=?, deleted=?, updated_at=? " +
        "WHERE schedule_id=?";
    int updated = JdbcTemplate.update(conn, sql,
        schedule.title(), schedule.category().code(), schedule.start(), schedule.end(),
        schedule.allDay(), schedule.zone().getId(), schedule.locationName(),
        schedule.locationAddress(), schedule.department(), schedule.doctorName(), schedule.notes(),
        schedule.externalEventId(), schedule.externalRevision(), schedule.syncStatus().code(),
        schedule.lastSyncedAt(), schedule.deleted(), schedule.updatedAt(), schedule.scheduleId());
    if (updated == 0) {
      return 0;
    }
    for (String table : List.of(CHECKLIST_TABLE, REMINDER_TABLE, CONFLICT_TABLE)) {
      JdbcTemplate.update(conn, "DELETE FROM " + table + " WHERE schedule_id=?", schedule.scheduleId());
    }
    insertDetails(conn, schedule);
    return updated;
  }

  @Override
  public Optional<Schedule> find(Connection conn, String scheduleId) {
    List<Schedule> found = select(conn, "WHERE schedule_id=?", scheduleId);
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  @Override
  public Optional<Schedule> findByExternalEventId(Connection conn, String userId, String externalEventId) {
    List<Schedule> found = select(conn,
        "WHERE user_id=? AND external_event_id=? ORDER BY updated_at DESC", userId, externalEventId);
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  @Override
  public List<Schedule> listActiveByChild(Connection conn, String childId) {
    return select(conn, "WHERE child_id=? AND deleted=? ORDER BY start_at, schedule_id", childId, false);
  }

  @Override
  public List<Schedule> listByChild(Connection conn, String childId, Instant from, Instant to) {
    return select(conn,
        "WHERE child_id=? AND deleted=? AND start_at < ? AND end_at > ? ORDER BY start_at, schedule_id",
        childId, false, to, from);
  }

  @Override
  public List<Schedule> listPendingPush(Connection conn, String userId, int limit) {
    return select(conn,
        "WHERE user_id=? AND (sync_status IN (?,?,?) OR (sync_status=? AND deleted=?))"
            + " ORDER BY updated_at, schedule_id LIMIT ?",
        userId, SyncStatus.PENDING_PUSH.code(), SyncStatus.CONFLICTED.code(), SyncStatus.SYNC_FAILED.code(),
        SyncStatus.UNSYNCED.code(), false, limit);
  }

  private List<Schedule> select(Connection conn, String where, Object... params) {
    List<Row> rows = JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + TABLE + " " + where, ROW_MAPPER, params);
    if (rows.isEmpty()) {
      return List.of();
    }
    Map<String, Schedule.Builder> byId = new LinkedHashMap<>();
    for (Row row : rows) {
      byId.put(row.scheduleId(), row.builder());
    }
    Details details = loadDetails(conn, new ArrayList<>(byId.keySet()));
    List<Schedule> result = new ArrayList<>(byId.size());
    for (Map.Entry<String, Schedule.Builder> e : byId.entrySet()) {
      String id = e.getKey();
      Schedule schedule = e.getValue()
          .checklist(details.checklists.getOrDefault(id, List.of()))
          .reminderMinutes(details.reminders.getOrDefault(id, Set.of()))
          .build()
          .withConflicts(details.conflicts.getOrDefault(id, Set.of()));
      result.add(schedule);
    }
    return result;
  }

  private void insertDetails(Connection conn, Schedule schedule) {
    String id = schedule.scheduleId();
    List<Object[]> checklistRows = new ArrayList<>();
    int order = 0;
    for (ChecklistItem item : schedule.checklist()) {
      checklistRows.add(new Object[]{id, order++, item.item(), item.checked()});
    }
    JdbcTemplate.batch(conn, "INSERT INTO " + CHECKLIST_TABLE +
        " (schedule_id, item_order, item, is_checked) VALUES (?,?,?,?)", checklistRows);

    List<Object[]> reminderRows = new ArrayList<>();
    for (Integer minutes : schedule.reminderMinutes()) {
      reminderRows.add(new Object[]{id, minutes});
    }
    JdbcTemplate.batch(conn, "INSERT INTO " + REMINDER_TABLE +
        " (schedule_id, minutes_before) VALUES (?,?)", reminderRows);

    List<Object[]> conflictRows = new ArrayList<>();
    for (String other : schedule.conflictWith()) {
      conflictRows.add(new Object[]{id, other});
    }
    JdbcTemplate.batch(conn, "INSERT INTO " + CONFLICT_TABLE +
        " (schedule_id, other_schedule_id) VALUES (?,?)", conflictRows);
  }

  private Details loadDetails(Connection conn, List<String> ids) {
    Details details = new Details();
    for (int from = 0; from < ids.size(); from += IN_CHUNK) {
      List<String> chunk = ids.subList(from, Math.min(ids.size(), from + IN_CHUNK));
      String in = inClause(chunk.size());
      Object[] params = chunk.toArray();

      JdbcTemplate.query(conn, "SELECT schedule_id, item, is_checked FROM " + CHECKLIST_TABLE +
          " WHERE schedule_id IN " + in + " ORDER BY schedule_id, item_order", rs -> {
            details.checklists.computeIfAbsent(rs.getString("schedule_id"), k -> new ArrayList<>())
                .add(new ChecklistItem(rs.getString("item"), rs.getBoolean("is_checked")));
            return null;
          }, params);
      JdbcTemplate.query(conn, "SELECT schedule_id, minutes_before FROM " + REMINDER_TABLE +
          " WHERE schedule_id IN " + in, rs -> {
            details.reminders.computeIfAbsent(rs.getString("schedule_id"), k -> new TreeSet<>())
                .add(rs.getInt("minutes_before"));
            return null;
          }, params);
      JdbcTemplate.query(conn, "SELECT schedule_id, other_schedule_id FROM " + CONFLICT_TABLE +
          " WHERE schedule_id IN " + in, rs -> {
            details.conflicts.computeIfAbsent(rs.getString("schedule_id"), k -> new HashSet<>())
                .add(rs.getString("other_schedule_id"));
            return null;
          }, params);
    }
    return details;
  }

  static String inClause(int size) {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < size; i++) {
      sb.append(i == 0 ? "?" : ",?");
    }
    return sb.append(')').toString();
  }

  private record Row(String scheduleId, Schedule.Builder builder) {
  }

  private static final class Details {
    final Map<String, List<ChecklistItem>> checklists = new HashMap<>();
    final Map<String, Set<Integer>> reminders = new HashMap<>();
    final Map<String, Set<String>> conflicts = new HashMap<>();
  }
}
