package io.caresync.jdbc.store;

import io.caresync.jdbc.JdbcTemplate;
import io.caresync.model.TimeSlot;
import io.caresync.model.WatchSubscription;
import io.caresync.model.WatcherStatus;
import io.caresync.spi.WatchSubscriptionStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * JDBC watch subscription store. Preferred dates and time slots are kept in child tables.
 */
public final class JdbcWatchSubscriptionStore implements WatchSubscriptionStore {
  static final String TABLE = "care_watch_subscription";
  static final String DATE_TABLE = "care_watch_preferred_date";
  static final String SLOT_TABLE = "care_watch_time_slot";

  private static final String COLUMNS =
      "subscription_id, user_id, child_id, hospital_name, department, doctor_name, enabled, " +
      "status, last_alert_at, alert_count, hospital_phone, reservation_url, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<Row> ROW_MAPPER = rs -> new Row(
      rs.getString("subscription_id"),
      WatchSubscription.builder()
          .subscriptionId(rs.getString("subscription_id"))
          .userId(rs.getString("user_id"))
          .childId(rs.getString("child_id"))
          .hospitalName(rs.getString("hospital_name"))
          .department(rs.getString("department"))
          .doctorName(rs.getString("doctor_name"))
          .enabled(rs.getBoolean("enabled"))
          .status(WatcherStatus.valueOf(rs.getString("status")))
          .lastAlertAt(JdbcTemplate.instant(rs, "last_alert_at"))
          .alertCount(rs.getInt("alert_count"))
          .hospitalPhone(rs.getString("hospital_phone"))
          .reservationUrl(rs.getString("reservation_url"))
          .createdAt(JdbcTemplate.instant(rs, "created_at"))
          .updatedAt(JdbcTemplate.instant(rs, "updated_at")));

  @Override
  public void insert(Connection conn, WatchSubscription subscription) {
    JdbcTemplate.update(conn, "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
        subscription.subscriptionId(), subscription.userId(), subscription.childId(),
        subscription.hospitalName(), subscription.department(), subscription.doctorName(),
        subscription.enabled(), subscription.status().name(), subscription.lastAlertAt(),
        subscription.alertCount(), subscription.hospitalPhone(), subscription.reservationUrl(),
        subscription.createdAt(), subscription.updatedAt());
    insertPreferences(conn, subscription);
  }

  @Override
  public int update(Connection conn, WatchSubscription subscription) {
    int updated = JdbcTemplate.update(conn, "UPDATE " + TABLE + " SET user_id=?, child_id=?, " +
            "hospital_name=?, department=?, doctor_name=?, enabled=?, status=?, last_alert_at=?, " +
            "alert_count=?, hospital_phone=?, reservation_url=?, updated_at=? WHERE subscription_id=?",
        subscription.userId(), subscription.childId(), subscription.hospitalName(),
        subscription.department(), subscription.doctorName(), subscription.enabled(),
        subscription.status().name(), subscription.lastAlertAt(), subscription.alertCount(),
        subscription.hospitalPhone(), subscription.reservationUrl(), subscription.updatedAt(),
        subscription.subscriptionId());
    if (updated == 0) {
      return 0;
    }
    JdbcTemplate.update(conn, "DELETE FROM " + DATE_TABLE + " WHERE subscription_id=?", subscription.subscriptionId());
    JdbcTemplate.update(conn, "DELETE FROM " + SLOT_TABLE + " WHERE subscription_id=?", subscription.subscriptionId());
    insertPreferences(conn, subscription);
    return updated;
  }

  @Override
  public Optional<WatchSubscription> find(Connection conn, String subscriptionId) {
    List<WatchSubscription> found = select(conn, "WHERE subscription_id=?", subscriptionId);
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  @Override
  public List<WatchSubscription> listEnabled(Connection conn) {
    return select(conn, "WHERE enabled=? ORDER BY created_at, subscription_id", true);
  }

  @Override
  public List<WatchSubscription> listByUser(Connection conn, String userId) {
    return select(conn, "WHERE user_id=? ORDER BY created_at, subscription_id", userId);
  }

  @Override
  public int recordAlert(Connection conn, String subscriptionId, Instant alertedAt) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE +
            " SET alert_count=alert_count+1, last_alert_at=?, updated_at=? WHERE subscription_id=?",
        alertedAt, alertedAt, subscriptionId);
  }

  private List<WatchSubscription> select(Connection conn, String where, Object... params) {
    List<Row> rows = JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + TABLE + " " + where, ROW_MAPPER, params);
    if (rows.isEmpty()) {
      return List.of();
    }
    Map<String, WatchSubscription.Builder> byId = new LinkedHashMap<>();
    for (Row row : rows) {
      byId.put(row.subscriptionId(), row.builder());
    }
    Map<String, SortedSet<LocalDate>> dates = new HashMap<>();
    Map<String, Set<TimeSlot>> slots = new HashMap<>();
    List<String> ids = new ArrayList<>(byId.keySet());
    String in = JdbcScheduleStore.inClause(ids.size());
    Object[] idParams = ids.toArray();
    JdbcTemplate.query(conn, "SELECT subscription_id, preferred_date FROM " + DATE_TABLE +
        " WHERE subscription_id IN " + in, rs -> {
          dates.computeIfAbsent(rs.getString("subscription_id"), k -> new TreeSet<>())
              .add(rs.getDate("preferred_date").toLocalDate());
          return null;
        }, idParams);
    JdbcTemplate.query(conn, "SELECT subscription_id, time_slot FROM " + SLOT_TABLE +
        " WHERE subscription_id IN " + in, rs -> {
          slots.computeIfAbsent(rs.getString("subscription_id"), k -> EnumSet.noneOf(TimeSlot.class))
              .add(TimeSlot.valueOf(rs.getString("time_slot")));
          return null;
        }, idParams);

    List<WatchSubscription> result = new ArrayList<>(byId.size());
    for (Map.Entry<String, WatchSubscription.Builder> e : byId.entrySet()) {
      result.add(e.getValue()
          .preferredDates(dates.getOrDefault(e.getKey(), new TreeSet<>()))
          .preferredTimeSlots(slots.getOrDefault(e.getKey(), EnumSet.noneOf(TimeSlot.class)))
          .build());
    }
    return result;
  }

  private void insertPreferences(Connection conn, WatchSubscription subscription) {
    List<Object[]> dateRows = new ArrayList<>();
    for (LocalDate date : subscription.preferredDates()) {
      dateRows.add(new Object[]{subscription.subscriptionId(), date});
    }
    JdbcTemplate.batch(conn, "INSERT INTO " + DATE_TABLE +
        " (subscription_id, preferred_date) VALUES (?,?)", dateRows);
    List<Object[]> slotRows = new ArrayList<>();
    for (TimeSlot slot : subscription.preferredTimeSlots()) {
      slotRows.add(new Object[]{subscription.subscriptionId(), slot.name()});
    }
    JdbcTemplate.batch(conn, "INSERT INTO " + SLOT_TABLE +
        " (subscription_id, time_slot) VALUES (?,?)", slotRows);
  }

  private record Row(String subscriptionId, WatchSubscription.Builder builder) {
  }
}
