package io.caresync.jdbc.store;

import io.caresync.jdbc.JdbcTemplate;
import io.caresync.model.LinkStatus;
import io.caresync.model.SyncDirection;
import io.caresync.model.SyncLink;
import io.caresync.spi.SyncLinkStore;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * JDBC sync link store, one row per user in {@code care_sync_link}.
 */
public final class JdbcSyncLinkStore implements SyncLinkStore {
  static final String TABLE = "care_sync_link";
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String COLUMNS =
      "user_id, account_id, refresh_credential, calendar_id, direction, enabled, status, " +
      "watermark, last_synced_at, last_error, default_child_id, updated_at";

  private static final JdbcTemplate.RowMapper<SyncLink> ROW_MAPPER = rs -> SyncLink.builder()
      .userId(rs.getString("user_id"))
      .accountId(rs.getString("account_id"))
      .refreshCredential(rs.getString("refresh_credential"))
      .calendarId(rs.getString("calendar_id"))
      .direction(SyncDirection.valueOf(rs.getString("direction")))
      .enabled(rs.getBoolean("enabled"))
      .status(LinkStatus.valueOf(rs.getString("status")))
      .watermark(JdbcTemplate.instant(rs, "watermark"))
      .lastSyncedAt(JdbcTemplate.instant(rs, "last_synced_at"))
      .lastError(rs.getString("last_error"))
      .defaultChildId(rs.getString("default_child_id"))
      .updatedAt(JdbcTemplate.instant(rs, "updated_at"))
      .build();

  @Override
  public Optional<SyncLink> find(Connection conn, String userId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE user_id=?", ROW_MAPPER, userId);
  }

  @Override
  public void save(Connection conn, SyncLink link) {
    String update = "UPDATE " + TABLE + " SET account_id=?, refresh_credential=?, calendar_id=?, " +
        "direction=?, enabled=?, status=?, watermark=?, last_synced_at=?, last_error=?, " +
        "default_child_id=?, updated_at=? WHERE user_id=?";
    int updated = JdbcTemplate.update(conn, update,
        link.accountId(), link.refreshCredential(), link.calendarId(), link.direction().name(),
        link.enabled(), link.status().name(), link.watermark(), link.lastSyncedAt(),
        truncateError(link.lastError()), link.defaultChildId(), link.updatedAt(), link.userId());
    if (updated == 0) {
      JdbcTemplate.update(conn, "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)",
          link.userId(), link.accountId(), link.refreshCredential(), link.calendarId(),
          link.direction().name(), link.enabled(), link.status().name(), link.watermark(),
          link.lastSyncedAt(), truncateError(link.lastError()), link.defaultChildId(), link.updatedAt());
    }
  }

  @Override
  public int delete(Connection conn, String userId) {
    return JdbcTemplate.update(conn, "DELETE FROM " + TABLE + " WHERE user_id=?", userId);
  }

  @Override
  public List<SyncLink> listRunnable(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE enabled=? AND status=? ORDER BY user_id",
        ROW_MAPPER, true, LinkStatus.ACTIVE.name());
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
