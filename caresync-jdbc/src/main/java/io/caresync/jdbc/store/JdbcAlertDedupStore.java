package io.caresync.jdbc.store;

import io.caresync.jdbc.JdbcTemplate;
import io.caresync.jdbc.spi.Dialect;
import io.caresync.spi.AlertDedupStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * JDBC dedup window over {@code care_alert_dedup}, one row per key.
 *
 * <p>Recording inserts the key if absent, otherwise reclaims the row only when its
 * previous sighting has left the window. Purges delete in batches so a large backlog
 * never holds one long-running delete.
 */
public final class JdbcAlertDedupStore implements AlertDedupStore {
  static final String TABLE = "care_alert_dedup";
  static final int DEFAULT_PURGE_BATCH_SIZE = 500;

  private final Dialect dialect;
  private final int purgeBatchSize;

  public JdbcAlertDedupStore(Dialect dialect) {
    this(dialect, DEFAULT_PURGE_BATCH_SIZE);
  }

  public JdbcAlertDedupStore(Dialect dialect, int purgeBatchSize) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    if (purgeBatchSize <= 0) {
      throw new IllegalArgumentException("purgeBatchSize must be > 0");
    }
    this.purgeBatchSize = purgeBatchSize;
  }

  @Override
  public boolean seenSince(Connection conn, String dedupKey, Instant windowStart) {
    return !JdbcTemplate.query(conn, "SELECT 1 FROM " + TABLE + " WHERE dedup_key=? AND seen_at >= ?",
        rs -> Boolean.TRUE, dedupKey, windowStart).isEmpty();
  }

  @Override
  public boolean tryRecord(Connection conn, String dedupKey, Instant seenAt, Instant windowStart) {
    int inserted = JdbcTemplate.update(conn, dialect.insertDedupKeyIfAbsentSql(TABLE), dedupKey, seenAt);
    if (inserted > 0) {
      return true;
    }
    return JdbcTemplate.update(conn, "UPDATE " + TABLE + " SET seen_at=? WHERE dedup_key=? AND seen_at < ?",
        seenAt, dedupKey, windowStart) > 0;
  }

  @Override
  public int purgeBefore(Connection conn, Instant cutoff) {
    String sql = dialect.purgeDedupBatchSql(TABLE);
    int total = 0;
    int deleted;
    do {
      deleted = JdbcTemplate.update(conn, sql, cutoff, purgeBatchSize);
      total += deleted;
    } while (deleted >= purgeBatchSize);
    return total;
  }

  @Override
  public List<Instant> recordedSince(Connection conn, String keyPrefix, Instant since) {
    return JdbcTemplate.query(conn,
        "SELECT seen_at FROM " + TABLE + " WHERE dedup_key LIKE ? ESCAPE '!' AND seen_at >= ? ORDER BY seen_at",
        rs -> JdbcTemplate.instant(rs, "seen_at"), likePrefix(keyPrefix), since);
  }

  private static String likePrefix(String prefix) {
    return prefix.replace("!", "!!").replace("%", "!%").replace("_", "!_") + "%";
  }
}
