package io.caresync.jdbc.dialect;

import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery, so purges use
 * {@code DELETE ... ORDER BY ... LIMIT} directly.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public String insertDedupKeyIfAbsentSql(String table) {
    return "INSERT IGNORE INTO " + table + " (dedup_key, seen_at) VALUES (?, ?)";
  }

  @Override
  public String purgeDedupBatchSql(String table) {
    return "DELETE FROM " + table + " WHERE seen_at < ? ORDER BY seen_at LIMIT ?";
  }
}
