package io.caresync.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String insertDedupKeyIfAbsentSql(String table) {
    return "INSERT INTO " + table + " (dedup_key, seen_at) VALUES (?, ?) ON CONFLICT (dedup_key) DO NOTHING";
  }
}
