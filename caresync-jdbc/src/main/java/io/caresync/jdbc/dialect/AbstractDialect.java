package io.caresync.jdbc.dialect;

import io.caresync.jdbc.spi.Dialect;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String schemaResource() {
    return "io/caresync/jdbc/schema-" + name() + ".sql";
  }

  @Override
  public String insertDedupKeyIfAbsentSql(String table) {
    return "INSERT INTO " + table + " (dedup_key, seen_at) " +
        "SELECT v.k, v.s FROM (VALUES (CAST(? AS VARCHAR(512)), CAST(? AS TIMESTAMP(3)))) AS v(k, s) " +
        "WHERE NOT EXISTS (SELECT 1 FROM " + table + " d WHERE d.dedup_key=v.k)";
  }

  /**
   * Subquery-based delete, accepted by PostgreSQL.
   */
  @Override
  public String purgeDedupBatchSql(String table) {
    return "DELETE FROM " + table + " WHERE dedup_key IN (" +
        "SELECT dedup_key FROM " + table + " WHERE seen_at < ? ORDER BY seen_at LIMIT ?)";
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name() + "]";
  }
}
