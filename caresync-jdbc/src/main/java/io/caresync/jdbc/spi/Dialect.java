package io.caresync.jdbc.spi;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific pieces of the care stores: the
 * schema script, the idempotent dedup insert and the batched dedup purge.
 * Register custom dialects via {@code META-INF/services/io.caresync.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL, PostgreSQL, H2.
 *
 * @see io.caresync.jdbc.dialect.Dialects
 */
public interface Dialect {

    /**
     * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
     */
    String name();

    /**
     * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:").
     */
    List<String> jdbcUrlPrefixes();

    /**
     * Classpath location of the DDL script creating the care tables.
     */
    String schemaResource();

    /**
     * SQL inserting a dedup key only if it is not stored yet.
     *
     * <p>Parameters: dedup_key (String), seen_at (Timestamp). Must affect zero rows,
     * without failing, when the key already exists.
     */
    String insertDedupKeyIfAbsentSql(String table);

    /**
     * SQL deleting at most a batch of dedup rows seen before a cutoff.
     *
     * <p>Parameters: cutoff (Timestamp), limit (int).
     */
    String purgeDedupBatchSql(String table);
}
