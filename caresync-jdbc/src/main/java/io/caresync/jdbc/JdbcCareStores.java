package io.caresync.jdbc;

import io.caresync.CareStores;
import io.caresync.jdbc.dialect.Dialects;
import io.caresync.jdbc.spi.Dialect;
import io.caresync.jdbc.store.JdbcAlertDedupStore;
import io.caresync.jdbc.store.JdbcScheduleStore;
import io.caresync.jdbc.store.JdbcSyncLinkStore;
import io.caresync.jdbc.store.JdbcWatchSubscriptionStore;
import io.caresync.spi.CareStoreException;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Factory for the JDBC-backed {@link CareStores}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * JdbcCareStores.createSchema(dataSource, dialect);
 * CareStores stores = JdbcCareStores.create(dialect);
 * }</pre>
 */
public final class JdbcCareStores {
  private static final Logger logger = Logger.getLogger(JdbcCareStores.class.getName());

  private JdbcCareStores() {
  }

  public static CareStores create(Dialect dialect) {
    return new CareStores(
        new JdbcScheduleStore(),
        new JdbcSyncLinkStore(),
        new JdbcWatchSubscriptionStore(),
        new JdbcAlertDedupStore(dialect));
  }

  /**
   * Creates stores for the dialect detected from the data source.
   */
  public static CareStores detect(DataSource dataSource) {
    return create(Dialects.detect(dataSource));
  }

  /**
   * Runs the dialect's schema script. Statements are idempotent where the database
   * supports {@code IF NOT EXISTS}.
   *
   * @throws CareStoreException if the script cannot be read or a statement fails
   */
  public static void createSchema(DataSource dataSource, Dialect dialect) {
    List<String> statements = statements(readResource(dialect.schemaResource()));
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      throw new CareStoreException("Failed to create schema for dialect " + dialect.name(), e);
    }
    logger.fine(() -> "Created care schema with " + statements.size() + " statements (" + dialect.name() + ")");
  }

  static List<String> statements(String script) {
    List<String> result = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String line : script.split("\\R")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("--")) {
        continue;
      }
      current.append(line).append('\n');
      if (trimmed.endsWith(";")) {
        String sql = current.toString().trim();
        result.add(sql.substring(0, sql.length() - 1));
        current.setLength(0);
      }
    }
    if (!current.toString().isBlank()) {
      result.add(current.toString().trim());
    }
    return result;
  }

  private static String readResource(String path) {
    try (InputStream in = JdbcCareStores.class.getClassLoader().getResourceAsStream(path)) {
      if (in == null) {
        throw new CareStoreException("Schema resource not found: " + path, null);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new CareStoreException("Failed to read schema resource " + path, e);
    }
  }
}
