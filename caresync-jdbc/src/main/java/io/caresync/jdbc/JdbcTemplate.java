package io.caresync.jdbc;

import io.caresync.spi.CareStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper to reduce boilerplate in store implementations.
 *
 * <p>{@link Instant} parameters are bound as {@link Timestamp}s and {@link LocalDate}s
 * as SQL dates. Every {@link SQLException} surfaces as {@link CareStoreException}.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new CareStoreException("Failed to execute update", e);
    }
  }

  /** Execute the same statement once per parameter row, return total rows affected. */
  public static int batch(Connection conn, String sql, List<Object[]> rows) {
    if (rows.isEmpty()) {
      return 0;
    }
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (Object[] row : rows) {
        bindParams(ps, row);
        ps.addBatch();
      }
      int total = 0;
      for (int count : ps.executeBatch()) {
        total += Math.max(count, 0);
      }
      return total;
    } catch (SQLException e) {
      throw new CareStoreException("Failed to execute batch", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new CareStoreException("Failed to execute query", e);
    }
  }

  /** Execute SELECT expecting at most one row. */
  public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    if (rows.size() > 1) {
      throw new CareStoreException("Expected at most one row, got " + rows.size(), null);
    }
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Reads a nullable timestamp column as an {@link Instant}. */
  public static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else if (param instanceof LocalDate date) {
        ps.setDate(i + 1, java.sql.Date.valueOf(date));
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
