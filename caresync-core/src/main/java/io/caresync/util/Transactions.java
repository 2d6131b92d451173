package io.caresync.util;

import io.caresync.spi.CareStoreException;
import io.caresync.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs store calls on a connection from a {@link ConnectionProvider}, either in one
 * transaction or in auto-commit mode. The connection is always closed afterwards.
 */
public final class Transactions {

  @FunctionalInterface
  public interface Work<T> {
    T run(Connection conn) throws SQLException;
  }

  /**
   * Runs {@code work} in a single transaction, committing on success and rolling back
   * on any exception.
   *
   * @throws CareStoreException if a JDBC call fails
   */
  public static <T> T inTransaction(ConnectionProvider connectionProvider, Work<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.run(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      throw new CareStoreException("Transaction failed", e);
    }
  }

  /**
   * Runs {@code work} on an auto-committed connection.
   *
   * @throws CareStoreException if a JDBC call fails
   */
  public static <T> T withConnection(ConnectionProvider connectionProvider, Work<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return work.run(conn);
    } catch (SQLException e) {
      throw new CareStoreException("Store call failed", e);
    }
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private Transactions() {
  }
}
