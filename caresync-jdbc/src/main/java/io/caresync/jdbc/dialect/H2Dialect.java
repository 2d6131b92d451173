package io.caresync.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect, used by the test suites and embedded deployments.
 *
 * <p>Keeps the standard {@code NOT EXISTS} dedup insert and limits purges with
 * {@code FETCH FIRST}.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String purgeDedupBatchSql(String table) {
    return "DELETE FROM " + table + " WHERE seen_at < ? FETCH FIRST ? ROWS ONLY";
  }
}
