package com.example.actionlambda.core.repository;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.actionlambda.core.jdbc.ConnectionPoolManager;
import com.example.actionlambda.core.jdbc.RetryingQueryExecutor;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Read access to {@code SITE_MASTER}, the per-tenant site configuration table. */
public final class SiteMasterRepository {

  private static final System.Logger logger =
      System.getLogger(SiteMasterRepository.class.getName());

  static final String SELECT_BY_ID = "SELECT * FROM SITE_MASTER WHERE SITE_MASTER_ID = ?";

  private final ConnectionPoolManager pool;
  private final RetryingQueryExecutor executor;

  public SiteMasterRepository(final ConnectionPoolManager pool) {
    this(pool, new RetryingQueryExecutor());
  }

  public SiteMasterRepository(
      final ConnectionPoolManager pool, final RetryingQueryExecutor executor) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /**
   * Fetches a site master row.
   *
   * @param siteMasterId value of {@code SITE_MASTER_ID}
   * @return the row keyed by column name, or empty if no row matched
   * @throws SQLException if no connection could be borrowed
   * @throws com.example.actionlambda.core.error.ClassifiedException if the query failed
   */
  public Optional<Map<String, Object>> getById(final String siteMasterId) throws SQLException {
    Objects.requireNonNull(siteMasterId, "siteMasterId");
    try (final var guard = pool.connection();
        final var cursor = guard.cursor()) {
      executor.execute(cursor, SELECT_BY_ID, List.of(siteMasterId));
      final var row = cursor.fetchOne();
      if (row.isPresent()) logger.log(INFO, "Found site master with ID: {0}", siteMasterId);
      else logger.log(INFO, "No site master found with ID: {0}", siteMasterId);
      return row;
    } catch (final SQLException | RuntimeException e) {
      logger.log(ERROR, "Error fetching site master: {0}", e.getMessage());
      throw e;
    }
  }
}
