package com.example.actionlambda.core.jdbc;

import javax.sql.DataSource;

/**
 * Factory that creates a pooled {@link DataSource} from {@link PoolSettings}. Implementations
 * returning an {@link AutoCloseable} data source get it closed by {@link
 * ConnectionPoolManager#closeAll()}.
 */
@FunctionalInterface
public interface DataSourceFactory {
  /**
   * Creates a new {@link DataSource} for the provided settings.
   *
   * @param settings pool configuration
   * @return a new {@link DataSource}
   */
  DataSource create(final PoolSettings settings);
}
