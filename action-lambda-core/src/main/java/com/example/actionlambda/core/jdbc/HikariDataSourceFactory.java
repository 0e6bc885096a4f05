package com.example.actionlambda.core.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;

/** {@link DataSourceFactory} building a HikariCP pool for MySQL Connector/J. */
public final class HikariDataSourceFactory implements DataSourceFactory {

  static final String POOL_NAME = "action-lambda-pool";
  static final long FAIL_FAST_TIMEOUT_MILLIS = 250L;

  @Override
  public DataSource create(final PoolSettings settings) {
    return new HikariDataSource(config(settings));
  }

  /**
   * Maps pool settings onto a Hikari configuration.
   *
   * <p>Hikari has no separate upper bound for idle connections; idle connections above {@code
   * minIdle} are retired after the idle timeout. Hikari also never runs a validation query on
   * borrow for JDBC4 drivers, which matches {@code pingOnBorrow=false}.
   *
   * @param settings pool configuration
   * @return Hikari configuration
   */
  static HikariConfig config(final PoolSettings settings) {
    final var config = new HikariConfig();
    config.setPoolName(POOL_NAME);
    config.setJdbcUrl(settings.jdbcUrl());
    config.setUsername(settings.user());
    config.setPassword(settings.password());
    config.setMaximumPoolSize(settings.maxConnections());
    config.setMinimumIdle(settings.minIdle());
    // 0 means wait indefinitely for a free connection
    config.setConnectionTimeout(settings.blockWhenExhausted() ? 0L : FAIL_FAST_TIMEOUT_MILLIS);
    config.addDataSourceProperty("characterEncoding", settings.javaEncoding());
    config.addDataSourceProperty("allowMultiQueries", String.valueOf(settings.multiStatements()));
    return config;
  }
}
