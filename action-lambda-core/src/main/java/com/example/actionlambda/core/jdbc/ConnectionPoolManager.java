package com.example.actionlambda.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import javax.sql.DataSource;

/**
 * Owns the process-wide database connection pool.
 *
 * <p>Construct one instance per process and share it with every repository. The pool itself is
 * created lazily on the first {@link #getConnection()} (or eagerly via {@link #initialize()}) from
 * the configured {@link PoolSettings} source; concurrent first callers create exactly one pool.
 *
 * <pre>{@code
 * var pool = new ConnectionPoolManager();            // DB_* environment, HikariCP
 * try (var guard = pool.connection()) {
 *   // use guard.cursor() ...
 * }
 * pool.closeAll();
 * }</pre>
 *
 * <p>Borrowing blocks while the pool is saturated and has no timeout of its own; callers that
 * need a bounded wait must impose it themselves.
 *
 * <p>A pool replaced by {@link #initialize()} keeps serving connections already borrowed from it
 * and is closed once the grace period has passed. {@link #closeAll()} closes every pool at once,
 * including one still in its grace period.
 */
public final class ConnectionPoolManager implements AutoCloseable {

  private static final System.Logger logger =
      System.getLogger(ConnectionPoolManager.class.getName());

  private final Supplier<PoolSettings> settingsSource;
  public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(30);

  private final DataSourceFactory factory;
  private final Duration gracePeriod;
  private final Object lock = new Object();

  private volatile DataSource pool;
  private Retirement retired;

  /** Pool manager reading {@link PoolSettings#fromEnvironment()} and building a HikariCP pool. */
  public ConnectionPoolManager() {
    this(PoolSettings::fromEnvironment, new HikariDataSourceFactory());
  }

  /**
   * Pool manager with explicit collaborators.
   *
   * @param settingsSource supplies pool settings each time a pool is built
   * @param factory builds the pooled data source
   */
  public ConnectionPoolManager(
      final Supplier<PoolSettings> settingsSource, final DataSourceFactory factory) {
    this(settingsSource, factory, DEFAULT_GRACE_PERIOD);
  }

  /**
   * Pool manager with explicit collaborators and grace period.
   *
   * @param settingsSource supplies pool settings each time a pool is built
   * @param factory builds the pooled data source
   * @param gracePeriod how long a replaced pool stays open before it is closed; zero closes it
   *     right away
   */
  public ConnectionPoolManager(
      final Supplier<PoolSettings> settingsSource,
      final DataSourceFactory factory,
      final Duration gracePeriod) {
    if (gracePeriod == null || gracePeriod.isNegative())
      throw new IllegalArgumentException("gracePeriod must be non-negative");
    this.settingsSource = Objects.requireNonNull(settingsSource, "settingsSource");
    this.factory = Objects.requireNonNull(factory, "factory");
    this.gracePeriod = gracePeriod;
  }

  /**
   * Builds a new pool. If one already exists it is replaced; connections borrowed from the old
   * pool stay usable and the old pool is closed after the grace period.
   */
  public void initialize() {
    synchronized (lock) {
      final var previous = pool;
      pool = createPool();
      if (previous != null) {
        logger.log(INFO, "Replaced existing connection pool");
        retire(previous);
      }
    }
  }

  /**
   * Borrows a connection, initializing the pool first if needed.
   *
   * @return pooled connection; closing it returns it to the pool
   * @throws SQLException if the pool cannot provide a connection
   */
  public Connection getConnection() throws SQLException {
    final var current = currentPool();
    Connection connection;
    try {
      connection = current.getConnection();
    } catch (final SQLException e) {
      // pool was closed or replaced while borrowing
      if (pool == current) throw e;
      logger.log(
          DEBUG, "Connection pool changed while borrowing, retrying once: {0}", e.getMessage());
      connection = currentPool().getConnection();
    }
    if (connection == null) throw new SQLException("Connection pool returned no connection");
    return connection;
  }

  /**
   * Borrows a connection wrapped in a {@link ConnectionGuard} for try-with-resources.
   *
   * @return guard owning a pooled connection
   * @throws SQLException if the pool cannot provide a connection
   */
  public ConnectionGuard connection() throws SQLException {
    return new ConnectionGuard(getConnection());
  }

  /** Closes the pool and every connection it holds; the next borrow re-initializes. */
  public void closeAll() {
    final DataSource previous;
    final Retirement pending;
    synchronized (lock) {
      previous = pool;
      pool = null;
      pending = retired;
      retired = null;
    }
    if (pending != null) pending.closeNow();
    if (previous != null) {
      closeDataSource(previous);
      logger.log(INFO, "Closed connection pool");
    }
  }

  public boolean isInitialized() {
    return pool != null;
  }

  @Override
  public void close() {
    closeAll();
  }

  private DataSource currentPool() {
    var current = pool;
    if (current == null) {
      synchronized (lock) {
        current = pool;
        if (current == null) {
          logger.log(DEBUG, "Connection pool not initialized, initializing lazily");
          current = createPool();
          pool = current;
        }
      }
    }
    return current;
  }

  private DataSource createPool() {
    final var settings = settingsSource.get();
    logger.log(INFO, "Initializing connection pool: {0}", settings);
    return Objects.requireNonNull(factory.create(settings), "factory returned null DataSource");
  }

  private void retire(final DataSource previous) {
    if (retired != null) retired.closeNow();
    retired = null;
    if (gracePeriod.isZero()) {
      closeDataSource(previous);
      return;
    }
    final var retirement = new Retirement(previous);
    CompletableFuture.runAsync(
        () -> {
          try {
            Thread.sleep(gracePeriod.toMillis());
            if (retirement.closeNow())
              logger.log(INFO, "Closed replaced connection pool after grace period");
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
          }
        });
    retired = retirement;
  }

  private void closeDataSource(final DataSource ds) {
    if (ds instanceof AutoCloseable ac) {
      try {
        ac.close();
      } catch (final Exception e) {
        logger.log(WARNING, "Failed to close DataSource", e);
      }
    }
  }

  /** A replaced pool waiting out its grace period; closed exactly once. */
  private final class Retirement {
    private final DataSource dataSource;
    private final AtomicBoolean closed = new AtomicBoolean();

    Retirement(final DataSource dataSource) {
      this.dataSource = dataSource;
    }

    boolean closeNow() {
      if (!closed.compareAndSet(false, true)) return false;
      closeDataSource(dataSource);
      return true;
    }
  }
}
