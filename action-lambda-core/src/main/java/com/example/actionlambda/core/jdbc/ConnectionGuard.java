package com.example.actionlambda.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped owner of one pooled {@link Connection}.
 *
 * <p>Meant for try-with-resources: whichever way the block exits, {@link #close()} hands the
 * connection back to the pool exactly once. Later {@code close()} calls do nothing.
 *
 * <pre>{@code
 * try (var guard = poolManager.connection(); var cursor = guard.cursor()) {
 *   executor.execute(cursor, "UPDATE t SET a = ? WHERE id = ?", List.of(1, 42));
 * }
 * }</pre>
 */
public final class ConnectionGuard implements AutoCloseable {

  private static final System.Logger logger = System.getLogger(ConnectionGuard.class.getName());

  private final Connection connection;
  private final AtomicBoolean released = new AtomicBoolean(false);

  public ConnectionGuard(final Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  /**
   * The guarded connection.
   *
   * @return borrowed connection
   * @throws IllegalStateException if the guard was already closed
   */
  public Connection connection() {
    if (released.get()) throw new IllegalStateException("Connection already released");
    return connection;
  }

  /**
   * Opens a cursor on the guarded connection.
   *
   * @return new cursor
   */
  public Cursor cursor() {
    return new Cursor(connection());
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (!released.compareAndSet(false, true)) {
      logger.log(DEBUG, "Connection already released, skipping");
      return;
    }
    try {
      connection.close();
    } catch (final SQLException e) {
      logger.log(WARNING, "Failed to release connection", e);
    }
  }
}
