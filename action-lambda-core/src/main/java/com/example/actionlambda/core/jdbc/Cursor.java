package com.example.actionlambda.core.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Buffered, map-returning cursor over a JDBC {@link Connection}.
 *
 * <p>Each {@code execute} prepares a statement, binds every parameter positionally and reads the
 * whole result into memory, so the statement is closed before the call returns. Rows are then
 * consumed with {@link #fetchOne()} / {@link #fetchAll()} as column-label keyed maps.
 *
 * <pre>{@code
 * try (var guard = pool.connection(); var cursor = guard.cursor()) {
 *   cursor.execute("SELECT * FROM SITE_MASTER WHERE SITE_MASTER_ID = ?", List.of(id));
 *   Optional<Map<String, Object>> row = cursor.fetchOne();
 * }
 * }</pre>
 *
 * <p>Closing a cursor discards buffered rows; it never closes the connection, which stays owned
 * by its {@link ConnectionGuard}. Instances are not thread-safe.
 */
public final class Cursor implements AutoCloseable {

  private final Connection connection;

  private List<Map<String, Object>> rows = List.of();
  private int position;
  private int rowCount = -1;
  private boolean closed;

  Cursor(final Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  /**
   * Executes one parameterized statement.
   *
   * @param sql statement with {@code ?} placeholders
   * @param params positional parameters, may be empty
   * @return rows returned by a query, or the update count for DML
   * @throws SQLException on driver errors
   */
  public int execute(final String sql, final List<?> params) throws SQLException {
    ensureOpen();
    try (final var stmt = connection.prepareStatement(sql)) {
      bind(stmt, params);
      if (stmt.execute()) {
        try (final var rs = stmt.getResultSet()) {
          reset(readRows(rs));
        }
        rowCount = rows.size();
      } else {
        reset(List.of());
        rowCount = stmt.getUpdateCount();
      }
      return rowCount;
    }
  }

  /**
   * Executes the same statement once per parameter row as a JDBC batch.
   *
   * @param sql statement with {@code ?} placeholders
   * @param paramRows one parameter list per execution
   * @return total affected rows reported by the driver
   * @throws SQLException on driver errors
   */
  public int executeMany(final String sql, final List<? extends List<?>> paramRows)
      throws SQLException {
    ensureOpen();
    reset(List.of());
    if (paramRows.isEmpty()) {
      rowCount = 0;
      return rowCount;
    }
    try (final var stmt = connection.prepareStatement(sql)) {
      for (final var params : paramRows) {
        bind(stmt, params);
        stmt.addBatch();
      }
      var total = 0;
      for (final var count : stmt.executeBatch()) if (count > 0) total += count;
      rowCount = total;
      return rowCount;
    }
  }

  /**
   * Next buffered row.
   *
   * @return the row, or empty when the result is exhausted or the last statement was not a query
   */
  public Optional<Map<String, Object>> fetchOne() {
    ensureOpen();
    if (position >= rows.size()) return Optional.empty();
    return Optional.of(rows.get(position++));
  }

  /**
   * All remaining buffered rows.
   *
   * @return remaining rows, possibly empty
   */
  public List<Map<String, Object>> fetchAll() {
    ensureOpen();
    final var remaining = rows.subList(position, rows.size());
    position = rows.size();
    return List.copyOf(remaining);
  }

  /**
   * Row count of the last statement, {@code -1} before anything ran.
   *
   * @return row count
   */
  public int rowCount() {
    return rowCount;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
    rows = List.of();
  }

  private void ensureOpen() {
    if (closed) throw new IllegalStateException("Cursor is closed");
  }

  private void reset(final List<Map<String, Object>> newRows) {
    rows = newRows;
    position = 0;
  }

  private static void bind(final PreparedStatement stmt, final List<?> params)
      throws SQLException {
    if (params == null) return;
    for (var i = 0; i < params.size(); i++) stmt.setObject(i + 1, params.get(i));
  }

  private static List<Map<String, Object>> readRows(final ResultSet rs) throws SQLException {
    final var meta = rs.getMetaData();
    final var columns = meta.getColumnCount();
    final var result = new ArrayList<Map<String, Object>>();
    while (rs.next()) {
      final var row = new LinkedHashMap<String, Object>(columns * 2);
      for (var i = 1; i <= columns; i++) row.put(meta.getColumnLabel(i), rs.getObject(i));
      result.add(Collections.unmodifiableMap(row));
    }
    return result;
  }
}
