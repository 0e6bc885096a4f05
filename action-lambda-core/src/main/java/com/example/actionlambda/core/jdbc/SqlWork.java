package com.example.actionlambda.core.jdbc;

import java.sql.SQLException;

/**
 * Unit of work executed against a {@link Cursor}, typically a single statement or batch.
 *
 * <pre>{@code
 * SqlWork<Integer> insert = cursor -> cursor.execute("INSERT INTO t (a) VALUES (?)", List.of(1));
 * }</pre>
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface SqlWork<T> {

  /**
   * Runs the work.
   *
   * @param cursor open cursor
   * @return work result
   * @throws SQLException on driver errors
   */
  T run(final Cursor cursor) throws SQLException;
}
