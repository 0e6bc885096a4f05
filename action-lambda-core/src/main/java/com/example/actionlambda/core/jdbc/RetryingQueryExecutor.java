package com.example.actionlambda.core.jdbc;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;

import com.example.actionlambda.core.error.ClassifiedException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs units of work against a {@link Cursor}, retrying lock wait timeouts and deadlocks with
 * exponential backoff and classifying every other driver failure.
 *
 * <p>Outcomes of {@link #retryQuery(Cursor, SqlWork)}:
 *
 * <ul>
 *   <li>the work succeeds: its result is returned, no backoff happens
 *   <li>{@link SQLException} with a retryable vendor code: retried until {@link
 *       RetrySettings#maxAttempts()} tries were made, then {@link ClassifiedException#databaseLock}
 *   <li>{@link SQLException} with any other code: {@link ClassifiedException#database} right away
 *   <li>any {@link RuntimeException}: rethrown unchanged
 * </ul>
 *
 * <pre>{@code
 * var executor = new RetryingQueryExecutor(RetrySettings.defaults());
 * try (var guard = pool.connection(); var cursor = guard.cursor()) {
 *   int updated = executor.execute(cursor, "UPDATE SITE_MASTER SET STATUS = ? WHERE SITE_MASTER_ID = ?",
 *       List.of("ACTIVE", siteId));
 * }
 * }</pre>
 */
public final class RetryingQueryExecutor {

  private static final System.Logger logger =
      System.getLogger(RetryingQueryExecutor.class.getName());

  private final RetrySettings settings;
  private final Backoff backoff;

  /** Executor with {@link RetrySettings#defaults()}. */
  public RetryingQueryExecutor() {
    this(RetrySettings.defaults());
  }

  public RetryingQueryExecutor(final RetrySettings settings) {
    this(settings, new Backoff(settings.baseDelaySeconds()));
  }

  /**
   * Executor with an explicit backoff, mainly for tests.
   *
   * @param settings retry configuration
   * @param backoff backoff applied between attempts
   */
  public RetryingQueryExecutor(final RetrySettings settings, final Backoff backoff) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
  }

  /**
   * Executes the unit of work with retry on lock contention.
   *
   * @param cursor cursor handed to the work
   * @param work unit of work, usually a single statement
   * @param <T> result type
   * @return work result
   * @throws ClassifiedException on database failures
   */
  public <T> T retryQuery(final Cursor cursor, final SqlWork<T> work) {
    var attempt = 0;
    while (true) {
      final SQLException failure;
      try {
        return work.run(cursor);
      } catch (final SQLException e) {
        failure = e;
      } catch (final RuntimeException e) {
        logger.log(ERROR, "Unexpected error: {0}", e.toString());
        throw e;
      }

      logger.log(ERROR, "Database error: {0}", describe(failure));
      final var failureClass = classify(failure);
      if (failureClass == FailureClass.LOCK_CONTENTION) attempt++;

      switch (decide(failureClass, attempt)) {
        case RETRY -> {
          logger.log(
              WARNING,
              "Retryable error (code={0}). Retrying ({1}/{2})...",
              failure.getErrorCode(),
              attempt,
              settings.maxAttempts() - 1);
          pause(attempt, failure);
        }
        case GIVE_UP -> {
          logger.log(ERROR, "Max retries exceeded. Error: {0}", describe(failure));
          throw ClassifiedException.databaseLock(describe(failure), failure);
        }
        case FAIL -> {
          logger.log(ERROR, "Non-retryable error: {0}", describe(failure));
          throw ClassifiedException.database(describe(failure), failure);
        }
      }
    }
  }

  /**
   * Executes one parameterized statement.
   *
   * @param cursor cursor to execute on
   * @param sql statement with {@code ?} placeholders
   * @param params positional parameters
   * @return affected (or returned) row count
   * @throws ClassifiedException on database failures
   */
  public int execute(final Cursor cursor, final String sql, final List<?> params) {
    final List<?> bound = params == null ? List.of() : params;
    return retryQuery(cursor, c -> c.execute(sql, bound));
  }

  /**
   * Executes a statement once per parameter row as a batch.
   *
   * @param cursor cursor to execute on
   * @param sql statement with {@code ?} placeholders
   * @param paramRows one parameter list per execution
   * @return total affected row count
   * @throws ClassifiedException on database failures
   */
  public int executeMany(
      final Cursor cursor, final String sql, final List<? extends List<?>> paramRows) {
    final List<? extends List<?>> rows = paramRows == null ? List.of() : paramRows;
    return retryQuery(cursor, c -> c.executeMany(sql, rows));
  }

  /**
   * Single entry point choosing between {@link #execute(Cursor, String, List)} and {@link
   * #executeMany(Cursor, String, List)}. With {@code executeMany} every element of {@code params}
   * must itself be a parameter list.
   *
   * @param cursor cursor to execute on
   * @param sql statement with {@code ?} placeholders
   * @param params parameters, or parameter rows when {@code executeMany}
   * @param executeMany whether to run as a batch
   * @return affected row count
   * @throws ClassifiedException on database failures
   */
  public int execute(
      final Cursor cursor, final String sql, final List<?> params, final boolean executeMany) {
    if (!executeMany) return execute(cursor, sql, params);

    final var rows = new ArrayList<List<?>>();
    if (params != null) {
      for (final var row : params) {
        if (!(row instanceof List<?> list))
          throw new IllegalArgumentException("executeMany expects a list of parameter lists");
        rows.add(list);
      }
    }
    return executeMany(cursor, sql, rows);
  }

  public RetrySettings settings() {
    return settings;
  }

  /**
   * Classifies a driver failure by its vendor error code.
   *
   * @param e driver failure
   * @return classification
   */
  FailureClass classify(final SQLException e) {
    return settings.retryableErrorCodes().contains(e.getErrorCode())
        ? FailureClass.LOCK_CONTENTION
        : FailureClass.OTHER;
  }

  /**
   * Decides what to do after a classified failure.
   *
   * @param failureClass classification of the failure
   * @param attempt lock-contention failures seen so far, including this one
   * @return next step
   */
  Decision decide(final FailureClass failureClass, final int attempt) {
    if (failureClass != FailureClass.LOCK_CONTENTION) return Decision.FAIL;
    return attempt < settings.maxAttempts() ? Decision.RETRY : Decision.GIVE_UP;
  }

  private void pause(final int attempt, final SQLException failure) {
    try {
      backoff.await(attempt);
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw ClassifiedException.databaseLock(
          "Interrupted while backing off: " + describe(failure), failure);
    }
  }

  private static String describe(final SQLException e) {
    return "(%d, %s)".formatted(e.getErrorCode(), e.getMessage());
  }

  /** Classification of a driver failure. */
  enum FailureClass {
    /** Lock wait timeout or deadlock; worth another try. */
    LOCK_CONTENTION,
    OTHER
  }

  /** Step taken after a failed attempt. */
  enum Decision {
    RETRY,
    /** Lock contention outlived every attempt. */
    GIVE_UP,
    FAIL
  }
}
