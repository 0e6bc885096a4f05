package com.example.actionlambda.core.jdbc;

import java.util.Set;

/**
 * Retry configuration for {@link RetryingQueryExecutor}.
 *
 * <p>MySQL error codes retried by default:
 *
 * <ul>
 *   <li>{@code 1205}: lock wait timeout exceeded
 *   <li>{@code 1213}: deadlock found when trying to get lock
 * </ul>
 *
 * @param maxAttempts total attempts (first + retries), must be ≥ 1
 * @param baseDelaySeconds base of the exponential backoff, delay for attempt n is {@code
 *     base^n} seconds, must be &gt; 0
 * @param retryableErrorCodes vendor error codes that trigger a retry
 */
public record RetrySettings(
    int maxAttempts, double baseDelaySeconds, Set<Integer> retryableErrorCodes) {

  public static final int LOCK_WAIT_TIMEOUT = 1205;
  public static final int DEADLOCK = 1213;

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final double DEFAULT_BASE_DELAY_SECONDS = 0.1;

  public RetrySettings {
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    if (!(baseDelaySeconds > 0.0))
      throw new IllegalArgumentException("baseDelaySeconds must be > 0");
    if (retryableErrorCodes == null)
      throw new IllegalArgumentException("retryableErrorCodes cannot be null");
    retryableErrorCodes = Set.copyOf(retryableErrorCodes);
  }

  /**
   * Three attempts, 0.1 second backoff base, lock wait timeout and deadlock retried.
   *
   * @return default settings
   */
  public static RetrySettings defaults() {
    return new RetrySettings(
        DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY_SECONDS, Set.of(LOCK_WAIT_TIMEOUT, DEADLOCK));
  }

  /**
   * Copy of these settings with a different attempt limit.
   *
   * @param maxAttempts total attempts, must be ≥ 1
   * @return adjusted settings
   */
  public RetrySettings withMaxAttempts(final int maxAttempts) {
    return new RetrySettings(maxAttempts, baseDelaySeconds, retryableErrorCodes);
  }
}
