package com.example.actionlambda.core.jdbc;

import static java.lang.System.Logger.Level.INFO;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Exponential backoff between retry attempts: attempt {@code n} waits {@code base^n} seconds.
 *
 * <p>With the default base of {@code 0.1} the first retry waits 100ms and the second 10ms, i.e.
 * the wait shrinks as {@code n} grows. A base above {@code 1.0} produces the usual growing delay.
 */
public final class Backoff {

  private static final System.Logger logger = System.getLogger(Backoff.class.getName());

  private final double baseDelaySeconds;
  private final Sleeper sleeper;

  /**
   * Backoff that blocks the calling thread.
   *
   * @param baseDelaySeconds base of the exponent, must be &gt; 0
   */
  public Backoff(final double baseDelaySeconds) {
    this(baseDelaySeconds, Sleeper.threadSleeper());
  }

  /**
   * Backoff with a custom sleeper, mainly for tests.
   *
   * @param baseDelaySeconds base of the exponent, must be &gt; 0
   * @param sleeper strategy used to wait
   */
  public Backoff(final double baseDelaySeconds, final Sleeper sleeper) {
    if (!(baseDelaySeconds > 0.0))
      throw new IllegalArgumentException("baseDelaySeconds must be > 0");
    if (sleeper == null) throw new IllegalArgumentException("sleeper cannot be null");
    this.baseDelaySeconds = baseDelaySeconds;
    this.sleeper = sleeper;
  }

  /**
   * Computes the delay for an attempt.
   *
   * @param attempt attempt number (1-based)
   * @return {@code base^attempt} seconds
   */
  public Duration delay(final int attempt) {
    if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
    final var seconds = Math.pow(baseDelaySeconds, attempt);
    return Duration.ofNanos(Math.round(seconds * TimeUnit.SECONDS.toNanos(1)));
  }

  /**
   * Blocks the calling thread for {@link #delay(int)}.
   *
   * @param attempt attempt number (1-based)
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  public void await(final int attempt) throws InterruptedException {
    final var delay = delay(attempt);
    logger.log(INFO, "Retrying in {0} ms...", delay.toNanos() / 1_000_000.0);
    sleeper.sleep(delay);
  }

  public double baseDelaySeconds() {
    return baseDelaySeconds;
  }

  /** Waiting strategy used by {@link Backoff}. */
  @FunctionalInterface
  public interface Sleeper {

    /**
     * Sleeper backed by {@link TimeUnit#sleep(long)}.
     *
     * @return blocking sleeper
     */
    static Sleeper threadSleeper() {
      return duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }

    /**
     * Waits for the given duration.
     *
     * @param duration how long to wait
     * @throws InterruptedException if interrupted while waiting
     */
    void sleep(final Duration duration) throws InterruptedException;
  }
}
