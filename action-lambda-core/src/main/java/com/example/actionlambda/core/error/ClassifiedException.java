package com.example.actionlambda.core.error;

import java.util.Objects;

/**
 * Failure tagged with an {@link ErrorKind} and the {@link ErrorPolicy} consumers should apply.
 *
 * <p>Variants are produced by the named factories rather than by subclassing, so the flag
 * combination for each variant is fixed in exactly one place:
 *
 * <ul>
 *   <li>{@link #of(String)} / {@link #of(String, ErrorPolicy)}: general failure, default flags
 *       unless overridden
 *   <li>{@link #database(String, Throwable)}: database failure the caller may retry
 *   <li>{@link #databaseLock(String, Throwable)}: lock wait timeout or deadlock after internal
 *       retries were exhausted; the caller must not retry again
 * </ul>
 *
 * <pre>{@code
 * try {
 *   repository.getById(siteId);
 * } catch (ClassifiedException e) {
 *   if (e.policy().sendToDeadLetter()) deadLetterQueue.send(payload);
 *   if (e.policy().sendAlert()) alerts.notify(e.getMessage());
 * }
 * }</pre>
 */
public final class ClassifiedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private static final ErrorPolicy DATABASE_POLICY = new ErrorPolicy(true, true, true, true);
  private static final ErrorPolicy DATABASE_LOCK_POLICY = new ErrorPolicy(false, true, true, true);

  private final ErrorKind kind;
  private final ErrorPolicy policy;

  private ClassifiedException(
      final ErrorKind kind, final ErrorPolicy policy, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  /**
   * General failure with {@link ErrorPolicy#defaults()}.
   *
   * @param message description of the failure
   * @return classified exception
   */
  public static ClassifiedException of(final String message) {
    return of(message, ErrorPolicy.defaults());
  }

  /**
   * General failure with caller-chosen flags.
   *
   * @param message description of the failure
   * @param policy flags to attach
   * @return classified exception
   */
  public static ClassifiedException of(final String message, final ErrorPolicy policy) {
    return new ClassifiedException(ErrorKind.GENERAL, policy, message, null);
  }

  /**
   * Database failure the caller may retry.
   *
   * @param message description of the failure
   * @param cause driver exception, may be null
   * @return classified exception
   */
  public static ClassifiedException database(final String message, final Throwable cause) {
    return database(message, cause, true);
  }

  /**
   * Database failure with an explicit caller-retry flag; the remaining flags are always set.
   *
   * @param message description of the failure
   * @param cause driver exception, may be null
   * @param retry whether the caller may retry
   * @return classified exception
   */
  public static ClassifiedException database(
      final String message, final Throwable cause, final boolean retry) {
    return new ClassifiedException(
        ErrorKind.DATABASE, DATABASE_POLICY.withRetry(retry), message, cause);
  }

  /**
   * Lock wait timeout or deadlock that outlived every internal retry attempt.
   *
   * @param message description of the failure
   * @param cause last driver exception, may be null
   * @return classified exception
   */
  public static ClassifiedException databaseLock(final String message, final Throwable cause) {
    return new ClassifiedException(ErrorKind.DATABASE_LOCK, DATABASE_LOCK_POLICY, message, cause);
  }

  public ErrorKind kind() {
    return kind;
  }

  public ErrorPolicy policy() {
    return policy;
  }
}
