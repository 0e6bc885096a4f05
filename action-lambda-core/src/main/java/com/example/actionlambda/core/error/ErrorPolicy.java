package com.example.actionlambda.core.error;

/**
 * Operational policy attached to a classified failure.
 *
 * <p>The flags are advisory: this library never acts on them. Consumers read them to decide
 * whether to retry the failed request, page an operator, park the payload on a dead-letter queue
 * or write an entry to the API error history.
 *
 * @param retry whether the caller may retry the whole operation
 * @param sendAlert whether an operator should be notified (email/page)
 * @param sendToDeadLetter whether the failed unit of work should be routed to the dead-letter
 *     queue
 * @param recordInHistory whether the failure should be inserted into the API error history
 */
public record ErrorPolicy(
    boolean retry, boolean sendAlert, boolean sendToDeadLetter, boolean recordInHistory) {

  private static final ErrorPolicy DEFAULTS = new ErrorPolicy(false, true, true, true);

  /**
   * Policy used when nothing more specific is known: no caller retry, everything else enabled.
   *
   * @return default policy
   */
  public static ErrorPolicy defaults() {
    return DEFAULTS;
  }

  /**
   * Copy of this policy with a different caller-retry flag.
   *
   * @param retry new caller-retry flag
   * @return adjusted policy
   */
  public ErrorPolicy withRetry(final boolean retry) {
    return new ErrorPolicy(retry, sendAlert, sendToDeadLetter, recordInHistory);
  }
}
