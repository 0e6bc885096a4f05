package com.example.actionlambda.handler;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Operations the handler can perform on a tenant stack. */
public enum Action {
  DEPLOY("deploy"),
  DESTROY("destroy");

  private final String value;

  Action(final String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Parses the {@code action} event field, ignoring case.
   *
   * @param raw field value, may be null
   * @return the action, or empty if unknown
   */
  public static Optional<Action> parse(final String raw) {
    if (raw == null) return Optional.empty();
    final var normalized = raw.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(a -> a.value.equals(normalized)).findFirst();
  }
}
