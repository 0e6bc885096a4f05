package com.example.actionlambda.handler;

import java.util.Map;
import java.util.Optional;

/**
 * Fields read from the invocation event.
 *
 * @param action raw {@code action} value
 * @param stackName {@code stack_name}, may be null
 * @param siteMasterId {@code site_master_id}, may be null
 */
public record ActionRequest(String action, String stackName, String siteMasterId) {

  public static final String ACTION = "action";
  public static final String STACK_NAME = "stack_name";
  public static final String SITE_MASTER_ID = "site_master_id";

  /**
   * Extracts the request fields from a raw event.
   *
   * @param event Lambda event, may be null
   * @return parsed request
   */
  public static ActionRequest from(final Map<String, Object> event) {
    final Map<String, Object> fields = event == null ? Map.of() : event;
    return new ActionRequest(
        text(fields.get(ACTION)), text(fields.get(STACK_NAME)), text(fields.get(SITE_MASTER_ID)));
  }

  public Optional<String> stackNameIfPresent() {
    return Optional.ofNullable(stackName).filter(name -> !name.isBlank());
  }

  public Optional<String> siteMasterIdIfPresent() {
    return Optional.ofNullable(siteMasterId).filter(id -> !id.isBlank());
  }

  private static String text(final Object value) {
    return value == null ? null : value.toString();
  }
}
