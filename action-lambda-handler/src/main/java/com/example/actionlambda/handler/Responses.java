package com.example.actionlambda.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builds {@code {statusCode, body}} responses with a JSON body. */
final class Responses {

  static final int SUCCESS = 200;
  static final int BAD_REQUEST = 400;
  static final int NOT_FOUND = 404;
  static final int INTERNAL_SERVER_ERROR = 500;

  static final String STATUS_CODE = "statusCode";
  static final String BODY = "body";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private Responses() {}

  static Map<String, Object> of(final int statusCode, final Map<String, ?> body) {
    final var response = new LinkedHashMap<String, Object>();
    response.put(STATUS_CODE, statusCode);
    response.put(BODY, json(body));
    return response;
  }

  static Map<String, Object> message(final int statusCode, final String message) {
    return of(statusCode, Map.of("message", message));
  }

  private static String json(final Map<String, ?> body) {
    try {
      return MAPPER.writeValueAsString(body);
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize response body", e);
    }
  }
}
