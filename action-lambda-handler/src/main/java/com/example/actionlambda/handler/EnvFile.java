package com.example.actionlambda.handler;

import java.util.Map;
import java.util.TreeMap;

/** Renders a site master row as a dotenv file, one {@code KEY=VALUE} line per non-null column. */
final class EnvFile {

  private EnvFile() {}

  /**
   * Renders the row with keys in sorted order. Values containing whitespace, quotes, {@code #} or
   * backslashes are double-quoted and escaped.
   *
   * @param row column name to value
   * @return env file contents, newline terminated
   */
  static String render(final Map<String, Object> row) {
    final var out = new StringBuilder();
    for (final var entry : new TreeMap<>(row).entrySet()) {
      if (entry.getValue() == null) continue;
      out.append(entry.getKey()).append('=').append(quote(entry.getValue().toString())).append('\n');
    }
    return out.toString();
  }

  private static String quote(final String value) {
    if (!needsQuoting(value)) return value;
    final var escaped =
        value
            .replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r");
    return '"' + escaped + '"';
  }

  private static boolean needsQuoting(final String value) {
    for (var i = 0; i < value.length(); i++) {
      final var c = value.charAt(i);
      if (Character.isWhitespace(c) || c == '"' || c == '\'' || c == '#' || c == '\\') return true;
    }
    return false;
  }
}
