package com.example.actionlambda.core.jdbc;

import com.example.actionlambda.core.secrets.SecretHelper;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Connection pool configuration.
 *
 * <p>{@link #fromEnvironment()} resolves each key from a system property first and an environment
 * variable second:
 *
 * <ul>
 *   <li>db.host / DB_HOST
 *   <li>db.port / DB_PORT
 *   <li>db.user / DB_USER
 *   <li>db.password / DB_PASSWORD
 *   <li>db.name / DB_NAME
 *   <li>db.secret.id / DB_SECRET_ID (optional; when set, host, port, user, password and, if
 *       present, the database name are read from that AWS Secrets Manager secret instead)
 * </ul>
 *
 * <p>Pool sizing is fixed: 20 connections at most, 5 to 10 kept idle, callers block when the pool
 * is exhausted, no validation query on borrow, {@code utf8mb4} and multi-statement execution.
 *
 * @param host database host
 * @param port database port
 * @param user database user
 * @param password database password
 * @param database schema name
 * @param charset MySQL character set
 * @param maxConnections upper bound of open connections
 * @param minIdle idle connections kept warm
 * @param maxIdle idle connections retained for reuse; informational only, HikariCP has no idle
 *     upper bound and retires idle connections above {@code minIdle} after its idle timeout
 * @param blockWhenExhausted whether borrowers wait (true) or fail fast when the pool is saturated
 * @param pingOnBorrow whether to validate connections when they are borrowed; informational only,
 *     HikariCP does not expose this switch
 * @param multiStatements whether a single execute may carry several statements
 */
public record PoolSettings(
    String host,
    int port,
    String user,
    String password,
    String database,
    String charset,
    int maxConnections,
    int minIdle,
    int maxIdle,
    boolean blockWhenExhausted,
    boolean pingOnBorrow,
    boolean multiStatements) {

  public static final String DB_HOST = "DB_HOST";
  public static final String DB_PORT = "DB_PORT";
  public static final String DB_USER = "DB_USER";
  public static final String DB_PASSWORD = "DB_PASSWORD";
  public static final String DB_NAME = "DB_NAME";
  public static final String DB_SECRET_ID = "DB_SECRET_ID";

  public static final String DEFAULT_CHARSET = "utf8mb4";
  public static final int DEFAULT_MAX_CONNECTIONS = 20;
  public static final int DEFAULT_MIN_IDLE = 5;
  public static final int DEFAULT_MAX_IDLE = 10;

  public PoolSettings {
    if (host == null || host.isBlank()) throw new IllegalArgumentException("host is required");
    if (port < 1 || port > 65_535)
      throw new IllegalArgumentException("port must be between 1 and 65535");
    if (maxConnections < 1) throw new IllegalArgumentException("maxConnections must be >= 1");
    if (minIdle < 0) throw new IllegalArgumentException("minIdle must be >= 0");
    if (maxIdle < minIdle) throw new IllegalArgumentException("maxIdle must be >= minIdle");
    if (maxIdle > maxConnections)
      throw new IllegalArgumentException("maxIdle must be <= maxConnections");
  }

  /**
   * Settings with the fixed pool parameters and the given credentials.
   *
   * @param host database host
   * @param port database port
   * @param user database user
   * @param password database password
   * @param database schema name
   * @return pool settings
   */
  public static PoolSettings of(
      final String host,
      final int port,
      final String user,
      final String password,
      final String database) {
    return new PoolSettings(
        host,
        port,
        user,
        password,
        database,
        DEFAULT_CHARSET,
        DEFAULT_MAX_CONNECTIONS,
        DEFAULT_MIN_IDLE,
        DEFAULT_MAX_IDLE,
        true,
        false,
        true);
  }

  /**
   * Reads settings from system properties and environment variables.
   *
   * @return pool settings
   * @throws IllegalStateException if a required key is missing or malformed
   */
  public static PoolSettings fromEnvironment() {
    return from(PoolSettings::lookup);
  }

  /**
   * Reads settings through the given key lookup (environment variable names as keys).
   *
   * @param env key lookup returning null for absent keys
   * @return pool settings
   * @throws IllegalStateException if a required key is missing or malformed
   */
  public static PoolSettings from(final Function<String, String> env) {
    final var secretId = optional(env, DB_SECRET_ID);
    if (secretId.isPresent()) {
      final var secret = SecretHelper.getDbSecret(secretId.get());
      final var database =
          Optional.ofNullable(secret.dbname())
              .filter(name -> !name.isBlank())
              .orElseGet(() -> required(env, DB_NAME));
      return of(secret.host(), secret.port(), secret.username(), secret.password(), database);
    }

    final var port = required(env, DB_PORT);
    try {
      return of(
          required(env, DB_HOST),
          Integer.parseInt(port.trim()),
          required(env, DB_USER),
          required(env, DB_PASSWORD),
          required(env, DB_NAME));
    } catch (final NumberFormatException e) {
      throw new IllegalStateException(DB_PORT + " must be an integer, got: " + port, e);
    }
  }

  /**
   * JDBC URL for MySQL Connector/J.
   *
   * @return JDBC URL
   */
  public String jdbcUrl() {
    return "jdbc:mysql://%s:%d/%s".formatted(host, port, database == null ? "" : database);
  }

  /**
   * Java encoding name Connector/J expects for {@link #charset()}.
   *
   * @return Java charset name
   */
  public String javaEncoding() {
    final var lower = charset == null ? DEFAULT_CHARSET : charset.toLowerCase(Locale.ROOT);
    return switch (lower) {
      case "utf8mb4", "utf8", "utf8mb3" -> "UTF-8";
      case "latin1" -> "ISO-8859-1";
      default -> charset;
    };
  }

  @Override
  public String toString() {
    return "PoolSettings[host=%s, port=%d, user=%s, password=****, database=%s, charset=%s, maxConnections=%d, minIdle=%d, maxIdle=%d, blockWhenExhausted=%s, pingOnBorrow=%s, multiStatements=%s]"
        .formatted(
            host,
            port,
            user,
            database,
            charset,
            maxConnections,
            minIdle,
            maxIdle,
            blockWhenExhausted,
            pingOnBorrow,
            multiStatements);
  }

  static String lookup(final String key) {
    final var property = key.toLowerCase(Locale.ROOT).replace('_', '.');
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(key)))
        .orElse(null);
  }

  private static Optional<String> optional(final Function<String, String> env, final String key) {
    return Optional.ofNullable(env.apply(key)).filter(value -> !value.isBlank());
  }

  private static String required(final Function<String, String> env, final String key) {
    return optional(env, key)
        .orElseThrow(() -> new IllegalStateException(key + " is not set"));
  }
}
