package com.example.actionlambda.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;

import com.example.actionlambda.core.secrets.SecretHelper;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class PoolSettingsTest {

  private Map<String, String> env;

  @BeforeEach
  void setUp() {
    env = new HashMap<>();
    env.put("DB_HOST", "db.internal");
    env.put("DB_PORT", "3306");
    env.put("DB_USER", "app");
    env.put("DB_PASSWORD", "s3cret");
    env.put("DB_NAME", "tenants");
  }

  @AfterEach
  void cleanup() {
    SecretHelper.setSecretSource(null);
  }

  @Nested
  @DisplayName("Environment variables")
  class EnvironmentVariables {

    @Test
    @DisplayName("Should read connection values and apply fixed pool sizing")
    void shouldReadValues() {
      final var settings = PoolSettings.from(env::get);

      assertEquals("db.internal", settings.host());
      assertEquals(3306, settings.port());
      assertEquals("app", settings.user());
      assertEquals("s3cret", settings.password());
      assertEquals("tenants", settings.database());
      assertEquals("utf8mb4", settings.charset());
      assertEquals(20, settings.maxConnections());
      assertEquals(5, settings.minIdle());
      assertEquals(10, settings.maxIdle());
      assertTrue(settings.blockWhenExhausted());
      assertFalse(settings.pingOnBorrow());
      assertTrue(settings.multiStatements());
    }

    @Test
    @DisplayName("Should name the missing key")
    void shouldNameMissingKey() {
      env.remove("DB_HOST");

      final var thrown = assertThrows(IllegalStateException.class, () -> PoolSettings.from(env::get));
      assertEquals("DB_HOST is not set", thrown.getMessage());
    }

    @Test
    @DisplayName("Should treat a blank value as missing")
    void shouldTreatBlankAsMissing() {
      env.put("DB_PASSWORD", "  ");

      final var thrown = assertThrows(IllegalStateException.class, () -> PoolSettings.from(env::get));
      assertTrue(thrown.getMessage().contains("DB_PASSWORD"));
    }

    @Test
    @DisplayName("Should reject a non-numeric port")
    void shouldRejectBadPort() {
      env.put("DB_PORT", "mysql");

      final var thrown = assertThrows(IllegalStateException.class, () -> PoolSettings.from(env::get));
      assertTrue(thrown.getMessage().startsWith("DB_PORT must be an integer"));
      assertInstanceOf(NumberFormatException.class, thrown.getCause());
    }

    @Test
    @DisplayName("Should prefer system properties over the environment")
    void shouldPreferSystemProperty() {
      System.setProperty("db.host", "from-property");
      try {
        assertEquals("from-property", PoolSettings.lookup("DB_HOST"));
      } finally {
        System.clearProperty("db.host");
      }
    }
  }

  @Nested
  @DisplayName("Secrets Manager")
  class SecretsManager {

    @Test
    @DisplayName("Should take credentials from the secret when DB_SECRET_ID is set")
    void shouldReadSecret() {
      env.clear();
      env.put("DB_SECRET_ID", "prod/db");
      SecretHelper.setSecretSource(
          id -> {
            assertEquals("prod/db", id);
            return """
                {"username":"svc","password":"pw","engine":"mysql","host":"rds.local","port":3307,"dbname":"main"}
                """;
          });

      final var settings = PoolSettings.from(env::get);

      assertEquals("rds.local", settings.host());
      assertEquals(3307, settings.port());
      assertEquals("svc", settings.user());
      assertEquals("pw", settings.password());
      assertEquals("main", settings.database());
    }

    @Test
    @DisplayName("Should fall back to DB_NAME when the secret has no database name")
    void shouldFallBackToDbName() {
      env.put("DB_SECRET_ID", "prod/db");
      SecretHelper.setSecretSource(
          id ->
              """
              {"username":"svc","password":"pw","engine":"mysql","host":"rds.local","port":3306}
              """);

      assertEquals("tenants", PoolSettings.from(env::get).database());
    }
  }

  @Nested
  @DisplayName("Validation and rendering")
  class Validation {

    @Test
    @DisplayName("Should build the MySQL JDBC URL")
    void shouldBuildJdbcUrl() {
      final var settings = PoolSettings.of("db", 3306, "app", "pw", "tenants");

      assertEquals("jdbc:mysql://db:3306/tenants", settings.jdbcUrl());
      assertEquals("UTF-8", settings.javaEncoding());
    }

    @Test
    @DisplayName("Should mask the password")
    void shouldMaskPassword() {
      final var rendered = PoolSettings.of("db", 3306, "app", "hunter2", "tenants").toString();

      assertFalse(rendered.contains("hunter2"));
      assertTrue(rendered.contains("password=****"));
    }

    @Test
    @DisplayName("Should reject inconsistent pool sizing")
    void shouldRejectBadSizing() {
      assertThrows(
          IllegalArgumentException.class,
          () -> new PoolSettings("db", 3306, "u", "p", "d", "utf8mb4", 0, 0, 0, true, false, true));
      assertThrows(
          IllegalArgumentException.class,
          () -> new PoolSettings("db", 3306, "u", "p", "d", "utf8mb4", 20, 5, 4, true, false, true));
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new PoolSettings("db", 3306, "u", "p", "d", "utf8mb4", 10, 5, 11, true, false, true));
      assertThrows(IllegalArgumentException.class, () -> PoolSettings.of("db", 0, "u", "p", "d"));
      assertThrows(IllegalArgumentException.class, () -> PoolSettings.of(" ", 3306, "u", "p", "d"));
    }
  }
}
