package com.example.actionlambda.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ConnectionPoolManagerTest {

  private static final PoolSettings SETTINGS = PoolSettings.of("db", 3306, "app", "secret", "main");

  private final List<DataSource> created = new ArrayList<>();
  private AtomicInteger settingsReads;

  @BeforeEach
  void setUp() {
    created.clear();
    settingsReads = new AtomicInteger();
  }

  private ConnectionPoolManager manager() {
    return manager(Duration.ZERO);
  }

  private ConnectionPoolManager manager(final Duration gracePeriod) {
    return new ConnectionPoolManager(
        () -> {
          settingsReads.incrementAndGet();
          return SETTINGS;
        },
        settings -> {
          final var ds = closeableDataSource();
          synchronized (created) {
            created.add(ds);
          }
          return ds;
        },
        gracePeriod);
  }

  private static DataSource closeableDataSource() {
    final var ds = mock(DataSource.class, withSettings().extraInterfaces(AutoCloseable.class));
    try {
      when(ds.getConnection()).thenAnswer(inv -> mock(Connection.class));
    } catch (final SQLException e) {
      throw new IllegalStateException(e);
    }
    return ds;
  }

  @Nested
  @DisplayName("Lazy initialization")
  class LazyInitialization {

    @Test
    @DisplayName("Should not build a pool before first use")
    void shouldStayUninitialized() {
      final var manager = manager();

      assertFalse(manager.isInitialized());
      assertEquals(0, settingsReads.get());
    }

    @Test
    @DisplayName("Should build the pool on first borrow and reuse it afterwards")
    void shouldInitializeOnce() throws SQLException {
      final var manager = manager();

      assertNotNull(manager.getConnection());
      assertNotNull(manager.getConnection());

      assertTrue(manager.isInitialized());
      assertEquals(1, created.size());
      verify(created.get(0), times(2)).getConnection();
    }

    @Test
    @DisplayName("Should build exactly one pool under concurrent first use")
    void shouldInitializeOnceConcurrently() throws Exception {
      final var threads = 16;
      final var factoryCalls = new AtomicInteger();
      final var manager =
          new ConnectionPoolManager(
              () -> SETTINGS,
              settings -> {
                factoryCalls.incrementAndGet();
                try {
                  Thread.sleep(50);
                } catch (final InterruptedException e) {
                  Thread.currentThread().interrupt();
                }
                return closeableDataSource();
              });

      final var pool = Executors.newFixedThreadPool(threads);
      try {
        final var start = new CountDownLatch(1);
        final var futures = new ArrayList<Future<Connection>>();
        for (var i = 0; i < threads; i++) {
          futures.add(
              pool.submit(
                  () -> {
                    start.await();
                    return manager.getConnection();
                  }));
        }
        start.countDown();
        for (final var future : futures) assertNotNull(future.get(5, TimeUnit.SECONDS));
      } finally {
        pool.shutdownNow();
      }

      assertEquals(1, factoryCalls.get());
    }

    @Test
    @DisplayName("Should surface settings errors to the borrower")
    void shouldPropagateSettingsErrors() {
      final var manager =
          new ConnectionPoolManager(
              () -> {
                throw new IllegalStateException("DB_HOST is not set");
              },
              settings -> closeableDataSource());

      final var thrown = assertThrows(IllegalStateException.class, manager::getConnection);
      assertEquals("DB_HOST is not set", thrown.getMessage());
      assertFalse(manager.isInitialized());
    }
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("Should replace and close the previous pool on re-initialization")
    void shouldReplacePool() throws Exception {
      final var manager = manager();

      manager.initialize();
      manager.initialize();

      assertEquals(2, created.size());
      verify((AutoCloseable) created.get(0)).close();
      verify((AutoCloseable) created.get(1), never()).close();

      manager.getConnection();
      verify(created.get(1)).getConnection();
    }

    @Test
    @DisplayName("Should keep borrowed connections usable while a replaced pool drains")
    void shouldKeepBorrowedConnectionsAcrossReinitialization() throws Exception {
      final var manager = manager(Duration.ofSeconds(1));
      final var borrowed = manager.getConnection();

      manager.initialize();

      final var oldPool = created.get(0);
      verify((AutoCloseable) oldPool, never()).close();
      verify(borrowed, never()).close();
      verify(borrowed, never()).abort(any());
      assertNotSame(borrowed, manager.getConnection());
      verify(created.get(1)).getConnection();

      verify((AutoCloseable) oldPool, timeout(5_000).times(1)).close();
    }

    @Test
    @DisplayName("Should close a draining pool right away on closeAll")
    void shouldCloseDrainingPoolOnCloseAll() throws Exception {
      final var manager = manager(Duration.ofMinutes(5));
      manager.initialize();
      manager.initialize();

      manager.closeAll();

      verify((AutoCloseable) created.get(0), times(1)).close();
      verify((AutoCloseable) created.get(1), times(1)).close();
    }

    @Test
    @DisplayName("Should reject a negative grace period")
    void shouldRejectNegativeGracePeriod() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new ConnectionPoolManager(
                  () -> SETTINGS, settings -> mock(DataSource.class), Duration.ofSeconds(-1)));
    }

    @Test
    @DisplayName("Should borrow from a fresh pool when the pool was closed mid-borrow")
    void shouldRetryBorrowAfterConcurrentClose() throws SQLException {
      final var builds = new AtomicInteger();
      final var holder = new ConnectionPoolManager[1];
      final var closing = mock(DataSource.class);
      when(closing.getConnection())
          .thenAnswer(
              inv -> {
                holder[0].closeAll();
                throw new SQLException("HikariDataSource action-lambda-pool has been closed.");
              });
      final var healthy = closeableDataSource();
      holder[0] =
          new ConnectionPoolManager(
              () -> SETTINGS, settings -> builds.getAndIncrement() == 0 ? closing : healthy);

      assertNotNull(holder[0].getConnection());
      assertEquals(2, builds.get());
      verify(healthy).getConnection();
    }

    @Test
    @DisplayName("Should propagate a borrow failure when the pool is unchanged")
    void shouldPropagateBorrowFailure() throws SQLException {
      final var failing = mock(DataSource.class);
      final var failure = new SQLException("Connection is not available");
      when(failing.getConnection()).thenThrow(failure);
      final var manager = new ConnectionPoolManager(() -> SETTINGS, settings -> failing);

      assertSame(failure, assertThrows(SQLException.class, manager::getConnection));
      verify(failing, times(1)).getConnection();
    }

    @Test
    @DisplayName("Should close the pool and re-initialize on next borrow")
    void shouldCloseAndReinitialize() throws Exception {
      final var manager = manager();
      manager.getConnection();

      manager.closeAll();

      assertFalse(manager.isInitialized());
      verify((AutoCloseable) created.get(0)).close();

      manager.getConnection();
      assertEquals(2, created.size());
      assertEquals(2, settingsReads.get());
    }

    @Test
    @DisplayName("Should ignore closeAll on an uninitialized pool")
    void shouldIgnoreCloseWhenUninitialized() {
      final var manager = manager();

      assertDoesNotThrow(manager::closeAll);
      assertTrue(created.isEmpty());
    }

    @Test
    @DisplayName("Should keep going when closing the pool fails")
    void shouldTolerateCloseFailure() throws Exception {
      final var manager = manager();
      manager.initialize();
      doThrow(new IllegalStateException("busy")).when((AutoCloseable) created.get(0)).close();

      assertDoesNotThrow(manager::close);
      assertFalse(manager.isInitialized());
    }

    @Test
    @DisplayName("Should hand out guarded connections that return to the pool once")
    void shouldGuardConnections() throws SQLException {
      final var manager = manager();

      final Connection borrowed;
      try (final var guard = manager.connection()) {
        borrowed = guard.connection();
      }

      verify(borrowed, times(1)).close();
    }

    @Test
    @DisplayName("Should fail when the pool hands out no connection")
    void shouldRejectNullConnection() {
      final var manager = new ConnectionPoolManager(() -> SETTINGS, settings -> mock(DataSource.class));

      assertThrows(SQLException.class, manager::getConnection);
    }
  }
}
