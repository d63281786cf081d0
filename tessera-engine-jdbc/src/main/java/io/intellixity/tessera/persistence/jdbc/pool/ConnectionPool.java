package io.intellixity.tessera.persistence.jdbc.pool;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.intellixity.tessera.persistence.config.PasswordDecryptor;
import io.intellixity.tessera.persistence.config.PoolConfig;
import io.intellixity.tessera.persistence.jdbc.dialect.JdbcDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.Closeable;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;

/**
 * One named pool over a lazily started data source.\n
 *
 * {@link #acquire()} pings the database first when the pool has been idle longer than the health-check
 * interval. The {@code available} flag is updated by those pings only, so readers may briefly see a
 * stale value.
 */
public final class ConnectionPool implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);
  private static final int PING_TIMEOUT_SECONDS = 5;

  private final String name;
  private final String database;
  private final DataSource dataSource;
  private final long healthCheckIntervalMillis;
  private final IntSupplier idleConnections;
  private final LongSupplier nowMillis;

  private final AtomicBoolean available = new AtomicBoolean(true);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicLong lastActivity = new AtomicLong(Long.MIN_VALUE);

  public ConnectionPool(String name,
                        String database,
                        DataSource dataSource,
                        Duration healthCheckInterval,
                        IntSupplier idleConnections,
                        LongSupplier nowMillis) {
    this.name = Objects.requireNonNull(name, "name");
    this.database = Objects.requireNonNull(database, "database");
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.healthCheckIntervalMillis = Objects.requireNonNull(healthCheckInterval, "healthCheckInterval").toMillis();
    this.idleConnections = Objects.requireNonNull(idleConnections, "idleConnections");
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  /**
   * Builds a pool without opening any connection: Hikari starts on the first borrow.
   * The password is unwrapped through {@code decryptor} before it reaches the driver.
   */
  public static ConnectionPool connectLazy(String applicationName,
                                           PoolConfig config,
                                           JdbcDialect dialect,
                                           PasswordDecryptor decryptor) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(dialect, "dialect");
    PasswordDecryptor pd = decryptor == null ? PasswordDecryptor.NONE : decryptor;

    HikariDataSource ds = new HikariDataSource();
    ds.setPoolName(applicationName + "-" + config.name());
    ds.setJdbcUrl(config.url() != null ? config.url() : dialect.jdbcUrl(config));
    ds.setUsername(config.username());
    ds.setPassword(pd.decrypt(config, config.password()));
    ds.setMaximumPoolSize(config.maxConnections());
    ds.setMinimumIdle(config.minConnections());
    ds.setMaxLifetime(config.maxLifetime().toMillis());
    ds.setIdleTimeout(config.idleTimeout().toMillis());
    ds.setConnectionTimeout(config.acquireTimeout().toMillis());
    // start without a connection; an unreachable database surfaces on acquire, not here
    ds.setInitializationFailTimeout(-1);
    dialect.dataSourceProperties(applicationName, config).forEach(ds::addDataSourceProperty);

    log.info("tessera.pool created name={} database={} dialect={} max={} min={}",
        config.name(), config.database(), dialect.id(), config.maxConnections(), config.minConnections());

    return new ConnectionPool(config.name(), config.database(), ds, config.healthCheckInterval(),
        () -> {
          HikariPoolMXBean mx = ds.getHikariPoolMXBean();
          return mx == null ? 0 : mx.getIdleConnections();
        },
        System::currentTimeMillis);
  }

  public String name() { return name; }
  public String database() { return database; }
  public DataSource dataSource() { return dataSource; }
  public boolean isAvailable() { return available.get() && !closed.get(); }
  public boolean isClosed() { return closed.get(); }

  /** Borrows a connection; the caller closes it to return it to the pool. */
  public Connection acquire() {
    if (closed.get()) throw new PoolUnavailableException(name, PoolUnavailableException.Reason.CLOSED, "pool is closed", null);

    long now = nowMillis.getAsLong();
    long last = lastActivity.get();
    if (last == Long.MIN_VALUE || now - last > healthCheckIntervalMillis) healthCheck(now);

    try {
      Connection c = dataSource.getConnection();
      lastActivity.set(nowMillis.getAsLong());
      return c;
    } catch (SQLException e) {
      throw unavailable(e);
    }
  }

  private void healthCheck(long now) {
    try (Connection c = dataSource.getConnection()) {
      if (!c.isValid(PING_TIMEOUT_SECONDS)) throw new SQLException("connection failed validation");
    } catch (SQLException e) {
      PoolUnavailableException ex = unavailable(e);
      if (ex.reason() == PoolUnavailableException.Reason.UNHEALTHY) {
        log.warn("tessera.pool health_check_failed name={} database={} error={}", name, database, e.getMessage());
      }
      throw ex;
    }
    available.set(idleConnections.getAsInt() > 0);
    lastActivity.set(now);
    log.debug("tessera.pool health_check name={} available={}", name, available.get());
  }

  /**
   * Hikari reports both an exhausted pool and an unreachable database as a transient timeout; only the
   * latter carries the last connection failure as its cause. Exhaustion leaves availability untouched.
   */
  private PoolUnavailableException unavailable(SQLException e) {
    if (e instanceof SQLTransientConnectionException && e.getCause() == null) {
      return new PoolUnavailableException(name, PoolUnavailableException.Reason.ACQUIRE_TIMEOUT, e.getMessage(), e);
    }
    available.set(false);
    return new PoolUnavailableException(name, PoolUnavailableException.Reason.UNHEALTHY, e.getMessage(), e);
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    available.set(false);
    if (dataSource instanceof AutoCloseable ac) {
      try {
        ac.close();
      } catch (Exception e) {
        log.warn("tessera.pool close_failed name={} error={}", name, e.getMessage(), e);
      }
    }
    log.info("tessera.pool closed name={}", name);
  }

  @Override
  public String toString() {
    return "ConnectionPool{name=" + name + ", database=" + database + ", available=" + available.get()
        + ", closed=" + closed.get() + "}";
  }
}
