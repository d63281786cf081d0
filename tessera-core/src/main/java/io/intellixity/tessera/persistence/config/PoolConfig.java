package io.intellixity.tessera.persistence.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of one connection pool entry.
 * <p>
 * {@code port == null} means the dialect's default port; {@code url}, when set, replaces the URL the
 * dialect would build from host, port and database.
 */
public record PoolConfig(String name,
                         String database,
                         String username,
                         String password,
                         String host,
                         Integer port,
                         String url,
                         int statementCacheCapacity,
                         int maxConnections,
                         int minConnections,
                         Duration maxLifetime,
                         Duration idleTimeout,
                         Duration acquireTimeout,
                         Duration healthCheckInterval) {
  public static final String DEFAULT_NAME = "main";
  public static final String DEFAULT_HOST = "127.0.0.1";
  public static final int DEFAULT_STATEMENT_CACHE_CAPACITY = 100;
  public static final int DEFAULT_MAX_CONNECTIONS = 16;
  public static final int DEFAULT_MIN_CONNECTIONS = 2;
  public static final long DEFAULT_MAX_LIFETIME_SECONDS = 60 * 60;
  public static final long DEFAULT_IDLE_TIMEOUT_SECONDS = 10 * 60;
  public static final long DEFAULT_ACQUIRE_TIMEOUT_SECONDS = 30;
  public static final long DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS = 60;

  public PoolConfig {
    name = (name == null || name.isBlank()) ? DEFAULT_NAME : name;
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(username, "username");
    password = (password == null) ? "" : password;
    host = (host == null || host.isBlank()) ? DEFAULT_HOST : host;
    Objects.requireNonNull(maxLifetime, "maxLifetime");
    Objects.requireNonNull(idleTimeout, "idleTimeout");
    Objects.requireNonNull(acquireTimeout, "acquireTimeout");
    Objects.requireNonNull(healthCheckInterval, "healthCheckInterval");
    if (maxConnections <= 0) throw new IllegalArgumentException("max-connections must be > 0");
    if (minConnections < 0 || minConnections > maxConnections) {
      throw new IllegalArgumentException("min-connections must be between 0 and max-connections");
    }
  }

  /** Pool with every optional setting at its default. */
  public static PoolConfig of(String name, String database, String username, String password) {
    return fromMap(Map.of(
        "name", name == null ? DEFAULT_NAME : name,
        "database", database,
        "username", username,
        "password", password == null ? "" : password));
  }

  public PoolConfig withUrl(String url) {
    return new PoolConfig(name, database, username, password, host, port, url, statementCacheCapacity,
        maxConnections, minConnections, maxLifetime, idleTimeout, acquireTimeout, healthCheckInterval);
  }

  public PoolConfig withPassword(String password) {
    return new PoolConfig(name, database, username, password, host, port, url, statementCacheCapacity,
        maxConnections, minConnections, maxLifetime, idleTimeout, acquireTimeout, healthCheckInterval);
  }

  public int portOr(int defaultPort) { return port == null ? defaultPort : port; }

  /** Reads one entry of a dialect's pool array; missing required keys fail fast. */
  public static PoolConfig fromMap(Map<String, ?> m) {
    return new PoolConfig(
        ConfigValues.string(m, "name", DEFAULT_NAME),
        ConfigValues.requireString(m, "database"),
        ConfigValues.requireString(m, "username"),
        ConfigValues.string(m, "password", ""),
        ConfigValues.string(m, "host", DEFAULT_HOST),
        m.containsKey("port") ? (int) ConfigValues.number(m, "port", 0) : null,
        ConfigValues.string(m, "url", null),
        (int) ConfigValues.number(m, "statement-cache-capacity", DEFAULT_STATEMENT_CACHE_CAPACITY),
        (int) ConfigValues.number(m, "max-connections", DEFAULT_MAX_CONNECTIONS),
        (int) ConfigValues.number(m, "min-connections", DEFAULT_MIN_CONNECTIONS),
        Duration.ofSeconds(ConfigValues.number(m, "max-lifetime", DEFAULT_MAX_LIFETIME_SECONDS)),
        Duration.ofSeconds(ConfigValues.number(m, "idle-timeout", DEFAULT_IDLE_TIMEOUT_SECONDS)),
        Duration.ofSeconds(ConfigValues.number(m, "acquire-timeout", DEFAULT_ACQUIRE_TIMEOUT_SECONDS)),
        Duration.ofSeconds(ConfigValues.number(m, "health-check-interval", DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS))
    );
  }

  @Override
  public String toString() {
    return "PoolConfig{name=" + name + ", database=" + database + ", username=" + username
        + ", host=" + host + ", port=" + port + ", url=" + url + ", max=" + maxConnections
        + ", min=" + minConnections + "}";
  }
}
