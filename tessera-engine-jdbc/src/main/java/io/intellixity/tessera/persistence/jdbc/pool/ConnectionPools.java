package io.intellixity.tessera.persistence.jdbc.pool;

import io.intellixity.tessera.persistence.config.PasswordDecryptor;
import io.intellixity.tessera.persistence.config.PoolConfig;
import io.intellixity.tessera.persistence.jdbc.dialect.JdbcDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pools in config order. Several pools may share a name; lookups prefer an available one.
 */
public final class ConnectionPools implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionPools.class);

  private final List<ConnectionPool> pools;

  public ConnectionPools(List<ConnectionPool> pools) {
    this.pools = List.copyOf(Objects.requireNonNull(pools, "pools"));
  }

  public static ConnectionPools connectLazy(String applicationName,
                                            List<PoolConfig> configs,
                                            JdbcDialect dialect,
                                            PasswordDecryptor decryptor) {
    List<ConnectionPool> out = new ArrayList<>(configs.size());
    for (PoolConfig c : configs) out.add(ConnectionPool.connectLazy(applicationName, c, dialect, decryptor));
    return new ConnectionPools(out);
  }

  /**
   * First available pool named {@code name}; when none is available, the last one with that name.
   * Empty only when no pool has that name.
   */
  public Optional<ConnectionPool> get(String name) {
    ConnectionPool fallback = null;
    for (ConnectionPool p : pools) {
      if (!p.name().equals(name)) continue;
      if (p.isAvailable()) return Optional.of(p);
      fallback = p;
    }
    if (fallback != null) {
      log.warn("tessera.pool no_available_pool name={} fallback={}", name, fallback);
    }
    return Optional.ofNullable(fallback);
  }

  public ConnectionPool require(String name) {
    return get(name).orElseThrow(() -> new PoolUnavailableException(
        name, PoolUnavailableException.Reason.NO_POOL, "no pool configured with this name", null));
  }

  public List<ConnectionPool> all() { return pools; }

  @Override
  public void close() {
    for (ConnectionPool p : pools) p.close();
  }
}
