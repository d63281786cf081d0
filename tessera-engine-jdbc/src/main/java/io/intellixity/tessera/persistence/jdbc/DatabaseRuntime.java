package io.intellixity.tessera.persistence.jdbc;

import io.intellixity.tessera.persistence.config.DatabaseConfig;
import io.intellixity.tessera.persistence.config.PasswordDecryptor;
import io.intellixity.tessera.persistence.jdbc.compile.SchemaCompiler;
import io.intellixity.tessera.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tessera.persistence.jdbc.pool.ConnectionPools;
import io.intellixity.tessera.persistence.spi.exec.QueryValidationStrategy;
import io.intellixity.tessera.persistence.util.TesseraFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Owns everything one database config needs at runtime: pools, dialect, compiler and engine.\n
 *
 * Built once at startup (config, password unwrapping, pools, dialect, compiler, executor, engine) and
 * closed at shutdown. Pools are never rebuilt while the runtime is open.
 */
public final class DatabaseRuntime implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(DatabaseRuntime.class);

  private final DatabaseConfig config;
  private final JdbcDialect dialect;
  private final ConnectionPools pools;
  private final SchemaCompiler compiler;
  private final JdbcSchemaEngine engine;

  private DatabaseRuntime(DatabaseConfig config, JdbcDialect dialect, ConnectionPools pools) {
    this.config = config;
    this.dialect = dialect;
    this.pools = pools;
    this.compiler = new SchemaCompiler(dialect, config.namespaceObject());
    this.engine = new JdbcSchemaEngine(compiler,
        new JdbcSqlExecutor(pools, new JdbcRowDecoder(dialect)),
        QueryValidationStrategy.forMode(config.strictFilters()));
  }

  /** Resolves the dialect registered under {@code config.type()} in {@code META-INF/tessera.factories}. */
  public static DatabaseRuntime start(DatabaseConfig config, PasswordDecryptor decryptor) {
    Objects.requireNonNull(config, "config");
    return start(config, resolveDialect(config.type()), decryptor);
  }

  public static DatabaseRuntime start(DatabaseConfig config, JdbcDialect dialect, PasswordDecryptor decryptor) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(dialect, "dialect");
    ConnectionPools pools = ConnectionPools.connectLazy(config.applicationName(), config.pools(), dialect, decryptor);
    log.info("tessera.runtime started app={} namespace={} dialect={} pools={} strictFilters={}",
        config.applicationName(), config.namespace(), dialect.id(), config.pools().size(), config.strictFilters());
    return new DatabaseRuntime(config, dialect, pools);
  }

  static JdbcDialect resolveDialect(String id) {
    List<JdbcDialect> dialects = TesseraFactoriesLoader.load(JdbcDialect.class);
    List<String> known = new ArrayList<>();
    for (JdbcDialect d : dialects) {
      if (d.id().equalsIgnoreCase(id)) {
        log.info("tessera.runtime dialect_selected id={} impl={}", d.id(), d.getClass().getName());
        return d;
      }
      known.add(d.id());
    }
    throw new IllegalStateException("No JdbcDialect registered for type '" + id + "' (registered: " + known + ")");
  }

  public DatabaseConfig config() { return config; }
  public JdbcDialect dialect() { return dialect; }
  public ConnectionPools pools() { return pools; }
  public SchemaCompiler compiler() { return compiler; }
  public JdbcSchemaEngine engine() { return engine; }

  @Override
  public void close() {
    pools.close();
    log.info("tessera.runtime closed app={}", config.applicationName());
  }
}
