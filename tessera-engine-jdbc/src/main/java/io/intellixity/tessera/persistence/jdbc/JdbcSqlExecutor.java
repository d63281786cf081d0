package io.intellixity.tessera.persistence.jdbc;

import io.intellixity.tessera.persistence.jdbc.pool.ConnectionPools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Blocking executor: one pooled connection per statement, auto-commit. */
public final class JdbcSqlExecutor implements SqlExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcSqlExecutor.class);

  private final ConnectionPools pools;
  private final JdbcRowDecoder decoder;

  public JdbcSqlExecutor(ConnectionPools pools, JdbcRowDecoder decoder) {
    this.pools = Objects.requireNonNull(pools, "pools");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
  }

  @Override
  public long execute(String pool, SqlStatement ss) {
    long start = System.nanoTime();
    debugSql("EXECUTE", pool, ss);
    try (Connection c = pools.require(pool).acquire();
         PreparedStatement ps = c.prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      long n = ps.executeUpdate();
      debugDone("EXECUTE", ss, n, System.nanoTime() - start);
      return n;
    } catch (SQLException e) {
      throw new DatabaseException("EXECUTE", ss.sql(), e);
    }
  }

  @Override
  public List<Map<String, Object>> query(String pool, SqlStatement ss) {
    long start = System.nanoTime();
    debugSql("QUERY", pool, ss);
    try (Connection c = pools.require(pool).acquire();
         PreparedStatement ps = c.prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        List<Map<String, Object>> out = decoder.decodeAll(rs);
        debugDone("QUERY", ss, out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new DatabaseException("QUERY", ss.sql(), e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.params().size(); i++) {
      ps.setString(i + 1, ss.params().get(i));
    }
  }

  private static void debugSql(String op, String pool, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("tessera.jdbc op={} execKind={} pool={} paramCount={} sql={}",
        op, ss.execKind(), pool, ss.params().size(), ss.sql());

    // TRACE: parameter summary only (no raw values)
    if (log.isTraceEnabled() && !ss.params().isEmpty()) {
      int idx = 1;
      for (String p : ss.params()) {
        log.trace("tessera.jdbc param index={} valueLen={}", idx++, p == null ? -1 : p.length());
      }
    }
  }

  private static void debugDone(String op, SqlStatement ss, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("tessera.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
