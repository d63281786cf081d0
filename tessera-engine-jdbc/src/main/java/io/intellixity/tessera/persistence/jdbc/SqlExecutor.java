package io.intellixity.tessera.persistence.jdbc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Runs compiled statements against a named pool. */
public interface SqlExecutor {
  /** @return affected row count */
  long execute(String pool, SqlStatement statement);

  List<Map<String, Object>> query(String pool, SqlStatement statement);

  default Optional<Map<String, Object>> queryOne(String pool, SqlStatement statement) {
    List<Map<String, Object>> rows = query(pool, statement);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
