package io.intellixity.tessera.persistence.jdbc.dialect;

import io.intellixity.tessera.persistence.config.PoolConfig;
import io.intellixity.tessera.persistence.jdbc.NativeType;
import io.intellixity.tessera.persistence.model.Column;
import io.intellixity.tessera.persistence.spi.sql.Dialect;

import java.util.List;
import java.util.Map;

/** Dialect for JDBC engines: literal rendering plus connection settings and dialect-specific statement shapes. */
public interface JdbcDialect extends Dialect {
  int defaultPort();

  String jdbcUrl(PoolConfig pool);

  /** Driver properties for the pool (application name, statement cache). */
  Map<String, String> dataSourceProperties(String applicationName, PoolConfig pool);

  /** Driver-reported type name (lower-case) to the decoder's native type. */
  Map<String, NativeType> nativeTypes();

  /** Quoted identifier. */
  String quoteIdent(String ident);

  /** {@code DEFAULT ...} clause for a column that declares a default value. */
  String defaultClause(Column column);

  /** Column-definition suffix for an auto-increment column. */
  String autoIncrementClause(Column column);

  /**
   * Subquery selecting the primary key of the first row matching {@code tail}
   * ({@code WHERE ... ORDER BY ...}, possibly empty), usable as the right side of {@code pk IN (...)}.
   */
  String boundedSubquery(String table, String primaryKey, String tail);

  /** Conflict clause appended to an INSERT so it updates {@code updateColumns} on a primary key clash. */
  String upsertClause(String primaryKey, List<String> updateColumns);

  String createIndex(String table, Column column);

  String createTextSearchIndex(String table, String language, List<Column> columns);
}
