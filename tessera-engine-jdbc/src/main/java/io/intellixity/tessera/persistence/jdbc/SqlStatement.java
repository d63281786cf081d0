package io.intellixity.tessera.persistence.jdbc;

import java.util.List;

/**
 * Compiled SQL text plus positional string parameters.
 * <p>
 * Compiler output inlines every literal, so {@code params} is only used for caller-supplied raw SQL.
 */
public record SqlStatement(String sql, List<String> params, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (SELECT/COUNT). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() (DDL/DML). */
    UPDATE
  }

  public SqlStatement {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql must be non-blank");
    params = params == null ? List.of() : List.copyOf(params);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, ExecKind execKind) {
    this(sql, List.of(), execKind);
  }

  public static SqlStatement query(String sql) { return new SqlStatement(sql, ExecKind.QUERY); }

  public static SqlStatement update(String sql) { return new SqlStatement(sql, ExecKind.UPDATE); }
}
