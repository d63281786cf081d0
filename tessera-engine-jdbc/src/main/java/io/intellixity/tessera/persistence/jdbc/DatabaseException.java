package io.intellixity.tessera.persistence.jdbc;

/** A driver failure while executing a statement; carries the operation and the SQL text. */
public class DatabaseException extends RuntimeException {
  private final String operation;
  private final String sql;

  public DatabaseException(String operation, String sql, Throwable cause) {
    super("tessera.jdbc op=" + operation + " failed: " + (cause == null ? "" : cause.getMessage()) + " sql=" + sql, cause);
    this.operation = operation;
    this.sql = sql;
  }

  protected DatabaseException(String message, String operation, String sql, Throwable cause) {
    super(message, cause);
    this.operation = operation;
    this.sql = sql;
  }

  public String operation() { return operation; }
  public String sql() { return sql; }
}
