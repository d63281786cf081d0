package io.intellixity.tessera.persistence.jdbc;

/** A row value that could not be converted into a document value. */
public final class RowDecodeException extends DatabaseException {
  private final String column;

  public RowDecodeException(String column, String message, Throwable cause) {
    super("Failed to decode column '" + column + "': " + message, "DECODE", null, cause);
    this.column = column;
  }

  public String column() { return column; }
}
