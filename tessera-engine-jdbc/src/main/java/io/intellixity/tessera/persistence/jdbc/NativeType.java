package io.intellixity.tessera.persistence.jdbc;

import java.sql.Types;

/** Driver-reported column types the row decoder knows how to read. */
public enum NativeType {
  BOOL,
  INT16,
  INT32,
  INT64,
  UINT64,
  FLOAT32,
  FLOAT64,
  DECIMAL,
  TEXT,
  TIMESTAMPTZ,
  TIMESTAMP,
  DATE,
  TIME,
  UUID,
  BYTES,
  TEXT_ARRAY,
  JSON;

  /** Fallback by {@link java.sql.Types} code when the type name is not in the dialect table. */
  public static NativeType fromJdbcType(int sqlType) {
    return switch (sqlType) {
      case Types.BOOLEAN, Types.BIT -> BOOL;
      case Types.TINYINT, Types.SMALLINT -> INT16;
      case Types.INTEGER -> INT32;
      case Types.BIGINT -> INT64;
      case Types.REAL -> FLOAT32;
      case Types.FLOAT, Types.DOUBLE -> FLOAT64;
      case Types.NUMERIC, Types.DECIMAL -> DECIMAL;
      case Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR, Types.NCHAR, Types.NVARCHAR,
           Types.LONGNVARCHAR, Types.CLOB -> TEXT;
      case Types.TIMESTAMP_WITH_TIMEZONE -> TIMESTAMPTZ;
      case Types.TIMESTAMP -> TIMESTAMP;
      case Types.DATE -> DATE;
      case Types.TIME, Types.TIME_WITH_TIMEZONE -> TIME;
      case Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY, Types.BLOB -> BYTES;
      case Types.ARRAY -> TEXT_ARRAY;
      default -> null;
    };
  }
}
