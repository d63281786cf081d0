package io.intellixity.tessera.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.intellixity.tessera.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tessera.persistence.util.Json;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.*;

/**
 * Decodes result rows into ordered documents.\n
 *
 * Dispatch is on the driver-reported type name (looked up lower-case in the dialect's table), falling
 * back to the {@link java.sql.Types} code. Temporal values become ISO-8601 strings; arrays become
 * {@code List<String>}; JSON is parsed into maps and lists. Unknown types decode to {@code null}.
 */
public final class JdbcRowDecoder {
  private final Map<String, NativeType> nativeTypes;

  public JdbcRowDecoder(JdbcDialect dialect) {
    this.nativeTypes = Objects.requireNonNull(dialect, "dialect").nativeTypes();
  }

  public List<Map<String, Object>> decodeAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    NativeType[] types = nativeTypes(md);
    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) out.add(decode(rs, md, types));
    return out;
  }

  /** Decodes the current row. */
  public Map<String, Object> decode(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    return decode(rs, md, nativeTypes(md));
  }

  NativeType nativeType(String typeName, int sqlType) {
    if (typeName != null) {
      NativeType t = nativeTypes.get(typeName.toLowerCase(Locale.ROOT));
      if (t != null) return t;
    }
    return NativeType.fromJdbcType(sqlType);
  }

  private NativeType[] nativeTypes(ResultSetMetaData md) throws SQLException {
    NativeType[] types = new NativeType[md.getColumnCount()];
    for (int i = 0; i < types.length; i++) {
      types[i] = nativeType(md.getColumnTypeName(i + 1), md.getColumnType(i + 1));
    }
    return types;
  }

  private Map<String, Object> decode(ResultSet rs, ResultSetMetaData md, NativeType[] types) throws SQLException {
    Map<String, Object> doc = new LinkedHashMap<>();
    for (int i = 1; i <= types.length; i++) {
      String label = md.getColumnLabel(i);
      doc.put(label, decodeValue(rs, i, label, types[i - 1]));
    }
    return doc;
  }

  private static Object decodeValue(ResultSet rs, int i, String label, NativeType type) {
    if (type == null) return null;
    try {
      Object v = switch (type) {
        case BOOL -> rs.getBoolean(i);
        case INT16, INT32 -> rs.getInt(i);
        case INT64 -> rs.getLong(i);
        case UINT64, DECIMAL -> rs.getObject(i);
        case FLOAT32 -> rs.getFloat(i);
        case FLOAT64 -> rs.getDouble(i);
        case TEXT -> rs.getString(i);
        case TIMESTAMPTZ -> iso(rs.getObject(i, OffsetDateTime.class));
        case TIMESTAMP -> iso(rs.getObject(i, LocalDateTime.class));
        case DATE -> iso(rs.getObject(i, LocalDate.class));
        case TIME -> iso(rs.getObject(i, LocalTime.class));
        case UUID -> rs.getString(i);
        case BYTES -> rs.getBytes(i);
        case TEXT_ARRAY -> textArray(rs.getArray(i));
        case JSON -> json(rs.getString(i));
      };
      return rs.wasNull() ? null : v;
    } catch (SQLException | JsonProcessingException | RuntimeException e) {
      throw new RowDecodeException(label, type + ": " + e.getMessage(), e);
    }
  }

  private static String iso(Object v) { return v == null ? null : v.toString(); }

  private static List<String> textArray(Array arr) throws SQLException {
    if (arr == null) return null;
    try {
      Object raw = arr.getArray();
      if (!(raw instanceof Object[] items)) return null;
      List<String> out = new ArrayList<>(items.length);
      for (Object item : items) out.add(item == null ? null : item.toString());
      return out;
    } finally {
      arr.free();
    }
  }

  private static Object json(String text) throws JsonProcessingException {
    return text == null ? null : Json.read(text);
  }
}
