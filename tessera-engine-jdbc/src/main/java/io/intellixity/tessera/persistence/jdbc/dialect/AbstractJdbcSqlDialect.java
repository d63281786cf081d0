package io.intellixity.tessera.persistence.jdbc.dialect;

import io.intellixity.tessera.persistence.jdbc.NativeType;
import io.intellixity.tessera.persistence.model.Column;
import io.intellixity.tessera.persistence.model.SemanticType;
import io.intellixity.tessera.persistence.query.Query;
import io.intellixity.tessera.persistence.query.SortField;
import io.intellixity.tessera.persistence.util.Documents;
import io.intellixity.tessera.persistence.util.Json;
import io.intellixity.tessera.persistence.util.TemporalValues;

import java.math.BigDecimal;
import java.util.*;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - column types from a per-dialect semantic type table\n
 * - value literals ({@link #encodeValue}, {@link #formatValue})\n
 * - the filter operator algebra ({@link #formatFilter})\n
 *
 * DB-specific dialects override hooks for quoting, array/JSON predicates, temporal keywords and paging.\n
 * Nothing here throws on malformed input: unparsable values become {@code NULL}.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  private static final String RANGE_OPERATORS = "<>=";
  private static final String MATCH_OPERATORS = "!~*";
  private static final String DEFAULT_LANGUAGE = "english";

  private final Map<SemanticType, String> columnTypes;
  private final Map<String, NativeType> nativeTypes;

  protected AbstractJdbcSqlDialect(Map<SemanticType, String> columnTypes, Map<String, NativeType> nativeTypes) {
    this.columnTypes = Collections.unmodifiableMap(new EnumMap<>(columnTypes));
    this.nativeTypes = Map.copyOf(nativeTypes);
  }

  @Override public Map<String, NativeType> nativeTypes() { return nativeTypes; }

  @Override
  public String columnType(Column column) {
    SemanticType t = column.semanticType();
    if (t == null) return column.typeName();
    String token = columnTypes.get(t);
    return token == null ? column.typeName() : token;
  }

  @Override
  public String defaultClause(Column column) {
    return "DEFAULT " + formatValue(column, column.defaultValue());
  }

  @Override
  public String encodeValue(Column column, Object value) {
    if (value == null) return column.defaultValue() != null ? "DEFAULT" : "NULL";
    if (value instanceof Boolean b) return b ? "TRUE" : "FALSE";
    if (value instanceof Number n) return numberLiteral(n);
    if (value instanceof CharSequence cs) {
      String s = cs.toString();
      if (s.isEmpty()) {
        return column.defaultValue() != null ? formatValue(column, column.defaultValue()) : "''";
      }
      if (s.equals("null")) return "NULL";
      return formatValue(column, s);
    }
    if (value instanceof byte[] bytes) return bytesLiteral(HexFormat.of().formatHex(bytes));
    Iterable<?> items = Documents.asIterable(value);
    if (items != null) {
      List<String> elems = new ArrayList<>();
      for (Object v : items) {
        if (v == null) elems.add("NULL");
        else if (v instanceof CharSequence cs) elems.add(escapeString(cs.toString()));
        else elems.add(encodeValue(column, v));
      }
      return arrayLiteral(column, elems);
    }
    if (value instanceof Map<?, ?>) return objectLiteral(column, escapeString(Json.write(value)));
    return formatValue(column, String.valueOf(value));
  }

  @Override
  public String formatValue(Column column, String value) {
    SemanticType t = column.semanticType();
    if (t == null || value == null) return "NULL";
    return switch (t) {
      case BOOL -> value.equals("true") ? "TRUE" : value.equals("false") ? "FALSE" : "NULL";
      case U8, U16, U32, U64 -> parsesUnsigned(value) ? value : "NULL";
      case I8, I16, I32, I64 -> parsesSigned(value) ? value : "NULL";
      case F32, F64 -> decimalOrNull(value);
      case STRING, UUID -> escapeString(value);
      case DATETIME, LOCAL_DATETIME, DATE, TIME -> {
        String keyword = temporalKeyword(t, value);
        if (keyword != null) yield keyword;
        yield TemporalValues.isValid(t, value) ? escapeString(value) : "NULL";
      }
      case BYTES -> isHex(value) ? bytesLiteral(value) : "NULL";
      case TEXT_ARRAY, UUID_ARRAY -> {
        List<String> elems = new ArrayList<>();
        for (String part : value.split(",")) elems.add(escapeString(part));
        yield arrayLiteral(column, elems);
      }
      case JSON -> objectLiteral(column, escapeString(value));
    };
  }

  @Override
  public String formatFilter(Column column, String field, Object value) {
    String f = formatField(field);
    SemanticType t = column.semanticType();

    if (value instanceof Map<?, ?> ops) {
      if (t == SemanticType.JSON) return jsonContains(f, encodeValue(column, value));
      List<String> conditions = new ArrayList<>(ops.size());
      for (var e : ops.entrySet()) {
        String name = String.valueOf(e.getKey());
        Object operand = e.getValue();
        switch (name) {
          case "$in", "$nin" -> {
            Iterable<?> items = Documents.asIterable(operand);
            if (items == null) continue;
            List<String> values = new ArrayList<>();
            for (Object v : items) values.add(operand(column, v));
            if (values.isEmpty()) continue;
            String op = name.equals("$in") ? "IN" : "NOT IN";
            conditions.add(f + " " + op + " (" + String.join(",", values) + ")");
          }
          case "$all" -> conditions.add(arrayContainsAll(f, operand(column, operand)));
          case "$size" -> conditions.add(arrayLength(f) + " = " + operand(column, operand));
          case "$eq", "$ne" -> {
            if (operand == null) conditions.add(f + (name.equals("$eq") ? " IS NULL" : " IS NOT NULL"));
            else conditions.add(f + " " + comparisonOperator(name) + " " + operand(column, operand));
          }
          default -> conditions.add(f + " " + comparisonOperator(name) + " " + operand(column, operand));
        }
      }
      if (conditions.isEmpty()) return "";
      return "(" + String.join(" AND ", conditions) + ")";
    }

    if (value == null) return f + " IS NULL";
    if (t == null) return f + " = " + encodeValue(column, value);
    if (!(value instanceof String s)) {
      return switch (t) {
        case BOOL -> booleanTest(f, encodeValue(column, value));
        case TEXT_ARRAY, UUID_ARRAY -> arrayOverlaps(f, encodeValue(column, value));
        case JSON -> jsonContains(f, encodeValue(column, value));
        default -> f + " = " + encodeValue(column, value);
      };
    }

    return switch (t) {
      case BOOL -> booleanTest(f, encodeValue(column, s));
      case STRING -> formatStringFilter(f, s);
      case UUID -> formatUuidFilter(f, s);
      case TEXT_ARRAY, UUID_ARRAY -> formatArrayFilter(column, f, s);
      case JSON -> jsonPathExists(f, escapeString(s));
      case BYTES -> f + " = " + formatValue(column, s);
      default -> formatRangeFilter(column, f, s);
    };
  }

  /** Filter operands never take the column default: a missing value compares as {@code NULL}. */
  private String operand(Column column, Object value) {
    return value == null ? "NULL" : encodeValue(column, value);
  }

  private String formatRangeFilter(Column column, String f, String s) {
    int comma = s.indexOf(',');
    if (comma >= 0) {
      String min = formatValue(column, s.substring(0, comma));
      String max = formatValue(column, s.substring(comma + 1));
      return f + " >= " + min + " AND " + f + " < " + max;
    }
    int i = prefixLength(s, RANGE_OPERATORS);
    if (i > 0) return f + " " + s.substring(0, i) + " " + formatValue(column, s.substring(i));
    return f + " = " + formatValue(column, s);
  }

  private String formatStringFilter(String f, String s) {
    if (s.equals("null")) return "(" + f + " = '') IS NOT FALSE";
    if (s.equals("notnull")) return "(" + f + " = '') IS FALSE";
    int i = prefixLength(s, MATCH_OPERATORS);
    if (i > 0) return f + " " + stringMatchOperator(s.substring(0, i)) + " " + escapeString(s.substring(i));
    return f + " = " + escapeString(s);
  }

  private String formatUuidFilter(String f, String s) {
    if (s.equals("null")) return f + " IS NULL";
    if (s.equals("notnull")) return f + " IS NOT NULL";
    if (s.contains(",")) {
      List<String> values = new ArrayList<>();
      for (String part : s.split(",")) values.add(escapeString(part));
      return f + " IN (" + String.join(",", values) + ")";
    }
    return f + " = " + escapeString(s);
  }

  /** {@code a,b;c}: groups split on {@code ;} are AND-ed, members of a group overlap (OR). */
  private String formatArrayFilter(Column column, String f, String s) {
    if (!s.contains(";")) return arrayOverlaps(f, formatValue(column, s));
    List<String> parts = new ArrayList<>();
    for (String group : s.split(";")) {
      if (group.isEmpty()) continue;
      parts.add("(" + arrayOverlaps(f, formatValue(column, group)) + ")");
    }
    return String.join(" AND ", parts);
  }

  private static String booleanTest(String f, String literal) {
    return "TRUE".equals(literal) ? f + " IS TRUE" : f + " IS NOT TRUE";
  }

  @Override
  public String formatField(String field) {
    if (!field.contains(".")) return quoteIdent(field);
    List<String> parts = new ArrayList<>();
    for (String s : field.split("\\.")) parts.add(quoteIdent(s));
    return String.join(".", parts);
  }

  @Override
  public String escapeString(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  @Override
  public String formatPagination(Query query) {
    SortField sort = query.sort();
    if (sort != null && query.filters().containsKey(sort.field())) return "LIMIT " + query.limit();
    return offsetPagination(query.limit(), query.offset());
  }

  @Override
  public String formatTextSearch(Map<String, ?> spec) {
    if (spec == null) return null;
    List<String> fields = Documents.parseStringArray(spec.get("$fields"));
    String search = Documents.parseString(spec.get("$search"));
    if (fields.isEmpty() || search == null) return null;
    String language = Documents.parseString(spec.get("$language"));
    if (language == null || !language.chars().allMatch(Character::isLetter)) language = DEFAULT_LANGUAGE;
    List<String> quoted = new ArrayList<>(fields.size());
    for (String f : fields) quoted.add(formatField(f));
    return textSearch(quoted, escapeString(search), language);
  }

  /** Plain SQL operator for a {@code $}-operator; unknown operators compare with {@code =}. */
  protected String comparisonOperator(String name) {
    return switch (name) {
      case "$ne" -> "<>";
      case "$lt" -> "<";
      case "$lte" -> "<=";
      case "$gt" -> ">";
      case "$gte" -> ">=";
      default -> "=";
    };
  }

  /** Maps a string filter prefix made of {@code !~*}; anything unsupported compares with {@code =}. */
  protected String stringMatchOperator(String prefix) {
    return prefix.equals("!") ? "<>" : "=";
  }

  protected String numberLiteral(Number n) {
    if (n instanceof BigDecimal bd) return bd.toPlainString();
    if (n instanceof Double d && (d.isNaN() || d.isInfinite())) return "NULL";
    if (n instanceof Float fl && (fl.isNaN() || fl.isInfinite())) return "NULL";
    return n.toString();
  }

  protected abstract String temporalKeyword(SemanticType type, String keyword);

  protected abstract String arrayLiteral(Column column, List<String> elements);

  /** {@code escapedJson} is already a quoted string literal. */
  protected abstract String objectLiteral(Column column, String escapedJson);

  protected abstract String bytesLiteral(String hex);

  protected abstract String arrayOverlaps(String field, String literal);

  protected abstract String arrayContainsAll(String field, String literal);

  protected abstract String arrayLength(String field);

  protected abstract String jsonContains(String field, String literal);

  protected abstract String jsonPathExists(String field, String escapedPath);

  protected abstract String offsetPagination(long limit, long offset);

  protected abstract String textSearch(List<String> quotedFields, String escapedSearch, String language);

  private static int prefixLength(String s, String chars) {
    int i = 0;
    while (i < s.length() && chars.indexOf(s.charAt(i)) >= 0) i++;
    return i == s.length() ? 0 : i;
  }

  private static boolean parsesUnsigned(String s) {
    try {
      Long.parseUnsignedLong(s);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static boolean parsesSigned(String s) {
    try {
      Long.parseLong(s);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static String decimalOrNull(String s) {
    try {
      new BigDecimal(s);
      return s;
    } catch (NumberFormatException e) {
      return "NULL";
    }
  }

  private static boolean isHex(String s) {
    if (s.isEmpty() || s.length() % 2 != 0) return false;
    for (int i = 0; i < s.length(); i++) {
      if (Character.digit(s.charAt(i), 16) < 0) return false;
    }
    return true;
  }
}
