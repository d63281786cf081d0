package io.intellixity.tessera.persistence.jdbc.mysql;

import io.intellixity.tessera.persistence.config.PoolConfig;
import io.intellixity.tessera.persistence.jdbc.NativeType;
import io.intellixity.tessera.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tessera.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tessera.persistence.model.Column;
import io.intellixity.tessera.persistence.model.SemanticType;

import java.util.*;

/**
 * MySQL-family dialect (MySQL 8, compatible MariaDB builds).
 *
 * Arrays are stored as JSON, so array predicates go through the {@code json_*} functions.
 * String columns with a default or an index become {@code VARCHAR(255)} because MySQL cannot
 * default or fully index {@code TEXT}.
 */
public final class MySqlDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  public static final String ID = "mysql";
  private static final String INDEXABLE_STRING = "VARCHAR(255)";

  private static final Map<SemanticType, String> COLUMN_TYPES;
  private static final Map<String, NativeType> NATIVE_TYPES;

  static {
    EnumMap<SemanticType, String> t = new EnumMap<>(SemanticType.class);
    t.put(SemanticType.BOOL, "BOOLEAN");
    t.put(SemanticType.U8, "TINYINT UNSIGNED");
    t.put(SemanticType.U16, "SMALLINT UNSIGNED");
    t.put(SemanticType.U32, "INT UNSIGNED");
    t.put(SemanticType.U64, "BIGINT UNSIGNED");
    t.put(SemanticType.I8, "TINYINT");
    t.put(SemanticType.I16, "SMALLINT");
    t.put(SemanticType.I32, "INT");
    t.put(SemanticType.I64, "BIGINT");
    t.put(SemanticType.F32, "FLOAT");
    t.put(SemanticType.F64, "DOUBLE");
    t.put(SemanticType.STRING, "TEXT");
    t.put(SemanticType.DATETIME, "TIMESTAMP(6)");
    t.put(SemanticType.LOCAL_DATETIME, "DATETIME(6)");
    t.put(SemanticType.DATE, "DATE");
    t.put(SemanticType.TIME, "TIME");
    t.put(SemanticType.UUID, "VARCHAR(36)");
    t.put(SemanticType.BYTES, "BLOB");
    t.put(SemanticType.TEXT_ARRAY, "JSON");
    t.put(SemanticType.UUID_ARRAY, "JSON");
    t.put(SemanticType.JSON, "JSON");
    COLUMN_TYPES = t;

    Map<String, NativeType> n = new HashMap<>();
    n.put("bit", NativeType.BOOL);
    n.put("boolean", NativeType.BOOL);
    n.put("tinyint", NativeType.INT16);
    n.put("tinyint unsigned", NativeType.INT16);
    n.put("smallint", NativeType.INT16);
    n.put("smallint unsigned", NativeType.INT32);
    n.put("mediumint", NativeType.INT32);
    n.put("mediumint unsigned", NativeType.INT32);
    n.put("int", NativeType.INT32);
    n.put("int unsigned", NativeType.INT64);
    n.put("bigint", NativeType.INT64);
    n.put("bigint unsigned", NativeType.UINT64);
    n.put("float", NativeType.FLOAT32);
    n.put("double", NativeType.FLOAT64);
    n.put("decimal", NativeType.DECIMAL);
    for (String s : List.of("char", "varchar", "tinytext", "text", "mediumtext", "longtext", "enum", "set")) {
      n.put(s, NativeType.TEXT);
    }
    n.put("timestamp", NativeType.TIMESTAMPTZ);
    n.put("datetime", NativeType.TIMESTAMP);
    n.put("date", NativeType.DATE);
    n.put("time", NativeType.TIME);
    for (String s : List.of("binary", "varbinary", "tinyblob", "blob", "mediumblob", "longblob")) {
      n.put(s, NativeType.BYTES);
    }
    n.put("json", NativeType.JSON);
    NATIVE_TYPES = n;
  }

  public MySqlDialect() {
    super(COLUMN_TYPES, NATIVE_TYPES);
  }

  @Override public String id() { return ID; }
  @Override public int defaultPort() { return 3306; }

  @Override
  public String jdbcUrl(PoolConfig pool) {
    return "jdbc:mysql://" + pool.host() + ":" + pool.portOr(defaultPort()) + "/" + pool.database();
  }

  @Override
  public Map<String, String> dataSourceProperties(String applicationName, PoolConfig pool) {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("cachePrepStmts", "true");
    m.put("prepStmtCacheSize", String.valueOf(pool.statementCacheCapacity()));
    m.put("connectionAttributes", "program_name:" + applicationName);
    return m;
  }

  @Override
  public String columnType(Column column) {
    if (column.semanticType() == SemanticType.STRING
        && (column.defaultValue() != null || (column.indexType() != null && !column.indexType().isBlank()))) {
      return INDEXABLE_STRING;
    }
    return super.columnType(column);
  }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  public String escapeString(String value) {
    return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
  }

  @Override
  public String autoIncrementClause(Column column) { return "AUTO_INCREMENT"; }

  /**
   * MySQL takes only literals as bare defaults, plus {@code CURRENT_TIMESTAMP} on datetime columns.
   * Expressions, and any default on a BLOB or JSON column, go in parentheses.
   */
  @Override
  public String defaultClause(Column column) {
    String value = formatValue(column, column.defaultValue());
    return "DEFAULT " + (isBareDefault(column.semanticType(), value) ? value : "(" + value + ")");
  }

  private static boolean isBareDefault(SemanticType type, String value) {
    if (value.equals("NULL")) return true;
    if (type == SemanticType.BYTES || type == SemanticType.JSON
        || type == SemanticType.TEXT_ARRAY || type == SemanticType.UUID_ARRAY) {
      return false;
    }
    if (value.equals("current_timestamp(6)")) {
      return type == SemanticType.DATETIME || type == SemanticType.LOCAL_DATETIME;
    }
    char first = value.charAt(0);
    return first == '\'' || first == '-' || Character.isDigit(first) || value.equals("TRUE") || value.equals("FALSE");
  }

  /** MySQL rejects LIMIT inside IN subqueries and reading the target table, hence the derived table. */
  @Override
  public String boundedSubquery(String table, String primaryKey, String tail) {
    String pk = quoteIdent(primaryKey);
    String inner = "SELECT " + pk + " FROM " + quoteIdent(table) + (tail.isEmpty() ? "" : " " + tail) + " LIMIT 1";
    return "SELECT " + pk + " FROM (" + inner + ") AS " + quoteIdent("t_one");
  }

  @Override
  public String upsertClause(String primaryKey, List<String> updateColumns) {
    List<String> cols = updateColumns.isEmpty() ? List.of(primaryKey) : updateColumns;
    List<String> sets = new ArrayList<>(cols.size());
    for (String c : cols) sets.add(quoteIdent(c) + " = VALUES(" + quoteIdent(c) + ")");
    return "ON DUPLICATE KEY UPDATE " + String.join(", ", sets);
  }

  @Override
  public String createIndex(String table, Column column) {
    String type = column.indexType().trim().toLowerCase(Locale.ROOT);
    String sql = "CREATE INDEX " + quoteIdent(table + "_" + column.name() + "_index") + " ON " + quoteIdent(table)
        + " (" + quoteIdent(column.name()) + (type.equals("btree") ? " DESC" : "") + ")";
    return switch (type) {
      case "btree" -> sql + " USING BTREE";
      case "hash" -> sql + " USING HASH";
      default -> sql;
    };
  }

  @Override
  public String createTextSearchIndex(String table, String language, List<Column> columns) {
    List<String> cols = new ArrayList<>(columns.size());
    for (Column c : columns) cols.add(quoteIdent(c.name()));
    return "CREATE FULLTEXT INDEX " + quoteIdent(table + "_text_search_" + language + "_index")
        + " ON " + quoteIdent(table) + " (" + String.join(", ", cols) + ")";
  }

  @Override
  protected String temporalKeyword(SemanticType type, String keyword) {
    return switch (type) {
      case DATETIME, LOCAL_DATETIME, DATE -> switch (keyword) {
        case "epoch" -> type == SemanticType.DATE ? "'1970-01-01'" : "from_unixtime(0)";
        case "now" -> type == SemanticType.DATE ? null : "current_timestamp(6)";
        case "today" -> "curdate()";
        case "tomorrow" -> "curdate() + INTERVAL 1 DAY";
        case "yesterday" -> "curdate() - INTERVAL 1 DAY";
        default -> null;
      };
      case TIME -> switch (keyword) {
        case "now" -> "curtime()";
        case "midnight" -> "'00:00:00'";
        default -> null;
      };
      default -> null;
    };
  }

  @Override
  protected String stringMatchOperator(String prefix) {
    return switch (prefix) {
      case "~", "~*" -> "REGEXP";
      case "!~", "!~*" -> "NOT REGEXP";
      default -> super.stringMatchOperator(prefix);
    };
  }

  @Override
  protected String arrayLiteral(Column column, List<String> elements) {
    return "json_array(" + String.join(",", elements) + ")";
  }

  @Override protected String objectLiteral(Column column, String escapedJson) { return escapedJson; }
  @Override protected String bytesLiteral(String hex) { return "X'" + hex + "'"; }

  @Override protected String arrayOverlaps(String field, String literal) { return "json_overlaps(" + field + ", " + literal + ")"; }
  @Override protected String arrayContainsAll(String field, String literal) { return "json_contains(" + field + ", " + literal + ")"; }
  @Override protected String arrayLength(String field) { return "json_length(" + field + ")"; }
  @Override protected String jsonContains(String field, String literal) { return "json_overlaps(" + field + ", " + literal + ")"; }

  @Override
  protected String jsonPathExists(String field, String escapedPath) {
    return "json_contains_path(" + field + ", 'one', " + escapedPath + ")";
  }

  @Override
  protected String offsetPagination(long limit, long offset) {
    return "LIMIT " + offset + ", " + limit;
  }

  @Override
  protected String textSearch(List<String> quotedFields, String escapedSearch, String language) {
    return "match(" + String.join(", ", quotedFields) + ") against(" + escapedSearch + ")";
  }
}
