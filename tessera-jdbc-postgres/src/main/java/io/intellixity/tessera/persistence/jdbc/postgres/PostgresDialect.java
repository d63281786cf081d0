package io.intellixity.tessera.persistence.jdbc.postgres;

import io.intellixity.tessera.persistence.config.PoolConfig;
import io.intellixity.tessera.persistence.jdbc.NativeType;
import io.intellixity.tessera.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tessera.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tessera.persistence.model.Column;
import io.intellixity.tessera.persistence.model.SemanticType;

import java.util.*;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides.\n
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  public static final String ID = "postgres";
  private static final Set<String> MATCH_OPERATORS = Set.of("~", "~*", "!~", "!~*");

  private static final Map<SemanticType, String> COLUMN_TYPES;
  private static final Map<String, NativeType> NATIVE_TYPES;

  static {
    EnumMap<SemanticType, String> t = new EnumMap<>(SemanticType.class);
    t.put(SemanticType.BOOL, "BOOLEAN");
    t.put(SemanticType.U8, "SMALLINT");
    t.put(SemanticType.U16, "SMALLINT");
    t.put(SemanticType.U32, "INT");
    t.put(SemanticType.U64, "BIGINT");
    t.put(SemanticType.I8, "SMALLINT");
    t.put(SemanticType.I16, "SMALLINT");
    t.put(SemanticType.I32, "INT");
    t.put(SemanticType.I64, "BIGINT");
    t.put(SemanticType.F32, "REAL");
    t.put(SemanticType.F64, "DOUBLE PRECISION");
    t.put(SemanticType.STRING, "TEXT");
    t.put(SemanticType.DATETIME, "TIMESTAMPTZ");
    t.put(SemanticType.LOCAL_DATETIME, "TIMESTAMP");
    t.put(SemanticType.DATE, "DATE");
    t.put(SemanticType.TIME, "TIME");
    t.put(SemanticType.UUID, "UUID");
    t.put(SemanticType.BYTES, "BYTEA");
    t.put(SemanticType.TEXT_ARRAY, "TEXT[]");
    t.put(SemanticType.UUID_ARRAY, "UUID[]");
    t.put(SemanticType.JSON, "JSONB");
    COLUMN_TYPES = t;

    Map<String, NativeType> n = new HashMap<>();
    n.put("bool", NativeType.BOOL);
    n.put("int2", NativeType.INT16);
    n.put("int4", NativeType.INT32);
    n.put("int8", NativeType.INT64);
    n.put("float4", NativeType.FLOAT32);
    n.put("float8", NativeType.FLOAT64);
    n.put("numeric", NativeType.DECIMAL);
    n.put("text", NativeType.TEXT);
    n.put("varchar", NativeType.TEXT);
    n.put("bpchar", NativeType.TEXT);
    n.put("timestamptz", NativeType.TIMESTAMPTZ);
    n.put("timestamp", NativeType.TIMESTAMP);
    n.put("date", NativeType.DATE);
    n.put("time", NativeType.TIME);
    n.put("uuid", NativeType.UUID);
    n.put("bytea", NativeType.BYTES);
    n.put("_text", NativeType.TEXT_ARRAY);
    n.put("_uuid", NativeType.TEXT_ARRAY);
    n.put("json", NativeType.JSON);
    n.put("jsonb", NativeType.JSON);
    NATIVE_TYPES = n;
  }

  public PostgresDialect() {
    super(COLUMN_TYPES, NATIVE_TYPES);
  }

  @Override public String id() { return ID; }
  @Override public int defaultPort() { return 5432; }

  @Override
  public String jdbcUrl(PoolConfig pool) {
    return "jdbc:postgresql://" + pool.host() + ":" + pool.portOr(defaultPort()) + "/" + pool.database();
  }

  @Override
  public Map<String, String> dataSourceProperties(String applicationName, PoolConfig pool) {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("ApplicationName", applicationName);
    m.put("preparedStatementCacheQueries", String.valueOf(pool.statementCacheCapacity()));
    return m;
  }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String autoIncrementClause(Column column) { return "GENERATED BY DEFAULT AS IDENTITY"; }

  @Override
  public String boundedSubquery(String table, String primaryKey, String tail) {
    String base = "SELECT " + quoteIdent(primaryKey) + " FROM " + quoteIdent(table);
    return (tail.isEmpty() ? base : base + " " + tail) + " LIMIT 1";
  }

  @Override
  public String upsertClause(String primaryKey, List<String> updateColumns) {
    List<String> cols = updateColumns.isEmpty() ? List.of(primaryKey) : updateColumns;
    List<String> sets = new ArrayList<>(cols.size());
    for (String c : cols) sets.add(quoteIdent(c) + " = EXCLUDED." + quoteIdent(c));
    return "ON CONFLICT (" + quoteIdent(primaryKey) + ") DO UPDATE SET " + String.join(", ", sets);
  }

  @Override
  public String createIndex(String table, Column column) {
    String type = column.indexType().trim().toLowerCase(Locale.ROOT);
    String desc = type.equals("btree") ? " DESC" : "";
    return "CREATE INDEX CONCURRENTLY IF NOT EXISTS " + quoteIdent(table + "_" + column.name() + "_index")
        + " ON " + quoteIdent(table) + " USING " + type + "(" + quoteIdent(column.name()) + desc + ")";
  }

  @Override
  public String createTextSearchIndex(String table, String language, List<Column> columns) {
    List<String> parts = new ArrayList<>(columns.size());
    for (Column c : columns) parts.add("coalesce(" + quoteIdent(c.name()) + ", '')");
    return "CREATE INDEX CONCURRENTLY IF NOT EXISTS " + quoteIdent(table + "_text_search_" + language + "_index")
        + " ON " + quoteIdent(table) + " USING gin(to_tsvector('" + language + "', "
        + String.join(" || ' ' || ", parts) + "))";
  }

  @Override
  protected String temporalKeyword(SemanticType type, String keyword) {
    return switch (type) {
      case DATETIME, LOCAL_DATETIME -> switch (keyword) {
        case "epoch" -> "'epoch'";
        case "now" -> "now()";
        case "today" -> "date_trunc('day', now())";
        case "tomorrow" -> "date_trunc('day', now()) + '1 day'::INTERVAL";
        case "yesterday" -> "date_trunc('day', now()) - '1 day'::INTERVAL";
        default -> null;
      };
      case DATE -> switch (keyword) {
        case "epoch" -> "'epoch'";
        case "today" -> "current_date";
        case "tomorrow" -> "current_date + 1";
        case "yesterday" -> "current_date - 1";
        default -> null;
      };
      case TIME -> switch (keyword) {
        case "now" -> "localtime";
        case "midnight" -> "'allballs'";
        default -> null;
      };
      default -> null;
    };
  }

  @Override
  protected String stringMatchOperator(String prefix) {
    return MATCH_OPERATORS.contains(prefix) ? prefix : super.stringMatchOperator(prefix);
  }

  @Override
  protected String arrayLiteral(Column column, List<String> elements) {
    return "ARRAY[" + String.join(",", elements) + "]::" + columnType(column);
  }

  @Override
  protected String objectLiteral(Column column, String escapedJson) {
    String type = column.semanticType() == SemanticType.JSON ? columnType(column) : "JSONB";
    return escapedJson + "::" + type;
  }

  @Override protected String bytesLiteral(String hex) { return "'\\x" + hex + "'::BYTEA"; }

  @Override protected String arrayOverlaps(String field, String literal) { return field + " && " + literal; }
  @Override protected String arrayContainsAll(String field, String literal) { return field + " @> " + literal; }
  @Override protected String arrayLength(String field) { return "array_length(" + field + ", 1)"; }
  @Override protected String jsonContains(String field, String literal) { return field + " @> " + literal; }
  @Override protected String jsonPathExists(String field, String escapedPath) { return field + " @? " + escapedPath; }

  @Override
  protected String offsetPagination(long limit, long offset) {
    return "LIMIT " + limit + " OFFSET " + offset;
  }

  @Override
  protected String textSearch(List<String> quotedFields, String escapedSearch, String language) {
    return "to_tsvector('" + language + "', " + String.join(" || ' ' || ", quotedFields)
        + ") @@ websearch_to_tsquery('" + language + "', " + escapedSearch + ")";
  }
}
