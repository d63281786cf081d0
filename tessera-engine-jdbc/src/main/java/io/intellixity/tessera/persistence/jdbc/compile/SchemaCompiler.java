package io.intellixity.tessera.persistence.jdbc.compile;

import io.intellixity.tessera.persistence.jdbc.SqlStatement;
import io.intellixity.tessera.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tessera.persistence.model.Column;
import io.intellixity.tessera.persistence.model.EntitySchema;
import io.intellixity.tessera.persistence.model.Namespace;
import io.intellixity.tessera.persistence.model.Reference;
import io.intellixity.tessera.persistence.query.Mutation;
import io.intellixity.tessera.persistence.query.Query;
import io.intellixity.tessera.persistence.query.SortField;
import io.intellixity.tessera.persistence.util.Documents;

import java.util.*;

/**
 * Stateless SQL compiler: entity schema + query/mutation/document to {@link SqlStatement}.\n
 *
 * Every literal is rendered inline by the dialect, so compiled statements carry no params.
 * Filter keys that are not declared columns are skipped; {@code $and}, {@code $or} and {@code $text}
 * are the only recognized logical keys.
 */
public final class SchemaCompiler {
  private final JdbcDialect dialect;
  private final Namespace namespace;

  public SchemaCompiler(JdbcDialect dialect, Namespace namespace) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.namespace = Objects.requireNonNull(namespace, "namespace");
  }

  public JdbcDialect dialect() { return dialect; }
  public Namespace namespace() { return namespace; }

  public String tableName(EntitySchema schema) { return namespace.tableName(schema.typeName()); }

  /* ---------------- DDL ---------------- */

  public SqlStatement createTable(EntitySchema schema) {
    String table = tableName(schema);
    List<String> defs = new ArrayList<>();
    for (Column c : schema.columns()) defs.add(columnDefinition(c));
    defs.add("CONSTRAINT " + dialect.quoteIdent(table + "_pkey")
        + " PRIMARY KEY (" + dialect.quoteIdent(schema.primaryKeyName()) + ")");
    for (Column c : schema.columns()) {
      String fk = foreignKey(c);
      if (fk != null) defs.add(fk);
    }
    return SqlStatement.update("CREATE TABLE IF NOT EXISTS " + dialect.quoteIdent(table)
        + " (" + String.join(", ", defs) + ")");
  }

  private String columnDefinition(Column c) {
    String def = dialect.quoteIdent(c.name()) + " " + dialect.columnType(c);
    if (c.autoIncrement()) return def + " " + dialect.autoIncrementClause(c);
    if (c.defaultValue() != null) return def + " " + dialect.defaultClause(c);
    if (c.isNotNull()) return def + " NOT NULL";
    return def;
  }

  private String foreignKey(Column c) {
    Reference ref = c.reference();
    if (ref == null || c.extra("foreign_key") == null) return null;
    StringBuilder sb = new StringBuilder("FOREIGN KEY (")
        .append(dialect.quoteIdent(c.name()))
        .append(") REFERENCES ")
        .append(dialect.quoteIdent(namespace.tableName(ref.targetEntity())))
        .append("(").append(dialect.quoteIdent(ref.targetColumn())).append(")");
    String onDelete = c.extra("on_delete");
    if (onDelete != null) sb.append(" ON DELETE ").append(referentialAction(onDelete));
    String onUpdate = c.extra("on_update");
    if (onUpdate != null) sb.append(" ON UPDATE ").append(referentialAction(onUpdate));
    return sb.toString();
  }

  private static String referentialAction(String raw) {
    return raw.trim().toUpperCase(Locale.ROOT).replace('_', ' ');
  }

  /** One statement per indexed column plus one full-text index per language. */
  public List<SqlStatement> createIndexes(EntitySchema schema) {
    String table = tableName(schema);
    List<SqlStatement> out = new ArrayList<>();
    Map<String, List<Column>> textByLanguage = new LinkedHashMap<>();
    for (Column c : schema.columns()) {
      if (c.indexType() == null || c.indexType().isBlank()) continue;
      if (c.isTextSearchIndex()) {
        textByLanguage.computeIfAbsent(c.textSearchLanguage(), k -> new ArrayList<>()).add(c);
      } else {
        out.add(SqlStatement.update(dialect.createIndex(table, c)));
      }
    }
    for (var e : textByLanguage.entrySet()) {
      out.add(SqlStatement.update(dialect.createTextSearchIndex(table, e.getKey(), e.getValue())));
    }
    return out;
  }

  /* ---------------- DML ---------------- */

  public SqlStatement insert(EntitySchema schema, Map<String, ?> document) {
    Objects.requireNonNull(document, "document");
    return SqlStatement.update(insertPrefix(schema) + " VALUES " + valuesRow(schema, document));
  }

  public SqlStatement insertMany(EntitySchema schema, List<? extends Map<String, ?>> documents) {
    if (documents == null || documents.isEmpty()) {
      throw new IllegalArgumentException("insertMany requires at least one document");
    }
    List<String> rows = new ArrayList<>(documents.size());
    for (Map<String, ?> d : documents) rows.add(valuesRow(schema, Objects.requireNonNull(d, "document")));
    return SqlStatement.update(insertPrefix(schema) + " VALUES " + String.join(",", rows));
  }

  public SqlStatement upsert(EntitySchema schema, Map<String, ?> document) {
    Objects.requireNonNull(document, "document");
    List<String> updateColumns = new ArrayList<>();
    for (Column c : schema.columns()) {
      if (!c.name().equals(schema.primaryKeyName())) updateColumns.add(c.name());
    }
    return SqlStatement.update(insertPrefix(schema) + " VALUES " + valuesRow(schema, document)
        + " " + dialect.upsertClause(schema.primaryKeyName(), updateColumns));
  }

  private String insertPrefix(EntitySchema schema) {
    List<String> cols = new ArrayList<>();
    for (Column c : schema.columns()) cols.add(dialect.quoteIdent(c.name()));
    return "INSERT INTO " + dialect.quoteIdent(tableName(schema)) + " (" + String.join(", ", cols) + ")";
  }

  private String valuesRow(EntitySchema schema, Map<String, ?> document) {
    List<String> values = new ArrayList<>();
    for (Column c : schema.columns()) {
      Object v = document.get(c.name());
      // identity columns take the generated value when the document leaves them out
      if (v == null && c.autoIncrement()) values.add("DEFAULT");
      else values.add(dialect.encodeValue(c, v));
    }
    return "(" + String.join(", ", values) + ")";
  }

  /** Overwrites every non-key column of the row identified by the document's primary key. */
  public SqlStatement update(EntitySchema schema, Map<String, ?> document) {
    Objects.requireNonNull(document, "document");
    List<String> sets = new ArrayList<>();
    for (Column c : schema.columns()) {
      if (c.name().equals(schema.primaryKeyName())) continue;
      sets.add(dialect.quoteIdent(c.name()) + " = " + dialect.encodeValue(c, document.get(c.name())));
    }
    if (sets.isEmpty()) throw new IllegalArgumentException("Mutation has no SET columns");
    return SqlStatement.update("UPDATE " + dialect.quoteIdent(tableName(schema))
        + " SET " + String.join(", ", sets) + byPrimaryKey(schema, document));
  }

  public SqlStatement updateOne(EntitySchema schema, Query query, Mutation mutation) {
    return SqlStatement.update("UPDATE " + dialect.quoteIdent(tableName(schema))
        + " SET " + setClause(schema, mutation) + inBoundedSubquery(schema, query));
  }

  public SqlStatement updateMany(EntitySchema schema, Query query, Mutation mutation) {
    return SqlStatement.update("UPDATE " + dialect.quoteIdent(tableName(schema))
        + " SET " + setClause(schema, mutation) + where(schema, query));
  }

  private String setClause(EntitySchema schema, Mutation mutation) {
    List<String> sets = new ArrayList<>();
    if (mutation != null) {
      for (var e : mutation.sets().entrySet()) {
        if (e.getKey().equals(schema.primaryKeyName())) continue;
        Column c = schema.column(e.getKey());
        if (c == null) continue;
        sets.add(dialect.quoteIdent(c.name()) + " = " + dialect.encodeValue(c, e.getValue()));
      }
    }
    if (sets.isEmpty()) throw new IllegalArgumentException("Mutation has no SET columns");
    return String.join(", ", sets);
  }

  public SqlStatement delete(EntitySchema schema, Map<String, ?> document) {
    Objects.requireNonNull(document, "document");
    return SqlStatement.update("DELETE FROM " + dialect.quoteIdent(tableName(schema)) + byPrimaryKey(schema, document));
  }

  public SqlStatement deleteOne(EntitySchema schema, Query query) {
    return SqlStatement.update("DELETE FROM " + dialect.quoteIdent(tableName(schema)) + inBoundedSubquery(schema, query));
  }

  public SqlStatement deleteMany(EntitySchema schema, Query query) {
    return SqlStatement.update("DELETE FROM " + dialect.quoteIdent(tableName(schema)) + where(schema, query));
  }

  private String byPrimaryKey(EntitySchema schema, Map<String, ?> document) {
    Object pk = document.get(schema.primaryKeyName());
    if (pk == null) {
      throw new IllegalArgumentException("Document has no value for primary key '" + schema.primaryKeyName() + "'");
    }
    return " WHERE " + dialect.quoteIdent(schema.primaryKeyName()) + " = " + dialect.encodeValue(schema.primaryKey(), pk);
  }

  private String inBoundedSubquery(EntitySchema schema, Query query) {
    String tail = (where(schema, query) + orderBy(schema, query)).trim();
    return " WHERE " + dialect.quoteIdent(schema.primaryKeyName()) + " IN ("
        + dialect.boundedSubquery(tableName(schema), schema.primaryKeyName(), tail) + ")";
  }

  /* ---------------- Queries ---------------- */

  public SqlStatement find(EntitySchema schema, Query query) {
    Query q = query == null ? new Query() : query;
    return SqlStatement.query(select(schema, q) + where(schema, q) + orderBy(schema, q)
        + " " + dialect.formatPagination(q));
  }

  public SqlStatement findOne(EntitySchema schema, Query query) {
    Query q = query == null ? new Query() : query;
    return SqlStatement.query(select(schema, q) + where(schema, q) + orderBy(schema, q) + " LIMIT 1");
  }

  public SqlStatement findById(EntitySchema schema, Object primaryKey) {
    if (primaryKey == null) throw new IllegalArgumentException("primaryKey must not be null");
    return SqlStatement.query(select(schema, new Query())
        + " WHERE " + dialect.quoteIdent(schema.primaryKeyName()) + " = "
        + dialect.encodeValue(schema.primaryKey(), primaryKey) + " LIMIT 1");
  }

  public SqlStatement count(EntitySchema schema, Query query) {
    return SqlStatement.query("SELECT COUNT(*) AS " + dialect.quoteIdent("count")
        + " FROM " + dialect.quoteIdent(tableName(schema)) + where(schema, query));
  }

  /**
   * Loads the documents whose primary key is one of {@code keys}: the caller's filters and projection
   * apply (the key is always projected), sort and pagination do not.
   */
  public SqlStatement fetchAssociations(EntitySchema schema, Query query, List<String> keys) {
    Query q = query == null ? new Query() : query.copy();
    Map<String, Object> in = new LinkedHashMap<>();
    in.put("$in", List.copyOf(keys));
    q.withFilter(schema.primaryKeyName(), in);
    if (!q.fields().isEmpty() && !q.fields().contains(schema.primaryKeyName())) {
      List<String> fields = new ArrayList<>(q.fields());
      fields.add(schema.primaryKeyName());
      q.withFields(fields);
    }
    return SqlStatement.query(select(schema, q) + where(schema, q));
  }

  private String select(EntitySchema schema, Query query) {
    List<String> cols = new ArrayList<>();
    for (String f : query.fields()) {
      if (schema.column(f) != null) cols.add(dialect.formatField(f));
    }
    if (cols.isEmpty()) {
      for (Column c : schema.columns()) cols.add(dialect.quoteIdent(c.name()));
    }
    return "SELECT " + String.join(", ", cols) + " FROM " + dialect.quoteIdent(tableName(schema));
  }

  private String orderBy(EntitySchema schema, Query query) {
    if (query == null) return "";
    SortField sort = query.sort();
    if (sort == null || schema.column(sort.field()) == null) return "";
    return " ORDER BY " + dialect.formatField(sort.field()) + (sort.descending() ? " DESC" : " ASC");
  }

  /** {@code " WHERE ..."} or {@code ""} when no filter yields a condition. */
  String where(EntitySchema schema, Query query) {
    if (query == null) return "";
    String cond = conditions(schema, query.filters());
    return cond.isEmpty() ? "" : " WHERE " + cond;
  }

  private String conditions(EntitySchema schema, Map<String, ?> filters) {
    if (filters == null || filters.isEmpty()) return "";
    List<String> parts = new ArrayList<>();
    for (var e : filters.entrySet()) {
      String key = e.getKey();
      Object value = e.getValue();
      switch (key) {
        case "$and", "$or" -> {
          String group = logicalGroup(schema, value, key.equals("$and") ? " AND " : " OR ");
          if (!group.isEmpty()) parts.add(group);
        }
        case "$text" -> {
          if (value instanceof Map<?, ?> m) {
            @SuppressWarnings("unchecked")
            String text = dialect.formatTextSearch((Map<String, ?>) m);
            if (text != null) parts.add(text);
          }
        }
        default -> {
          if (key.startsWith("$")) continue;
          Column c = schema.column(key);
          if (c == null) continue;
          String frag = dialect.formatFilter(c, key, value);
          if (!frag.isEmpty()) parts.add(frag);
        }
      }
    }
    return String.join(" AND ", parts);
  }

  private String logicalGroup(EntitySchema schema, Object value, String joiner) {
    Iterable<?> items = Documents.asIterable(value);
    if (items == null) return "";
    List<String> members = new ArrayList<>();
    for (Object item : items) {
      if (!(item instanceof Map<?, ?> m)) continue;
      @SuppressWarnings("unchecked")
      String cond = conditions(schema, (Map<String, ?>) m);
      if (!cond.isEmpty()) members.add("(" + cond + ")");
    }
    if (members.isEmpty()) return "";
    return "(" + String.join(joiner, members) + ")";
  }
}
