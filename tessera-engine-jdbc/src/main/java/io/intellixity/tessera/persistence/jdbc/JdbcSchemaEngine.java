package io.intellixity.tessera.persistence.jdbc;

import io.intellixity.tessera.persistence.exec.SchemaEngine;
import io.intellixity.tessera.persistence.jdbc.compile.SchemaCompiler;
import io.intellixity.tessera.persistence.model.EntitySchema;
import io.intellixity.tessera.persistence.query.Mutation;
import io.intellixity.tessera.persistence.query.Query;
import io.intellixity.tessera.persistence.spi.exec.QueryValidationStrategy;
import io.intellixity.tessera.persistence.util.Documents;
import io.intellixity.tessera.persistence.util.Json;

import java.util.*;

/**
 * {@link SchemaEngine} over JDBC: validate, compile, execute.\n
 *
 * Reads run on the schema's reader pool, writes and DDL on its writer pool.
 */
public final class JdbcSchemaEngine implements SchemaEngine {
  private final SchemaCompiler compiler;
  private final SqlExecutor executor;
  private final QueryValidationStrategy validation;

  public JdbcSchemaEngine(SchemaCompiler compiler, SqlExecutor executor, QueryValidationStrategy validation) {
    this.compiler = Objects.requireNonNull(compiler, "compiler");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.validation = validation == null ? QueryValidationStrategy.LENIENT : validation;
  }

  public SchemaCompiler compiler() { return compiler; }

  @Override
  public long createTable(EntitySchema schema) {
    return executor.execute(schema.writerName(), compiler.createTable(schema));
  }

  @Override
  public long createIndexes(EntitySchema schema) {
    long max = 0;
    for (SqlStatement ss : compiler.createIndexes(schema)) {
      max = Math.max(max, executor.execute(schema.writerName(), ss));
    }
    return max;
  }

  @Override
  public long insert(EntitySchema schema, Map<String, Object> document) {
    return executor.execute(schema.writerName(), compiler.insert(schema, document));
  }

  @Override
  public long insertMany(EntitySchema schema, List<Map<String, Object>> documents) {
    return executor.execute(schema.writerName(), compiler.insertMany(schema, documents));
  }

  @Override
  public long update(EntitySchema schema, Map<String, Object> document) {
    return executor.execute(schema.writerName(), compiler.update(schema, document));
  }

  @Override
  public long updateOne(EntitySchema schema, Query query, Mutation mutation) {
    validation.validate(schema, query);
    validation.validateMutation(schema, mutation);
    return executor.execute(schema.writerName(), compiler.updateOne(schema, query, mutation));
  }

  @Override
  public long updateMany(EntitySchema schema, Query query, Mutation mutation) {
    validation.validate(schema, query);
    validation.validateMutation(schema, mutation);
    return executor.execute(schema.writerName(), compiler.updateMany(schema, query, mutation));
  }

  @Override
  public long upsert(EntitySchema schema, Map<String, Object> document) {
    return executor.execute(schema.writerName(), compiler.upsert(schema, document));
  }

  @Override
  public long delete(EntitySchema schema, Map<String, Object> document) {
    return executor.execute(schema.writerName(), compiler.delete(schema, document));
  }

  @Override
  public long deleteOne(EntitySchema schema, Query query) {
    validation.validate(schema, query);
    return executor.execute(schema.writerName(), compiler.deleteOne(schema, query));
  }

  @Override
  public long deleteMany(EntitySchema schema, Query query) {
    validation.validate(schema, query);
    return executor.execute(schema.writerName(), compiler.deleteMany(schema, query));
  }

  @Override
  public List<Map<String, Object>> find(EntitySchema schema, Query query) {
    validation.validate(schema, query);
    return executor.query(schema.readerName(), compiler.find(schema, query));
  }

  @Override
  public <T> List<T> findAs(EntitySchema schema, Query query, Class<T> type) {
    List<Map<String, Object>> rows = find(schema, query);
    List<T> out = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) out.add(convert(schema, row, type));
    return out;
  }

  @Override
  public Optional<Map<String, Object>> findOne(EntitySchema schema, Query query) {
    validation.validate(schema, query);
    return executor.queryOne(schema.readerName(), compiler.findOne(schema, query));
  }

  @Override
  public <T> Optional<T> findOneAs(EntitySchema schema, Query query, Class<T> type) {
    return findOne(schema, query).map(row -> convert(schema, row, type));
  }

  @Override
  public Optional<Map<String, Object>> findById(EntitySchema schema, Object primaryKey) {
    return executor.queryOne(schema.readerName(), compiler.findById(schema, primaryKey));
  }

  @Override
  public long count(EntitySchema schema, Query query) {
    validation.validate(schema, query);
    return executor.queryOne(schema.readerName(), compiler.count(schema, query))
        .map(row -> row.values().iterator().next())
        .map(v -> v instanceof Number n ? n.longValue() : Long.parseLong(String.valueOf(v)))
        .orElse(0L);
  }

  @Override
  public long fetch(EntitySchema schema, Query query, List<Map<String, Object>> data, List<String> columns) {
    if (data == null || data.isEmpty() || columns == null || columns.isEmpty()) return 0;

    Set<String> keys = new LinkedHashSet<>();
    for (Map<String, Object> doc : data) {
      for (String col : columns) keys.addAll(Documents.parseStringArray(doc.get(col)));
    }
    if (keys.isEmpty()) return 0;

    validation.validate(schema, query);
    List<Map<String, Object>> rows = executor.query(schema.readerName(),
        compiler.fetchAssociations(schema, query, new ArrayList<>(keys)));

    Map<String, Map<String, Object>> byKey = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) {
      String k = Documents.keyOf(row.get(schema.primaryKeyName()));
      if (k != null) byKey.putIfAbsent(k, row);
    }

    for (Map<String, Object> doc : data) {
      for (String col : columns) {
        Object v = doc.get(col);
        if (v != null) doc.put(col, splice(v, byKey));
      }
    }
    return byKey.size();
  }

  @Override
  public long fetchOne(EntitySchema schema, Query query, Map<String, Object> data, List<String> columns) {
    if (data == null) return 0;
    return fetch(schema, query, List.of(data), columns);
  }

  /** Scalars are replaced by their associated document; csv strings and collections element-wise. */
  private static Object splice(Object value, Map<String, Map<String, Object>> byKey) {
    if (value instanceof CharSequence cs && cs.toString().contains(",")) {
      return spliceAll(Documents.parseStringArray(value), byKey);
    }
    String k = Documents.keyOf(value);
    if (k != null) {
      Map<String, Object> assoc = byKey.get(k.trim());
      return assoc == null ? value : assoc;
    }
    Iterable<?> items = Documents.asIterable(value);
    return items == null ? value : spliceAll(items, byKey);
  }

  private static List<Object> spliceAll(Iterable<?> items, Map<String, Map<String, Object>> byKey) {
    List<Object> out = new ArrayList<>();
    for (Object item : items) {
      String k = Documents.keyOf(item);
      Map<String, Object> assoc = k == null ? null : byKey.get(k.trim());
      out.add(assoc == null ? item : assoc);
    }
    return out;
  }

  @Override
  public long execute(EntitySchema schema, String sql, List<String> params) {
    return executor.execute(schema.writerName(), new SqlStatement(sql, params, SqlStatement.ExecKind.UPDATE));
  }

  @Override
  public List<Map<String, Object>> query(EntitySchema schema, String sql, List<String> params) {
    return executor.query(schema.readerName(), new SqlStatement(sql, params, SqlStatement.ExecKind.QUERY));
  }

  @Override
  public Optional<Map<String, Object>> queryOne(EntitySchema schema, String sql, List<String> params) {
    return executor.queryOne(schema.readerName(), new SqlStatement(sql, params, SqlStatement.ExecKind.QUERY));
  }

  private static <T> T convert(EntitySchema schema, Map<String, Object> row, Class<T> type) {
    try {
      return Json.mapper().convertValue(row, type);
    } catch (IllegalArgumentException e) {
      throw new RowDecodeException(schema.typeName(), "cannot convert row to " + type.getName(), e);
    }
  }
}
