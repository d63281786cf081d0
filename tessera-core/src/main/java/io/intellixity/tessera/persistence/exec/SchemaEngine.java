package io.intellixity.tessera.persistence.exec;

import io.intellixity.tessera.persistence.model.EntitySchema;
import io.intellixity.tessera.persistence.query.Mutation;
import io.intellixity.tessera.persistence.query.Query;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backend-agnostic operations over an entity schema.
 * <p>
 * Documents are {@code Map<String, Object>} with JSON-like values. Mutating operations return the number
 * of affected rows. Each call runs as its own unit of work; no transaction spans calls.
 */
public interface SchemaEngine {
  long createTable(EntitySchema schema);

  long createIndexes(EntitySchema schema);

  long insert(EntitySchema schema, Map<String, Object> document);

  long insertMany(EntitySchema schema, List<Map<String, Object>> documents);

  /** Overwrites every non-key column of the row whose primary key matches the document's. */
  long update(EntitySchema schema, Map<String, Object> document);

  /** Updates at most one row: the first match under the query's sort order. */
  long updateOne(EntitySchema schema, Query query, Mutation mutation);

  long updateMany(EntitySchema schema, Query query, Mutation mutation);

  long upsert(EntitySchema schema, Map<String, Object> document);

  long delete(EntitySchema schema, Map<String, Object> document);

  /** Deletes at most one row: the first match under the query's sort order. */
  long deleteOne(EntitySchema schema, Query query);

  long deleteMany(EntitySchema schema, Query query);

  List<Map<String, Object>> find(EntitySchema schema, Query query);

  <T> List<T> findAs(EntitySchema schema, Query query, Class<T> type);

  Optional<Map<String, Object>> findOne(EntitySchema schema, Query query);

  <T> Optional<T> findOneAs(EntitySchema schema, Query query, Class<T> type);

  Optional<Map<String, Object>> findById(EntitySchema schema, Object primaryKey);

  long count(EntitySchema schema, Query query);

  /**
   * Replaces foreign-key values held in {@code columns} of every document with the referenced
   * documents of {@code schema}, loaded with a single query.
   *
   * @return number of distinct associated documents loaded
   */
  long fetch(EntitySchema schema, Query query, List<Map<String, Object>> data, List<String> columns);

  /** Single-document variant of {@link #fetch}. */
  long fetchOne(EntitySchema schema, Query query, Map<String, Object> data, List<String> columns);

  long execute(EntitySchema schema, String sql, List<String> params);

  List<Map<String, Object>> query(EntitySchema schema, String sql, List<String> params);

  Optional<Map<String, Object>> queryOne(EntitySchema schema, String sql, List<String> params);
}
