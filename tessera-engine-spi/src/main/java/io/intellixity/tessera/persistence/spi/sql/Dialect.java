package io.intellixity.tessera.persistence.spi.sql;

import io.intellixity.tessera.persistence.model.Column;
import io.intellixity.tessera.persistence.query.Query;

import java.util.Map;

/**
 * Per-dialect encoder: renders column types, literals, filters and identifiers as SQL text.
 * <p>
 * Encoding never fails on malformed input. Values that do not parse as their column's semantic type
 * render as {@code NULL}, and unrecognized filter shapes fall back to equality.
 */
public interface Dialect {
  String id();

  /** DDL type token; unknown semantic types pass through unchanged. */
  String columnType(Column column);

  /**
   * SQL literal for a dynamic value (null, Boolean, Number, CharSequence, Collection or array, Map,
   * byte[], or anything with a meaningful {@code toString}).
   */
  String encodeValue(Column column, Object value);

  /** Type-directed literal for a string value, including temporal keywords such as {@code now}. */
  String formatValue(Column column, String value);

  /** One boolean SQL fragment for a field filter, or {@code ""} when it yields no condition. */
  String formatFilter(Column column, String field, Object value);

  /** Quoted identifier; dotted paths are quoted per segment. */
  String formatField(String field);

  /** Single-quoted string literal. */
  String escapeString(String value);

  /** LIMIT/OFFSET clause for a query. */
  String formatPagination(Query query);

  /**
   * Full-text predicate from {@code {$fields, $search, $language}}, or {@code null} when
   * fields or search are missing.
   */
  String formatTextSearch(Map<String, ?> spec);
}
