package io.intellixity.tessera.persistence.query;

import java.util.*;

/** Builders for operator-object filter values, e.g. {@code query.withFilter("age", QueryFilters.gte(18))}. */
public final class QueryFilters {
  private QueryFilters() {}

  public static Map<String, Object> eq(Object value) { return op("$eq", value); }
  public static Map<String, Object> ne(Object value) { return op("$ne", value); }
  public static Map<String, Object> lt(Object value) { return op("$lt", value); }
  public static Map<String, Object> lte(Object value) { return op("$lte", value); }
  public static Map<String, Object> gt(Object value) { return op("$gt", value); }
  public static Map<String, Object> gte(Object value) { return op("$gte", value); }

  public static Map<String, Object> in(Collection<?> values) { return op("$in", new ArrayList<>(values)); }
  public static Map<String, Object> nin(Collection<?> values) { return op("$nin", new ArrayList<>(values)); }

  /** Array column contains every value. */
  public static Map<String, Object> all(Collection<?> values) { return op("$all", new ArrayList<>(values)); }

  /** Array column has exactly {@code size} elements. */
  public static Map<String, Object> size(int size) { return op("$size", size); }

  /** Half-open range filter string {@code "min,max"}. */
  public static String range(Object min, Object max) { return min + "," + max; }

  public static Map<String, Object> text(List<String> fields, String search, String language) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("$fields", List.copyOf(fields));
    m.put("$search", search);
    if (language != null) m.put("$language", language);
    return m;
  }

  @SafeVarargs
  public static List<Map<String, Object>> group(Map<String, Object>... filters) {
    return List.of(filters);
  }

  private static Map<String, Object> op(String name, Object value) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(name, value);
    return m;
  }
}
