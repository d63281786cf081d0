package io.intellixity.tessera.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Document-oriented query: projection, per-field filters, a single sort key and offset pagination.
 * <p>
 * Filter keys are field names (or {@code $and}, {@code $or}, {@code $text}); values follow the filter
 * value grammar of the dialects. Instances are built per request and consumed once.
 */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query {
  public static final int DEFAULT_LIMIT = 10;

  private List<String> fields = new ArrayList<>();
  private Map<String, Object> filters = new LinkedHashMap<>();
  private SortField sort;
  private long offset;
  private long limit = DEFAULT_LIMIT;

  public Query() {}

  public List<String> fields() { return fields; }
  public Map<String, Object> filters() { return filters; }
  public SortField sort() { return sort; }
  public long offset() { return offset; }
  public long limit() { return limit; }

  public Query withFields(List<String> fields) { this.fields = new ArrayList<>(fields == null ? List.of() : fields); return this; }
  public Query withFields(String... fields) { return withFields(Arrays.asList(fields)); }
  public Query withFilters(Map<String, Object> filters) { this.filters = new LinkedHashMap<>(filters == null ? Map.of() : filters); return this; }
  public Query withFilter(String field, Object value) { this.filters.put(field, value); return this; }
  public Query withSort(SortField sort) { this.sort = sort; return this; }
  public Query withOffset(long offset) {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    this.offset = offset;
    return this;
  }
  public Query withLimit(long limit) {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    this.limit = limit;
    return this;
  }

  /** Adds every entry of {@code more}; existing keys are overwritten. */
  public Query appendFilters(Map<String, ?> more) {
    if (more != null) filters.putAll(more);
    return this;
  }

  /** Shallow copy; filter values are shared. */
  public Query copy() {
    Query q = new Query();
    q.fields = new ArrayList<>(fields);
    q.filters = new LinkedHashMap<>(filters);
    q.sort = sort;
    q.offset = offset;
    q.limit = limit;
    return q;
  }

  public static Query of(Map<String, Object> filters) {
    return new Query().withFilters(filters);
  }

  public static Query where(String field, Object value) {
    return new Query().withFilter(field, value);
  }

  @Override
  public String toString() {
    return "Query{fields=" + fields + ", filters=" + filters + ", sort=" + sort
        + ", offset=" + offset + ", limit=" + limit + "}";
  }
}
