package io.intellixity.tessera.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link Query}.
 *
 * <pre>
 * { "fields": ["id", "name"], "filters": {"age": "18,65"}, "sort_by": "age", "descending": true,
 *   "offset": 0, "limit": 20 }
 * </pre>
 */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Query JSON must be an object");

    Query q = new Query();

    JsonNode fields = root.get("fields");
    if (fields != null && fields.isArray()) {
      List<String> out = new ArrayList<>();
      for (JsonNode x : fields) if (x.isTextual()) out.add(x.asText());
      q.withFields(out);
    } else if (fields != null && fields.isTextual()) {
      List<String> out = new ArrayList<>();
      for (String s : fields.asText().split(",")) {
        if (!s.isBlank()) out.add(s.trim());
      }
      q.withFields(out);
    }

    JsonNode filters = root.get("filters");
    if (filters != null && filters.isObject()) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(filters, LinkedHashMap.class);
      q.withFilters(m);
    }

    String sortBy = textOrNull(root.get("sort_by"));
    if (sortBy != null && !sortBy.isBlank()) {
      boolean desc = boolOrDefault(root.get("descending"), false);
      q.withSort(new SortField(sortBy, desc ? SortField.Direction.DESC : SortField.Direction.ASC));
    }

    q.withOffset(longOrDefault(root.get("offset"), 0));
    q.withLimit(longOrDefault(root.get("limit"), Query.DEFAULT_LIMIT));
    return q;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static long longOrDefault(JsonNode n, long def) {
    if (n == null || n.isNull()) return def;
    return n.isNumber() ? n.longValue() : Long.parseLong(n.asText());
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}
