package io.intellixity.tessera.persistence.query;

import io.intellixity.tessera.persistence.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QueryJsonTest {
  @Test
  void readsCanonicalQueryJson() throws Exception {
    String json = """
        {"fields": "id, name", "filters": {"age": "18,65", "tags": {"$in": ["a", "b"]}},
         "sort_by": "age", "descending": true, "offset": 20, "limit": 5}
        """;
    Query q = Json.mapper().readValue(json, Query.class);

    assertEquals(List.of("id", "name"), q.fields());
    assertEquals("18,65", q.filters().get("age"));
    assertEquals(Map.of("$in", List.of("a", "b")), q.filters().get("tags"));
    assertEquals(SortField.desc("age"), q.sort());
    assertEquals(20, q.offset());
    assertEquals(5, q.limit());
  }

  @Test
  void missingKeysUseDefaults() throws Exception {
    Query q = Json.mapper().readValue("{}", Query.class);
    assertTrue(q.fields().isEmpty());
    assertTrue(q.filters().isEmpty());
    assertNull(q.sort());
    assertEquals(0, q.offset());
    assertEquals(Query.DEFAULT_LIMIT, q.limit());
  }

  @Test
  void writesSortAsSortByAndDescending() {
    Query q = Query.where("age", ">=18").withSort(SortField.asc("age")).withLimit(3);
    String json = Json.write(q);
    assertTrue(json.contains("\"sort_by\":\"age\""), json);
    assertTrue(json.contains("\"descending\":false"), json);
    assertTrue(json.contains("\"limit\":3"), json);
    assertFalse(json.contains("\"fields\""), json);
  }

  @Test
  void mutationAcceptsWrappedAndBareForms() throws Exception {
    Mutation wrapped = Json.mapper().readValue("{\"sets\": {\"age\": 30}}", Mutation.class);
    Mutation bare = Json.mapper().readValue("{\"age\": 30}", Mutation.class);
    assertEquals(Map.of("age", 30), wrapped.sets());
    assertEquals(wrapped.sets(), bare.sets());
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> new Query().withLimit(0));
    assertThrows(IllegalArgumentException.class, () -> new Query().withOffset(-1));
  }
}
