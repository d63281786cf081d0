package io.intellixity.tessera.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.LinkedHashMap;
import java.util.Map;

/** Field assignments for an UPDATE. */
@JsonDeserialize(using = MutationJsonDeserializer.class)
public final class Mutation {
  private final Map<String, Object> sets = new LinkedHashMap<>();

  public Mutation() {}

  public Map<String, Object> sets() { return sets; }

  public Mutation set(String field, Object value) { sets.put(field, value); return this; }

  public Mutation setAll(Map<String, ?> values) {
    if (values != null) sets.putAll(values);
    return this;
  }

  public boolean isEmpty() { return sets.isEmpty(); }

  public static Mutation of(Map<String, ?> values) {
    return new Mutation().setAll(values);
  }

  @Override
  public String toString() { return "Mutation{sets=" + sets + "}"; }
}
