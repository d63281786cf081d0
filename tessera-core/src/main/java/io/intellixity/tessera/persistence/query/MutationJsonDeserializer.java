package io.intellixity.tessera.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Accepts {@code {"sets": {...}}} or a bare object of assignments. */
public final class MutationJsonDeserializer extends JsonDeserializer<Mutation> {
  @Override
  public Mutation deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Mutation JSON must be an object");

    JsonNode sets = root.has("sets") && root.get("sets").isObject() ? root.get("sets") : root;
    @SuppressWarnings("unchecked")
    Map<String, Object> m = codec.treeToValue(sets, LinkedHashMap.class);
    return Mutation.of(m);
  }
}
