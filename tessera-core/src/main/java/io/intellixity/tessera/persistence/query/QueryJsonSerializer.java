package io.intellixity.tessera.persistence.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link Query}; the inverse of {@link QueryJsonDeserializer}. */
public final class QueryJsonSerializer extends JsonSerializer<Query> {
  @Override
  public void serialize(Query q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    if (!q.fields().isEmpty()) {
      g.writeObjectField("fields", q.fields());
    }
    if (!q.filters().isEmpty()) {
      g.writeObjectField("filters", q.filters());
    }
    if (q.sort() != null) {
      g.writeStringField("sort_by", q.sort().field());
      g.writeBooleanField("descending", q.sort().descending());
    }
    g.writeNumberField("offset", q.offset());
    g.writeNumberField("limit", q.limit());
    g.writeEndObject();
  }
}
