package io.intellixity.tessera.persistence.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Shared Jackson mapper for document values (JSON columns, literals and typed conversions). */
public final class Json {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private Json() {}

  public static ObjectMapper mapper() { return MAPPER; }

  public static String write(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON-serializable: " + value.getClass().getName(), e);
    }
  }

  /** Parses JSON text into maps, lists and scalars. */
  public static Object read(String text) throws JsonProcessingException {
    return MAPPER.readValue(text, Object.class);
  }
}
