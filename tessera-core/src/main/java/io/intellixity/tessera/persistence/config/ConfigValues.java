package io.intellixity.tessera.persistence.config;

import java.util.Map;

/** Typed reads from a parsed config table. */
final class ConfigValues {
  private ConfigValues() {}

  static String requireString(Map<String, ?> m, String key) {
    Object v = m.get(key);
    if (v == null) throw new IllegalStateException("the `" + key + "` field should be specified");
    if (v instanceof Map || v instanceof Iterable) {
      throw new IllegalStateException("the `" + key + "` field should be a string");
    }
    return String.valueOf(v);
  }

  static String string(Map<String, ?> m, String key, String def) {
    Object v = m.get(key);
    return v == null ? def : String.valueOf(v);
  }

  static boolean bool(Map<String, ?> m, String key, boolean def) {
    Object v = m.get(key);
    if (v == null) return def;
    if (v instanceof Boolean b) return b;
    return Boolean.parseBoolean(String.valueOf(v));
  }

  static long number(Map<String, ?> m, String key, long def) {
    Object v = m.get(key);
    if (v == null) return def;
    if (v instanceof Number n) return n.longValue();
    try {
      return Long.parseLong(String.valueOf(v).trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException("the `" + key + "` field should be an integer", e);
    }
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> table(Map<String, ?> m, String key) {
    Object v = m.get(key);
    if (v == null) throw new IllegalStateException("the `" + key + "` field should be specified");
    if (!(v instanceof Map<?, ?> t)) throw new IllegalStateException("the `" + key + "` field should be a table");
    return (Map<String, Object>) t;
  }
}
