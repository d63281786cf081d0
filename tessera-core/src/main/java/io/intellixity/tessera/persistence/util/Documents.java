package io.intellixity.tessera.persistence.util;

import java.util.*;

/** Helpers for dynamically-typed document values. */
public final class Documents {
  private Documents() {}

  /**
   * Reads a value as a list of strings: a collection or array of scalars, or a comma-separated string.
   * Blank entries and non-scalar elements are skipped; {@code null} yields an empty list.
   */
  public static List<String> parseStringArray(Object value) {
    if (value == null) return List.of();
    List<String> out = new ArrayList<>();
    if (value instanceof CharSequence cs) {
      for (String part : cs.toString().split(",")) {
        String s = part.trim();
        if (!s.isEmpty()) out.add(s);
      }
      return out;
    }
    Iterable<?> items = asIterable(value);
    if (items == null) {
      if (value instanceof Number || value instanceof UUID) out.add(String.valueOf(value));
      return out;
    }
    for (Object item : items) {
      if (item instanceof CharSequence || item instanceof Number || item instanceof UUID) {
        String s = String.valueOf(item).trim();
        if (!s.isEmpty()) out.add(s);
      }
    }
    return out;
  }

  /** Non-blank string value, or {@code null}. */
  public static String parseString(Object value) {
    if (value == null) return null;
    String s = String.valueOf(value);
    return s.isBlank() ? null : s;
  }

  /** Collections and object arrays as an iterable; {@code null} for anything else. */
  public static Iterable<?> asIterable(Object value) {
    if (value instanceof Collection<?> c) return c;
    if (value instanceof Object[] arr) return Arrays.asList(arr);
    return null;
  }

  /** Key under which a scalar reference is indexed; {@code null} for non-scalars. */
  public static String keyOf(Object value) {
    if (value instanceof CharSequence || value instanceof Number || value instanceof UUID) {
      return String.valueOf(value);
    }
    return null;
  }
}
