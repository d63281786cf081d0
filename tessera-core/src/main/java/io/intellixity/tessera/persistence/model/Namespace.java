package io.intellixity.tessera.persistence.model;

import java.util.Objects;

/** Table-name prefix shared by all entities of one database config. */
public record Namespace(String prefix) {
  public Namespace {
    Objects.requireNonNull(prefix, "prefix");
    if (prefix.isBlank()) throw new IllegalArgumentException("Namespace prefix must not be blank");
  }

  /** {@code {prefix}_{type}} with every non-alphanumeric character normalized to {@code _}. */
  public String tableName(String typeName) {
    return normalize(prefix + "_" + typeName);
  }

  /** {@code {prefix}:{type}}. */
  public String modelNamespace(String typeName) {
    return prefix + ":" + typeName;
  }

  private static String normalize(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      sb.append(Character.isLetterOrDigit(ch) || ch == '_' ? ch : '_');
    }
    return sb.toString();
  }
}
