package io.intellixity.tessera.persistence.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One persisted field of an entity.
 * <p>
 * {@code typeName} is a {@link SemanticType} tag; tags the engine does not know are kept verbatim and
 * passed through to DDL. {@code indexType} is one of {@code hash}, {@code btree}, {@code gin} or
 * {@code text[:language]}.
 */
public record Column(String name,
                     String typeName,
                     boolean nullable,
                     String defaultValue,
                     String indexType,
                     boolean autoIncrement,
                     Reference reference,
                     Map<String, String> extra) {
  public static final String TEXT_INDEX_PREFIX = "text";
  public static final String DEFAULT_TEXT_LANGUAGE = "english";

  public Column {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(typeName, "typeName");
    if (name.isBlank()) throw new IllegalArgumentException("Column name must not be blank");
    extra = (extra == null) ? Map.of() : Map.copyOf(extra);
  }

  public static Column of(String name, String typeName) {
    return new Column(name, typeName, true, null, null, false, null, Map.of());
  }

  public static Column of(String name, SemanticType type) {
    return of(name, type.tag());
  }

  public Column notNull() { return new Column(name, typeName, false, defaultValue, indexType, autoIncrement, reference, extra); }
  public Column withDefault(String value) { return new Column(name, typeName, nullable, value, indexType, autoIncrement, reference, extra); }
  public Column withIndex(String type) { return new Column(name, typeName, nullable, defaultValue, type, autoIncrement, reference, extra); }
  public Column withAutoIncrement() { return new Column(name, typeName, nullable, defaultValue, indexType, true, reference, extra); }
  public Column withReference(Reference ref) { return new Column(name, typeName, nullable, defaultValue, indexType, autoIncrement, ref, extra); }

  public Column withExtra(String key, String value) {
    Map<String, String> m = new LinkedHashMap<>(extra);
    m.put(key, value);
    return new Column(name, typeName, nullable, defaultValue, indexType, autoIncrement, reference, m);
  }

  /** Resolved semantic type, or {@code null} when {@link #typeName()} is not a known tag. */
  public SemanticType semanticType() { return SemanticType.fromTag(typeName); }

  public boolean isNotNull() { return !nullable; }

  public boolean isTextSearchIndex() {
    return indexType != null && indexType.toLowerCase(Locale.ROOT).startsWith(TEXT_INDEX_PREFIX);
  }

  /** Language of a {@code text[:lang]} index; defaults to {@value #DEFAULT_TEXT_LANGUAGE}. */
  public String textSearchLanguage() {
    if (!isTextSearchIndex()) return null;
    int i = indexType.indexOf(':');
    if (i < 0 || i == indexType.length() - 1) return DEFAULT_TEXT_LANGUAGE;
    return indexType.substring(i + 1).trim();
  }

  public String extra(String key) { return extra.get(key); }
}
