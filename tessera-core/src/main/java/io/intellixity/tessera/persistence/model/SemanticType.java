package io.intellixity.tessera.persistence.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Semantic column types.\n
 *
 * Each type has a canonical tag (used in schemas and config) plus optional aliases.
 * Dialects map these to DDL tokens; unknown tags are not an error and resolve to {@code null}.
 */
public enum SemanticType {
  BOOL("bool", "boolean"),
  U8("u8"),
  U16("u16"),
  U32("u32"),
  U64("u64"),
  I8("i8", "byte"),
  I16("i16", "short"),
  I32("i32", "int"),
  I64("i64", "long"),
  F32("f32", "float"),
  F64("f64", "double"),
  STRING("string", "text"),
  DATETIME("datetime"),
  LOCAL_DATETIME("local_datetime"),
  DATE("date"),
  TIME("time"),
  UUID("uuid"),
  BYTES("bytes"),
  TEXT_ARRAY("list<string>"),
  UUID_ARRAY("list<uuid>"),
  JSON("json", "map");

  private static final Map<String, SemanticType> BY_TAG = new HashMap<>();

  static {
    for (SemanticType t : values()) {
      for (String tag : t.tags) BY_TAG.put(tag, t);
    }
  }

  private final String tag;
  private final String[] tags;

  SemanticType(String... tags) {
    this.tag = tags[0];
    this.tags = tags;
  }

  public String tag() { return tag; }

  /** Resolves a tag or alias (case-insensitive); returns {@code null} for unknown tags. */
  public static SemanticType fromTag(String tag) {
    if (tag == null) return null;
    return BY_TAG.get(tag.trim().toLowerCase(Locale.ROOT));
  }

  public boolean isUnsigned() {
    return this == U8 || this == U16 || this == U32 || this == U64;
  }

  public boolean isInteger() {
    return isUnsigned() || this == I8 || this == I16 || this == I32 || this == I64;
  }

  public boolean isFloat() { return this == F32 || this == F64; }

  public boolean isNumeric() { return isInteger() || isFloat(); }

  public boolean isTemporal() {
    return this == DATETIME || this == LOCAL_DATETIME || this == DATE || this == TIME;
  }

  public boolean isArray() { return this == TEXT_ARRAY || this == UUID_ARRAY; }
}
