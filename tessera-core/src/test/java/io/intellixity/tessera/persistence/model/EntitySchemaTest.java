package io.intellixity.tessera.persistence.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class EntitySchemaTest {
  @Test
  void defaultsPrimaryKeyAndPools() {
    EntitySchema s = EntitySchema.of("user", List.of(
        Column.of("id", SemanticType.UUID),
        Column.of("name", SemanticType.STRING)));

    assertEquals("id", s.primaryKeyName());
    assertEquals("main", s.readerName());
    assertEquals("main", s.writerName());
    assertEquals(List.of("id", "name"), s.columnNames());
    assertEquals("name", s.column("name").name());
    assertNull(s.column("missing"));
  }

  @Test
  void rejectsDuplicateColumns() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> EntitySchema.of("user", List.of(
        Column.of("id", SemanticType.UUID),
        Column.of("id", SemanticType.STRING))));
    assertTrue(ex.getMessage().contains("Duplicate column 'id'"));
  }

  @Test
  void rejectsUndeclaredPrimaryKey() {
    assertThrows(IllegalArgumentException.class, () -> EntitySchema.builder("user")
        .primaryKey("user_id")
        .column("id", SemanticType.UUID)
        .build());
  }

  @Test
  void columnWithersKeepOtherAttributes() {
    Column c = Column.of("bio", SemanticType.STRING)
        .withIndex("text:german")
        .notNull()
        .withExtra("foreign_key", "true");

    assertFalse(c.nullable());
    assertTrue(c.isTextSearchIndex());
    assertEquals("german", c.textSearchLanguage());
    assertEquals("true", c.extra("foreign_key"));
    assertEquals("english", Column.of("t", "string").withIndex("text").textSearchLanguage());
  }

  @Test
  void namespaceNormalizesTableNames() {
    Namespace ns = new Namespace("demo");
    assertEquals("demo_user", ns.tableName("user"));
    assertEquals("demo_order_line", ns.tableName("order-line"));
    assertEquals("demo:user", ns.modelNamespace("user"));
  }
}
