package io.intellixity.tessera.persistence.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SemanticTypeTest {
  @Test
  void resolvesTagsAndAliasesCaseInsensitively() {
    assertEquals(SemanticType.BOOL, SemanticType.fromTag("boolean"));
    assertEquals(SemanticType.I64, SemanticType.fromTag("LONG"));
    assertEquals(SemanticType.STRING, SemanticType.fromTag(" text "));
    assertEquals(SemanticType.TEXT_ARRAY, SemanticType.fromTag("list<string>"));
    assertEquals(SemanticType.JSON, SemanticType.fromTag("map"));
  }

  @Test
  void unknownTagResolvesToNull() {
    assertNull(SemanticType.fromTag("geometry"));
    assertNull(SemanticType.fromTag(null));
    assertNull(Column.of("shape", "geometry").semanticType());
  }

  @Test
  void categories() {
    assertTrue(SemanticType.U16.isUnsigned());
    assertTrue(SemanticType.U16.isInteger());
    assertFalse(SemanticType.I32.isUnsigned());
    assertTrue(SemanticType.F32.isNumeric());
    assertTrue(SemanticType.TIME.isTemporal());
    assertTrue(SemanticType.UUID_ARRAY.isArray());
    assertFalse(SemanticType.UUID.isArray());
  }
}
