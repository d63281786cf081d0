package io.intellixity.tessera.persistence.util;

import io.intellixity.tessera.persistence.model.SemanticType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TemporalValuesTest {
  @Test
  void acceptsLenientIsoForms() {
    assertTrue(TemporalValues.isValid(SemanticType.DATETIME, "2024-03-01T10:15:30Z"));
    assertTrue(TemporalValues.isValid(SemanticType.DATETIME, "2024-03-01 10:15:30.123+02:00"));
    assertTrue(TemporalValues.isValid(SemanticType.DATETIME, "2024-03-01"));
    assertTrue(TemporalValues.isValid(SemanticType.LOCAL_DATETIME, "2024-03-01T10:15"));
    assertTrue(TemporalValues.isValid(SemanticType.DATE, "2024-03-01"));
    assertTrue(TemporalValues.isValid(SemanticType.TIME, "23:59:59"));
  }

  @Test
  void rejectsGarbageAndNonTemporalTypes() {
    assertFalse(TemporalValues.isValid(SemanticType.DATE, "yesterdayish"));
    assertFalse(TemporalValues.isValid(SemanticType.TIME, "25"));
    assertFalse(TemporalValues.isValid(SemanticType.STRING, "2024-03-01"));
  }

  @Test
  void parsesStringArraysFromCsvAndCollections() {
    assertEquals(List.of("a", "b"), Documents.parseStringArray(" a, ,b"));
    assertEquals(List.of("1", "x"), Documents.parseStringArray(List.of(1, "x", List.of("nested"))));
    assertEquals(List.of(), Documents.parseStringArray(null));
  }
}
