package io.intellixity.tessera.persistence.spi.exec;

import io.intellixity.tessera.persistence.model.Column;
import io.intellixity.tessera.persistence.model.EntitySchema;
import io.intellixity.tessera.persistence.model.SemanticType;
import io.intellixity.tessera.persistence.query.Mutation;
import io.intellixity.tessera.persistence.query.Query;
import io.intellixity.tessera.persistence.query.QueryFilters;
import io.intellixity.tessera.persistence.query.QueryValidationException;
import io.intellixity.tessera.persistence.query.SortField;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class StrictQueryValidationStrategyTest {
  private static final EntitySchema USER = EntitySchema.of("user", List.of(
      Column.of("id", SemanticType.UUID),
      Column.of("name", SemanticType.STRING),
      Column.of("age", SemanticType.I32),
      Column.of("active", SemanticType.BOOL),
      Column.of("created", SemanticType.DATETIME),
      Column.of("tags", SemanticType.TEXT_ARRAY),
      Column.of("meta", SemanticType.JSON)));

  private final QueryValidationStrategy strict = QueryValidationStrategy.forMode(true);

  @Test
  void acceptsWellFormedQuery() {
    Query q = new Query()
        .withFields("id", "name")
        .withFilter("age", "18,65")
        .withFilter("created", ">=yesterday")
        .withFilter("active", "true")
        .withFilter("tags", "a,b;c")
        .withFilter("meta", Map.of("k", "v"))
        .withFilter("$or", QueryFilters.group(Map.of("name", "~^a"), Map.of("age", QueryFilters.gt(3))))
        .withFilter("$text", QueryFilters.text(List.of("name"), "ann", null))
        .withSort(SortField.desc("age"));

    assertDoesNotThrow(() -> strict.validate(USER, q));
  }

  @Test
  void rejectsUnknownFieldsEverywhere() {
    assertThrows(QueryValidationException.class, () -> strict.validate(USER, Query.where("email", "x")));
    assertThrows(QueryValidationException.class, () -> strict.validate(USER, new Query().withFields("email")));
    assertThrows(QueryValidationException.class, () -> strict.validate(USER, new Query().withSort(SortField.asc("email"))));
    assertThrows(QueryValidationException.class, () -> strict.validate(USER,
        Query.where("$and", QueryFilters.group(Map.of("email", "x")))));
  }

  @Test
  void rejectsUnknownOperatorsAndBadOperands() {
    assertThrows(QueryValidationException.class, () -> strict.validate(USER, Query.where("$nor", List.of())));
    assertThrows(QueryValidationException.class, () -> strict.validate(USER, Query.where("age", Map.of("$regex", "1"))));
    assertThrows(QueryValidationException.class, () -> strict.validate(USER, Query.where("age", Map.of("$in", "1,2"))));
    assertThrows(QueryValidationException.class, () -> strict.validate(USER, Query.where("tags", Map.of("$size", "2"))));
  }

  @Test
  void rejectsUnparsableValues() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> strict.validate(USER, Query.where("age", ">=abc")));
    assertTrue(ex.getMessage().contains("not a valid i32"), ex.getMessage());

    assertThrows(QueryValidationException.class, () -> strict.validate(USER, Query.where("id", "not-a-uuid")));
    assertThrows(QueryValidationException.class, () -> strict.validate(USER, Query.where("active", "yes")));
    assertThrows(QueryValidationException.class, () -> strict.validate(USER, Query.where("created", "2024-13-45")));
  }

  @Test
  void mutationMustSetKnownNonKeyColumns() {
    assertThrows(QueryValidationException.class, () -> strict.validateMutation(USER, new Mutation()));
    assertThrows(QueryValidationException.class, () -> strict.validateMutation(USER, new Mutation().set("id", "x")));
    assertThrows(QueryValidationException.class, () -> strict.validateMutation(USER, new Mutation().set("email", "x")));
    assertDoesNotThrow(() -> strict.validateMutation(USER, new Mutation().set("age", 31).set("name", "Ann")));
  }

  @Test
  void lenientModeAcceptsAnything() {
    QueryValidationStrategy lenient = QueryValidationStrategy.forMode(false);
    assertSame(QueryValidationStrategy.LENIENT, lenient);
    assertDoesNotThrow(() -> lenient.validate(USER, Query.where("email", Map.of("$regex", 1))));
    assertDoesNotThrow(() -> lenient.validateMutation(USER, new Mutation()));
  }
}
