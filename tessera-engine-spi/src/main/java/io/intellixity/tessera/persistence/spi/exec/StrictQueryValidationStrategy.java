package io.intellixity.tessera.persistence.spi.exec;

import io.intellixity.tessera.persistence.model.Column;
import io.intellixity.tessera.persistence.model.EntitySchema;
import io.intellixity.tessera.persistence.model.SemanticType;
import io.intellixity.tessera.persistence.query.Mutation;
import io.intellixity.tessera.persistence.query.Query;
import io.intellixity.tessera.persistence.query.QueryValidationException;
import io.intellixity.tessera.persistence.util.Documents;
import io.intellixity.tessera.persistence.util.TemporalValues;

import java.math.BigDecimal;
import java.util.*;

/**
 * Fail-closed validation.\n
 *
 * Rejects with {@link QueryValidationException}:\n
 * - filter, sort, projection and mutation fields that are not declared columns\n
 * - unknown {@code $} operators and non-array {@code $in}/{@code $nin} operands\n
 * - string values that do not parse as the column's semantic type\n
 */
public final class StrictQueryValidationStrategy implements QueryValidationStrategy {
  private static final Set<String> OPERATORS = Set.of(
      "$eq", "$ne", "$lt", "$lte", "$gt", "$gte", "$in", "$nin", "$all", "$size");
  private static final Set<String> TEMPORAL_KEYWORDS = Set.of(
      "epoch", "now", "today", "tomorrow", "yesterday", "midnight");

  @Override
  public void validate(EntitySchema schema, Query query) {
    Objects.requireNonNull(schema, "schema");
    if (query == null) return;

    for (String f : query.fields()) requireColumn(schema, f, "projection");
    if (query.sort() != null) requireColumn(schema, query.sort().field(), "sort");
    validateFilters(schema, query.filters());
  }

  @Override
  public void validateMutation(EntitySchema schema, Mutation mutation) {
    Objects.requireNonNull(schema, "schema");
    if (mutation == null || mutation.isEmpty()) {
      throw new QueryValidationException("Mutation has no SET columns for entity '" + schema.typeName() + "'");
    }
    for (var e : mutation.sets().entrySet()) {
      Column col = requireColumn(schema, e.getKey(), "mutation");
      if (col.name().equals(schema.primaryKeyName())) {
        throw new QueryValidationException("Mutation must not assign primary key '" + col.name() + "'");
      }
      if (e.getValue() instanceof String s) requireParsable(col, s);
    }
  }

  private void validateFilters(EntitySchema schema, Map<String, ?> filters) {
    if (filters == null) return;
    for (var e : filters.entrySet()) {
      String key = e.getKey();
      Object value = e.getValue();
      switch (key) {
        case "$and", "$or" -> {
          Iterable<?> groups = Documents.asIterable(value);
          if (groups == null) throw new QueryValidationException(key + " expects an array of filter objects");
          for (Object g : groups) {
            if (!(g instanceof Map<?, ?> m)) throw new QueryValidationException(key + " expects an array of filter objects");
            @SuppressWarnings("unchecked")
            Map<String, ?> nested = (Map<String, ?>) m;
            validateFilters(schema, nested);
          }
        }
        case "$text" -> validateTextSearch(schema, value);
        default -> {
          if (key.startsWith("$")) throw new QueryValidationException("Unknown filter operator '" + key + "'");
          validateFilter(requireColumn(schema, key, "filter"), value);
        }
      }
    }
  }

  private static void validateTextSearch(EntitySchema schema, Object value) {
    if (!(value instanceof Map<?, ?> m)) throw new QueryValidationException("$text expects an object");
    List<String> fields = Documents.parseStringArray(m.get("$fields"));
    if (fields.isEmpty() || Documents.parseString(m.get("$search")) == null) {
      throw new QueryValidationException("$text requires $fields and $search");
    }
    for (String f : fields) requireColumn(schema, f, "$text");
  }

  private static void validateFilter(Column col, Object value) {
    SemanticType t = col.semanticType();
    if (value instanceof Map<?, ?> ops) {
      if (t == SemanticType.JSON) return;
      for (var op : ops.entrySet()) {
        String name = String.valueOf(op.getKey());
        if (!OPERATORS.contains(name)) {
          throw new QueryValidationException("Unknown operator '" + name + "' on field '" + col.name() + "'");
        }
        Object operand = op.getValue();
        if ((name.equals("$in") || name.equals("$nin")) && Documents.asIterable(operand) == null) {
          throw new QueryValidationException(name + " on field '" + col.name() + "' expects an array");
        }
        if (name.equals("$size") && !(operand instanceof Number)) {
          throw new QueryValidationException("$size on field '" + col.name() + "' expects a number");
        }
        if (operand instanceof String s) requireParsable(col, s);
      }
      return;
    }
    if (!(value instanceof String s) || t == null) return;

    if (t.isNumeric() || t.isTemporal()) {
      int comma = s.indexOf(',');
      if (comma >= 0) {
        requireParsable(col, s.substring(0, comma));
        requireParsable(col, s.substring(comma + 1));
      } else {
        requireParsable(col, stripPrefix(s, "<>="));
      }
    } else if (t == SemanticType.UUID) {
      if (s.equals("null") || s.equals("notnull")) return;
      for (String part : s.split(",")) requireParsable(col, part);
    } else if (t == SemanticType.UUID_ARRAY) {
      for (String part : s.split("[,;]")) requireParsable(col, part);
    } else if (t == SemanticType.BOOL || t == SemanticType.BYTES) {
      requireParsable(col, s);
    }
  }

  private static void requireParsable(Column col, String raw) {
    SemanticType t = col.semanticType();
    if (t == null) return;
    String s = raw.trim();
    boolean ok = switch (t) {
      case BOOL -> s.equals("true") || s.equals("false");
      case U8, U16, U32, U64 -> parsesUnsigned(s);
      case I8, I16, I32, I64 -> parsesSigned(s);
      case F32, F64 -> parsesDecimal(s);
      case DATETIME, LOCAL_DATETIME, DATE, TIME -> TEMPORAL_KEYWORDS.contains(s) || TemporalValues.isValid(t, s);
      case UUID, UUID_ARRAY -> parsesUuid(s);
      case BYTES -> s.length() % 2 == 0 && s.chars().allMatch(ch -> Character.digit(ch, 16) >= 0);
      default -> true;
    };
    if (!ok) {
      throw new QueryValidationException(
          "Value '" + raw + "' is not a valid " + t.tag() + " for field '" + col.name() + "'");
    }
  }

  private static Column requireColumn(EntitySchema schema, String field, String usage) {
    if (field == null || field.isBlank()) {
      throw new QueryValidationException("Blank field in " + usage + " for entity '" + schema.typeName() + "'");
    }
    Column col = schema.column(field);
    if (col == null) {
      throw new QueryValidationException(
          "Unknown field '" + field + "' in " + usage + " for entity '" + schema.typeName() + "'");
    }
    return col;
  }

  private static String stripPrefix(String s, String chars) {
    int i = 0;
    while (i < s.length() && chars.indexOf(s.charAt(i)) >= 0) i++;
    return s.substring(i);
  }

  private static boolean parsesUnsigned(String s) {
    try {
      Long.parseUnsignedLong(s);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static boolean parsesSigned(String s) {
    try {
      Long.parseLong(s);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static boolean parsesDecimal(String s) {
    try {
      new BigDecimal(s);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static boolean parsesUuid(String s) {
    try {
      UUID.fromString(s);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }
}
