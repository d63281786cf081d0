package io.intellixity.tessera.persistence.util;

import io.intellixity.tessera.persistence.model.SemanticType;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Lenient temporal text checks used before a string is emitted as a date/time literal.
 * <p>
 * Accepts ISO-8601 with either {@code 'T'} or a space between date and time, optional seconds and
 * fraction, and (for zoned values) an optional offset. A bare date is accepted for datetime columns.
 */
public final class TemporalValues {
  private static final DateTimeFormatter TIME = new DateTimeFormatterBuilder()
      .appendPattern("HH:mm")
      .optionalStart().appendPattern(":ss").optionalEnd()
      .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
      .toFormatter();

  private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart().appendLiteral('T').optionalEnd()
      .optionalStart().appendLiteral(' ').optionalEnd()
      .append(TIME)
      .toFormatter();

  private static final DateTimeFormatter ZONED_DATE_TIME = new DateTimeFormatterBuilder()
      .append(LOCAL_DATE_TIME)
      .optionalStart().appendLiteral(' ').optionalEnd()
      .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
      .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
      .optionalStart().appendOffset("+HH", "Z").optionalEnd()
      .toFormatter();

  private TemporalValues() {}

  /** Whether {@code text} parses as a value of the given temporal type. Non-temporal types return false. */
  public static boolean isValid(SemanticType type, String text) {
    if (type == null || text == null || text.isBlank()) return false;
    String s = text.trim();
    return switch (type) {
      case DATETIME -> parses(ZONED_DATE_TIME, s) || parses(DateTimeFormatter.ISO_LOCAL_DATE, s);
      case LOCAL_DATETIME -> parses(LOCAL_DATE_TIME, s) || parses(DateTimeFormatter.ISO_LOCAL_DATE, s);
      case DATE -> parses(DateTimeFormatter.ISO_LOCAL_DATE, s);
      case TIME -> parses(TIME, s);
      default -> false;
    };
  }

  private static boolean parses(DateTimeFormatter f, String s) {
    try {
      f.parse(s);
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }
}
