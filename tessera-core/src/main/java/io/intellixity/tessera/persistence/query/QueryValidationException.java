package io.intellixity.tessera.persistence.query;

/**
 * Raised when a Query or Mutation references unknown fields, unknown operators or values that do not
 * parse as their column type.
 * <p>
 * Only thrown by strict validation; the SQL compiler itself degrades malformed input instead of failing.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
