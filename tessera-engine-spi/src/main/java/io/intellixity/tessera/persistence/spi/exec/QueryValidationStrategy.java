package io.intellixity.tessera.persistence.spi.exec;

import io.intellixity.tessera.persistence.model.EntitySchema;
import io.intellixity.tessera.persistence.query.Mutation;
import io.intellixity.tessera.persistence.query.Query;

/**
 * SPI hook to validate query and mutation documents before SQL compilation.
 * <p>
 * The compiler degrades malformed input to {@code NULL} or best-effort predicates. Engines call this
 * hook first so deployments can fail closed instead; {@link #LENIENT} keeps the compiler's behavior.
 */
public interface QueryValidationStrategy {
  QueryValidationStrategy LENIENT = new QueryValidationStrategy() {
    @Override public void validate(EntitySchema schema, Query query) {}
    @Override public String toString() { return "LENIENT"; }
  };

  void validate(EntitySchema schema, Query query);

  default void validateMutation(EntitySchema schema, Mutation mutation) {}

  static QueryValidationStrategy forMode(boolean strict) {
    return strict ? new StrictQueryValidationStrategy() : LENIENT;
  }
}
