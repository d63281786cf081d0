package io.intellixity.tessera.persistence.model;

import java.util.Objects;

/** Foreign-key target: the referenced entity type and its column. */
public record Reference(String targetEntity, String targetColumn) {
  public Reference {
    Objects.requireNonNull(targetEntity, "targetEntity");
    targetColumn = (targetColumn == null || targetColumn.isBlank()) ? "id" : targetColumn;
  }

  public static Reference to(String targetEntity) {
    return new Reference(targetEntity, "id");
  }
}
