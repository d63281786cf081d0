package io.intellixity.tessera.persistence.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static schema of a persisted entity type: its ordered columns, primary key and the
 * names of the pools it reads from and writes to.
 */
public record EntitySchema(String typeName,
                           String primaryKeyName,
                           String readerName,
                           String writerName,
                           List<Column> columns) {
  public static final String DEFAULT_PRIMARY_KEY = "id";
  public static final String DEFAULT_POOL = "main";

  public EntitySchema {
    Objects.requireNonNull(typeName, "typeName");
    primaryKeyName = (primaryKeyName == null || primaryKeyName.isBlank()) ? DEFAULT_PRIMARY_KEY : primaryKeyName;
    readerName = (readerName == null || readerName.isBlank()) ? DEFAULT_POOL : readerName;
    writerName = (writerName == null || writerName.isBlank()) ? DEFAULT_POOL : writerName;
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    if (columns.isEmpty()) throw new IllegalArgumentException("Entity '" + typeName + "' declares no columns");

    Map<String, Column> seen = new LinkedHashMap<>();
    for (Column c : columns) {
      if (seen.put(c.name(), c) != null) {
        throw new IllegalArgumentException("Duplicate column '" + c.name() + "' in entity '" + typeName + "'");
      }
    }
    if (!seen.containsKey(primaryKeyName)) {
      throw new IllegalArgumentException("Primary key '" + primaryKeyName + "' is not a column of entity '" + typeName + "'");
    }
  }

  public static EntitySchema of(String typeName, List<Column> columns) {
    return new EntitySchema(typeName, DEFAULT_PRIMARY_KEY, DEFAULT_POOL, DEFAULT_POOL, columns);
  }

  public static Builder builder(String typeName) { return new Builder(typeName); }

  public Column column(String name) {
    if (name == null) return null;
    for (Column c : columns) {
      if (c.name().equals(name)) return c;
    }
    return null;
  }

  public Column primaryKey() { return column(primaryKeyName); }

  public List<String> columnNames() {
    List<String> out = new ArrayList<>(columns.size());
    for (Column c : columns) out.add(c.name());
    return Collections.unmodifiableList(out);
  }

  public static final class Builder {
    private final String typeName;
    private String primaryKeyName = DEFAULT_PRIMARY_KEY;
    private String readerName = DEFAULT_POOL;
    private String writerName = DEFAULT_POOL;
    private final List<Column> columns = new ArrayList<>();

    private Builder(String typeName) { this.typeName = typeName; }

    public Builder primaryKey(String name) { this.primaryKeyName = name; return this; }
    public Builder reader(String name) { this.readerName = name; return this; }
    public Builder writer(String name) { this.writerName = name; return this; }
    public Builder column(Column column) { this.columns.add(column); return this; }
    public Builder column(String name, SemanticType type) { return column(Column.of(name, type)); }

    public EntitySchema build() {
      return new EntitySchema(typeName, primaryKeyName, readerName, writerName, columns);
    }
  }
}
