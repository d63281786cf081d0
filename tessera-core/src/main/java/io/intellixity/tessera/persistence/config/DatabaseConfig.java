package io.intellixity.tessera.persistence.config;

import io.intellixity.tessera.persistence.model.Namespace;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Database section of the application config.
 *
 * <pre>
 * name: demo-app
 * database:
 *   namespace: demo
 *   type: postgres
 *   strict-filters: false
 * postgres:
 *   - name: main
 *     database: demo
 *     username: demo
 *     password: secret
 * </pre>
 *
 * Pools are read from the array keyed by the dialect id ({@code type}). Missing required keys throw
 * {@link IllegalStateException}: a broken static config is an ops error, not a runtime condition.
 */
public record DatabaseConfig(String applicationName,
                             String namespace,
                             String type,
                             boolean strictFilters,
                             List<PoolConfig> pools) {
  public static final String DEFAULT_TYPE = "postgres";

  public DatabaseConfig {
    Objects.requireNonNull(applicationName, "applicationName");
    Objects.requireNonNull(namespace, "namespace");
    type = (type == null || type.isBlank()) ? DEFAULT_TYPE : type;
    pools = List.copyOf(Objects.requireNonNull(pools, "pools"));
  }

  public Namespace namespaceObject() { return new Namespace(namespace); }

  public static DatabaseConfig fromMap(Map<String, ?> root) {
    Objects.requireNonNull(root, "root");
    String appName = ConfigValues.requireString(root, "name");
    Map<String, Object> database = ConfigValues.table(root, "database");
    String namespace = ConfigValues.requireString(database, "namespace");
    String type = ConfigValues.string(database, "type", DEFAULT_TYPE);
    boolean strict = ConfigValues.bool(database, "strict-filters", false);

    Object poolsRaw = root.get(type);
    if (poolsRaw == null) throw new IllegalStateException("the `" + type + "` field should be specified");
    if (!(poolsRaw instanceof List<?> entries)) {
      throw new IllegalStateException("the `" + type + "` field should be an array of tables");
    }
    List<PoolConfig> pools = new ArrayList<>();
    for (Object entry : entries) {
      if (!(entry instanceof Map<?, ?> table)) continue;
      @SuppressWarnings("unchecked")
      Map<String, Object> t = (Map<String, Object>) table;
      pools.add(PoolConfig.fromMap(t));
    }
    if (pools.isEmpty()) throw new IllegalStateException("the `" + type + "` field should contain at least one table");
    return new DatabaseConfig(appName, namespace, type, strict, pools);
  }
}
