package io.intellixity.tessera.persistence.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DatabaseConfigTest {
  @Test
  void loadsYamlResource() {
    DatabaseConfig cfg = ConfigLoader.loadResource("tessera-test.yml");

    assertEquals("demo-app", cfg.applicationName());
    assertEquals("demo", cfg.namespace());
    assertEquals("postgres", cfg.type());
    assertTrue(cfg.strictFilters());
    assertEquals(3, cfg.pools().size());

    PoolConfig main = cfg.pools().get(0);
    assertEquals("main", main.name());
    assertEquals(6543, main.portOr(5432));
    assertEquals(8, main.maxConnections());
    assertEquals(1, main.minConnections());
    assertEquals(Duration.ofSeconds(5), main.acquireTimeout());
    assertEquals(Duration.ofSeconds(60), main.healthCheckInterval());

    PoolConfig replica = cfg.pools().get(1);
    assertEquals("replica.internal", replica.host());
    assertEquals(5432, replica.portOr(5432));
    assertEquals("", replica.password());

    assertEquals("jdbc:postgresql://reports.internal/reports", cfg.pools().get(2).url());
  }

  @Test
  void missingRequiredKeyNamesTheKey() {
    Map<String, Object> root = Map.of(
        "name", "app",
        "database", Map.of("namespace", "demo"),
        "postgres", List.of(Map.of("username", "demo")));

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> DatabaseConfig.fromMap(root));
    assertEquals("the `database` field should be specified", ex.getMessage());
  }

  @Test
  void poolsAreReadFromTheDialectSection() {
    Map<String, Object> root = Map.of(
        "name", "app",
        "database", Map.of("namespace", "demo", "type", "mysql"),
        "postgres", List.of(Map.of("database", "pg", "username", "u")));

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> DatabaseConfig.fromMap(root));
    assertEquals("the `mysql` field should be specified", ex.getMessage());
  }

  @Test
  void poolToStringHidesPassword() {
    PoolConfig p = PoolConfig.of("main", "demo", "demo", "hunter2");
    assertFalse(p.toString().contains("hunter2"));
  }
}
