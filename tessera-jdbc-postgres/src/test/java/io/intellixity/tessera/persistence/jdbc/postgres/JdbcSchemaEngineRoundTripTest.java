package io.intellixity.tessera.persistence.jdbc.postgres;

import io.intellixity.tessera.persistence.config.DatabaseConfig;
import io.intellixity.tessera.persistence.config.PasswordDecryptor;
import io.intellixity.tessera.persistence.config.PoolConfig;
import io.intellixity.tessera.persistence.jdbc.DatabaseRuntime;
import io.intellixity.tessera.persistence.jdbc.JdbcSchemaEngine;
import io.intellixity.tessera.persistence.model.Column;
import io.intellixity.tessera.persistence.model.EntitySchema;
import io.intellixity.tessera.persistence.model.SemanticType;
import io.intellixity.tessera.persistence.query.Query;
import io.intellixity.tessera.persistence.query.QueryFilters;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/** Tables created from the schema itself, written and read back through HSQLDB in PostgreSQL syntax mode. */
final class JdbcSchemaEngineRoundTripTest {
  private static final String REF = "6f1c2a3e-9b4d-4c5e-8f70-112233445566";

  private static final EntitySchema ITEM = EntitySchema.of("item", List.of(
      Column.of("id", SemanticType.STRING),
      Column.of("active", SemanticType.BOOL),
      Column.of("score", SemanticType.F64),
      Column.of("born", SemanticType.DATE),
      Column.of("ref", SemanticType.UUID),
      Column.of("raw", SemanticType.BYTES),
      Column.of("note", SemanticType.STRING).withDefault("none")));

  private DatabaseRuntime runtime;
  private JdbcSchemaEngine engine;

  @BeforeEach
  void setUp() {
    String url = "jdbc:hsqldb:mem:tessera_" + UUID.randomUUID().toString().replace("-", "") + ";sql.syntax_pgs=true";
    PoolConfig pool = PoolConfig.of("main", "tessera", "SA", "").withUrl(url);
    DatabaseConfig config = new DatabaseConfig("tessera-test", "demo", "postgres", false, List.of(pool));

    runtime = DatabaseRuntime.start(config, new PostgresDialect(), PasswordDecryptor.NONE);
    engine = runtime.engine();
    engine.createTable(ITEM);

    Map<String, Object> first = new LinkedHashMap<>();
    first.put("id", "i1");
    first.put("active", true);
    first.put("score", 1.5);
    first.put("born", "2024-01-02");
    first.put("ref", REF);
    engine.insert(ITEM, first);

    Map<String, Object> second = new LinkedHashMap<>();
    second.put("id", "i2");
    second.put("active", false);
    second.put("note", "kept");
    engine.insert(ITEM, second);
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  @Test
  void typedColumnsDecodeBackToDocumentValues() {
    Map<String, Object> row = engine.findById(ITEM, "i1").orElseThrow();

    assertEquals(Boolean.TRUE, row.get("active"));
    assertEquals(1.5, row.get("score"));
    assertEquals("2024-01-02", row.get("born"));
    assertTrue(REF.equalsIgnoreCase((String) row.get("ref")), String.valueOf(row.get("ref")));
    assertNull(row.get("raw"));
    assertEquals("none", row.get("note"));
  }

  @Test
  void missingValuesStayNullUnlessTheColumnHasADefault() {
    Map<String, Object> row = engine.findById(ITEM, "i2").orElseThrow();

    assertEquals(Boolean.FALSE, row.get("active"));
    assertNull(row.get("score"));
    assertNull(row.get("born"));
    assertNull(row.get("ref"));
    assertEquals("kept", row.get("note"));
  }

  @Test
  void filtersMatchTypedColumns() {
    assertEquals(1, engine.count(ITEM, Query.where("active", "true")));
    assertEquals(1, engine.count(ITEM, Query.where("score", ">1")));
    assertEquals(List.of("i1"), engine.find(ITEM, Query.where("born", "2024-01-02")).stream()
        .map(r -> r.get("id")).toList());
  }

  @Test
  void nullOperandsMatchMissingValues() {
    assertEquals(1, engine.count(ITEM, Query.where("score", QueryFilters.eq(null))));
    assertEquals(1, engine.count(ITEM, Query.where("score", QueryFilters.ne(null))));
    assertEquals(1, engine.count(ITEM, Query.where("born", null)));
    assertEquals(0, engine.count(ITEM, Query.where("note", QueryFilters.eq(null))));
  }

  @Test
  void bytesDecodeFromBinaryColumns() {
    assertEquals(1, engine.execute(ITEM, "UPDATE \"demo_item\" SET \"raw\" = X'0102' WHERE \"id\" = ?", List.of("i1")));

    assertArrayEquals(new byte[]{1, 2}, (byte[]) engine.findById(ITEM, "i1").orElseThrow().get("raw"));
  }
}
