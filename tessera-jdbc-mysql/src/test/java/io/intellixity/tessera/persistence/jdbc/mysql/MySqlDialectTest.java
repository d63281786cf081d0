package io.intellixity.tessera.persistence.jdbc.mysql;

import io.intellixity.tessera.persistence.config.PoolConfig;
import io.intellixity.tessera.persistence.jdbc.SqlStatement;
import io.intellixity.tessera.persistence.jdbc.compile.SchemaCompiler;
import io.intellixity.tessera.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tessera.persistence.model.Column;
import io.intellixity.tessera.persistence.model.EntitySchema;
import io.intellixity.tessera.persistence.model.Namespace;
import io.intellixity.tessera.persistence.model.SemanticType;
import io.intellixity.tessera.persistence.query.Mutation;
import io.intellixity.tessera.persistence.query.Query;
import io.intellixity.tessera.persistence.query.QueryFilters;
import io.intellixity.tessera.persistence.query.SortField;
import io.intellixity.tessera.persistence.util.TesseraFactoriesLoader;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MySqlDialectTest {
  private static final EntitySchema USER = EntitySchema.of("user", List.of(
      Column.of("id", SemanticType.I64).withAutoIncrement(),
      Column.of("name", SemanticType.STRING).withDefault("anon"),
      Column.of("age", SemanticType.U8),
      Column.of("bio", SemanticType.STRING).withIndex("text"),
      Column.of("tags", SemanticType.TEXT_ARRAY).withIndex("gin"),
      Column.of("created", SemanticType.LOCAL_DATETIME).withIndex("btree"),
      Column.of("code", SemanticType.STRING).withIndex("hash")));

  private final MySqlDialect d = new MySqlDialect();
  private final SchemaCompiler compiler = new SchemaCompiler(d, new Namespace("demo"));

  @Test
  void createTableUsesMySqlTypes() {
    assertEquals("CREATE TABLE IF NOT EXISTS `demo_user` (`id` BIGINT AUTO_INCREMENT, "
        + "`name` VARCHAR(255) DEFAULT 'anon', `age` TINYINT UNSIGNED, `bio` VARCHAR(255), `tags` JSON, "
        + "`created` DATETIME(6), `code` VARCHAR(255), CONSTRAINT `demo_user_pkey` PRIMARY KEY (`id`))",
        compiler.createTable(USER).sql());
  }

  @Test
  void createIndexes() {
    assertEquals(List.of(
        "CREATE INDEX `demo_user_tags_index` ON `demo_user` (`tags`)",
        "CREATE INDEX `demo_user_created_index` ON `demo_user` (`created` DESC) USING BTREE",
        "CREATE INDEX `demo_user_code_index` ON `demo_user` (`code`) USING HASH",
        "CREATE FULLTEXT INDEX `demo_user_text_search_english_index` ON `demo_user` (`bio`)"),
        compiler.createIndexes(USER).stream().map(SqlStatement::sql).toList());
  }

  @Test
  void escapesBackslashesAndQuotes() {
    assertEquals("'a\\\\b''c'", d.escapeString("a\\b'c"));
    assertEquals("`we``ird`", d.formatField("we`ird"));
  }

  @Test
  void arraysAreJson() {
    Column tags = USER.column("tags");
    assertEquals("json_array('a','b')", d.encodeValue(tags, List.of("a", "b")));
    assertEquals("json_overlaps(`tags`, json_array('a','b'))", d.formatFilter(tags, "tags", "a,b"));
    assertEquals("(json_overlaps(`tags`, json_array('a','b'))) AND (json_overlaps(`tags`, json_array('c')))",
        d.formatFilter(tags, "tags", "a,b;c"));
    assertEquals("(json_length(`tags`) = 3)", d.formatFilter(tags, "tags", QueryFilters.size(3)));
    assertEquals("(json_contains(`tags`, json_array('x')))", d.formatFilter(tags, "tags", QueryFilters.all(List.of("x"))));
  }

  @Test
  void jsonPredicates() {
    Column meta = Column.of("meta", SemanticType.JSON);
    assertEquals("json_contains_path(`meta`, 'one', '$.a')", d.formatFilter(meta, "meta", "$.a"));
    assertEquals("json_overlaps(`meta`, '{\"k\":1}')", d.formatFilter(meta, "meta", Map.of("k", 1)));
  }

  @Test
  void regexOperatorsMapToRegexp() {
    Column bio = USER.column("bio");
    assertEquals("`bio` REGEXP '^a'", d.formatFilter(bio, "bio", "~^a"));
    assertEquals("`bio` NOT REGEXP 'x'", d.formatFilter(bio, "bio", "!~*x"));
    assertEquals("`bio` <> 'x'", d.formatFilter(bio, "bio", "!x"));
  }

  @Test
  void temporalKeywords() {
    assertEquals("'1970-01-01'", d.formatValue(Column.of("d", SemanticType.DATE), "epoch"));
    assertEquals("from_unixtime(0)", d.formatValue(Column.of("at", SemanticType.DATETIME), "epoch"));
    assertEquals("curdate() + INTERVAL 1 DAY", d.formatValue(Column.of("at", SemanticType.DATETIME), "tomorrow"));
    assertEquals("current_timestamp(6)", d.formatValue(Column.of("at", SemanticType.LOCAL_DATETIME), "now"));
    assertEquals("curtime()", d.formatValue(Column.of("t", SemanticType.TIME), "now"));
  }

  @Test
  void expressionDefaultsAreParenthesized() {
    EntitySchema events = EntitySchema.of("event", List.of(
        Column.of("id", SemanticType.I64).withAutoIncrement(),
        Column.of("day", SemanticType.DATE).withDefault("today"),
        Column.of("since", SemanticType.DATETIME).withDefault("epoch"),
        Column.of("seen", SemanticType.LOCAL_DATETIME).withDefault("now"),
        Column.of("tags", SemanticType.TEXT_ARRAY).withDefault("a,b"),
        Column.of("hits", SemanticType.U32).withDefault("0")));
    String sql = compiler.createTable(events).sql();
    assertTrue(sql.contains("`day` DATE DEFAULT (curdate())"), sql);
    assertTrue(sql.contains("`since` TIMESTAMP(6) DEFAULT (from_unixtime(0))"), sql);
    assertTrue(sql.contains("`seen` DATETIME(6) DEFAULT current_timestamp(6)"), sql);
    assertTrue(sql.contains("`tags` JSON DEFAULT (json_array('a','b'))"), sql);
    assertTrue(sql.contains("DEFAULT 0,"), sql);
    assertEquals("DEFAULT 'anon'", d.defaultClause(USER.column("name")));
  }

  @Test
  void everySemanticTypeHasAStableDdlToken() {
    MySqlDialect other = new MySqlDialect();
    for (SemanticType t : SemanticType.values()) {
      Column c = Column.of("c", t);
      String token = d.columnType(c);
      assertNotNull(token, t.name());
      assertFalse(token.isBlank(), t.name());
      assertEquals(token, other.columnType(c), t.name());
    }
  }

  @Test
  void paginationPutsOffsetFirst() {
    assertEquals("LIMIT 20, 10", d.formatPagination(new Query().withOffset(20)));
    assertEquals("LIMIT 10", d.formatPagination(Query.where("age", ">1").withSort(SortField.asc("age")).withOffset(20)));
  }

  @Test
  void boundedMutationsUseDerivedTable() {
    Query q = Query.where("age", ">30").withSort(SortField.asc("created"));
    assertEquals("DELETE FROM `demo_user` WHERE `id` IN (SELECT `id` FROM "
        + "(SELECT `id` FROM `demo_user` WHERE `age` > 30 ORDER BY `created` ASC LIMIT 1) AS `t_one`)",
        compiler.deleteOne(USER, q).sql());
    assertTrue(compiler.updateOne(USER, q, new Mutation().set("age", 31)).sql()
        .startsWith("UPDATE `demo_user` SET `age` = 31 WHERE `id` IN (SELECT `id` FROM ("));
  }

  @Test
  void upsertUsesOnDuplicateKey() {
    String sql = compiler.upsert(USER, Map.of("name", "Ann")).sql();
    assertTrue(sql.startsWith("INSERT INTO `demo_user` (`id`, `name`, "), sql);
    assertTrue(sql.contains("VALUES (DEFAULT, 'Ann', "), sql);
    assertTrue(sql.contains(" ON DUPLICATE KEY UPDATE `name` = VALUES(`name`), `age` = VALUES(`age`)"), sql);
  }

  @Test
  void textSearchUsesMatchAgainst() {
    assertEquals("match(`name`, `bio`) against('rust')",
        d.formatTextSearch(QueryFilters.text(List.of("name", "bio"), "rust", null)));
  }

  @Test
  void connectionSettings() {
    PoolConfig pool = PoolConfig.of("main", "demo", "app", "pw");
    assertEquals("jdbc:mysql://127.0.0.1:3306/demo", d.jdbcUrl(pool));
    assertEquals("program_name:demo-app", d.dataSourceProperties("demo-app", pool).get("connectionAttributes"));
  }

  @Test
  void registeredThroughFactories() {
    assertTrue(TesseraFactoriesLoader.load(JdbcDialect.class).stream().anyMatch(x -> x instanceof MySqlDialect));
  }
}
