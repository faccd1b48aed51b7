package io.intellixity.federa.jdbc.dialect;

import io.intellixity.federa.catalog.*;
import io.intellixity.federa.query.QueryValidationException;
import io.intellixity.federa.query.SortField;
import io.intellixity.federa.sdl.CatalogLoader;
import io.intellixity.federa.sdl.SdlSource;
import io.intellixity.federa.spi.source.SqlStatement;
import io.intellixity.federa.spi.sql.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.federa.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class DuckDbDialectTest {
  static final String SDL = """
      type customers @table(name: "customers") {
        id: Int! @pk
        name: String
      }

      type orders @table(name: "orders", soft_delete: true, soft_delete_cond: "[deleted_at] IS NULL",
                         soft_delete_set: "[deleted_at] = now()") {
        id: Int! @pk @default(sequence: "orders_id_seq")
        customer_id: Int! @field_references(references_name: "customers", query: "customer")
        total: Float
        status: String
        deleted_at: Timestamp
      }

      type sales @table(name: "sales") @cube {
        id: Int! @pk
        customer_id: Int! @field_references(references_name: "customers", query: "customer",
                                            references_query: "sales")
        amount: Float @measurement
      }
      """;

  static Catalog catalog(String... sdl) {
    DataSourceInfo info = new DataSourceInfo("db", "duckdb", null, false, false, Capabilities.FULL);
    List<SdlSource> docs = new ArrayList<>();
    for (int i = 0; i < sdl.length; i++) docs.add(new SdlSource("db-" + i + ".graphql", sdl[i]));
    return new CatalogLoader(type -> Capabilities.FULL)
        .loadDocuments(List.of(new CatalogLoader.SourceDocuments(info, docs)))
        .orThrow();
  }

  private final Catalog catalog = catalog(SDL);
  private final DuckDbDialect dialect = new DuckDbDialect();

  private int id(String name) {
    return catalog.resolveObject("", name).id();
  }

  @Test
  void selectsColumnsWithFilterAndPaging() {
    SelectSpec spec = SelectSpec.builder(id("customers"))
        .columns("id", "name")
        .filter(eq("name", "Ada"))
        .limit(10)
        .build();

    SqlStatement st = dialect.select(catalog, spec);

    assertEquals("SELECT t0.\"id\" AS \"id\", t0.\"name\" AS \"name\" FROM \"customers\" t0"
        + " WHERE t0.\"name\" = :b1 LIMIT 10", st.sql());
    assertEquals(1, st.binds().size());
    assertEquals("Ada", st.binds().get(0).value());
  }

  @Test
  void nestsToManyRelationAsCorrelatedJsonArray() {
    Relation orders = catalog.resolveRelation(id("customers"), "orders");
    SelectSpec spec = SelectSpec.builder(id("customers"))
        .columns("name")
        .project(new Projection.Nested("orders", orders.id(),
            SelectSpec.builder(id("orders")).columns("id").build(), false))
        .limit(2000)
        .build();

    String sql = dialect.select(catalog, spec).sql();

    assertTrue(sql.startsWith("SELECT t0.\"name\" AS \"name\", (SELECT COALESCE(json_group_array("), sql);
    assertTrue(sql.contains("SELECT json_object('id', t1.\"id\") AS \"_row\" FROM \"orders\" t1"
        + " WHERE t1.\"customer_id\" = t0.\"id\" AND (t1.\"deleted_at\" IS NULL)"), sql);
    assertTrue(sql.endsWith(") AS \"orders\" FROM \"customers\" t0 LIMIT 2000"), sql);
  }

  @Test
  void innerNestedRelationFiltersParentRows() {
    Relation orders = catalog.resolveRelation(id("customers"), "orders");
    SelectSpec spec = SelectSpec.builder(id("customers"))
        .columns("name")
        .project(new Projection.Nested("orders", orders.id(),
            SelectSpec.builder(id("orders")).columns("id").filter(eq("status", "open")).build(), true))
        .build();

    String sql = dialect.select(catalog, spec).sql();

    assertTrue(sql.contains(" FROM \"customers\" t0 WHERE EXISTS (SELECT 1 FROM \"orders\" t1"
        + " WHERE t1.\"customer_id\" = t0.\"id\" AND (t1.\"deleted_at\" IS NULL) AND t1.\"status\" = :"), sql);
  }

  @Test
  void toManyQuantifiersRenderAsExists() {
    SqlStatement any = dialect.select(catalog, SelectSpec.builder(id("customers")).columns("id")
        .filter(anyOf("orders", gt("total", 100))).build());
    assertTrue(any.sql().contains("WHERE EXISTS (SELECT 1 FROM \"orders\" t1 WHERE t1.\"customer_id\" = t0.\"id\""
        + " AND (t1.\"deleted_at\" IS NULL) AND t1.\"total\" > :b1)"), any.sql());
    assertEquals(100.0, any.binds().get(0).value());

    String all = dialect.select(catalog, SelectSpec.builder(id("customers")).columns("id")
        .filter(allOf("orders", gt("total", 100))).build()).sql();
    assertTrue(all.contains("WHERE NOT EXISTS (") && all.contains("AND NOT (t1.\"total\" > :b1))"), all);

    String none = dialect.select(catalog, SelectSpec.builder(id("customers")).columns("id")
        .filter(noneOf("orders", eq("status", "void"))).build()).sql();
    assertTrue(none.contains("WHERE NOT EXISTS (") && none.contains("AND t1.\"status\" = :b1)"), none);
  }

  @Test
  void notFlipsBooleanLogic() {
    String sql = dialect.select(catalog, SelectSpec.builder(id("customers")).columns("id")
        .filter(not(or(like("name", "%test%"), isNull("name", true)))).build()).sql();

    assertTrue(sql.endsWith("WHERE NOT (t0.\"name\" LIKE :b1) AND NOT (t0.\"name\" IS NULL)"), sql);
  }

  @Test
  void emptyInListMatchesNothing() {
    String sql = dialect.select(catalog, SelectSpec.builder(id("customers")).columns("id")
        .filter(in("id", List.of())).build()).sql();
    assertTrue(sql.endsWith("WHERE FALSE"), sql);
  }

  @Test
  void emptyOrMatchesNothingAndEmptyAndMatchesEverything() {
    String none = dialect.select(catalog, SelectSpec.builder(id("customers")).columns("id")
        .filter(or()).build()).sql();
    String all = dialect.select(catalog, SelectSpec.builder(id("customers")).columns("id")
        .filter(or(and(), like("name", "a%"))).build()).sql();

    assertTrue(none.endsWith("WHERE FALSE"), none);
    assertTrue(all.endsWith("WHERE (TRUE OR t0.\"name\" LIKE :b1)"), all);
  }

  @Test
  void ilikeAndRegexUseDuckDbOperators() {
    String sql = dialect.select(catalog, SelectSpec.builder(id("customers")).columns("id")
        .filter(and(ilike("name", "a%"), regex("name", "^[A-Z]"))).build()).sql();
    assertTrue(sql.contains("t0.\"name\" ILIKE :b1 AND regexp_matches(t0.\"name\", :b2)"), sql);
  }

  @Test
  void withDeletedSkipsLiveRowCondition() {
    String live = dialect.select(catalog, SelectSpec.builder(id("orders")).columns("id").build()).sql();
    String all = dialect.select(catalog, SelectSpec.builder(id("orders")).columns("id").withDeleted(true).build()).sql();

    assertTrue(live.endsWith("WHERE (t0.\"deleted_at\" IS NULL)"), live);
    assertFalse(all.contains("deleted_at"), all);
  }

  @Test
  void cubeGroupsByRelationKeysBeforeJoining() {
    Relation customer = catalog.resolveRelation(id("sales"), "customer");
    SelectSpec spec = SelectSpec.builder(id("sales"))
        .cube(true)
        .project(new Projection.Nested("customer", customer.id(),
            SelectSpec.builder(id("customers")).columns("name").build(), false))
        .project(new Projection.Column("amount", "amount", null, "SUM"))
        .build();

    String sql = dialect.select(catalog, spec).sql();

    assertTrue(sql.contains("FROM (SELECT t0.\"customer_id\" AS \"customer_id\", SUM(t0.\"amount\") AS \"amount__sum\""
        + " FROM \"sales\" t0 GROUP BY t0.\"customer_id\") t1"), sql);
    assertTrue(sql.contains("FROM \"customers\" t2 WHERE t2.\"id\" = t1.\"customer_id\" LIMIT 1) AS \"customer\""), sql);
    assertTrue(sql.contains("t1.\"amount__sum\" AS \"amount\""), sql);
    assertFalse(sql.contains("t0.\"amount\" AS"), sql);
  }

  @Test
  void bucketAggregationGroupsAndOrdersByAggregate() {
    AggregateSpec spec = AggregateSpec.builder(id("orders"))
        .key(Projection.Column.of("status"))
        .item(AggregateItem.rowsCount("_rows_count"))
        .item(AggregateItem.of("total.sum", "total", "sum"))
        .orderBy(List.of(new SortField("total.sum", SortField.Direction.DESC)))
        .build();

    String sql = dialect.aggregate(catalog, spec).sql();

    assertEquals("SELECT t0.\"status\" AS \"status\", COUNT(*) AS \"_rows_count\", SUM(t0.\"total\") AS \"total.sum\""
        + " FROM \"orders\" t0 WHERE (t0.\"deleted_at\" IS NULL) GROUP BY t0.\"status\" ORDER BY \"total.sum\" DESC", sql);
  }

  @Test
  void bucketOrderOnUnselectedAggregateIsRejected() {
    AggregateSpec spec = AggregateSpec.builder(id("orders"))
        .key(Projection.Column.of("status"))
        .item(AggregateItem.rowsCount("_rows_count"))
        .orderBy(List.of(new SortField("total.sum", SortField.Direction.DESC)))
        .build();

    assertThrows(QueryValidationException.class, () -> dialect.aggregate(catalog, spec));
  }

  @Test
  void pagedAggregationAggregatesSelectedRowsOnly() {
    AggregateSpec spec = AggregateSpec.builder(id("customers"))
        .item(AggregateItem.of("id.count", "id", "count"))
        .orderBy(List.of(new SortField("name", SortField.Direction.ASC)))
        .limit(5)
        .build();

    String sql = dialect.aggregate(catalog, spec).sql();

    assertEquals("SELECT COUNT(t1.\"id\") AS \"id.count\" FROM (SELECT t0.* FROM \"customers\" t0"
        + " ORDER BY t0.\"name\" ASC LIMIT 5) t1", sql);
  }

  @Test
  void stringAggAndListUseDialectFunctions() {
    AggregateSpec spec = AggregateSpec.builder(id("customers"))
        .item(new AggregateItem("name.string_agg", "name", "string_agg", true, ";"))
        .item(new AggregateItem("name.list", "name", "list", false, null))
        .build();

    String sql = dialect.aggregate(catalog, spec).sql();

    assertTrue(sql.contains("STRING_AGG(DISTINCT CAST(t0.\"name\" AS VARCHAR), ';')"), sql);
    assertTrue(sql.contains("LIST(t0.\"name\")"), sql);
  }

  @Test
  void insertAddsSequenceDefaultAndReturning() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("customer_id", 1);
    values.put("status", "new");

    SqlStatement st = dialect.insert(catalog, new InsertSpec(id("orders"), values, List.of("id", "status")));

    assertEquals("INSERT INTO \"orders\" (\"customer_id\", \"status\", \"id\") VALUES (:b1, :b2, nextval('orders_id_seq'))"
        + " RETURNING \"id\" AS \"id\", \"status\" AS \"status\"", st.sql());
    assertEquals(SqlStatement.ExecKind.RETURNING, st.execKind());
    assertEquals(List.of(1, "new"), st.binds().stream().map(b -> b.value()).toList());
  }

  @Test
  void updateTouchesLiveRowsOnly() {
    SqlStatement st = dialect.update(catalog,
        new UpdateSpec(id("orders"), Map.of("status", "paid"), eq("id", 5), false));

    assertEquals("UPDATE \"orders\" SET \"status\" = :b1 WHERE (\"orders\".\"deleted_at\" IS NULL)"
        + " AND \"orders\".\"id\" = :b2", st.sql());
    assertEquals(SqlStatement.ExecKind.UPDATE, st.execKind());
  }

  @Test
  void deleteOnSoftDeleteTableMarksRows() {
    SqlStatement st = dialect.delete(catalog, new DeleteSpec(id("orders"), eq("id", 5)));

    assertEquals("UPDATE \"orders\" SET \"deleted_at\" = now() WHERE (\"orders\".\"deleted_at\" IS NULL)"
        + " AND \"orders\".\"id\" = :b1", st.sql());
  }

  @Test
  void deleteOnPlainTableDeletesRows() {
    SqlStatement st = dialect.delete(catalog, new DeleteSpec(id("customers"), eq("id", 5)));
    assertEquals("DELETE FROM \"customers\" WHERE \"customers\".\"id\" = :b1", st.sql());
  }

  @Test
  void unknownFieldIsRejected() {
    SelectSpec spec = SelectSpec.builder(id("customers")).columns("id").filter(eq("nope", 1)).build();
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> dialect.select(catalog, spec));
    assertTrue(ex.getMessage().contains("nope"));
  }
}
