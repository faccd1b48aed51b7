package io.intellixity.federa.jdbc.postgres;

import io.intellixity.federa.catalog.*;
import io.intellixity.federa.query.Condition;
import io.intellixity.federa.query.Operator;
import io.intellixity.federa.sdl.CatalogLoader;
import io.intellixity.federa.sdl.SdlSource;
import io.intellixity.federa.spi.source.Bind;
import io.intellixity.federa.spi.source.SqlStatement;
import io.intellixity.federa.spi.sql.*;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

import java.util.List;
import java.util.Map;

import static io.intellixity.federa.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  static final String SDL = """
      type parcels @table(name: "gis.parcels") {
        id: Int! @pk
        name: String
        tags: [String]
        geom: Geometry @geometry_info(type: "POLYGON", srid: 4326)
      }

      type readings @table(name: "readings") @hypertable {
        id: Int! @pk
        parcel_id: Int! @field_references(references_name: "parcels", query: "parcel")
        ts: Timestamp! @timescale_key
        value: Float
      }
      """;

  private final Catalog catalog = catalog();
  private final PostgresDialect dialect = new PostgresDialect();

  static Catalog catalog() {
    DataSourceInfo info = new DataSourceInfo("pg", "postgres", null, false, false, Capabilities.FULL);
    return new CatalogLoader(type -> Capabilities.FULL)
        .loadDocuments(List.of(new CatalogLoader.SourceDocuments(info, List.of(new SdlSource("pg.graphql", SDL)))))
        .orThrow();
  }

  private int id(String name) {
    return catalog.resolveObject("", name).id();
  }

  @Test
  void quotesSchemaQualifiedTables() {
    String sql = dialect.select(catalog, SelectSpec.builder(id("parcels")).columns("id").build()).sql();
    assertEquals("SELECT t0.\"id\" AS \"id\" FROM \"gis\".\"parcels\" t0", sql);
  }

  @Test
  void regexUsesTildeOperator() {
    String sql = dialect.select(catalog, SelectSpec.builder(id("parcels")).columns("id")
        .filter(regex("name", "^North")).build()).sql();
    assertTrue(sql.endsWith("WHERE t0.\"name\" ~ :b1"), sql);
  }

  @Test
  void arrayContainsBindsOneArrayParam() {
    SqlStatement st = dialect.select(catalog, SelectSpec.builder(id("parcels")).columns("id")
        .filter(new Condition("tags", Operator.CONTAINS, List.of("farm", "north"))).build());

    assertTrue(st.sql().endsWith("WHERE t0.\"tags\" @> :b1"), st.sql());
    Bind b = st.binds().get(0);
    assertTrue(b.type().list());
    assertEquals(List.of("farm", "north"), b.value());
  }

  @Test
  void arrayIntersectsUsesOverlap() {
    String sql = dialect.select(catalog, SelectSpec.builder(id("parcels")).columns("id")
        .filter(new Condition("tags", Operator.INTERSECTS, List.of("farm"))).build()).sql();
    assertTrue(sql.endsWith("WHERE t0.\"tags\" && :b1"), sql);
  }

  @Test
  void geometryFilterBindsWktWithSrid() {
    SqlStatement st = dialect.select(catalog, SelectSpec.builder(id("parcels")).columns("id")
        .filter(new Condition("geom", Operator.INTERSECTS, "POINT(1 2)")).build());

    assertTrue(st.sql().endsWith("WHERE ST_Intersects(t0.\"geom\", ST_GeomFromText(:b1, 4326))"), st.sql());
    assertInstanceOf(String.class, st.binds().get(0).value());
  }

  @Test
  void geometryOutputAndSpheroidMeasurement() {
    String sql = dialect.select(catalog, SelectSpec.builder(id("parcels"))
        .columns("geom")
        .project(new Projection.Measurement("_geom_measurement", "geom", "AreaSpheroid"))
        .build()).sql();

    assertTrue(sql.contains("ST_AsText(t0.\"geom\") AS \"geom\""), sql);
    assertTrue(sql.contains("ST_Area(t0.\"geom\"::geography) AS \"_geom_measurement\""), sql);
  }

  @Test
  void hypertableBucketsUseTimeBucket() {
    AggregateSpec spec = AggregateSpec.builder(id("readings"))
        .key(new Projection.Column("ts", "ts", "day", null))
        .item(AggregateItem.of("value.avg", "value", "avg"))
        .build();

    String sql = dialect.aggregate(catalog, spec).sql();

    assertEquals("SELECT time_bucket(INTERVAL '1 day', t0.\"ts\") AS \"ts\", AVG(t0.\"value\") AS \"value.avg\""
        + " FROM \"readings\" t0 GROUP BY time_bucket(INTERVAL '1 day', t0.\"ts\")", sql);
  }

  @Test
  void plainTablesBucketWithDateTrunc() {
    String sql = dialect.select(catalog, SelectSpec.builder(id("readings"))
        .project(new Projection.Column("ts", "ts", "month", null)).build()).sql();
    assertTrue(sql.contains("time_bucket(INTERVAL '1 month', t0.\"ts\")"), sql);

    Catalog plain = new CatalogLoader(type -> Capabilities.FULL).loadDocuments(List.of(new CatalogLoader.SourceDocuments(
        new DataSourceInfo("pg", "postgres", null, false, false, Capabilities.FULL),
        List.of(new SdlSource("e.graphql", "type events @table(name: \"events\") { id: Int! @pk  ts: Timestamp }")))))
        .orThrow();
    String trunc = dialect.select(plain, SelectSpec.builder(plain.resolveObject("", "events").id())
        .project(new Projection.Column("ts", "ts", "month", null)).build()).sql();
    assertTrue(trunc.contains("date_trunc('month', t0.\"ts\") AS \"ts\""), trunc);
  }

  @Test
  void timePartExtractsIsoParts() {
    String sql = dialect.select(catalog, SelectSpec.builder(id("readings"))
        .project(new Projection.TimePart("_ts_part", "ts", "iso_dow", null))
        .project(new Projection.TimePart("_ts_decade", "ts", "year", 10))
        .build()).sql();

    assertTrue(sql.contains("CAST(EXTRACT(ISODOW FROM t0.\"ts\") AS BIGINT) AS \"_ts_part\""), sql);
    assertTrue(sql.contains("(CAST(EXTRACT(YEAR FROM t0.\"ts\") AS BIGINT) / 10) AS \"_ts_decade\""), sql);
  }

  @Test
  void nestedRowsUseJsonBuildObject() {
    Relation readings = catalog.resolveRelation(id("parcels"), "readings");
    String sql = dialect.select(catalog, SelectSpec.builder(id("parcels"))
        .columns("id")
        .project(new Projection.Nested("readings", readings.id(),
            SelectSpec.builder(id("readings")).columns("value").build(), false))
        .project(new Projection.NestedAggregation("readings_aggregation", readings.id(),
            AggregateSpec.builder(id("readings")).item(AggregateItem.rowsCount("_rows_count")).build()))
        .build()).sql();

    assertTrue(sql.contains("COALESCE(json_agg(t2.\"_row\"), '[]'::json)"), sql);
    assertTrue(sql.contains("json_build_object('value', t1.\"value\") AS \"_row\""), sql);
    assertTrue(sql.contains("(SELECT json_build_object('_rows_count', COUNT(*)) FROM \"readings\" t3"
        + " WHERE t3.\"parcel_id\" = t0.\"id\") AS \"readings_aggregation\""), sql);
  }

  @Test
  void anyAndLastUseArrayAggregates() {
    String sql = dialect.aggregate(catalog, AggregateSpec.builder(id("parcels"))
        .item(AggregateItem.of("name.any", "name", "any"))
        .item(AggregateItem.of("name.last", "name", "last"))
        .build()).sql();

    assertTrue(sql.contains("(ARRAY_AGG(t0.\"name\"))[1] AS \"name.any\""), sql);
    assertTrue(sql.contains("(ARRAY_AGG(t0.\"name\"))[COUNT(*)] AS \"name.last\""), sql);
  }

  @Test
  void updateBindsJsonAwareValues() {
    SqlStatement st = dialect.update(catalog, new UpdateSpec(id("parcels"), Map.of("tags", List.of("a")), eq("id", 1), false));
    assertEquals("UPDATE \"gis\".\"parcels\" SET \"tags\" = :b1 WHERE \"parcels\".\"id\" = :b2", st.sql());
  }

  @Test
  void readsPgObjectsAsText() throws Exception {
    PGobject json = new PGobject();
    json.setType("jsonb");
    json.setValue("{\"a\":1}");
    assertEquals("{\"a\":1}", dialect.readValue(json));
    assertEquals(5, dialect.readValue(5));
  }
}
