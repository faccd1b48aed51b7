package io.intellixity.federa.engine;

import io.intellixity.federa.config.CatalogDef;
import io.intellixity.federa.config.DataSourceDef;
import io.intellixity.federa.config.EngineConfig;
import io.intellixity.federa.config.PermissionDef;
import io.intellixity.federa.config.RoleDef;
import io.intellixity.federa.engine.memory.InMemorySourceAdapterProvider;
import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.governance.AuthContext;
import io.intellixity.federa.sdl.SchemaError;
import io.intellixity.federa.spi.source.SourceAdapterRegistry;
import io.intellixity.federa.spi.source.SourceExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static io.intellixity.federa.engine.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

final class FederaEngineTest {
  private FederaEngine engine;

  @AfterEach
  void closeEngine() {
    if (engine != null) engine.close();
  }

  private FederaEngine start(SourceAdapterRegistry registry, List<DataSourceDef> sources) {
    return start(FederaEngine.builder().registry(registry), sources);
  }

  private FederaEngine start(FederaEngine.Builder builder, List<DataSourceDef> sources) {
    engine = builder.build();
    SchemaCompilation compiled = engine.reload(sources);
    assertTrue(compiled.complete(), () -> compiled.failures().toString());
    return engine;
  }

  private static Map<String, Object> data(ExecutionResponse r) {
    assertFalse(r.hasErrors(), () -> r.errors().toString());
    return r.data();
  }

  private static List<Object> column(List<Map<String, Object>> rows, String key) {
    List<Object> out = new ArrayList<>();
    for (Map<String, Object> r : rows) out.add(r.get(key));
    return out;
  }

  private static List<Map<String, Object>> rows(ExecutionResponse r, String key) {
    return at(data(r), key);
  }

  private static String onlyCode(ExecutionResponse r) {
    assertEquals(1, r.errors().size(), () -> r.errors().toString());
    return r.errors().get(0).code();
  }

  @Test
  void relationOnScanSourceIsMergedLocally() {
    start(registry(), List.of(shop()));

    Map<String, Object> data = data(engine.execute(request("{ customers { name orders { id } } }")));

    List<Map<String, Object>> customers = at(data, "customers");
    assertEquals(List.of("Ann", "Bob", "test account"), column(customers, "name"));
    assertEquals(List.of(10, 11), column(at(data, "customers", 0, "orders"), "id"));
    assertEquals(List.of(12, 13), column(at(data, "customers", 1, "orders"), "id"));
    assertEquals(List.of(), at(data, "customers", 2, "orders"));
  }

  @Test
  void bucketAggregationSortsBySummedTotal() {
    start(registry(), List.of(shop()));

    Map<String, Object> data = data(engine.execute(request("""
        { orders_bucket_aggregation(order_by: [{field: "aggregations.total.sum", direction: DESC}]) {
            key { status }
            aggregations { _rows_count total { sum } }
        } }
        """)));

    assertEquals("open", at(data, "orders_bucket_aggregation", 0, "key", "status"));
    assertEquals(120.0, ((Number) at(data, "orders_bucket_aggregation", 0, "aggregations", "total", "sum")).doubleValue());
    assertEquals(2L, ((Number) at(data, "orders_bucket_aggregation", 0, "aggregations", "_rows_count")).longValue());
    assertEquals("closed", at(data, "orders_bucket_aggregation", 1, "key", "status"));
  }

  @Test
  void bucketOrderMustReferenceSelectedAggregate() {
    start(registry(), List.of(shop()));

    ExecutionResponse r = engine.execute(request("""
        { orders_bucket_aggregation(order_by: [{field: "aggregations.total.sum", direction: DESC}]) {
            key { status }
            aggregations { _rows_count }
        } }
        """));

    assertEquals(GraphQLErrorEntry.VALIDATION_FAILED, onlyCode(r));
    assertNull(r.data());
  }

  @Test
  void notFilterExcludesMatchingRows() {
    start(registry(), List.of(shop()));

    Map<String, Object> data = data(engine.execute(request(
        "{ customers(filter: {_not: {name: {like: \"%test%\"}}}) { name } }")));

    assertEquals(List.of("Ann", "Bob"), column(at(data, "customers"), "name"));
  }

  @Test
  void notInsideScalarFilterIsRejected() {
    start(registry(), List.of(shop()));

    ExecutionResponse r = engine.execute(request(
        "{ customers(filter: {name: {_not: {like: \"%test%\"}}}) { name } }"));

    assertEquals(GraphQLErrorEntry.VALIDATION_FAILED, onlyCode(r));
  }

  @Test
  void foreignKeyAcrossSourcesFailsOnlyThatSource() {
    engine = FederaEngine.builder().registry(registry()).build();

    SchemaCompilation compiled = engine.reload(List.of(
        DataSourceDef.of("crm", "memory", DATA, CatalogDef.inline("customers", CUSTOMERS)),
        DataSourceDef.of("sales", "memory", DATA, CatalogDef.inline("orders", ORDERS))));

    assertFalse(compiled.complete());
    assertTrue(compiled.failures().get("sales").has(SchemaError.Code.CROSS_SOURCE_RELATION));
    assertEquals(3, rows(engine.execute(request("{ customers { id } }")), "customers").size());
    assertEquals(GraphQLErrorEntry.VALIDATION_FAILED, onlyCode(engine.execute(request("{ orders { id } }"))));
  }

  @Test
  void joinAcrossSourcesRunsLocally() {
    start(registry(), split("memory"));

    Map<String, Object> data = data(engine.execute(request("{ orders { id customer { name } } }")));

    assertEquals("Ann", at(data, "orders", 0, "customer", "name"));
    assertEquals("Bob", at(data, "orders", 2, "customer", "name"));
  }

  @Test
  void relationFiltersAcrossSourcesRestrictParents() {
    start(registry(), split("memory"));

    Map<String, Object> any = data(engine.execute(request(
        "{ customers(filter: {orders: {any_of: {total: {gt: 40}}}}) { name } }")));
    Map<String, Object> none = data(engine.execute(request(
        "{ customers(filter: {orders: {none_of: {status: {eq: \"open\"}}}}) { name } }")));

    assertEquals(List.of("Ann"), column(at(any, "customers"), "name"));
    assertEquals(List.of("test account"), column(at(none, "customers"), "name"));
  }

  @Test
  void aggregationOverScanSourceRunsInProcess() {
    start(registry(), List.of(shop()));

    Map<String, Object> data = data(engine.execute(request(
        "{ orders_aggregation(filter: {status: {eq: \"open\"}}) { _rows_count total { sum } } }")));

    assertEquals(2L, ((Number) at(data, "orders_aggregation", "_rows_count")).longValue());
    assertEquals(120.0, ((Number) at(data, "orders_aggregation", "total", "sum")).doubleValue());
  }

  @Test
  void cachedReadsHitTheSourceOnce() {
    DataSourceDef def = DataSourceDef.of("shop", "stub", DATA, CatalogDef.inline("customers", CUSTOMERS));
    StubAdapter stub = new StubAdapter(def);
    start(registry(stub.provider()), List.of(def));
    String query = "query @cache(ttl: 60) { customers { name } }";

    data(engine.execute(request(query)));
    Map<String, Object> again = data(engine.execute(request(query)));
    assertEquals(1, stub.calls.get());
    assertEquals(3, rows(engine.execute(request(query)), "customers").size());
    assertEquals("Ann", at(again, "customers", 0, "name"));

    data(engine.execute(request("query @invalidate_cache { customers { name } }")));
    assertEquals(2, stub.calls.get());
    data(engine.execute(request(query)));
    assertEquals(3, stub.calls.get());
  }

  @Test
  void cachedReadsOfSameNamedObjectsStayApartAcrossModules() {
    String orders = """
        type customers @table(name: "orders") {
          id: Int! @pk
        }
        """;
    start(registry(), List.of(
        DataSourceDef.of("crm", InMemorySourceAdapterProvider.TYPE, DATA, CatalogDef.inline("customers", CUSTOMERS))
            .withAsModule(true),
        DataSourceDef.of("shop", InMemorySourceAdapterProvider.TYPE, DATA, CatalogDef.inline("customers", orders))
            .withAsModule(true)));

    Map<String, Object> crm = data(engine.execute(request("query @cache(ttl: 60) { crm { customers { id } } }")));
    Map<String, Object> shop = data(engine.execute(request("query @cache(ttl: 60) { shop { customers { id } } }")));

    assertEquals(List.of(1, 2, 3), column(at(crm, "crm", "customers"), "id"));
    assertEquals(List.of(10, 11, 12, 13), column(at(shop, "shop", "customers"), "id"));
  }

  @Test
  void mutationsWriteThroughAndPurgeCachedReads() {
    DataSourceDef def = DataSourceDef.of("shop", "stub", DATA, CatalogDef.inline("customers", CUSTOMERS));
    StubAdapter stub = new StubAdapter(def);
    start(registry(stub.provider()), List.of(def));
    String query = "query @cache(ttl: 60) { customers { id name } }";
    assertEquals(3, rows(engine.execute(request(query)), "customers").size());

    Map<String, Object> inserted = data(engine.execute(request(
        "mutation { insert_customers(data: {id: 4, name: \"Dee\"}) { id name } }")));
    assertEquals("Dee", at(inserted, "insert_customers", "name"));
    assertEquals(4, rows(engine.execute(request(query)), "customers").size());

    Map<String, Object> updated = data(engine.execute(request(
        "mutation { update_customers(filter: {id: {eq: 4}}, data: {name: \"Dina\"}) { success affected_rows } }")));
    assertEquals(Boolean.TRUE, Fixtures.<Object>at(updated, "update_customers", "success"));
    assertEquals(1L, ((Number) at(updated, "update_customers", "affected_rows")).longValue());
    assertEquals("Dina", rows(engine.execute(request(query)), "customers").get(3).get("name"));

    Map<String, Object> deleted = data(engine.execute(request(
        "mutation { delete_customers(filter: {id: {eq: 4}}) { affected_rows } }")));
    assertEquals(1L, ((Number) at(deleted, "delete_customers", "affected_rows")).longValue());
    assertEquals(3, rows(engine.execute(request(query)), "customers").size());
  }

  @Test
  void failingJoinedSourceNullsOnlyItsBranch() {
    DataSourceDef crm = split("stub").get(0);
    StubAdapter stub = new StubAdapter(crm);
    stub.failure = new SourceExecutionException(SourceExecutionException.Code.SOURCE_UNAVAILABLE, "crm", "crm is down");
    start(registry(stub.provider()), split("stub"));

    ExecutionResponse r = engine.execute(request("{ orders { id customer { name } } }"));

    assertEquals(SourceExecutionException.Code.SOURCE_UNAVAILABLE.name(), onlyCode(r));
    assertEquals("crm is down", r.errors().get(0).message());
    assertEquals(4, Fixtures.<List<?>>at(r.data(), "orders").size());
    assertEquals(10, Fixtures.<Object>at(r.data(), "orders", 0, "id"));
    assertNull(at(r.data(), "orders", 0, "customer"));
  }

  @Test
  void failingInnerJoinedSourceNullsOnlyItsBranch() {
    DataSourceDef crm = split("stub").get(0);
    StubAdapter stub = new StubAdapter(crm);
    stub.failure = new SourceExecutionException(SourceExecutionException.Code.SOURCE_UNAVAILABLE, "crm", "crm is down");
    start(registry(stub.provider()), split("stub"));

    ExecutionResponse r = engine.execute(request("{ orders { id customer(inner: true) { name } } }"));

    assertEquals(SourceExecutionException.Code.SOURCE_UNAVAILABLE.name(), onlyCode(r));
    assertEquals(List.of("orders", "customer"), r.errors().get(0).path());
    assertEquals(4, Fixtures.<List<?>>at(r.data(), "orders").size());
    assertNull(at(r.data(), "orders", 0, "customer"));
  }

  @Test
  void hangingSourceTimesOut() {
    DataSourceDef def = DataSourceDef.of("shop", "stub", DATA, CatalogDef.inline("customers", CUSTOMERS));
    StubAdapter stub = new StubAdapter(def);
    stub.hang = true;
    start(FederaEngine.builder().registry(registry(stub.provider()))
        .config(EngineConfig.DEFAULT.withRequestTimeoutMillis(200)), List.of(def));

    ExecutionResponse r = engine.execute(request("{ customers { name } }"));

    assertEquals(SourceExecutionException.Code.TIMEOUT.name(), onlyCode(r));
    assertNull(r.data().get("customers"));
  }

  @Test
  void rolesRedactHiddenFieldsAndFilterRows() {
    RoleDef rep = new RoleDef("rep", null, false, List.of(
        new PermissionDef("customers", "region", false, true, null, null),
        new PermissionDef("customers", "*", false, false, Map.of("id", Map.of("eq", "[$auth.customer]")), null)));
    start(FederaEngine.builder().registry(registry()).roles(List.of(rep)), List.of(shop()));

    Map<String, Object> data = data(engine.execute(request("{ customers { name region } }")
        .withAuth(AuthContext.of("rep", Map.of("customer", "2")))));
    ExecutionResponse ghost = engine.execute(request("{ customers { name } }")
        .withAuth(AuthContext.of("ghost", Map.of())));

    List<Map<String, Object>> rows = at(data, "customers");
    assertEquals(1, rows.size());
    assertEquals("Bob", rows.get(0).get("name"));
    assertTrue(rows.get(0).containsKey("region"));
    assertNull(rows.get(0).get("region"));
    assertEquals(GraphQLErrorEntry.ACCESS_DENIED, onlyCode(ghost));
  }

  @Test
  void introspectionIsAnsweredFromTheSchema() {
    start(registry(), List.of(shop()));

    Map<String, Object> data = data(engine.execute(request("{ __schema { queryType { name } } customers { id } }")));

    assertEquals("Query", at(data, "__schema", "queryType", "name"));
    assertEquals(3, Fixtures.<List<?>>at(data, "customers").size());
  }

  @Test
  void introspectionCanBeDisabled() {
    start(FederaEngine.builder().registry(registry()).config(new EngineConfig(0, 0, 0, null, false)), List.of(shop()));

    ExecutionResponse r = engine.execute(request("{ __schema { queryType { name } } }"));

    assertEquals(GraphQLErrorEntry.VALIDATION_FAILED, onlyCode(r));
  }

  @Test
  void errorsCarryTheirPhase() {
    engine = FederaEngine.builder().registry(registry()).build();
    assertEquals(GraphQLErrorEntry.VALIDATION_FAILED, onlyCode(engine.execute(request("{ customers { id } }"))));
    engine.reload(List.of(shop()));

    ExecutionResponse unknown = engine.execute(request("{ customers { nickname } }"));
    ExecutionResponse conflict = engine.execute(request("query @cache(ttl: 5) @no_cache { customers { id } }"));

    assertEquals(GraphQLErrorEntry.VALIDATION_FAILED, onlyCode(unknown));
    assertEquals(GraphQLErrorEntry.PLANNING_FAILED, onlyCode(conflict));
    assertTrue(conflict.toJson().contains("\"code\":\"PLANNING_FAILED\""), conflict.toJson());
  }

  @Test
  void responseSerializesDataInSelectionOrder() {
    start(registry(), List.of(shop()));

    String json = engine.execute(request("{ customers(limit: 1) { name id } }")).toJson();

    assertEquals("{\"data\":{\"customers\":[{\"name\":\"Ann\",\"id\":1}]}}", json);
  }

  @Test
  void functionQueriesAreCalledOncePerArguments() {
    FunctionAdapter fn = new FunctionAdapter("fn", Map.of("greet", args -> "Hello " + args.get("name")));
    DataSourceDef def = DataSourceDef.of("fn", "fakesql", null, CatalogDef.inline("functions", """
        type ledger @table(name: "ledger") {
          id: Int! @pk
        }
        extend type Function {
          greet(name: String!): String @function(name: "greet")
        }
        """));
    start(registry(fn.provider()), List.of(def));

    Map<String, Object> data = data(engine.execute(request(
        "{ function { a: greet(name: \"Ann\") b: greet(name: \"Ann\") c: greet(name: \"Bob\") } }")));

    assertEquals("Hello Ann", at(data, "function", "a"));
    assertEquals("Hello Ann", at(data, "function", "b"));
    assertEquals("Hello Bob", at(data, "function", "c"));
    assertEquals(2, fn.calls.get());
  }

  @Test
  void reloadClosesReplacedAdapters() {
    List<StubAdapter> created = new CopyOnWriteArrayList<>();
    StubProvider provider = new StubProvider("stub", Capabilities.SCAN_ONLY, def -> {
      StubAdapter a = new StubAdapter(def);
      created.add(a);
      return a;
    });
    DataSourceDef def = DataSourceDef.of("shop", "stub", DATA, CatalogDef.inline("customers", CUSTOMERS));
    start(registry(provider), List.of(def));

    engine.reload(List.of(def));

    assertEquals(2, created.size());
    assertTrue(created.get(0).closed);
    assertFalse(created.get(1).closed);
    data(engine.execute(request("{ customers { id } }")));
    assertEquals(1, created.get(1).calls.get());
  }

  @Test
  void clusterSignalReloadsAndKeepsSnapshotOnFailure() {
    AtomicReference<Runnable> listener = new AtomicReference<>();
    AtomicReference<ClusterCoordinator.SourceSnapshot> store =
        new AtomicReference<>(new ClusterCoordinator.SourceSnapshot(split("memory"), List.of()));
    ClusterCoordinator cluster = new ClusterCoordinator() {
      @Override public void onSchemaInvalidated(Runnable callback) { listener.set(callback); }
      @Override public SourceSnapshot currentSourceSnapshot() { return store.get(); }
    };
    engine = FederaEngine.builder().registry(registry()).cluster(cluster).build();
    assertNull(engine.schema());

    listener.get().run();
    assertNotNull(engine.schema());
    data(engine.execute(request("{ orders { id customer { name } } }")));

    store.set(new ClusterCoordinator.SourceSnapshot(List.of(
        DataSourceDef.of("ghost", "nosuch", null, CatalogDef.inline("customers", CUSTOMERS))), List.of()));
    listener.get().run();
    data(engine.execute(request("{ orders { id customer { name } } }")));
  }
}
