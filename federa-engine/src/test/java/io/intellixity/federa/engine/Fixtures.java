package io.intellixity.federa.engine;

import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.catalog.Catalog;
import io.intellixity.federa.config.CatalogDef;
import io.intellixity.federa.config.DataSourceDef;
import io.intellixity.federa.config.EngineConfig;
import io.intellixity.federa.engine.memory.InMemorySourceAdapterProvider;
import io.intellixity.federa.governance.AccessPolicy;
import io.intellixity.federa.governance.AuthContext;
import io.intellixity.federa.plan.QueryPlan;
import io.intellixity.federa.plan.QueryPlanner;
import io.intellixity.federa.plan.request.RequestParser;
import io.intellixity.federa.schema.CompiledSchema;
import io.intellixity.federa.schema.SchemaCompiler;
import io.intellixity.federa.sdl.CatalogLoader;
import io.intellixity.federa.spi.source.*;
import io.intellixity.federa.spi.sql.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Sources and adapter doubles shared by engine tests. Row data lives in {@code data/shop.json}. */
final class Fixtures {
  static final String DATA = "classpath:data/shop.json";

  static final String CUSTOMERS = """
      type customers @table(name: "customers") {
        id: Int! @pk
        name: String
        region: String
      }
      """;

  static final String ORDERS = """
      type orders @table(name: "orders") {
        id: Int! @pk
        customer_id: Int! @field_references(references_name: "customers", query: "customer", references_query: "orders")
        total: Float
        status: String
      }
      """;

  static final String REMOTE_ORDERS = """
      type orders @table(name: "orders") {
        id: Int! @pk
        customer_id: Int!
        total: Float
        status: String
      }
      extend type orders {
        customer: customers @join(references_name: "customers", source_fields: ["customer_id"], references_fields: ["id"])
      }
      extend type customers {
        orders: [orders] @join(references_name: "orders", source_fields: ["id"], references_fields: ["customer_id"])
      }
      """;

  private Fixtures() {}

  /** One memory source holding both objects. */
  static DataSourceDef shop() {
    return DataSourceDef.of("shop", InMemorySourceAdapterProvider.TYPE, DATA,
        CatalogDef.inline("customers", CUSTOMERS), CatalogDef.inline("orders", ORDERS));
  }

  /** {@code customers} on {@code crm}, {@code orders} on {@code sales} joined through {@code @join}. */
  static List<DataSourceDef> split(String crmType) {
    return List.of(
        DataSourceDef.of("crm", crmType, DATA, CatalogDef.inline("customers", CUSTOMERS)),
        DataSourceDef.of("sales", InMemorySourceAdapterProvider.TYPE, DATA, CatalogDef.inline("orders", REMOTE_ORDERS)));
  }

  static SourceAdapterRegistry registry(SourceAdapterProvider... extra) {
    List<SourceAdapterProvider> providers = new ArrayList<>();
    providers.add(new InMemorySourceAdapterProvider());
    providers.addAll(Arrays.asList(extra));
    return new SourceAdapterRegistry(providers);
  }

  /** Plan of {@code query} over {@link #shop()} read through scans. */
  static QueryPlan plan(String query) {
    CompiledSchema schema = new SchemaCompiler().compile(
        new CatalogLoader(type -> Capabilities.SCAN_ONLY).load(List.of(shop())).orThrow());
    RequestParser parser = new RequestParser(schema.graphQLSchema());
    return new QueryPlanner(schema, EngineConfig.DEFAULT_LIMIT, ds -> false).plan(
        parser.parse(RequestParser.parseDocument(query), null, Map.of()),
        AccessPolicy.open().permissions(AuthContext.anonymous()), AuthContext.anonymous());
  }

  static ExecutionRequest request(String query) {
    return ExecutionRequest.of(query);
  }

  @SuppressWarnings("unchecked")
  static <T> T at(Object data, Object... path) {
    Object v = data;
    for (Object p : path) {
      v = p instanceof Integer i ? ((List<Object>) v).get(i) : ((Map<String, Object>) v).get(p);
    }
    return (T) v;
  }

  /** Provider handing out adapters built by {@code factory}. */
  static final class StubProvider implements SourceAdapterProvider {
    private final String type;
    private final Capabilities capabilities;
    private final Function<DataSourceDef, SourceAdapter> factory;

    StubProvider(String type, Capabilities capabilities, Function<DataSourceDef, SourceAdapter> factory) {
      this.type = type;
      this.capabilities = capabilities;
      this.factory = factory;
    }

    @Override public String type() { return type; }
    @Override public Capabilities capabilities() { return capabilities; }
    @Override public SourceAdapter create(DataSourceDef dataSource) { return factory.apply(dataSource); }
  }

  /** Memory-backed adapter that counts calls and can be told to fail or to hang until cancelled. */
  static final class StubAdapter implements SourceAdapter {
    final SourceAdapter delegate;
    final AtomicInteger calls = new AtomicInteger();
    volatile boolean hang;
    volatile RuntimeException failure;
    volatile boolean closed;

    StubAdapter(DataSourceDef def) {
      this.delegate = new InMemorySourceAdapterProvider().create(def);
    }

    /** Provider of type {@code stub} serving this adapter for every source. */
    StubProvider provider() {
      return new StubProvider("stub", Capabilities.SCAN_ONLY, def -> this);
    }

    @Override public String name() { return delegate.name(); }
    @Override public Capabilities capabilities() { return delegate.capabilities(); }
    @Override public Dialect dialect() { return null; }

    @Override
    public SourceResult execute(NativeQuery query, CancellationToken token) {
      calls.incrementAndGet();
      if (failure != null) throw failure;
      while (hang && !token.isCancelled()) {
        try {
          Thread.sleep(5);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          token.cancel("interrupted");
        }
      }
      token.throwIfCancelled(name());
      return delegate.execute(query, token);
    }

    @Override
    public void close() {
      closed = true;
    }
  }

  /**
   * SQL source double answering scalar function calls with {@code functions}. Statements carry an id
   * that maps back to the call arguments.
   */
  static final class FunctionAdapter implements SourceAdapter, Dialect {
    private final String name;
    private final Map<String, Function<Map<String, Object>, Object>> functions;
    private final Map<String, Map<String, Object>> pending = new ConcurrentHashMap<>();
    private final AtomicInteger seq = new AtomicInteger();
    final AtomicInteger calls = new AtomicInteger();

    FunctionAdapter(String name, Map<String, Function<Map<String, Object>, Object>> functions) {
      this.name = name;
      this.functions = functions;
    }

    StubProvider provider() {
      return new StubProvider("fakesql", Capabilities.FULL, def -> this);
    }

    @Override public String name() { return name; }
    @Override public Capabilities capabilities() { return Capabilities.FULL; }
    @Override public Dialect dialect() { return this; }
    @Override public String id() { return "fakesql"; }

    @Override
    public SqlStatement callFunction(Catalog catalog, String module, String function, Map<String, Object> args) {
      String sql = "SELECT " + function + "(" + seq.incrementAndGet() + ") AS value";
      pending.put(sql, new LinkedHashMap<>(args));
      return new SqlStatement(name, sql, List.of());
    }

    @Override
    public SourceResult execute(NativeQuery query, CancellationToken token) {
      calls.incrementAndGet();
      SqlStatement s = (SqlStatement) query;
      Map<String, Object> args = pending.remove(s.sql());
      String function = s.sql().substring("SELECT ".length(), s.sql().indexOf('('));
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("value", functions.get(function).apply(args));
      return SourceResult.ofRows(List.of(row));
    }

    @Override public SqlStatement select(Catalog catalog, SelectSpec spec) { throw unsupported(); }
    @Override public SqlStatement aggregate(Catalog catalog, AggregateSpec spec) { throw unsupported(); }
    @Override public SqlStatement insert(Catalog catalog, InsertSpec spec) { throw unsupported(); }
    @Override public SqlStatement update(Catalog catalog, UpdateSpec spec) { throw unsupported(); }
    @Override public SqlStatement delete(Catalog catalog, DeleteSpec spec) { throw unsupported(); }

    private static UnsupportedOperationException unsupported() {
      return new UnsupportedOperationException("function source only calls functions");
    }
  }
}
