package io.intellixity.federa.plan;

import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.catalog.Catalog;
import io.intellixity.federa.catalog.DataSourceInfo;
import io.intellixity.federa.governance.AccessPolicy;
import io.intellixity.federa.governance.AuthContext;
import io.intellixity.federa.governance.RolePermissions;
import io.intellixity.federa.plan.request.RequestParser;
import io.intellixity.federa.plan.request.RequestTree;
import io.intellixity.federa.sdl.CatalogLoader;
import io.intellixity.federa.sdl.SdlSource;
import io.intellixity.federa.schema.CompiledSchema;
import io.intellixity.federa.schema.SchemaCompiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Catalog fixtures shared by planner tests. Source type {@code memory} is scan-only. */
public final class Schemas {
  public static final Capabilities NO_JOINS = new Capabilities(false, true, false);

  public static final String CUSTOMERS = """
      type customers @table(name: "customers") {
        id: Int! @pk
        name: String
        region: String
      }
      """;

  public static final String ORDERS = """
      type orders @table(name: "orders") {
        id: Int! @pk
        customer_id: Int! @field_references(references_name: "customers", query: "customer", references_query: "orders")
        total: Float
        status: String
        created_at: Timestamp
      }
      """;

  /** {@code orders} on its own source, related to {@code customers} through {@code @join} extensions. */
  public static final String REMOTE_ORDERS = """
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

  private Schemas() {}

  public static CatalogLoader.SourceDocuments source(String name, String type, Capabilities caps, String... sdl) {
    List<SdlSource> docs = new ArrayList<>();
    for (int i = 0; i < sdl.length; i++) docs.add(new SdlSource(name + "-" + i + ".graphql", sdl[i]));
    return new CatalogLoader.SourceDocuments(new DataSourceInfo(name, type, null, false, false, caps), docs);
  }

  public static CatalogLoader.SourceDocuments postgres(String name, String... sdl) {
    return source(name, "postgres", Capabilities.FULL, sdl);
  }

  public static CompiledSchema compile(CatalogLoader.SourceDocuments... sources) {
    Catalog catalog = new CatalogLoader(Schemas::capabilities).loadDocuments(List.of(sources)).orThrow();
    return new SchemaCompiler().compile(catalog);
  }

  public static Capabilities capabilities(String type) {
    return switch (type) {
      case "memory" -> Capabilities.SCAN_ONLY;
      case "nojoin" -> NO_JOINS;
      default -> Capabilities.FULL;
    };
  }

  public static RequestTree request(CompiledSchema schema, String query) {
    return request(schema, query, Map.of());
  }

  public static RequestTree request(CompiledSchema schema, String query, Map<String, Object> variables) {
    return new RequestParser(schema.graphQLSchema()).parse(RequestParser.parseDocument(query), null, variables);
  }

  public static QueryPlanner planner(CompiledSchema schema) {
    Catalog c = schema.catalog();
    return new QueryPlanner(schema, SchemaCompiler.DEFAULT_LIMIT, ds -> !"memory".equals(c.dataSource(ds).type()));
  }

  public static QueryPlan plan(CompiledSchema schema, String query) {
    return plan(schema, query, AccessPolicy.open().permissions(AuthContext.anonymous()), AuthContext.anonymous());
  }

  public static QueryPlan plan(CompiledSchema schema, String query, RolePermissions perms, AuthContext auth) {
    return planner(schema).plan(request(schema, query), perms, auth);
  }
}
