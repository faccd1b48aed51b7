package io.intellixity.federa.engine;

import graphql.language.Document;
import io.intellixity.federa.cache.ExternalCacheTier;
import io.intellixity.federa.cache.LocalCacheTier;
import io.intellixity.federa.cache.QueryCache;
import io.intellixity.federa.config.CacheConfig;
import io.intellixity.federa.config.DataSourceDef;
import io.intellixity.federa.config.EngineConfig;
import io.intellixity.federa.config.RoleDef;
import io.intellixity.federa.governance.AccessDeniedException;
import io.intellixity.federa.governance.AccessPolicy;
import io.intellixity.federa.governance.AuthContext;
import io.intellixity.federa.governance.RolePermissions;
import io.intellixity.federa.plan.PlanningException;
import io.intellixity.federa.plan.QueryPlan;
import io.intellixity.federa.plan.QueryPlanner;
import io.intellixity.federa.plan.request.RequestParser;
import io.intellixity.federa.plan.request.RequestTree;
import io.intellixity.federa.plan.request.RequestValidator;
import io.intellixity.federa.plan.request.SelectedField;
import io.intellixity.federa.query.QueryValidationException;
import io.intellixity.federa.schema.CompiledSchema;
import io.intellixity.federa.schema.SchemaCompiler;
import io.intellixity.federa.sdl.CatalogLoadResult;
import io.intellixity.federa.sdl.CatalogLoader;
import io.intellixity.federa.sdl.SchemaDefinitionException;
import io.intellixity.federa.spi.source.CancellationToken;
import io.intellixity.federa.spi.source.SourceAdapter;
import io.intellixity.federa.spi.source.SourceAdapterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the engine: compiles data source catalogs into a GraphQL schema and executes requests
 * against it.
 * <p>
 * The compiled schema, the planner and the source adapters form one snapshot that requests read
 * without locking. {@link #reload(List)} builds a new snapshot and swaps it in atomically; requests
 * already running finish on the snapshot they started with.
 */
public final class FederaEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(FederaEngine.class);

  private final EngineConfig config;
  private final SourceAdapterRegistry registry;
  private final ClusterCoordinator cluster;
  private final QueryCache cache;
  private final ExecutorService workers;
  private final ExecutionCoordinator coordinator;
  private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();
  private final AtomicReference<AccessPolicy> access;

  private record Snapshot(CompiledSchema schema, Map<String, SourceAdapter> adapters, QueryPlanner planner,
                          RequestParser parser, RequestValidator validator, Introspector introspector) {}

  private FederaEngine(Builder b) {
    this.config = b.config;
    this.registry = b.registry != null ? b.registry : new SourceAdapterRegistry();
    this.cluster = b.cluster;
    this.access = new AtomicReference<>(b.access != null ? b.access : AccessPolicy.open());
    CacheConfig cc = config.cache();
    this.cache = cc.enabled() ? new QueryCache(new LocalCacheTier(cc.localMaxEntries(), cc.idleMillis()), b.externalCache) : null;
    this.workers = Executors.newFixedThreadPool(config.workerThreads(), new WorkerThreads());
    this.coordinator = new ExecutionCoordinator(workers, cache, Duration.ofSeconds(cc.defaultTtlSeconds()));
    if (cluster != null) cluster.onSchemaInvalidated(this::reloadFromCluster);
  }

  public static Builder builder() {
    return new Builder();
  }

  public EngineConfig config() { return config; }

  /** Current schema, {@code null} before the first reload. */
  public CompiledSchema schema() {
    Snapshot s = snapshot.get();
    return s == null ? null : s.schema();
  }

  /** Query cache, {@code null} when caching is disabled. */
  public QueryCache cache() { return cache; }

  /**
   * Loads and compiles the catalogs of {@code sources} without touching the running snapshot. Sources
   * whose catalog fails to load are left out of the schema and reported in the result.
   */
  public SchemaCompilation compileSchema(List<DataSourceDef> sources) {
    CatalogLoadResult loaded = new CatalogLoader(registry::capabilities).load(sources);
    for (Map.Entry<String, SchemaDefinitionException> f : loaded.failures().entrySet()) {
      log.warn("federa.engine source_failed dataSource={} errors={}", f.getKey(), f.getValue().errors().size());
    }
    CompiledSchema schema = new SchemaCompiler(config.defaultLimit()).compile(loaded.catalog());
    return new SchemaCompilation(schema, loaded.failures());
  }

  /** Compiles {@code sources}, opens their adapters and makes them the running snapshot. */
  public synchronized SchemaCompilation reload(List<DataSourceDef> sources) {
    SchemaCompilation compiled = compileSchema(sources);
    Map<String, SourceAdapter> adapters = new LinkedHashMap<>();
    try {
      for (DataSourceDef ds : sources) {
        if (!compiled.failures().containsKey(ds.name())) adapters.put(ds.name(), registry.create(ds));
      }
    } catch (RuntimeException e) {
      closeAll(adapters);
      throw e;
    }
    CompiledSchema schema = compiled.schema();
    QueryPlanner planner = new QueryPlanner(schema, config.defaultLimit(),
        ds -> adapters.containsKey(ds) && adapters.get(ds).dialect() != null);
    Snapshot next = new Snapshot(schema, Collections.unmodifiableMap(adapters), planner,
        new RequestParser(schema.graphQLSchema()), new RequestValidator(schema), new Introspector(schema.graphQLSchema()));
    Snapshot previous = snapshot.getAndSet(next);
    if (cache != null) cache.clearLocal();
    if (previous != null) closeAll(previous.adapters());
    log.info("federa.engine reloaded dataSources={} objects={} failures={}", adapters.keySet(),
        schema.catalog().objects().size(), compiled.failures().keySet());
    return compiled;
  }

  /** Replaces the role definitions; an empty list opens the engine to every caller. */
  public void updateRoles(List<RoleDef> roles) {
    access.set(AccessPolicy.of(roles));
  }

  /** Reloads sources and roles from the cluster catalog store. */
  public void reloadFromCluster() {
    if (cluster == null) throw new IllegalStateException("No cluster coordinator configured");
    ClusterCoordinator.SourceSnapshot s = cluster.currentSourceSnapshot();
    try {
      updateRoles(s.roles());
      reload(s.dataSources());
    } catch (RuntimeException e) {
      log.error("federa.engine cluster_reload_failed keeping previous snapshot", e);
    }
  }

  public ExecutionResponse execute(ExecutionRequest request) {
    Objects.requireNonNull(request, "request");
    Snapshot s = snapshot.get();
    if (s == null) {
      return ExecutionResponse.failed(GraphQLErrorEntry.of("No schema is loaded", List.of(),
          GraphQLErrorEntry.VALIDATION_FAILED));
    }
    AuthContext auth = request.auth();
    QueryPlan plan;
    RolePermissions perms;
    Map<String, Object> introspection = Map.of();
    try {
      Document document = RequestParser.parseDocument(request.query());
      List<QueryValidationException> invalid = s.validator().validateDocument(document);
      if (!invalid.isEmpty()) {
        List<GraphQLErrorEntry> errors = new ArrayList<>();
        for (QueryValidationException e : invalid) {
          errors.add(GraphQLErrorEntry.of(e.getMessage(), e.path(), GraphQLErrorEntry.VALIDATION_FAILED));
        }
        return new ExecutionResponse(null, errors);
      }
      RequestTree tree = s.parser().parse(document, request.operationName(), request.variables());
      s.validator().validate(tree);
      boolean introspects = false;
      for (SelectedField f : tree.fields()) introspects |= f.isIntrospection();
      if (introspects && !config.introspection()) throw new QueryValidationException("Introspection is disabled");
      perms = access.get().permissions(auth);
      plan = s.planner().plan(tree, perms, auth);
      if (plan.hasIntrospection()) {
        introspection = s.introspector().answer(document, request.operationName(), request.variables());
      }
    } catch (QueryValidationException e) {
      log.debug("federa.engine invalid_request err={}", e.getMessage());
      return ExecutionResponse.failed(GraphQLErrorEntry.of(e.getMessage(), e.path(), GraphQLErrorEntry.VALIDATION_FAILED));
    } catch (AccessDeniedException e) {
      log.debug("federa.engine access_denied role={} err={}", auth.role(), e.getMessage());
      return ExecutionResponse.failed(GraphQLErrorEntry.of(e.getMessage(), e.path(), GraphQLErrorEntry.ACCESS_DENIED));
    } catch (PlanningException e) {
      log.debug("federa.engine planning_failed err={}", e.getMessage());
      return ExecutionResponse.failed(GraphQLErrorEntry.of(e.getMessage(), e.path(), GraphQLErrorEntry.PLANNING_FAILED));
    }
    String identity = perms.usesClaims() ? auth.cacheKey() : auth.role();
    CancellationToken token = CancellationToken.withTimeoutMillis(config.requestTimeoutMillis());
    return coordinator.execute(s.schema().catalog(), s.adapters(), plan, identity, introspection, token);
  }

  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) workers.shutdownNow();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
    Snapshot s = snapshot.getAndSet(null);
    if (s != null) closeAll(s.adapters());
    if (cache != null) {
      try {
        cache.close();
      } catch (Exception e) {
        log.warn("federa.engine cache_close_failed err={}", e.getMessage());
      }
    }
  }

  private static void closeAll(Map<String, SourceAdapter> adapters) {
    for (SourceAdapter a : adapters.values()) {
      try {
        a.close();
      } catch (RuntimeException e) {
        log.warn("federa.engine adapter_close_failed dataSource={} err={}", a.name(), e.getMessage());
      }
    }
  }

  private static final class WorkerThreads implements ThreadFactory {
    private final AtomicInteger seq = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "federa-worker-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }

  public static final class Builder {
    private EngineConfig config = EngineConfig.DEFAULT;
    private SourceAdapterRegistry registry;
    private AccessPolicy access;
    private ExternalCacheTier externalCache;
    private ClusterCoordinator cluster;

    private Builder() {}

    public Builder config(EngineConfig v) { this.config = Objects.requireNonNull(v, "config"); return this; }
    /** Defaults to the providers listed in {@code META-INF/federa.factories}. */
    public Builder registry(SourceAdapterRegistry v) { this.registry = v; return this; }
    public Builder roles(List<RoleDef> v) { this.access = AccessPolicy.of(v); return this; }
    public Builder accessPolicy(AccessPolicy v) { this.access = v; return this; }
    public Builder externalCache(ExternalCacheTier v) { this.externalCache = v; return this; }
    public Builder cluster(ClusterCoordinator v) { this.cluster = v; return this; }

    public FederaEngine build() {
      return new FederaEngine(this);
    }
  }
}
