package io.intellixity.federa.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.federa.cache.CacheKeys;
import io.intellixity.federa.cache.QueryCache;
import io.intellixity.federa.catalog.Catalog;
import io.intellixity.federa.catalog.DataObject;
import io.intellixity.federa.catalog.ScalarType;
import io.intellixity.federa.governance.AccessDeniedException;
import io.intellixity.federa.plan.*;
import io.intellixity.federa.plan.request.RequestTree;
import io.intellixity.federa.query.*;
import io.intellixity.federa.schema.FederaScalars;
import io.intellixity.federa.spi.source.*;
import io.intellixity.federa.spi.source.SourceExecutionException.Code;
import io.intellixity.federa.spi.sql.Dialect;
import io.intellixity.federa.spi.sql.Projection;
import io.intellixity.federa.spi.sql.SelectSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Function;

/**
 * Runs a {@link QueryPlan} against the adapters of one snapshot.
 * <p>
 * Native queries run on the worker pool. A local merge waits for all of its inputs and runs on the
 * thread completing the last one. Every read node is executed at most once per request, so a child read
 * shared by a semi-join and a local join is fetched once. Top-level query fields run concurrently;
 * mutation fields run one after the other in document order.
 */
final class ExecutionCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final String FUNCTION_VALUE = "value";

  private final ExecutorService workers;
  private final QueryCache cache;
  private final Duration defaultTtl;

  /** {@code cache} is {@code null} when caching is disabled. */
  ExecutionCoordinator(ExecutorService workers, QueryCache cache, Duration defaultTtl) {
    this.workers = Objects.requireNonNull(workers, "workers");
    this.cache = cache;
    this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
  }

  /**
   * @param cacheIdentity caller part of derived cache keys
   * @param introspection values of introspection fields, by response key
   */
  ExecutionResponse execute(Catalog catalog, Map<String, SourceAdapter> adapters, QueryPlan plan,
                            String cacheIdentity, Map<String, Object> introspection, CancellationToken token) {
    return new Run(catalog, adapters, cacheIdentity, introspection, token).execute(plan);
  }

  /** Output value of one field plus the errors of its failed branches. */
  private record FieldResult(Object value, List<GraphQLErrorEntry> errors) {
    FieldResult {
      errors = List.copyOf(errors);
    }
  }

  /** Carries a partial field result past the cache, which only stores complete ones. */
  private static final class PartialResultException extends RuntimeException {
    private final FieldResult result;

    PartialResultException(FieldResult result) {
      super(null, null, false, false);
      this.result = result;
    }
  }

  private final class Run {
    private final Catalog catalog;
    private final Map<String, SourceAdapter> adapters;
    private final String cacheIdentity;
    private final Map<String, Object> introspection;
    private final CancellationToken token;
    private final Map<ReadNode, CompletableFuture<List<Map<String, Object>>>> reads = new IdentityHashMap<>();
    private final Map<List<Object>, CompletableFuture<Object>> calls = new ConcurrentHashMap<>();
    private final List<GraphQLErrorEntry> errors = new ArrayList<>();

    Run(Catalog catalog, Map<String, SourceAdapter> adapters, String cacheIdentity, Map<String, Object> introspection,
        CancellationToken token) {
      this.catalog = catalog;
      this.adapters = adapters;
      this.cacheIdentity = cacheIdentity;
      this.introspection = introspection;
      this.token = token;
    }

    ExecutionResponse execute(QueryPlan plan) {
      Map<String, Object> data = new LinkedHashMap<>();
      if (plan.operation() == RequestTree.Operation.MUTATION) {
        for (FieldPlan f : plan.fields()) data.put(f.responseKey(), await(f, start(f)));
      } else {
        List<CompletableFuture<FieldResult>> started = new ArrayList<>();
        for (FieldPlan f : plan.fields()) started.add(start(f));
        for (int i = 0; i < started.size(); i++) {
          FieldPlan f = plan.fields().get(i);
          data.put(f.responseKey(), await(f, started.get(i)));
        }
      }
      return new ExecutionResponse(data, errors);
    }

    /** Waits for a top-level field until the request deadline; failures null the field. */
    private Object await(FieldPlan f, CompletableFuture<FieldResult> future) {
      try {
        FieldResult r = future.get(token.remainingMillis(), TimeUnit.MILLISECONDS);
        errors.addAll(r.errors());
        return r.value();
      } catch (TimeoutException e) {
        token.cancel("deadline exceeded");
        log.warn("federa.exec timeout field={}", f.path());
        errors.add(GraphQLErrorEntry.of("Request timed out", f.path(), Code.TIMEOUT.name()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        token.cancel("interrupted");
        errors.add(GraphQLErrorEntry.of("Request was interrupted", f.path(), Code.CANCELLED.name()));
      } catch (ExecutionException e) {
        errors.add(error(f.path(), e.getCause()));
      }
      return null;
    }

    private CompletableFuture<FieldResult> start(FieldPlan f) {
      if (f instanceof FieldPlan.Typename t) return done(t.typeName());
      if (f instanceof FieldPlan.Redacted) return done(null);
      if (f instanceof FieldPlan.Introspection) return done(introspection.get(f.responseKey()));
      if (f instanceof FieldPlan.Group g) return group(g);
      if (f instanceof FieldPlan.Mutation m) return collect(errs -> mutation(m));
      if (f instanceof FieldPlan.Rows r) return cached(r.cache(), errs -> rows(r, errs));
      FieldPlan.Scalar s = (FieldPlan.Scalar) f;
      return cached(s.cache(), errs -> scalar(s));
    }

    private CompletableFuture<FieldResult> done(Object value) {
      return CompletableFuture.completedFuture(new FieldResult(value, List.of()));
    }

    /** Module namespace; children are independent fields, run serially inside mutations. */
    private CompletableFuture<FieldResult> group(FieldPlan.Group g) {
      Map<String, Object> out = new LinkedHashMap<>();
      List<GraphQLErrorEntry> errs = new CopyOnWriteArrayList<>();
      CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
      List<CompletableFuture<Void>> parallel = new ArrayList<>();
      for (FieldPlan c : g.fields()) {
        if (c instanceof FieldPlan.Mutation || c instanceof FieldPlan.Group && hasMutation((FieldPlan.Group) c)) {
          chain = chain.thenCompose(v -> settle(c, start(c)).thenAccept(r -> keep(out, errs, c, r)));
        } else {
          parallel.add(settle(c, start(c)).thenAccept(r -> keep(out, errs, c, r)));
        }
      }
      parallel.add(chain);
      return CompletableFuture.allOf(parallel.toArray(new CompletableFuture[0])).thenApply(v -> {
        Map<String, Object> ordered = new LinkedHashMap<>();
        synchronized (out) {
          for (FieldPlan c : g.fields()) ordered.put(c.responseKey(), out.get(c.responseKey()));
        }
        return new FieldResult(ordered, errs);
      });
    }

    private boolean hasMutation(FieldPlan.Group g) {
      for (FieldPlan c : g.fields()) {
        if (c instanceof FieldPlan.Mutation || c instanceof FieldPlan.Group && hasMutation((FieldPlan.Group) c)) {
          return true;
        }
      }
      return false;
    }

    private void keep(Map<String, Object> out, List<GraphQLErrorEntry> errs, FieldPlan f, FieldResult r) {
      synchronized (out) {
        out.put(f.responseKey(), r.value());
      }
      errs.addAll(r.errors());
    }

    private CompletableFuture<FieldResult> settle(FieldPlan f, CompletableFuture<FieldResult> future) {
      return future.exceptionally(e -> new FieldResult(null, List.of(error(f.path(), e))));
    }

    /** Runs {@code body} with a fresh error list for its failed branches. */
    private CompletableFuture<FieldResult> collect(Function<List<GraphQLErrorEntry>, CompletableFuture<Object>> body) {
      List<GraphQLErrorEntry> errs = new CopyOnWriteArrayList<>();
      CompletableFuture<Object> value;
      try {
        value = body.apply(errs);
      } catch (RuntimeException e) {
        value = CompletableFuture.failedFuture(e);
      }
      return value.thenApply(v -> new FieldResult(v, errs));
    }

    private CompletableFuture<FieldResult> cached(CachePolicy policy,
                                                  Function<List<GraphQLErrorEntry>, CompletableFuture<Object>> body) {
      if (policy == null || cache == null) return collect(body);
      if (policy.invalidate()) {
        return collect(body).whenComplete((r, e) -> cache.invalidate(policy.tags()));
      }
      String key = policy.key() != null
          ? CacheKeys.explicit(policy.key())
          : CacheKeys.of(policy.canonical(), Map.of(), cacheIdentity);
      Duration ttl = policy.ttlSeconds() != null ? Duration.ofSeconds(policy.ttlSeconds()) : defaultTtl;
      return cache.getOrCompute(key, ttl, policy.tags(), () -> collect(body).thenCompose(r -> r.errors().isEmpty()
              ? CompletableFuture.<Object>completedFuture(r.value())
              : CompletableFuture.<Object>failedFuture(new PartialResultException(r))))
          .handle((entry, e) -> {
            if (e == null) return done(entry.value());
            Throwable cause = unwrap(e);
            if (cause instanceof PartialResultException p) return CompletableFuture.completedFuture(p.result);
            return CompletableFuture.<FieldResult>failedFuture(cause);
          })
          .thenCompose(Function.identity());
    }

    // ---------- reads

    private CompletableFuture<Object> rows(FieldPlan.Rows f, List<GraphQLErrorEntry> errs) {
      return read(f.node(), errs).thenApply(rows -> {
        if (!f.list()) return rows.isEmpty() ? null : format(f.fields(), rows.get(0));
        List<Object> out = new ArrayList<>(rows.size());
        for (Map<String, Object> r : rows) out.add(format(f.fields(), r));
        return out;
      });
    }

    /** Rows of {@code node}, started on first use. */
    private CompletableFuture<List<Map<String, Object>>> read(ReadNode node, List<GraphQLErrorEntry> errs) {
      CompletableFuture<List<Map<String, Object>>> rows;
      synchronized (reads) {
        CompletableFuture<List<Map<String, Object>>> known = reads.get(node);
        if (known != null) return known;
        rows = new CompletableFuture<>();
        reads.put(node, rows);
      }
      try {
        run(node, errs).whenComplete((r, e) -> {
          if (e == null) rows.complete(r);
          else rows.completeExceptionally(unwrap(e));
        });
      } catch (RuntimeException e) {
        rows.completeExceptionally(e);
      }
      return rows;
    }

    private CompletableFuture<List<Map<String, Object>>> run(ReadNode node, List<GraphQLErrorEntry> errs) {
      node.moveTo(PlanState.SCHEDULED);
      List<CompletableFuture<List<List<Object>>>> keys = new ArrayList<>();
      for (SemiJoin sj : node.semiJoins()) {
        CompletableFuture<List<List<Object>>> tuples = read(sj.keys(), errs).thenApply(rows -> keyTuples(rows, sj.keyLabels()));
        // inner join keys: the local join over the same read nulls the branch and reports the failure
        if (sj.condition() == null) tuples = tuples.exceptionally(e -> null);
        keys.add(tuples);
      }
      return CompletableFuture.allOf(keys.toArray(new CompletableFuture[0]))
          .thenApplyAsync(v -> {
            QueryElement filter = node.select() != null ? node.select().filter() : node.aggregate().filter();
            for (int i = 0; i < keys.size(); i++) {
              List<List<Object>> tuples = keys.get(i).join();
              if (tuples != null) filter = restrict(filter, node.semiJoins().get(i), tuples);
            }
            List<Map<String, Object>> rows = fetch(node, filter);
            if (node.localAggregation() != null) rows = LocalAggregator.apply(node.localAggregation(), rows);
            return rows;
          }, workers)
          .thenCompose(rows -> functionCalls(node, rows))
          .thenCompose(rows -> joins(node, rows, errs))
          .whenComplete((rows, e) -> node.moveTo(e == null ? PlanState.COMPLETED : PlanState.FAILED));
    }

    private List<Map<String, Object>> fetch(ReadNode node, QueryElement filter) {
      String ds = node.dataSource();
      SourceAdapter adapter = adapter(ds);
      token.throwIfCancelled(ds);
      boolean rewritten = !node.semiJoins().isEmpty();
      NativeQuery query;
      if (node.scan()) {
        query = scan(node, filter);
      } else if (node.select() != null) {
        SelectSpec spec = rewritten ? node.select().toBuilder().filter(filter).build() : node.select();
        query = dialect(adapter).select(catalog, spec);
      } else {
        query = dialect(adapter).aggregate(catalog,
            rewritten ? node.aggregate().toBuilder().filter(filter).build() : node.aggregate());
      }
      long started = System.nanoTime();
      SourceResult result = adapter.execute(query, token);
      if (log.isDebugEnabled()) {
        log.debug("federa.exec read node={} rows={} tookMs={}", node, result.rows().size(),
            (System.nanoTime() - started) / 1_000_000L);
      }
      List<Map<String, Object>> rows = new ArrayList<>(result.rows().size());
      if (node.scan()) {
        for (Map<String, Object> r : result.rows()) rows.add(relabel(node.select(), r));
      } else {
        for (Map<String, Object> r : result.rows()) rows.add(new LinkedHashMap<>(r));
      }
      return rows;
    }

    /** Scan reads project plain columns; rows come back by field name. */
    private ScanRequest scan(ReadNode node, QueryElement filter) {
      SelectSpec spec = node.select();
      if (spec == null) {
        throw new SourceExecutionException(Code.EXECUTION_FAILED, node.dataSource(),
            "Aggregation of " + node + " needs a SQL source");
      }
      List<String> fields = new ArrayList<>();
      for (Projection p : spec.projections()) {
        if (!(p instanceof Projection.Column c)) {
          throw new SourceExecutionException(Code.EXECUTION_FAILED, node.dataSource(),
              "Projection '" + p.output() + "' needs a SQL source");
        }
        if (!fields.contains(c.field())) fields.add(c.field());
      }
      DataObject o = catalog.object(node.objectId());
      return new ScanRequest(node.dataSource(), ScanRequest.Action.SELECT, o.sourceName(), fields, filter,
          spec.orderBy(), spec.limit(), spec.offset(), spec.distinctOn(), spec.args(), null);
    }

    private CompletableFuture<List<Map<String, Object>>> functionCalls(ReadNode node, List<Map<String, Object>> rows) {
      if (node.functionCalls().isEmpty() || rows.isEmpty()) return CompletableFuture.completedFuture(rows);
      List<CompletableFuture<Object>> values = new ArrayList<>();
      for (FunctionCallStep step : node.functionCalls()) {
        for (Map<String, Object> row : rows) {
          Map<String, Object> args = new LinkedHashMap<>(step.constArgs());
          for (Map.Entry<String, String> a : step.fieldArgs().entrySet()) args.put(a.getKey(), row.get(a.getValue()));
          values.add(call(step.dataSource(), step.module(), step.function(), args));
        }
      }
      // a failed call fails the read: the field value is not optional
      return CompletableFuture.allOf(values.toArray(new CompletableFuture[0])).thenApply(v -> {
        int i = 0;
        for (FunctionCallStep step : node.functionCalls()) {
          for (Map<String, Object> row : rows) row.put(step.label(), values.get(i++).join());
        }
        return rows;
      });
    }

    /** Scalar function call, made once per distinct arguments. */
    private CompletableFuture<Object> call(String ds, String module, String function, Map<String, Object> args) {
      List<Object> key = List.of(ds, module, function, args);
      return calls.computeIfAbsent(key, k -> CompletableFuture.supplyAsync(() -> {
        SourceAdapter adapter = adapter(ds);
        token.throwIfCancelled(ds);
        SourceResult r = adapter.execute(dialect(adapter).callFunction(catalog, module, function, args), token);
        if (r.rows().isEmpty()) return null;
        Map<String, Object> row = r.rows().get(0);
        if (row.containsKey(FUNCTION_VALUE) || row.size() != 1) return row.get(FUNCTION_VALUE);
        return row.values().iterator().next();
      }, workers));
    }

    private CompletableFuture<List<Map<String, Object>>> joins(ReadNode node, List<Map<String, Object>> rows,
                                                              List<GraphQLErrorEntry> errs) {
      if (node.joins().isEmpty()) return CompletableFuture.completedFuture(rows);
      List<CompletableFuture<List<Map<String, Object>>>> children = new ArrayList<>();
      List<CompletableFuture<List<Map<String, Object>>>> junctions = new ArrayList<>();
      List<CompletableFuture<?>> barrier = new ArrayList<>();
      for (LocalJoin join : node.joins()) {
        CompletableFuture<List<Map<String, Object>>> child = read(join.child(), errs);
        CompletableFuture<List<Map<String, Object>>> junction = join.junction() == null
            ? CompletableFuture.completedFuture(List.of())
            : read(join.junction(), errs);
        children.add(child);
        junctions.add(junction);
        barrier.add(child.handle((r, e) -> null));
        barrier.add(junction.handle((r, e) -> null));
      }
      return CompletableFuture.allOf(barrier.toArray(new CompletableFuture[0])).thenApply(v -> {
        List<Map<String, Object>> current = rows;
        for (int i = 0; i < node.joins().size(); i++) {
          LocalJoin join = node.joins().get(i);
          try {
            current = LocalJoiner.join(current, join, children.get(i).join(), junctions.get(i).join());
          } catch (CompletionException | CancellationException e) {
            LocalJoiner.nullBranch(current, join.label());
            errs.add(error(join.path(), e));
          }
        }
        return current;
      });
    }

    // ---------- functions and mutations

    private CompletableFuture<Object> scalar(FieldPlan.Scalar f) {
      FunctionNode node = f.node();
      node.moveTo(PlanState.SCHEDULED);
      return call(node.dataSource(), node.module(), node.function(), node.args())
          .thenApply(v -> value(f.scalar(), v))
          .whenComplete((v, e) -> node.moveTo(e == null ? PlanState.COMPLETED : PlanState.FAILED));
    }

    private CompletableFuture<Object> mutation(FieldPlan.Mutation f) {
      MutationNode node = f.node();
      node.moveTo(PlanState.SCHEDULED);
      return CompletableFuture.supplyAsync(() -> mutate(node), workers)
          .thenApply(row -> (Object) format(f.fields(), row))
          .whenComplete((v, e) -> {
            node.moveTo(e == null ? PlanState.COMPLETED : PlanState.FAILED);
            if (e == null && cache != null) cache.invalidate(node.invalidateTags());
          });
    }

    private Map<String, Object> mutate(MutationNode node) {
      String ds = node.dataSource();
      SourceAdapter adapter = adapter(ds);
      token.throwIfCancelled(ds);
      String object = catalog.object(node.objectId()).sourceName();
      if (node.insert() != null) {
        NativeQuery q = node.scan()
            ? new ScanRequest(ds, ScanRequest.Action.INSERT, object, node.insert().returning(), null, null, null,
                null, null, null, node.insert().values())
            : dialect(adapter).insert(catalog, node.insert());
        SourceResult r = adapter.execute(q, token);
        log.debug("federa.exec insert node={} returned={}", node, r.rows().size());
        return new LinkedHashMap<>(r.rows().isEmpty() ? node.insert().values() : r.rows().get(0));
      }
      NativeQuery q;
      if (node.update() != null) {
        q = node.scan()
            ? new ScanRequest(ds, ScanRequest.Action.UPDATE, object, null, node.update().filter(), null, null, null,
                null, null, node.update().values())
            : dialect(adapter).update(catalog, node.update());
      } else {
        q = node.scan()
            ? new ScanRequest(ds, ScanRequest.Action.DELETE, object, null, node.delete().filter(), null, null, null,
                null, null, null)
            : dialect(adapter).delete(catalog, node.delete());
      }
      SourceResult r = adapter.execute(q, token);
      log.debug("federa.exec mutation node={} affected={}", node, r.affectedRows());
      Map<String, Object> result = new LinkedHashMap<>();
      result.put("success", true);
      result.put("affected_rows", r.affectedRows());
      result.put("message", null);
      return result;
    }

    private SourceAdapter adapter(String ds) {
      SourceAdapter a = adapters.get(ds);
      if (a == null) throw new SourceExecutionException(Code.SOURCE_UNAVAILABLE, ds, "Data source '" + ds + "' is not loaded");
      return a;
    }

    private Dialect dialect(SourceAdapter adapter) {
      Dialect d = adapter.dialect();
      if (d == null) {
        throw new SourceExecutionException(Code.EXECUTION_FAILED, adapter.name(), "Data source does not render SQL");
      }
      return d;
    }
  }

  // ---------- semi-joins

  private static List<List<Object>> keyTuples(List<Map<String, Object>> rows, List<String> labels) {
    Set<List<Object>> seen = new HashSet<>();
    List<List<Object>> out = new ArrayList<>();
    for (Map<String, Object> r : rows) {
      List<Object> norm = LocalJoiner.key(r, labels);
      if (norm == null || !seen.add(norm)) continue;
      List<Object> raw = new ArrayList<>(labels.size());
      for (String l : labels) raw.add(r.get(l));
      out.add(raw);
    }
    return out;
  }

  /** Parent filter with the semi-join condition in place. No keys render as an always-false {@code IN ()}. */
  static QueryElement restrict(QueryElement filter, SemiJoin sj, List<List<Object>> tuples) {
    QueryElement keys;
    List<String> fields = sj.parentFields();
    if (fields.size() == 1 || tuples.isEmpty()) {
      List<Object> values = new ArrayList<>(tuples.size());
      for (List<Object> t : tuples) values.add(t.get(0));
      keys = QueryFilters.in(fields.get(0), values);
    } else {
      List<QueryElement> any = new ArrayList<>(tuples.size());
      for (List<Object> t : tuples) {
        List<QueryElement> all = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) all.add(QueryFilters.eq(fields.get(i), t.get(i)));
        any.add(new LogicalGroup(Clause.AND, all));
      }
      keys = new LogicalGroup(Clause.OR, any);
    }
    if (sj.negate()) keys = QueryFilters.not(keys);
    if (sj.condition() == null) return QueryFilters.andNullable(filter, keys);
    return replace(filter, sj.condition(), keys);
  }

  private static QueryElement replace(QueryElement e, QueryElement target, QueryElement with) {
    if (e == target) return with;
    if (e instanceof LogicalGroup g) {
      List<QueryElement> out = new ArrayList<>(g.elements().size());
      for (QueryElement c : g.elements()) out.add(replace(c, target, with));
      return new LogicalGroup(g.clause(), out);
    }
    if (e instanceof NotElement n) return new NotElement(replace(n.element(), target, with));
    return e;
  }

  private static Map<String, Object> relabel(SelectSpec spec, Map<String, Object> row) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Projection p : spec.projections()) {
      Projection.Column c = (Projection.Column) p;
      out.put(c.output(), row.get(c.field()));
    }
    return out;
  }

  // ---------- output

  static Map<String, Object> format(List<Shape> shapes, Map<String, ?> row) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Shape s : shapes) out.put(s.key(), shape(s, row));
    return out;
  }

  private static Object shape(Shape s, Map<String, ?> row) {
    if (s instanceof Shape.Value v) return value(v.scalar(), row.get(v.label()));
    if (s instanceof Shape.Typename t) return t.typeName();
    if (s instanceof Shape.Group g) return format(g.fields(), row);
    if (s instanceof Shape.Nested n) return nested(n.fields(), n.list(), json(row.get(n.label())));
    if (s instanceof Shape.Joined j) return nested(j.fields(), j.list(), row.get(j.label()));
    return null;
  }

  @SuppressWarnings("unchecked")
  private static Object nested(List<Shape> fields, boolean list, Object v) {
    if (v == null) return null;
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> one = format(fields, (Map<String, ?>) m);
      return list ? new ArrayList<>(List.of(one)) : one;
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object item : l) out.add(item instanceof Map<?, ?> m ? format(fields, (Map<String, ?>) m) : null);
      if (list) return out;
      return out.isEmpty() ? null : out.get(0);
    }
    throw new IllegalStateException("Unexpected nested value of type " + v.getClass().getSimpleName());
  }

  /** Nested selections come back from SQL sources as JSON text. */
  private static Object json(Object v) {
    if (!(v instanceof String s)) return v;
    try {
      return JSON.readValue(s, Object.class);
    } catch (JsonProcessingException e) {
      throw new SourceExecutionException(Code.EXECUTION_FAILED, null, "Malformed nested JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static Object value(ScalarType scalar, Object v) {
    if (scalar == null || v == null) return v;
    if (v instanceof List<?> l && scalar != ScalarType.VECTOR && scalar != ScalarType.JSON) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object item : l) out.add(FederaScalars.serialize(scalar, item));
      return out;
    }
    return FederaScalars.serialize(scalar, v);
  }

  // ---------- errors

  static GraphQLErrorEntry error(List<Object> path, Throwable failure) {
    Throwable e = unwrap(failure);
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    if (e instanceof SourceExecutionException s) {
      log.warn("federa.exec branch_failed path={} dataSource={} code={} err={}", path, s.dataSource(), s.code(), message);
      return GraphQLErrorEntry.of(message, path, s.code().name());
    }
    if (e instanceof QueryValidationException) return GraphQLErrorEntry.of(message, path, GraphQLErrorEntry.VALIDATION_FAILED);
    if (e instanceof PlanningException) return GraphQLErrorEntry.of(message, path, GraphQLErrorEntry.PLANNING_FAILED);
    if (e instanceof AccessDeniedException) return GraphQLErrorEntry.of(message, path, GraphQLErrorEntry.ACCESS_DENIED);
    if (e instanceof CancellationException) return GraphQLErrorEntry.of(message, path, Code.CANCELLED.name());
    log.error("federa.exec unexpected_failure path={}", path, e);
    return GraphQLErrorEntry.of(message, path, Code.EXECUTION_FAILED.name());
  }

  static Throwable unwrap(Throwable e) {
    Throwable t = e;
    while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
