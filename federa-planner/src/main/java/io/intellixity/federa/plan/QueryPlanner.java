package io.intellixity.federa.plan;

import io.intellixity.federa.catalog.*;
import io.intellixity.federa.governance.AuthContext;
import io.intellixity.federa.governance.RolePermissions;
import io.intellixity.federa.plan.request.RequestTree;
import io.intellixity.federa.plan.request.SelectedField;
import io.intellixity.federa.query.*;
import io.intellixity.federa.schema.CompiledSchema;
import io.intellixity.federa.schema.FieldBinding;
import io.intellixity.federa.schema.TypeNames;
import io.intellixity.federa.spi.sql.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;

/**
 * Turns a validated request into a {@link QueryPlan}.
 * <p>
 * A relation whose two ends live on the same SQL source that supports join pushdown is rendered in
 * the parent statement as a nested projection. Everything else (cross-source relations, scan-only
 * sources, {@code @no_pushdown}, dynamic and spatial joins) becomes an independently filtered child
 * read merged locally by a {@link LocalJoin}. Filters over such relations become {@link SemiJoin}s.
 * <p>
 * Row values carry the response key as label; hidden join keys use {@value #KEY_PREFIX}, raw inputs
 * of local aggregations {@value #FIELD_PREFIX}.
 */
public final class QueryPlanner {
  private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

  public static final String KEY_PREFIX = "__k_";
  public static final String JOIN_PREFIX = "__j";
  public static final String FIELD_PREFIX = "f.";
  public static final String OBJECT_TAG_PREFIX = "object:";

  private final CompiledSchema schema;
  private final Catalog catalog;
  private final int defaultLimit;
  private final Predicate<String> sqlSource;

  /**
   * @param defaultLimit limit of to-many relation and dynamic join rows per parent when none is given
   * @param sqlSource    whether a data source renders SQL through a dialect; others only take scans
   */
  public QueryPlanner(CompiledSchema schema, int defaultLimit, Predicate<String> sqlSource) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.catalog = schema.catalog();
    this.defaultLimit = defaultLimit;
    this.sqlSource = Objects.requireNonNull(sqlSource, "sqlSource");
  }

  public QueryPlan plan(RequestTree request, RolePermissions permissions, AuthContext auth) {
    Planning p = new Planning(request, permissions, auth);
    List<FieldPlan> fields = new ArrayList<>();
    for (SelectedField f : request.fields()) fields.add(p.topLevel(f));
    QueryPlan plan = new QueryPlan(request.operation(), fields);
    if (log.isDebugEnabled()) {
      for (FieldPlan.Rows r : plan.reads()) {
        log.debug("federa.plan field={} node={} state={} joins={} semiJoins={}", r.path(), r.node(),
            r.node().state(), r.node().joins().size(), r.node().semiJoins().size());
      }
    }
    return plan;
  }

  /** Tag every cached read of {@code o} carries and every mutation of it purges. */
  public static String objectTag(DataObject o) {
    return OBJECT_TAG_PREFIX + o.qualifiedName();
  }

  /** Rows of one read being planned. */
  private final class Rows {
    final DataObject object;
    final String dataSource;
    final boolean scan;
    final List<Object> path;
    final List<Projection> projections = new ArrayList<>();
    final Set<String> labels = new HashSet<>();
    final List<LocalJoin> joins = new ArrayList<>();
    final List<SemiJoin> semiJoins = new ArrayList<>();
    final List<FunctionCallStep> functionCalls = new ArrayList<>();
    final List<QueryElement> conditions = new ArrayList<>();
    // rendered inside a parent statement: no local steps
    boolean nested;
    boolean noPushdown;
    boolean localRelations;
    boolean withDeleted;

    Rows(DataObject object, String dataSource, List<Object> path) {
      this.object = object;
      this.dataSource = dataSource;
      this.scan = !sqlSource.test(dataSource);
      this.path = path;
      if (scan && object.cube()) {
        throw new PlanningException("Cube " + object.qualifiedName() + " needs a SQL source", path);
      }
    }

    Rows child(DataObject o, String ds, List<Object> at) {
      Rows c = new Rows(o, ds, at);
      c.noPushdown = noPushdown;
      c.withDeleted = withDeleted;
      return c;
    }

    void add(Projection p) {
      if (labels.add(p.output())) projections.add(p);
    }

    String key(String field) {
      if (!object.hasField(field)) {
        throw new PlanningException("Unknown field '" + field + "' of " + object.qualifiedName(), path);
      }
      String label = KEY_PREFIX + field;
      add(Projection.Column.as(label, field));
      return label;
    }

    List<String> keys(List<String> fields) {
      List<String> out = new ArrayList<>(fields.size());
      for (String f : fields) out.add(key(f));
      return out;
    }

    String input(String field) {
      String label = FIELD_PREFIX + field;
      add(Projection.Column.as(label, field));
      return label;
    }

    void ensureProjection() {
      if (!projections.isEmpty()) return;
      if (!object.primaryKey().isEmpty()) {
        key(object.primaryKey().get(0));
        return;
      }
      for (Field f : object.fields()) {
        if (!f.isFunctionCall()) {
          key(f.name());
          return;
        }
      }
      throw new PlanningException(object.qualifiedName() + " has no readable field", path);
    }
  }

  /** Aggregate items and their shapes, keyed by output label. */
  private record Aggregations(List<AggregateItem> items, List<Shape> shapes) {}

  private final class Planning {
    private final RequestTree request;
    private final RolePermissions perms;
    private final AuthContext auth;
    private final FilterParser parser = new FilterParser(catalog);
    private Set<DataObject> touched = new LinkedHashSet<>();
    private int joinSeq;

    Planning(RequestTree request, RolePermissions perms, AuthContext auth) {
      this.request = request;
      this.perms = perms;
      this.auth = auth;
      checkDirectives(request.directives().keySet(), request.operation() == RequestTree.Operation.MUTATION,
          List.of());
    }

    // ---------- top level

    FieldPlan topLevel(SelectedField f) {
      if (f.isTypename()) return new FieldPlan.Typename(f.responseKey(), f.path(), f.parentType());
      if (f.isIntrospection()) return new FieldPlan.Introspection(f.responseKey(), f.path());
      checkDirectives(f.directives().keySet(), request.operation() == RequestTree.Operation.MUTATION, f.path());
      if (!visible(f)) return new FieldPlan.Redacted(f.responseKey(), f.path());
      touched = new LinkedHashSet<>();
      FieldBinding b = binding(f);
      if (b instanceof FieldBinding.ModuleField || b instanceof FieldBinding.FunctionHub) {
        List<FieldPlan> children = new ArrayList<>();
        for (SelectedField c : f.selections()) children.add(topLevel(c));
        return new FieldPlan.Group(f.responseKey(), f.path(), children);
      }
      if (b instanceof FieldBinding.FunctionQuery q) return functionQuery(f, q);
      if (b instanceof FieldBinding.SelectList s) return select(f, catalog.object(s.objectId()), null);
      if (b instanceof FieldBinding.SelectOne s) return select(f, catalog.object(s.objectId()), s.keyFields());
      if (b instanceof FieldBinding.Aggregate a) return aggregate(f, catalog.object(a.objectId()));
      if (b instanceof FieldBinding.BucketAggregate a) return bucketAggregate(f, catalog.object(a.objectId()));
      if (b instanceof FieldBinding.Insert m) return insert(f, catalog.object(m.objectId()));
      if (b instanceof FieldBinding.Update m) return update(f, catalog.object(m.objectId()));
      if (b instanceof FieldBinding.Delete m) return delete(f, catalog.object(m.objectId()));
      throw new PlanningException("Field '" + f.name() + "' cannot be planned at the top level", f.path());
    }

    private FieldPlan select(SelectedField f, DataObject o, List<String> keyFields) {
      Rows rows = root(o, f);
      List<Shape> shapes = selection(rows, f);
      QueryElement base;
      if (keyFields == null) {
        base = parse(o, f);
      } else {
        List<QueryElement> eqs = new ArrayList<>();
        for (String k : keyFields) eqs.add(QueryFilters.eq(k, Values.coerce(o.field(k).type(), f.argument(k))));
        base = eqs.size() == 1 ? eqs.get(0) : new LogicalGroup(Clause.AND, eqs);
      }
      QueryElement filter = where(rows, base);
      ReadNode node = keyFields == null
          ? read(rows, filter, orderBy(f), f.intArgument("limit"), f.intArgument("offset"), distinctOn(f),
              f.mapArgument("args"), null, null)
          : read(rows, filter, List.of(), 1, null, List.of(), f.mapArgument("args"), null, null);
      return new FieldPlan.Rows(f.responseKey(), f.path(), node, shapes, keyFields == null, cache(f));
    }

    private FieldPlan aggregate(SelectedField f, DataObject o) {
      Rows rows = root(o, f);
      boolean push = !rows.scan && !rows.noPushdown && catalog.supportsAggregationPushdown(o.id());
      Aggregations aggs = aggregations(o, f, "", push ? null : rows);
      QueryElement filter = where(rows, parse(o, f));
      ReadNode node;
      if (push) {
        AggregateSpec.Builder spec = AggregateSpec.builder(o.id()).args(f.mapArgument("args")).filter(filter)
            .orderBy(orderBy(f)).limit(f.intArgument("limit")).offset(f.intArgument("offset"))
            .distinctOn(distinctOn(f)).withDeleted(rows.withDeleted);
        for (AggregateItem i : aggs.items()) spec.item(i);
        node = new ReadNode(rows.dataSource, rows.path, o.id(), null, spec.build(), rows.semiJoins, null, List.of(),
            List.of(), false);
      } else {
        node = read(rows, filter, orderBy(f), f.intArgument("limit"), f.intArgument("offset"), distinctOn(f),
            f.mapArgument("args"), null, LocalAggregation.of(aggs.items()));
      }
      return new FieldPlan.Rows(f.responseKey(), f.path(), node, aggs.shapes(), false, cache(f));
    }

    private FieldPlan bucketAggregate(SelectedField f, DataObject o) {
      Rows rows = root(o, f);
      boolean push = !rows.scan && !rows.noPushdown && catalog.supportsAggregationPushdown(o.id());
      rows.localRelations = !push;
      List<Projection> keys = new ArrayList<>();
      List<AggregateItem> items = new ArrayList<>();
      List<Shape> shapes = new ArrayList<>();
      for (SelectedField c : f.selections()) {
        if (c.isTypename()) {
          shapes.add(new Shape.Typename(c.responseKey(), TypeNames.bucket(o.typeName())));
          continue;
        }
        if (!visible(c)) {
          shapes.add(new Shape.Redacted(c.responseKey()));
          continue;
        }
        FieldBinding b = binding(c);
        if (b instanceof FieldBinding.BucketKey) {
          shapes.add(new Shape.Group(c.responseKey(), bucketKeys(rows, c, keys, push)));
        } else if (b instanceof FieldBinding.BucketAggregations) {
          Aggregations aggs = aggregations(o, c, c.responseKey() + ".", push ? null : rows);
          items.addAll(aggs.items());
          shapes.add(new Shape.Group(c.responseKey(), aggs.shapes()));
        } else {
          throw unsupported(c);
        }
      }
      QueryElement filter = where(rows, parse(o, f));
      ReadNode node;
      if (push) {
        AggregateSpec.Builder spec = AggregateSpec.builder(o.id()).args(f.mapArgument("args")).filter(filter)
            .orderBy(orderBy(f)).limit(f.intArgument("limit")).offset(f.intArgument("offset"))
            .withDeleted(rows.withDeleted);
        for (Projection k : keys) spec.key(k);
        // parent keys of relation keys merged locally
        for (Projection p : rows.projections) {
          if (p.output().startsWith(KEY_PREFIX)) spec.key(p);
        }
        for (AggregateItem i : items) spec.item(i);
        node = new ReadNode(rows.dataSource, rows.path, o.id(), null, spec.build(), rows.semiJoins, null,
            List.of(), rows.joins, false);
      } else {
        List<LocalAggregation.GroupKey> groups = new ArrayList<>();
        for (Projection p : keys) groups.add(new LocalAggregation.GroupKey(p.output(), p.output()));
        for (Projection p : rows.projections) {
          if (p.output().startsWith(KEY_PREFIX)) groups.add(new LocalAggregation.GroupKey(p.output(), p.output()));
        }
        LocalAggregation local = new LocalAggregation(groups, items, orderBy(f), f.intArgument("limit"),
            f.intArgument("offset"));
        node = read(rows, filter, List.of(), null, null, List.of(), f.mapArgument("args"), null, local);
      }
      return new FieldPlan.Rows(f.responseKey(), f.path(), node, shapes, true, cache(f));
    }

    /** Bucket key fields, labelled {@code <key>.<field>}; pushed keys go to {@code keys}, local ones to the rows. */
    private List<Shape> bucketKeys(Rows rows, SelectedField key, List<Projection> keys, boolean push) {
      DataObject o = rows.object;
      List<Shape> shapes = new ArrayList<>();
      for (SelectedField c : key.selections()) {
        String label = key.responseKey() + "." + c.responseKey();
        if (c.isTypename()) {
          shapes.add(new Shape.Typename(c.responseKey(), o.typeName()));
          continue;
        }
        if (!visible(c)) {
          shapes.add(new Shape.Redacted(c.responseKey()));
          continue;
        }
        FieldBinding b = binding(c);
        Projection p;
        ScalarType scalar;
        if (b instanceof FieldBinding.Column col) {
          String bucket = (String) c.argument("bucket");
          String mf = (String) c.argument("measurement_func");
          if (bucket != null) requireSql(rows, c, "time buckets");
          p = new Projection.Column(label, col.field(), bucket, mf);
          scalar = o.field(col.field()).scalar();
        } else if (b instanceof FieldBinding.TimePart t) {
          requireSql(rows, c, "time part extraction");
          p = new Projection.TimePart(label, t.field(), (String) c.argument("extract"), c.intArgument("extract_divide"));
          scalar = ScalarType.BIGINT;
        } else if (b instanceof FieldBinding.Measurement m) {
          requireSql(rows, c, "spatial measurements");
          p = new Projection.Measurement(label, m.field(), (String) c.argument("type"));
          scalar = ScalarType.FLOAT;
        } else if (b instanceof FieldBinding.RelationField r) {
          Relation rel = catalog.relation(r.relationId());
          if (rel.cardinality().isToMany()) {
            throw new PlanningException("Bucket keys can only follow to-one relations; '" + rel.name() + "' is to-many",
                c.path());
          }
          if (push && pushable(rows, rel, c)) {
            Rows child = nestedRows(rows, rel, c);
            List<Shape> inner = selection(child, c);
            keys.add(new Projection.Nested(label, rel.id(), nestedSelect(child, c, false), false));
            shapes.add(new Shape.Nested(c.responseKey(), label, inner, false));
          } else {
            shapes.add(localRelation(rows, c, rel, label));
          }
          continue;
        } else {
          throw unsupported(c);
        }
        if (!push) rows.add(p);
        keys.add(p);
        shapes.add(new Shape.Value(c.responseKey(), label, scalar));
      }
      return shapes;
    }

    private FieldPlan functionQuery(SelectedField f, FieldBinding.FunctionQuery q) {
      FunctionDef fn = catalog.function(q.modulePath(), q.function());
      if (fn == null) throw new PlanningException("Unknown function '" + q.function() + "'", f.path());
      Map<String, Object> args = new LinkedHashMap<>(f.arguments());
      if (!fn.returnsTable()) {
        if (!sqlSource.test(fn.dataSource())) {
          throw new PlanningException("Function '" + fn.name() + "' needs a SQL source", f.path());
        }
        FunctionNode node = new FunctionNode(fn.dataSource(), f.path(), fn.module(), fn.name(), args);
        return new FieldPlan.Scalar(f.responseKey(), f.path(), node, fn.returnScalar().scalar(), cache(f));
      }
      DataObject o = catalog.object(fn.returnObject());
      Rows rows = new Rows(o, fn.dataSource(), f.path());
      if (rows.scan) throw new PlanningException("Function '" + fn.name() + "' needs a SQL source", f.path());
      rows.noPushdown = request.hasDirective("no_pushdown") || f.hasDirective("no_pushdown");
      rows.withDeleted = request.hasDirective("with_deleted") || f.hasDirective("with_deleted");
      touched.add(o);
      List<Shape> shapes = selection(rows, f);
      QueryElement filter = where(rows, null);
      ReadNode node = read(rows, filter, List.of(), null, null, List.of(), null,
          new FunctionSource(fn.module(), fn.name(), args, null), null);
      return new FieldPlan.Rows(f.responseKey(), f.path(), node, shapes, fn.returnsList(), cache(f));
    }

    // ---------- mutations

    private FieldPlan insert(SelectedField f, DataObject o) {
      writable(o, f);
      Map<String, Object> data = data(o, f);
      for (Field fld : o.fields()) {
        if (fld.isFunctionCall() || fld.calculated() || !fld.type().nonNull()) continue;
        if (fld.defaultSpec() != null && fld.defaultSpec().coversInsert()) continue;
        if (data.get(fld.name()) == null) {
          throw new PlanningException("Field '" + fld.name() + "' of " + o.qualifiedName() + " is required", f.path());
        }
      }
      List<String> returning = new ArrayList<>();
      List<Shape> shapes = new ArrayList<>();
      for (SelectedField c : f.selections()) {
        if (c.isTypename()) {
          shapes.add(new Shape.Typename(c.responseKey(), o.typeName()));
          continue;
        }
        if (!visible(c)) {
          shapes.add(new Shape.Redacted(c.responseKey()));
          continue;
        }
        if (!(binding(c) instanceof FieldBinding.Column col)) {
          throw new PlanningException("Insert returns columns of " + o.qualifiedName() + " only; '" + c.name()
              + "' is not one", c.path());
        }
        if (!returning.contains(col.field())) returning.add(col.field());
        shapes.add(new Shape.Value(c.responseKey(), col.field(), o.field(col.field()).scalar()));
      }
      MutationNode node = new MutationNode(o.dataSource(), f.path(), o.id(), new InsertSpec(o.id(), data, returning),
          null, null, mutationTags(o), !sqlSource.test(o.dataSource()));
      return new FieldPlan.Mutation(f.responseKey(), f.path(), node, shapes);
    }

    private FieldPlan update(SelectedField f, DataObject o) {
      writable(o, f);
      UpdateSpec spec = new UpdateSpec(o.id(), data(o, f), mutationFilter(o, f), f.hasDirective("with_deleted"));
      MutationNode node = new MutationNode(o.dataSource(), f.path(), o.id(), null, spec, null, mutationTags(o),
          !sqlSource.test(o.dataSource()));
      return new FieldPlan.Mutation(f.responseKey(), f.path(), node, operationResult(f));
    }

    private FieldPlan delete(SelectedField f, DataObject o) {
      writable(o, f);
      DeleteSpec spec = new DeleteSpec(o.id(), mutationFilter(o, f));
      MutationNode node = new MutationNode(o.dataSource(), f.path(), o.id(), null, null, spec, mutationTags(o),
          !sqlSource.test(o.dataSource()));
      return new FieldPlan.Mutation(f.responseKey(), f.path(), node, operationResult(f));
    }

    private void writable(DataObject o, SelectedField f) {
      if (catalog.isReadOnly(o.id())) {
        throw new PlanningException(o.qualifiedName() + " belongs to read-only source " + o.dataSource(), f.path());
      }
    }

    private Map<String, Object> data(DataObject o, SelectedField f) {
      Map<String, Object> raw = f.mapArgument("data");
      Map<String, Object> out = new LinkedHashMap<>();
      if (raw != null) {
        for (Map.Entry<String, Object> e : raw.entrySet()) {
          Field fld = o.field(e.getKey());
          if (fld == null || fld.calculated() || fld.isFunctionCall()) {
            throw new PlanningException("Field '" + e.getKey() + "' of " + o.qualifiedName() + " is not writable",
                f.childPath("data"));
          }
          out.put(e.getKey(), Values.coerce(fld.type(), e.getValue()));
        }
      }
      out.putAll(perms.mutationData(o, auth));
      return out;
    }

    private QueryElement mutationFilter(DataObject o, SelectedField f) {
      QueryElement filter = QueryFilters.andNullable(parse(o, f), perms.rowFilter(catalog, o, auth));
      boolean scan = !sqlSource.test(o.dataSource());
      if (filter != null && !elementPushable(o, filter, o.dataSource(), scan)) {
        throw new PlanningException("Mutation filter of " + o.qualifiedName()
            + " references a relation that cannot be pushed down", f.childPath("filter"));
      }
      return filter;
    }

    private List<Shape> operationResult(SelectedField f) {
      List<Shape> shapes = new ArrayList<>();
      for (SelectedField c : f.selections()) {
        if (c.isTypename()) shapes.add(new Shape.Typename(c.responseKey(), TypeNames.OPERATION_RESULT));
        else shapes.add(new Shape.Value(c.responseKey(), c.name(), null));
      }
      return shapes;
    }

    private Set<String> mutationTags(DataObject o) {
      Set<String> tags = new LinkedHashSet<>();
      tags.add(objectTag(o));
      if (o.cacheSpec() != null) tags.addAll(o.cacheSpec().tags());
      tags.addAll(o.invalidateTags());
      return tags;
    }

    // ---------- object selections

    private Rows root(DataObject o, SelectedField f) {
      Rows rows = new Rows(o, o.dataSource(), f.path());
      rows.noPushdown = request.hasDirective("no_pushdown") || f.hasDirective("no_pushdown");
      rows.withDeleted = request.hasDirective("with_deleted") || f.hasDirective("with_deleted");
      touched.add(o);
      return rows;
    }

    private List<Shape> selection(Rows rows, SelectedField parent) {
      List<Shape> shapes = new ArrayList<>();
      DataObject o = rows.object;
      for (SelectedField c : parent.selections()) {
        String key = c.responseKey();
        if (c.isTypename()) {
          shapes.add(new Shape.Typename(key, o.typeName()));
          continue;
        }
        checkDirectives(c.directives().keySet(), false, c.path());
        if (!visible(c)) {
          shapes.add(new Shape.Redacted(key));
          continue;
        }
        FieldBinding b = binding(c);
        if (b instanceof FieldBinding.Column col) {
          String bucket = (String) c.argument("bucket");
          String mf = (String) c.argument("measurement_func");
          if (bucket != null) requireSql(rows, c, "time buckets");
          if (mf != null) requireSql(rows, c, "measurement aggregation");
          rows.add(new Projection.Column(key, col.field(), bucket, mf));
          shapes.add(new Shape.Value(key, key, o.field(col.field()).scalar()));
        } else if (b instanceof FieldBinding.TimePart t) {
          requireSql(rows, c, "time part extraction");
          rows.add(new Projection.TimePart(key, t.field(), (String) c.argument("extract"),
              c.intArgument("extract_divide")));
          shapes.add(new Shape.Value(key, key, ScalarType.BIGINT));
        } else if (b instanceof FieldBinding.Measurement m) {
          requireSql(rows, c, "spatial measurements");
          rows.add(new Projection.Measurement(key, m.field(), (String) c.argument("type")));
          shapes.add(new Shape.Value(key, key, ScalarType.FLOAT));
        } else if (b instanceof FieldBinding.FunctionCallField fc) {
          shapes.add(functionCall(rows, c, o.field(fc.field())));
        } else if (b instanceof FieldBinding.RelationField r) {
          shapes.add(relation(rows, c, catalog.relation(r.relationId())));
        } else if (b instanceof FieldBinding.RelationAggregation r) {
          shapes.add(relationAggregation(rows, c, catalog.relation(r.relationId())));
        } else if (b instanceof FieldBinding.JoinHub) {
          shapes.add(hub(rows, c, false));
        } else if (b instanceof FieldBinding.SpatialHub) {
          shapes.add(hub(rows, c, true));
        } else {
          throw unsupported(c);
        }
      }
      return shapes;
    }

    private Shape relation(Rows rows, SelectedField c, Relation r) {
      boolean toMany = r.cardinality().isToMany();
      if (!toMany && c.hasDirective("unnest")) {
        throw new PlanningException("@unnest does not apply to to-one relation '" + r.name() + "'", c.path());
      }
      if (pushable(rows, r, c)) {
        Rows child = nestedRows(rows, r, c);
        List<Shape> shapes = selection(child, c);
        SelectSpec spec = nestedSelect(child, c, toMany);
        rows.add(new Projection.Nested(c.responseKey(), r.id(), spec, c.booleanArgument("inner")));
        return new Shape.Nested(c.responseKey(), c.responseKey(), shapes, toMany);
      }
      return localRelation(rows, c, r, c.responseKey());
    }

    /** Relation merged in process: an independent child read, joined on the relation keys. */
    private Shape localRelation(Rows rows, SelectedField c, Relation r, String label) {
      if (rows.nested) {
        throw new PlanningException("Relation '" + r.name() + "' cannot be merged inside a pushed-down selection",
            c.path());
      }
      if (!r.equiJoin()) {
        throw new PlanningException("Relation '" + r.name() + "' joins on a SQL condition and needs join pushdown",
            c.path());
      }
      if (!c.listArgument("distinct_on").isEmpty()) {
        throw new PlanningException("distinct_on of relation '" + r.name() + "' needs join pushdown", c.path());
      }
      boolean toMany = r.cardinality().isToMany();
      DataObject target = catalog.object(r.toObject());
      Rows child = childRows(rows, target, c);
      List<Shape> shapes = selection(child, c);
      List<String> childKeys = child.keys(r.targetFields());
      List<String> parentKeys = rows.keys(r.sourceFields());
      QueryElement filter = where(child, parse(target, c));
      ReadNode node = read(child, filter, orderBy(c), null, null, List.of(), null, null, null);
      boolean inner = c.booleanArgument("inner");
      JoinPredicate.Equi direct = new JoinPredicate.Equi(parentKeys, childKeys);
      ReadNode junction = null;
      JoinPredicate predicate = direct;
      if (r.hasJunction()) {
        DataObject j = catalog.object(r.junction());
        Rows jr = childRows(rows, j, c);
        List<String> js = jr.keys(r.junctionSourceFields());
        List<String> jt = jr.keys(r.junctionTargetFields());
        junction = read(jr, where(jr, null), List.of(), null, null, List.of(), null, null, null);
        predicate = new JoinPredicate.Junction(new JoinPredicate.Equi(parentKeys, js), new JoinPredicate.Equi(jt, childKeys));
      } else if (inner) {
        rows.semiJoins.add(new SemiJoin(null, node, r.sourceFields(), childKeys, false));
      }
      Integer limit = toMany ? limitOrDefault(c) : null;
      Integer offset = toMany ? c.intArgument("offset") : null;
      rows.joins.add(new LocalJoin(label, node, junction, predicate, toMany, inner, limit, offset, null, c.path()));
      return new Shape.Joined(c.responseKey(), label, shapes, toMany);
    }

    private Shape relationAggregation(Rows rows, SelectedField c, Relation r) {
      DataObject target = catalog.object(r.toObject());
      String key = c.responseKey();
      boolean inner = c.booleanArgument("inner");
      if (pushable(rows, r, c) && catalog.supportsAggregationPushdown(target.id())) {
        Rows child = nestedRows(rows, r, c);
        Aggregations aggs = aggregations(target, c, "", null);
        AggregateSpec.Builder spec = AggregateSpec.builder(target.id()).filter(where(child, parse(target, c)))
            .orderBy(orderBy(c)).limit(c.intArgument("limit")).offset(c.intArgument("offset"))
            .withDeleted(child.withDeleted);
        for (AggregateItem i : aggs.items()) spec.item(i);
        rows.add(new Projection.NestedAggregation(key, r.id(), spec.build()));
        if (inner) {
          QueryElement related = parse(target, c);
          rows.conditions.add(QueryFilters.anyOf(r.name(), related != null ? related : QueryFilters.and()));
        }
        return new Shape.Nested(key, key, aggs.shapes(), false);
      }
      if (rows.nested) {
        throw new PlanningException("Aggregation over '" + r.name() + "' cannot be merged inside a pushed-down selection",
            c.path());
      }
      if (!r.equiJoin()) {
        throw new PlanningException("Relation '" + r.name() + "' joins on a SQL condition and needs join pushdown",
            c.path());
      }
      Rows child = childRows(rows, target, c);
      Aggregations aggs = aggregations(target, c, "", child);
      List<String> childKeys = child.keys(r.targetFields());
      List<String> parentKeys = rows.keys(r.sourceFields());
      ReadNode node = read(child, where(child, parse(target, c)), orderBy(c), null, null, List.of(), null, null, null);
      ReadNode junction = null;
      JoinPredicate predicate = new JoinPredicate.Equi(parentKeys, childKeys);
      if (r.hasJunction()) {
        DataObject j = catalog.object(r.junction());
        Rows jr = childRows(rows, j, c);
        List<String> js = jr.keys(r.junctionSourceFields());
        List<String> jt = jr.keys(r.junctionTargetFields());
        junction = read(jr, where(jr, null), List.of(), null, null, List.of(), null, null, null);
        predicate = new JoinPredicate.Junction(new JoinPredicate.Equi(parentKeys, js), new JoinPredicate.Equi(jt, childKeys));
      } else if (inner) {
        rows.semiJoins.add(new SemiJoin(null, node, r.sourceFields(), childKeys, false));
      }
      rows.joins.add(new LocalJoin(key, node, junction, predicate, false, inner, c.intArgument("limit"),
          c.intArgument("offset"), LocalAggregation.of(aggs.items()), c.path()));
      return new Shape.Joined(key, key, aggs.shapes(), false);
    }

    /** {@code _join} and {@code _spatial}: every item is a local join against an arbitrary object. */
    private Shape hub(Rows rows, SelectedField c, boolean spatial) {
      if (rows.nested) {
        throw new PlanningException("'" + c.name() + "' cannot be used inside a pushed-down selection", c.path());
      }
      DataObject o = rows.object;
      List<String> parentLabels = new ArrayList<>();
      String parentGeometry = null;
      if (spatial) {
        String field = (String) c.argument("field");
        geometry(o, field, c.childPath("field"));
        parentGeometry = rows.key(field);
      } else {
        for (Object f : c.listArgument("fields")) {
          if (!o.hasField((String) f)) {
            throw new QueryValidationException("Unknown field '" + f + "' of " + o.qualifiedName(), c.childPath("fields"));
          }
          parentLabels.add(rows.key((String) f));
        }
      }
      List<Shape> shapes = new ArrayList<>();
      for (SelectedField item : c.selections()) {
        if (item.isTypename()) {
          shapes.add(new Shape.Typename(item.responseKey(), spatial ? TypeNames.SPATIAL_HUB : TypeNames.JOIN_HUB));
          continue;
        }
        checkDirectives(item.directives().keySet(), false, item.path());
        if (!visible(item)) {
          shapes.add(new Shape.Redacted(item.responseKey()));
          continue;
        }
        FieldBinding b = binding(item);
        int targetId;
        boolean aggregation;
        if (b instanceof FieldBinding.DynamicJoin d) {
          targetId = d.targetObjectId();
          aggregation = d.aggregation();
        } else if (b instanceof FieldBinding.SpatialJoin s) {
          targetId = s.targetObjectId();
          aggregation = s.aggregation();
        } else {
          throw unsupported(item);
        }
        DataObject target = catalog.object(targetId);
        Rows child = childRows(rows, target, item);
        JoinPredicate predicate;
        if (spatial) {
          String field = (String) item.argument("field");
          geometry(target, field, item.childPath("field"));
          predicate = new JoinPredicate.Spatial(parentGeometry, child.key(field),
              JoinPredicate.SpatialType.valueOf((String) c.argument("type")), c.intArgument("buffer"));
        } else {
          List<?> fields = item.listArgument("fields");
          if (fields.size() != parentLabels.size()) {
            throw new QueryValidationException("_join needs as many fields on " + target.typeName() + " as on "
                + o.typeName(), item.childPath("fields"));
          }
          List<String> childLabels = new ArrayList<>();
          for (Object f : fields) childLabels.add(child.key((String) f));
          predicate = new JoinPredicate.Equi(parentLabels, childLabels);
        }
        String label = JOIN_PREFIX + (++joinSeq);
        boolean inner = item.booleanArgument("inner");
        if (aggregation) {
          Aggregations aggs = aggregations(target, item, "", child);
          ReadNode node = read(child, where(child, parse(target, item)), List.of(), null, null, List.of(), null, null,
              null);
          rows.joins.add(new LocalJoin(label, node, null, predicate, false, inner, null, null,
              LocalAggregation.of(aggs.items()), item.path()));
          shapes.add(new Shape.Joined(item.responseKey(), label, aggs.shapes(), false));
        } else {
          List<Shape> itemShapes = selection(child, item);
          ReadNode node = read(child, where(child, parse(target, item)), orderBy(item), null, null, List.of(),
              item.mapArgument("args"), null, null);
          rows.joins.add(new LocalJoin(label, node, null, predicate, true, inner, limitOrDefault(item),
              item.intArgument("offset"), null, item.path()));
          shapes.add(new Shape.Joined(item.responseKey(), label, itemShapes, true));
        }
      }
      return new Shape.Group(c.responseKey(), shapes);
    }

    private Shape functionCall(Rows rows, SelectedField c, Field field) {
      FunctionCall call = field.functionCall();
      FunctionDef fn = catalog.function(call.module(), call.function());
      if (fn == null) throw new PlanningException("Unknown function '" + call.function() + "'", c.path());
      String key = c.responseKey();
      Map<String, Object> constArgs = new LinkedHashMap<>(c.arguments());
      boolean sameSource = !rows.scan && !rows.noPushdown && fn.dataSource().equals(rows.dataSource);
      if (fn.returnsTable()) {
        if (!sameSource) {
          throw new PlanningException("Table function '" + fn.name() + "' must run on the source of "
              + rows.object.qualifiedName(), c.path());
        }
        DataObject target = catalog.object(fn.returnObject());
        Rows child = new Rows(target, rows.dataSource, c.path());
        child.nested = true;
        child.withDeleted = rows.withDeleted;
        touched.add(target);
        List<Shape> shapes = selection(child, c);
        child.ensureProjection();
        SelectSpec spec = SelectSpec.builder(target.id())
            .function(new FunctionSource(fn.module(), fn.name(), constArgs, call.arguments()))
            .projections(child.projections).withDeleted(child.withDeleted).build();
        rows.add(new Projection.FunctionRows(key, field.name(), spec, fn.returnsList()));
        return new Shape.Nested(key, key, shapes, fn.returnsList());
      }
      ScalarType scalar = fn.returnScalar().scalar();
      if (sameSource) {
        rows.add(new Projection.FunctionValue(key, fn.module(), fn.name(), call.arguments(), constArgs));
        return new Shape.Value(key, key, scalar);
      }
      if (rows.nested) {
        throw new PlanningException("Function '" + fn.name() + "' of another source cannot be called inside a "
            + "pushed-down selection", c.path());
      }
      if (!sqlSource.test(fn.dataSource())) {
        throw new PlanningException("Function '" + fn.name() + "' needs a SQL source", c.path());
      }
      Map<String, String> fieldArgs = new LinkedHashMap<>();
      for (Map.Entry<String, String> a : call.arguments().entrySet()) fieldArgs.put(a.getKey(), rows.key(a.getValue()));
      rows.functionCalls.add(new FunctionCallStep(key, fn.dataSource(), fn.module(), fn.name(), fieldArgs, constArgs));
      return new Shape.Value(key, key, scalar);
    }

    // ---------- aggregations

    /**
     * Items of a {@code <T>_aggregations} selection labelled {@code prefix + key[.fn]}. With
     * {@code local} rows the items read raw inputs fetched into those rows.
     */
    private Aggregations aggregations(DataObject o, SelectedField f, String prefix, Rows local) {
      List<AggregateItem> items = new ArrayList<>();
      List<Shape> shapes = new ArrayList<>();
      for (SelectedField c : f.selections()) {
        String label = prefix + c.responseKey();
        if (c.isTypename()) {
          shapes.add(new Shape.Typename(c.responseKey(), TypeNames.aggregations(o.typeName())));
          continue;
        }
        if (!visible(c)) {
          shapes.add(new Shape.Redacted(c.responseKey()));
          continue;
        }
        FieldBinding b = binding(c);
        if (b instanceof FieldBinding.RowsCount) {
          items.add(AggregateItem.rowsCount(label));
          shapes.add(new Shape.Value(c.responseKey(), label, ScalarType.BIGINT));
          continue;
        }
        if (!(b instanceof FieldBinding.AggregatedField af)) throw unsupported(c);
        ScalarType scalar = o.field(af.field()).scalar();
        String input = local == null ? af.field() : local.input(af.field());
        List<Shape> fns = new ArrayList<>();
        for (SelectedField fc : c.selections()) {
          if (fc.isTypename()) {
            fns.add(new Shape.Typename(fc.responseKey(), fc.parentType()));
            continue;
          }
          if (!(binding(fc) instanceof FieldBinding.AggregateFunction fn)) throw unsupported(fc);
          String out = label + "." + fc.responseKey();
          String sep = "string_agg".equals(fn.function()) ? (String) fc.argument("sep") : null;
          items.add(new AggregateItem(out, input, fn.function(), fc.booleanArgument("distinct"), sep));
          fns.add(new Shape.Value(fc.responseKey(), out, aggregateScalar(fn.function(), scalar)));
        }
        shapes.add(new Shape.Group(c.responseKey(), fns));
      }
      return new Aggregations(items, shapes);
    }

    // ---------- pushdown decisions

    private boolean pushable(Rows rows, Relation r, SelectedField c) {
      if (rows.scan || rows.noPushdown || rows.localRelations) return false;
      return relationPushable(rows.object, r, c, rows.dataSource);
    }

    private boolean relationPushable(DataObject from, Relation r, SelectedField c, String ds) {
      if (c.hasDirective("no_pushdown") || c.hasDirective("unnest") || r.crossSource()) return false;
      DataObject target = catalog.object(r.toObject());
      if (!ds.equals(target.dataSource())) return false;
      if (r.hasJunction() && !ds.equals(catalog.object(r.junction()).dataSource())) return false;
      if (!catalog.supportsJoinPushdown(from.id())) return false;
      QueryElement filter = QueryFilters.andNullable(parse(target, c), perms.rowFilter(catalog, target, auth));
      if (filter != null && !elementPushable(target, filter, ds, false)) return false;
      return subtreePushable(target, c, ds);
    }

    private boolean subtreePushable(DataObject o, SelectedField f, String ds) {
      for (SelectedField c : f.selections()) {
        if (c.isTypename() || perms.isHidden(c.parentType(), c.name())) continue;
        FieldBinding b = binding(c);
        if (b instanceof FieldBinding.RelationField r) {
          if (!relationPushable(o, catalog.relation(r.relationId()), c, ds)) return false;
        } else if (b instanceof FieldBinding.RelationAggregation r) {
          Relation rel = catalog.relation(r.relationId());
          if (!relationPushable(o, rel, c, ds) || !catalog.supportsAggregationPushdown(rel.toObject())) return false;
        } else if (b instanceof FieldBinding.FunctionCallField fc) {
          FunctionCall call = o.field(fc.field()).functionCall();
          FunctionDef fn = catalog.function(call.module(), call.function());
          if (fn == null || !ds.equals(fn.dataSource())) return false;
        } else if (b instanceof FieldBinding.JoinHub || b instanceof FieldBinding.SpatialHub) {
          return false;
        }
      }
      return true;
    }

    /** Every relation condition of {@code e} can be rendered by the dialect of {@code ds}. */
    private boolean elementPushable(DataObject o, QueryElement e, String ds, boolean scan) {
      if (e instanceof LogicalGroup g) {
        for (QueryElement c : g.elements()) {
          if (!elementPushable(o, c, ds, scan)) return false;
        }
        return true;
      }
      if (e instanceof NotElement n) return elementPushable(o, n.element(), ds, scan);
      if (e instanceof RelationCondition rc) {
        if (scan) return false;
        Relation r = catalog.resolveRelation(o.id(), rc.relation());
        DataObject target = catalog.object(r.toObject());
        if (r.crossSource() || !ds.equals(target.dataSource())) return false;
        if (r.hasJunction() && !ds.equals(catalog.object(r.junction()).dataSource())) return false;
        return catalog.supportsJoinPushdown(o.id()) && elementPushable(target, rc.element(), ds, false);
      }
      return true;
    }

    // ---------- filters

    private QueryElement parse(DataObject o, SelectedField f) {
      Map<String, Object> filter = f.mapArgument("filter");
      return filter == null ? null : parser.parse(o.id(), filter, f.childPath("filter"));
    }

    /** ANDs the role's row filter and pending conditions into {@code base}; plans semi-joins. */
    private QueryElement where(Rows rows, QueryElement base) {
      QueryElement filter = QueryFilters.andNullable(base, perms.rowFilter(catalog, rows.object, auth));
      for (QueryElement c : rows.conditions) filter = QueryFilters.andNullable(filter, c);
      if (filter == null || rows.nested) return filter;
      semiJoins(rows, filter);
      return filter;
    }

    private void semiJoins(Rows rows, QueryElement e) {
      if (e instanceof LogicalGroup g) {
        for (QueryElement c : g.elements()) semiJoins(rows, c);
      } else if (e instanceof NotElement n) {
        semiJoins(rows, n.element());
      } else if (e instanceof RelationCondition rc) {
        DataObject o = rows.object;
        if (!rows.noPushdown && elementPushable(o, rc, rows.dataSource, rows.scan)) return;
        Relation r = catalog.resolveRelation(o.id(), rc.relation());
        if (!r.equiJoin() || r.hasJunction()) {
          throw new PlanningException("Filter on relation '" + r.name() + "' of " + o.qualifiedName()
              + " needs join pushdown", rows.path);
        }
        DataObject target = catalog.object(r.toObject());
        Rows keys = rows.child(target, target.dataSource(), rows.path);
        touched.add(target);
        List<String> keyLabels = keys.keys(r.targetFields());
        boolean all = rc.quantifier() == RelationCondition.Quantifier.ALL_OF;
        QueryElement keyFilter = where(keys, all ? QueryFilters.not(rc.element()) : rc.element());
        ReadNode node = read(keys, keyFilter, List.of(), null, null, List.of(), null, null, null);
        boolean negate = all || rc.quantifier() == RelationCondition.Quantifier.NONE_OF;
        rows.semiJoins.add(new SemiJoin(rc, node, r.sourceFields(), keyLabels, negate));
      }
    }

    // ---------- reads

    private Rows childRows(Rows parent, DataObject target, SelectedField c) {
      Rows child = parent.child(target, target.dataSource(), c.path());
      if (c.hasDirective("no_pushdown")) child.noPushdown = true;
      if (c.hasDirective("with_deleted")) child.withDeleted = true;
      touched.add(target);
      return child;
    }

    private Rows nestedRows(Rows parent, Relation r, SelectedField c) {
      Rows child = childRows(parent, catalog.object(r.toObject()), c);
      child.nested = true;
      return child;
    }

    private SelectSpec nestedSelect(Rows child, SelectedField c, boolean toMany) {
      child.ensureProjection();
      return SelectSpec.builder(child.object.id()).projections(child.projections)
          .filter(where(child, parse(child.object, c)))
          .orderBy(orderBy(c))
          .limit(toMany ? limitOrDefault(c) : null)
          .offset(toMany ? c.intArgument("offset") : null)
          .distinctOn(distinctOn(c))
          .withDeleted(child.withDeleted)
          .build();
    }

    private ReadNode read(Rows rows, QueryElement filter, List<SortField> orderBy, Integer limit, Integer offset,
                          List<String> distinctOn, Map<String, Object> args, FunctionSource function,
                          LocalAggregation aggregation) {
      rows.ensureProjection();
      if (rows.scan) {
        for (SortField s : orderBy) {
          if (s.field().contains(".")) {
            throw new PlanningException("Ordering by '" + s.field() + "' needs a SQL source", rows.path);
          }
        }
      }
      SelectSpec spec = SelectSpec.builder(rows.object.id()).function(function).args(args)
          .projections(rows.projections).filter(filter).orderBy(orderBy).limit(limit).offset(offset)
          .distinctOn(distinctOn).withDeleted(rows.withDeleted)
          .cube(rows.object.cube() && aggregation == null)
          .build();
      return new ReadNode(rows.dataSource, rows.path, rows.object.id(), spec, null, rows.semiJoins, aggregation,
          rows.functionCalls, rows.joins, rows.scan);
    }

    // ---------- caching

    private CachePolicy cache(SelectedField f) {
      if (request.operation() != RequestTree.Operation.QUERY) return null;
      Map<String, Object> fieldCache = f.directive("cache");
      Map<String, Object> opCache = request.directive("cache");
      boolean invalidate = f.hasDirective("invalidate_cache") || request.hasDirective("invalidate_cache");
      Set<String> tags = new LinkedHashSet<>();
      for (DataObject o : touched) {
        tags.add(objectTag(o));
        if (o.cacheSpec() != null) tags.addAll(o.cacheSpec().tags());
      }
      Map<String, Object> explicit = fieldCache != null ? fieldCache
          : f.hasDirective("no_cache") ? null : opCache;
      if (explicit != null) {
        for (Object t : listOf(explicit.get("tags"))) tags.add(String.valueOf(t));
      }
      // same-named objects of different modules hang off different parent types
      String text = f.parentType() + "." + f.canonical();
      if (invalidate) return new CachePolicy(null, null, tags, true, text);
      if (f.hasDirective("no_cache") || (fieldCache == null && request.hasDirective("no_cache"))) return null;
      CacheSpec objectSpec = rootCacheSpec();
      if (explicit != null) {
        Integer ttl = explicit.get("ttl") instanceof Number n ? n.intValue()
            : objectSpec != null ? objectSpec.ttlSeconds() : null;
        return new CachePolicy((String) explicit.get("key"), ttl, tags, false, text);
      }
      if (objectSpec == null) return null;
      return new CachePolicy(objectSpec.key(), objectSpec.ttlSeconds(), tags, false, text);
    }

    /** {@code @cache} of the field's root object unless it is marked {@code @no_cache}. */
    private CacheSpec rootCacheSpec() {
      if (touched.isEmpty()) return null;
      DataObject root = touched.iterator().next();
      return root.noCache() ? null : root.cacheSpec();
    }

    // ---------- helpers

    private void checkDirectives(Set<String> directives, boolean mutation, List<Object> path) {
      if (directives.contains("cache") && directives.contains("no_cache")) {
        throw new PlanningException("@cache and @no_cache cannot be combined", path);
      }
      if (directives.contains("no_cache") && directives.contains("invalidate_cache")) {
        throw new PlanningException("@no_cache and @invalidate_cache cannot be combined", path);
      }
      if (mutation && directives.contains("no_pushdown")) {
        throw new PlanningException("@no_pushdown does not apply to mutations", path);
      }
    }

    private boolean visible(SelectedField f) {
      perms.checkField(f.parentType(), f.name(), f.path());
      return !perms.isHidden(f.parentType(), f.name());
    }

    private FieldBinding binding(SelectedField f) {
      FieldBinding b = schema.binding(f.parentType(), f.name());
      if (b == null) throw new PlanningException("Field '" + f.name() + "' has no binding on " + f.parentType(), f.path());
      return b;
    }

    private void requireSql(Rows rows, SelectedField c, String what) {
      if (rows.scan) {
        throw new PlanningException("'" + c.name() + "' uses " + what + " and needs a SQL source", c.path());
      }
    }

    private void geometry(DataObject o, String field, List<Object> path) {
      Field f = o.field(field);
      if (f == null || f.scalar() != ScalarType.GEOMETRY) {
        throw new QueryValidationException("'" + field + "' is not a geometry field of " + o.qualifiedName(), path);
      }
    }

    private int limitOrDefault(SelectedField f) {
      Integer limit = f.intArgument("limit");
      return limit != null ? limit : defaultLimit;
    }

    private PlanningException unsupported(SelectedField c) {
      return new PlanningException("Field '" + c.name() + "' is not supported here", c.path());
    }
  }

  // ---------- request values

  private static List<SortField> orderBy(SelectedField f) {
    List<SortField> out = new ArrayList<>();
    for (Object entry : f.listArgument("order_by")) {
      if (!(entry instanceof Map<?, ?> m)) continue;
      Object dir = m.get("direction");
      out.add(new SortField((String) m.get("field"),
          dir == null ? SortField.Direction.ASC : SortField.Direction.valueOf(String.valueOf(dir))));
    }
    return out;
  }

  private static List<String> distinctOn(SelectedField f) {
    List<String> out = new ArrayList<>();
    for (Object v : f.listArgument("distinct_on")) out.add(String.valueOf(v));
    return out;
  }

  private static List<?> listOf(Object v) {
    if (v == null) return List.of();
    return v instanceof List<?> l ? l : List.of(v);
  }

  static ScalarType aggregateScalar(String function, ScalarType field) {
    return switch (function) {
      case "count" -> ScalarType.BIGINT;
      case "sum" -> field == ScalarType.FLOAT ? ScalarType.FLOAT : ScalarType.BIGINT;
      case "avg", "stddev", "variance" -> ScalarType.FLOAT;
      case "string_agg" -> ScalarType.STRING;
      case "bool_and", "bool_or" -> ScalarType.BOOLEAN;
      default -> field;
    };
  }
}
