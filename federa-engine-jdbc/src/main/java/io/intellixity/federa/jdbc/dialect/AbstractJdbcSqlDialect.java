package io.intellixity.federa.jdbc.dialect;

import io.intellixity.federa.catalog.*;
import io.intellixity.federa.jdbc.SqlParamCompiler;
import io.intellixity.federa.query.*;
import io.intellixity.federa.spi.source.Bind;
import io.intellixity.federa.spi.source.SqlStatement;
import io.intellixity.federa.spi.source.SqlStatement.ExecKind;
import io.intellixity.federa.spi.sql.*;

import java.util.*;
import java.util.function.Function;

/**
 * JDBC-generic SQL dialect base.
 * <p>
 * Provides common rendering for:
 * <ul>
 *   <li>selects: projections, nested relations as correlated JSON sub-selects, filters, sort, paging,
 *   cube pre-aggregation</li>
 *   <li>aggregations and bucket aggregations</li>
 *   <li>DML: insert/update/delete, soft delete</li>
 * </ul>
 * DB-specific dialects override hooks for quoting, JSON construction, regex, arrays, spatial and time
 * functions.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  /** Label of the JSON row built by nested sub-selects. */
  protected static final String ROW_JSON = "_row";

  protected static final class RenderCtx {
    private final Catalog catalog;
    private int n = 1;
    private int aliases;
    private final Map<String, Bind> params = new LinkedHashMap<>();

    RenderCtx(Catalog catalog) {
      this.catalog = catalog;
    }

    public Catalog catalog() { return catalog; }

    public String add(Bind b) {
      String name = "b" + (n++);
      params.put(name, b);
      return ":" + name;
    }

    String alias() {
      return "t" + (aliases++);
    }
  }

  /**
   * How the fields of one data object are addressed in a FROM item. A grouped scope exposes fields
   * through the columns of a grouping sub-select.
   */
  protected static final class Scope {
    final DataObject object;
    final String alias;
    final Map<String, String> columns;
    final boolean withDeleted;

    private Scope(DataObject object, String alias, Map<String, String> columns, boolean withDeleted) {
      this.object = object;
      this.alias = alias;
      this.columns = columns;
      this.withDeleted = withDeleted;
    }

    static Scope direct(DataObject object, String alias, boolean withDeleted) {
      return new Scope(object, alias, null, withDeleted);
    }

    static Scope grouped(DataObject object, String alias, Map<String, String> columns) {
      return new Scope(object, alias, columns, true);
    }

    boolean grouped() { return columns != null; }
  }

  // ---------- reads

  @Override
  public final SqlStatement select(Catalog catalog, SelectSpec spec) {
    RenderCtx ctx = new RenderCtx(catalog);
    String sql = selectRows(ctx, spec, null, null, false, null);
    return statement(ctx, objectOf(ctx, spec.objectId()).dataSource(), sql, ExecKind.QUERY);
  }

  @Override
  public final SqlStatement aggregate(Catalog catalog, AggregateSpec spec) {
    RenderCtx ctx = new RenderCtx(catalog);
    String sql = aggregateSql(ctx, spec, null, false);
    return statement(ctx, objectOf(ctx, spec.objectId()).dataSource(), sql, ExecKind.QUERY);
  }

  @Override
  public final SqlStatement callFunction(Catalog catalog, String module, String function, Map<String, Object> args) {
    RenderCtx ctx = new RenderCtx(catalog);
    FunctionDef fd = functionOf(ctx, module, function);
    String body = functionSql(ctx, fd, args, Map.of(), null);
    if (isQuery(body)) body = "(" + body + ")";
    String sql = "SELECT " + body + " AS " + quoteIdent("value");
    return statement(ctx, fd.dataSource(), sql, ExecKind.QUERY);
  }

  /**
   * Rows of {@code spec}. With {@code json} each row is one JSON object labelled {@link #ROW_JSON};
   * {@code link} correlates the rows with the {@code parent} scope.
   */
  private String selectRows(RenderCtx ctx, SelectSpec spec, Scope parent, Function<Scope, String> link,
                            boolean json, Integer forcedLimit) {
    DataObject o = objectOf(ctx, spec.objectId());
    String a = ctx.alias();
    Scope base = Scope.direct(o, a, spec.withDeleted());

    String from = fromSource(ctx, o, spec.args(), spec.function(), parent) + " " + a;
    List<String> where = new ArrayList<>();
    if (link != null) where.add(link.apply(base));
    addLiveCondition(ctx, base, where);
    addFilter(ctx, base, spec.filter(), where);

    Scope scope = base;
    if (spec.cube()) {
      CubeLayout cube = cubeLayout(ctx, spec, base);
      String inner = "SELECT " + String.join(", ", cube.selectItems) + " FROM " + from + whereClause(where)
          + (cube.groupBy.isEmpty() ? "" : " GROUP BY " + String.join(", ", cube.groupBy));
      String g = ctx.alias();
      scope = Scope.grouped(o, g, cube.columns);
      from = "(" + inner + ") " + g;
      where = new ArrayList<>();
    }

    for (Projection p : spec.projections()) {
      if (p instanceof Projection.Nested n && n.inner()) {
        Relation r = ctx.catalog.relation(n.relationId());
        where.add(exists(ctx, scope, r, n.select().filter(), n.select().withDeleted(), false));
      }
    }

    List<String> keys = new ArrayList<>();
    List<String> values = new ArrayList<>();
    for (Projection p : spec.projections()) {
      keys.add(p.output());
      values.add(projectionValue(ctx, scope, p));
    }

    StringBuilder sql = new StringBuilder("SELECT ");
    List<String> distinct = new ArrayList<>();
    for (String f : spec.distinctOn()) distinct.add(fieldExpr(ctx, scope, f));
    if (!distinct.isEmpty()) sql.append("DISTINCT ON (").append(String.join(", ", distinct)).append(") ");

    if (json) {
      sql.append(jsonObject(keys, values)).append(" AS ").append(quoteIdent(ROW_JSON));
    } else {
      List<String> items = new ArrayList<>();
      for (int i = 0; i < keys.size(); i++) items.add(values.get(i) + " AS " + quoteIdent(keys.get(i)));
      sql.append(String.join(", ", items));
    }
    sql.append(" FROM ").append(from).append(whereClause(where));

    List<String> order = new ArrayList<>();
    for (String d : distinct) order.add(d + " ASC");
    for (SortField sf : spec.orderBy()) {
      String expr = orderExpr(ctx, scope, spec, sf.field());
      if (!distinct.isEmpty() && order.size() <= distinct.size() && distinct.contains(expr)) {
        order.set(distinct.indexOf(expr), expr + direction(sf));
        continue;
      }
      order.add(expr + direction(sf));
    }
    if (!order.isEmpty()) sql.append(" ORDER BY ").append(String.join(", ", order));

    Integer limit = forcedLimit != null ? forcedLimit : spec.limit();
    appendPage(sql, limit, spec.offset());
    return sql.toString();
  }

  private String aggregateSql(RenderCtx ctx, AggregateSpec spec, Function<Scope, String> link, boolean json) {
    DataObject o = objectOf(ctx, spec.objectId());
    String a = ctx.alias();
    Scope base = Scope.direct(o, a, spec.withDeleted());

    String from = fromSource(ctx, o, spec.args(), null, null) + " " + a;
    List<String> where = new ArrayList<>();
    if (link != null) where.add(link.apply(base));
    addLiveCondition(ctx, base, where);
    addFilter(ctx, base, spec.filter(), where);

    Scope scope = base;
    boolean subset = !spec.bucketed() && (spec.limit() != null || spec.offset() != null
        || !spec.distinctOn().isEmpty() || !spec.orderBy().isEmpty());
    if (subset) {
      StringBuilder rows = new StringBuilder("SELECT ");
      List<String> distinct = new ArrayList<>();
      for (String f : spec.distinctOn()) distinct.add(fieldExpr(ctx, base, f));
      if (!distinct.isEmpty()) rows.append("DISTINCT ON (").append(String.join(", ", distinct)).append(") ");
      rows.append(a).append(".* FROM ").append(from).append(whereClause(where));
      List<String> order = new ArrayList<>();
      for (String d : distinct) order.add(d + " ASC");
      for (SortField sf : spec.orderBy()) order.add(orderPath(ctx, base, sf.field()) + direction(sf));
      if (!order.isEmpty()) rows.append(" ORDER BY ").append(String.join(", ", order));
      appendPage(rows, spec.limit(), spec.offset());

      String b = ctx.alias();
      from = "(" + rows + ") " + b;
      scope = Scope.direct(o, b, true);
      where = new ArrayList<>();
    }

    boolean nestedKeys = false;
    for (Projection k : spec.keys()) nestedKeys |= k instanceof Projection.Nested;
    if (nestedKeys) return groupedThenNested(ctx, spec, scope, from, where, json);

    List<String> labels = new ArrayList<>();
    List<String> exprs = new ArrayList<>();
    List<String> groupBy = new ArrayList<>();
    for (Projection k : spec.keys()) {
      String e = projectionValue(ctx, scope, k);
      labels.add(k.output());
      exprs.add(e);
      groupBy.add(e);
    }
    for (AggregateItem item : spec.items()) {
      labels.add(item.output());
      exprs.add(aggregateExpr(ctx, scope, item));
    }
    if (labels.isEmpty()) {
      labels.add(AggregateItem.ROWS_COUNT);
      exprs.add("COUNT(*)");
    }

    StringBuilder sql = new StringBuilder("SELECT ");
    if (json) {
      sql.append(jsonObject(labels, exprs));
    } else {
      List<String> items = new ArrayList<>();
      for (int i = 0; i < labels.size(); i++) items.add(exprs.get(i) + " AS " + quoteIdent(labels.get(i)));
      sql.append(String.join(", ", items));
    }
    sql.append(" FROM ").append(from).append(whereClause(where));
    if (!groupBy.isEmpty()) sql.append(" GROUP BY ").append(String.join(", ", groupBy));
    if (spec.bucketed()) {
      appendLabelOrder(sql, spec.orderBy(), labels);
      appendPage(sql, spec.limit(), spec.offset());
    }
    return sql.toString();
  }

  /** Bucket aggregation whose keys include related objects: group first, then resolve the relations. */
  private String groupedThenNested(RenderCtx ctx, AggregateSpec spec, Scope scope, String from, List<String> where,
                                   boolean json) {
    List<String> inner = new ArrayList<>();
    List<String> groupBy = new ArrayList<>();
    Map<String, String> columns = new LinkedHashMap<>();
    for (Projection k : spec.keys()) {
      if (k instanceof Projection.Nested n) {
        for (String f : relationSourceFields(ctx.catalog.relation(n.relationId()))) {
          if (columns.containsKey(f)) continue;
          String col = "__g_" + f;
          String e = fieldExpr(ctx, scope, f);
          columns.put(f, col);
          inner.add(e + " AS " + quoteIdent(col));
          groupBy.add(e);
        }
        continue;
      }
      String e = projectionValue(ctx, scope, k);
      inner.add(e + " AS " + quoteIdent(k.output()));
      groupBy.add(e);
    }
    for (AggregateItem item : spec.items()) {
      inner.add(aggregateExpr(ctx, scope, item) + " AS " + quoteIdent(item.output()));
    }

    String g = ctx.alias();
    Scope grouped = Scope.grouped(scope.object, g, columns);
    List<String> labels = new ArrayList<>();
    List<String> exprs = new ArrayList<>();
    for (Projection k : spec.keys()) {
      labels.add(k.output());
      exprs.add(k instanceof Projection.Nested n ? nested(ctx, grouped, n) : g + "." + quoteIdent(k.output()));
    }
    for (AggregateItem item : spec.items()) {
      labels.add(item.output());
      exprs.add(g + "." + quoteIdent(item.output()));
    }

    StringBuilder sql = new StringBuilder("SELECT ");
    if (json) {
      sql.append(jsonObject(labels, exprs));
    } else {
      List<String> items = new ArrayList<>();
      for (int i = 0; i < labels.size(); i++) items.add(exprs.get(i) + " AS " + quoteIdent(labels.get(i)));
      sql.append(String.join(", ", items));
    }
    sql.append(" FROM (SELECT ").append(String.join(", ", inner)).append(" FROM ").append(from)
        .append(whereClause(where)).append(" GROUP BY ").append(String.join(", ", groupBy)).append(") ").append(g);
    appendLabelOrder(sql, spec.orderBy(), labels);
    appendPage(sql, spec.limit(), spec.offset());
    return sql.toString();
  }

  private void appendLabelOrder(StringBuilder sql, List<SortField> orderBy, List<String> labels) {
    if (orderBy.isEmpty()) return;
    List<String> order = new ArrayList<>();
    for (SortField sf : orderBy) {
      if (!labels.contains(sf.field())) {
        throw new QueryValidationException("order_by field '" + sf.field() + "' is not selected");
      }
      order.add(quoteIdent(sf.field()) + direction(sf));
    }
    sql.append(" ORDER BY ").append(String.join(", ", order));
  }

  // ---------- projections

  private String projectionValue(RenderCtx ctx, Scope s, Projection p) {
    if (p instanceof Projection.Column c) return columnValue(ctx, s, c);
    if (p instanceof Projection.TimePart t) {
      String part = "CAST(" + extract(t.extract(), fieldExpr(ctx, s, t.field())) + " AS BIGINT)";
      return (t.divide() == null || t.divide() == 0) ? part : "(" + part + " / " + t.divide() + ")";
    }
    if (p instanceof Projection.Measurement m) return measurement(m.type(), fieldExpr(ctx, s, m.field()));
    if (p instanceof Projection.FunctionValue fv) {
      FunctionDef fd = functionOf(ctx, fv.module(), fv.function());
      return "(" + functionSql(ctx, fd, fv.constArgs(), fv.fieldArgs(), s) + ")";
    }
    if (p instanceof Projection.Nested n) return nested(ctx, s, n);
    if (p instanceof Projection.NestedAggregation na) {
      Relation r = ctx.catalog.relation(na.relationId());
      if (na.aggregate().objectId() != r.toObject()) {
        throw new IllegalArgumentException("aggregation of relation " + r.name() + " reads the wrong object");
      }
      return "(" + aggregateSql(ctx, na.aggregate(), child -> correlate(ctx, r, s, child), true) + ")";
    }
    if (p instanceof Projection.FunctionRows fr) return functionRows(ctx, s, fr);
    throw new IllegalArgumentException("Unsupported projection: " + p);
  }

  private String columnValue(RenderCtx ctx, Scope s, Projection.Column c) {
    Field f = fieldOf(s, c.field());
    String expr;
    if (s.grouped() && s.columns.containsKey(cubeKey(f, c))) {
      expr = s.alias + "." + quoteIdent(s.columns.get(cubeKey(f, c)));
    } else {
      expr = fieldExpr(ctx, s, c.field());
      if (c.bucket() != null) expr = timeBucket(c.bucket(), expr, s.object.hypertable());
    }
    return f.scalar() == ScalarType.GEOMETRY ? geometryOut(expr) : expr;
  }

  private String nested(RenderCtx ctx, Scope parent, Projection.Nested n) {
    Relation r = ctx.catalog.relation(n.relationId());
    if (n.select().objectId() != r.toObject()) {
      throw new IllegalArgumentException("selection of relation " + r.name() + " reads the wrong object");
    }
    Function<Scope, String> link = child -> correlate(ctx, r, parent, child);
    if (r.cardinality().isToMany()) {
      String rows = selectRows(ctx, n.select(), parent, link, true, null);
      String a = ctx.alias();
      return "(SELECT " + jsonArrayAgg(a + "." + quoteIdent(ROW_JSON)) + " FROM (" + rows + ") " + a + ")";
    }
    return "(" + selectRows(ctx, n.select(), parent, link, true, 1) + ")";
  }

  private String functionRows(RenderCtx ctx, Scope parent, Projection.FunctionRows fr) {
    FunctionCall call = fieldOf(parent, fr.field()).functionCall();
    if (call == null) throw new IllegalArgumentException("Field '" + fr.field() + "' is not a function call");
    Function<Scope, String> link = null;
    if (call.tableJoin()) {
      link = child -> {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < call.sourceFields().size(); i++) {
          parts.add(fieldExpr(ctx, child, call.targetFields().get(i)) + " = "
              + fieldExpr(ctx, parent, call.sourceFields().get(i)));
        }
        return String.join(" AND ", parts);
      };
    }
    if (fr.list()) {
      String rows = selectRows(ctx, fr.select(), parent, link, true, null);
      String a = ctx.alias();
      return "(SELECT " + jsonArrayAgg(a + "." + quoteIdent(ROW_JSON)) + " FROM (" + rows + ") " + a + ")";
    }
    return "(" + selectRows(ctx, fr.select(), parent, link, true, 1) + ")";
  }

  // ---------- cube

  private static final class CubeLayout {
    final List<String> selectItems = new ArrayList<>();
    final List<String> groupBy = new ArrayList<>();
    final Map<String, String> columns = new LinkedHashMap<>();
  }

  private static String cubeKey(Field f, Projection.Column c) {
    if (f.measurement()) return "m:" + measureFunc(c.measurementFunc()) + ":" + f.name();
    if (c.bucket() != null) return "b:" + c.bucket() + ":" + f.name();
    return f.name();
  }

  private static String measureFunc(String func) {
    return func == null ? "SUM" : func.toUpperCase(Locale.ROOT);
  }

  /**
   * Columns of the grouping stage of a cube read: every non-measurement field the read touches is a
   * dimension (including key fields of nested relations), measurements are aggregated.
   */
  private CubeLayout cubeLayout(RenderCtx ctx, SelectSpec spec, Scope raw) {
    CubeLayout cube = new CubeLayout();
    for (Projection p : spec.projections()) {
      if (p instanceof Projection.Column c) {
        Field f = fieldOf(raw, c.field());
        if (f.measurement()) {
          addMeasure(ctx, cube, raw, f, measureFunc(c.measurementFunc()));
        } else if (c.bucket() != null) {
          String key = cubeKey(f, c);
          if (cube.columns.containsKey(key)) continue;
          String col = f.name() + "__" + c.bucket();
          String e = timeBucket(c.bucket(), fieldExpr(ctx, raw, f.name()), raw.object.hypertable());
          cube.columns.put(key, col);
          cube.selectItems.add(e + " AS " + quoteIdent(col));
          cube.groupBy.add(e);
        } else {
          addCubeField(ctx, cube, raw, f.name());
        }
      } else if (p instanceof Projection.TimePart t) {
        addCubeField(ctx, cube, raw, t.field());
      } else if (p instanceof Projection.Measurement m) {
        addCubeField(ctx, cube, raw, m.field());
      } else if (p instanceof Projection.FunctionValue fv) {
        for (String f : fv.fieldArgs().values()) addCubeField(ctx, cube, raw, f);
      } else if (p instanceof Projection.Nested n) {
        for (String f : relationSourceFields(ctx.catalog.relation(n.relationId()))) addCubeField(ctx, cube, raw, f);
      } else if (p instanceof Projection.NestedAggregation na) {
        for (String f : relationSourceFields(ctx.catalog.relation(na.relationId()))) addCubeField(ctx, cube, raw, f);
      } else if (p instanceof Projection.FunctionRows fr) {
        FunctionCall call = fieldOf(raw, fr.field()).functionCall();
        for (String f : fr.select().function().parentFieldArgs().values()) addCubeField(ctx, cube, raw, f);
        if (call != null) for (String f : call.sourceFields()) addCubeField(ctx, cube, raw, f);
      }
    }
    for (SortField sf : spec.orderBy()) {
      if (raw.object.hasField(sf.field())) addCubeField(ctx, cube, raw, sf.field());
    }
    for (String f : spec.distinctOn()) addCubeField(ctx, cube, raw, f);
    return cube;
  }

  private void addCubeField(RenderCtx ctx, CubeLayout cube, Scope raw, String name) {
    Field f = fieldOf(raw, name);
    if (f.measurement()) {
      if (!cube.columns.containsKey(name)) addMeasure(ctx, cube, raw, f, "SUM");
      return;
    }
    if (cube.columns.containsKey(name)) return;
    String e = fieldExpr(ctx, raw, name);
    cube.columns.put(name, name);
    cube.selectItems.add(e + " AS " + quoteIdent(name));
    cube.groupBy.add(e);
  }

  private void addMeasure(RenderCtx ctx, CubeLayout cube, Scope raw, Field f, String func) {
    String key = "m:" + func + ":" + f.name();
    if (cube.columns.containsKey(key)) return;
    String col = f.name() + "__" + func.toLowerCase(Locale.ROOT);
    String e = aggregateFunction(func.toLowerCase(Locale.ROOT), fieldExpr(ctx, raw, f.name()), false, null);
    cube.columns.put(key, col);
    cube.columns.putIfAbsent(f.name(), col);
    cube.selectItems.add(e + " AS " + quoteIdent(col));
  }

  // ---------- sources, fields and relations

  private String fromSource(RenderCtx ctx, DataObject o, Map<String, Object> args, FunctionSource fn, Scope parent) {
    if (fn != null) {
      FunctionDef fd = functionOf(ctx, fn.module(), fn.name());
      String sql = functionSql(ctx, fd, fn.args(), fn.parentFieldArgs(), parent);
      return isQuery(sql) ? "(" + sql + ")" : sql;
    }
    if (o.viewSql() != null) {
      return "(" + SqlParamCompiler.expand(o.viewSql(), ref -> viewArgument(ctx, o, args, ref)) + ")";
    }
    if (o.kind() == ObjectKind.PARAMETERIZED_VIEW && o.sourceName().contains("[")) {
      return SqlParamCompiler.expand(o.sourceName(), ref -> viewArgument(ctx, o, args, ref));
    }
    return quoteQualified(o.sourceName());
  }

  private String viewArgument(RenderCtx ctx, DataObject o, Map<String, Object> args, String ref) {
    if (!ref.startsWith("$")) throw new IllegalArgumentException("Unexpected reference [" + ref + "] in view " + o.name());
    String name = ref.substring(1);
    ArgDef def = null;
    if (o.args() != null) {
      for (ArgDef d : o.args().arguments()) if (d.name().equals(name)) def = d;
    }
    if (def == null) throw new QueryValidationException("Unknown argument '" + name + "' of " + o.name());
    Object v = args.containsKey(name) ? args.get(name) : def.defaultValue();
    return param(ctx, v, def.type(), null);
  }

  private String functionSql(RenderCtx ctx, FunctionDef fd, Map<String, Object> args, Map<String, String> fieldArgs,
                             Scope s) {
    return SqlParamCompiler.expand(fd.sql(), ref -> {
      if (!ref.startsWith("$")) {
        throw new IllegalArgumentException("Unexpected reference [" + ref + "] in function " + fd.name());
      }
      String name = ref.substring(1);
      if (fieldArgs.containsKey(name)) {
        if (s == null) throw new IllegalArgumentException("Argument " + name + " of " + fd.name() + " needs a row");
        return fieldExpr(ctx, s, fieldArgs.get(name));
      }
      ArgDef def = fd.argument(name);
      if (def == null) throw new QueryValidationException("Unknown argument '" + name + "' of function " + fd.name());
      Object v = args.containsKey(name) ? args.get(name) : def.defaultValue();
      return param(ctx, v, def.type(), null);
    });
  }

  /** SQL expression of a field in scope {@code s}. */
  protected String fieldExpr(RenderCtx ctx, Scope s, String name) {
    Field f = fieldOf(s, name);
    if (s.grouped()) {
      String col = s.columns.get(name);
      if (col == null) {
        throw new IllegalArgumentException("Field '" + name + "' of " + s.object.name() + " is not grouped");
      }
      return s.alias + "." + quoteIdent(col);
    }
    if (f.isFunctionCall()) throw new QueryValidationException("Function field '" + name + "' cannot be used here");
    if (f.calculated()) {
      return "(" + SqlParamCompiler.expand(f.sqlExpression(), ref -> fieldExpr(ctx, s, ref)) + ")";
    }
    return qualify(s.alias, f.column());
  }

  private String qualify(String alias, String column) {
    return alias == null ? quoteIdent(column) : alias + "." + quoteIdent(column);
  }

  private static Field fieldOf(Scope s, String name) {
    Field f = s.object.field(name);
    if (f == null) throw new QueryValidationException("Unknown field '" + name + "' of " + s.object.name());
    return f;
  }

  /** Sort expression: a field, a dotted path through to-one relations, or a projection output. */
  private String orderExpr(RenderCtx ctx, Scope s, SelectSpec spec, String path) {
    if (s.object.hasField(path) || path.contains(".")) return orderPath(ctx, s, path);
    for (Projection p : spec.projections()) {
      if (p.output().equals(path)) return quoteIdent(path);
    }
    throw new QueryValidationException("Unknown order_by field '" + path + "' of " + s.object.name());
  }

  private String orderPath(RenderCtx ctx, Scope s, String path) {
    int dot = path.indexOf('.');
    if (dot < 0) return fieldExpr(ctx, s, path);
    String head = path.substring(0, dot);
    Relation r = ctx.catalog.resolveRelation(s.object.id(), head);
    if (r == null || r.cardinality().isToMany()) {
      throw new QueryValidationException("order_by path '" + path + "' must go through to-one relations");
    }
    DataObject t = ctx.catalog.object(r.toObject());
    String a = ctx.alias();
    Scope child = Scope.direct(t, a, s.withDeleted);
    return "(SELECT " + orderPath(ctx, child, path.substring(dot + 1)) + " FROM " + quoteQualified(t.sourceName())
        + " " + a + " WHERE " + correlate(ctx, r, s, child) + " LIMIT 1)";
  }

  /** Join predicate of {@code r} between a parent row and a row of the related object. */
  protected String correlate(RenderCtx ctx, Relation r, Scope parent, Scope child) {
    List<String> parts = new ArrayList<>();
    if (r.hasJunction()) {
      DataObject j = ctx.catalog.object(r.junction());
      String ja = ctx.alias();
      Scope js = Scope.direct(j, ja, true);
      List<String> on = new ArrayList<>();
      for (int i = 0; i < r.sourceFields().size(); i++) {
        on.add(fieldExpr(ctx, js, r.junctionSourceFields().get(i)) + " = " + fieldExpr(ctx, parent, r.sourceFields().get(i)));
      }
      for (int i = 0; i < r.targetFields().size(); i++) {
        on.add(fieldExpr(ctx, js, r.junctionTargetFields().get(i)) + " = " + fieldExpr(ctx, child, r.targetFields().get(i)));
      }
      parts.add("EXISTS (SELECT 1 FROM " + quoteQualified(j.sourceName()) + " " + ja + " WHERE "
          + String.join(" AND ", on) + ")");
    } else {
      for (int i = 0; i < r.sourceFields().size(); i++) {
        parts.add(fieldExpr(ctx, child, r.targetFields().get(i)) + " = " + fieldExpr(ctx, parent, r.sourceFields().get(i)));
      }
    }
    if (r.joinCondition() != null && !r.joinCondition().isBlank()) {
      parts.add("(" + SqlParamCompiler.expand(r.joinCondition(), ref -> {
        if (ref.startsWith("source.")) return fieldExpr(ctx, parent, ref.substring("source.".length()));
        if (ref.startsWith("target.")) return fieldExpr(ctx, child, ref.substring("target.".length()));
        throw new IllegalArgumentException("Unexpected reference [" + ref + "] in join of " + r.name());
      }) + ")");
    }
    return String.join(" AND ", parts);
  }

  /** Fields of the from side a relation needs to correlate. */
  protected static List<String> relationSourceFields(Relation r) {
    List<String> out = new ArrayList<>(r.sourceFields());
    if (r.joinCondition() != null) {
      SqlParamCompiler.expand(r.joinCondition(), ref -> {
        if (ref.startsWith("source.")) {
          String f = ref.substring("source.".length());
          if (!out.contains(f)) out.add(f);
        }
        return ref;
      });
    }
    return out;
  }

  private String exists(RenderCtx ctx, Scope parent, Relation r, QueryElement childFilter, boolean withDeleted,
                        boolean negateChild) {
    DataObject t = ctx.catalog.object(r.toObject());
    String a = ctx.alias();
    Scope child = Scope.direct(t, a, withDeleted);
    List<String> where = new ArrayList<>();
    where.add(correlate(ctx, r, parent, child));
    addLiveCondition(ctx, child, where);
    if (childFilter != null) {
      String p = renderPredicate(ctx, child, childFilter, negateChild);
      if (!p.isBlank()) where.add(p);
    }
    return "EXISTS (SELECT 1 FROM " + fromSource(ctx, t, Map.of(), null, null) + " " + a
        + whereClause(where) + ")";
  }

  private void addLiveCondition(RenderCtx ctx, Scope s, List<String> where) {
    SoftDeleteSpec sd = s.object.softDelete();
    if (sd == null || s.withDeleted) return;
    where.add("(" + SqlParamCompiler.expand(sd.condition(), ref -> fieldExpr(ctx, s, ref)) + ")");
  }

  private void addFilter(RenderCtx ctx, Scope s, QueryElement filter, List<String> where) {
    if (filter == null) return;
    String p = renderPredicate(ctx, s, filter, false);
    if (p.isBlank()) return;
    // where items are ANDed: a top-level OR keeps its parentheses
    String stripped = stripParensIfAny(p);
    where.add(hasTopLevelOr(stripped) ? p : stripped);
  }

  private static boolean hasTopLevelOr(String sql) {
    int depth = 0;
    boolean quoted = false;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);
      if (ch == '\'') quoted = !quoted;
      else if (quoted) continue;
      else if (ch == '(') depth++;
      else if (ch == ')') depth--;
      else if (depth == 0 && sql.startsWith(" OR ", i)) return true;
    }
    return false;
  }

  private static String whereClause(List<String> where) {
    return where.isEmpty() ? "" : " WHERE " + String.join(" AND ", where);
  }

  // ---------- predicates

  protected String renderPredicate(RenderCtx ctx, Scope s, QueryElement el, boolean negate) {
    if (el == null) return "";

    if (el instanceof NotElement n) {
      return renderPredicate(ctx, s, n.element(), !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;
      List<String> childSql = new ArrayList<>();
      for (QueryElement c : g.elements()) {
        String sql = renderPredicate(ctx, s, c, negate);
        if (sql == null || sql.isBlank()) continue;
        childSql.add(sql);
      }
      if (childSql.isEmpty()) return (g.clause() == Clause.AND) != negate ? "TRUE" : "FALSE";
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (clause == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (el instanceof RelationCondition rc) {
      Relation r = ctx.catalog.resolveRelation(s.object.id(), rc.relation());
      if (r == null) {
        throw new QueryValidationException("Unknown relation '" + rc.relation() + "' of " + s.object.name());
      }
      String sql = switch (rc.quantifier()) {
        case DIRECT, ANY_OF -> exists(ctx, s, r, rc.element(), s.withDeleted, false);
        case ALL_OF -> "NOT " + exists(ctx, s, r, rc.element(), s.withDeleted, true);
        case NONE_OF -> "NOT " + exists(ctx, s, r, rc.element(), s.withDeleted, false);
      };
      return negate ? "NOT (" + sql + ")" : sql;
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    Field f = fieldOf(s, c.property());
    String expr = fieldExpr(ctx, s, c.property());
    FieldType type = f.type();
    boolean geometry = type.scalar() == ScalarType.GEOMETRY && !type.list();
    Integer srid = f.geometryInfo() == null ? null : f.geometryInfo().srid();
    Object value = c.value();

    String sql = switch (c.operator()) {
      case IS_NULL -> expr + (Boolean.FALSE.equals(value) ? " IS NOT NULL" : " IS NULL");
      case EQ -> {
        if (value == null) yield expr + " IS NULL";
        if (geometry) yield spatial("equals", expr, param(ctx, value, type, srid));
        yield expr + " = " + param(ctx, value, type, srid);
      }
      case IN -> {
        List<Object> vals = c.values();
        if (vals.isEmpty()) yield "FALSE";
        List<String> ph = new ArrayList<>();
        for (Object v : vals) ph.add(param(ctx, v, FieldType.of(type.scalar()), srid));
        yield expr + " IN (" + String.join(", ", ph) + ")";
      }
      case GT -> expr + " > " + param(ctx, requireValue(c), type, srid);
      case GTE -> expr + " >= " + param(ctx, requireValue(c), type, srid);
      case LT -> expr + " < " + param(ctx, requireValue(c), type, srid);
      case LTE -> expr + " <= " + param(ctx, requireValue(c), type, srid);
      case LIKE -> expr + " LIKE " + param(ctx, requireValue(c), type, srid);
      case ILIKE -> ilike(expr, param(ctx, requireValue(c), type, srid));
      case REGEX -> regexMatch(expr, param(ctx, requireValue(c), type, srid));
      case CONTAINS -> geometry
          ? spatial("contains", expr, param(ctx, requireValue(c), type, srid))
          : arrayContains(expr, param(ctx, requireValue(c), FieldType.listOf(type.scalar()), srid));
      case INTERSECTS -> geometry
          ? spatial("intersects", expr, param(ctx, requireValue(c), type, srid))
          : arrayOverlaps(expr, param(ctx, requireValue(c), FieldType.listOf(type.scalar()), srid));
    };
    return negate ? "NOT (" + sql + ")" : sql;
  }

  private static Object requireValue(Condition c) {
    if (c.value() == null) {
      throw new QueryValidationException(c.operator().graphqlName() + " on '" + c.property() + "' requires a value");
    }
    return c.value();
  }

  /** Placeholder of a coerced value; geometries are bound as WKT and parsed by the database. */
  protected String param(RenderCtx ctx, Object value, FieldType type, Integer srid) {
    if (type == null) return ctx.add(Bind.untyped(value));
    if (type.scalar() == ScalarType.GEOMETRY && !type.list()) {
      String wkt = value == null ? null : Geometries.toWkt(Geometries.parse(value));
      return geometryParam(ctx.add(new Bind(wkt, type)), srid);
    }
    Object v = value;
    if (type.list() && value != null && !(value instanceof Collection<?>)) v = List.of(value);
    return ctx.add(new Bind(Values.coerce(type, v), type));
  }

  // ---------- aggregates

  private String aggregateExpr(RenderCtx ctx, Scope s, AggregateItem item) {
    if (item.rowsCount()) return "COUNT(*)";
    String expr = fieldExpr(ctx, s, item.field());
    return aggregateFunction(item.function(), expr, item.distinct(), item.separator());
  }

  protected String aggregateFunction(String function, String expr, boolean distinct, String separator) {
    String d = distinct ? "DISTINCT " : "";
    return switch (function.toLowerCase(Locale.ROOT)) {
      case "count" -> "COUNT(" + d + expr + ")";
      case "sum" -> "SUM(" + expr + ")";
      case "avg" -> "AVG(" + expr + ")";
      case "min" -> "MIN(" + expr + ")";
      case "max" -> "MAX(" + expr + ")";
      case "stddev" -> "STDDEV_SAMP(" + expr + ")";
      case "variance" -> "VAR_SAMP(" + expr + ")";
      case "bool_and" -> "BOOL_AND(" + expr + ")";
      case "bool_or" -> "BOOL_OR(" + expr + ")";
      case "string_agg" -> "STRING_AGG(" + d + "CAST(" + expr + " AS VARCHAR), "
          + sqlString(separator == null ? "," : separator) + ")";
      case "list" -> listAgg(expr, distinct);
      case "any" -> anyValue(expr);
      case "last" -> lastValue(expr);
      default -> throw new QueryValidationException("Unknown aggregate function '" + function + "'");
    };
  }

  // ---------- DML

  @Override
  public final SqlStatement insert(Catalog catalog, InsertSpec spec) {
    RenderCtx ctx = new RenderCtx(catalog);
    DataObject o = tableOf(ctx, spec.objectId());
    List<String> cols = new ArrayList<>();
    List<String> vals = new ArrayList<>();
    for (Map.Entry<String, Object> e : spec.values().entrySet()) {
      Field f = writable(o, e.getKey());
      cols.add(quoteIdent(f.column()));
      vals.add(param(ctx, e.getValue(), f.type(), srid(f)));
    }
    for (Field f : o.fields()) {
      DefaultSpec d = f.defaultSpec();
      if (d == null || spec.values().containsKey(f.name())) continue;
      String v;
      if (d.sequence() != null) v = sequenceNextValue(d.sequence());
      else if (d.insertExpression() != null) v = d.insertExpression();
      else if (d.value() != null) v = param(ctx, d.value(), f.type(), srid(f));
      else continue;
      cols.add(quoteIdent(f.column()));
      vals.add(v);
    }

    String sql = cols.isEmpty()
        ? "INSERT INTO " + quoteQualified(o.sourceName()) + " DEFAULT VALUES"
        : "INSERT INTO " + quoteQualified(o.sourceName()) + " (" + String.join(", ", cols) + ") VALUES ("
            + String.join(", ", vals) + ")";

    List<String> returning = new ArrayList<>();
    for (String name : spec.returning()) {
      Field f = o.field(name);
      if (f == null || f.calculated() || f.isFunctionCall()) continue;
      String col = quoteIdent(f.column());
      returning.add((f.scalar() == ScalarType.GEOMETRY ? geometryOut(col) : col) + " AS " + quoteIdent(f.name()));
    }
    if (returning.isEmpty()) return statement(ctx, o.dataSource(), sql, ExecKind.UPDATE);
    return statement(ctx, o.dataSource(), applyReturning(sql, returning), ExecKind.RETURNING);
  }

  @Override
  public final SqlStatement update(Catalog catalog, UpdateSpec spec) {
    RenderCtx ctx = new RenderCtx(catalog);
    DataObject o = tableOf(ctx, spec.objectId());
    Scope s = Scope.direct(o, tableQualifier(o), spec.withDeleted());
    List<String> sets = new ArrayList<>();
    for (Map.Entry<String, Object> e : spec.values().entrySet()) {
      Field f = writable(o, e.getKey());
      sets.add(quoteIdent(f.column()) + " = " + param(ctx, e.getValue(), f.type(), srid(f)));
    }
    for (Field f : o.fields()) {
      DefaultSpec d = f.defaultSpec();
      if (d == null || d.updateExpression() == null || spec.values().containsKey(f.name())) continue;
      sets.add(quoteIdent(f.column()) + " = " + SqlParamCompiler.expand(d.updateExpression(), ref -> fieldExpr(ctx, s, ref)));
    }
    if (sets.isEmpty()) throw new QueryValidationException("update_" + o.queryName() + " has no data");

    List<String> where = new ArrayList<>();
    addLiveCondition(ctx, s, where);
    addFilter(ctx, s, spec.filter(), where);
    String sql = "UPDATE " + quoteQualified(o.sourceName()) + " SET " + String.join(", ", sets) + whereClause(where);
    return statement(ctx, o.dataSource(), sql, ExecKind.UPDATE);
  }

  @Override
  public final SqlStatement delete(Catalog catalog, DeleteSpec spec) {
    RenderCtx ctx = new RenderCtx(catalog);
    DataObject o = tableOf(ctx, spec.objectId());
    Scope s = Scope.direct(o, tableQualifier(o), false);
    List<String> where = new ArrayList<>();
    SoftDeleteSpec sd = o.softDelete();
    if (sd != null) {
      addLiveCondition(ctx, s, where);
      addFilter(ctx, s, spec.filter(), where);
      String set = SqlParamCompiler.expand(sd.setExpression(), ref -> quoteIdent(fieldOf(s, ref).column()));
      String sql = "UPDATE " + quoteQualified(o.sourceName()) + " SET " + set + whereClause(where);
      return statement(ctx, o.dataSource(), sql, ExecKind.UPDATE);
    }
    addFilter(ctx, s, spec.filter(), where);
    String sql = "DELETE FROM " + quoteQualified(o.sourceName()) + whereClause(where);
    return statement(ctx, o.dataSource(), sql, ExecKind.UPDATE);
  }

  private static Field writable(DataObject o, String name) {
    Field f = o.field(name);
    if (f == null) throw new QueryValidationException("Unknown field '" + name + "' of " + o.name());
    if (f.calculated() || f.isFunctionCall()) {
      throw new QueryValidationException("Field '" + name + "' of " + o.name() + " is not writable");
    }
    return f;
  }

  private static Integer srid(Field f) {
    return f.geometryInfo() == null ? null : f.geometryInfo().srid();
  }

  private String tableQualifier(DataObject o) {
    String source = o.sourceName();
    int dot = source.lastIndexOf('.');
    return quoteIdent(dot < 0 ? source : source.substring(dot + 1));
  }

  // ---------- helpers

  private SqlStatement statement(RenderCtx ctx, String dataSource, String sql, ExecKind kind) {
    return new SqlStatement(dataSource, sql, SqlParamCompiler.bindsFor(sql, ctx.params), kind);
  }

  private static DataObject objectOf(RenderCtx ctx, int objectId) {
    return ctx.catalog.object(objectId);
  }

  private static DataObject tableOf(RenderCtx ctx, int objectId) {
    DataObject o = ctx.catalog.object(objectId);
    if (!o.isTable()) throw new QueryValidationException(o.name() + " is not a table");
    return o;
  }

  private static FunctionDef functionOf(RenderCtx ctx, String module, String name) {
    FunctionDef fd = ctx.catalog.function(module, name);
    if (fd == null) throw new QueryValidationException("Unknown function '" + name + "' in module '" + module + "'");
    return fd;
  }

  private static boolean isQuery(String sql) {
    String lower = sql.trim().toLowerCase(Locale.ROOT);
    return lower.startsWith("select") || lower.startsWith("with");
  }

  private static String direction(SortField sf) {
    return sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC";
  }

  protected String stripParensIfAny(String s) {
    if (s == null) return null;
    String t = s.trim();
    if (!t.startsWith("(") || !t.endsWith(")")) return t;
    int depth = 0;
    for (int i = 0; i < t.length(); i++) {
      char ch = t.charAt(i);
      if (ch == '(') depth++;
      else if (ch == ')') depth--;
      if (depth == 0 && i < t.length() - 1) return t;
    }
    return t.substring(1, t.length() - 1);
  }

  protected static String sqlString(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  protected String quoteQualified(String name) {
    List<String> parts = new ArrayList<>();
    for (String p : name.split("\\.")) parts.add(quoteIdent(p));
    return String.join(".", parts);
  }

  // ---------- dialect hooks

  protected abstract String quoteIdent(String ident);

  protected void appendPage(StringBuilder sql, Integer limit, Integer offset) {
    if (limit != null) sql.append(" LIMIT ").append(limit);
    if (offset != null && offset > 0) sql.append(" OFFSET ").append(offset);
  }

  /** JSON object built from parallel key and value lists. */
  protected abstract String jsonObject(List<String> keys, List<String> values);

  /** JSON array of the aggregated JSON values, an empty array when there are none. */
  protected abstract String jsonArrayAgg(String expr);

  protected String ilike(String expr, String param) {
    return "LOWER(" + expr + ") LIKE LOWER(" + param + ")";
  }

  protected String regexMatch(String expr, String param) {
    throw new QueryValidationException("regex is not supported by dialect: " + id());
  }

  /** Array column contains every value of the bound array. */
  protected String arrayContains(String expr, String param) {
    throw new QueryValidationException("contains is not supported by dialect: " + id());
  }

  /** Array column has any value of the bound array. */
  protected String arrayOverlaps(String expr, String param) {
    throw new QueryValidationException("intersects is not supported by dialect: " + id());
  }

  protected String geometryParam(String param, Integer srid) {
    return (srid == null || srid == 0) ? "ST_GeomFromText(" + param + ")" : "ST_GeomFromText(" + param + ", " + srid + ")";
  }

  protected String geometryOut(String expr) {
    return "ST_AsText(" + expr + ")";
  }

  /** {@code equals}, {@code contains} or {@code intersects}. */
  protected String spatial(String predicate, String expr, String geometry) {
    return switch (predicate) {
      case "equals" -> "ST_Equals(" + expr + ", " + geometry + ")";
      case "contains" -> "ST_Contains(" + expr + ", " + geometry + ")";
      case "intersects" -> "ST_Intersects(" + expr + ", " + geometry + ")";
      default -> throw new IllegalArgumentException("Unknown spatial predicate " + predicate);
    };
  }

  /** {@code Area}, {@code AreaSpheroid}, {@code Length}, {@code LengthSpheroid}, {@code Perimeter}, {@code PerimeterSpheroid}. */
  protected String measurement(String type, String expr) {
    return switch (type) {
      case "Area" -> "ST_Area(" + expr + ")";
      case "AreaSpheroid" -> "ST_Area_Spheroid(" + expr + ")";
      case "Length" -> "ST_Length(" + expr + ")";
      case "LengthSpheroid" -> "ST_Length_Spheroid(" + expr + ")";
      case "Perimeter" -> "ST_Perimeter(" + expr + ")";
      case "PerimeterSpheroid" -> "ST_Perimeter_Spheroid(" + expr + ")";
      default -> throw new QueryValidationException("Unknown measurement type '" + type + "'");
    };
  }

  protected String timeBucket(String unit, String expr, boolean hypertable) {
    return "date_trunc(" + sqlString(unit.toLowerCase(Locale.ROOT)) + ", " + expr + ")";
  }

  protected String extract(String part, String expr) {
    String p = switch (part.toLowerCase(Locale.ROOT)) {
      case "iso_dow" -> "ISODOW";
      case "iso_year" -> "ISOYEAR";
      case "epoch", "minute", "hour", "day", "doy", "dow", "week", "month", "year", "quarter" ->
          part.toUpperCase(Locale.ROOT);
      default -> throw new QueryValidationException("Unknown extract part '" + part + "'");
    };
    return "EXTRACT(" + p + " FROM " + expr + ")";
  }

  protected String listAgg(String expr, boolean distinct) {
    return "ARRAY_AGG(" + (distinct ? "DISTINCT " : "") + expr + ")";
  }

  protected String anyValue(String expr) {
    return "ANY_VALUE(" + expr + ")";
  }

  protected String lastValue(String expr) {
    return "LAST(" + expr + ")";
  }

  protected String sequenceNextValue(String sequence) {
    return "nextval(" + sqlString(sequence) + ")";
  }

  protected String applyReturning(String sql, List<String> returning) {
    return sql + " RETURNING " + String.join(", ", returning);
  }
}
