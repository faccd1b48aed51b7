package io.intellixity.federa.schema;

import graphql.Scalars;
import graphql.introspection.Introspection.DirectiveLocation;
import graphql.schema.*;
import io.intellixity.federa.catalog.*;
import io.intellixity.federa.catalog.Module;
import io.intellixity.federa.query.FilterParser;
import io.intellixity.federa.query.Operator;
import io.intellixity.federa.sdl.SchemaDefinitionException;
import io.intellixity.federa.sdl.SchemaError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static graphql.schema.GraphQLList.list;
import static graphql.schema.GraphQLNonNull.nonNull;
import static graphql.schema.GraphQLTypeReference.typeRef;

/**
 * Synthesizes the GraphQL surface of a {@link Catalog}: object types, filter and aggregation inputs,
 * per-module query, mutation and function types, and the {@link SchemaBindings} the planner uses to
 * interpret requests.
 * <p>
 * Compilation is deterministic for a given catalog. Generated names that collide are reported as
 * {@link SchemaError.Code#NAME_COLLISION} naming both owners.
 */
public final class SchemaCompiler {
  private static final Logger log = LoggerFactory.getLogger(SchemaCompiler.class);

  public static final int DEFAULT_LIMIT = 2000;

  static final List<String> NUMERIC_AGGREGATES =
      List.of("count", "sum", "avg", "min", "max", "stddev", "variance", "list", "any", "last");
  static final List<String> STRING_AGGREGATES = List.of("count", "string_agg", "list", "any", "last");
  static final List<String> BOOLEAN_AGGREGATES = List.of("count", "bool_and", "bool_or");
  static final List<String> TEMPORAL_AGGREGATES = List.of("count", "min", "max");

  private final int defaultLimit;

  public SchemaCompiler() {
    this(DEFAULT_LIMIT);
  }

  public SchemaCompiler(int defaultLimit) {
    if (defaultLimit <= 0) throw new IllegalArgumentException("defaultLimit must be positive");
    this.defaultLimit = defaultLimit;
  }

  public CompiledSchema compile(Catalog catalog) {
    Objects.requireNonNull(catalog, "catalog");
    long start = System.nanoTime();
    CompiledSchema compiled = new Run(catalog).compile();
    log.info("federa.schema compiled objects={} relations={} functions={} bindings={} tookMs={}",
        catalog.objects().size(), catalog.relations().size(), catalog.functions().size(),
        compiled.bindings().size(), (System.nanoTime() - start) / 1_000_000);
    return compiled;
  }

  /** Operators of a scalar filter, in declaration order; empty when the type is not filterable. */
  static List<Operator> filterOperators(FieldType type) {
    List<Operator> ops = new ArrayList<>(FilterParser.operatorsFor(type));
    ops.sort(Comparator.naturalOrder());
    return ops;
  }

  /** Aggregate functions of a scalar, or an empty list when the scalar is not aggregatable. */
  static List<String> aggregateFunctions(ScalarType scalar) {
    return switch (scalar) {
      case INT, BIGINT, FLOAT -> NUMERIC_AGGREGATES;
      case STRING -> STRING_AGGREGATES;
      case BOOLEAN -> BOOLEAN_AGGREGATES;
      case DATE, TIMESTAMP, TIME -> TEMPORAL_AGGREGATES;
      default -> List.of();
    };
  }

  static List<GraphQLDirective> queryDirectives() {
    return List.of(
        GraphQLDirective.newDirective().name("cache")
            .description("Caches the result of the field (or of every top-level field of the operation)")
            .validLocations(DirectiveLocation.QUERY, DirectiveLocation.FIELD)
            .argument(GraphQLArgument.newArgument().name("ttl").type(Scalars.GraphQLInt))
            .argument(GraphQLArgument.newArgument().name("key").type(Scalars.GraphQLString))
            .argument(GraphQLArgument.newArgument().name("tags").type(list(nonNull(Scalars.GraphQLString))))
            .build(),
        GraphQLDirective.newDirective().name("no_cache")
            .validLocations(DirectiveLocation.QUERY, DirectiveLocation.FIELD)
            .build(),
        GraphQLDirective.newDirective().name("invalidate_cache")
            .description("Executes the field, then purges cached entries carrying its tags")
            .validLocations(DirectiveLocation.QUERY, DirectiveLocation.MUTATION, DirectiveLocation.FIELD)
            .build(),
        GraphQLDirective.newDirective().name("no_pushdown")
            .validLocations(DirectiveLocation.QUERY, DirectiveLocation.MUTATION, DirectiveLocation.FIELD)
            .build(),
        GraphQLDirective.newDirective().name("unnest")
            .validLocations(DirectiveLocation.FIELD)
            .build(),
        GraphQLDirective.newDirective().name("with_deleted")
            .validLocations(DirectiveLocation.QUERY, DirectiveLocation.FIELD)
            .build());
  }

  /** Source of a generated name, used to report collisions. */
  private record Owner(String label, String dataSource, SdlLocation location) {
    static final Owner BUILT_IN = new Owner("built-in types", "", SdlLocation.UNKNOWN);

    static Owner of(DataObject o) {
      return new Owner("object " + o.qualifiedName() + " of data source " + o.dataSource(), o.dataSource(),
          o.location());
    }

    static Owner of(FunctionDef f) {
      return new Owner("function " + f.name() + " of data source " + f.dataSource(), f.dataSource(), null);
    }

    static Owner module(Module m) {
      return new Owner("module " + m.path(), "", null);
    }
  }

  private final class Run {
    private final Catalog catalog;
    private final Map<String, GraphQLNamedType> types = new LinkedHashMap<>();
    private final Map<String, Owner> typeOwners = new HashMap<>();
    private final Map<String, FieldBinding> bindings = new LinkedHashMap<>();
    private final Map<String, List<SchemaError>> errors = new LinkedHashMap<>();

    Run(Catalog catalog) {
      this.catalog = catalog;
    }

    CompiledSchema compile() {
      sharedTypes();
      for (DataObject o : catalog.objects()) objectTypes(o);

      ObjectTypeSpec query = moduleTypes(catalog.rootModule(), true);
      ObjectTypeSpec mutation = moduleTypes(catalog.rootModule(), false);
      hubTypes();

      if (!errors.isEmpty()) {
        Map.Entry<String, List<SchemaError>> first = errors.entrySet().iterator().next();
        List<SchemaError> all = new ArrayList<>();
        errors.values().forEach(all::addAll);
        throw new SchemaDefinitionException(first.getKey(), all);
      }

      if (query.isEmpty()) {
        query.add(GraphQLFieldDefinition.newFieldDefinition().name("_empty").type(Scalars.GraphQLBoolean)
            .description("Present while no data object is loaded").build(), null, Owner.BUILT_IN);
      }
      GraphQLSchema.Builder schema = GraphQLSchema.newSchema().query(query.build());
      if (!mutation.isEmpty()) schema.mutation(mutation.build());
      schema.additionalTypes(new LinkedHashSet<>(types.values()));
      for (GraphQLDirective d : queryDirectives()) schema.additionalDirective(d);
      return new CompiledSchema(catalog, schema.build(), new SchemaBindings(bindings));
    }

    // ---------- shared types

    private void sharedTypes() {
      typeOwners.put(TypeNames.QUERY, Owner.BUILT_IN);
      typeOwners.put(TypeNames.MUTATION, Owner.BUILT_IN);
      for (GraphQLScalarType s : FederaScalars.custom()) register(s, Owner.BUILT_IN);
      register(GraphQLEnumType.newEnum().name(TypeNames.ORDER_DIRECTION).value("ASC").value("DESC").build(),
          Owner.BUILT_IN);
      register(GraphQLInputObjectType.newInputObject().name(TypeNames.ORDER_BY_FIELD)
          .field(inputField("field", nonNull(Scalars.GraphQLString)))
          .field(GraphQLInputObjectField.newInputObjectField().name("direction")
              .type(typeRef(TypeNames.ORDER_DIRECTION)).defaultValueProgrammatic("ASC"))
          .build(), Owner.BUILT_IN);
      register(enumType(TypeNames.TIME_BUCKET, "minute", "hour", "day", "week", "month", "quarter", "year"),
          Owner.BUILT_IN);
      register(enumType(TypeNames.TIME_EXTRACT, "epoch", "minute", "hour", "day", "doy", "dow", "iso_dow", "week",
          "month", "year", "iso_year", "quarter"), Owner.BUILT_IN);
      register(enumType(TypeNames.MEASUREMENT_TYPES, "Area", "AreaSpheroid", "Length", "LengthSpheroid",
          "Perimeter", "PerimeterSpheroid"), Owner.BUILT_IN);
      register(enumType(TypeNames.MEASUREMENT_AGGREGATION, "SUM", "AVG", "MIN", "MAX", "ANY"), Owner.BUILT_IN);
      register(enumType(TypeNames.SPATIAL_JOIN_TYPE, "INTERSECTS", "WITHIN", "CONTAINS", "DISJOIN", "DWITHIN"),
          Owner.BUILT_IN);

      ObjectTypeSpec result = new ObjectTypeSpec(TypeNames.OPERATION_RESULT, "Outcome of an update or delete",
          Owner.BUILT_IN);
      result.add(field("success", Scalars.GraphQLBoolean), new FieldBinding.OperationResultField("success"),
          Owner.BUILT_IN);
      result.add(field("affected_rows", Scalars.GraphQLInt), new FieldBinding.OperationResultField("affected_rows"),
          Owner.BUILT_IN);
      result.add(field("message", Scalars.GraphQLString), new FieldBinding.OperationResultField("message"),
          Owner.BUILT_IN);
      register(result.build(), Owner.BUILT_IN);

      for (ScalarType s : ScalarType.values()) {
        List<String> functions = aggregateFunctions(s);
        if (functions.isEmpty()) continue;
        String name = TypeNames.scalarAggregation(s);
        ObjectTypeSpec agg = new ObjectTypeSpec(name, null, Owner.BUILT_IN);
        for (String fn : functions) {
          agg.add(aggregateFunctionField(s, fn), new FieldBinding.AggregateFunction(fn), Owner.BUILT_IN);
        }
        register(agg.build(), Owner.BUILT_IN);
      }
    }

    private GraphQLFieldDefinition aggregateFunctionField(ScalarType s, String fn) {
      GraphQLOutputType scalar = FederaScalars.of(s);
      GraphQLFieldDefinition.Builder b = GraphQLFieldDefinition.newFieldDefinition().name(fn);
      switch (fn) {
        case "count" -> b.type(FederaScalars.of(ScalarType.BIGINT))
            .argument(argument("distinct", Scalars.GraphQLBoolean, false));
        case "sum" -> b.type(s == ScalarType.FLOAT ? Scalars.GraphQLFloat : FederaScalars.of(ScalarType.BIGINT));
        case "avg", "stddev", "variance" -> b.type(Scalars.GraphQLFloat);
        case "list" -> b.type(list(scalar)).argument(argument("distinct", Scalars.GraphQLBoolean, false));
        case "string_agg" -> b.type(Scalars.GraphQLString)
            .argument(argument("sep", Scalars.GraphQLString, ","))
            .argument(argument("distinct", Scalars.GraphQLBoolean, false));
        case "bool_and", "bool_or" -> b.type(Scalars.GraphQLBoolean);
        default -> b.type(scalar);
      }
      return b.build();
    }

    private void scalarFilter(FieldType type) {
      String name = TypeNames.scalarFilter(type.scalar(), type.list());
      if (types.containsKey(name)) return;
      GraphQLInputType scalar = FederaScalars.of(type.scalar());
      GraphQLInputObjectType.Builder b = GraphQLInputObjectType.newInputObject().name(name);
      for (Operator op : filterOperators(type)) {
        GraphQLInputType t = switch (op) {
          case IN -> list(nonNull(scalar));
          case LIKE, ILIKE, REGEX -> Scalars.GraphQLString;
          case IS_NULL -> Scalars.GraphQLBoolean;
          case EQ, CONTAINS, INTERSECTS -> type.list() ? list(scalar) : scalar;
          default -> scalar;
        };
        b.field(inputField(op.graphqlName(), t));
      }
      register(b.build(), Owner.BUILT_IN);
    }

    // ---------- per object

    private void objectTypes(DataObject o) {
      Owner owner = Owner.of(o);
      String tn = o.typeName();

      ObjectTypeSpec type = new ObjectTypeSpec(tn, o.description(), owner);
      for (io.intellixity.federa.catalog.Field f : o.fields()) {
        if (f.isFunctionCall()) {
          functionCallField(type, o, f, owner);
        } else {
          dataField(type, o, f, owner);
        }
      }
      for (Relation r : catalog.relationsFrom(o.id())) relationField(type, r, owner);
      type.add(GraphQLFieldDefinition.newFieldDefinition().name("_join")
          .description("Joins any object on the given fields of this object")
          .argument(argument("fields", nonNull(list(nonNull(Scalars.GraphQLString)))))
          .type(typeRef(TypeNames.JOIN_HUB)).build(), new FieldBinding.JoinHub(o.id()), owner);
      if (o.hasGeometry()) {
        type.add(GraphQLFieldDefinition.newFieldDefinition().name("_spatial")
            .description("Joins geometry-bearing objects by a spatial predicate on the given field")
            .argument(argument("field", nonNull(Scalars.GraphQLString)))
            .argument(argument("type", nonNull(typeRef(TypeNames.SPATIAL_JOIN_TYPE))))
            .argument(argument("buffer", Scalars.GraphQLInt))
            .type(typeRef(TypeNames.SPATIAL_HUB)).build(), new FieldBinding.SpatialHub(o.id()), owner);
      }
      register(type.build(), owner);

      filterType(o, owner);
      aggregationTypes(o, owner);
      if (mutable(o)) mutationInputs(o, owner);
      if (o.args() != null) argsInput(o.args(), owner);
    }

    private void dataField(ObjectTypeSpec type, DataObject o, io.intellixity.federa.catalog.Field f, Owner owner) {
      GraphQLFieldDefinition.Builder b = GraphQLFieldDefinition.newFieldDefinition()
          .name(f.name())
          .description(f.description())
          .type(outputType(f.type()));
      boolean dateLike = f.scalar().isDateLike() && !f.type().list();
      if (dateLike) b.argument(argument("bucket", typeRef(TypeNames.TIME_BUCKET)));
      if (o.cube() && f.measurement()) {
        b.argument(argument("measurement_func", typeRef(TypeNames.MEASUREMENT_AGGREGATION)));
      }
      type.add(b.build(), new FieldBinding.Column(o.id(), f.name()), owner);

      if (dateLike) {
        type.add(GraphQLFieldDefinition.newFieldDefinition().name("_" + f.name() + "_part")
            .argument(argument("extract", nonNull(typeRef(TypeNames.TIME_EXTRACT))))
            .argument(argument("extract_divide", Scalars.GraphQLInt))
            .type(FederaScalars.of(ScalarType.BIGINT)).build(), new FieldBinding.TimePart(o.id(), f.name()), owner);
      }
      if (f.scalar() == ScalarType.GEOMETRY && !f.type().list()) {
        type.add(GraphQLFieldDefinition.newFieldDefinition().name("_" + f.name() + "_measurement")
            .argument(argument("type", nonNull(typeRef(TypeNames.MEASUREMENT_TYPES))))
            .type(Scalars.GraphQLFloat).build(), new FieldBinding.Measurement(o.id(), f.name()), owner);
      }
    }

    private void functionCallField(ObjectTypeSpec type, DataObject o, io.intellixity.federa.catalog.Field f,
                                   Owner owner) {
      FunctionCall call = f.functionCall();
      FunctionDef fn = catalog.function(call.module(), call.function());
      if (fn == null) {
        error(owner, SchemaError.Code.UNRESOLVED_REFERENCE,
            "Field " + o.typeName() + "." + f.name() + " calls unknown function " + call.function());
        return;
      }
      GraphQLFieldDefinition.Builder b = GraphQLFieldDefinition.newFieldDefinition()
          .name(f.name())
          .description(f.description() != null ? f.description() : fn.description())
          .type(functionOutput(fn));
      for (ArgDef a : fn.arguments()) {
        if (!call.arguments().containsKey(a.name())) b.argument(argument(a));
      }
      type.add(b.build(), new FieldBinding.FunctionCallField(o.id(), f.name()), owner);
    }

    private void relationField(ObjectTypeSpec type, Relation r, Owner owner) {
      DataObject target = catalog.object(r.toObject());
      String tn = target.typeName();
      if (r.cardinality().isToMany()) {
        type.add(GraphQLFieldDefinition.newFieldDefinition().name(r.name())
            .type(list(nonNull(typeRef(tn))))
            .arguments(selectArguments(target, true, true, false))
            .argument(argument("inner", Scalars.GraphQLBoolean, false))
            .build(), new FieldBinding.RelationField(r.id()), owner);
        type.add(GraphQLFieldDefinition.newFieldDefinition().name(r.name() + "_aggregation")
            .type(typeRef(TypeNames.aggregations(tn)))
            .arguments(selectArguments(target, false, false, false))
            .argument(argument("inner", Scalars.GraphQLBoolean, false))
            .build(), new FieldBinding.RelationAggregation(r.id()), owner);
      } else {
        type.add(GraphQLFieldDefinition.newFieldDefinition().name(r.name())
            .type(typeRef(tn))
            .argument(argument("inner", Scalars.GraphQLBoolean, false))
            .build(), new FieldBinding.RelationField(r.id()), owner);
      }
    }

    private void filterType(DataObject o, Owner owner) {
      String tn = o.typeName();
      String name = TypeNames.filter(tn);
      GraphQLInputObjectType.Builder b = GraphQLInputObjectType.newInputObject().name(name)
          .description("Filter of " + tn)
          .field(inputField("_and", list(nonNull(typeRef(name)))))
          .field(inputField("_or", list(nonNull(typeRef(name)))))
          .field(inputField("_not", typeRef(name)));
      for (io.intellixity.federa.catalog.Field f : o.fields()) {
        if (f.isFunctionCall() || filterOperators(f.type()).isEmpty()) continue;
        scalarFilter(f.type());
        b.field(inputField(f.name(), typeRef(TypeNames.scalarFilter(f.scalar(), f.type().list()))));
      }
      for (Relation r : catalog.relationsFrom(o.id())) {
        String target = catalog.object(r.toObject()).typeName();
        b.field(inputField(r.name(),
            typeRef(r.cardinality().isToMany() ? TypeNames.listFilter(target) : TypeNames.filter(target))));
      }
      register(b.build(), owner);
      register(GraphQLInputObjectType.newInputObject().name(TypeNames.listFilter(tn))
          .description("Filter over the rows of a to-many relation to " + tn)
          .field(inputField("any_of", typeRef(name)))
          .field(inputField("all_of", typeRef(name)))
          .field(inputField("none_of", typeRef(name)))
          .build(), owner);
    }

    private void aggregationTypes(DataObject o, Owner owner) {
      String tn = o.typeName();
      ObjectTypeSpec agg = new ObjectTypeSpec(TypeNames.aggregations(tn), "Aggregations of " + tn, owner);
      agg.add(field("_rows_count", FederaScalars.of(ScalarType.BIGINT)), new FieldBinding.RowsCount(o.id()), owner);
      for (io.intellixity.federa.catalog.Field f : o.fields()) {
        if (f.isFunctionCall() || f.type().list() || aggregateFunctions(f.scalar()).isEmpty()) continue;
        agg.add(field(f.name(), typeRef(TypeNames.scalarAggregation(f.scalar()))),
            new FieldBinding.AggregatedField(o.id(), f.name()), owner);
      }
      register(agg.build(), owner);

      ObjectTypeSpec bucket = new ObjectTypeSpec(TypeNames.bucket(tn), null, owner);
      bucket.add(field("key", typeRef(tn)), new FieldBinding.BucketKey(o.id()), owner);
      bucket.add(field("aggregations", typeRef(TypeNames.aggregations(tn))),
          new FieldBinding.BucketAggregations(o.id()), owner);
      register(bucket.build(), owner);
    }

    private void mutationInputs(DataObject o, Owner owner) {
      String tn = o.typeName();
      GraphQLInputObjectType.Builder insert = GraphQLInputObjectType.newInputObject().name(TypeNames.insertData(tn));
      GraphQLInputObjectType.Builder update = GraphQLInputObjectType.newInputObject().name(TypeNames.updateData(tn));
      for (io.intellixity.federa.catalog.Field f : o.fields()) {
        if (f.isFunctionCall() || f.calculated()) continue;
        insert.field(inputField(f.name(), inputType(f.type(), false)));
        update.field(inputField(f.name(), inputType(f.type(), false)));
      }
      register(insert.build(), owner);
      register(update.build(), owner);
    }

    private void argsInput(ArgsSpec args, Owner owner) {
      if (types.containsKey(args.inputTypeName()) && types.get(args.inputTypeName()) instanceof GraphQLInputObjectType) {
        return;
      }
      GraphQLInputObjectType.Builder b = GraphQLInputObjectType.newInputObject().name(args.inputTypeName());
      for (ArgDef a : args.arguments()) {
        GraphQLInputObjectField.Builder f = GraphQLInputObjectField.newInputObjectField()
            .name(a.name()).type(inputType(a.type(), a.required()));
        if (a.defaultValue() != null) f.defaultValueProgrammatic(a.defaultValue());
        b.field(f);
      }
      register(b.build(), owner);
    }

    // ---------- modules

    private ObjectTypeSpec moduleTypes(Module m, boolean queries) {
      String name = queries ? TypeNames.moduleQuery(m) : TypeNames.moduleMutation(m);
      Owner moduleOwner = Owner.module(m);
      ObjectTypeSpec type = new ObjectTypeSpec(name, m.isRoot() ? null : "Module " + m.path(), moduleOwner);

      for (Module child : m.children()) {
        ObjectTypeSpec childType = moduleTypes(child, queries);
        if (childType.isEmpty()) continue;
        register(childType.build(), Owner.module(child));
        type.add(field(child.name(), typeRef(childType.name)), new FieldBinding.ModuleField(child.path()),
            Owner.module(child));
      }
      for (int id : m.objectIds()) {
        DataObject o = catalog.object(id);
        if (queries) {
          queryFields(type, o);
        } else if (mutable(o)) {
          mutationFields(type, o);
        }
      }
      if (queries && !m.functions().isEmpty()) {
        ObjectTypeSpec functions = new ObjectTypeSpec(TypeNames.moduleFunction(m), null, moduleOwner);
        for (String fnName : m.functions()) {
          FunctionDef fn = catalog.function(m.path(), fnName);
          Owner fo = Owner.of(fn);
          GraphQLFieldDefinition.Builder b = GraphQLFieldDefinition.newFieldDefinition()
              .name(fn.name()).description(fn.description()).type(functionOutput(fn));
          for (ArgDef a : fn.arguments()) b.argument(argument(a));
          functions.add(b.build(), new FieldBinding.FunctionQuery(m.path(), fn.name()), fo);
        }
        register(functions.build(), moduleOwner);
        type.add(field("function", typeRef(functions.name)), new FieldBinding.FunctionHub(m.path()), moduleOwner);
      }
      return type;
    }

    private void queryFields(ObjectTypeSpec type, DataObject o) {
      Owner owner = Owner.of(o);
      String tn = o.typeName();
      String q = o.queryName();

      type.add(GraphQLFieldDefinition.newFieldDefinition().name(q).description(o.description())
          .type(list(nonNull(typeRef(tn))))
          .arguments(selectArguments(o, true, true, true))
          .build(), new FieldBinding.SelectList(o.id()), owner);
      if (!o.primaryKey().isEmpty()) {
        type.add(keyQuery(o, q + "_by_pk", o.primaryKey()), new FieldBinding.SelectOne(o.id(), o.primaryKey()), owner);
      }
      for (UniqueConstraint u : o.uniqueConstraints()) {
        if (u.skipQuery()) continue;
        type.add(keyQuery(o, q + "_" + u.suffix(), u.fields()), new FieldBinding.SelectOne(o.id(), u.fields()), owner);
      }
      type.add(GraphQLFieldDefinition.newFieldDefinition().name(q + "_aggregation")
          .type(typeRef(TypeNames.aggregations(tn)))
          .arguments(selectArguments(o, false, true, true))
          .build(), new FieldBinding.Aggregate(o.id()), owner);
      type.add(GraphQLFieldDefinition.newFieldDefinition().name(q + "_bucket_aggregation")
          .type(list(nonNull(typeRef(TypeNames.bucket(tn)))))
          .arguments(selectArguments(o, false, false, true))
          .build(), new FieldBinding.BucketAggregate(o.id()), owner);
    }

    private GraphQLFieldDefinition keyQuery(DataObject o, String name, List<String> keyFields) {
      GraphQLFieldDefinition.Builder b = GraphQLFieldDefinition.newFieldDefinition().name(name)
          .type(typeRef(o.typeName()));
      for (String k : keyFields) {
        b.argument(argument(k, inputType(o.field(k).type(), true)));
      }
      if (o.args() != null) b.argument(argsArgument(o.args()));
      return b.build();
    }

    private void mutationFields(ObjectTypeSpec type, DataObject o) {
      Owner owner = Owner.of(o);
      String tn = o.typeName();
      String q = o.queryName();
      type.add(GraphQLFieldDefinition.newFieldDefinition().name("insert_" + q)
          .argument(argument("data", nonNull(typeRef(TypeNames.insertData(tn)))))
          .type(typeRef(tn)).build(), new FieldBinding.Insert(o.id()), owner);
      type.add(GraphQLFieldDefinition.newFieldDefinition().name("update_" + q)
          .argument(argument("filter", typeRef(TypeNames.filter(tn))))
          .argument(argument("data", nonNull(typeRef(TypeNames.updateData(tn)))))
          .type(typeRef(TypeNames.OPERATION_RESULT)).build(), new FieldBinding.Update(o.id()), owner);
      type.add(GraphQLFieldDefinition.newFieldDefinition().name("delete_" + q)
          .argument(argument("filter", typeRef(TypeNames.filter(tn))))
          .type(typeRef(TypeNames.OPERATION_RESULT)).build(), new FieldBinding.Delete(o.id()), owner);
    }

    // ---------- join hubs

    private void hubTypes() {
      if (catalog.objects().isEmpty()) return;
      ObjectTypeSpec join = new ObjectTypeSpec(TypeNames.JOIN_HUB, "Objects joinable on arbitrary fields",
          Owner.BUILT_IN);
      ObjectTypeSpec spatial = new ObjectTypeSpec(TypeNames.SPATIAL_HUB, "Objects joinable by geometry",
          Owner.BUILT_IN);
      for (DataObject o : catalog.objects()) {
        Owner owner = Owner.of(o);
        join.add(hubSelect(o, "fields", nonNull(list(nonNull(Scalars.GraphQLString)))),
            new FieldBinding.DynamicJoin(o.id(), false), owner);
        join.add(hubAggregation(o, "fields", nonNull(list(nonNull(Scalars.GraphQLString)))),
            new FieldBinding.DynamicJoin(o.id(), true), owner);
        if (o.hasGeometry()) {
          spatial.add(hubSelect(o, "field", nonNull(Scalars.GraphQLString)),
              new FieldBinding.SpatialJoin(o.id(), false), owner);
          spatial.add(hubAggregation(o, "field", nonNull(Scalars.GraphQLString)),
              new FieldBinding.SpatialJoin(o.id(), true), owner);
        }
      }
      register(join.build(), Owner.BUILT_IN);
      if (!spatial.isEmpty()) register(spatial.build(), Owner.BUILT_IN);
    }

    private GraphQLFieldDefinition hubSelect(DataObject o, String keyArg, GraphQLInputType keyType) {
      return GraphQLFieldDefinition.newFieldDefinition().name(o.typeName())
          .type(list(nonNull(typeRef(o.typeName()))))
          .argument(argument(keyArg, keyType))
          .arguments(selectArguments(o, true, false, true))
          .argument(argument("inner", Scalars.GraphQLBoolean, false))
          .build();
    }

    private GraphQLFieldDefinition hubAggregation(DataObject o, String keyArg, GraphQLInputType keyType) {
      return GraphQLFieldDefinition.newFieldDefinition().name(o.typeName() + "_aggregation")
          .type(typeRef(TypeNames.aggregations(o.typeName())))
          .argument(argument(keyArg, keyType))
          .argument(argument("filter", typeRef(TypeNames.filter(o.typeName()))))
          .argument(argument("inner", Scalars.GraphQLBoolean, false))
          .build();
    }

    // ---------- helpers

    /**
     * {@code filter, order_by, limit, offset[, distinct_on][, args]}; {@code limit} defaults to the
     * configured limit on row selections only.
     */
    private List<GraphQLArgument> selectArguments(DataObject o, boolean rows, boolean distinctOn, boolean withArgs) {
      List<GraphQLArgument> out = new ArrayList<>();
      out.add(argument("filter", typeRef(TypeNames.filter(o.typeName()))));
      out.add(argument("order_by", list(nonNull(typeRef(TypeNames.ORDER_BY_FIELD)))));
      out.add(rows ? argument("limit", Scalars.GraphQLInt, defaultLimit) : argument("limit", Scalars.GraphQLInt));
      out.add(argument("offset", Scalars.GraphQLInt));
      if (distinctOn) out.add(argument("distinct_on", list(nonNull(Scalars.GraphQLString))));
      if (withArgs && o.args() != null) out.add(argsArgument(o.args()));
      return out;
    }

    private GraphQLArgument argsArgument(ArgsSpec args) {
      GraphQLInputType t = typeRef(args.inputTypeName());
      return argument("args", args.required() ? nonNull(t) : t);
    }

    private GraphQLOutputType functionOutput(FunctionDef fn) {
      if (fn.returnsTable()) {
        GraphQLOutputType t = typeRef(catalog.object(fn.returnObject()).typeName());
        return fn.returnsList() ? list(nonNull(t)) : t;
      }
      return outputType(fn.returnScalar());
    }

    private boolean mutable(DataObject o) {
      return o.isTable() && !catalog.isReadOnly(o.id());
    }

    private void register(GraphQLNamedType type, Owner owner) {
      Owner prior = typeOwners.putIfAbsent(type.getName(), owner);
      if (prior != null) {
        error(owner, SchemaError.Code.NAME_COLLISION, "Generated type " + type.getName() + " of " + owner.label() + " collides with " + prior.label());
        return;
      }
      types.put(type.getName(), type);
    }

    private void error(Owner owner, SchemaError.Code code, String message) {
      errors.computeIfAbsent(owner.dataSource(), k -> new ArrayList<>())
          .add(new SchemaError(code, message, owner.location()));
    }

    /** Output object type under construction; field names are checked for collisions. */
    private final class ObjectTypeSpec {
      final String name;
      final String description;
      final Owner owner;
      final Map<String, GraphQLFieldDefinition> fields = new LinkedHashMap<>();
      final Map<String, Owner> fieldOwners = new HashMap<>();

      ObjectTypeSpec(String name, String description, Owner owner) {
        this.name = name;
        this.description = description;
        this.owner = owner;
      }

      void add(GraphQLFieldDefinition def, FieldBinding binding, Owner fieldOwner) {
        Owner prior = fieldOwners.putIfAbsent(def.getName(), fieldOwner);
        if (prior != null) {
          error(fieldOwner, SchemaError.Code.NAME_COLLISION, "Generated field " + name + "." + def.getName() + " of " + fieldOwner.label()
              + " collides with " + prior.label());
          return;
        }
        fields.put(def.getName(), def);
        if (binding != null) bindings.put(SchemaBindings.coordinate(name, def.getName()), binding);
      }

      boolean isEmpty() { return fields.isEmpty(); }

      GraphQLObjectType build() {
        return GraphQLObjectType.newObject().name(name).description(description)
            .fields(new ArrayList<>(fields.values())).build();
      }
    }
  }

  static GraphQLOutputType outputType(FieldType t) {
    GraphQLOutputType base = FederaScalars.of(t.scalar());
    return t.list() ? list(base) : base;
  }

  static GraphQLInputType inputType(FieldType t, boolean keepNonNull) {
    GraphQLInputType base = FederaScalars.of(t.scalar());
    GraphQLInputType out = t.list() ? list(base) : base;
    return keepNonNull && t.nonNull() ? nonNull(out) : out;
  }

  private static GraphQLFieldDefinition field(String name, GraphQLOutputType type) {
    return GraphQLFieldDefinition.newFieldDefinition().name(name).type(type).build();
  }

  private static GraphQLInputObjectField inputField(String name, GraphQLInputType type) {
    return GraphQLInputObjectField.newInputObjectField().name(name).type(type).build();
  }

  private static GraphQLArgument argument(String name, GraphQLInputType type) {
    return GraphQLArgument.newArgument().name(name).type(type).build();
  }

  private static GraphQLArgument argument(String name, GraphQLInputType type, Object defaultValue) {
    return GraphQLArgument.newArgument().name(name).type(type).defaultValueProgrammatic(defaultValue).build();
  }

  private static GraphQLArgument argument(ArgDef a) {
    GraphQLArgument.Builder b = GraphQLArgument.newArgument().name(a.name()).type(inputType(a.type(), a.required()));
    if (a.defaultValue() != null) b.defaultValueProgrammatic(a.defaultValue());
    return b.build();
  }

  private static GraphQLEnumType enumType(String name, String... values) {
    GraphQLEnumType.Builder b = GraphQLEnumType.newEnum().name(name);
    for (String v : values) b.value(v);
    return b.build();
  }
}
