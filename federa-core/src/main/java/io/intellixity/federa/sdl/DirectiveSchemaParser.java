package io.intellixity.federa.sdl;

import graphql.language.*;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import io.intellixity.federa.catalog.*;
import io.intellixity.federa.catalog.Field;
import io.intellixity.federa.sdl.SourceDraft.*;

import java.util.*;

/**
 * First parsing pass over the SDL documents of one data source.
 * <p>
 * Builds every object and field so that the second pass ({@link CatalogLinker}) can resolve
 * references in any file order. Cross references are only recorded here.
 */
final class DirectiveSchemaParser {
  static final String FUNCTION_TYPE = "Function";

  private final DataSourceInfo info;
  private final SourceDraft draft;

  private final List<Def<ObjectTypeDefinition>> objectDefs = new ArrayList<>();
  private final List<Def<ObjectTypeExtensionDefinition>> extensionDefs = new ArrayList<>();
  private final List<Def<FieldDefinition>> functionDefs = new ArrayList<>();
  private final Map<String, Def<InputObjectTypeDefinition>> inputDefs = new HashMap<>();
  private final Set<String> enumNames = new HashSet<>();
  private final Set<String> objectTypeNames = new HashSet<>();
  private final Map<String, PendingArgs> pendingArgs = new LinkedHashMap<>();

  private record Def<T>(T node, String source) {}

  private record PendingArgs(DirectiveSpec.Args spec, String source, SdlLocation location) {}

  DirectiveSchemaParser(DataSourceInfo info) {
    this.info = Objects.requireNonNull(info, "info");
    this.draft = new SourceDraft(info);
  }

  SourceDraft parse(List<SdlSource> sources) {
    for (SdlSource s : sources) collect(s);
    if (!draft.errors.isEmpty()) return draft;

    for (Def<ObjectTypeDefinition> d : objectDefs) objectTypeNames.add(d.node().getName());
    for (Def<ObjectTypeExtensionDefinition> d : extensionDefs) objectTypeNames.add(d.node().getName());

    for (Def<ObjectTypeDefinition> d : objectDefs) buildObject(d.node(), d.source());
    for (Def<ObjectTypeExtensionDefinition> d : extensionDefs) applyExtension(d.node(), d.source());
    for (Def<FieldDefinition> d : functionDefs) buildFunction(d.node(), d.source());
    resolveArgs();
    return draft;
  }

  private void collect(SdlSource s) {
    Document doc;
    try {
      doc = Parser.parse(s.text());
    } catch (InvalidSyntaxException e) {
      SourceLocation sl = e.getLocation();
      SdlLocation loc = sl == null ? new SdlLocation(s.name(), 0, 0) : new SdlLocation(s.name(), sl.getLine(), sl.getColumn());
      draft.errors.add(new SchemaError(SchemaError.Code.SYNTAX, e.getMessage(), loc));
      return;
    }
    for (Definition<?> def : doc.getDefinitions()) {
      if (def instanceof ObjectTypeExtensionDefinition ext) {
        if (FUNCTION_TYPE.equals(ext.getName())) {
          for (FieldDefinition fd : ext.getFieldDefinitions()) functionDefs.add(new Def<>(fd, s.name()));
        } else {
          extensionDefs.add(new Def<>(ext, s.name()));
        }
      } else if (def instanceof ObjectTypeDefinition otd) {
        if (FUNCTION_TYPE.equals(otd.getName())) {
          for (FieldDefinition fd : otd.getFieldDefinitions()) functionDefs.add(new Def<>(fd, s.name()));
        } else {
          objectDefs.add(new Def<>(otd, s.name()));
        }
      } else if (def instanceof InputObjectTypeDefinition in) {
        inputDefs.put(in.getName(), new Def<>(in, s.name()));
      } else if (def instanceof EnumTypeDefinition en) {
        enumNames.add(en.getName());
      }
    }
  }

  private void buildObject(ObjectTypeDefinition def, String source) {
    String declared = def.getName();
    SdlLocation loc = Directives.location(def, source);
    List<DirectiveSpec> specs = Directives.readAll(def.getDirectives(), Directives.Site.OBJECT, source, draft.errors);

    DirectiveSpec.Table table = null;
    DirectiveSpec.View view = null;
    DirectiveSpec.Args args = null;
    for (DirectiveSpec spec : specs) {
      if (spec instanceof DirectiveSpec.Table t) table = t;
      else if (spec instanceof DirectiveSpec.View v) view = v;
      else if (spec instanceof DirectiveSpec.Args a) args = a;
    }
    if (table == null && view == null) {
      // Not a data object.
      return;
    }
    if (table != null && view != null) {
      error(SchemaError.Code.INVALID_DEFINITION, "Type " + declared + " cannot be both @table and @view", loc);
      return;
    }
    if (args != null && view == null) {
      error(SchemaError.Code.WRONG_LOCATION, "@args is only allowed on @view types (" + declared + ")", loc);
      return;
    }
    if (draft.objects.containsKey(declared)) {
      error(SchemaError.Code.DUPLICATE_OBJECT, "Duplicate data object " + declared, loc);
      return;
    }

    ObjectKind kind = table != null ? ObjectKind.TABLE : (args != null ? ObjectKind.PARAMETERIZED_VIEW : ObjectKind.VIEW);
    DataObject.Builder b = DataObject.builder(info.prefixed(declared), info.name(), kind)
        .location(loc)
        .module(moduleOf(null))
        .description(def.getDescription() == null ? null : def.getDescription().getContent());
    ObjectDraft od = new ObjectDraft(declared, b, loc);

    if (table != null) {
      b.sourceName(table.name()).m2m(table.m2m());
      if (table.softDelete()) {
        if (table.softDeleteCond() == null || table.softDeleteSet() == null) {
          error(SchemaError.Code.MISSING_ARGUMENT,
              "@table(soft_delete: true) requires soft_delete_cond and soft_delete_set on " + declared, loc);
        } else {
          b.softDelete(new SoftDeleteSpec(table.softDeleteCond(), table.softDeleteSet()));
        }
      }
    } else {
      b.sourceName(view.name()).viewSql(view.sql());
    }
    if (args != null) pendingArgs.put(declared, new PendingArgs(args, source, loc));

    List<DirectiveSpec.Unique> objectUniques = new ArrayList<>();
    for (DirectiveSpec spec : specs) {
      if (spec instanceof DirectiveSpec.Named n) b.queryName(info.prefixed(n.name()));
      else if (spec instanceof DirectiveSpec.InModule m) b.module(moduleOf(m.name()));
      else if (spec instanceof DirectiveSpec.Cube) b.cube(true);
      else if (spec instanceof DirectiveSpec.Hypertable) b.hypertable(true);
      else if (spec instanceof DirectiveSpec.Cache c) b.cacheSpec(new CacheSpec(c.ttl(), c.key(), c.tags()));
      else if (spec instanceof DirectiveSpec.NoCache) b.noCache(true);
      else if (spec instanceof DirectiveSpec.InvalidateCache ic) b.invalidateTags(ic.tags());
      else if (spec instanceof DirectiveSpec.Unique u) objectUniques.add(u);
      else if (spec instanceof DirectiveSpec.References r) {
        draft.foreignKeys.add(new PendingFk(declared, r.sourceFields(), r.referencesName(), r.referencesFields(),
            r.query(), r.referencesQuery(), loc));
      }
    }

    for (FieldDefinition fd : def.getFieldDefinitions()) addField(od, fd, source);

    for (DirectiveSpec.Unique u : objectUniques) {
      if (u.fields().isEmpty()) {
        error(SchemaError.Code.MISSING_ARGUMENT, "Object level @unique requires 'fields' on " + declared, loc);
        continue;
      }
      for (String f : u.fields()) {
        if (!b.fields().containsKey(f)) {
          error(SchemaError.Code.INVALID_DEFINITION, "@unique references unknown field " + declared + "." + f, loc);
        }
      }
      b.unique(new UniqueConstraint(u.fields(), u.querySuffix(), u.skipQuery()));
    }

    if (b.fields().isEmpty()) {
      error(SchemaError.Code.INVALID_DEFINITION, "Data object " + declared + " declares no data fields", loc);
    }
    draft.objects.put(declared, od);
  }

  private void applyExtension(ObjectTypeExtensionDefinition ext, String source) {
    SdlLocation loc = Directives.location(ext, source);
    if (!ext.getDirectives().isEmpty()) {
      error(SchemaError.Code.WRONG_LOCATION, "Type extensions cannot carry object directives (" + ext.getName() + ")", loc);
    }
    ObjectDraft local = draft.objects.get(ext.getName());
    for (FieldDefinition fd : ext.getFieldDefinitions()) {
      if (local != null) {
        addField(local, fd, source);
        continue;
      }
      // Extension of an object owned by another data source: only query-time links are allowed.
      int before = draft.joins.size() + draft.calls.size();
      addLinkField(ext.getName(), fd, source);
      if (draft.joins.size() + draft.calls.size() == before) {
        error(SchemaError.Code.WRONG_LOCATION, "Field " + ext.getName() + "." + fd.getName()
            + " extends a type of another data source and needs @join, @function_call or @table_function_call_join",
            Directives.location(fd, source));
      }
    }
  }

  /** Records a @join / @function_call / @table_function_call_join field; returns false when the field has none. */
  private boolean addLinkField(String owner, FieldDefinition fd, String source) {
    SdlLocation loc = Directives.location(fd, source);
    TypeShape shape = TypeShape.of(fd.getType());
    List<DirectiveSpec> specs = Directives.readAll(fd.getDirectives(), Directives.Site.FIELD, source, draft.errors);
    String description = fd.getDescription() == null ? null : fd.getDescription().getContent();
    for (DirectiveSpec spec : specs) {
      if (spec instanceof DirectiveSpec.Join j) {
        if (j.sourceFields().isEmpty() && (j.sql() == null || j.sql().isBlank())) {
          error(SchemaError.Code.MISSING_ARGUMENT, "@join on " + owner + "." + fd.getName()
              + " needs source_fields/references_fields or sql", loc);
          return true;
        }
        draft.joins.add(new PendingJoin(owner, fd.getName(), shape.list(), j.referencesName(), j.sourceFields(),
            j.referencesFields(), j.sql(), loc));
        return true;
      }
      if (spec instanceof DirectiveSpec.FunctionCall fc) {
        draft.calls.add(new PendingCall(owner, fd.getName(), scalarOrNull(shape), shape.list(), fc.referencesName(),
            fc.args(), List.of(), List.of(), fc.module(), description, loc));
        return true;
      }
      if (spec instanceof DirectiveSpec.TableFunctionCallJoin tj) {
        draft.calls.add(new PendingCall(owner, fd.getName(), null, shape.list(), tj.referencesName(), tj.args(),
            tj.sourceFields(), tj.referencesFields(), tj.module(), description, loc));
        return true;
      }
    }
    return false;
  }

  private void addField(ObjectDraft od, FieldDefinition fd, String source) {
    SdlLocation loc = Directives.location(fd, source);
    String name = fd.getName();
    if (od.builder.fields().containsKey(name)) {
      error(SchemaError.Code.INVALID_DEFINITION, "Duplicate field " + od.declaredName + "." + name, loc);
      return;
    }
    TypeShape shape = TypeShape.of(fd.getType());
    boolean hasLink = fd.getDirectives().stream().anyMatch(d ->
        d.getName().equals("join") || d.getName().equals("function_call") || d.getName().equals("table_function_call_join"));
    if (hasLink) {
      addLinkField(od.declaredName, fd, source);
      return;
    }

    ScalarType scalar = scalarOrNull(shape) == null ? null : scalarOrNull(shape).scalar();
    if (scalar == null) {
      String why = objectTypeNames.contains(shape.name())
          ? "field of object type needs @join, @function_call or @table_function_call_join"
          : "unknown type " + shape.name();
      error(SchemaError.Code.INVALID_DEFINITION, od.declaredName + "." + name + ": " + why, loc);
      return;
    }

    Field.Builder fb = Field.builder(name, new FieldType(scalar, shape.list(), shape.nonNull()))
        .description(fd.getDescription() == null ? null : fd.getDescription().getContent());
    List<DirectiveSpec> specs = Directives.readAll(fd.getDirectives(), Directives.Site.FIELD, source, draft.errors);
    for (DirectiveSpec spec : specs) {
      if (spec instanceof DirectiveSpec.Pk) fb.primaryKey(true);
      else if (spec instanceof DirectiveSpec.Unique u) {
        if (!u.fields().isEmpty()) {
          error(SchemaError.Code.INVALID_DEFINITION, "Field level @unique takes no 'fields' (" + od.declaredName + "." + name + ")", loc);
        } else {
          od.builder.unique(new UniqueConstraint(List.of(name), u.querySuffix(), u.skipQuery()));
        }
      }
      else if (spec instanceof DirectiveSpec.Sql s) fb.sqlExpression(s.expression());
      else if (spec instanceof DirectiveSpec.Default d) {
        fb.defaultSpec(new DefaultSpec(d.value(), d.sequence(), d.insertExp(), d.updateExp()));
      }
      else if (spec instanceof DirectiveSpec.FieldSource fs) fb.sourceField(fs.field());
      else if (spec instanceof DirectiveSpec.GeometryInfo gi) {
        if (scalar != ScalarType.GEOMETRY) {
          error(SchemaError.Code.WRONG_LOCATION, "@geometry_info requires a Geometry field (" + od.declaredName + "." + name + ")", loc);
        }
        fb.geometryInfo(new GeometryInfo(gi.type(), gi.srid()));
      }
      else if (spec instanceof DirectiveSpec.FilterRequired) fb.filterRequired(true);
      else if (spec instanceof DirectiveSpec.Dim dim) fb.dimension(dim.length());
      else if (spec instanceof DirectiveSpec.Embeddings e) {
        fb.embeddings(new EmbeddingsSpec(e.model(), e.vector(), e.distance(), e.length()));
      }
      else if (spec instanceof DirectiveSpec.TimescaleKey) {
        if (!scalar.isDateLike()) {
          error(SchemaError.Code.WRONG_LOCATION, "@timescale_key requires a Timestamp or Date field (" + od.declaredName + "." + name + ")", loc);
        }
        fb.timescaleKey(true);
      }
      else if (spec instanceof DirectiveSpec.Measurement) {
        if (scalar.family() != ScalarType.Family.NUMERIC && !scalar.isDateLike()) {
          error(SchemaError.Code.WRONG_LOCATION, "@measurement requires a numeric or date field (" + od.declaredName + "." + name + ")", loc);
        }
        fb.measurement(true);
      }
      else if (spec instanceof DirectiveSpec.FieldReferences fr) {
        draft.foreignKeys.add(new PendingFk(od.declaredName, List.of(name), fr.referencesName(),
            fr.field() == null ? List.of() : List.of(fr.field()), fr.query(), fr.referencesQuery(), loc));
      }
      else {
        error(SchemaError.Code.WRONG_LOCATION, "Directive not applicable to data field " + od.declaredName + "." + name, loc);
      }
    }
    try {
      od.builder.field(fb.build());
    } catch (IllegalArgumentException e) {
      error(SchemaError.Code.INVALID_DEFINITION, e.getMessage(), loc);
    }
  }

  private void buildFunction(FieldDefinition fd, String source) {
    SdlLocation loc = Directives.location(fd, source);
    List<DirectiveSpec> specs = Directives.readAll(fd.getDirectives(), Directives.Site.FIELD, source, draft.errors);
    DirectiveSpec.Function fn = null;
    for (DirectiveSpec spec : specs) {
      if (spec instanceof DirectiveSpec.Function f) fn = f;
    }
    if (fn == null) {
      error(SchemaError.Code.MISSING_ARGUMENT, "Function field " + fd.getName() + " needs @function", loc);
      return;
    }
    List<ArgDef> args = new ArrayList<>();
    for (InputValueDefinition iv : fd.getInputValueDefinitions()) {
      ArgDef a = argDef(iv, source);
      if (a != null) args.add(a);
    }
    String sql = fn.sql();
    if (sql == null || sql.isBlank()) {
      List<String> refs = args.stream().map(a -> "[$" + a.name() + "]").toList();
      sql = fn.name() + "(" + String.join(", ", refs) + ")";
    }
    TypeShape shape = TypeShape.of(fd.getType());
    FieldType scalar = scalarOrNull(shape);
    if (fn.isTable() && scalar != null) {
      error(SchemaError.Code.INVALID_DEFINITION, "Table function " + fd.getName() + " must return a data object type", loc);
      return;
    }
    if (scalar == null && !objectTypeNames.contains(shape.name())) {
      error(SchemaError.Code.INVALID_DEFINITION, "Function " + fd.getName() + " returns unknown type " + shape.name(), loc);
      return;
    }
    draft.functions.add(new FunctionDraft(info.prefixed(fd.getName()), moduleOf(null), sql, args, scalar,
        scalar == null ? shape.name() : null, shape.list(), fn.skipNullArg(),
        fd.getDescription() == null ? null : fd.getDescription().getContent(), loc));
  }

  private void resolveArgs() {
    for (var e : pendingArgs.entrySet()) {
      ObjectDraft od = draft.objects.get(e.getKey());
      if (od == null) continue;
      PendingArgs pa = e.getValue();
      Def<InputObjectTypeDefinition> input = inputDefs.get(pa.spec().name());
      if (input == null) {
        error(SchemaError.Code.UNRESOLVED_REFERENCE, "Unknown args input type " + pa.spec().name()
            + " for view " + e.getKey(), pa.location());
        continue;
      }
      List<ArgDef> args = new ArrayList<>();
      for (InputValueDefinition iv : input.node().getInputValueDefinitions()) {
        ArgDef a = argDef(iv, input.source());
        if (a != null) args.add(a);
      }
      od.builder.args(new ArgsSpec(info.prefixed(pa.spec().name()), pa.spec().required(), args));
    }
  }

  private ArgDef argDef(InputValueDefinition iv, String source) {
    FieldType t = scalarOrNull(TypeShape.of(iv.getType()));
    if (t == null) {
      error(SchemaError.Code.INVALID_DEFINITION, "Argument " + iv.getName() + " must have a scalar type",
          Directives.location(iv, source));
      return null;
    }
    Object dflt = iv.getDefaultValue() == null ? null : SdlValues.toJava(iv.getDefaultValue());
    return new ArgDef(iv.getName(), t, dflt);
  }

  private FieldType scalarOrNull(TypeShape shape) {
    Optional<ScalarType> s = ScalarType.byGraphqlName(shape.name());
    if (s.isEmpty() && enumNames.contains(shape.name())) s = Optional.of(ScalarType.STRING);
    return s.map(st -> new FieldType(st, shape.list(), shape.nonNull())).orElse(null);
  }

  private String moduleOf(String declaredModule) {
    String base = info.asModule() ? info.name() : "";
    if (declaredModule == null || declaredModule.isBlank()) return base;
    return base.isEmpty() ? declaredModule : base + "." + declaredModule;
  }

  private void error(SchemaError.Code code, String message, SdlLocation loc) {
    draft.errors.add(new SchemaError(code, message, loc));
  }

  /** Named type with list/non-null wrappers flattened. */
  record TypeShape(String name, boolean list, boolean nonNull) {
    static TypeShape of(Type<?> type) {
      boolean nonNull = type instanceof NonNullType;
      boolean list = false;
      Type<?> t = type;
      while (!(t instanceof TypeName)) {
        if (t instanceof NonNullType nn) t = nn.getType();
        else if (t instanceof ListType lt) {
          list = true;
          t = lt.getType();
        } else {
          throw new IllegalStateException("Unexpected type node " + t);
        }
      }
      return new TypeShape(((TypeName) t).getName(), list, nonNull);
    }
  }
}
