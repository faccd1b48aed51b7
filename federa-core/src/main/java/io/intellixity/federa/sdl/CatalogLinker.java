package io.intellixity.federa.sdl;

import io.intellixity.federa.catalog.*;
import io.intellixity.federa.sdl.SourceDraft.*;

import java.util.*;

/**
 * Second pass: resolves references of every parsed data source against the full object set and
 * assembles the {@link Catalog}.
 * <p>
 * One linker run is one attempt. Errors are attributed to the data source that declared the failing
 * reference so {@link CatalogLoader} can drop that source and link the rest again.
 */
final class CatalogLinker {
  private final List<SourceDraft> drafts;

  private final List<Slot> slots = new ArrayList<>();
  private final Map<String, Map<String, Integer>> byDeclared = new HashMap<>();
  private final Map<String, List<FunctionDef>> functionsByName = new LinkedHashMap<>();
  private final Map<String, List<SchemaError>> errors = new LinkedHashMap<>();
  private final Map<Integer, Set<String>> memberNames = new HashMap<>();
  private Catalog.Builder catalog;

  private record Slot(SourceDraft source, ObjectDraft draft, DataObject.Builder builder) {}

  record Attempt(Catalog catalog, Map<String, List<SchemaError>> errors) {
    boolean ok() { return errors.isEmpty(); }
  }

  private record ResolvedFk(PendingFk fk, SourceDraft source, int owner, int target,
                            List<String> sourceFields, List<String> targetFields) {}

  CatalogLinker(List<SourceDraft> drafts) {
    this.drafts = List.copyOf(drafts);
  }

  Attempt link() {
    assignIds();
    linkFunctions();
    linkCalls();

    catalog = Catalog.builder();
    for (SourceDraft d : drafts) catalog.dataSource(d.info);
    for (Slot s : slots) catalog.object(s.builder());
    for (int id = 0; id < slots.size(); id++) {
      Set<String> names = new HashSet<>();
      for (Field f : catalog.object(id).fields()) names.add(f.name());
      memberNames.put(id, names);
    }

    linkForeignKeys();
    linkJoins();

    if (!errors.isEmpty()) return new Attempt(null, errors);
    for (List<FunctionDef> fs : functionsByName.values()) fs.forEach(catalog::function);
    return new Attempt(catalog.build(), Map.of());
  }

  // ---------- objects

  private void assignIds() {
    Map<String, String> typeOwners = new HashMap<>();
    Map<String, String> queryOwners = new HashMap<>();
    for (SourceDraft d : drafts) {
      Map<String, Integer> local = new HashMap<>();
      byDeclared.put(d.name(), local);
      for (ObjectDraft od : d.objects.values()) {
        int id = slots.size();
        DataObject built = od.builder.build(id);
        DataObject.Builder copy = built.toBuilder();
        String typeOwner = typeOwners.putIfAbsent(built.typeName(), d.name());
        String queryOwner = queryOwners.putIfAbsent(built.module() + "|" + built.queryName(), d.name());
        if (typeOwner != null || queryOwner != null) {
          String other = typeOwner != null ? typeOwner : queryOwner;
          error(d, SchemaError.Code.NAME_COLLISION, "Object " + od.declaredName + " of data source '" + d.name()
              + "' collides with an object of data source '" + other + "' (" + built.qualifiedName()
              + "); set a prefix or as_module", od.location);
        }
        local.put(od.declaredName, id);
        slots.add(new Slot(d, od, copy));
      }
    }
  }

  private Integer local(SourceDraft source, String name) {
    return byDeclared.getOrDefault(source.name(), Map.of()).get(name);
  }

  /** Object of any data source, by declared, prefixed or GraphQL type name. Own source wins. */
  private Integer global(SourceDraft source, String name) {
    Integer own = local(source, name);
    if (own != null) return own;
    for (int id = 0; id < slots.size(); id++) {
      Slot s = slots.get(id);
      if (s.source() == source) continue;
      DataObject.Builder b = s.builder();
      if (s.draft().declaredName.equals(name) || b.name().equals(name) || typeName(s).equals(name)) return id;
    }
    return null;
  }

  private String typeName(Slot s) {
    return s.builder().build(-1).typeName();
  }

  // ---------- functions

  private void linkFunctions() {
    for (SourceDraft d : drafts) {
      for (FunctionDraft fd : d.functions) {
        Integer returnObject = null;
        if (fd.returnTypeName() != null) {
          returnObject = global(d, fd.returnTypeName());
          if (returnObject == null) {
            error(d, SchemaError.Code.UNRESOLVED_REFERENCE, "Function " + fd.name() + " returns unknown data object "
                + fd.returnTypeName(), fd.location());
            continue;
          }
        }
        FunctionDef def = new FunctionDef(fd.name(), fd.module(), d.name(), fd.sql(), fd.arguments(),
            fd.returnScalar(), returnObject, fd.returnsList(), fd.skipNullArgs(), fd.description());
        functionsByName.computeIfAbsent(fd.name(), k -> new ArrayList<>()).add(def);
      }
    }
  }

  private FunctionDef findFunction(SourceDraft source, String name, String module) {
    List<FunctionDef> candidates = new ArrayList<>();
    candidates.addAll(functionsByName.getOrDefault(name, List.of()));
    String prefixed = source.info.prefixed(name);
    if (!prefixed.equals(name)) candidates.addAll(functionsByName.getOrDefault(prefixed, List.of()));
    FunctionDef fallback = null;
    for (FunctionDef f : candidates) {
      if (module != null && !module.isBlank() && !f.module().equals(module)) continue;
      if (f.dataSource().equals(source.name())) return f;
      if (fallback == null) fallback = f;
    }
    return fallback;
  }

  private void linkCalls() {
    for (SourceDraft d : drafts) {
      for (PendingCall call : d.calls) {
        Integer owner = global(d, call.owner());
        if (owner == null) {
          error(d, SchemaError.Code.UNRESOLVED_REFERENCE, "Unknown data object " + call.owner(), call.location());
          continue;
        }
        FunctionDef fn = findFunction(d, call.referencesName(), call.module());
        if (fn == null) {
          error(d, SchemaError.Code.UNRESOLVED_REFERENCE, "Unknown function " + call.referencesName()
              + " called by " + call.owner() + "." + call.fieldName(), call.location());
          continue;
        }
        DataObject.Builder ob = slots.get(owner).builder();
        if (!checkCall(d, call, fn, ob)) continue;
        if (ob.fields().containsKey(call.fieldName())) {
          error(d, SchemaError.Code.NAME_COLLISION, "Field " + call.owner() + "." + call.fieldName()
              + " is already defined", call.location());
          continue;
        }
        FunctionCall binding = new FunctionCall(fn.name(), fn.module(), call.args(), call.sourceFields(),
            call.referencesFields());
        FieldType type = call.scalarType();
        if (type == null && fn.returnScalar() != null) type = fn.returnScalar();
        if (type != null && fn.returnsTable()) type = null;
        ob.field(Field.builder(call.fieldName(), type).functionCall(binding).description(call.description()).build());
      }
    }
  }

  private boolean checkCall(SourceDraft d, PendingCall call, FunctionDef fn, DataObject.Builder owner) {
    String where = call.owner() + "." + call.fieldName();
    for (String arg : call.args().keySet()) {
      if (fn.argument(arg) == null) {
        error(d, SchemaError.Code.UNRESOLVED_REFERENCE, "Function " + fn.name() + " has no argument '" + arg
            + "' (" + where + ")", call.location());
        return false;
      }
    }
    if (call.tableJoin()) {
      if (!fn.returnsTable()) {
        error(d, SchemaError.Code.INVALID_DEFINITION, "@table_function_call_join needs a table function: " + fn.name(),
            call.location());
        return false;
      }
      if (call.sourceFields().size() != call.referencesFields().size()) {
        error(d, SchemaError.Code.INVALID_CARDINALITY, "source_fields and references_fields differ in size on " + where,
            call.location());
        return false;
      }
      DataObject.Builder target = slots.get(fn.returnObject()).builder();
      for (String f : call.sourceFields()) {
        if (!owner.fields().containsKey(f)) {
          error(d, SchemaError.Code.UNRESOLVED_REFERENCE, "Unknown source field " + f + " on " + where, call.location());
          return false;
        }
      }
      for (String f : call.referencesFields()) {
        if (!target.fields().containsKey(f)) {
          error(d, SchemaError.Code.UNRESOLVED_REFERENCE, "Unknown field " + f + " of " + target.name() + " on " + where,
              call.location());
          return false;
        }
      }
      return true;
    }
    if (call.scalarType() != null && fn.returnsTable()) {
      error(d, SchemaError.Code.INVALID_DEFINITION, "Scalar field " + where + " calls table function " + fn.name(),
          call.location());
      return false;
    }
    if (call.scalarType() == null && !fn.returnsTable()) {
      error(d, SchemaError.Code.INVALID_DEFINITION, "Object field " + where + " calls scalar function " + fn.name(),
          call.location());
      return false;
    }
    return true;
  }

  // ---------- foreign keys

  private void linkForeignKeys() {
    Map<Integer, List<ResolvedFk>> junctions = new LinkedHashMap<>();
    for (SourceDraft d : drafts) {
      for (PendingFk fk : d.foreignKeys) {
        ResolvedFk r = resolve(d, fk);
        if (r == null) continue;
        if (catalog.object(r.owner()).m2m()) {
          junctions.computeIfAbsent(r.owner(), k -> new ArrayList<>()).add(r);
        }
        addForeignKey(r);
      }
    }
    for (var e : junctions.entrySet()) addManyToMany(e.getKey(), e.getValue());
    for (SourceDraft d : drafts) {
      for (ObjectDraft od : d.objects.values()) {
        int id = local(d, od.declaredName);
        if (catalog.object(id).m2m() && !junctions.containsKey(id)) {
          error(d, SchemaError.Code.INVALID_DEFINITION, "Many-to-many table " + od.declaredName
              + " declares no foreign keys", od.location);
        }
      }
    }
  }

  private ResolvedFk resolve(SourceDraft d, PendingFk fk) {
    int owner = local(d, fk.owner());
    Integer target = local(d, fk.referencesName());
    if (target == null) {
      if (global(d, fk.referencesName()) != null) {
        error(d, SchemaError.Code.CROSS_SOURCE_RELATION, "Foreign key " + fk.owner() + " -> " + fk.referencesName()
            + " crosses data sources; use @join instead", fk.location());
      } else {
        error(d, SchemaError.Code.UNRESOLVED_REFERENCE, "Unknown referenced object " + fk.referencesName()
            + " on " + fk.owner(), fk.location());
      }
      return null;
    }
    DataObject src = catalog.object(owner);
    DataObject tgt = catalog.object(target);
    List<String> targetFields = fk.referencesFields().isEmpty() ? tgt.primaryKey() : fk.referencesFields();
    if (targetFields.isEmpty()) {
      error(d, SchemaError.Code.INVALID_CARDINALITY, "Referenced object " + fk.referencesName()
          + " has no primary key and no references_fields were given", fk.location());
      return null;
    }
    if (targetFields.size() != fk.sourceFields().size()) {
      error(d, SchemaError.Code.INVALID_CARDINALITY, "Foreign key " + fk.owner() + fk.sourceFields() + " -> "
          + fk.referencesName() + targetFields + " has mismatched arity", fk.location());
      return null;
    }
    for (int i = 0; i < targetFields.size(); i++) {
      Field sf = src.field(fk.sourceFields().get(i));
      Field tf = tgt.field(targetFields.get(i));
      if (sf == null || tf == null) {
        String missing = sf == null ? fk.owner() + "." + fk.sourceFields().get(i) : fk.referencesName() + "." + targetFields.get(i);
        error(d, SchemaError.Code.UNRESOLVED_REFERENCE, "Unknown foreign key field " + missing, fk.location());
        return null;
      }
      if (sf.scalar() == null || tf.scalar() == null || sf.scalar().family() != tf.scalar().family()) {
        error(d, SchemaError.Code.INVALID_CARDINALITY, "Foreign key field " + fk.owner() + "." + sf.name() + " ("
            + sf.type() + ") does not match " + fk.referencesName() + "." + tf.name() + " (" + tf.type() + ")",
            fk.location());
        return null;
      }
    }
    return new ResolvedFk(fk, d, owner, target, fk.sourceFields(), targetFields);
  }

  private void addForeignKey(ResolvedFk r) {
    DataObject src = catalog.object(r.owner());
    DataObject tgt = catalog.object(r.target());
    PendingFk fk = r.fk();
    boolean unique = isUnique(src, r.sourceFields());
    Cardinality forward = unique ? Cardinality.ONE_TO_ONE : Cardinality.MANY_TO_ONE;
    String forwardName = blank(fk.query()) ? tgt.queryName() : fk.query();
    String inverseName = blank(fk.referencesQuery()) ? src.queryName() : fk.referencesQuery();

    if (!claim(r.source(), r.owner(), forwardName, fk.location())) return;
    catalog.relation(new Relation(0, forwardName, r.owner(), r.target(), r.sourceFields(), r.targetFields(), forward,
        inverseName, null, Relation.NO_JUNCTION, null, null, false, fk.location()));
    if (src.m2m()) return;
    if (!claim(r.source(), r.target(), inverseName, fk.location())) return;
    catalog.relation(new Relation(0, inverseName, r.target(), r.owner(), r.targetFields(), r.sourceFields(),
        forward.inverse(), forwardName, null, Relation.NO_JUNCTION, null, null, false, fk.location()));
  }

  private void addManyToMany(int junctionId, List<ResolvedFk> fks) {
    ResolvedFk first = fks.get(0);
    DataObject junction = catalog.object(junctionId);
    if (fks.size() != 2) {
      error(first.source(), SchemaError.Code.INVALID_DEFINITION, "Many-to-many table " + junction.name()
          + " must declare exactly two foreign keys, found " + fks.size(), junction.location());
      return;
    }
    ResolvedFk a = fks.get(0);
    ResolvedFk b = fks.get(1);
    Set<String> keyUnion = new HashSet<>(a.sourceFields());
    keyUnion.addAll(b.sourceFields());
    if (!keyUnion.equals(new HashSet<>(junction.primaryKey()))) {
      error(first.source(), SchemaError.Code.INVALID_DEFINITION, "Primary key of many-to-many table " + junction.name()
          + " must be exactly " + keyUnion, junction.location());
      return;
    }
    linkThrough(junctionId, a, b);
    linkThrough(junctionId, b, a);
  }

  /** Adds the relation from {@code from.target} to {@code to.target} through the junction. */
  private void linkThrough(int junctionId, ResolvedFk from, ResolvedFk to) {
    DataObject toObject = catalog.object(to.target());
    DataObject fromObject = catalog.object(from.target());
    String name = blank(from.fk().referencesQuery()) ? toObject.queryName() : from.fk().referencesQuery();
    String inverse = blank(to.fk().referencesQuery()) ? fromObject.queryName() : to.fk().referencesQuery();
    if (!claim(from.source(), from.target(), name, from.fk().location())) return;
    try {
      catalog.relation(new Relation(0, name, from.target(), to.target(), from.targetFields(), to.targetFields(),
          Cardinality.MANY_TO_MANY, inverse, null, junctionId, from.sourceFields(), to.sourceFields(), false,
          from.fk().location()));
    } catch (IllegalArgumentException e) {
      error(from.source(), SchemaError.Code.INVALID_CARDINALITY, e.getMessage(), from.fk().location());
    }
  }

  private static boolean isUnique(DataObject o, List<String> fields) {
    Set<String> set = new HashSet<>(fields);
    if (!o.primaryKey().isEmpty() && set.equals(new HashSet<>(o.primaryKey()))) return true;
    for (UniqueConstraint u : o.uniqueConstraints()) {
      if (set.equals(new HashSet<>(u.fields()))) return true;
    }
    return false;
  }

  // ---------- @join

  private void linkJoins() {
    for (SourceDraft d : drafts) {
      for (PendingJoin j : d.joins) {
        Integer owner = global(d, j.owner());
        if (owner == null) {
          error(d, SchemaError.Code.UNRESOLVED_REFERENCE, "Unknown data object " + j.owner(), j.location());
          continue;
        }
        Integer target = global(d, j.referencesName());
        if (target == null) {
          error(d, SchemaError.Code.UNRESOLVED_REFERENCE, "Unknown joined object " + j.referencesName() + " on "
              + j.owner() + "." + j.fieldName(), j.location());
          continue;
        }
        DataObject from = catalog.object(owner);
        DataObject to = catalog.object(target);
        if (j.sourceFields().size() != j.referencesFields().size()) {
          error(d, SchemaError.Code.INVALID_CARDINALITY, "@join on " + j.owner() + "." + j.fieldName()
              + " has mismatched source_fields/references_fields", j.location());
          continue;
        }
        boolean fieldsOk = true;
        for (int i = 0; i < j.sourceFields().size(); i++) {
          if (!from.hasField(j.sourceFields().get(i)) || !to.hasField(j.referencesFields().get(i))) {
            error(d, SchemaError.Code.UNRESOLVED_REFERENCE, "@join on " + j.owner() + "." + j.fieldName()
                + " references unknown fields", j.location());
            fieldsOk = false;
            break;
          }
        }
        if (!fieldsOk) continue;
        if (!claim(d, owner, j.fieldName(), j.location())) continue;
        Cardinality c = j.list() ? Cardinality.ONE_TO_MANY : Cardinality.MANY_TO_ONE;
        catalog.relation(new Relation(0, j.fieldName(), owner, target, j.sourceFields(), j.referencesFields(), c,
            null, blank(j.sql()) ? null : j.sql(), Relation.NO_JUNCTION, null, null,
            !from.dataSource().equals(to.dataSource()), j.location()));
      }
    }
  }

  // ---------- helpers

  private boolean claim(SourceDraft d, int objectId, String name, SdlLocation loc) {
    if (!memberNames.get(objectId).add(name)) {
      error(d, SchemaError.Code.NAME_COLLISION, "Relation field '" + name + "' collides with an existing member of "
          + catalog.object(objectId).name(), loc);
      return false;
    }
    return true;
  }

  private void error(SourceDraft d, SchemaError.Code code, String message, SdlLocation loc) {
    errors.computeIfAbsent(d.name(), k -> new ArrayList<>()).add(new SchemaError(code, message, loc));
  }

  private static boolean blank(String s) { return s == null || s.isBlank(); }
}
