package io.intellixity.federa.catalog;

import java.util.*;

/**
 * Arena of data objects, relations and functions of every loaded data source.
 * <p>
 * Objects and relations reference each other by integer id, so self-referencing and mutually
 * referencing objects need no special handling. A catalog never changes after {@link Builder#build()};
 * reloads build a new one.
 */
public final class Catalog {
  private final List<DataObject> objects;
  private final List<Relation> relations;
  private final Map<Integer, List<Relation>> relationsFrom;
  private final Map<String, DataSourceInfo> dataSources;
  private final Map<String, FunctionDef> functions;
  private final Map<String, DataObject> byQualifiedName;
  private final Map<String, DataObject> byTypeName;
  private final Module root;

  private Catalog(Builder b) {
    this.objects = List.copyOf(b.objects);
    this.relations = List.copyOf(b.relations);
    this.dataSources = Collections.unmodifiableMap(new LinkedHashMap<>(b.dataSources));
    this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(b.functions));

    Map<Integer, List<Relation>> from = new HashMap<>();
    for (Relation r : relations) from.computeIfAbsent(r.fromObject(), k -> new ArrayList<>()).add(r);
    from.replaceAll((k, v) -> List.copyOf(v));
    this.relationsFrom = Collections.unmodifiableMap(from);

    Map<String, DataObject> qn = new HashMap<>();
    Map<String, DataObject> tn = new HashMap<>();
    this.root = new Module("");
    for (DataObject o : objects) {
      qn.put(key(o.module(), o.queryName()), o);
      tn.put(o.typeName(), o);
      moduleOrCreate(o.module()).addObject(o.id());
    }
    for (FunctionDef f : functions.values()) moduleOrCreate(f.module()).addFunction(f.name());
    this.byQualifiedName = Collections.unmodifiableMap(qn);
    this.byTypeName = Collections.unmodifiableMap(tn);
  }

  public static Builder builder() { return new Builder(); }

  public static Catalog empty() { return new Builder().build(); }

  public List<DataObject> objects() { return objects; }

  public DataObject object(int id) {
    if (id < 0 || id >= objects.size()) throw new IllegalArgumentException("Unknown data object id: " + id);
    return objects.get(id);
  }

  /** Object by module path and query name, or {@code null}. */
  public DataObject findObject(String module, String name) {
    return byQualifiedName.get(key(module, name));
  }

  public DataObject resolveObject(String module, String name) {
    DataObject o = findObject(module, name);
    if (o == null) {
      throw new IllegalArgumentException("Unknown data object '" + name + "' in module '" + module + "'");
    }
    return o;
  }

  public DataObject objectByTypeName(String typeName) { return byTypeName.get(typeName); }

  public List<Relation> relations() { return relations; }

  public Relation relation(int id) {
    if (id < 0 || id >= relations.size()) throw new IllegalArgumentException("Unknown relation id: " + id);
    return relations.get(id);
  }

  /** Relation whose query field on {@code fromObject} is {@code name}, or {@code null}. */
  public Relation resolveRelation(int fromObject, String name) {
    for (Relation r : relationsFrom(fromObject)) {
      if (r.name().equals(name)) return r;
    }
    return null;
  }

  public List<Relation> relationsFrom(int objectId) {
    return relationsFrom.getOrDefault(objectId, List.of());
  }

  public Collection<Field> fieldsOf(int objectId) { return object(objectId).fields(); }

  public Collection<DataSourceInfo> dataSources() { return dataSources.values(); }

  public DataSourceInfo dataSource(String name) {
    DataSourceInfo ds = dataSources.get(name);
    if (ds == null) throw new IllegalArgumentException("Unknown data source: " + name);
    return ds;
  }

  public DataSourceInfo dataSourceOf(int objectId) { return dataSource(object(objectId).dataSource()); }

  public boolean supportsJoinPushdown(int objectId) {
    return dataSourceOf(objectId).capabilities().joinPushdown();
  }

  public boolean supportsAggregationPushdown(int objectId) {
    return dataSourceOf(objectId).capabilities().aggregationPushdown();
  }

  public boolean supportsSpatial(int objectId) {
    return dataSourceOf(objectId).capabilities().supportsSpatial();
  }

  public boolean isCube(int objectId) { return object(objectId).cube(); }

  public boolean isReadOnly(int objectId) { return dataSourceOf(objectId).readOnly(); }

  public FunctionDef function(String module, String name) { return functions.get(key(module, name)); }

  public Collection<FunctionDef> functions() { return functions.values(); }

  public Module rootModule() { return root; }

  public Module module(String path) {
    if (path == null || path.isEmpty()) return root;
    Module m = root;
    for (String part : path.split("\\.")) {
      m = m.child(part);
      if (m == null) return null;
    }
    return m;
  }

  private Module moduleOrCreate(String path) {
    Module m = root;
    if (path == null || path.isEmpty()) return m;
    for (String part : path.split("\\.")) m = m.childOrCreate(part);
    return m;
  }

  static String key(String module, String name) {
    return (module == null ? "" : module) + "|" + name;
  }

  public static final class Builder {
    private final List<DataObject> objects = new ArrayList<>();
    private final List<Relation> relations = new ArrayList<>();
    private final Map<String, DataSourceInfo> dataSources = new LinkedHashMap<>();
    private final Map<String, FunctionDef> functions = new LinkedHashMap<>();

    private Builder() {}

    public Builder dataSource(DataSourceInfo ds) {
      dataSources.put(ds.name(), ds);
      return this;
    }

    /** Adds the object and returns its arena id. */
    public int object(DataObject.Builder ob) {
      int id = objects.size();
      objects.add(ob.build(id));
      return id;
    }

    /** Adds the relation with the next arena id and returns that id. */
    public int relation(Relation r) {
      int id = relations.size();
      relations.add(r.withId(id));
      return id;
    }

    public Builder function(FunctionDef f) {
      functions.put(key(f.module(), f.name()), f);
      return this;
    }

    public int objectCount() { return objects.size(); }

    public DataObject object(int id) { return objects.get(id); }

    public Catalog build() { return new Catalog(this); }
  }
}
