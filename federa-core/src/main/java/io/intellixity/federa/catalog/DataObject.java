package io.intellixity.federa.catalog;

import java.util.*;

/**
 * Table, view or parameterized view exposed by one data source. Immutable once built.
 */
public final class DataObject {
  private final int id;
  private final String name;
  private final String queryName;
  private final String module;
  private final String dataSource;
  private final ObjectKind kind;
  private final String sourceName;
  private final String viewSql;
  private final LinkedHashMap<String, Field> fields;
  private final List<String> primaryKey;
  private final List<UniqueConstraint> uniqueConstraints;
  private final SoftDeleteSpec softDelete;
  private final boolean cube;
  private final boolean hypertable;
  private final CacheSpec cacheSpec;
  private final boolean noCache;
  private final List<String> invalidateTags;
  private final boolean m2m;
  private final ArgsSpec args;
  private final String description;
  private final SdlLocation location;

  private DataObject(Builder b, int id) {
    this.id = id;
    this.name = Objects.requireNonNull(b.name, "name");
    this.queryName = b.queryName == null ? b.name : b.queryName;
    this.module = b.module == null ? "" : b.module;
    this.dataSource = Objects.requireNonNull(b.dataSource, "dataSource");
    this.kind = Objects.requireNonNull(b.kind, "kind");
    this.sourceName = b.sourceName == null ? b.name : b.sourceName;
    this.viewSql = b.viewSql;
    this.fields = new LinkedHashMap<>(b.fields);
    List<String> pk = new ArrayList<>();
    for (Field f : fields.values()) if (f.primaryKey()) pk.add(f.name());
    this.primaryKey = List.copyOf(pk);
    this.uniqueConstraints = List.copyOf(b.uniqueConstraints);
    this.softDelete = b.softDelete;
    this.cube = b.cube;
    this.hypertable = b.hypertable;
    this.cacheSpec = b.cacheSpec;
    this.noCache = b.noCache;
    this.invalidateTags = List.copyOf(b.invalidateTags);
    this.m2m = b.m2m;
    this.args = b.args;
    this.description = b.description;
    this.location = b.location == null ? SdlLocation.UNKNOWN : b.location;
    if (kind == ObjectKind.PARAMETERIZED_VIEW && args == null) {
      throw new IllegalArgumentException("parameterized view " + name + " has no args");
    }
  }

  public static Builder builder(String name, String dataSource, ObjectKind kind) {
    return new Builder(name, dataSource, kind);
  }

  public int id() { return id; }
  /** Object name with the data source prefix applied. */
  public String name() { return name; }

  /** GraphQL type name: the name qualified by the module path, unique across the catalog. */
  public String typeName() {
    return module.isEmpty() ? name : module.replace('.', '_') + "_" + name;
  }
  /** Base name of the generated query fields. */
  public String queryName() { return queryName; }
  public String module() { return module; }
  public String dataSource() { return dataSource; }
  public ObjectKind kind() { return kind; }
  public String sourceName() { return sourceName; }
  /** SQL body of a view declared with {@code @view(sql: ...)}; {@code null} for named tables and views. */
  public String viewSql() { return viewSql; }
  public List<String> primaryKey() { return primaryKey; }
  public List<UniqueConstraint> uniqueConstraints() { return uniqueConstraints; }
  public SoftDeleteSpec softDelete() { return softDelete; }
  public boolean cube() { return cube; }
  public boolean hypertable() { return hypertable; }
  public CacheSpec cacheSpec() { return cacheSpec; }
  public boolean noCache() { return noCache; }
  /** Extra cache tags purged whenever the object is mutated. */
  public List<String> invalidateTags() { return invalidateTags; }
  public boolean m2m() { return m2m; }
  public ArgsSpec args() { return args; }
  public String description() { return description; }
  public SdlLocation location() { return location; }

  public Collection<Field> fields() { return Collections.unmodifiableCollection(fields.values()); }

  public Field field(String fieldName) { return fields.get(fieldName); }

  public boolean hasField(String fieldName) { return fields.containsKey(fieldName); }

  public boolean isTable() { return kind == ObjectKind.TABLE; }

  public boolean hasGeometry() {
    for (Field f : fields.values()) {
      if (f.scalar() == ScalarType.GEOMETRY) return true;
    }
    return false;
  }

  public Field timescaleKey() {
    for (Field f : fields.values()) {
      if (f.timescaleKey()) return f;
    }
    return null;
  }

  public String qualifiedName() {
    return module.isEmpty() ? queryName : module + "." + queryName;
  }

  public Builder toBuilder() {
    Builder b = new Builder(name, dataSource, kind);
    b.queryName = queryName;
    b.module = module;
    b.sourceName = sourceName;
    b.viewSql = viewSql;
    b.fields.putAll(fields);
    b.uniqueConstraints.addAll(uniqueConstraints);
    b.softDelete = softDelete;
    b.cube = cube;
    b.hypertable = hypertable;
    b.cacheSpec = cacheSpec;
    b.noCache = noCache;
    b.invalidateTags.addAll(invalidateTags);
    b.m2m = m2m;
    b.args = args;
    b.description = description;
    b.location = location;
    return b;
  }

  @Override
  public String toString() { return "DataObject(" + qualifiedName() + "#" + id + ")"; }

  public static final class Builder {
    private final String name;
    private final String dataSource;
    private final ObjectKind kind;
    private String queryName;
    private String module;
    private String sourceName;
    private String viewSql;
    private final LinkedHashMap<String, Field> fields = new LinkedHashMap<>();
    private final List<UniqueConstraint> uniqueConstraints = new ArrayList<>();
    private SoftDeleteSpec softDelete;
    private boolean cube;
    private boolean hypertable;
    private CacheSpec cacheSpec;
    private boolean noCache;
    private final List<String> invalidateTags = new ArrayList<>();
    private boolean m2m;
    private ArgsSpec args;
    private String description;
    private SdlLocation location;

    private Builder(String name, String dataSource, ObjectKind kind) {
      this.name = name;
      this.dataSource = dataSource;
      this.kind = kind;
    }

    public String name() { return name; }
    public ObjectKind kind() { return kind; }
    public Map<String, Field> fields() { return fields; }

    public Builder queryName(String v) { this.queryName = v; return this; }
    public Builder module(String v) { this.module = v; return this; }
    public Builder sourceName(String v) { this.sourceName = v; return this; }
    public Builder viewSql(String v) { this.viewSql = v; return this; }
    public Builder softDelete(SoftDeleteSpec v) { this.softDelete = v; return this; }
    public Builder cube(boolean v) { this.cube = v; return this; }
    public Builder hypertable(boolean v) { this.hypertable = v; return this; }
    public Builder cacheSpec(CacheSpec v) { this.cacheSpec = v; return this; }
    public Builder noCache(boolean v) { this.noCache = v; return this; }
    public Builder invalidateTags(List<String> v) { this.invalidateTags.addAll(v); return this; }
    public Builder m2m(boolean v) { this.m2m = v; return this; }
    public Builder args(ArgsSpec v) { this.args = v; return this; }
    public Builder description(String v) { this.description = v; return this; }
    public Builder location(SdlLocation v) { this.location = v; return this; }

    public Builder field(Field f) {
      fields.put(f.name(), f);
      return this;
    }

    public Builder unique(UniqueConstraint u) {
      uniqueConstraints.add(u);
      return this;
    }

    public DataObject build(int id) {
      return new DataObject(this, id);
    }
  }
}
