package io.intellixity.federa.catalog;

import java.util.*;

/** Node of the module tree. The root module has the empty path. */
public final class Module {
  private final String path;
  private final Map<String, Module> children = new LinkedHashMap<>();
  private final List<Integer> objectIds = new ArrayList<>();
  private final List<String> functions = new ArrayList<>();

  Module(String path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  public String path() { return path; }

  /** Last path segment; empty for the root. */
  public String name() {
    int i = path.lastIndexOf('.');
    return i < 0 ? path : path.substring(i + 1);
  }

  public boolean isRoot() { return path.isEmpty(); }

  public Collection<Module> children() { return Collections.unmodifiableCollection(children.values()); }

  public Module child(String name) { return children.get(name); }

  public List<Integer> objectIds() { return Collections.unmodifiableList(objectIds); }

  public List<String> functions() { return Collections.unmodifiableList(functions); }

  /** Type-name fragment for generated module types, e.g. {@code sales_crm}. */
  public String typeFragment() { return path.replace('.', '_'); }

  Module childOrCreate(String name) {
    return children.computeIfAbsent(name, n -> new Module(path.isEmpty() ? n : path + "." + n));
  }

  void addObject(int id) { objectIds.add(id); }

  void addFunction(String name) { functions.add(name); }

  @Override
  public String toString() { return "Module(" + (path.isEmpty() ? "<root>" : path) + ")"; }
}
