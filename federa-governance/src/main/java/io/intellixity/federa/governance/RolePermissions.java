package io.intellixity.federa.governance;

import io.intellixity.federa.catalog.Catalog;
import io.intellixity.federa.catalog.DataObject;
import io.intellixity.federa.catalog.Field;
import io.intellixity.federa.config.PermissionDef;
import io.intellixity.federa.config.RoleDef;
import io.intellixity.federa.query.FilterParser;
import io.intellixity.federa.query.QueryElement;
import io.intellixity.federa.query.QueryFilters;
import io.intellixity.federa.query.Values;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiled permissions of one role.
 * <p>
 * Access to a field is decided by the most specific matching rule: exact type and field, then exact
 * type with {@code *}, then {@code *} with the exact field, then {@code *}/{@code *}. Fields without a
 * matching rule are allowed. Row filters and mutation data come from rules on the object's type name.
 */
public final class RolePermissions {
  static final String ANY = "*";

  static final RolePermissions UNRESTRICTED =
      new RolePermissions(new RoleDef("*", "unrestricted", false, List.of()));

  private record Access(boolean disabled, boolean hidden) {
    static final Access ALLOWED = new Access(false, false);
  }

  private final String role;
  private final boolean disabled;
  private final Map<String, PermissionDef> rules;
  private final Map<String, List<PermissionDef>> byType;
  private final Map<String, Access> accessCache = new ConcurrentHashMap<>();
  private final boolean usesClaims;

  RolePermissions(RoleDef def) {
    this.role = def.name();
    this.disabled = def.disabled();
    Map<String, PermissionDef> r = new LinkedHashMap<>();
    Map<String, List<PermissionDef>> t = new LinkedHashMap<>();
    boolean claims = false;
    for (PermissionDef p : def.permissions()) {
      r.put(key(p.typeName(), p.fieldName()), p);
      t.computeIfAbsent(p.typeName(), k -> new ArrayList<>()).add(p);
      claims |= AuthPlaceholders.containsPlaceholder(p.filter()) || AuthPlaceholders.containsPlaceholder(p.data());
    }
    this.usesClaims = claims;
    this.rules = Map.copyOf(r);
    this.byType = Map.copyOf(t);
  }

  public String role() { return role; }

  public boolean disabled() { return disabled; }

  /** Row filters or mutation data read auth claims, so results differ between callers of the role. */
  public boolean usesClaims() { return usesClaims; }

  /** Throws {@link AccessDeniedException} when the field of the GraphQL type is disabled. */
  public void checkField(String typeName, String fieldName, List<Object> path) {
    if (access(typeName, fieldName).disabled()) {
      throw new AccessDeniedException("Access to field '" + fieldName + "' of " + typeName
          + " is denied for role '" + role + "'", path);
    }
  }

  public boolean isDisabled(String typeName, String fieldName) {
    return access(typeName, fieldName).disabled();
  }

  /** Hidden fields may be queried but come back as null. */
  public boolean isHidden(String typeName, String fieldName) {
    return access(typeName, fieldName).hidden();
  }

  /** Whether any rule of this role hides something; lets callers skip redaction. */
  public boolean hidesAnything() {
    for (PermissionDef p : rules.values()) {
      if (p.hidden()) return true;
    }
    return false;
  }

  /**
   * Row filter ANDed to every read of {@code obj}, with auth placeholders substituted; {@code null}
   * when the role has none.
   */
  public QueryElement rowFilter(Catalog catalog, DataObject obj, AuthContext auth) {
    List<PermissionDef> own = byType.getOrDefault(obj.typeName(), List.of());
    List<QueryElement> parts = new ArrayList<>();
    FilterParser parser = null;
    for (PermissionDef p : own) {
      if (p.filter().isEmpty()) continue;
      if (parser == null) parser = new FilterParser(catalog);
      Map<String, Object> resolved = AuthPlaceholders.substituteAll(p.filter(), auth);
      parts.add(parser.parse(obj.id(), resolved, List.of()));
    }
    if (parts.isEmpty()) return null;
    return parts.size() == 1 ? parts.get(0) : QueryFilters.and(parts.toArray(new QueryElement[0]));
  }

  /**
   * Values forced on insert and update of {@code obj}, coerced to the field types. Later rules of the
   * role override earlier ones.
   */
  public Map<String, Object> mutationData(DataObject obj, AuthContext auth) {
    List<PermissionDef> own = byType.getOrDefault(obj.typeName(), List.of());
    Map<String, Object> out = new LinkedHashMap<>();
    for (PermissionDef p : own) {
      if (p.data().isEmpty()) continue;
      for (Map.Entry<String, Object> e : AuthPlaceholders.substituteAll(p.data(), auth).entrySet()) {
        Field f = obj.field(e.getKey());
        if (f == null || f.calculated() || f.isFunctionCall()) {
          throw new IllegalStateException("Role '" + role + "' sets unknown or read-only field '"
              + e.getKey() + "' of " + obj.name());
        }
        out.put(f.name(), e.getValue() == null ? null : Values.coerce(f.type(), e.getValue()));
      }
    }
    return out;
  }

  private Access access(String typeName, String fieldName) {
    if (rules.isEmpty()) return Access.ALLOWED;
    return accessCache.computeIfAbsent(key(typeName, fieldName), k -> resolve(typeName, fieldName));
  }

  private Access resolve(String typeName, String fieldName) {
    for (String k : List.of(key(typeName, fieldName), key(typeName, ANY), key(ANY, fieldName), key(ANY, ANY))) {
      PermissionDef p = rules.get(k);
      if (p != null) return new Access(p.disabled(), p.hidden());
    }
    return Access.ALLOWED;
  }

  private static String key(String typeName, String fieldName) {
    return typeName + "." + fieldName;
  }
}
