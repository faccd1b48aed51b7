package io.intellixity.federa.governance;

import io.intellixity.federa.config.RoleDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Role based access rules of one catalog snapshot.
 * <p>
 * A policy without roles is open: every caller may use everything. Once roles are configured an
 * unknown or disabled role is denied.
 */
public final class AccessPolicy {
  private static final Logger log = LoggerFactory.getLogger(AccessPolicy.class);

  private static final AccessPolicy OPEN = new AccessPolicy(Map.of());

  private final Map<String, RolePermissions> roles;

  private AccessPolicy(Map<String, RolePermissions> roles) {
    this.roles = roles;
  }

  public static AccessPolicy open() {
    return OPEN;
  }

  public static AccessPolicy of(List<RoleDef> defs) {
    if (defs == null || defs.isEmpty()) return OPEN;
    Map<String, RolePermissions> out = new LinkedHashMap<>();
    for (RoleDef def : defs) {
      if (out.put(def.name(), new RolePermissions(def)) != null) {
        throw new IllegalArgumentException("Duplicate role: " + def.name());
      }
    }
    log.debug("federa.governance roles={}", out.keySet());
    return new AccessPolicy(Map.copyOf(out));
  }

  public boolean isOpen() {
    return roles.isEmpty();
  }

  /** Permissions of the caller's role; throws {@link AccessDeniedException} for unknown or disabled roles. */
  public RolePermissions permissions(AuthContext auth) {
    Objects.requireNonNull(auth, "auth");
    if (isOpen()) return RolePermissions.UNRESTRICTED;
    RolePermissions p = roles.get(auth.role());
    if (p == null) throw new AccessDeniedException("Unknown role '" + auth.role() + "'");
    if (p.disabled()) throw new AccessDeniedException("Role '" + auth.role() + "' is disabled");
    return p;
  }

  public Set<String> roleNames() {
    return roles.keySet();
  }
}
