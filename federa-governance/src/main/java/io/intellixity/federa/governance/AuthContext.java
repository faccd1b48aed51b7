package io.intellixity.federa.governance;

import java.util.Map;
import java.util.Objects;

/**
 * Per-request caller identity.
 * <p>
 * Typical claims: {@code user_id}, {@code org_id}, {@code role}. Row filters and mutation data refer to
 * them as {@code [$auth.<claim>]}.
 */
public interface AuthContext {
  String ANONYMOUS_ROLE = "anonymous";

  /** Role name; never null. */
  String role();

  /** Claim value or null if absent. */
  Object claim(String name);

  /** Stable identity of this caller, part of cache keys. */
  String cacheKey();

  default Object requiredClaim(String name) {
    Objects.requireNonNull(name, "name");
    Object v = claim(name);
    if (v == null) throw new AccessDeniedException("Missing auth claim '" + name + "'");
    return v;
  }

  static AuthContext anonymous() {
    return of(ANONYMOUS_ROLE, Map.of());
  }

  static AuthContext of(String role, Map<String, ?> claims) {
    return of(role, claims, null);
  }

  /** Map-backed context; a blank {@code cacheKey} is derived from role and claims. */
  static AuthContext of(String role, Map<String, ?> claims, String cacheKey) {
    String r = (role == null || role.isBlank()) ? ANONYMOUS_ROLE : role;
    Map<String, ?> m = claims == null ? Map.of() : Map.copyOf(claims);
    String ck = (cacheKey == null || cacheKey.isBlank()) ? (r + ":" + m.hashCode()) : cacheKey;
    return new AuthContext() {
      @Override public String role() { return r; }
      @Override public Object claim(String name) {
        if ("role".equals(name)) return r;
        return m.get(name);
      }
      @Override public String cacheKey() { return ck; }
      @Override public String toString() { return "AuthContext[role=" + r + "]"; }
    };
  }
}
