package io.intellixity.federa.governance;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code [$auth.<claim>]} placeholders in permission filters and data.
 * <p>
 * A string that is exactly one placeholder becomes the claim value with its own type; placeholders
 * embedded in longer strings are replaced by the claim's text.
 */
public final class AuthPlaceholders {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\[\\$auth\\.([A-Za-z_][A-Za-z0-9_]*)]");

  private AuthPlaceholders() {}

  public static Object substitute(Object value, AuthContext auth) {
    Objects.requireNonNull(auth, "auth");
    if (value instanceof String s) return string(s, auth);
    if (value instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), substitute(e.getValue(), auth));
      return out;
    }
    if (value instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(substitute(o, auth));
      return out;
    }
    return value;
  }

  @SuppressWarnings("unchecked")
  public static Map<String, Object> substituteAll(Map<String, ?> values, AuthContext auth) {
    if (values == null || values.isEmpty()) return Map.of();
    return (Map<String, Object>) substitute(values, auth);
  }

  public static boolean hasPlaceholder(String s) {
    return s != null && PLACEHOLDER.matcher(s).find();
  }

  /** Whether any string inside {@code value} (maps and collections included) holds a placeholder. */
  public static boolean containsPlaceholder(Object value) {
    if (value instanceof String s) return hasPlaceholder(s);
    if (value instanceof Map<?, ?> m) {
      for (Object v : m.values()) {
        if (containsPlaceholder(v)) return true;
      }
    } else if (value instanceof Collection<?> c) {
      for (Object v : c) {
        if (containsPlaceholder(v)) return true;
      }
    }
    return false;
  }

  private static Object string(String s, AuthContext auth) {
    Matcher m = PLACEHOLDER.matcher(s);
    if (m.matches()) return auth.requiredClaim(m.group(1));
    m.reset();
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      m.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(auth.requiredClaim(m.group(1)))));
    }
    m.appendTail(sb);
    return sb.toString();
  }
}
