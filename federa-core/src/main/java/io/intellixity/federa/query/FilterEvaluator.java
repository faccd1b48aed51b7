package io.intellixity.federa.query;

import org.locationtech.jts.geom.Geometry;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Evaluates a filter tree against in-process rows (local fallback, scan-only sources).
 * <p>
 * Rows are maps keyed by field name. Relation conditions need a {@link RelatedRows} lookup.
 */
public final class FilterEvaluator implements QueryVisitor<Boolean> {
  /** Rows reachable from {@code row} through {@code relation}. */
  @FunctionalInterface
  public interface RelatedRows {
    List<? extends Map<String, ?>> rows(Map<String, ?> row, String relation);
  }

  private static final RelatedRows NO_RELATIONS = (row, relation) -> {
    throw new IllegalStateException("Relation filter '" + relation + "' cannot be evaluated locally");
  };

  private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

  private final Map<String, ?> row;
  private final RelatedRows related;

  private FilterEvaluator(Map<String, ?> row, RelatedRows related) {
    this.row = row;
    this.related = related;
  }

  public static boolean matches(QueryElement filter, Map<String, ?> row) {
    return matches(filter, row, NO_RELATIONS);
  }

  public static boolean matches(QueryElement filter, Map<String, ?> row, RelatedRows related) {
    if (filter == null) return true;
    return filter.accept(new FilterEvaluator(row, related));
  }

  @Override
  public Boolean visit(LogicalGroup group) {
    if (group.clause() == Clause.AND) {
      for (QueryElement e : group.elements()) {
        if (!e.accept(this)) return false;
      }
      return true;
    }
    for (QueryElement e : group.elements()) {
      if (e.accept(this)) return true;
    }
    return false;
  }

  @Override
  public Boolean visit(NotElement not) {
    return !not.element().accept(this);
  }

  @Override
  public Boolean visit(RelationCondition rc) {
    List<? extends Map<String, ?>> rows = related.rows(row, rc.relation());
    if (rows == null) rows = List.of();
    switch (rc.quantifier()) {
      case DIRECT:
      case ANY_OF:
        for (Map<String, ?> r : rows) {
          if (matches(rc.element(), r, related)) return true;
        }
        return false;
      case ALL_OF:
        for (Map<String, ?> r : rows) {
          if (!matches(rc.element(), r, related)) return false;
        }
        return true;
      case NONE_OF:
        for (Map<String, ?> r : rows) {
          if (matches(rc.element(), r, related)) return false;
        }
        return true;
      default:
        throw new IllegalStateException("Unknown quantifier " + rc.quantifier());
    }
  }

  @Override
  public Boolean visit(Condition c) {
    Object actual = row.get(c.property());
    Object expected = c.value();
    switch (c.operator()) {
      case IS_NULL:
        return (actual == null) == Boolean.TRUE.equals(expected);
      case EQ:
        return actual != null && Values.equal(actual, expected);
      case IN:
        if (actual == null) return false;
        for (Object v : c.values()) {
          if (Values.equal(actual, v)) return true;
        }
        return false;
      case GT:
        return actual != null && Values.compare(actual, expected) > 0;
      case GTE:
        return actual != null && Values.compare(actual, expected) >= 0;
      case LT:
        return actual != null && Values.compare(actual, expected) < 0;
      case LTE:
        return actual != null && Values.compare(actual, expected) <= 0;
      case LIKE:
        return actual != null && likePattern(expected.toString(), false).matcher(actual.toString()).matches();
      case ILIKE:
        return actual != null && likePattern(expected.toString(), true).matcher(actual.toString()).matches();
      case REGEX:
        return actual != null && regexPattern(expected.toString()).matcher(actual.toString()).find();
      case CONTAINS:
        return contains(actual, expected);
      case INTERSECTS:
        return intersects(actual, expected);
      default:
        throw new IllegalStateException("Unsupported operator " + c.operator());
    }
  }

  private static boolean contains(Object actual, Object expected) {
    if (actual == null || expected == null) return false;
    if (actual instanceof Geometry g) return g.contains(Geometries.parse(expected));
    if (actual instanceof Collection<?> have) {
      Collection<?> want = expected instanceof Collection<?> c ? c : List.of(expected);
      for (Object w : want) {
        if (have.stream().noneMatch(h -> Values.equal(h, w))) return false;
      }
      return true;
    }
    return false;
  }

  private static boolean intersects(Object actual, Object expected) {
    if (actual == null || expected == null) return false;
    if (actual instanceof Geometry g) return g.intersects(Geometries.parse(expected));
    if (actual instanceof Collection<?> have) {
      Collection<?> want = expected instanceof Collection<?> c ? c : List.of(expected);
      for (Object w : want) {
        if (have.stream().anyMatch(h -> Values.equal(h, w))) return true;
      }
    }
    return false;
  }

  /** SQL LIKE pattern ({@code %}, {@code _}, backslash escape) as a regex. */
  static Pattern likePattern(String like, boolean ignoreCase) {
    return PATTERNS.computeIfAbsent((ignoreCase ? "i:" : "s:") + like, k -> {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < like.length(); i++) {
        char ch = like.charAt(i);
        if (ch == '\\' && i + 1 < like.length()) {
          sb.append(Pattern.quote(String.valueOf(like.charAt(++i))));
        } else if (ch == '%') {
          sb.append(".*");
        } else if (ch == '_') {
          sb.append('.');
        } else {
          sb.append(Pattern.quote(String.valueOf(ch)));
        }
      }
      int flags = Pattern.DOTALL | (ignoreCase ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0);
      return Pattern.compile(sb.toString(), flags);
    });
  }

  static Pattern regexPattern(String regex) {
    return PATTERNS.computeIfAbsent("r:" + regex, k -> Pattern.compile(regex));
  }
}
