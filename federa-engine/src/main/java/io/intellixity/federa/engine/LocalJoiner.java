package io.intellixity.federa.engine;

import io.intellixity.federa.plan.JoinPredicate;
import io.intellixity.federa.plan.LocalJoin;
import io.intellixity.federa.query.Geometries;
import io.intellixity.federa.query.Values;
import org.locationtech.jts.geom.Geometry;

import java.util.*;

/**
 * Merges child rows into parent rows for one {@link LocalJoin}. Parent rows are updated in place and
 * keep their order; child rows are only read.
 */
final class LocalJoiner {
  private LocalJoiner() {}

  static List<Map<String, Object>> join(List<Map<String, Object>> parents, LocalJoin join,
                                        List<Map<String, Object>> children, List<Map<String, Object>> junction) {
    Matcher matcher = matcher(join.predicate(), children, junction);
    List<Map<String, Object>> out = new ArrayList<>(parents.size());
    for (Map<String, Object> parent : parents) {
      List<Map<String, Object>> matches = matcher.matches(parent);
      if (join.inner() && matches.isEmpty()) continue;
      if (join.aggregation() != null) {
        List<Map<String, Object>> subset = LocalAggregator.page(matches, join.offset(), join.limit());
        parent.put(join.label(), LocalAggregator.aggregate(join.aggregation().items(), subset));
      } else if (join.list()) {
        parent.put(join.label(), LocalAggregator.page(matches, join.offset(), join.limit()));
      } else {
        parent.put(join.label(), matches.isEmpty() ? null : matches.get(0));
      }
      out.add(parent);
    }
    return out;
  }

  /** The child read failed: the branch is {@code null} on every parent. */
  static void nullBranch(List<Map<String, Object>> parents, String label) {
    for (Map<String, Object> p : parents) p.put(label, null);
  }

  private interface Matcher {
    List<Map<String, Object>> matches(Map<String, Object> parent);
  }

  private static Matcher matcher(JoinPredicate predicate, List<Map<String, Object>> children,
                                 List<Map<String, Object>> junction) {
    if (predicate instanceof JoinPredicate.Equi e) {
      Map<List<Object>, List<Map<String, Object>>> index = index(children, e.childLabels());
      return parent -> lookup(index, key(parent, e.parentLabels()));
    }
    if (predicate instanceof JoinPredicate.Junction j) {
      Map<List<Object>, List<Map<String, Object>>> links = index(junction, j.parentToJunction().childLabels());
      Map<List<Object>, List<Map<String, Object>>> targets = index(children, j.junctionToChild().childLabels());
      return parent -> {
        List<Map<String, Object>> out = new ArrayList<>();
        Set<Map<String, Object>> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Map<String, Object> link : lookup(links, key(parent, j.parentToJunction().parentLabels()))) {
          for (Map<String, Object> child : lookup(targets, key(link, j.junctionToChild().parentLabels()))) {
            if (seen.add(child)) out.add(child);
          }
        }
        return out;
      };
    }
    JoinPredicate.Spatial s = (JoinPredicate.Spatial) predicate;
    List<Geometry> shapes = new ArrayList<>(children.size());
    for (Map<String, Object> c : children) shapes.add(Geometries.parse(c.get(s.childLabel())));
    return parent -> {
      Geometry g = Geometries.parse(parent.get(s.parentLabel()));
      List<Map<String, Object>> out = new ArrayList<>();
      if (g == null) return out;
      for (int i = 0; i < children.size(); i++) {
        Geometry other = shapes.get(i);
        if (other != null && spatial(s, g, other)) out.add(children.get(i));
      }
      return out;
    };
  }

  /** {@code parent <type> child}; DWITHIN without a buffer means touching. */
  private static boolean spatial(JoinPredicate.Spatial s, Geometry parent, Geometry child) {
    return switch (s.type()) {
      case INTERSECTS -> parent.intersects(child);
      case WITHIN -> parent.within(child);
      case CONTAINS -> parent.contains(child);
      case DISJOIN -> parent.disjoint(child);
      case DWITHIN -> parent.isWithinDistance(child, s.buffer() == null ? 0 : s.buffer());
    };
  }

  private static Map<List<Object>, List<Map<String, Object>>> index(List<Map<String, Object>> rows, List<String> labels) {
    Map<List<Object>, List<Map<String, Object>>> index = new HashMap<>();
    for (Map<String, Object> r : rows) {
      List<Object> k = key(r, labels);
      if (k != null) index.computeIfAbsent(k, x -> new ArrayList<>()).add(r);
    }
    return index;
  }

  private static List<Map<String, Object>> lookup(Map<List<Object>, List<Map<String, Object>>> index, List<Object> key) {
    if (key == null) return List.of();
    List<Map<String, Object>> rows = index.get(key);
    return rows == null ? List.of() : rows;
  }

  /** Normalized key tuple; {@code null} when a component is null, which never matches. */
  static List<Object> key(Map<String, Object> row, List<String> labels) {
    List<Object> out = new ArrayList<>(labels.size());
    for (String l : labels) {
      Object v = row.get(l);
      if (v == null) return null;
      out.add(Values.joinKey(v));
    }
    return out;
  }
}
