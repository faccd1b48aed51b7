package io.intellixity.federa.engine;

import io.intellixity.federa.plan.LocalAggregation;
import io.intellixity.federa.query.SortField;
import io.intellixity.federa.query.Values;
import io.intellixity.federa.spi.sql.AggregateItem;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.*;

/** Computes aggregates over fetched rows with the semantics of their SQL counterparts. */
final class LocalAggregator {
  private LocalAggregator() {}

  static List<Map<String, Object>> apply(LocalAggregation agg, List<Map<String, Object>> rows) {
    if (!agg.grouped()) return new ArrayList<>(List.of(aggregate(agg.items(), rows)));

    Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
    for (Map<String, Object> r : rows) {
      List<Object> key = new ArrayList<>(agg.keys().size());
      for (LocalAggregation.GroupKey k : agg.keys()) key.add(Values.joinKey(r.get(k.input())));
      groups.computeIfAbsent(key, x -> new ArrayList<>()).add(r);
    }
    List<Map<String, Object>> out = new ArrayList<>(groups.size());
    for (List<Map<String, Object>> members : groups.values()) {
      Map<String, Object> row = new LinkedHashMap<>();
      Map<String, Object> first = members.get(0);
      for (LocalAggregation.GroupKey k : agg.keys()) row.put(k.output(), first.get(k.input()));
      row.putAll(aggregate(agg.items(), members));
      out.add(row);
    }
    if (!agg.orderBy().isEmpty()) out.sort(comparator(agg.orderBy()));
    return page(out, agg.offset(), agg.limit());
  }

  static Map<String, Object> aggregate(List<AggregateItem> items, List<Map<String, Object>> rows) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (AggregateItem item : items) {
      if (item.rowsCount()) {
        out.put(item.output(), (long) rows.size());
        continue;
      }
      List<Object> values = new ArrayList<>(rows.size());
      for (Map<String, Object> r : rows) values.add(r.get(item.field()));
      if (item.distinct()) values = distinct(values);
      out.put(item.output(), compute(item, values));
    }
    return out;
  }

  static <T> List<T> page(List<T> rows, Integer offset, Integer limit) {
    int from = offset == null ? 0 : Math.max(0, Math.min(offset, rows.size()));
    int to = limit == null ? rows.size() : Math.min(rows.size(), from + Math.max(0, limit));
    return new ArrayList<>(rows.subList(from, to));
  }

  static Comparator<Map<String, Object>> comparator(List<SortField> order) {
    return (a, b) -> {
      for (SortField s : order) {
        int c = Values.compare(a.get(s.field()), b.get(s.field()));
        if (c != 0) return s.direction() == SortField.Direction.DESC ? -c : c;
      }
      return 0;
    };
  }

  private static Object compute(AggregateItem item, List<Object> values) {
    List<Object> present = new ArrayList<>(values.size());
    for (Object v : values) {
      if (v != null) present.add(v);
    }
    switch (item.function()) {
      case "count":
        return (long) present.size();
      case "sum":
        return present.isEmpty() ? null : sum(present);
      case "avg":
        return present.isEmpty() ? null : decimal(present).divide(BigDecimal.valueOf(present.size()),
            MathContext.DECIMAL64).doubleValue();
      case "min":
        return present.stream().min(Values::compare).orElse(null);
      case "max":
        return present.stream().max(Values::compare).orElse(null);
      case "stddev": {
        Double v = variance(present);
        return v == null ? null : Math.sqrt(v);
      }
      case "variance":
        return variance(present);
      case "list":
        return values;
      case "any":
        return present.isEmpty() ? null : present.get(0);
      case "last":
        return values.isEmpty() ? null : values.get(values.size() - 1);
      case "string_agg": {
        if (present.isEmpty()) return null;
        StringJoiner j = new StringJoiner(item.separator() == null ? "," : item.separator());
        for (Object v : present) j.add(v.toString());
        return j.toString();
      }
      case "bool_and":
        return present.isEmpty() ? null : present.stream().allMatch(Boolean.TRUE::equals);
      case "bool_or":
        return present.isEmpty() ? null : present.stream().anyMatch(Boolean.TRUE::equals);
      default:
        throw new IllegalArgumentException("Unsupported aggregate function '" + item.function() + "'");
    }
  }

  private static Object sum(List<Object> values) {
    BigDecimal total = decimal(values);
    for (Object v : values) {
      if (v instanceof Double || v instanceof Float || (v instanceof BigDecimal d && d.scale() > 0)) {
        return total.doubleValue();
      }
    }
    return total.longValueExact();
  }

  private static BigDecimal decimal(List<Object> values) {
    BigDecimal total = BigDecimal.ZERO;
    for (Object v : values) total = total.add(toDecimal(v));
    return total;
  }

  /** Sample variance, {@code null} below two values. */
  private static Double variance(List<Object> values) {
    int n = values.size();
    if (n < 2) return null;
    double mean = 0;
    for (Object v : values) mean += toDecimal(v).doubleValue();
    mean /= n;
    double sq = 0;
    for (Object v : values) {
      double d = toDecimal(v).doubleValue() - mean;
      sq += d * d;
    }
    return sq / (n - 1);
  }

  private static BigDecimal toDecimal(Object v) {
    if (v instanceof BigDecimal d) return d;
    if (v instanceof BigInteger i) return new BigDecimal(i);
    if (v instanceof Double || v instanceof Float) return BigDecimal.valueOf(((Number) v).doubleValue());
    if (v instanceof Number n) return BigDecimal.valueOf(n.longValue());
    try {
      return new BigDecimal(v.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Value '" + v + "' is not numeric", e);
    }
  }

  private static List<Object> distinct(List<Object> values) {
    Set<Object> seen = new HashSet<>();
    List<Object> out = new ArrayList<>();
    for (Object v : values) {
      if (seen.add(Values.joinKey(v))) out.add(v);
    }
    return out;
  }
}
