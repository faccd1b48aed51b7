package io.intellixity.federa.engine.memory;

import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.query.FilterEvaluator;
import io.intellixity.federa.query.SortField;
import io.intellixity.federa.query.Values;
import io.intellixity.federa.spi.source.*;
import io.intellixity.federa.spi.source.SourceExecutionException.Code;
import io.intellixity.federa.spi.sql.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Scan-only source serving rows from Java collections. Tables are keyed by the physical source name of
 * the data object; rows by field name.
 */
public final class InMemorySourceAdapter implements SourceAdapter {
  private static final Logger log = LoggerFactory.getLogger(InMemorySourceAdapter.class);

  private final String name;
  private final Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();

  public InMemorySourceAdapter(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  /** Replaces the rows of {@code object}. */
  public synchronized InMemorySourceAdapter put(String object, List<? extends Map<String, ?>> rows) {
    List<Map<String, Object>> copy = new ArrayList<>();
    for (Map<String, ?> r : rows) copy.add(new LinkedHashMap<>(r));
    tables.put(object, copy);
    return this;
  }

  /** Snapshot of the rows of {@code object}. */
  public synchronized List<Map<String, Object>> rows(String object) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> r : table(object)) out.add(new LinkedHashMap<>(r));
    return out;
  }

  @Override public String name() { return name; }
  @Override public Capabilities capabilities() { return Capabilities.SCAN_ONLY; }
  @Override public Dialect dialect() { return null; }

  @Override
  public SourceResult execute(NativeQuery query, CancellationToken token) {
    if (!(query instanceof ScanRequest scan)) {
      throw new SourceExecutionException(Code.EXECUTION_FAILED, name,
          "In-memory source does not accept " + query.getClass().getSimpleName());
    }
    token.throwIfCancelled(name);
    log.debug("federa.exec scan dataSource={} action={} object={}", name, scan.action(), scan.object());
    try {
      synchronized (this) {
        return switch (scan.action()) {
          case SELECT -> SourceResult.ofRows(select(scan));
          case INSERT -> insert(scan);
          case UPDATE -> SourceResult.ofCount(update(scan));
          case DELETE -> SourceResult.ofCount(delete(scan));
        };
      }
    } catch (IllegalStateException e) {
      throw new SourceExecutionException(Code.EXECUTION_FAILED, name, e.getMessage(), e);
    }
  }

  private List<Map<String, Object>> select(ScanRequest scan) {
    List<Map<String, Object>> matched = new ArrayList<>();
    for (Map<String, Object> r : table(scan.object())) {
      if (FilterEvaluator.matches(scan.filter(), r)) matched.add(r);
    }
    List<SortField> order = new ArrayList<>();
    for (String f : scan.distinctOn()) order.add(new SortField(f, SortField.Direction.ASC));
    order.addAll(scan.orderBy());
    if (!order.isEmpty()) matched.sort(comparator(order));

    if (!scan.distinctOn().isEmpty()) {
      Set<List<Object>> seen = new HashSet<>();
      List<Map<String, Object>> distinct = new ArrayList<>();
      for (Map<String, Object> r : matched) {
        List<Object> key = new ArrayList<>();
        for (String f : scan.distinctOn()) key.add(Values.joinKey(r.get(f)));
        if (seen.add(key)) distinct.add(r);
      }
      matched = distinct;
    }

    int from = scan.offset() == null ? 0 : Math.min(scan.offset(), matched.size());
    int to = scan.limit() == null ? matched.size() : Math.min(matched.size(), from + scan.limit());
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> r : matched.subList(from, to)) out.add(project(r, scan.fields()));
    return out;
  }

  private SourceResult insert(ScanRequest scan) {
    Map<String, Object> row = new LinkedHashMap<>(scan.values());
    tables.computeIfAbsent(scan.object(), k -> new ArrayList<>()).add(row);
    return new SourceResult(List.of(project(row, scan.fields())), 1);
  }

  private long update(ScanRequest scan) {
    long n = 0;
    for (Map<String, Object> r : table(scan.object())) {
      if (!FilterEvaluator.matches(scan.filter(), r)) continue;
      r.putAll(scan.values());
      n++;
    }
    return n;
  }

  private long delete(ScanRequest scan) {
    List<Map<String, Object>> rows = table(scan.object());
    int before = rows.size();
    rows.removeIf(r -> FilterEvaluator.matches(scan.filter(), r));
    return before - rows.size();
  }

  private List<Map<String, Object>> table(String object) {
    List<Map<String, Object>> rows = tables.get(object);
    if (rows == null) throw new SourceExecutionException(Code.EXECUTION_FAILED, name, "Unknown object '" + object + "'");
    return rows;
  }

  private static Map<String, Object> project(Map<String, Object> row, List<String> fields) {
    if (fields.isEmpty()) return new LinkedHashMap<>(row);
    Map<String, Object> out = new LinkedHashMap<>();
    for (String f : fields) out.put(f, row.get(f));
    return out;
  }

  private static Comparator<Map<String, Object>> comparator(List<SortField> order) {
    return (a, b) -> {
      for (SortField s : order) {
        int c = Values.compare(a.get(s.field()), b.get(s.field()));
        if (c != 0) return s.direction() == SortField.Direction.DESC ? -c : c;
      }
      return 0;
    };
  }
}
