package io.intellixity.federa.engine;

import io.intellixity.federa.plan.LocalAggregation;
import io.intellixity.federa.query.SortField;
import io.intellixity.federa.spi.sql.AggregateItem;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class LocalAggregatorTest {
  private static final List<Map<String, Object>> ORDERS = List.of(
      order("open", 100.0, 1),
      order("closed", 50.0, 1),
      order("open", 20.0, 2),
      order("closed", null, 3));

  private static Map<String, Object> order(String status, Double total, int customer) {
    Map<String, Object> r = new LinkedHashMap<>();
    r.put("f.status", status);
    r.put("f.total", total);
    r.put("f.customer_id", customer);
    return r;
  }

  @Test
  void aggregatesIgnoreNulls() {
    Map<String, Object> out = LocalAggregator.aggregate(List.of(
        AggregateItem.rowsCount("_rows_count"),
        AggregateItem.of("total.count", "f.total", "count"),
        AggregateItem.of("total.sum", "f.total", "sum"),
        AggregateItem.of("total.avg", "f.total", "avg"),
        AggregateItem.of("total.min", "f.total", "min"),
        AggregateItem.of("total.max", "f.total", "max"),
        new AggregateItem("customers", "f.customer_id", "count", true, null)), ORDERS);

    assertEquals(4L, out.get("_rows_count"));
    assertEquals(3L, out.get("total.count"));
    assertEquals(170.0, out.get("total.sum"));
    assertEquals(170.0 / 3, (Double) out.get("total.avg"), 1e-9);
    assertEquals(20.0, out.get("total.min"));
    assertEquals(100.0, out.get("total.max"));
    assertEquals(3L, out.get("customers"));
  }

  @Test
  void emptyInputYieldsNullsAndZeroCounts() {
    Map<String, Object> out = LocalAggregator.aggregate(List.of(
        AggregateItem.rowsCount("n"), AggregateItem.of("s", "f.total", "sum"), AggregateItem.of("v", "f.total", "variance")),
        List.of());

    assertEquals(0L, out.get("n"));
    assertNull(out.get("s"));
    assertNull(out.get("v"));
  }

  @Test
  void integerSumsStayIntegral() {
    Map<String, Object> out = LocalAggregator.aggregate(List.of(
        AggregateItem.of("ids", "f.customer_id", "sum"),
        AggregateItem.of("decimals", "d", "sum")),
        List.of(Map.of("f.customer_id", 1, "d", new BigDecimal("1.25")),
            Map.of("f.customer_id", 2L, "d", new BigDecimal("2.50"))));

    assertEquals(3L, out.get("ids"));
    assertEquals(3.75, out.get("decimals"));
  }

  @Test
  void stringAggAndBooleanAggregates() {
    Map<String, Object> out = LocalAggregator.aggregate(List.of(
        new AggregateItem("joined", "s", "string_agg", false, "|"),
        AggregateItem.of("all", "b", "bool_and"),
        AggregateItem.of("any", "b", "bool_or"),
        AggregateItem.of("sd", "n", "stddev")), List.of(
        Map.of("s", "a", "b", true, "n", 2),
        Map.of("s", "b", "b", false, "n", 4)));

    assertEquals("a|b", out.get("joined"));
    assertEquals(false, out.get("all"));
    assertEquals(true, out.get("any"));
    assertEquals(Math.sqrt(2), (Double) out.get("sd"), 1e-9);
  }

  @Test
  void groupedAggregationSortsAndPagesGroups() {
    LocalAggregation agg = new LocalAggregation(
        List.of(new LocalAggregation.GroupKey("key.status", "f.status")),
        List.of(AggregateItem.rowsCount("aggregations._rows_count"),
            AggregateItem.of("aggregations.total.sum", "f.total", "sum")),
        List.of(new SortField("aggregations.total.sum", SortField.Direction.DESC)), 1, null);

    List<Map<String, Object>> out = LocalAggregator.apply(agg, ORDERS);

    assertEquals(1, out.size());
    assertEquals("open", out.get(0).get("key.status"));
    assertEquals(2L, out.get(0).get("aggregations._rows_count"));
    assertEquals(120.0, out.get(0).get("aggregations.total.sum"));
  }

  @Test
  void ungroupedAggregationIsOneRow() {
    List<Map<String, Object>> out = LocalAggregator.apply(LocalAggregation.of(List.of(AggregateItem.rowsCount("n"))),
        List.of());

    assertEquals(List.of(Map.of("n", 0L)), out);
  }

  @Test
  void pageClampsOffsetAndLimit() {
    List<Integer> values = List.of(1, 2, 3, 4);

    assertEquals(List.of(2, 3), LocalAggregator.page(values, 1, 2));
    assertEquals(List.of(), LocalAggregator.page(values, 10, 2));
    assertEquals(values, LocalAggregator.page(values, null, null));
  }

  @Test
  void unknownFunctionIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> LocalAggregator.aggregate(
        List.of(AggregateItem.of("x", "f.total", "median")), ORDERS));
  }
}
