package io.intellixity.federa.engine;

import io.intellixity.federa.catalog.ScalarType;
import io.intellixity.federa.plan.ReadNode;
import io.intellixity.federa.plan.SemiJoin;
import io.intellixity.federa.plan.Shape;
import io.intellixity.federa.query.*;
import io.intellixity.federa.spi.source.SourceExecutionException;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

final class ExecutionCoordinatorTest {
  private static final ReadNode KEYS =
      Fixtures.plan("{ customers { name orders { id } } }").reads().get(0).node().joins().get(0).child();

  @Test
  void singleKeySemiJoinBecomesIn() {
    SemiJoin sj = new SemiJoin(null, KEYS, List.of("id"), List.of("k"), false);

    QueryElement out = ExecutionCoordinator.restrict(null, sj, List.of(List.of(1), List.of(2)));

    Condition in = assertInstanceOf(Condition.class, out);
    assertEquals(Operator.IN, in.operator());
    assertEquals(List.of(1, 2), in.values());
  }

  @Test
  void missingKeysRestrictToNothing() {
    SemiJoin sj = new SemiJoin(null, KEYS, List.of("a", "b"), List.of("x", "y"), false);

    Condition in = assertInstanceOf(Condition.class, ExecutionCoordinator.restrict(null, sj, List.of()));

    assertEquals("a", in.property());
    assertTrue(in.values().isEmpty());
  }

  @Test
  void compositeKeysBecomeDisjunctionOfTuples() {
    SemiJoin sj = new SemiJoin(null, KEYS, List.of("a", "b"), List.of("x", "y"), false);
    QueryElement own = QueryFilters.eq("region", "EU");

    LogicalGroup and = assertInstanceOf(LogicalGroup.class,
        ExecutionCoordinator.restrict(own, sj, List.of(List.of(1, "p"), List.of(2, "q"))));

    assertEquals(Clause.AND, and.clause());
    assertSame(own, and.elements().get(0));
    LogicalGroup or = assertInstanceOf(LogicalGroup.class, and.elements().get(1));
    assertEquals(Clause.OR, or.clause());
    assertEquals(2, or.elements().size());
    LogicalGroup first = assertInstanceOf(LogicalGroup.class, or.elements().get(0));
    assertEquals("b", ((Condition) first.elements().get(1)).property());
    assertEquals("p", ((Condition) first.elements().get(1)).value());
  }

  @Test
  void negatedSemiJoinReplacesRelationConditionInPlace() {
    RelationCondition none = QueryFilters.noneOf("orders", QueryFilters.eq("status", "open"));
    QueryElement own = QueryFilters.eq("region", "EU");
    SemiJoin sj = new SemiJoin(none, KEYS, List.of("id"), List.of("k"), true);

    LogicalGroup and = assertInstanceOf(LogicalGroup.class,
        ExecutionCoordinator.restrict(QueryFilters.and(own, none), sj, List.of(List.of(7))));

    assertSame(own, and.elements().get(0));
    NotElement not = assertInstanceOf(NotElement.class, and.elements().get(1));
    assertEquals(List.of(7), ((Condition) not.element()).values());
  }

  @Test
  void nestedJsonIsDecodedIntoShapes() {
    List<Shape> shapes = List.of(
        new Shape.Value("name", "name", ScalarType.STRING),
        new Shape.Nested("orders", "orders", List.of(new Shape.Value("total", "total", ScalarType.BIGINT)), true),
        new Shape.Joined("owner", "__j0", List.of(new Shape.Value("id", "id", ScalarType.INT)), false),
        new Shape.Redacted("region"));
    Map<String, Object> row = new HashMap<>();
    row.put("name", "Ann");
    row.put("orders", "[{\"total\": 4}, {\"total\": 5}]");
    row.put("__j0", List.of(Map.of("id", 1), Map.of("id", 2)));
    row.put("region", "EU");

    Map<String, Object> out = ExecutionCoordinator.format(shapes, row);

    assertEquals(List.of("name", "orders", "owner", "region"), new ArrayList<>(out.keySet()));
    assertEquals(List.of(Map.of("total", 4L), Map.of("total", 5L)), out.get("orders"));
    assertEquals(Map.of("id", 1), out.get("owner"));
    assertNull(out.get("region"));
  }

  @Test
  void errorsMapToCodes() {
    GraphQLErrorEntry source = ExecutionCoordinator.error(List.of("orders"), new CompletionException(
        new SourceExecutionException(SourceExecutionException.Code.UNIQUE_VIOLATION, "shop", "duplicate key")));
    GraphQLErrorEntry invalid = ExecutionCoordinator.error(List.of(), new QueryValidationException("bad"));
    GraphQLErrorEntry other = ExecutionCoordinator.error(List.of(), new IllegalStateException("boom"));

    assertEquals("UNIQUE_VIOLATION", source.code());
    assertEquals("duplicate key", source.message());
    assertEquals(List.of("orders"), source.path());
    assertEquals(GraphQLErrorEntry.VALIDATION_FAILED, invalid.code());
    assertEquals("EXECUTION_FAILED", other.code());
  }
}
