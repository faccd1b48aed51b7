package io.intellixity.federa.query;

import io.intellixity.federa.catalog.*;
import io.intellixity.federa.sdl.CatalogLoader;
import io.intellixity.federa.sdl.SdlSource;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class FilterParserTest {
  private static final String SDL = """
      type customers @table(name: "customers") {
        id: Int! @pk
        name: String
        tags: [String]
        since: Date
      }
      type orders @table(name: "orders") {
        id: Int! @pk
        customer_id: Int! @field_references(references_name: "customers", query: "customer")
        total: Float
      }
      """;

  private static final Catalog CATALOG = new CatalogLoader(t -> Capabilities.FULL).loadDocuments(List.of(
      new CatalogLoader.SourceDocuments(new DataSourceInfo("db", "postgres", null, false, false, Capabilities.FULL),
          List.of(new SdlSource("db.graphql", SDL))))).orThrow();

  private static final FilterParser PARSER = new FilterParser(CATALOG);

  private static int id(String name) { return CATALOG.resolveObject("", name).id(); }

  @Test
  void notOverScalarFilterExcludesMatches() {
    QueryElement f = PARSER.parse(id("customers"), Map.of("_not", Map.of("name", Map.of("like", "%test%"))), List.of());

    assertInstanceOf(NotElement.class, f);
    assertFalse(FilterEvaluator.matches(f, Map.of("name", "a test user")));
    assertTrue(FilterEvaluator.matches(f, Map.of("name", "alice")));
  }

  @Test
  void rejectsBooleanLogicInsideScalarFilter() {
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> PARSER.parse(id("customers"),
        Map.of("name", Map.of("_not", Map.of("like", "%test%"))), List.of("customers", "filter")));
    assertEquals(List.of("customers", "filter", "name", "_not"), ex.path());
  }

  @Test
  void rejectsOperatorOutsideTheFieldTypeSet() {
    assertThrows(QueryValidationException.class,
        () -> PARSER.parse(id("customers"), Map.of("name", Map.of("gt", "a")), List.of()));
    assertThrows(QueryValidationException.class,
        () -> PARSER.parse(id("customers"), Map.of("tags", Map.of("like", "a")), List.of()));
  }

  @Test
  void toOneRelationTakesNestedObject() {
    QueryElement f = PARSER.parse(id("orders"), Map.of("customer", Map.of("name", Map.of("eq", "bob"))), List.of());
    RelationCondition rc = assertInstanceOf(RelationCondition.class, f);
    assertEquals(RelationCondition.Quantifier.DIRECT, rc.quantifier());

    assertThrows(QueryValidationException.class, () -> PARSER.parse(id("orders"),
        Map.of("customer", Map.of("any_of", Map.of("name", Map.of("eq", "bob")))), List.of()));
  }

  @Test
  void toManyRelationNeedsExactlyOneQuantifier() {
    QueryElement f = PARSER.parse(id("customers"),
        Map.of("orders", Map.of("any_of", Map.of("total", Map.of("gt", 10)))), List.of());
    RelationCondition rc = assertInstanceOf(RelationCondition.class, f);
    assertEquals(RelationCondition.Quantifier.ANY_OF, rc.quantifier());

    assertThrows(QueryValidationException.class, () -> PARSER.parse(id("customers"),
        Map.of("orders", Map.of("total", Map.of("gt", 10))), List.of()));
    assertThrows(QueryValidationException.class, () -> PARSER.parse(id("customers"),
        Map.of("orders", Map.of("any_of", Map.of(), "none_of", Map.of())), List.of()));
  }

  @Test
  void coercesValuesToFieldTypes() {
    QueryElement f = PARSER.parse(id("customers"), Map.of("since", Map.of("gte", "2024-01-31")), List.of());
    Condition c = assertInstanceOf(Condition.class, f);
    assertEquals(LocalDate.of(2024, 1, 31), c.value());

    Condition total = (Condition) PARSER.parse(id("orders"), Map.of("total", Map.of("gt", 10)), List.of());
    assertEquals(10.0, total.value());
  }

  @Test
  void evaluatesListAndRegexOperators() {
    QueryElement contains = PARSER.parse(id("customers"), Map.of("tags", Map.of("contains", List.of("a", "b"))), List.of());
    assertTrue(FilterEvaluator.matches(contains, Map.of("tags", List.of("a", "b", "c"))));
    assertFalse(FilterEvaluator.matches(contains, Map.of("tags", List.of("a"))));

    QueryElement regex = PARSER.parse(id("customers"), Map.of("name", Map.of("regex", "^al[a-z]+$")), List.of());
    assertTrue(FilterEvaluator.matches(regex, Map.of("name", "alice")));
    assertFalse(FilterEvaluator.matches(regex, Map.of("name", "Alice")));
  }

  @Test
  void evaluatesRelationQuantifiersWithLookup() {
    QueryElement f = PARSER.parse(id("customers"),
        Map.of("orders", Map.of("all_of", Map.of("total", Map.of("gt", 10)))), List.of());
    FilterEvaluator.RelatedRows orders = (row, rel) -> List.of(Map.of("total", 20.0), Map.of("total", 5.0));

    assertFalse(FilterEvaluator.matches(f, Map.of("id", 1), orders));
    assertTrue(FilterEvaluator.matches(f, Map.of("id", 1), (row, rel) -> List.of()));
  }

  @Test
  void orOfAndGroups() {
    QueryElement f = PARSER.parse(id("orders"), Map.of("_or", List.of(
        Map.of("total", Map.of("lt", 5)),
        Map.of("_and", List.of(Map.of("id", Map.of("in", List.of(1, 2))), Map.of("total", Map.of("is_null", true)))))),
        List.of());
    HashMap<String, Object> nullTotal = new HashMap<>();
    nullTotal.put("id", 2L);
    nullTotal.put("total", null);

    assertTrue(FilterEvaluator.matches(f, Map.of("id", 9, "total", 1.5)));
    assertTrue(FilterEvaluator.matches(f, nullTotal));
    assertFalse(FilterEvaluator.matches(f, Map.of("id", 3, "total", 7.0)));
  }

  @Test
  void emptyOrMatchesNothingWhileEmptyItemMatchesEverything() {
    QueryElement none = PARSER.parse(id("orders"), Map.of("_or", List.of()), List.of());
    QueryElement all = PARSER.parse(id("orders"), Map.of("_or", List.of(Map.of())), List.of());

    assertFalse(FilterEvaluator.matches(none, Map.of("id", 1, "total", 1.0)));
    assertTrue(FilterEvaluator.matches(all, Map.of("id", 1, "total", 1.0)));
  }

  @Test
  void filterTreesPrintReadably() {
    QueryElement f = QueryFilters.or(QueryFilters.eq("id", 1), QueryFilters.not(QueryFilters.and()));

    assertEquals("OR[id EQ 1, NOT(AND[])]", f.toString());
  }
}
