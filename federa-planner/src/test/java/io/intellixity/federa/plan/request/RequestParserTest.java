package io.intellixity.federa.plan.request;

import io.intellixity.federa.plan.Schemas;
import io.intellixity.federa.query.QueryValidationException;
import io.intellixity.federa.schema.CompiledSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RequestParserTest {
  private static final CompiledSchema SHOP = Schemas.compile(Schemas.postgres("db", Schemas.CUSTOMERS, Schemas.ORDERS));

  private static RequestTree parse(String query, Map<String, Object> variables) {
    return Schemas.request(SHOP, query, variables);
  }

  @Test
  void fragmentsAreInlinedAndDefaultsApplied() {
    RequestTree tree = parse("""
        query { customers { ...names orders { id } } }
        fragment names on customers { id name }
        """, Map.of());

    SelectedField customers = tree.fields().get(0);
    assertEquals(List.of("id", "name", "orders"), customers.selections().stream().map(SelectedField::name).toList());
    assertEquals(2000, customers.intArgument("limit"));
    assertEquals("customers", customers.type());
    assertEquals(List.of("customers", "orders", "id"), customers.selections().get(2).selections().get(0).path());
  }

  @Test
  void skipAndIncludeFollowVariables() {
    RequestTree tree = parse("query ($full: Boolean!) { customers { id name @include(if: $full) region @skip(if: $full) } }",
        Map.of("full", false));

    assertEquals(List.of("id", "region"),
        tree.fields().get(0).selections().stream().map(SelectedField::responseKey).toList());
  }

  @Test
  void aliasesKeepSeparateFields() {
    RequestTree tree = parse("{ a: customers(limit: 1) { id } b: customers(limit: 2) { id } }", Map.of());

    assertEquals(1, tree.fields().get(0).intArgument("limit"));
    assertEquals(2, tree.fields().get(1).intArgument("limit"));
    assertEquals("customers", tree.fields().get(1).name());
  }

  @Test
  void canonicalTextDoesNotDependOnVariables() {
    String literal = parse("{ customers(limit: 3) { id } }", Map.of()).fields().get(0).canonical();
    String variable = parse("query ($n: Int) { customers(limit: $n) { id } }", Map.of("n", 3)).fields().get(0).canonical();
    String other = parse("{ customers(limit: 4) { id } }", Map.of()).fields().get(0).canonical();

    assertEquals(literal, variable);
    assertNotEquals(literal, other);
  }

  @Test
  void operationDirectivesAreRecorded() {
    RequestTree tree = parse("query @cache(ttl: 30) { customers { id } }", Map.of());

    assertTrue(tree.hasDirective("cache"));
    assertEquals(30, tree.directive("cache").get("ttl"));
  }

  @Test
  void missingRequiredVariableIsRejected() {
    assertThrows(QueryValidationException.class,
        () -> parse("query ($id: Int!) { customers_by_pk(id: $id) { name } }", Map.of()));
  }

  @Test
  void severalOperationsNeedAName() {
    String doc = "query A { customers { id } } query B { orders { id } }";
    assertThrows(QueryValidationException.class, () -> parse(doc, Map.of()));

    RequestTree b = new RequestParser(SHOP.graphQLSchema()).parse(RequestParser.parseDocument(doc), "B", Map.of());
    assertEquals("orders", b.fields().get(0).name());
  }

  @Test
  void invalidSyntaxIsAValidationError() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> RequestParser.parseDocument("{ customers { id "));
    assertTrue(ex.getMessage().startsWith("Invalid syntax"));
  }

  @Test
  void introspectionOnlyRequestsAreRecognised() {
    assertTrue(parse("{ __schema { queryType { name } } }", Map.of()).introspectionOnly());
    assertFalse(parse("{ __typename customers { id } }", Map.of()).introspectionOnly());
  }
}
