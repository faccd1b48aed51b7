package io.intellixity.federa.plan.request;

import io.intellixity.federa.plan.Schemas;
import io.intellixity.federa.query.QueryValidationException;
import io.intellixity.federa.schema.CompiledSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RequestValidatorTest {
  private static final CompiledSchema SHOP = Schemas.compile(Schemas.postgres("db", Schemas.CUSTOMERS, Schemas.ORDERS));
  private static final RequestValidator VALIDATOR = new RequestValidator(SHOP);

  private static void validate(String query) {
    validate(query, Map.of());
  }

  private static void validate(String query, Map<String, Object> variables) {
    List<QueryValidationException> errors = VALIDATOR.validateDocument(RequestParser.parseDocument(query));
    if (!errors.isEmpty()) throw errors.get(0);
    VALIDATOR.validate(Schemas.request(SHOP, query, variables));
  }

  @Test
  void bucketOrderMustReferenceSelectedAggregate() {
    String selected = """
        { orders_bucket_aggregation(order_by: [{field: "aggregations.total.sum", direction: DESC}]) {
            key { status }
            aggregations { _rows_count total { sum } }
        } }
        """;
    assertDoesNotThrow(() -> validate(selected));

    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> validate(selected.replace("total { sum }", "")));
    assertTrue(ex.getMessage().contains("aggregations.total.sum"));
    assertEquals(List.of("orders_bucket_aggregation", "order_by", 0), ex.path());
  }

  @Test
  void notIsAllowedOnObjectFiltersOnly() {
    assertDoesNotThrow(() -> validate("{ customers(filter: {_not: {name: {like: \"%test%\"}}}) { id } }"));

    assertThrows(QueryValidationException.class,
        () -> validate("{ customers(filter: {name: {_not: {like: \"%test%\"}}}) { id } }"));
  }

  @Test
  void regexMustBePosixExtended() {
    assertDoesNotThrow(() -> validate("{ customers(filter: {name: {regex: \"^[A-Z][a-z]+$\"}}) { id } }"));

    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> validate("{ customers(filter: {name: {regex: \"\\\\d+\"}}) { id } }"));
    assertEquals(List.of("customers", "filter", "name", "regex"), ex.path());
    assertThrows(QueryValidationException.class, () -> RequestValidator.checkPosixRegex("a+?", List.of()));
    assertThrows(QueryValidationException.class, () -> RequestValidator.checkPosixRegex("(?i)abc", List.of()));
    assertThrows(QueryValidationException.class, () -> RequestValidator.checkPosixRegex("[a-", List.of()));
  }

  @Test
  void pagingMustNotBeNegative() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> validate("{ customers(limit: -1) { id } }"));
    assertEquals(List.of("customers", "limit"), ex.path());
  }

  @Test
  void orderByAcceptsFieldsAndToOnePaths() {
    assertDoesNotThrow(() -> validate("{ orders(order_by: [{field: \"customer.name\"}]) { id } }"));
    assertThrows(QueryValidationException.class,
        () -> validate("{ customers(order_by: [{field: \"orders.id\"}]) { id } }"));
    assertThrows(QueryValidationException.class,
        () -> validate("{ customers(order_by: [{field: \"nope\"}]) { id } }"));
  }

  @Test
  void orderDirectionFromVariablesIsChecked() {
    String query = "query ($o: [OrderByField!]) { customers(order_by: $o) { id } }";
    assertDoesNotThrow(() -> validate(query, Map.of("o", List.of(Map.of("field", "name", "direction", "DESC")))));

    assertThrows(QueryValidationException.class,
        () -> validate(query, Map.of("o", List.of(Map.of("field", "name", "direction", "down")))));
  }

  @Test
  void requiredFilterFieldMustAppear() {
    CompiledSchema schema = Schemas.compile(Schemas.postgres("db", """
        type events @table(name: "events") {
          id: Int! @pk
          tenant: String @filter_required
        }
        """));
    RequestValidator validator = new RequestValidator(schema);

    assertThrows(QueryValidationException.class,
        () -> validator.validate(Schemas.request(schema, "{ events { id } }")));
    assertDoesNotThrow(() -> validator.validate(Schemas.request(schema,
        "{ events(filter: {_or: [{tenant: {eq: \"a\"}}, {tenant: {eq: \"b\"}}]}) { id } }")));
  }

  @Test
  void unknownFieldsFailDocumentValidation() {
    List<QueryValidationException> errors = VALIDATOR.validateDocument(
        RequestParser.parseDocument("{ customers { id nickname } }"));

    assertFalse(errors.isEmpty());
    assertTrue(errors.get(0).getMessage().contains("nickname"));
  }
}
