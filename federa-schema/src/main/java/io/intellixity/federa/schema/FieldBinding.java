package io.intellixity.federa.schema;

import java.util.List;

/**
 * Meaning of one generated GraphQL field. The planner walks a request through these bindings
 * instead of interpreting generated names.
 */
public sealed interface FieldBinding {

  // ---------- module and function namespaces

  /** Field on a query/mutation type that opens a nested module. */
  record ModuleField(String modulePath) implements FieldBinding {}

  /** The {@code function} field of a module query type. */
  record FunctionHub(String modulePath) implements FieldBinding {}

  /** A function exposed under {@code function}. */
  record FunctionQuery(String modulePath, String function) implements FieldBinding {}

  // ---------- root queries

  /** {@code <obj>} list query. */
  record SelectList(int objectId) implements FieldBinding {}

  /** {@code <obj>_by_pk} and unique-constraint queries; arguments are {@code keyFields}. */
  record SelectOne(int objectId, List<String> keyFields) implements FieldBinding {
    public SelectOne {
      keyFields = List.copyOf(keyFields);
    }
  }

  record Aggregate(int objectId) implements FieldBinding {}

  record BucketAggregate(int objectId) implements FieldBinding {}

  // ---------- mutations

  record Insert(int objectId) implements FieldBinding {}

  record Update(int objectId) implements FieldBinding {}

  record Delete(int objectId) implements FieldBinding {}

  /** Field of {@code OperationResult}. */
  record OperationResultField(String name) implements FieldBinding {}

  // ---------- object type members

  record Column(int objectId, String field) implements FieldBinding {}

  /** {@code _<field>_part(extract, extract_divide)}. */
  record TimePart(int objectId, String field) implements FieldBinding {}

  /** {@code _<field>_measurement(type)}. */
  record Measurement(int objectId, String field) implements FieldBinding {}

  /** Field bound to a function through {@code @function_call} or {@code @table_function_call_join}. */
  record FunctionCallField(int objectId, String field) implements FieldBinding {}

  record RelationField(int relationId) implements FieldBinding {}

  /** {@code <relation>_aggregation} sibling of a to-many relation field. */
  record RelationAggregation(int relationId) implements FieldBinding {}

  /** {@code _join(fields)} on an object; items of the hub are {@link DynamicJoin}. */
  record JoinHub(int objectId) implements FieldBinding {}

  record DynamicJoin(int targetObjectId, boolean aggregation) implements FieldBinding {}

  /** {@code _spatial(field, type, buffer)}; items of the hub are {@link SpatialJoin}. */
  record SpatialHub(int objectId) implements FieldBinding {}

  record SpatialJoin(int targetObjectId, boolean aggregation) implements FieldBinding {}

  // ---------- aggregation results

  record RowsCount(int objectId) implements FieldBinding {}

  /** Per-field aggregation object inside {@code <obj>_aggregations}. */
  record AggregatedField(int objectId, String field) implements FieldBinding {}

  /** Aggregate function of a scalar aggregation type, e.g. {@code sum}. */
  record AggregateFunction(String function) implements FieldBinding {}

  record BucketKey(int objectId) implements FieldBinding {}

  record BucketAggregations(int objectId) implements FieldBinding {}
}
