package io.intellixity.federa.schema;

import io.intellixity.federa.catalog.Module;
import io.intellixity.federa.catalog.ScalarType;

/** Names of generated GraphQL types. */
public final class TypeNames {
  public static final String QUERY = "Query";
  public static final String MUTATION = "Mutation";
  public static final String FUNCTION = "Function";
  public static final String JOIN_HUB = "_join";
  public static final String SPATIAL_HUB = "_spatial";
  public static final String OPERATION_RESULT = "OperationResult";
  public static final String ORDER_BY_FIELD = "OrderByField";
  public static final String ORDER_DIRECTION = "OrderDirection";
  public static final String TIME_BUCKET = "TimeBucket";
  public static final String TIME_EXTRACT = "TimeExtract";
  public static final String MEASUREMENT_TYPES = "GeometryMeasurementTypes";
  public static final String MEASUREMENT_AGGREGATION = "MeasurementAggregation";
  public static final String SPATIAL_JOIN_TYPE = "SpatialJoinType";

  private TypeNames() {}

  public static String filter(String typeName) { return typeName + "_filter"; }

  public static String listFilter(String typeName) { return typeName + "_list_filter"; }

  public static String aggregations(String typeName) { return typeName + "_aggregations"; }

  public static String bucket(String typeName) { return typeName + "_bucket"; }

  public static String insertData(String typeName) { return typeName + "_mut_input_data"; }

  public static String updateData(String typeName) { return typeName + "_mut_data"; }

  public static String scalarFilter(ScalarType scalar, boolean list) {
    return scalar.graphqlName() + (list ? "ListFilter" : "Filter");
  }

  public static String scalarAggregation(ScalarType scalar) { return scalar.graphqlName() + "Aggregation"; }

  public static String moduleQuery(Module m) { return m.isRoot() ? QUERY : m.typeFragment() + "_query"; }

  public static String moduleMutation(Module m) { return m.isRoot() ? MUTATION : m.typeFragment() + "_mutation"; }

  public static String moduleFunction(Module m) { return m.isRoot() ? FUNCTION : m.typeFragment() + "_function"; }
}
