package io.intellixity.federa.spi.sql;

import java.util.*;

/**
 * One output of a relational read. {@code output} is the column label (or JSON key for nested
 * selections) the row carries the value under.
 */
public sealed interface Projection {
  String output();

  /**
   * Field value, optionally truncated to a time {@code bucket}. On cube reads {@code measurementFunc}
   * aggregates a measurement field ({@code SUM} when absent).
   */
  record Column(String output, String field, String bucket, String measurementFunc) implements Projection {
    public Column {
      Objects.requireNonNull(output, "output");
      Objects.requireNonNull(field, "field");
    }

    public static Column of(String field) {
      return new Column(field, field, null, null);
    }

    public static Column as(String output, String field) {
      return new Column(output, field, null, null);
    }
  }

  /** {@code EXTRACT(part FROM field)}, integer divided by {@code divide} when set. */
  record TimePart(String output, String field, String extract, Integer divide) implements Projection {}

  /** Spatial measurement ({@code Area}, {@code LengthSpheroid}, ...) of a geometry field. */
  record Measurement(String output, String field, String type) implements Projection {}

  /**
   * Scalar function evaluated per row. Function arguments come from the row ({@code fieldArgs}) or
   * from the request ({@code constArgs}).
   */
  record FunctionValue(String output, String module, String function, Map<String, String> fieldArgs,
                       Map<String, Object> constArgs) implements Projection {
    public FunctionValue {
      module = module == null ? "" : module;
      fieldArgs = Collections.unmodifiableMap(new LinkedHashMap<>(fieldArgs == null ? Map.of() : fieldArgs));
      constArgs = Collections.unmodifiableMap(new LinkedHashMap<>(constArgs == null ? Map.of() : constArgs));
    }
  }

  /**
   * Related rows rendered in the same statement: a JSON object for to-one relations, a JSON array for
   * to-many relations. {@code inner} drops parent rows without a match.
   */
  record Nested(String output, int relationId, SelectSpec select, boolean inner) implements Projection {
    public Nested {
      Objects.requireNonNull(select, "select");
    }
  }

  /** {@code <relation>_aggregation}: JSON object of aggregates over the related rows. */
  record NestedAggregation(String output, int relationId, AggregateSpec aggregate) implements Projection {
    public NestedAggregation {
      Objects.requireNonNull(aggregate, "aggregate");
    }
  }

  /**
   * Object-returning {@code @function_call} field. The function source of {@code select} takes
   * argument values from the parent row; a table join additionally matches the function result on
   * {@code FunctionCall} key fields.
   */
  record FunctionRows(String output, String field, SelectSpec select, boolean list) implements Projection {
    public FunctionRows {
      Objects.requireNonNull(select, "select");
      if (select.function() == null) throw new IllegalArgumentException("select of " + field + " has no function source");
    }
  }
}
