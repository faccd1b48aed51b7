package io.intellixity.federa.schema;

import graphql.Scalars;
import graphql.language.*;
import graphql.schema.*;
import io.intellixity.federa.catalog.ScalarType;
import io.intellixity.federa.query.Geometries;
import io.intellixity.federa.query.QueryValidationException;
import io.intellixity.federa.query.Values;
import org.locationtech.jts.geom.Geometry;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * GraphQL scalars of the catalog types. Built-in scalars are reused; the others coerce through
 * {@link Values} so literals, variables and results agree on one canonical form.
 */
public final class FederaScalars {
  private static final Map<ScalarType, GraphQLScalarType> CUSTOM = new EnumMap<>(ScalarType.class);

  static {
    for (ScalarType t : List.of(ScalarType.BIGINT, ScalarType.DATE, ScalarType.TIMESTAMP, ScalarType.TIME,
        ScalarType.JSON, ScalarType.GEOMETRY, ScalarType.VECTOR)) {
      CUSTOM.put(t, GraphQLScalarType.newScalar()
          .name(t.graphqlName())
          .description(description(t))
          .coercing(new CatalogCoercing(t))
          .build());
    }
  }

  private FederaScalars() {}

  public static GraphQLScalarType of(ScalarType type) {
    return switch (type) {
      case STRING -> Scalars.GraphQLString;
      case INT -> Scalars.GraphQLInt;
      case FLOAT -> Scalars.GraphQLFloat;
      case BOOLEAN -> Scalars.GraphQLBoolean;
      default -> CUSTOM.get(type);
    };
  }

  /** Scalars that have to be registered as additional schema types. */
  static Collection<GraphQLScalarType> custom() {
    return CUSTOM.values();
  }

  private static String description(ScalarType t) {
    return switch (t) {
      case BIGINT -> "64-bit integer";
      case DATE -> "ISO-8601 date";
      case TIMESTAMP -> "ISO-8601 timestamp, returned in UTC";
      case TIME -> "ISO-8601 local time";
      case JSON -> "Arbitrary JSON value";
      case GEOMETRY -> "Geometry as WKT, EWKT or hex WKB; returned as WKT";
      case VECTOR -> "Embedding vector";
      default -> null;
    };
  }

  /** Output form of a canonical value. */
  public static Object serialize(ScalarType type, Object value) {
    if (value == null) return null;
    return switch (type) {
      case BIGINT -> value instanceof Number n ? n.longValue() : Long.parseLong(value.toString());
      case DATE, TIMESTAMP, TIME -> Values.coerce(type, value).toString();
      case GEOMETRY -> value instanceof Geometry g ? Geometries.toWkt(g) : value.toString();
      case VECTOR -> Values.coerce(type, value);
      default -> value;
    };
  }

  public static Object literal(Value<?> v) {
    if (v == null || v instanceof NullValue) return null;
    if (v instanceof StringValue s) return s.getValue();
    if (v instanceof IntValue i) {
      BigInteger n = i.getValue();
      return n.bitLength() < 32 ? (Object) n.intValue() : (Object) n.longValueExact();
    }
    if (v instanceof FloatValue f) return f.getValue().doubleValue();
    if (v instanceof BooleanValue b) return b.isValue();
    if (v instanceof EnumValue e) return e.getName();
    if (v instanceof ArrayValue a) {
      List<Object> out = new ArrayList<>();
      for (Value<?> x : a.getValues()) out.add(literal(x));
      return out;
    }
    if (v instanceof ObjectValue o) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (ObjectField f : o.getObjectFields()) out.put(f.getName(), literal(f.getValue()));
      return out;
    }
    throw new IllegalArgumentException("Unsupported literal " + v.getClass().getSimpleName());
  }

  @SuppressWarnings("deprecation")
  private static final class CatalogCoercing implements Coercing<Object, Object> {
    private final ScalarType type;

    CatalogCoercing(ScalarType type) {
      this.type = type;
    }

    @Override
    public Object serialize(Object dataFetcherResult) {
      try {
        return FederaScalars.serialize(type, dataFetcherResult);
      } catch (RuntimeException e) {
        throw new CoercingSerializeException("Cannot serialize " + type.graphqlName() + ": " + e.getMessage(), e);
      }
    }

    @Override
    public Object parseValue(Object input) {
      try {
        return Values.coerce(type, input);
      } catch (QueryValidationException | IllegalArgumentException e) {
        throw new CoercingParseValueException(e.getMessage(), e);
      }
    }

    @Override
    public Object parseLiteral(Object input) {
      if (!(input instanceof Value<?> v)) {
        throw new CoercingParseLiteralException("Expected a literal for " + type.graphqlName());
      }
      if (type != ScalarType.JSON && type != ScalarType.VECTOR && (v instanceof ObjectValue || v instanceof ArrayValue)) {
        throw new CoercingParseLiteralException("Expected a scalar literal for " + type.graphqlName());
      }
      try {
        return Values.coerce(type, literal(v));
      } catch (QueryValidationException | IllegalArgumentException e) {
        throw new CoercingParseLiteralException(e.getMessage(), e);
      }
    }

    @Override
    public Value<?> valueToLiteral(Object input) {
      Object out = FederaScalars.serialize(type, input);
      if (out instanceof Long || out instanceof Integer) return new IntValue(BigInteger.valueOf(((Number) out).longValue()));
      if (out instanceof Number n) return new FloatValue(BigDecimal.valueOf(n.doubleValue()));
      if (out instanceof Boolean b) return new BooleanValue(b);
      return new StringValue(String.valueOf(out));
    }
  }
}
