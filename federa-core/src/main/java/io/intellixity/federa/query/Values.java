package io.intellixity.federa.query;

import io.intellixity.federa.catalog.FieldType;
import io.intellixity.federa.catalog.ScalarType;
import org.locationtech.jts.geom.Geometry;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Canonical Java values of the catalog scalars and their comparison rules.
 * <p>
 * Canonical types: String, Integer, Long, Double, Boolean, LocalDate, OffsetDateTime (UTC), LocalTime,
 * JTS Geometry, {@code List<Double>} for vectors; JSON values stay as parsed maps and lists.
 */
public final class Values {
  private Values() {}

  public static Object coerce(FieldType type, Object raw) {
    if (raw == null) return null;
    if (type.list() && raw instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(coerce(type.scalar(), o));
      return out;
    }
    return coerce(type.scalar(), raw);
  }

  public static Object coerce(ScalarType scalar, Object raw) {
    if (raw == null) return null;
    try {
      switch (scalar) {
        case STRING:
          return raw.toString();
        case INT:
          return raw instanceof Number n ? n.intValue() : Integer.parseInt(raw.toString());
        case BIGINT:
          return raw instanceof Number n ? n.longValue() : Long.parseLong(raw.toString());
        case FLOAT:
          return raw instanceof Number n ? n.doubleValue() : Double.parseDouble(raw.toString());
        case BOOLEAN:
          return raw instanceof Boolean b ? b : Boolean.parseBoolean(raw.toString());
        case DATE:
          return toDate(raw);
        case TIMESTAMP:
          return toTimestamp(raw);
        case TIME:
          return raw instanceof LocalTime t ? t : LocalTime.parse(raw.toString());
        case GEOMETRY:
          return Geometries.parse(raw);
        case VECTOR:
          return toVector(raw);
        case JSON:
        default:
          return raw;
      }
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new QueryValidationException("Invalid " + scalar.graphqlName() + " value '" + raw + "'", e);
    }
  }

  public static LocalDate toDate(Object raw) {
    if (raw instanceof LocalDate d) return d;
    if (raw instanceof OffsetDateTime t) return t.toLocalDate();
    if (raw instanceof LocalDateTime t) return t.toLocalDate();
    if (raw instanceof java.sql.Date d) return d.toLocalDate();
    String s = raw.toString();
    return s.length() > 10 ? toTimestamp(s).toLocalDate() : LocalDate.parse(s);
  }

  public static OffsetDateTime toTimestamp(Object raw) {
    if (raw instanceof OffsetDateTime t) return t.withOffsetSameInstant(ZoneOffset.UTC);
    if (raw instanceof Instant i) return i.atOffset(ZoneOffset.UTC);
    if (raw instanceof ZonedDateTime z) return z.toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
    if (raw instanceof LocalDateTime t) return t.atOffset(ZoneOffset.UTC);
    if (raw instanceof LocalDate d) return d.atStartOfDay().atOffset(ZoneOffset.UTC);
    if (raw instanceof java.sql.Timestamp ts) return ts.toInstant().atOffset(ZoneOffset.UTC);
    if (raw instanceof Date d) return d.toInstant().atOffset(ZoneOffset.UTC);
    String s = raw.toString().trim().replace(' ', 'T');
    if (s.length() == 10) return LocalDate.parse(s).atStartOfDay().atOffset(ZoneOffset.UTC);
    try {
      return OffsetDateTime.parse(s).withOffsetSameInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      return LocalDateTime.parse(s).atOffset(ZoneOffset.UTC);
    }
  }

  private static List<Double> toVector(Object raw) {
    if (raw instanceof Collection<?> c) {
      List<Double> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(((Number) o).doubleValue());
      return out;
    }
    String s = raw.toString().trim();
    if (s.startsWith("[")) s = s.substring(1, s.length() - 1);
    List<Double> out = new ArrayList<>();
    for (String part : s.split(",")) {
      if (!part.isBlank()) out.add(Double.parseDouble(part.trim()));
    }
    return out;
  }

  /** Equality across numeric widths and temporal representations. */
  public static boolean equal(Object a, Object b) {
    if (a == null || b == null) return a == b;
    if (a instanceof Number && b instanceof Number) return compare(a, b) == 0;
    if (isTemporal(a) && isTemporal(b)) return compare(a, b) == 0;
    if (a instanceof Geometry ga && b instanceof Geometry gb) return ga.equalsTopo(gb);
    if (a instanceof List<?> la && b instanceof List<?> lb) {
      if (la.size() != lb.size()) return false;
      for (int i = 0; i < la.size(); i++) {
        if (!equal(la.get(i), lb.get(i))) return false;
      }
      return true;
    }
    return a.equals(b);
  }

  /** Natural order; nulls sort last. */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compare(Object a, Object b) {
    if (a == b) return 0;
    if (a == null) return 1;
    if (b == null) return -1;
    if (a instanceof Number na && b instanceof Number nb) return toBigDecimal(na).compareTo(toBigDecimal(nb));
    if (isTemporal(a) && isTemporal(b)) {
      if (a instanceof LocalTime ta && b instanceof LocalTime tb) return ta.compareTo(tb);
      return toTimestamp(a).compareTo(toTimestamp(b));
    }
    if (a instanceof Comparable ca && a.getClass().isInstance(b)) return ca.compareTo(b);
    return a.toString().compareTo(b.toString());
  }

  /** Hash key used by local joins; numerically equal values share a key. */
  public static Object joinKey(Object v) {
    if (v instanceof Number n) {
      BigDecimal d = toBigDecimal(n).stripTrailingZeros();
      return d.scale() <= 0 ? d.toBigInteger() : d;
    }
    if (v instanceof CharSequence s) return s.toString();
    if (isTemporal(v) && !(v instanceof LocalTime)) return toTimestamp(v).toInstant();
    return v;
  }

  private static boolean isTemporal(Object o) {
    return o instanceof LocalDate || o instanceof OffsetDateTime || o instanceof LocalDateTime
        || o instanceof Instant || o instanceof LocalTime || o instanceof ZonedDateTime || o instanceof Date;
  }

  static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal d) return d;
    if (n instanceof BigInteger i) return new BigDecimal(i);
    if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
    return BigDecimal.valueOf(n.longValue());
  }
}
