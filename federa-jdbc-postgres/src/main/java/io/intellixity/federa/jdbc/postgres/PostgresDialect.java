package io.intellixity.federa.jdbc.postgres;

import io.intellixity.federa.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.federa.jdbc.dialect.JdbcDialect;
import io.intellixity.federa.query.QueryValidationException;
import org.postgresql.util.PGobject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Postgres dialect implementation for JDBC, with PostGIS and TimescaleDB functions.
 *
 * Keeps only Postgres-specific overrides. Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String jsonObject(List<String> keys, List<String> values) {
    List<String> args = new ArrayList<>();
    for (int i = 0; i < keys.size(); i++) {
      args.add(sqlString(keys.get(i)));
      args.add(values.get(i));
    }
    return "json_build_object(" + String.join(", ", args) + ")";
  }

  @Override
  protected String jsonArrayAgg(String expr) {
    return "COALESCE(json_agg(" + expr + "), '[]'::json)";
  }

  @Override
  protected String ilike(String expr, String param) {
    return expr + " ILIKE " + param;
  }

  @Override
  protected String regexMatch(String expr, String param) {
    return expr + " ~ " + param;
  }

  // Postgres array containment: col @> ARRAY[...], bound as one native array parameter.
  @Override
  protected String arrayContains(String expr, String param) {
    return expr + " @> " + param;
  }

  @Override
  protected String arrayOverlaps(String expr, String param) {
    return expr + " && " + param;
  }

  @Override
  protected String measurement(String type, String expr) {
    return switch (type) {
      case "AreaSpheroid" -> "ST_Area(" + expr + "::geography)";
      case "LengthSpheroid" -> "ST_Length(" + expr + "::geography)";
      case "PerimeterSpheroid" -> "ST_Perimeter(" + expr + "::geography)";
      default -> super.measurement(type, expr);
    };
  }

  @Override
  protected String timeBucket(String unit, String expr, boolean hypertable) {
    if (!hypertable) return super.timeBucket(unit, expr, false);
    String interval = switch (unit.toLowerCase(Locale.ROOT)) {
      case "minute" -> "1 minute";
      case "hour" -> "1 hour";
      case "day" -> "1 day";
      case "week" -> "1 week";
      case "month" -> "1 month";
      case "quarter" -> "3 months";
      case "year" -> "1 year";
      default -> throw new QueryValidationException("Unknown bucket '" + unit + "'");
    };
    return "time_bucket(INTERVAL '" + interval + "', " + expr + ")";
  }

  @Override
  protected String anyValue(String expr) {
    return "(ARRAY_AGG(" + expr + "))[1]";
  }

  @Override
  protected String lastValue(String expr) {
    return "(ARRAY_AGG(" + expr + "))[COUNT(*)]";
  }

  /** json/jsonb and other extension types arrive as {@link PGobject}; their text form is kept. */
  @Override
  public Object readValue(Object raw) {
    if (raw instanceof PGobject pg) return pg.getValue();
    return raw;
  }
}
