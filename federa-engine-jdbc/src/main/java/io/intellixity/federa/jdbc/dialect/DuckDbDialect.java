package io.intellixity.federa.jdbc.dialect;

import java.util.ArrayList;
import java.util.List;

/**
 * DuckDB dialect. Spatial predicates need the {@code spatial} extension loaded on the connection.
 */
public final class DuckDbDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "duckdb"; }

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
    return "json_object(" + String.join(", ", args) + ")";
  }

  @Override
  protected String jsonArrayAgg(String expr) {
    return "COALESCE(json_group_array(" + expr + "), '[]')";
  }

  @Override
  protected String ilike(String expr, String param) {
    return expr + " ILIKE " + param;
  }

  @Override
  protected String regexMatch(String expr, String param) {
    return "regexp_matches(" + expr + ", " + param + ")";
  }

  @Override
  protected String arrayContains(String expr, String param) {
    return "list_has_all(" + expr + ", CAST(" + param + " AS JSON)::VARCHAR[])";
  }

  @Override
  protected String arrayOverlaps(String expr, String param) {
    return "list_has_any(" + expr + ", CAST(" + param + " AS JSON)::VARCHAR[])";
  }

  /** DuckDB geometries carry no SRID. */
  @Override
  protected String geometryParam(String param, Integer srid) {
    return "ST_GeomFromText(" + param + ")";
  }

  @Override
  protected String listAgg(String expr, boolean distinct) {
    return "LIST(" + (distinct ? "DISTINCT " : "") + expr + ")";
  }
}
