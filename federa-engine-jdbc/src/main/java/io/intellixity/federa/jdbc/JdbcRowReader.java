package io.intellixity.federa.jdbc;

import io.intellixity.federa.jdbc.dialect.JdbcDialect;

import java.sql.*;
import java.time.ZoneOffset;
import java.util.*;

/** Reads result rows into maps keyed by column label, converting JDBC types into canonical values. */
public final class JdbcRowReader {
  private final JdbcDialect dialect;

  public JdbcRowReader(JdbcDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 0; i < n; i++) labels[i] = md.getColumnLabel(i + 1);

    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 0; i < n; i++) row.put(labels[i], value(rs.getObject(i + 1)));
      out.add(row);
    }
    return out;
  }

  Object value(Object raw) throws SQLException {
    if (raw == null) return null;
    if (raw instanceof Array a) {
      Object arr = a.getArray();
      List<Object> out = new ArrayList<>();
      if (arr instanceof Object[] oa) {
        for (Object o : oa) out.add(value(o));
      }
      return out;
    }
    if (raw instanceof Timestamp ts) return ts.toInstant().atOffset(ZoneOffset.UTC);
    if (raw instanceof java.sql.Date d) return d.toLocalDate();
    if (raw instanceof Time t) return t.toLocalTime();
    if (raw instanceof Clob c) return c.getSubString(1, (int) c.length());
    return dialect.readValue(raw);
  }
}
