package io.intellixity.federa.jdbc;

import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.jdbc.bind.JdbcBinderProvider;
import io.intellixity.federa.jdbc.dialect.DuckDbDialect;
import io.intellixity.federa.jdbc.dialect.JdbcDialect;

/** {@code duckdb} sources. The DuckDB JDBC driver is expected on the runtime class path. */
public final class DuckDbAdapterProvider extends JdbcSourceAdapterProvider {
  private static final JdbcDialect DIALECT = new DuckDbDialect();
  private static final JdbcBinderProvider BINDERS = new JdbcBinderProvider() {};

  @Override public String type() { return "duckdb"; }

  @Override
  public Capabilities capabilities() {
    return new Capabilities(false, true, true);
  }

  @Override protected JdbcDialect dialect() { return DIALECT; }
  @Override protected JdbcBinderProvider binderProvider() { return BINDERS; }
}
