package io.intellixity.federa.jdbc.postgres;

import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.jdbc.JdbcSourceAdapterProvider;
import io.intellixity.federa.jdbc.bind.JdbcBinderProvider;
import io.intellixity.federa.jdbc.dialect.JdbcDialect;

/** {@code postgres} sources (PostGIS and TimescaleDB functions are used when the schema asks for them). */
public final class PostgresAdapterProvider extends JdbcSourceAdapterProvider {
  private static final JdbcDialect DIALECT = new PostgresDialect();
  private static final JdbcBinderProvider BINDERS = new PostgresBinderProvider();

  @Override public String type() { return "postgres"; }
  @Override public Capabilities capabilities() { return Capabilities.FULL; }

  @Override protected JdbcDialect dialect() { return DIALECT; }
  @Override protected JdbcBinderProvider binderProvider() { return BINDERS; }
  @Override protected String driverClassName() { return "org.postgresql.Driver"; }
}
