package io.intellixity.federa.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.federa.config.DataSourceDef;
import io.intellixity.federa.jdbc.bind.JdbcBinderProvider;
import io.intellixity.federa.jdbc.dialect.JdbcDialect;
import io.intellixity.federa.spi.source.SourceAdapter;
import io.intellixity.federa.spi.source.SourceAdapterProvider;

import java.util.Map;

/**
 * Base provider of pooled JDBC sources. The data source {@code path} is the JDBC URL; {@code properties}
 * may set {@code user}, {@code password}, {@code pool_size}, {@code connection_timeout_ms} and
 * {@code fail_fast}.
 */
public abstract class JdbcSourceAdapterProvider implements SourceAdapterProvider {
  protected abstract JdbcDialect dialect();

  protected abstract JdbcBinderProvider binderProvider();

  /** Driver class to load, or {@code null} to rely on {@link java.sql.DriverManager} discovery. */
  protected String driverClassName() {
    return null;
  }

  @Override
  public SourceAdapter create(DataSourceDef def) {
    HikariDataSource ds = new HikariDataSource(poolConfig(def));
    return new JdbcSourceAdapter(def.name(), capabilities(), dialect(), ds, binderProvider());
  }

  HikariConfig poolConfig(DataSourceDef def) {
    if (def.path() == null || def.path().isBlank()) {
      throw new IllegalArgumentException("Data source '" + def.name() + "' has no JDBC url");
    }
    Map<String, String> p = def.properties();
    HikariConfig cfg = new HikariConfig();
    cfg.setPoolName("federa-" + def.name());
    cfg.setJdbcUrl(def.path());
    if (driverClassName() != null) cfg.setDriverClassName(driverClassName());
    if (p.containsKey("user")) cfg.setUsername(p.get("user"));
    if (p.containsKey("password")) cfg.setPassword(p.get("password"));
    cfg.setMaximumPoolSize(Integer.parseInt(p.getOrDefault("pool_size", "10")));
    cfg.setConnectionTimeout(Long.parseLong(p.getOrDefault("connection_timeout_ms", "30000")));
    // Connect lazily unless asked to fail at startup.
    cfg.setInitializationFailTimeout(Boolean.parseBoolean(p.getOrDefault("fail_fast", "false")) ? 1 : -1);
    cfg.setReadOnly(def.readOnly());
    cfg.setAutoCommit(true);
    return cfg;
  }
}
