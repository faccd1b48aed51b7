package io.intellixity.federa.jdbc;

import com.zaxxer.hikari.HikariConfig;
import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.config.DataSourceDef;
import io.intellixity.federa.jdbc.bind.JdbcBinderProvider;
import io.intellixity.federa.jdbc.dialect.DuckDbDialect;
import io.intellixity.federa.spi.source.CancellationToken;
import io.intellixity.federa.spi.source.ScanRequest;
import io.intellixity.federa.spi.source.SourceExecutionException;
import io.intellixity.federa.spi.source.SqlStatement;
import io.intellixity.federa.spi.source.SourceExecutionException.Code;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcSourceAdapterTest {
  /** Data source that never connects; these tests do not reach the database. */
  static final class NoDataSource implements DataSource {
    @Override public Connection getConnection() throws SQLException { throw new SQLException("no database", "08001"); }
    @Override public Connection getConnection(String u, String p) throws SQLException { return getConnection(); }
    @Override public PrintWriter getLogWriter() { return null; }
    @Override public void setLogWriter(PrintWriter out) {}
    @Override public void setLoginTimeout(int seconds) {}
    @Override public int getLoginTimeout() { return 0; }
    @Override public Logger getParentLogger() { return Logger.getGlobal(); }
    @Override public <T> T unwrap(Class<T> iface) throws SQLException { throw new SQLException("not a wrapper"); }
    @Override public boolean isWrapperFor(Class<?> iface) { return false; }
  }

  private static JdbcSourceAdapter adapter() {
    return new JdbcSourceAdapter("files", Capabilities.RELATIONAL, new DuckDbDialect(), new NoDataSource(),
        new JdbcBinderProvider() {});
  }

  @Test
  void mapsSqlStatesToExecutionCodes() {
    assertEquals(Code.UNIQUE_VIOLATION, JdbcSourceAdapter.codeOf("23505"));
    assertEquals(Code.FOREIGN_KEY_VIOLATION, JdbcSourceAdapter.codeOf("23503"));
    assertEquals(Code.NOT_NULL_VIOLATION, JdbcSourceAdapter.codeOf("23502"));
    assertEquals(Code.CHECK_VIOLATION, JdbcSourceAdapter.codeOf("23514"));
    assertEquals(Code.SOURCE_UNAVAILABLE, JdbcSourceAdapter.codeOf("08006"));
    assertEquals(Code.EXECUTION_FAILED, JdbcSourceAdapter.codeOf("42P01"));
  }

  @Test
  void connectionFailureIsSourceUnavailable() {
    SqlStatement stmt = new SqlStatement("files", "SELECT 1", List.of());
    SourceExecutionException ex = assertThrows(SourceExecutionException.class,
        () -> adapter().execute(stmt, CancellationToken.create()));
    assertEquals(Code.SOURCE_UNAVAILABLE, ex.code());
    assertEquals("files", ex.dataSource());
  }

  @Test
  void statementTimeoutIsReportedAsTimeout() {
    SourceExecutionException ex = adapter().translate(new SQLTimeoutException("slow"), CancellationToken.create());
    assertEquals(Code.TIMEOUT, ex.code());
  }

  @Test
  void explicitCancelIsReportedAsCancelled() {
    CancellationToken token = CancellationToken.create();
    token.cancel("client gone");
    SourceExecutionException ex = adapter().translate(new SQLException("canceling statement", "57014"), token);
    assertEquals(Code.CANCELLED, ex.code());
  }

  @Test
  void cancelledTokenStopsBeforeConnecting() {
    CancellationToken token = CancellationToken.create();
    token.cancel("client gone");
    SqlStatement stmt = new SqlStatement("files", "SELECT 1", List.of());
    SourceExecutionException ex = assertThrows(SourceExecutionException.class, () -> adapter().execute(stmt, token));
    assertEquals(Code.CANCELLED, ex.code());
  }

  @Test
  void scanRequestsAreRejected() {
    ScanRequest scan = ScanRequest.select("files", "orders", List.of("id"), null, List.of(), null, null);
    SourceExecutionException ex = assertThrows(SourceExecutionException.class,
        () -> adapter().execute(scan, CancellationToken.create()));
    assertEquals(Code.EXECUTION_FAILED, ex.code());
  }

  @Test
  void poolConfigComesFromDataSourceRecord() {
    DataSourceDef def = new DataSourceDef("files", "duckdb", "jdbc:duckdb:/tmp/files.db", null, true, false,
        List.of(), Map.of("user", "reader", "pool_size", "3"));

    HikariConfig cfg = new DuckDbAdapterProvider().poolConfig(def);

    assertEquals("jdbc:duckdb:/tmp/files.db", cfg.getJdbcUrl());
    assertEquals("reader", cfg.getUsername());
    assertEquals(3, cfg.getMaximumPoolSize());
    assertTrue(cfg.isReadOnly());
    assertEquals("federa-files", cfg.getPoolName());
  }

  @Test
  void missingJdbcUrlIsRejected() {
    DataSourceDef def = DataSourceDef.of("files", "duckdb", null);
    assertThrows(IllegalArgumentException.class, () -> new DuckDbAdapterProvider().poolConfig(def));
  }
}
