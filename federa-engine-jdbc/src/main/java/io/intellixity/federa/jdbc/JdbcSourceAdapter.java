package io.intellixity.federa.jdbc;

import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.jdbc.bind.JdbcBinderProvider;
import io.intellixity.federa.jdbc.dialect.JdbcDialect;
import io.intellixity.federa.spi.source.*;
import io.intellixity.federa.spi.source.SourceExecutionException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Source adapter over a pooled JDBC {@link DataSource}. Every statement runs on its own connection in
 * auto-commit mode.
 */
public final class JdbcSourceAdapter implements SourceAdapter {
  private static final Logger log = LoggerFactory.getLogger(JdbcSourceAdapter.class);

  private final String name;
  private final Capabilities capabilities;
  private final JdbcDialect dialect;
  private final DataSource ds;
  private final JdbcBinderProvider binders;
  private final JdbcRowReader reader;

  public JdbcSourceAdapter(String name, Capabilities capabilities, JdbcDialect dialect, DataSource ds,
                           JdbcBinderProvider binders) {
    this.name = Objects.requireNonNull(name, "name");
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.ds = Objects.requireNonNull(ds, "ds");
    this.binders = Objects.requireNonNull(binders, "binders");
    this.reader = new JdbcRowReader(dialect);
  }

  @Override public String name() { return name; }
  @Override public Capabilities capabilities() { return capabilities; }
  @Override public JdbcDialect dialect() { return dialect; }

  @Override
  public SourceResult execute(NativeQuery query, CancellationToken token) {
    if (!(query instanceof SqlStatement ss)) {
      throw new SourceExecutionException(Code.EXECUTION_FAILED, name,
          "JDBC source does not accept " + query.getClass().getSimpleName());
    }
    token.throwIfCancelled(name);
    String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql(ss, jdbcSql);

    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql);
         CancellationToken.Registration ignored = token.onCancel(() -> cancelQuietly(ps))) {
      long remaining = token.remainingMillis();
      if (remaining != Long.MAX_VALUE) {
        if (remaining <= 0) token.throwIfCancelled(name);
        ps.setQueryTimeout((int) Math.max(1, (remaining + 999) / 1000));
      }
      binders.bindAll(ps, ss.binds());

      SourceResult result;
      if (ss.execKind() == SqlStatement.ExecKind.UPDATE) {
        result = SourceResult.ofCount(ps.executeUpdate());
      } else {
        try (ResultSet rs = ps.executeQuery()) {
          List<Map<String, Object>> rows = reader.readAll(rs);
          result = SourceResult.ofRows(rows);
        }
      }
      debugDone(ss, result, System.nanoTime() - start);
      return result;
    } catch (SQLException e) {
      throw translate(e, token);
    }
  }

  private void cancelQuietly(PreparedStatement ps) {
    try {
      ps.cancel();
    } catch (SQLException e) {
      log.warn("federa.jdbc cancel_failed source={} error={}", name, e.getMessage());
    }
  }

  SourceExecutionException translate(SQLException e, CancellationToken token) {
    String state = e.getSQLState() == null ? "" : e.getSQLState();
    Code code;
    if (token.isCancelled() || "57014".equals(state) || e instanceof SQLTimeoutException) {
      boolean explicit = token.isCancelled() && !token.expired();
      code = explicit ? Code.CANCELLED : Code.TIMEOUT;
    } else {
      code = codeOf(state);
    }
    log.warn("federa.jdbc failed source={} code={} sqlState={} error={}", name, code, state, e.getMessage());
    return new SourceExecutionException(code, name, e.getMessage(), e);
  }

  static Code codeOf(String sqlState) {
    if (sqlState == null) return Code.EXECUTION_FAILED;
    return switch (sqlState) {
      case "23505" -> Code.UNIQUE_VIOLATION;
      case "23503" -> Code.FOREIGN_KEY_VIOLATION;
      case "23502" -> Code.NOT_NULL_VIOLATION;
      case "23514" -> Code.CHECK_VIOLATION;
      default -> sqlState.startsWith("08") ? Code.SOURCE_UNAVAILABLE : Code.EXECUTION_FAILED;
    };
  }

  @Override
  public void close() {
    if (ds instanceof AutoCloseable ac) {
      try {
        ac.close();
      } catch (Exception e) {
        log.warn("federa.jdbc close_failed source={} error={}", name, e.getMessage());
      }
    }
  }

  private void debugSql(SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("federa.jdbc source={} dialect={} execKind={} bindCount={} sql={}",
        name, dialect.id(), ss.execKind(), ss.binds().size(), jdbcSql);

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("federa.jdbc bind index={} type={} valueType={} valueLen={}", idx++, b.type(), vType, vLen);
      }
    }
  }

  private void debugDone(SqlStatement ss, SourceResult result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("federa.jdbc_done source={} execKind={} durationMs={} rows={} affected={}",
        name, ss.execKind(), durationNanos / 1_000_000.0, result.rows().size(), result.affectedRows());
  }
}
