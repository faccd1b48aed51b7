package io.intellixity.federa.spi.source;

import java.util.List;
import java.util.Objects;

/**
 * SQL text with {@code :bN} named placeholders and their binds in appearance order.
 */
public record SqlStatement(String dataSource, String sql, List<Bind> binds, ExecKind execKind) implements NativeQuery {
  public enum ExecKind {
    /** {@code executeQuery()}, rows are returned. */
    QUERY,
    /** {@code executeUpdate()}, only the affected row count is returned. */
    UPDATE,
    /** {@code executeQuery()} on DML with a RETURNING clause. */
    RETURNING
  }

  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = execKind == null ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String dataSource, String sql, List<Bind> binds) {
    this(dataSource, sql, binds, ExecKind.QUERY);
  }

  public SqlStatement withExecKind(ExecKind kind) {
    return new SqlStatement(dataSource, sql, binds, kind);
  }
}
