package io.intellixity.federa.jdbc.bind;

import io.intellixity.federa.spi.source.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Sets one bind on a prepared statement. The first binder that supports a bind handles it. */
public interface JdbcBinder {
  boolean supports(Bind bind);

  void bind(PreparedStatement ps, int position1Based, Bind bind) throws SQLException;
}
