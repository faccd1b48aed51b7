package io.intellixity.federa.jdbc.dialect;

import io.intellixity.federa.spi.sql.Dialect;

/** Dialect of a JDBC source. */
public interface JdbcDialect extends Dialect {
  /** Converts a driver-specific column value (e.g. {@code PGobject}) into a plain Java value. */
  default Object readValue(Object raw) {
    return raw;
  }
}
