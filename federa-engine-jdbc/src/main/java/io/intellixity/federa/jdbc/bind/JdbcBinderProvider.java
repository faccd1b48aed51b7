package io.intellixity.federa.jdbc.bind;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.federa.catalog.ScalarType;
import io.intellixity.federa.spi.source.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * JDBC-family binder base.
 * <p>
 * Dialect providers (e.g. postgres) extend this and add dialect binders, which are evaluated before
 * the base JDBC binders.
 */
public abstract class JdbcBinderProvider {
  static final ObjectMapper JSON = new ObjectMapper().registerModule(new JavaTimeModule());

  private volatile List<JdbcBinder> binders;

  public final List<JdbcBinder> binders() {
    List<JdbcBinder> b = binders;
    if (b == null) {
      List<JdbcBinder> out = new ArrayList<>();
      out.addAll(dialectBinders());
      out.addAll(jdbcBinders());
      b = List.copyOf(out);
      binders = b;
    }
    return b;
  }

  public final void bindAll(PreparedStatement ps, List<Bind> binds) throws SQLException {
    for (int i = 0; i < binds.size(); i++) {
      Bind b = binds.get(i);
      binderFor(b).bind(ps, i + 1, b);
    }
  }

  private JdbcBinder binderFor(Bind b) {
    for (JdbcBinder binder : binders()) {
      if (binder.supports(b)) return binder;
    }
    throw new IllegalStateException("No binder for " + b.type());
  }

  /** Dialect-specific binders (default empty). Put overriding binders here. */
  protected Collection<JdbcBinder> dialectBinders() {
    return Collections.emptyList();
  }

  /** Base JDBC binders shared by all JDBC dialects. */
  protected Collection<JdbcBinder> jdbcBinders() {
    return List.of(
        new NullBinder(),
        new TimestampBinder(),
        new JsonTextBinder(),
        new SetObjectBinder()
    );
  }

  static String toJson(Object value) throws SQLException {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SQLException("Cannot encode bind value as JSON", e);
    }
  }

  static final class NullBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) {
      return bind.value() == null;
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      ps.setNull(pos, Types.NULL);
    }
  }

  /** Timestamps are bound as UTC instants. */
  static final class TimestampBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) {
      return bind.value() instanceof OffsetDateTime;
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      ps.setTimestamp(pos, Timestamp.from(((OffsetDateTime) bind.value()).toInstant()));
    }
  }

  /** JSON values, and lists for dialects without native array binding, are bound as JSON text. */
  static final class JsonTextBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) {
      if (bind.type() == null) return bind.value() instanceof Collection<?>;
      return bind.type().list() || bind.type().scalar() == ScalarType.JSON || bind.type().scalar() == ScalarType.VECTOR;
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      ps.setString(pos, toJson(bind.value()));
    }
  }

  static final class SetObjectBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) {
      return true;
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      ps.setObject(pos, bind.value());
    }
  }
}
