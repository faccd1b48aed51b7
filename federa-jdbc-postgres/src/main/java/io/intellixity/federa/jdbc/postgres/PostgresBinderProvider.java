package io.intellixity.federa.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.federa.catalog.ScalarType;
import io.intellixity.federa.jdbc.bind.JdbcBinder;
import io.intellixity.federa.jdbc.bind.JdbcBinderProvider;
import io.intellixity.federa.spi.source.Bind;
import org.postgresql.util.PGobject;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Postgres-specific JDBC binders: jsonb, pgvector and native arrays. */
public final class PostgresBinderProvider extends JdbcBinderProvider {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Override
  protected Collection<JdbcBinder> dialectBinders() {
    return List.of(new PostgresJsonbBinder(), new PostgresVectorBinder(), new PostgresArrayBinder());
  }

  static final class PostgresJsonbBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) {
      return bind.value() != null && bind.type() != null && !bind.type().list()
          && bind.type().scalar() == ScalarType.JSON;
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      PGobject obj = new PGobject();
      obj.setType("jsonb");
      try {
        obj.setValue(bind.value() instanceof String s ? s : JSON.writeValueAsString(bind.value()));
      } catch (JsonProcessingException e) {
        throw new SQLException("Cannot encode jsonb bind", e);
      }
      ps.setObject(pos, obj);
    }
  }

  /** Embedding vectors use the pgvector text form {@code [1.0,2.0]}. */
  static final class PostgresVectorBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) {
      return bind.value() instanceof List<?> && bind.type() != null && bind.type().scalar() == ScalarType.VECTOR;
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      StringBuilder sb = new StringBuilder("[");
      List<?> values = (List<?>) bind.value();
      for (int i = 0; i < values.size(); i++) {
        if (i > 0) sb.append(',');
        sb.append(values.get(i));
      }
      PGobject obj = new PGobject();
      obj.setType("vector");
      obj.setValue(sb.append(']').toString());
      ps.setObject(pos, obj);
    }
  }

  /**
   * Binds list values as Postgres native arrays. This binder wins over the JDBC fallback that stores
   * lists as JSON text.
   */
  static final class PostgresArrayBinder implements JdbcBinder {
    private static final Map<ScalarType, String> PG_ELEM_TYPES = new EnumMap<>(ScalarType.class);

    static {
      PG_ELEM_TYPES.put(ScalarType.STRING, "text");
      PG_ELEM_TYPES.put(ScalarType.INT, "int4");
      PG_ELEM_TYPES.put(ScalarType.BIGINT, "int8");
      PG_ELEM_TYPES.put(ScalarType.FLOAT, "float8");
      PG_ELEM_TYPES.put(ScalarType.BOOLEAN, "bool");
      PG_ELEM_TYPES.put(ScalarType.DATE, "date");
      PG_ELEM_TYPES.put(ScalarType.TIMESTAMP, "timestamptz");
      PG_ELEM_TYPES.put(ScalarType.TIME, "time");
    }

    @Override
    public boolean supports(Bind bind) {
      return bind.value() instanceof Collection<?> && bind.type() != null && bind.type().list()
          && PG_ELEM_TYPES.containsKey(bind.type().scalar());
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      Object[] arr = ((Collection<?>) bind.value()).toArray();
      for (int i = 0; i < arr.length; i++) {
        if (arr[i] instanceof OffsetDateTime t) arr[i] = Timestamp.from(t.toInstant());
      }
      Array sqlArr = ps.getConnection().createArrayOf(PG_ELEM_TYPES.get(bind.type().scalar()), arr);
      ps.setArray(pos, sqlArr);
    }
  }
}
