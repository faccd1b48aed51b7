package io.intellixity.federa.jdbc.postgres;

import io.intellixity.federa.catalog.FieldType;
import io.intellixity.federa.catalog.ScalarType;
import io.intellixity.federa.jdbc.bind.JdbcBinder;
import io.intellixity.federa.spi.source.Bind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresBinderProviderTest {
  private final PostgresBinderProvider provider = new PostgresBinderProvider();

  private JdbcBinder binderFor(Bind b) {
    for (JdbcBinder binder : provider.binders()) {
      if (binder.supports(b)) return binder;
    }
    throw new AssertionError("no binder");
  }

  @Test
  void dialectBindersComeFirst() {
    assertInstanceOf(PostgresBinderProvider.PostgresJsonbBinder.class, provider.binders().get(0));
  }

  @Test
  void jsonGoesToJsonb() {
    JdbcBinder b = binderFor(new Bind(Map.of("a", 1), FieldType.of(ScalarType.JSON)));
    assertInstanceOf(PostgresBinderProvider.PostgresJsonbBinder.class, b);
  }

  @Test
  void scalarListsBecomeNativeArrays() {
    JdbcBinder b = binderFor(new Bind(List.of(1, 2), FieldType.listOf(ScalarType.INT)));
    assertInstanceOf(PostgresBinderProvider.PostgresArrayBinder.class, b);
  }

  @Test
  void vectorsUsePgvector() {
    JdbcBinder b = binderFor(new Bind(List.of(0.5, 1.0), FieldType.of(ScalarType.VECTOR)));
    assertInstanceOf(PostgresBinderProvider.PostgresVectorBinder.class, b);
  }

  @Test
  void nullsFallBackToBaseBinder() {
    JdbcBinder b = binderFor(new Bind(null, FieldType.of(ScalarType.JSON)));
    assertFalse(b instanceof PostgresBinderProvider.PostgresJsonbBinder);
  }
}
