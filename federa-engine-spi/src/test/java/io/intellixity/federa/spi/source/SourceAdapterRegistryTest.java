package io.intellixity.federa.spi.source;

import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.config.DataSourceDef;
import io.intellixity.federa.spi.sql.Dialect;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SourceAdapterRegistryTest {
  public static class EchoProvider implements SourceAdapterProvider {
    @Override public String type() { return "echo"; }
    @Override public Capabilities capabilities() { return Capabilities.SCAN_ONLY; }

    @Override
    public SourceAdapter create(DataSourceDef dataSource) {
      return new SourceAdapter() {
        @Override public String name() { return dataSource.name(); }
        @Override public Capabilities capabilities() { return Capabilities.SCAN_ONLY; }
        @Override public Dialect dialect() { return null; }

        @Override
        public SourceResult execute(NativeQuery query, CancellationToken token) {
          token.throwIfCancelled(name());
          return SourceResult.ofRows(List.of(Map.of("source", query.dataSource())));
        }
      };
    }
  }

  /** Registered second for the same type; never used. */
  public static final class ShadowEchoProvider extends EchoProvider {
    @Override public Capabilities capabilities() { return Capabilities.FULL; }
  }

  private static DataSourceDef def(String name, String type) {
    return new DataSourceDef(name, type, null, null, false, false, List.of(), Map.of());
  }

  @Test
  void discoversProvidersFromFactoriesFile() {
    SourceAdapterRegistry registry = new SourceAdapterRegistry();
    assertEquals(List.of("echo"), List.copyOf(registry.types()));
    assertEquals(Capabilities.SCAN_ONLY, registry.capabilities("ECHO"));
    assertNull(registry.capabilities("postgres"));
  }

  @Test
  void createsAdapterForDataSourceType() {
    SourceAdapterRegistry registry = new SourceAdapterRegistry();
    try (SourceAdapter adapter = registry.create(def("files", "echo"))) {
      assertEquals("files", adapter.name());
      SourceResult r = adapter.execute(ScanRequest.select("files", "t", List.of(), null, null, null, null),
          CancellationToken.create());
      assertEquals("files", r.rows().get(0).get("source"));
    }
  }

  @Test
  void unknownTypeIsRejected() {
    SourceAdapterRegistry registry = new SourceAdapterRegistry(List.of(new EchoProvider()));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> registry.create(def("pg", "postgres")));
    assertTrue(e.getMessage().contains("postgres"));
  }
}
