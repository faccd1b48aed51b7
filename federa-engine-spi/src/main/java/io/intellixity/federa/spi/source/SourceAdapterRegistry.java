package io.intellixity.federa.spi.source;

import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.config.DataSourceDef;
import io.intellixity.federa.util.FederaFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Adapter providers keyed by source type, built via discovery ({@code META-INF/federa.factories}).
 * The first provider registered for a type wins.
 */
public final class SourceAdapterRegistry {
  private static final Logger log = LoggerFactory.getLogger(SourceAdapterRegistry.class);

  private final Map<String, SourceAdapterProvider> providers;

  public SourceAdapterRegistry() {
    this(FederaFactoriesLoader.load(SourceAdapterProvider.class));
  }

  public SourceAdapterRegistry(List<? extends SourceAdapterProvider> providers) {
    Map<String, SourceAdapterProvider> byType = new LinkedHashMap<>();
    for (SourceAdapterProvider p : providers) {
      if (p == null) continue;
      String type = normalize(p.type());
      SourceAdapterProvider prior = byType.putIfAbsent(type, p);
      if (prior != null) {
        log.warn("federa.spi duplicate_provider type={} kept={} ignored={}",
            type, prior.getClass().getName(), p.getClass().getName());
      }
    }
    this.providers = Collections.unmodifiableMap(byType);
  }

  public Set<String> types() { return providers.keySet(); }

  public SourceAdapterProvider provider(String type) {
    SourceAdapterProvider p = providers.get(normalize(type));
    if (p == null) throw new IllegalArgumentException("No source adapter provider for type '" + type + "'");
    return p;
  }

  /** Capabilities of a source type, {@code null} when the type is unknown. */
  public Capabilities capabilities(String type) {
    SourceAdapterProvider p = providers.get(normalize(type));
    return p == null ? null : p.capabilities();
  }

  public SourceAdapter create(DataSourceDef dataSource) {
    SourceAdapter adapter = provider(dataSource.type()).create(dataSource);
    log.info("federa.spi adapter_created dataSource={} type={}", dataSource.name(), dataSource.type());
    return adapter;
  }

  private static String normalize(String type) {
    return type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
  }
}
