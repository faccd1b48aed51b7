package io.intellixity.federa.spi.source;

import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.config.DataSourceDef;

/** Creates adapters for one source type; discovered through {@code META-INF/federa.factories}. */
public interface SourceAdapterProvider {
  /** Data source type this provider serves, e.g. {@code postgres}. */
  String type();

  Capabilities capabilities();

  SourceAdapter create(DataSourceDef dataSource);
}
