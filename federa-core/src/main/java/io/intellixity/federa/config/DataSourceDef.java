package io.intellixity.federa.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Data source record of the catalog store snapshot.
 *
 * @param path       connection string handed to the adapter (JDBC URL, base URL, ...)
 * @param properties adapter specific settings (credentials, pool size)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DataSourceDef(String name,
                            String type,
                            String path,
                            String prefix,
                            @JsonProperty("read_only") boolean readOnly,
                            @JsonProperty("as_module") boolean asModule,
                            List<CatalogDef> catalogs,
                            Map<String, String> properties) {
  public DataSourceDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    catalogs = List.copyOf(catalogs == null ? List.of() : catalogs);
    properties = Map.copyOf(properties == null ? Map.of() : properties);
  }

  public static DataSourceDef of(String name, String type, String path, CatalogDef... catalogs) {
    return new DataSourceDef(name, type, path, null, false, false, List.of(catalogs), Map.of());
  }

  public DataSourceDef withPrefix(String newPrefix) {
    return new DataSourceDef(name, type, path, newPrefix, readOnly, asModule, catalogs, properties);
  }

  public DataSourceDef withAsModule(boolean value) {
    return new DataSourceDef(name, type, path, prefix, readOnly, value, catalogs, properties);
  }

  public DataSourceDef withReadOnly(boolean value) {
    return new DataSourceDef(name, type, path, prefix, value, asModule, catalogs, properties);
  }
}
