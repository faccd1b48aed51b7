package io.intellixity.federa.engine.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.config.DataSourceDef;
import io.intellixity.federa.spi.source.SourceAdapter;
import io.intellixity.federa.spi.source.SourceAdapterProvider;
import io.intellixity.federa.spi.source.SourceExecutionException;
import io.intellixity.federa.spi.source.SourceExecutionException.Code;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Source type {@code memory}. A non-blank {@code path} names a JSON document
 * {@code {"<object>": [rows...]}} on the file system, or on the classpath with a {@code classpath:} prefix.
 */
public final class InMemorySourceAdapterProvider implements SourceAdapterProvider {
  public static final String TYPE = "memory";
  private static final String CLASSPATH = "classpath:";

  private static final ObjectMapper JSON = new ObjectMapper();

  @Override public String type() { return TYPE; }
  @Override public Capabilities capabilities() { return Capabilities.SCAN_ONLY; }

  @Override
  public SourceAdapter create(DataSourceDef dataSource) {
    InMemorySourceAdapter adapter = new InMemorySourceAdapter(dataSource.name());
    if (dataSource.path() == null || dataSource.path().isBlank()) return adapter;
    for (Map.Entry<String, List<Map<String, Object>>> t : load(dataSource).entrySet()) {
      adapter.put(t.getKey(), t.getValue());
    }
    return adapter;
  }

  private static Map<String, List<Map<String, Object>>> load(DataSourceDef ds) {
    String path = ds.path().trim();
    TypeReference<Map<String, List<Map<String, Object>>>> type = new TypeReference<>() {};
    try {
      if (path.startsWith(CLASSPATH)) {
        String resource = path.substring(CLASSPATH.length());
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = InMemorySourceAdapterProvider.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
          if (in == null) {
            throw new SourceExecutionException(Code.SOURCE_UNAVAILABLE, ds.name(), "Missing data resource " + resource);
          }
          return JSON.readValue(in, type);
        }
      }
      try (InputStream in = Files.newInputStream(Path.of(path))) {
        return JSON.readValue(in, type);
      }
    } catch (IOException e) {
      throw new SourceExecutionException(Code.SOURCE_UNAVAILABLE, ds.name(), "Failed to read data of " + ds.name(), e);
    }
  }
}
