package io.intellixity.federa.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Reads engine settings and catalog store snapshots from JSON. */
public final class ConfigLoader {
  public static final String DEFAULT_RESOURCE = "federa.json";

  private static final ObjectMapper JSON = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private ConfigLoader() {}

  public static EngineConfig engineConfig(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return JSON.readValue(in, EngineConfig.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read engine config " + path, e);
    }
  }

  /** Reads {@code resource} from the classpath, or returns {@link EngineConfig#DEFAULT} when absent. */
  public static EngineConfig engineConfigFromClasspath(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = ConfigLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) return EngineConfig.DEFAULT;
      return JSON.readValue(in, EngineConfig.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read engine config resource " + resource, e);
    }
  }

  public static List<DataSourceDef> dataSources(String json) {
    try {
      return JSON.readValue(json, new TypeReference<List<DataSourceDef>>() {});
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid data source snapshot: " + e.getMessage(), e);
    }
  }

  public static List<RoleDef> roles(String json) {
    try {
      return JSON.readValue(json, new TypeReference<List<RoleDef>>() {});
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid role snapshot: " + e.getMessage(), e);
    }
  }
}
