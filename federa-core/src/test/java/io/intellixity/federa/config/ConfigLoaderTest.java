package io.intellixity.federa.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ConfigLoaderTest {
  @Test
  void readsEngineConfigWithDefaults() throws Exception {
    Path file = Files.createTempFile("federa", ".json");
    Files.writeString(file, """
        {"default_limit": 500, "cache": {"enabled": false, "default_ttl_seconds": 5}, "unknown": 1}
        """);
    EngineConfig cfg = ConfigLoader.engineConfig(file);

    assertEquals(500, cfg.defaultLimit());
    assertEquals(30_000, cfg.requestTimeoutMillis());
    assertFalse(cfg.cache().enabled());
    assertEquals(5, cfg.cache().defaultTtlSeconds());
    assertEquals(10_000, cfg.cache().localMaxEntries());
    assertTrue(cfg.introspection());
  }

  @Test
  void classpathConfigOverridesDefaults() {
    EngineConfig cfg = ConfigLoader.engineConfigFromClasspath(ConfigLoader.DEFAULT_RESOURCE);
    assertEquals(1000, cfg.defaultLimit());
    assertEquals(2, cfg.workerThreads());

    assertSame(EngineConfig.DEFAULT, ConfigLoader.engineConfigFromClasspath("missing-federa.json"));
  }

  @Test
  void readsCatalogStoreSnapshot() {
    List<DataSourceDef> sources = ConfigLoader.dataSources("""
        [{"name": "crm", "type": "postgres", "path": "jdbc:postgresql://db/crm", "prefix": "crm",
          "read_only": true, "as_module": true,
          "catalogs": [{"name": "base", "path": "/catalogs/crm"}]}]
        """);
    DataSourceDef crm = sources.get(0);

    assertTrue(crm.readOnly());
    assertTrue(crm.asModule());
    assertEquals("crm", crm.prefix());
    assertEquals("localFS", crm.catalogs().get(0).type());
  }

  @Test
  void readsRoles() {
    List<RoleDef> roles = ConfigLoader.roles("""
        [{"name": "viewer", "permissions": [
          {"type_name": "orders", "filter": {"owner_id": {"eq": "[$auth.user_id]"}}},
          {"type_name": "customers", "field_name": "email", "hidden": true}]}]
        """);
    RoleDef viewer = roles.get(0);

    assertEquals("*", viewer.permissions().get(0).fieldName());
    assertTrue(viewer.permissions().get(1).hidden());
    assertThrows(IllegalArgumentException.class, () -> ConfigLoader.roles("{not json"));
  }
}
