package io.intellixity.federa.config;

import java.util.Objects;

/**
 * SDL catalog of a data source. {@code type} is {@code localFS} (directory or file path),
 * {@code classpath} (comma separated resource names) or {@code inline} ({@code path} holds the SDL text).
 */
public record CatalogDef(String name, String type, String path) {
  public CatalogDef {
    Objects.requireNonNull(name, "name");
    type = (type == null || type.isBlank()) ? "localFS" : type;
    Objects.requireNonNull(path, "path");
  }

  public static CatalogDef inline(String name, String sdl) {
    return new CatalogDef(name, "inline", sdl);
  }
}
