package io.intellixity.federa.sdl;

import io.intellixity.federa.config.CatalogDef;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/** Materializes the SDL documents of a {@link CatalogDef}. */
public final class SdlSourceReader {
  private SdlSourceReader() {}

  public static List<SdlSource> read(CatalogDef def) {
    switch (def.type()) {
      case "inline":
        return List.of(new SdlSource(def.name(), def.path()));
      case "classpath":
        return fromClasspath(def);
      case "localFS":
        return fromFileSystem(def);
      default:
        throw new IllegalArgumentException("Unsupported catalog type '" + def.type() + "' of catalog " + def.name());
    }
  }

  private static List<SdlSource> fromFileSystem(CatalogDef def) {
    Path root = Path.of(def.path());
    try {
      if (Files.isRegularFile(root)) {
        return List.of(new SdlSource(root.toString(), Files.readString(root, StandardCharsets.UTF_8)));
      }
      List<SdlSource> out = new ArrayList<>();
      try (Stream<Path> files = Files.walk(root)) {
        for (Path p : files.filter(SdlSourceReader::isSdl).sorted().toList()) {
          out.add(new SdlSource(root.relativize(p).toString(), Files.readString(p, StandardCharsets.UTF_8)));
        }
      }
      return out;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read catalog " + def.name() + " from " + root, e);
    }
  }

  private static List<SdlSource> fromClasspath(CatalogDef def) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = SdlSourceReader.class.getClassLoader();
    List<SdlSource> out = new ArrayList<>();
    for (String part : def.path().split(",")) {
      String resource = part.trim();
      if (resource.isEmpty()) continue;
      try (InputStream in = cl.getResourceAsStream(resource)) {
        if (in == null) throw new UncheckedIOException(new IOException("Missing catalog resource " + resource));
        out.add(new SdlSource(resource, new String(in.readAllBytes(), StandardCharsets.UTF_8)));
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to read catalog resource " + resource, e);
      }
    }
    return out;
  }

  private static boolean isSdl(Path p) {
    String n = p.getFileName().toString();
    return Files.isRegularFile(p) && (n.endsWith(".graphql") || n.endsWith(".graphqls"));
  }
}
