package io.intellixity.federa.sdl;

import java.util.Objects;

/** One SDL document; {@code name} is reported in error locations. */
public record SdlSource(String name, String text) {
  public SdlSource {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(text, "text");
  }
}
