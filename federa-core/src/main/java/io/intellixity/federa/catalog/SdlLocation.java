package io.intellixity.federa.catalog;

/** Position of a definition inside an SDL document. */
public record SdlLocation(String source, int line, int column) {
  public static final SdlLocation UNKNOWN = new SdlLocation("<unknown>", 0, 0);

  @Override
  public String toString() { return source + ":" + line + ":" + column; }
}
