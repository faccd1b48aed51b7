package io.intellixity.federa.governance;

import java.util.List;

/** The caller's role may not use a type or field. Reported with code {@code ACCESS_DENIED}. */
public final class AccessDeniedException extends RuntimeException {
  private final List<Object> path;

  public AccessDeniedException(String message) {
    this(message, List.of());
  }

  public AccessDeniedException(String message, List<Object> path) {
    super(message);
    this.path = List.copyOf(path == null ? List.of() : path);
  }

  public List<Object> path() { return path; }
}
