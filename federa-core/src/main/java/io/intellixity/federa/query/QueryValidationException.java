package io.intellixity.federa.query;

import java.util.List;

/**
 * Raised when a request references invalid fields, operators or directives, before any planning.
 * <p>
 * {@link #path()} is the GraphQL response path (aliases and argument names) of the offending element.
 */
public final class QueryValidationException extends RuntimeException {
  private final List<Object> path;

  public QueryValidationException(String message) {
    this(message, List.of());
  }

  public QueryValidationException(String message, List<Object> path) {
    super(message);
    this.path = List.copyOf(path == null ? List.of() : path);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
    this.path = List.of();
  }

  public List<Object> path() { return path; }
}
