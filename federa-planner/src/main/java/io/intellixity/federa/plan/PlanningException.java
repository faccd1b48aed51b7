package io.intellixity.federa.plan;

import java.util.List;

/**
 * A valid request that cannot be turned into a plan: conflicting directives, relations that can
 * neither be pushed down nor merged locally, missing required insert values.
 */
public final class PlanningException extends RuntimeException {
  private final List<Object> path;

  public PlanningException(String message, List<Object> path) {
    super(message);
    this.path = List.copyOf(path == null ? List.of() : path);
  }

  public List<Object> path() { return path; }
}
