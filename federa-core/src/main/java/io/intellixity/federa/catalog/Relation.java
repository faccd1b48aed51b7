package io.intellixity.federa.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Directed edge between two data objects, addressed by arena ids.
 * <p>
 * Equality joins use {@code sourceFields}/{@code targetFields}; {@code @join} relations may carry a
 * raw {@code joinCondition} referencing {@code [source.field]} and {@code [target.field]}.
 * Many-to-many relations go through {@code junction}: {@code source.sourceFields = junction.junctionSourceFields}
 * and {@code junction.junctionTargetFields = target.targetFields}.
 */
public record Relation(int id, String name, int fromObject, int toObject,
                       List<String> sourceFields, List<String> targetFields,
                       Cardinality cardinality, String inverseName, String joinCondition,
                       int junction, List<String> junctionSourceFields, List<String> junctionTargetFields,
                       boolean crossSource, SdlLocation declaredAt) {
  public static final int NO_JUNCTION = -1;

  public Relation {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(cardinality, "cardinality");
    sourceFields = List.copyOf(sourceFields == null ? List.of() : sourceFields);
    targetFields = List.copyOf(targetFields == null ? List.of() : targetFields);
    junctionSourceFields = List.copyOf(junctionSourceFields == null ? List.of() : junctionSourceFields);
    junctionTargetFields = List.copyOf(junctionTargetFields == null ? List.of() : junctionTargetFields);
    if (sourceFields.size() != targetFields.size()) {
      throw new IllegalArgumentException("relation " + name + " has mismatched key arity");
    }
    if (sourceFields.isEmpty() && (joinCondition == null || joinCondition.isBlank())) {
      throw new IllegalArgumentException("relation " + name + " has neither key fields nor a join condition");
    }
  }

  public boolean hasJunction() { return junction != NO_JUNCTION; }

  /** True when rows can be matched by key equality only (hash join, semi join). */
  public boolean equiJoin() { return !sourceFields.isEmpty() && (joinCondition == null || joinCondition.isBlank()); }

  public Relation withId(int newId) {
    return new Relation(newId, name, fromObject, toObject, sourceFields, targetFields, cardinality, inverseName,
        joinCondition, junction, junctionSourceFields, junctionTargetFields, crossSource, declaredAt);
  }
}
