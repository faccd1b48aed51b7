package io.intellixity.federa.plan;

import java.util.List;
import java.util.Objects;

/** How a {@link LocalJoin} matches child rows to parent rows. Labels name row values. */
public sealed interface JoinPredicate {

  /** Tuple equality between parent and child labels. */
  record Equi(List<String> parentLabels, List<String> childLabels) implements JoinPredicate {
    public Equi {
      parentLabels = List.copyOf(parentLabels);
      childLabels = List.copyOf(childLabels);
      if (parentLabels.isEmpty() || parentLabels.size() != childLabels.size()) {
        throw new IllegalArgumentException("join keys " + parentLabels + " / " + childLabels + " do not line up");
      }
    }
  }

  /**
   * Many-to-many through junction rows: parent keys equal junction source keys, junction target keys
   * equal child keys.
   */
  record Junction(Equi parentToJunction, Equi junctionToChild) implements JoinPredicate {
    public Junction {
      Objects.requireNonNull(parentToJunction, "parentToJunction");
      Objects.requireNonNull(junctionToChild, "junctionToChild");
    }
  }

  /** Geometry predicate between a parent and a child geometry; {@code buffer} is the DWITHIN distance in coordinate units. */
  record Spatial(String parentLabel, String childLabel, SpatialType type, Integer buffer) implements JoinPredicate {
    public Spatial {
      Objects.requireNonNull(parentLabel, "parentLabel");
      Objects.requireNonNull(childLabel, "childLabel");
      Objects.requireNonNull(type, "type");
    }
  }

  enum SpatialType { INTERSECTS, WITHIN, CONTAINS, DISJOIN, DWITHIN }
}
