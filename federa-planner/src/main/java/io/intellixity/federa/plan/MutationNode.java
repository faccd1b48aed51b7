package io.intellixity.federa.plan;

import io.intellixity.federa.spi.sql.DeleteSpec;
import io.intellixity.federa.spi.sql.InsertSpec;
import io.intellixity.federa.spi.sql.UpdateSpec;

import java.util.List;
import java.util.Set;

/** One insert, update or delete; {@link #invalidateTags()} are purged after it succeeds. */
public final class MutationNode extends PlanNode {
  private final int objectId;
  private final InsertSpec insert;
  private final UpdateSpec update;
  private final DeleteSpec delete;
  private final Set<String> invalidateTags;
  private final boolean scan;

  MutationNode(String dataSource, List<Object> path, int objectId, InsertSpec insert, UpdateSpec update,
               DeleteSpec delete, Set<String> invalidateTags, boolean scan) {
    super(dataSource, path);
    int specs = (insert != null ? 1 : 0) + (update != null ? 1 : 0) + (delete != null ? 1 : 0);
    if (specs != 1) throw new IllegalArgumentException("mutation of object " + objectId + " needs exactly one spec");
    this.objectId = objectId;
    this.insert = insert;
    this.update = update;
    this.delete = delete;
    this.invalidateTags = Set.copyOf(invalidateTags == null ? Set.of() : invalidateTags);
    this.scan = scan;
    resolve(!scan);
  }

  public int objectId() { return objectId; }
  public InsertSpec insert() { return insert; }
  public UpdateSpec update() { return update; }
  public DeleteSpec delete() { return delete; }
  public Set<String> invalidateTags() { return invalidateTags; }
  public boolean scan() { return scan; }

  @Override
  public String toString() {
    String kind = insert != null ? "insert" : update != null ? "update" : "delete";
    return "MutationNode(" + dataSource() + "#" + objectId + "," + kind + ")";
  }
}
