package io.intellixity.federa.engine;

import io.intellixity.federa.config.DataSourceDef;
import io.intellixity.federa.config.RoleDef;

import java.util.List;

/**
 * Cluster membership seen by one engine node. The engine reloads its snapshot when another node
 * signals a schema change.
 */
public interface ClusterCoordinator {
  /** Registers the callback run when the shared catalog changed. */
  void onSchemaInvalidated(Runnable callback);

  /** Current catalog store snapshot. */
  SourceSnapshot currentSourceSnapshot();

  /** Data sources and roles of the catalog store. */
  record SourceSnapshot(List<DataSourceDef> dataSources, List<RoleDef> roles) {
    public SourceSnapshot {
      dataSources = List.copyOf(dataSources == null ? List.of() : dataSources);
      roles = List.copyOf(roles == null ? List.of() : roles);
    }
  }
}
