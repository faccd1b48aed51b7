package io.intellixity.federa.spi.sql;

import io.intellixity.federa.catalog.Catalog;
import io.intellixity.federa.spi.source.SqlStatement;

import java.util.Map;

/**
 * Renders relational plan specs to native SQL for one data source.
 * <p>
 * Implementations are stateless and receive the catalog snapshot of the request, so one dialect
 * instance serves every snapshot of its source.
 */
public interface Dialect {
  String id();

  SqlStatement select(Catalog catalog, SelectSpec spec);

  SqlStatement aggregate(Catalog catalog, AggregateSpec spec);

  /** {@code SELECT <function sql> AS value} for a scalar function query. */
  SqlStatement callFunction(Catalog catalog, String module, String function, Map<String, Object> args);

  SqlStatement insert(Catalog catalog, InsertSpec spec);

  SqlStatement update(Catalog catalog, UpdateSpec spec);

  SqlStatement delete(Catalog catalog, DeleteSpec spec);
}
