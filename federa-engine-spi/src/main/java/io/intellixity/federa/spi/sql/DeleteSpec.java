package io.intellixity.federa.spi.sql;

import io.intellixity.federa.query.QueryElement;

/** Delete; rendered as an update of the soft delete marker on soft-deletable tables. */
public record DeleteSpec(int objectId, QueryElement filter) {}
