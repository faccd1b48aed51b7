package io.intellixity.federa.catalog;

/**
 * Soft delete of a table. {@code condition} selects the rows that are not deleted and is added to every
 * read unless {@code @with_deleted} is set; {@code setExpression} is the SET clause that marks a row
 * deleted. Both may reference fields with {@code [field]}.
 */
public record SoftDeleteSpec(String condition, String setExpression) {}
