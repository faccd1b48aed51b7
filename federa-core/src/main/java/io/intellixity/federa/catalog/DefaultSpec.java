package io.intellixity.federa.catalog;

/**
 * Insert/update defaults of a field. At most one of {@code value}, {@code sequence} and
 * {@code insertExpression} applies on insert.
 */
public record DefaultSpec(Object value, String sequence, String insertExpression, String updateExpression) {
  public boolean coversInsert() {
    return value != null || sequence != null || insertExpression != null;
  }
}
