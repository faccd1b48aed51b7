package io.intellixity.federa.sdl;

import java.util.List;
import java.util.stream.Collectors;

/** Load-time failure of one data source catalog. Carries every error found in the catalog. */
public final class SchemaDefinitionException extends RuntimeException {
  private final String dataSource;
  private final List<SchemaError> errors;

  public SchemaDefinitionException(String dataSource, List<SchemaError> errors) {
    super(message(dataSource, errors));
    this.dataSource = dataSource;
    this.errors = List.copyOf(errors);
  }

  public String dataSource() { return dataSource; }
  public List<SchemaError> errors() { return errors; }

  public boolean has(SchemaError.Code code) {
    return errors.stream().anyMatch(e -> e.code() == code);
  }

  private static String message(String dataSource, List<SchemaError> errors) {
    return "Schema definition errors in data source '" + dataSource + "': "
        + errors.stream().map(SchemaError::toString).collect(Collectors.joining("; "));
  }
}
