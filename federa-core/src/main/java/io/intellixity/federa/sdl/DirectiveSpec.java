package io.intellixity.federa.sdl;

import java.util.List;
import java.util.Map;

/**
 * Closed set of catalog directives, resolved once from the SDL AST. Parser and linker switch over
 * these records instead of looking at directive names.
 */
public sealed interface DirectiveSpec {

  record Table(String name, boolean m2m, boolean softDelete, String softDeleteCond, String softDeleteSet)
      implements DirectiveSpec {}

  record View(String name, String sql) implements DirectiveSpec {}

  record Args(String name, boolean required) implements DirectiveSpec {}

  record Named(String name) implements DirectiveSpec {}

  record InModule(String name) implements DirectiveSpec {}

  record Pk() implements DirectiveSpec {}

  /** Object level lists the fields; field level leaves {@code fields} empty. */
  record Unique(List<String> fields, String querySuffix, boolean skipQuery) implements DirectiveSpec {}

  record Sql(String expression) implements DirectiveSpec {}

  record Default(Object value, String sequence, String insertExp, String updateExp) implements DirectiveSpec {}

  record FieldSource(String field) implements DirectiveSpec {}

  record GeometryInfo(String type, int srid) implements DirectiveSpec {}

  record FilterRequired() implements DirectiveSpec {}

  record Dim(int length) implements DirectiveSpec {}

  record Embeddings(String model, String vector, String distance, int length) implements DirectiveSpec {}

  record Hypertable() implements DirectiveSpec {}

  record TimescaleKey() implements DirectiveSpec {}

  record Cube() implements DirectiveSpec {}

  record Measurement() implements DirectiveSpec {}

  /** Object level foreign key over one or more fields. */
  record References(String referencesName, List<String> sourceFields, List<String> referencesFields,
                    String query, String referencesQuery) implements DirectiveSpec {}

  /** Field level foreign key; {@code field} is the referenced field, defaulting to the target primary key. */
  record FieldReferences(String referencesName, String field, String query, String referencesQuery)
      implements DirectiveSpec {}

  record Join(String referencesName, List<String> sourceFields, List<String> referencesFields, String sql)
      implements DirectiveSpec {}

  record Function(String name, String sql, boolean skipNullArg, boolean isTable) implements DirectiveSpec {}

  record FunctionCall(String referencesName, Map<String, String> args, String module) implements DirectiveSpec {}

  record TableFunctionCallJoin(String referencesName, Map<String, String> args, List<String> sourceFields,
                               List<String> referencesFields, String module) implements DirectiveSpec {}

  record Cache(Integer ttl, String key, List<String> tags) implements DirectiveSpec {}

  record NoCache() implements DirectiveSpec {}

  /** Extra tags purged after mutations of the object. */
  record InvalidateCache(List<String> tags) implements DirectiveSpec {}
}
