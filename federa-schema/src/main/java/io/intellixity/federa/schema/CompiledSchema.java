package io.intellixity.federa.schema;

import graphql.schema.GraphQLSchema;
import io.intellixity.federa.catalog.Catalog;

import java.util.Objects;

/** GraphQL surface of one catalog snapshot plus the meaning of every generated field. */
public record CompiledSchema(Catalog catalog, GraphQLSchema graphQLSchema, SchemaBindings bindings) {
  public CompiledSchema {
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(graphQLSchema, "graphQLSchema");
    Objects.requireNonNull(bindings, "bindings");
  }

  public FieldBinding binding(String typeName, String fieldName) {
    return bindings.field(typeName, fieldName);
  }
}
