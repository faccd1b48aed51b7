package io.intellixity.federa.catalog;

import java.util.Objects;

/**
 * Data field of a {@link DataObject}. Its value comes from the column named like the field, from
 * {@code sourceField}, from {@code sqlExpression}, or from a {@code functionCall}.
 */
public record Field(String name, FieldType type, String sourceField, String sqlExpression, boolean primaryKey,
                    GeometryInfo geometryInfo, boolean measurement, DefaultSpec defaultSpec, boolean filterRequired,
                    Integer dimension, EmbeddingsSpec embeddings, boolean timescaleKey, FunctionCall functionCall,
                    String description) {
  public Field {
    Objects.requireNonNull(name, "name");
    if (type == null && functionCall == null) throw new IllegalArgumentException("field " + name + " has no type");
    if (sourceField != null && sqlExpression != null) {
      throw new IllegalArgumentException("field " + name + " cannot have both a source field and a sql expression");
    }
  }

  public static Builder builder(String name, FieldType type) {
    return new Builder(name, type);
  }

  /** Physical column backing the field. */
  public String column() { return sourceField != null ? sourceField : name; }

  public boolean calculated() { return sqlExpression != null; }

  public boolean isFunctionCall() { return functionCall != null; }

  public ScalarType scalar() { return type == null ? null : type.scalar(); }

  public Builder toBuilder() {
    Builder b = new Builder(name, type);
    b.sourceField = sourceField;
    b.sqlExpression = sqlExpression;
    b.primaryKey = primaryKey;
    b.geometryInfo = geometryInfo;
    b.measurement = measurement;
    b.defaultSpec = defaultSpec;
    b.filterRequired = filterRequired;
    b.dimension = dimension;
    b.embeddings = embeddings;
    b.timescaleKey = timescaleKey;
    b.functionCall = functionCall;
    b.description = description;
    return b;
  }

  public static final class Builder {
    private final String name;
    private final FieldType type;
    private String sourceField;
    private String sqlExpression;
    private boolean primaryKey;
    private GeometryInfo geometryInfo;
    private boolean measurement;
    private DefaultSpec defaultSpec;
    private boolean filterRequired;
    private Integer dimension;
    private EmbeddingsSpec embeddings;
    private boolean timescaleKey;
    private FunctionCall functionCall;
    private String description;

    private Builder(String name, FieldType type) {
      this.name = name;
      this.type = type;
    }

    public Builder sourceField(String v) { this.sourceField = v; return this; }
    public Builder sqlExpression(String v) { this.sqlExpression = v; return this; }
    public Builder primaryKey(boolean v) { this.primaryKey = v; return this; }
    public Builder geometryInfo(GeometryInfo v) { this.geometryInfo = v; return this; }
    public Builder measurement(boolean v) { this.measurement = v; return this; }
    public Builder defaultSpec(DefaultSpec v) { this.defaultSpec = v; return this; }
    public Builder filterRequired(boolean v) { this.filterRequired = v; return this; }
    public Builder dimension(Integer v) { this.dimension = v; return this; }
    public Builder embeddings(EmbeddingsSpec v) { this.embeddings = v; return this; }
    public Builder timescaleKey(boolean v) { this.timescaleKey = v; return this; }
    public Builder functionCall(FunctionCall v) { this.functionCall = v; return this; }
    public Builder description(String v) { this.description = v; return this; }

    public Field build() {
      return new Field(name, type, sourceField, sqlExpression, primaryKey, geometryInfo, measurement, defaultSpec,
          filterRequired, dimension, embeddings, timescaleKey, functionCall, description);
    }
  }
}
