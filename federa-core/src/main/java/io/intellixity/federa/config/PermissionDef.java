package io.intellixity.federa.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * One permission rule of a role. {@code typeName} and {@code fieldName} accept {@code *}.
 * <p>
 * {@code filter} is a GraphQL-shaped row filter ANDed to every read of the type; string values may
 * contain {@code [$auth.<claim>]} placeholders. {@code data} holds values forced on insert and update.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PermissionDef(@JsonProperty("type_name") String typeName,
                            @JsonProperty("field_name") String fieldName,
                            boolean disabled,
                            boolean hidden,
                            Map<String, Object> filter,
                            Map<String, Object> data) {
  public PermissionDef {
    Objects.requireNonNull(typeName, "typeName");
    fieldName = (fieldName == null || fieldName.isBlank()) ? "*" : fieldName;
    filter = filter == null ? Map.of() : filter;
    data = data == null ? Map.of() : data;
  }
}
