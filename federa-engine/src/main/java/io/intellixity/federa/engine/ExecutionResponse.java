package io.intellixity.federa.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.*;

/**
 * {@code data} in selection order and {@code errors}. {@code data} is {@code null} when the request
 * failed before execution.
 */
public record ExecutionResponse(Map<String, Object> data, List<GraphQLErrorEntry> errors) {
  private static final ObjectMapper JSON = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  public ExecutionResponse {
    errors = List.copyOf(errors == null ? List.of() : errors);
  }

  public static ExecutionResponse failed(GraphQLErrorEntry error) {
    return new ExecutionResponse(null, List.of(error));
  }

  public boolean hasErrors() { return !errors.isEmpty(); }

  /** Response object of the GraphQL over HTTP format; {@code errors} only when present. */
  public Map<String, Object> toSpecification() {
    Map<String, Object> out = new LinkedHashMap<>();
    if (!errors.isEmpty()) {
      List<Map<String, Object>> list = new ArrayList<>();
      for (GraphQLErrorEntry e : errors) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("message", e.message());
        if (!e.path().isEmpty()) m.put("path", e.path());
        if (!e.extensions().isEmpty()) m.put("extensions", e.extensions());
        list.add(m);
      }
      out.put("errors", list);
    }
    out.put("data", data);
    return out;
  }

  public String toJson() {
    try {
      return JSON.writeValueAsString(toSpecification());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Response is not serializable: " + e.getOriginalMessage(), e);
    }
  }
}
