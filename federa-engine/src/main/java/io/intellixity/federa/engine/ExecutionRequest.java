package io.intellixity.federa.engine;

import io.intellixity.federa.governance.AuthContext;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/** A GraphQL request as handed over by the transport. */
public record ExecutionRequest(String query, String operationName, Map<String, Object> variables, AuthContext auth) {
  public ExecutionRequest {
    // variables may carry explicit nulls
    variables = Collections.unmodifiableMap(new HashMap<>(variables == null ? Map.of() : variables));
    auth = auth == null ? AuthContext.anonymous() : auth;
  }

  public static ExecutionRequest of(String query) {
    return new ExecutionRequest(query, null, Map.of(), null);
  }

  public static ExecutionRequest of(String query, Map<String, Object> variables) {
    return new ExecutionRequest(query, null, variables, null);
  }

  public ExecutionRequest withAuth(AuthContext newAuth) {
    return new ExecutionRequest(query, operationName, variables, newAuth);
  }
}
