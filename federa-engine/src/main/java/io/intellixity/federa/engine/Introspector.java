package io.intellixity.federa.engine;

import graphql.ExecutionInput;
import graphql.ExecutionResult;
import graphql.GraphQL;
import graphql.GraphQLError;
import graphql.language.*;
import graphql.schema.GraphQLSchema;
import io.intellixity.federa.query.QueryValidationException;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Answers {@code __schema} and {@code __type} with graphql-java. Only the introspection selections of
 * the operation are executed, together with the fragments and variables they use.
 */
final class Introspector {
  private final GraphQL graphQL;

  Introspector(GraphQLSchema schema) {
    this.graphQL = GraphQL.newGraphQL(schema).build();
  }

  /** Introspection field values of the operation, by response key. */
  Map<String, Object> answer(Document document, String operationName, Map<String, Object> variables) {
    OperationDefinition op = operation(document, operationName);
    List<Selection> kept = new ArrayList<>();
    for (Selection<?> s : op.getSelectionSet().getSelections()) {
      if (s instanceof Field f && f.getName().startsWith("__") && !"__typename".equals(f.getName())) kept.add(s);
    }
    SelectionSet selection = SelectionSet.newSelectionSet(kept).build();
    StringBuilder text = new StringBuilder(AstPrinter.printAst(selection));

    Map<String, FragmentDefinition> fragments = new LinkedHashMap<>();
    for (FragmentDefinition f : document.getDefinitionsOfType(FragmentDefinition.class)) fragments.put(f.getName(), f);
    List<Definition> definitions = new ArrayList<>();
    Set<String> used = new HashSet<>();
    boolean grew = true;
    while (grew) {
      grew = false;
      for (FragmentDefinition f : fragments.values()) {
        if (used.contains(f.getName()) || !references(text, "\\.\\.\\.\\s*", f.getName())) continue;
        used.add(f.getName());
        definitions.add(f);
        text.append('\n').append(AstPrinter.printAst(f));
        grew = true;
      }
    }
    List<VariableDefinition> vars = new ArrayList<>();
    for (VariableDefinition v : op.getVariableDefinitions()) {
      if (references(text, "\\$", v.getName())) vars.add(v);
    }
    OperationDefinition only = op.transform(b -> b.selectionSet(selection).variableDefinitions(vars)
        .directives(List.of()));
    definitions.add(0, only);
    String query = AstPrinter.printAst(Document.newDocument().definitions(definitions).build());

    ExecutionResult result = graphQL.execute(ExecutionInput.newExecutionInput()
        .query(query)
        .variables(variables == null ? Map.of() : variables)
        .build());
    if (!result.getErrors().isEmpty()) {
      GraphQLError first = result.getErrors().get(0);
      throw new QueryValidationException("Introspection failed: " + first.getMessage());
    }
    Map<String, Object> data = result.getData();
    return data == null ? Map.of() : data;
  }

  private static OperationDefinition operation(Document document, String operationName) {
    List<OperationDefinition> ops = document.getDefinitionsOfType(OperationDefinition.class);
    for (OperationDefinition op : ops) {
      if (operationName == null || operationName.equals(op.getName())) return op;
    }
    throw new QueryValidationException("Unknown operation '" + operationName + "'");
  }

  private static boolean references(CharSequence text, String prefix, String name) {
    return Pattern.compile(prefix + Pattern.quote(name) + "(?![_0-9A-Za-z])").matcher(text).find();
  }
}
