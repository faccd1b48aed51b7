package io.intellixity.federa.plan.request;

import graphql.language.*;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import graphql.schema.*;
import io.intellixity.federa.query.QueryValidationException;
import io.intellixity.federa.schema.FederaScalars;

import java.util.*;

/**
 * Resolves a request document against the compiled schema into a {@link RequestTree}: the operation
 * is selected, fragments are inlined, {@code @skip}/{@code @include} are applied, and arguments carry
 * their variable values or declared defaults.
 */
public final class RequestParser {
  private static final Object ABSENT = new Object();

  private final GraphQLSchema schema;

  public RequestParser(GraphQLSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  public static Document parseDocument(String query) {
    if (query == null || query.isBlank()) throw new QueryValidationException("Request has no query");
    try {
      return Parser.parse(query);
    } catch (InvalidSyntaxException e) {
      throw new QueryValidationException("Invalid syntax: " + e.getMessage(), e);
    }
  }

  public RequestTree parse(Document document, String operationName, Map<String, Object> variables) {
    OperationDefinition op = operation(document, operationName);
    Map<String, FragmentDefinition> fragments = new HashMap<>();
    for (FragmentDefinition f : document.getDefinitionsOfType(FragmentDefinition.class)) {
      fragments.put(f.getName(), f);
    }
    Ctx ctx = new Ctx(fragments, variables(op, variables));

    RequestTree.Operation kind;
    GraphQLObjectType root;
    switch (op.getOperation()) {
      case QUERY -> {
        kind = RequestTree.Operation.QUERY;
        root = schema.getQueryType();
      }
      case MUTATION -> {
        kind = RequestTree.Operation.MUTATION;
        root = schema.getMutationType();
      }
      default -> throw new QueryValidationException("Subscriptions are not supported");
    }
    if (root == null) throw new QueryValidationException("The schema has no " + kind.name().toLowerCase(Locale.ROOT) + " type");

    LinkedHashMap<String, List<Field>> grouped = new LinkedHashMap<>();
    collect(ctx, op.getSelectionSet(), root, grouped, new HashSet<>());
    List<SelectedField> fields = new ArrayList<>();
    for (Map.Entry<String, List<Field>> e : grouped.entrySet()) {
      fields.add(field(ctx, e.getKey(), e.getValue(), root, List.of()));
    }
    return new RequestTree(kind, op.getName(), directives(ctx, op.getDirectives()), fields);
  }

  private static OperationDefinition operation(Document document, String operationName) {
    List<OperationDefinition> ops = document.getDefinitionsOfType(OperationDefinition.class);
    if (ops.isEmpty()) throw new QueryValidationException("Request has no operation");
    if (operationName == null || operationName.isBlank()) {
      if (ops.size() > 1) {
        throw new QueryValidationException("Operation name is required when the request has several operations");
      }
      return ops.get(0);
    }
    for (OperationDefinition op : ops) {
      if (operationName.equals(op.getName())) return op;
    }
    throw new QueryValidationException("Unknown operation '" + operationName + "'");
  }

  private static Map<String, Object> variables(OperationDefinition op, Map<String, Object> given) {
    Map<String, Object> out = new LinkedHashMap<>(given == null ? Map.of() : given);
    for (VariableDefinition d : op.getVariableDefinitions()) {
      if (!out.containsKey(d.getName()) && d.getDefaultValue() != null) {
        out.put(d.getName(), FederaScalars.literal(d.getDefaultValue()));
      }
      if (d.getType() instanceof NonNullType && out.get(d.getName()) == null) {
        throw new QueryValidationException("Variable '$" + d.getName() + "' is required");
      }
    }
    return out;
  }

  // ---------- selections

  private void collect(Ctx ctx, SelectionSet set, GraphQLObjectType parent, LinkedHashMap<String, List<Field>> out,
                       Set<String> visited) {
    if (set == null) return;
    for (Selection<?> s : set.getSelections()) {
      if (s instanceof Field f) {
        if (included(ctx, f.getDirectives())) out.computeIfAbsent(f.getResultKey(), k -> new ArrayList<>()).add(f);
      } else if (s instanceof InlineFragment inline) {
        if (included(ctx, inline.getDirectives()) && applies(inline.getTypeCondition(), parent)) {
          collect(ctx, inline.getSelectionSet(), parent, out, visited);
        }
      } else if (s instanceof FragmentSpread spread) {
        if (!included(ctx, spread.getDirectives()) || !visited.add(spread.getName())) continue;
        FragmentDefinition def = ctx.fragments.get(spread.getName());
        if (def == null) throw new QueryValidationException("Unknown fragment '" + spread.getName() + "'");
        if (applies(def.getTypeCondition(), parent)) collect(ctx, def.getSelectionSet(), parent, out, visited);
      }
    }
  }

  private static boolean applies(TypeName condition, GraphQLObjectType parent) {
    return condition == null || condition.getName().equals(parent.getName());
  }

  private SelectedField field(Ctx ctx, String key, List<Field> group, GraphQLObjectType parent, List<Object> parentPath) {
    Field first = group.get(0);
    String name = first.getName();
    List<Object> path = new ArrayList<>(parentPath);
    path.add(key);

    if (SelectedField.TYPENAME.equals(name)) {
      return new SelectedField(key, name, parent.getName(), "String", Map.of(), Map.of(), List.of(), path,
          canonical(key, name, Map.of(), Map.of(), List.of()));
    }
    if (name.startsWith("__")) {
      return new SelectedField(key, name, parent.getName(), null, Map.of(), Map.of(), List.of(), path,
          canonical(key, name, Map.of(), Map.of(), List.of()));
    }

    GraphQLFieldDefinition def = parent.getFieldDefinition(name);
    if (def == null) throw new QueryValidationException("Unknown field '" + name + "' on " + parent.getName(), path);
    Map<String, Object> args = arguments(ctx, def, first);
    Map<String, Map<String, Object>> directives = directives(ctx, first.getDirectives());

    GraphQLUnmodifiedType out = GraphQLTypeUtil.unwrapAll(def.getType());
    List<SelectedField> children = new ArrayList<>();
    if (out instanceof GraphQLObjectType objectType) {
      LinkedHashMap<String, List<Field>> grouped = new LinkedHashMap<>();
      for (Field f : group) collect(ctx, f.getSelectionSet(), objectType, grouped, new HashSet<>());
      for (Map.Entry<String, List<Field>> e : grouped.entrySet()) {
        children.add(field(ctx, e.getKey(), e.getValue(), objectType, path));
      }
    }
    return new SelectedField(key, name, parent.getName(), out.getName(), args, directives, children, path,
        canonical(key, name, args, directives, children));
  }

  // ---------- arguments and directives

  private static Map<String, Object> arguments(Ctx ctx, GraphQLFieldDefinition def, Field field) {
    Map<String, Argument> given = new HashMap<>();
    for (Argument a : field.getArguments()) given.put(a.getName(), a);
    Map<String, Object> out = new LinkedHashMap<>();
    for (GraphQLArgument ga : def.getArguments()) {
      Argument a = given.get(ga.getName());
      if (a != null) {
        Object v = value(ctx, a.getValue());
        if (v != ABSENT) {
          out.put(ga.getName(), v);
          continue;
        }
      }
      if (ga.hasSetDefaultValue()) {
        Object d = ga.getArgumentDefaultValue().getValue();
        if (d instanceof Value<?> literal) d = FederaScalars.literal(literal);
        if (d != null) out.put(ga.getName(), d);
      }
    }
    return out;
  }

  private static Map<String, Map<String, Object>> directives(Ctx ctx, List<Directive> directives) {
    Map<String, Map<String, Object>> out = new LinkedHashMap<>();
    for (Directive d : directives) {
      if ("skip".equals(d.getName()) || "include".equals(d.getName())) continue;
      Map<String, Object> args = new LinkedHashMap<>();
      for (Argument a : d.getArguments()) {
        Object v = value(ctx, a.getValue());
        if (v != ABSENT) args.put(a.getName(), v);
      }
      out.put(d.getName(), args);
    }
    return out;
  }

  private static boolean included(Ctx ctx, List<Directive> directives) {
    for (Directive d : directives) {
      Argument condition = d.getArgument("if");
      if (condition == null) continue;
      Object v = value(ctx, condition.getValue());
      if ("skip".equals(d.getName()) && Boolean.TRUE.equals(v)) return false;
      if ("include".equals(d.getName()) && !Boolean.TRUE.equals(v)) return false;
    }
    return true;
  }

  private static Object value(Ctx ctx, Value<?> v) {
    if (v instanceof VariableReference ref) {
      return ctx.variables.containsKey(ref.getName()) ? ctx.variables.get(ref.getName()) : ABSENT;
    }
    if (v instanceof ArrayValue array) {
      List<Object> out = new ArrayList<>();
      for (Value<?> item : array.getValues()) {
        Object x = value(ctx, item);
        out.add(x == ABSENT ? null : x);
      }
      return out;
    }
    if (v instanceof ObjectValue object) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (ObjectField f : object.getObjectFields()) {
        Object x = value(ctx, f.getValue());
        if (x != ABSENT) out.put(f.getName(), x);
      }
      return out;
    }
    return FederaScalars.literal(v);
  }

  // ---------- canonical text

  static String canonical(String key, String name, Map<String, Object> args, Map<String, Map<String, Object>> directives,
                          List<SelectedField> children) {
    StringBuilder sb = new StringBuilder(key);
    if (!key.equals(name)) sb.append(':').append(name);
    if (!args.isEmpty()) {
      sb.append('(');
      render(sb, args);
      sb.append(')');
    }
    for (Map.Entry<String, Map<String, Object>> d : new TreeMap<>(directives).entrySet()) {
      sb.append(" @").append(d.getKey());
      if (!d.getValue().isEmpty()) render(sb, d.getValue());
    }
    if (!children.isEmpty()) {
      sb.append(" {");
      for (SelectedField c : children) sb.append(' ').append(c.canonical());
      sb.append(" }");
    }
    return sb.toString();
  }

  private static void render(StringBuilder sb, Object v) {
    if (v instanceof Map<?, ?> m) {
      sb.append('{');
      Map<String, Object> sorted = new TreeMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) sorted.put(String.valueOf(e.getKey()), e.getValue());
      boolean first = true;
      for (Map.Entry<String, Object> e : sorted.entrySet()) {
        if (!first) sb.append(',');
        first = false;
        sb.append(e.getKey()).append(':');
        render(sb, e.getValue());
      }
      sb.append('}');
    } else if (v instanceof Collection<?> c) {
      sb.append('[');
      boolean first = true;
      for (Object x : c) {
        if (!first) sb.append(',');
        first = false;
        render(sb, x);
      }
      sb.append(']');
    } else if (v instanceof CharSequence s) {
      sb.append('"').append(s.toString().replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
    } else {
      sb.append(v);
    }
  }

  private record Ctx(Map<String, FragmentDefinition> fragments, Map<String, Object> variables) {}
}
