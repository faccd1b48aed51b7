package io.intellixity.federa.query;

import io.intellixity.federa.catalog.*;

import java.util.*;

/**
 * Turns a GraphQL {@code <obj>_filter} argument value into a {@link QueryElement} tree.
 * <p>
 * Scalar values are coerced to their canonical types ({@link Values}). The structural rules that
 * graphql-java cannot express are enforced here: to-many relation filters need exactly one of
 * {@code any_of}, {@code all_of} and {@code none_of}.
 */
public final class FilterParser {
  private static final Map<ScalarType.Family, Set<Operator>> SCALAR_OPERATORS = Map.of(
      ScalarType.Family.STRING, EnumSet.of(Operator.EQ, Operator.IN, Operator.LIKE, Operator.ILIKE, Operator.REGEX, Operator.IS_NULL),
      ScalarType.Family.NUMERIC, EnumSet.of(Operator.EQ, Operator.IN, Operator.GT, Operator.GTE, Operator.LT, Operator.LTE, Operator.IS_NULL),
      ScalarType.Family.BOOLEAN, EnumSet.of(Operator.EQ, Operator.IS_NULL),
      ScalarType.Family.TEMPORAL, EnumSet.of(Operator.EQ, Operator.GT, Operator.GTE, Operator.LT, Operator.LTE, Operator.IS_NULL),
      ScalarType.Family.GEOMETRY, EnumSet.of(Operator.EQ, Operator.INTERSECTS, Operator.CONTAINS, Operator.IS_NULL),
      ScalarType.Family.OTHER, EnumSet.noneOf(Operator.class));

  private static final Set<Operator> LIST_OPERATORS =
      EnumSet.of(Operator.EQ, Operator.CONTAINS, Operator.INTERSECTS, Operator.IS_NULL);

  private final Catalog catalog;

  public FilterParser(Catalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  /** Operators of the generated filter input of a field type. */
  public static Set<Operator> operatorsFor(FieldType type) {
    if (type.list()) return Collections.unmodifiableSet(LIST_OPERATORS);
    return Collections.unmodifiableSet(SCALAR_OPERATORS.get(type.scalar().family()));
  }

  /** Returns {@code null} for an absent or empty filter. */
  public QueryElement parse(int objectId, Map<String, ?> filter, List<Object> path) {
    if (filter == null || filter.isEmpty()) return null;
    return object(catalog.object(objectId), filter, new ArrayList<>(path));
  }

  private QueryElement object(DataObject obj, Map<String, ?> filter, List<Object> path) {
    List<QueryElement> parts = new ArrayList<>();
    for (Map.Entry<String, ?> e : filter.entrySet()) {
      String key = e.getKey();
      Object value = e.getValue();
      if (value == null) continue;
      List<Object> p = append(path, key);
      switch (key) {
        case "_and" -> parts.add(group(obj, Clause.AND, value, p));
        case "_or" -> parts.add(group(obj, Clause.OR, value, p));
        case "_not" -> parts.add(new NotElement(object(obj, asMap(value, p), p)));
        default -> parts.add(member(obj, key, value, p));
      }
    }
    if (parts.size() == 1) return parts.get(0);
    return new LogicalGroup(Clause.AND, parts);
  }

  private QueryElement group(DataObject obj, Clause clause, Object value, List<Object> path) {
    List<QueryElement> items = new ArrayList<>();
    Collection<?> list = value instanceof Collection<?> c ? c : List.of(value);
    int i = 0;
    for (Object item : list) {
      List<Object> p = append(path, i++);
      // an empty item is an empty AND and matches every row
      items.add(object(obj, asMap(item, p), p));
    }
    return new LogicalGroup(clause, items);
  }

  private QueryElement member(DataObject obj, String key, Object value, List<Object> path) {
    Field field = obj.field(key);
    if (field != null) {
      if (field.isFunctionCall()) {
        throw new QueryValidationException("Field '" + key + "' of " + obj.name() + " cannot be filtered", path);
      }
      return scalar(field, asMap(value, path), path);
    }
    Relation rel = catalog.resolveRelation(obj.id(), key);
    if (rel == null) {
      throw new QueryValidationException("Unknown filter field '" + key + "' on " + obj.name(), path);
    }
    DataObject target = catalog.object(rel.toObject());
    Map<String, ?> m = asMap(value, path);
    if (!rel.cardinality().isToMany()) {
      for (String k : m.keySet()) {
        if (isQuantifier(k)) {
          throw new QueryValidationException("Relation '" + key + "' is to-one; '" + k + "' is not allowed", path);
        }
      }
      return new RelationCondition(key, RelationCondition.Quantifier.DIRECT, object(target, m, path));
    }
    List<String> quantifiers = m.entrySet().stream()
        .filter(en -> en.getValue() != null)
        .map(Map.Entry::getKey)
        .toList();
    if (quantifiers.size() != 1 || !isQuantifier(quantifiers.get(0))) {
      throw new QueryValidationException("Filter on to-many relation '" + key
          + "' needs exactly one of any_of, all_of, none_of", path);
    }
    String q = quantifiers.get(0);
    List<Object> p = append(path, q);
    RelationCondition.Quantifier quantifier = RelationCondition.Quantifier.valueOf(q.toUpperCase(Locale.ROOT));
    return new RelationCondition(key, quantifier, object(target, asMap(m.get(q), p), p));
  }

  private QueryElement scalar(Field field, Map<String, ?> ops, List<Object> path) {
    Set<Operator> allowed = operatorsFor(field.type());
    List<QueryElement> conditions = new ArrayList<>();
    for (Map.Entry<String, ?> e : ops.entrySet()) {
      List<Object> p = append(path, e.getKey());
      Operator op;
      try {
        op = Operator.fromGraphqlName(e.getKey());
      } catch (QueryValidationException ex) {
        throw new QueryValidationException(ex.getMessage() + " on field '" + field.name() + "'", p);
      }
      if (!allowed.contains(op)) {
        throw new QueryValidationException("Operator '" + e.getKey() + "' is not supported on "
            + field.type() + " field '" + field.name() + "'", p);
      }
      if (e.getValue() == null) continue;
      conditions.add(new Condition(field.name(), op, operand(field, op, e.getValue(), p)));
    }
    if (conditions.size() == 1) return conditions.get(0);
    return new LogicalGroup(Clause.AND, conditions);
  }

  private Object operand(Field field, Operator op, Object raw, List<Object> path) {
    try {
      return switch (op) {
        case IS_NULL -> Values.coerce(ScalarType.BOOLEAN, raw);
        case IN -> {
          List<Object> out = new ArrayList<>();
          for (Object o : raw instanceof Collection<?> c ? c : List.of(raw)) out.add(Values.coerce(field.scalar(), o));
          yield out;
        }
        case LIKE, ILIKE, REGEX -> raw.toString();
        case CONTAINS, INTERSECTS -> field.type().list()
            ? Values.coerce(FieldType.listOf(field.scalar()), raw instanceof Collection<?> ? raw : List.of(raw))
            : Values.coerce(field.scalar(), raw);
        default -> Values.coerce(field.type(), raw);
      };
    } catch (QueryValidationException e) {
      throw new QueryValidationException(e.getMessage(), path);
    }
  }

  private static boolean isQuantifier(String key) {
    return key.equals("any_of") || key.equals("all_of") || key.equals("none_of");
  }

  @SuppressWarnings("unchecked")
  private static Map<String, ?> asMap(Object value, List<Object> path) {
    if (value instanceof Map<?, ?> m) return (Map<String, ?>) m;
    throw new QueryValidationException("Expected an input object", path);
  }

  private static List<Object> append(List<Object> path, Object segment) {
    List<Object> p = new ArrayList<>(path);
    p.add(segment);
    return p;
  }
}
