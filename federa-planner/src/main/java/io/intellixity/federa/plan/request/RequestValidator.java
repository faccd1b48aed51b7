package io.intellixity.federa.plan.request;

import graphql.language.Document;
import graphql.validation.ValidationError;
import graphql.validation.Validator;
import io.intellixity.federa.catalog.*;
import io.intellixity.federa.query.QueryValidationException;
import io.intellixity.federa.schema.CompiledSchema;
import io.intellixity.federa.schema.FieldBinding;

import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Request checks before planning: graphql-java's document rules, then the rules the generated schema
 * cannot express.
 */
public final class RequestValidator {
  private static final Set<String> DIRECTIONS = Set.of("ASC", "DESC");
  private static final String NON_POSIX_ESCAPES = "dDwWsSbB";

  private final CompiledSchema schema;
  private final Catalog catalog;

  public RequestValidator(CompiledSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.catalog = schema.catalog();
  }

  /** graphql-java validation of the document against the compiled schema. */
  public List<QueryValidationException> validateDocument(Document document) {
    List<ValidationError> errors = new Validator().validateDocument(schema.graphQLSchema(), document, Locale.ENGLISH);
    List<QueryValidationException> out = new ArrayList<>();
    for (ValidationError e : errors) {
      List<Object> path = e.getQueryPath() == null ? List.of() : new ArrayList<>(e.getQueryPath());
      out.add(new QueryValidationException(e.getMessage(), path));
    }
    return out;
  }

  /** Domain rules; the first violation is thrown. */
  public void validate(RequestTree request) {
    for (SelectedField f : request.fields()) walk(f);
  }

  private void walk(SelectedField f) {
    if (f.isTypename() || f.isIntrospection()) return;
    FieldBinding b = schema.binding(f.parentType(), f.name());
    if (b instanceof FieldBinding.SelectList s) {
      DataObject o = catalog.object(s.objectId());
      rootChecks(o, f);
      rows(o, f);
    } else if (b instanceof FieldBinding.SelectOne s) {
      requiredArgs(catalog.object(s.objectId()), f);
    } else if (b instanceof FieldBinding.Aggregate a) {
      DataObject o = catalog.object(a.objectId());
      rootChecks(o, f);
      rows(o, f);
    } else if (b instanceof FieldBinding.BucketAggregate a) {
      DataObject o = catalog.object(a.objectId());
      rootChecks(o, f);
      filter(f);
      page(f);
      bucketOrder(f);
    } else if (b instanceof FieldBinding.RelationField r) {
      rows(catalog.object(catalog.relation(r.relationId()).toObject()), f);
    } else if (b instanceof FieldBinding.RelationAggregation r) {
      rows(catalog.object(catalog.relation(r.relationId()).toObject()), f);
    } else if (b instanceof FieldBinding.DynamicJoin j) {
      rows(catalog.object(j.targetObjectId()), f);
    } else if (b instanceof FieldBinding.SpatialJoin j) {
      rows(catalog.object(j.targetObjectId()), f);
    } else if (b instanceof FieldBinding.Update || b instanceof FieldBinding.Delete) {
      filter(f);
    }
    for (SelectedField c : f.selections()) walk(c);
  }

  private void rootChecks(DataObject o, SelectedField f) {
    requiredArgs(o, f);
    requiredFilters(o, f);
  }

  private void rows(DataObject o, SelectedField f) {
    filter(f);
    page(f);
    List<?> order = f.listArgument("order_by");
    for (int i = 0; i < order.size(); i++) {
      List<Object> at = f.childPath("order_by");
      at.add(i);
      String field = orderEntry(order.get(i), at);
      if (!rowOrderField(o, field) && !selectedKey(f, field)) {
        throw new QueryValidationException("Unknown order_by field '" + field + "' of " + o.typeName(), at);
      }
    }
    for (Object d : f.listArgument("distinct_on")) {
      Field field = o.field(String.valueOf(d));
      if (field == null || field.isFunctionCall()) {
        throw new QueryValidationException("Unknown distinct_on field '" + d + "' of " + o.typeName(),
            f.childPath("distinct_on"));
      }
    }
  }

  private boolean rowOrderField(DataObject o, String path) {
    String[] parts = path.split("\\.");
    DataObject current = o;
    for (int i = 0; i < parts.length - 1; i++) {
      Relation r = catalog.resolveRelation(current.id(), parts[i]);
      if (r == null || r.cardinality().isToMany()) return false;
      current = catalog.object(r.toObject());
    }
    Field field = current.field(parts[parts.length - 1]);
    return field != null && !field.isFunctionCall();
  }

  private static boolean selectedKey(SelectedField f, String key) {
    for (SelectedField c : f.selections()) {
      if (c.responseKey().equals(key) && c.selections().isEmpty()) return true;
    }
    return false;
  }

  /** Bucket rows sort by what the request selected: {@code key.<field>} or {@code aggregations.<path>}. */
  private void bucketOrder(SelectedField f) {
    Set<String> selected = new HashSet<>();
    for (SelectedField c : f.selections()) {
      FieldBinding b = schema.binding(c.parentType(), c.name());
      if (b instanceof FieldBinding.BucketKey) {
        for (SelectedField k : c.selections()) {
          if (!k.selections().isEmpty()) continue;
          selected.add(c.responseKey() + "." + k.responseKey());
        }
      } else if (b instanceof FieldBinding.BucketAggregations) {
        for (SelectedField a : c.selections()) {
          if (a.selections().isEmpty()) {
            selected.add(c.responseKey() + "." + a.responseKey());
            continue;
          }
          for (SelectedField fn : a.selections()) {
            selected.add(c.responseKey() + "." + a.responseKey() + "." + fn.responseKey());
          }
        }
      }
    }
    List<?> order = f.listArgument("order_by");
    for (int i = 0; i < order.size(); i++) {
      List<Object> at = f.childPath("order_by");
      at.add(i);
      String field = orderEntry(order.get(i), at);
      if (!selected.contains(field)) {
        throw new QueryValidationException("order_by field '" + field + "' is not selected", at);
      }
    }
  }

  private static String orderEntry(Object entry, List<Object> at) {
    if (!(entry instanceof Map<?, ?> m) || !(m.get("field") instanceof String field) || field.isBlank()) {
      throw new QueryValidationException("order_by entries need a field", at);
    }
    Object direction = m.get("direction");
    if (direction != null && !DIRECTIONS.contains(direction.toString())) {
      throw new QueryValidationException("Invalid order direction '" + direction + "', expected ASC or DESC", at);
    }
    return field;
  }

  private static void page(SelectedField f) {
    for (String arg : List.of("limit", "offset")) {
      Integer v = f.intArgument(arg);
      if (v != null && v < 0) {
        throw new QueryValidationException("'" + arg + "' must not be negative", f.childPath(arg));
      }
    }
  }

  private void filter(SelectedField f) {
    Map<String, Object> filter = f.mapArgument("filter");
    if (filter != null) regexValues(filter, f.childPath("filter"));
  }

  private static void regexValues(Object value, List<Object> path) {
    if (value instanceof Map<?, ?> m) {
      for (Map.Entry<?, ?> e : m.entrySet()) {
        List<Object> p = new ArrayList<>(path);
        p.add(String.valueOf(e.getKey()));
        if ("regex".equals(e.getKey()) && e.getValue() instanceof String pattern) {
          checkPosixRegex(pattern, p);
        } else {
          regexValues(e.getValue(), p);
        }
      }
    } else if (value instanceof List<?> l) {
      for (int i = 0; i < l.size(); i++) {
        List<Object> p = new ArrayList<>(path);
        p.add(i);
        regexValues(l.get(i), p);
      }
    }
  }

  /**
   * Rejects patterns outside POSIX extended syntax: Perl class escapes, group extensions
   * ({@code (?...}) and lazy quantifiers.
   */
  static void checkPosixRegex(String pattern, List<Object> path) {
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      if (c == '\\' && i + 1 < pattern.length()) {
        char next = pattern.charAt(++i);
        if (NON_POSIX_ESCAPES.indexOf(next) >= 0) {
          throw new QueryValidationException("Regex '" + pattern + "' uses \\" + next + ", which is not POSIX ERE", path);
        }
        continue;
      }
      if (c == '(' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '?') {
        throw new QueryValidationException("Regex '" + pattern + "' uses a (? group, which is not POSIX ERE", path);
      }
      if ((c == '*' || c == '+' || c == '?' || c == '}') && i + 1 < pattern.length() && pattern.charAt(i + 1) == '?'
          && i > 0) {
        throw new QueryValidationException("Regex '" + pattern + "' uses a lazy quantifier, which is not POSIX ERE", path);
      }
    }
    try {
      Pattern.compile(pattern);
    } catch (PatternSyntaxException e) {
      throw new QueryValidationException("Invalid regex '" + pattern + "': " + e.getDescription(), path);
    }
  }

  private void requiredFilters(DataObject o, SelectedField f) {
    Map<String, Object> filter = f.mapArgument("filter");
    for (Field field : o.fields()) {
      if (!field.filterRequired()) continue;
      if (filter == null || !mentions(filter, field.name())) {
        throw new QueryValidationException("Filter on '" + field.name() + "' is required for " + f.name(),
            f.childPath("filter"));
      }
    }
  }

  private static boolean mentions(Map<?, ?> filter, String field) {
    for (Map.Entry<?, ?> e : filter.entrySet()) {
      if (field.equals(e.getKey()) && e.getValue() != null) return true;
      String k = String.valueOf(e.getKey());
      if (!k.startsWith("_")) continue;
      Object v = e.getValue();
      if (v instanceof Map<?, ?> m && mentions(m, field)) return true;
      if (v instanceof List<?> l) {
        for (Object item : l) {
          if (item instanceof Map<?, ?> m && mentions(m, field)) return true;
        }
      }
    }
    return false;
  }

  private static void requiredArgs(DataObject o, SelectedField f) {
    ArgsSpec args = o.args();
    if (args == null || !args.required()) return;
    if (f.argument("args") == null) {
      throw new QueryValidationException("Argument 'args' is required for " + f.name(), f.childPath("args"));
    }
  }
}
