package io.intellixity.federa.sdl;

import graphql.language.Argument;
import graphql.language.Directive;
import graphql.language.Node;
import graphql.language.SourceLocation;
import io.intellixity.federa.catalog.SdlLocation;

import java.util.*;
import java.util.function.Function;

/** Reads catalog directives into {@link DirectiveSpec} values and checks where they may appear. */
final class Directives {
  enum Site { OBJECT, FIELD }

  private static final Set<String> IGNORED = Set.of("deprecated", "specifiedBy");

  private record Rule(Set<Site> sites, List<String> required, Function<Args, DirectiveSpec> factory) {}

  private static final Map<String, Rule> RULES = new HashMap<>();

  static {
    rule("table", EnumSet.of(Site.OBJECT), List.of("name"), a -> new DirectiveSpec.Table(
        a.string("name"), a.bool("is_m2m"), a.bool("soft_delete"), a.string("soft_delete_cond"),
        a.string("soft_delete_set")));
    rule("view", EnumSet.of(Site.OBJECT), List.of("name"), a -> new DirectiveSpec.View(a.string("name"), a.string("sql")));
    rule("args", EnumSet.of(Site.OBJECT), List.of("name"), a -> new DirectiveSpec.Args(a.string("name"), a.bool("required")));
    rule("named", EnumSet.of(Site.OBJECT), List.of("name"), a -> new DirectiveSpec.Named(a.string("name")));
    rule("module", EnumSet.of(Site.OBJECT), List.of("name"), a -> new DirectiveSpec.InModule(a.string("name")));
    rule("pk", EnumSet.of(Site.FIELD), List.of(), a -> new DirectiveSpec.Pk());
    rule("unique", EnumSet.of(Site.OBJECT, Site.FIELD), List.of(), a -> new DirectiveSpec.Unique(
        a.strings("fields"), a.string("query_suffix"), a.bool("skip_query")));
    rule("sql", EnumSet.of(Site.FIELD), List.of("exp"), a -> new DirectiveSpec.Sql(a.string("exp")));
    rule("default", EnumSet.of(Site.FIELD), List.of(), a -> new DirectiveSpec.Default(
        a.raw("value"), a.string("sequence"), a.string("insert_exp"), a.string("update_exp")));
    rule("field_source", EnumSet.of(Site.FIELD), List.of("field"), a -> new DirectiveSpec.FieldSource(a.string("field")));
    rule("geometry_info", EnumSet.of(Site.FIELD), List.of("type"), a -> new DirectiveSpec.GeometryInfo(
        a.string("type"), a.integer("srid", 4326)));
    rule("filter_required", EnumSet.of(Site.FIELD), List.of(), a -> new DirectiveSpec.FilterRequired());
    rule("dim", EnumSet.of(Site.FIELD), List.of("len"), a -> new DirectiveSpec.Dim(a.integer("len", 0)));
    rule("embeddings", EnumSet.of(Site.FIELD), List.of("model", "vector"), a -> new DirectiveSpec.Embeddings(
        a.string("model"), a.string("vector"), a.string("distance"), a.integer("len", 0)));
    rule("hypertable", EnumSet.of(Site.OBJECT), List.of(), a -> new DirectiveSpec.Hypertable());
    rule("timescale_key", EnumSet.of(Site.FIELD), List.of(), a -> new DirectiveSpec.TimescaleKey());
    rule("cube", EnumSet.of(Site.OBJECT), List.of(), a -> new DirectiveSpec.Cube());
    rule("measurement", EnumSet.of(Site.FIELD), List.of(), a -> new DirectiveSpec.Measurement());
    rule("references", EnumSet.of(Site.OBJECT), List.of("references_name", "source_fields"),
        a -> new DirectiveSpec.References(a.string("references_name"), a.strings("source_fields"),
            a.strings("references_fields"), a.string("query"), a.string("references_query")));
    rule("field_references", EnumSet.of(Site.FIELD), List.of("references_name"),
        a -> new DirectiveSpec.FieldReferences(a.string("references_name"), a.string("field"),
            a.string("query"), a.string("references_query")));
    rule("join", EnumSet.of(Site.FIELD), List.of("references_name"), a -> new DirectiveSpec.Join(
        a.string("references_name"), a.strings("source_fields"), a.strings("references_fields"), a.string("sql")));
    rule("function", EnumSet.of(Site.FIELD), List.of("name"), a -> new DirectiveSpec.Function(
        a.string("name"), a.string("sql"), a.bool("skip_null_arg"), a.bool("is_table")));
    rule("function_call", EnumSet.of(Site.FIELD), List.of("references_name"), a -> new DirectiveSpec.FunctionCall(
        a.string("references_name"), a.stringMap("args"), a.string("module")));
    rule("table_function_call_join", EnumSet.of(Site.FIELD), List.of("references_name", "source_fields", "references_fields"),
        a -> new DirectiveSpec.TableFunctionCallJoin(a.string("references_name"), a.stringMap("args"),
            a.strings("source_fields"), a.strings("references_fields"), a.string("module")));
    rule("cache", EnumSet.of(Site.OBJECT), List.of(), a -> new DirectiveSpec.Cache(
        a.has("ttl") ? a.integer("ttl", 0) : null, a.string("key"), a.strings("tags")));
    rule("no_cache", EnumSet.of(Site.OBJECT), List.of(), a -> new DirectiveSpec.NoCache());
    rule("invalidate_cache", EnumSet.of(Site.OBJECT), List.of(), a -> new DirectiveSpec.InvalidateCache(a.strings("tags")));
  }

  private Directives() {}

  private static void rule(String name, Set<Site> sites, List<String> required, Function<Args, DirectiveSpec> factory) {
    RULES.put(name, new Rule(sites, required, factory));
  }

  static boolean isKnown(String name) { return RULES.containsKey(name); }

  /** Reads every directive of a definition; problems are appended to {@code errors} and the directive skipped. */
  static List<DirectiveSpec> readAll(List<Directive> directives, Site site, String source, List<SchemaError> errors) {
    List<DirectiveSpec> out = new ArrayList<>();
    for (Directive d : directives) {
      DirectiveSpec spec = read(d, site, source, errors);
      if (spec != null) out.add(spec);
    }
    return out;
  }

  static DirectiveSpec read(Directive d, Site site, String source, List<SchemaError> errors) {
    SdlLocation loc = location(d, source);
    if (IGNORED.contains(d.getName())) return null;
    Rule rule = RULES.get(d.getName());
    if (rule == null) {
      errors.add(new SchemaError(SchemaError.Code.UNKNOWN_DIRECTIVE, "Unknown directive @" + d.getName(), loc));
      return null;
    }
    if (!rule.sites().contains(site)) {
      errors.add(new SchemaError(SchemaError.Code.WRONG_LOCATION,
          "Directive @" + d.getName() + " is not allowed on " + site.name().toLowerCase(Locale.ROOT) + " definitions", loc));
      return null;
    }
    Args args = new Args(d);
    for (String r : rule.required()) {
      if (!args.has(r)) {
        errors.add(new SchemaError(SchemaError.Code.MISSING_ARGUMENT,
            "Directive @" + d.getName() + " requires argument '" + r + "'", loc));
        return null;
      }
    }
    try {
      return rule.factory().apply(args);
    } catch (ClassCastException | IllegalArgumentException | ArithmeticException e) {
      errors.add(new SchemaError(SchemaError.Code.INVALID_DEFINITION,
          "Invalid arguments of @" + d.getName() + ": " + e.getMessage(), loc));
      return null;
    }
  }

  static SdlLocation location(Node<?> node, String source) {
    SourceLocation sl = node == null ? null : node.getSourceLocation();
    if (sl == null) return new SdlLocation(source, 0, 0);
    return new SdlLocation(source, sl.getLine(), sl.getColumn());
  }

  static final class Args {
    private final Map<String, Object> values = new HashMap<>();

    Args(Directive d) {
      for (Argument a : d.getArguments()) values.put(a.getName(), SdlValues.toJava(a.getValue()));
    }

    boolean has(String name) { return values.get(name) != null; }

    Object raw(String name) { return values.get(name); }

    String string(String name) {
      Object v = values.get(name);
      return v == null ? null : v.toString();
    }

    boolean bool(String name) {
      Object v = values.get(name);
      return v != null && (Boolean) v;
    }

    int integer(String name, int dflt) {
      Object v = values.get(name);
      return v == null ? dflt : ((Number) v).intValue();
    }

    List<String> strings(String name) {
      Object v = values.get(name);
      if (v == null) return List.of();
      if (v instanceof List<?> l) return l.stream().map(String::valueOf).toList();
      return List.of(v.toString());
    }

    Map<String, String> stringMap(String name) {
      Object v = values.get(name);
      if (v == null) return Map.of();
      if (!(v instanceof Map<?, ?> m)) throw new IllegalArgumentException("'" + name + "' must be an object");
      Map<String, String> out = new LinkedHashMap<>();
      m.forEach((k, x) -> out.put(String.valueOf(k), String.valueOf(x)));
      return out;
    }
  }
}
