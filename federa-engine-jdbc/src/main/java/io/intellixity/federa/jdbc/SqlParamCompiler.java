package io.intellixity.federa.jdbc;

import io.intellixity.federa.spi.source.Bind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Lexical helpers for SQL text.
 *
 * <ul>
 *   <li>{@link #bindsFor(String, Map)} orders binds by placeholder appearance.</li>
 *   <li>{@link #toJdbcSql(String)} rewrites {@code :name} placeholders to {@code ?}.</li>
 *   <li>{@link #expand(String, Function)} replaces {@code [ref]} template references
 *   ({@code [field]}, {@code [$arg]}, {@code [source.field]}).</li>
 * </ul>
 * Both skip single-quoted literals and double-quoted identifiers; {@code ::} is a cast, not a param.
 */
public final class SqlParamCompiler {
  private SqlParamCompiler() {}

  /**
   * Binds of the {@code :name} placeholders of {@code sql} in appearance order, so renderers may
   * allocate placeholders in any order.
   */
  public static List<Bind> bindsFor(String sql, Map<String, Bind> params) {
    List<Bind> binds = new ArrayList<>();
    if (sql == null) return binds;
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        if (ch == quote) quote = 0;
        continue;
      }
      if (ch == '\'' || ch == '"') {
        quote = ch;
        continue;
      }

      if (ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          String name = sql.substring(start, end);
          if (!params.containsKey(name)) throw new IllegalArgumentException("Missing query param: " + name);
          binds.add(params.get(name));
          i = end - 1;
        }
      }
    }
    return binds;
  }

  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) {
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }
      if (ch == '\'' || ch == '"') {
        quote = ch;
        out.append(ch);
        continue;
      }

      if (ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return out.toString();
  }

  /**
   * Replaces each {@code [ref]} with {@code resolver.apply(ref)}. A reference starts with a letter,
   * {@code _} or {@code $} and may contain dots; anything else in brackets (array subscripts) is kept.
   */
  public static String expand(String template, Function<String, String> resolver) {
    if (template == null) return null;
    StringBuilder out = new StringBuilder(template.length() + 16);
    char quote = 0;

    for (int i = 0; i < template.length(); i++) {
      char ch = template.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) quote = 0;
        continue;
      }
      if (ch == '\'' || ch == '"') {
        quote = ch;
        out.append(ch);
        continue;
      }

      if (ch == '[') {
        int close = template.indexOf(']', i + 1);
        if (close > i + 1 && isReference(template, i + 1, close)) {
          out.append(resolver.apply(template.substring(i + 1, close).trim()));
          i = close;
          continue;
        }
      }
      out.append(ch);
    }
    return out.toString();
  }

  private static boolean isReference(String s, int from, int to) {
    String ref = s.substring(from, to).trim();
    if (ref.isEmpty()) return false;
    char first = ref.charAt(0);
    if (!(isIdentStart(first) || first == '$')) return false;
    for (int i = 1; i < ref.length(); i++) {
      char c = ref.charAt(i);
      if (!(isIdentPart(c) || c == '.')) return false;
    }
    return true;
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
