package io.intellixity.federa.jdbc;

import io.intellixity.federa.spi.source.Bind;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SqlParamCompilerTest {
  @Test
  void rewritesNamedParamsAndKeepsCastsAndLiterals() {
    String sql = "SELECT x::int, ':nope', \":id\" FROM t WHERE a = :b1 AND b = :b2";
    assertEquals("SELECT x::int, ':nope', \":id\" FROM t WHERE a = ? AND b = ?", SqlParamCompiler.toJdbcSql(sql));
  }

  @Test
  void bindsFollowPlaceholderOrder() {
    Map<String, Bind> params = new LinkedHashMap<>();
    params.put("b1", Bind.untyped("first-allocated"));
    params.put("b2", Bind.untyped("second-allocated"));

    List<Bind> binds = SqlParamCompiler.bindsFor("SELECT :b2 WHERE x = :b1 AND y = :b2", params);

    assertEquals(List.of("second-allocated", "first-allocated", "second-allocated"),
        binds.stream().map(Bind::value).toList());
  }

  @Test
  void unknownPlaceholderIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> SqlParamCompiler.bindsFor("SELECT :b9", Map.of()));
    assertTrue(ex.getMessage().contains("b9"));
  }

  @Test
  void expandsReferencesButNotSubscriptsOrLiterals() {
    String out = SqlParamCompiler.expand("[price] * [qty] + arr[1] + '[price]'", ref -> "t0.\"" + ref + "\"");
    assertEquals("t0.\"price\" * t0.\"qty\" + arr[1] + '[price]'", out);
  }

  @Test
  void expandsArgumentAndQualifiedReferences() {
    String out = SqlParamCompiler.expand("[source.id] = [target.owner] AND d > [$from]", ref -> "<" + ref + ">");
    assertEquals("<source.id> = <target.owner> AND d > <$from>", out);
  }
}
