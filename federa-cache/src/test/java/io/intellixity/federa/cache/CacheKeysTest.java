package io.intellixity.federa.cache;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class CacheKeysTest {
  private static final String FIELD = "orders(limit: $n) { id total }";

  @Test
  void sameQueryVariablesAndRoleGiveSameKey() {
    Map<String, Object> v1 = new LinkedHashMap<>();
    v1.put("n", 10);
    v1.put("status", "open");
    Map<String, Object> v2 = new LinkedHashMap<>();
    v2.put("status", "open");
    v2.put("n", 10);

    String k1 = CacheKeys.of(FIELD, v1, "reader");
    assertEquals(k1, CacheKeys.of(FIELD, v2, "reader"));
    assertEquals(64, k1.length());
  }

  @Test
  void roleVariablesAndTextChangeTheKey() {
    String base = CacheKeys.of(FIELD, Map.of("n", 10), "reader");

    assertNotEquals(base, CacheKeys.of(FIELD, Map.of("n", 10), "admin"));
    assertNotEquals(base, CacheKeys.of(FIELD, Map.of("n", 11), "reader"));
    assertNotEquals(base, CacheKeys.of(FIELD + " ", Map.of("n", 10), "reader"));
  }

  @Test
  void explicitKeyIsKept() {
    assertEquals("top-orders", CacheKeys.explicit("top-orders"));
    assertThrows(IllegalArgumentException.class, () -> CacheKeys.explicit(" "));
  }
}
