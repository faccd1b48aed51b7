package io.intellixity.federa.cache.redis;

import io.intellixity.federa.cache.CacheException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JsonValueCodecTest {
  private final JsonValueCodec codec = new JsonValueCodec();

  @Test
  void fieldResultsComeBackAsPlainJsonValues() {
    Object rows = List.of(Map.of("id", 1, "name", "a"), Map.of("id", 2, "name", "b"));

    assertEquals(rows, codec.decodeValue(codec.encodeValue(rows)));
  }

  @Test
  void timestampsAreWrittenAsIsoText() {
    OffsetDateTime ts = OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC);

    Object decoded = codec.decodeValue(codec.encodeValue(Map.of("at", ts)));

    assertEquals(Map.of("at", "2024-03-01T10:00:00Z"), decoded);
  }

  @Test
  void keysAreUtf8() {
    assertEquals("federa:v:ключ", codec.decodeKey(codec.encodeKey("federa:v:ключ")));
  }

  @Test
  void garbageIsACacheError() {
    ByteBuffer junk = ByteBuffer.wrap("{not json".getBytes(StandardCharsets.UTF_8));
    assertThrows(CacheException.class, () -> codec.decodeValue(junk));
  }

  @Test
  void valueAndTagKeysDoNotCollide() {
    assertEquals("federa:v:orders", RedisCacheTier.valueKey(RedisCacheTier.DEFAULT_PREFIX, "orders"));
    assertEquals("federa:t:orders", RedisCacheTier.tagKey(RedisCacheTier.DEFAULT_PREFIX, "orders"));
  }
}
