package io.intellixity.federa.cache.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.federa.cache.CacheException;
import io.lettuce.core.codec.RedisCodec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 keys and JSON values. Cached field results are plain maps, lists and scalars; temporal values
 * come back as ISO-8601 strings.
 */
final class JsonValueCodec implements RedisCodec<String, Object> {
  private final ObjectMapper mapper = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

  @Override public String decodeKey(ByteBuffer bytes) {
    return StandardCharsets.UTF_8.decode(bytes).toString();
  }

  @Override public Object decodeValue(ByteBuffer bytes) {
    try {
      byte[] array = new byte[bytes.remaining()];
      bytes.get(array);
      return mapper.readValue(array, Object.class);
    } catch (IOException e) {
      throw new CacheException("Failed to decode cached value", e);
    }
  }

  @Override public ByteBuffer encodeKey(String key) {
    return StandardCharsets.UTF_8.encode(key);
  }

  @Override public ByteBuffer encodeValue(Object value) {
    try {
      return ByteBuffer.wrap(mapper.writeValueAsBytes(value));
    } catch (IOException e) {
      throw new CacheException("Failed to encode cached value", e);
    }
  }
}
