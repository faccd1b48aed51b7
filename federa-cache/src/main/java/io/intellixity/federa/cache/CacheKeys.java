package io.intellixity.federa.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/** Cache keys of top-level fields. */
public final class CacheKeys {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
      .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

  private CacheKeys() {}

  /**
   * SHA-256 (hex) of the printed field, the variables it uses and the caller's role. Variable order does
   * not matter.
   */
  public static String of(String printedField, Map<String, ?> variables, String role) {
    StringBuilder sb = new StringBuilder(printedField == null ? "" : printedField);
    sb.append('\n');
    try {
      sb.append(MAPPER.writeValueAsString(variables == null ? Map.of() : new TreeMap<>(variables)));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Variables are not serializable for a cache key", e);
    }
    sb.append('\n').append(role == null ? "" : role);
    return sha256(sb.toString());
  }

  /** An explicit {@code @cache(key:)} is used as given. */
  public static String explicit(String key) {
    if (key == null || key.isBlank()) throw new IllegalArgumentException("cache key must not be blank");
    return key;
  }

  static String sha256(String s) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
