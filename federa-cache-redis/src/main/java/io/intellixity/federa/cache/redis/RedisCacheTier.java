package io.intellixity.federa.cache.redis;

import io.intellixity.federa.cache.CacheException;
import io.intellixity.federa.cache.ExternalCacheTier;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * External cache tier on Redis.
 * <p>
 * Entries live under {@code <prefix>v:<key>} with a PX expiry. Each tag is a set
 * {@code <prefix>t:<tag>} of entry keys whose expiry is kept at least as long as its longest entry.
 * Every Redis failure surfaces as {@link CacheException}.
 */
public final class RedisCacheTier implements ExternalCacheTier {
  private static final Logger log = LoggerFactory.getLogger(RedisCacheTier.class);

  public static final String DEFAULT_PREFIX = "federa:";

  private final RedisClient client;
  private final StatefulRedisConnection<String, Object> connection;
  private final String prefix;

  private RedisCacheTier(RedisClient client, StatefulRedisConnection<String, Object> connection, String prefix) {
    this.client = client;
    this.connection = connection;
    this.prefix = prefix;
  }

  /** Connects to {@code uri} (e.g. {@code redis://localhost:6379/0}). */
  public static RedisCacheTier connect(String uri, Duration timeout, String prefix) {
    Objects.requireNonNull(uri, "uri");
    RedisURI redisUri = RedisURI.create(uri);
    if (timeout != null) redisUri.setTimeout(timeout);
    RedisClient client = RedisClient.create(redisUri);
    try {
      StatefulRedisConnection<String, Object> conn = client.connect(new JsonValueCodec());
      log.info("federa.cache redis connected host={} db={}", redisUri.getHost(), redisUri.getDatabase());
      return new RedisCacheTier(client, conn, prefix == null ? DEFAULT_PREFIX : prefix);
    } catch (RedisException e) {
      client.shutdown();
      throw new CacheException("Redis is unreachable: " + e.getMessage(), e);
    }
  }

  @Override
  public Object get(String key) {
    try {
      return commands().get(valueKey(prefix, key));
    } catch (RedisException e) {
      throw new CacheException("Redis GET failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void set(String key, Object value, Duration ttl, Set<String> tags) {
    long ttlMillis = Math.max(1, ttl.toMillis());
    String vk = valueKey(prefix, key);
    try {
      RedisCommands<String, Object> cmd = commands();
      cmd.set(vk, value, SetArgs.Builder.px(ttlMillis));
      for (String tag : tags) {
        String tk = tagKey(prefix, tag);
        cmd.sadd(tk, vk);
        Long current = cmd.pttl(tk);
        if (current != null && current != -2 && current < ttlMillis) cmd.pexpire(tk, ttlMillis);
      }
    } catch (RedisException e) {
      throw new CacheException("Redis SET failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void invalidateByTag(String tag) {
    String tk = tagKey(prefix, tag);
    try {
      RedisCommands<String, Object> cmd = commands();
      Set<Object> members = cmd.smembers(tk);
      if (!members.isEmpty()) {
        cmd.del(members.stream().map(String::valueOf).toArray(String[]::new));
      }
      cmd.del(tk);
      log.debug("federa.cache redis invalidated tag={} entries={}", tag, members.size());
    } catch (RedisException e) {
      throw new CacheException("Redis invalidation failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    connection.close();
    client.shutdown();
  }

  private RedisCommands<String, Object> commands() {
    return connection.sync();
  }

  static String valueKey(String prefix, String key) {
    return prefix + "v:" + key;
  }

  static String tagKey(String prefix, String tag) {
    return prefix + "t:" + tag;
  }
}
