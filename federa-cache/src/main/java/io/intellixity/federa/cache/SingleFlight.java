package io.intellixity.federa.cache;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * At most one in-flight computation per key. Callers arriving while a computation runs attach to its
 * future instead of starting another one.
 */
public final class SingleFlight<K, V> {
  private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

  /**
   * Joins the running computation for {@code key} or starts {@code work}. The key is released when the
   * computation completes, normally or not.
   */
  public CompletableFuture<V> run(K key, Supplier<CompletableFuture<V>> work) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(work, "work");
    CompletableFuture<V> mine = new CompletableFuture<>();
    CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
    if (existing != null) return existing;

    CompletableFuture<V> started;
    try {
      started = work.get();
    } catch (RuntimeException | Error e) {
      inFlight.remove(key, mine);
      mine.completeExceptionally(e);
      return mine;
    }
    started.whenComplete((v, err) -> {
      inFlight.remove(key, mine);
      if (err != null) mine.completeExceptionally(err);
      else mine.complete(v);
    });
    return mine;
  }

  public boolean isInFlight(K key) {
    return inFlight.containsKey(key);
  }

  public int size() {
    return inFlight.size();
  }
}
