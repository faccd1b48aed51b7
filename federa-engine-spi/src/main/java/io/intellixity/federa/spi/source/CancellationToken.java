package io.intellixity.federa.spi.source;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Request-scoped cancellation signal shared by the coordinator, adapters and local merges.
 * <p>
 * A token is cancelled explicitly or implicitly once its deadline passes. Listeners run once, on the
 * thread that cancels.
 */
public final class CancellationToken {
  private final AtomicReference<String> reason = new AtomicReference<>();
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
  private final long deadlineNanos;

  private CancellationToken(long deadlineNanos) {
    this.deadlineNanos = deadlineNanos;
  }

  public static CancellationToken create() {
    return new CancellationToken(Long.MAX_VALUE);
  }

  public static CancellationToken withTimeoutMillis(long millis) {
    if (millis <= 0) return create();
    return new CancellationToken(System.nanoTime() + millis * 1_000_000L);
  }

  public void cancel(String why) {
    if (!reason.compareAndSet(null, why == null ? "cancelled" : why)) return;
    for (Runnable r : listeners) r.run();
  }

  public boolean isCancelled() {
    return reason.get() != null || expired();
  }

  public boolean expired() {
    return deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0;
  }

  public String reason() {
    String r = reason.get();
    if (r != null) return r;
    return expired() ? "deadline exceeded" : null;
  }

  /** Remaining time until the deadline, {@code Long.MAX_VALUE} without one, never negative. */
  public long remainingMillis() {
    if (deadlineNanos == Long.MAX_VALUE) return Long.MAX_VALUE;
    return Math.max(0, (deadlineNanos - System.nanoTime()) / 1_000_000L);
  }

  /** Registers {@code listener}; runs it immediately when the token is already cancelled. */
  public Registration onCancel(Runnable listener) {
    listeners.add(listener);
    if (reason.get() != null && listeners.remove(listener)) listener.run();
    return () -> listeners.remove(listener);
  }

  public void throwIfCancelled(String dataSource) {
    if (!isCancelled()) return;
    SourceExecutionException.Code code = expired() && reason.get() == null
        ? SourceExecutionException.Code.TIMEOUT
        : SourceExecutionException.Code.CANCELLED;
    throw new SourceExecutionException(code, dataSource, "Request " + reason());
  }

  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
