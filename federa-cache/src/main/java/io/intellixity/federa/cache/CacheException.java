package io.intellixity.federa.cache;

/** A cache tier failed. Never fatal: callers log it and continue without the tier. */
public final class CacheException extends RuntimeException {
  public CacheException(String message) {
    super(message);
  }

  public CacheException(String message, Throwable cause) {
    super(message, cause);
  }
}
