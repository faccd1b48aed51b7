package io.intellixity.federa.spi.source;

import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.spi.sql.Dialect;

/**
 * Connection to one data source. Adapters are shared by concurrent requests and must be thread-safe.
 */
public interface SourceAdapter extends AutoCloseable {
  /** Data source name. */
  String name();

  Capabilities capabilities();

  /** SQL dialect, or {@code null} when the source only accepts {@link ScanRequest}s. */
  Dialect dialect();

  /**
   * Runs one native query. Implementations check {@code token} before starting and abort running work
   * when it is cancelled.
   *
   * @throws SourceExecutionException on any backend failure
   */
  SourceResult execute(NativeQuery query, CancellationToken token);

  @Override
  default void close() {}
}
