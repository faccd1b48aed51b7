package io.intellixity.federa.spi.source;

/** Backend-specific query handed to a {@link SourceAdapter}. */
public sealed interface NativeQuery permits SqlStatement, ScanRequest {
  /** Data source the query targets. */
  String dataSource();
}
