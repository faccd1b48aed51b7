package io.intellixity.federa.spi.source;

import java.util.Objects;

/** Failure of one source call. The request continues; the affected branch becomes null with an error. */
public final class SourceExecutionException extends RuntimeException {
  public enum Code {
    EXECUTION_FAILED,
    SOURCE_UNAVAILABLE,
    TIMEOUT,
    CANCELLED,
    UNIQUE_VIOLATION,
    FOREIGN_KEY_VIOLATION,
    NOT_NULL_VIOLATION,
    CHECK_VIOLATION
  }

  private final Code code;
  private final String dataSource;

  public SourceExecutionException(Code code, String dataSource, String message) {
    this(code, dataSource, message, null);
  }

  public SourceExecutionException(Code code, String dataSource, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.dataSource = dataSource;
  }

  public Code code() { return code; }

  public String dataSource() { return dataSource; }
}
