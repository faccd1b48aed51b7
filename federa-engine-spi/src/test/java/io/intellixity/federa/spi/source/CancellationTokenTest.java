package io.intellixity.federa.spi.source;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class CancellationTokenTest {
  @Test
  void listenersRunOnceOnCancel() {
    CancellationToken token = CancellationToken.create();
    AtomicInteger calls = new AtomicInteger();
    token.onCancel(calls::incrementAndGet);

    token.cancel("client disconnected");
    token.cancel("again");

    assertTrue(token.isCancelled());
    assertEquals("client disconnected", token.reason());
    assertEquals(1, calls.get());
  }

  @Test
  void lateListenerRunsImmediately() {
    CancellationToken token = CancellationToken.create();
    token.cancel(null);
    AtomicInteger calls = new AtomicInteger();
    token.onCancel(calls::incrementAndGet);
    assertEquals(1, calls.get());
  }

  @Test
  void closedRegistrationIsNotNotified() {
    CancellationToken token = CancellationToken.create();
    AtomicInteger calls = new AtomicInteger();
    try (CancellationToken.Registration ignored = token.onCancel(calls::incrementAndGet)) {
      assertFalse(token.isCancelled());
    }
    token.cancel("done");
    assertEquals(0, calls.get());
  }

  @Test
  void expiredDeadlineReportsTimeout() throws InterruptedException {
    CancellationToken token = CancellationToken.withTimeoutMillis(1);
    Thread.sleep(20);
    assertTrue(token.isCancelled());
    assertEquals(0, token.remainingMillis());
    SourceExecutionException e = assertThrows(SourceExecutionException.class, () -> token.throwIfCancelled("pg"));
    assertEquals(SourceExecutionException.Code.TIMEOUT, e.code());
    assertEquals("pg", e.dataSource());
  }

  @Test
  void explicitCancelReportsCancelled() {
    CancellationToken token = CancellationToken.withTimeoutMillis(60_000);
    assertTrue(token.remainingMillis() > 0);
    token.cancel("client disconnected");
    SourceExecutionException e = assertThrows(SourceExecutionException.class, () -> token.throwIfCancelled("pg"));
    assertEquals(SourceExecutionException.Code.CANCELLED, e.code());
  }
}
