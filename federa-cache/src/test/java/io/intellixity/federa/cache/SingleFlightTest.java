package io.intellixity.federa.cache;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class SingleFlightTest {
  @Test
  void lateCallersJoinTheRunningComputation() {
    SingleFlight<String, String> sf = new SingleFlight<>();
    AtomicInteger starts = new AtomicInteger();
    CompletableFuture<String> gate = new CompletableFuture<>();

    CompletableFuture<String> a = sf.run("k", () -> { starts.incrementAndGet(); return gate; });
    CompletableFuture<String> b = sf.run("k", () -> { starts.incrementAndGet(); return gate; });
    assertTrue(sf.isInFlight("k"));

    gate.complete("v");

    assertEquals("v", a.join());
    assertEquals("v", b.join());
    assertEquals(1, starts.get());
    assertFalse(sf.isInFlight("k"));
  }

  @Test
  void workThatThrowsReleasesTheKey() {
    SingleFlight<String, String> sf = new SingleFlight<>();

    CompletableFuture<String> f = sf.run("k", () -> { throw new IllegalStateException("no"); });

    assertTrue(f.isCompletedExceptionally());
    assertEquals(0, sf.size());
    assertEquals("x", sf.run("k", () -> CompletableFuture.completedFuture("x")).join());
  }
}
