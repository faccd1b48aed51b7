package io.intellixity.federa.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class FederaFactoriesLoaderTest {
  public interface Greeter {
    String greet(String name);
  }

  public static final class HelloGreeter implements Greeter {
    @Override public String greet(String name) { return "hello " + name; }
  }

  public static final class HiGreeter implements Greeter {
    @Override public String greet(String name) { return "hi " + name; }
  }

  public interface Unlisted {}

  @Test
  void loadsListedImplementationsInOrder() {
    List<Greeter> greeters = FederaFactoriesLoader.load(Greeter.class);
    assertEquals(2, greeters.size());
    assertEquals("hello bob", greeters.get(0).greet("bob"));
    assertEquals("hi bob", greeters.get(1).greet("bob"));
  }

  @Test
  void returnsEmptyForUnlistedSpi() {
    assertTrue(FederaFactoriesLoader.load(Unlisted.class).isEmpty());
  }
}
