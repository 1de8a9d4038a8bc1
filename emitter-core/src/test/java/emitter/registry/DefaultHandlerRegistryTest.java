package emitter.registry;

import emitter.Handlers;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultHandlerRegistryTest {

  private static HandlerEntry entry(String key) {
    return new HandlerEntry(key, false, Handlers.of(() -> {}));
  }

  @Test
  void lookupReturnsNullForUnregisteredKey() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertNull(registry.lookup("Unknown"));
  }

  @Test
  void returnsRegisteredEntry() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    HandlerEntry add = entry("add");

    assertTrue(registry.register(add));

    assertSame(add, registry.lookup("add"));
  }

  @Test
  void secondRegistrationForSameKeyIsRefused() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    HandlerEntry first = entry("add");
    HandlerEntry second = entry("add");

    assertTrue(registry.register(first));
    assertFalse(registry.register(second));

    assertSame(first, registry.lookup("add"));
  }

  @Test
  void removeUnknownKeyIsNoop() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    registry.remove("missing");

    assertEquals(0, registry.size());
  }

  @Test
  void removeAllowsReRegistration() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    registry.register(entry("add"));

    registry.remove("add");

    assertNull(registry.lookup("add"));
    assertTrue(registry.register(entry("add")));
  }

  @Test
  void conditionalRemoveLeavesNewerEntryInPlace() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    HandlerEntry old = entry("job");
    HandlerEntry fresh = entry("job");
    registry.register(old);
    registry.remove("job");
    registry.register(fresh);

    assertFalse(registry.remove("job", old));
    assertSame(fresh, registry.lookup("job"));

    assertTrue(registry.remove("job", fresh));
    assertNull(registry.lookup("job"));
  }

  @Test
  void conditionalRemoveWithNullEntryIsNoop() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    registry.register(entry("job"));

    assertFalse(registry.remove("job", null));
    assertEquals(1, registry.size());
  }

  @Test
  void keysIsSnapshot() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    registry.register(entry("a"));
    registry.register(entry("b"));

    Set<String> keys = registry.keys();
    registry.register(entry("c"));

    assertEquals(Set.of("a", "b"), keys);
    assertThrows(UnsupportedOperationException.class, () -> keys.add("d"));
    assertEquals(3, registry.size());
  }

  @Test
  void rejectsNulls() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertThrows(NullPointerException.class, () -> registry.register(null));
    assertThrows(NullPointerException.class, () -> registry.lookup(null));
    assertThrows(NullPointerException.class, () -> registry.remove(null));
  }

  @Test
  void concurrentRegistrationsOfSameKeyHaveOneWinner() throws Exception {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    int threads = 16;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<HandlerEntry> candidates = new ArrayList<>();
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        HandlerEntry candidate = entry("race");
        candidates.add(candidate);
        results.add(pool.submit(() -> {
          start.await();
          return registry.register(candidate);
        }));
      }
      start.countDown();

      int winners = 0;
      HandlerEntry winner = null;
      for (int i = 0; i < threads; i++) {
        if (results.get(i).get(5, TimeUnit.SECONDS)) {
          winners++;
          winner = candidates.get(i);
        }
      }

      assertEquals(1, winners);
      assertSame(winner, registry.lookup("race"));
    } finally {
      pool.shutdownNow();
    }
  }
}
