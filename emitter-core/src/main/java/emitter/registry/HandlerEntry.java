package emitter.registry;

import emitter.EventHandler;
import emitter.util.Keys;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A handler bound to an event key, together with its registration metadata.
 *
 * <p>Everything except the call counter is fixed at construction. The expected argument
 * count is read from the handler once, here, and never again. A new entry is created for
 * every registration; entries are not reused after removal.
 *
 * <p>This class is thread-safe.
 */
public final class HandlerEntry {
  private final String key;
  private final boolean once;
  private final EventHandler handler;
  private final int expectedArgCount;
  private final AtomicInteger callCount = new AtomicInteger();

  public HandlerEntry(String key, boolean once, EventHandler handler) {
    this.key = Keys.check(key);
    this.once = once;
    this.handler = Objects.requireNonNull(handler, "handler");
    int arity = handler.arity();
    if (arity < 0) {
      throw new IllegalArgumentException("handler arity must be >= 0, got " + arity);
    }
    this.expectedArgCount = arity;
  }

  public String key() {
    return key;
  }

  public boolean once() {
    return once;
  }

  public EventHandler handler() {
    return handler;
  }

  public int expectedArgCount() {
    return expectedArgCount;
  }

  /**
   * Returns how many invocations have been attempted past the argument check.
   *
   * <p>For a once entry this can exceed 1: callers that lost the race still advance it.
   */
  public int callCount() {
    return callCount.get();
  }

  /**
   * Atomically records an invocation attempt and decides whether it may run.
   *
   * <p>Repeatable entries always may. A once entry admits only the attempt whose increment
   * produced 1.
   *
   * @return {@code true} if the caller may invoke the handler
   */
  public boolean claim() {
    int n = callCount.incrementAndGet();
    return !once || n == 1;
  }

  @Override
  public String toString() {
    return "{key: " + key + ", once: " + once + ", callCount: " + callCount.get() + "}";
  }
}
