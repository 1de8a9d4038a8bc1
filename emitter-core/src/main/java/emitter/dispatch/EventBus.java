package emitter.dispatch;

import emitter.EmitStatus;
import emitter.registry.HandlerEntry;

/**
 * Synchronous emitter: {@code send} runs the handler on the caller's thread and returns
 * the actual outcome.
 *
 * <p>No background threads are used. Concurrent {@code send} calls for the same repeatable
 * key may run the handler concurrently; handlers that are not reentrant must guard
 * themselves. A once handler runs for exactly one of any number of concurrent triggers;
 * the rest get {@link EmitStatus#NOT_FOUND}. The winning trigger unbinds the key before the
 * handler starts, so the handler may bind the key again. A once handler that throws still
 * counts as consumed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventBus events = new EventBus();
 * events.on("add", (Integer a, Integer b) -> System.out.println(a + b));
 * EmitStatus status = events.send("add", 1, 2);
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class EventBus extends AbstractEmitter {

  public EventBus() {
    this(builder());
  }

  private EventBus(Builder builder) {
    super(builder);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  protected EmitStatus dispatch(HandlerEntry entry, Object[] args) {
    return invoker.invoke(entry, args, () -> retire(entry));
  }

  /** Builder for {@link EventBus}. */
  public static final class Builder extends AbstractBuilder<Builder> {

    private Builder() {}

    public EventBus build() {
      return new EventBus(this);
    }
  }
}
