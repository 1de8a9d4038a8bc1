package emitter;

import emitter.util.Keys;

/**
 * Named-event registry with trigger-by-key dispatch.
 *
 * <p>{@code on} binds a repeatable handler, {@code once} binds a handler that runs at most one
 * time and is then removed, {@code send} triggers the handler bound to a key, and
 * {@code remove} unbinds it. Each key holds at most one handler.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Emitter events = new EventBus();
 * events.on("add", (Integer a, Integer b) -> System.out.println(a + b));
 * events.send("add", 1, 2);   // OK, prints 3
 * events.send("add", 1);      // ARGS_NOT_MATCH, handler not called
 *
 * events.once("greet", () -> System.out.println("hello"));
 * events.send("greet");       // OK
 * events.send("greet");       // NOT_FOUND
 * }</pre>
 *
 * <h2>Errors</h2>
 * <p>All outcomes are reported as {@link EmitStatus} values. A handler that throws never
 * propagates into {@code send}; see {@link EmitStatus#HANDLER_FAILED}. A {@code null} or
 * blank key is a programming error and fails with {@link NullPointerException} or
 * {@link IllegalArgumentException}.
 *
 * @see emitter.dispatch.EventBus
 * @see emitter.dispatch.AsyncEventBus
 */
public interface Emitter {

  /**
   * Binds a repeatable handler to {@code key}.
   *
   * @param key the event key
   * @param handler the handler; {@code null} yields {@link EmitStatus#NOT_CALLABLE}
   * @return {@link EmitStatus#OK}, {@link EmitStatus#ALREADY_EXISTS} or
   *     {@link EmitStatus#NOT_CALLABLE}
   */
  EmitStatus on(String key, EventHandler handler);

  /**
   * Binds a handler to {@code key} that runs at most one time.
   *
   * @param key the event key
   * @param handler the handler; {@code null} yields {@link EmitStatus#NOT_CALLABLE}
   * @return {@link EmitStatus#OK}, {@link EmitStatus#ALREADY_EXISTS} or
   *     {@link EmitStatus#NOT_CALLABLE}
   */
  EmitStatus once(String key, EventHandler handler);

  /**
   * Triggers the handler bound to {@code key}.
   *
   * @param key the event key
   * @param args the arguments; their count must equal the handler's arity
   * @return the outcome
   */
  EmitStatus send(String key, Object... args);

  /**
   * Unbinds {@code key}. Removing an unbound key is a no-op.
   *
   * @param key the event key
   */
  void remove(String key);

  /**
   * Binds a repeatable handler given as any invocable value.
   *
   * @see Handlers#adapt(Object)
   */
  default EmitStatus on(String key, Object callable) {
    return Handlers.adapt(callable)
        .map(handler -> on(key, handler))
        .orElseGet(() -> notCallable(key));
  }

  /**
   * Binds a once handler given as any invocable value.
   *
   * @see Handlers#adapt(Object)
   */
  default EmitStatus once(String key, Object callable) {
    return Handlers.adapt(callable)
        .map(handler -> once(key, handler))
        .orElseGet(() -> notCallable(key));
  }

  default EmitStatus on(String key, Handlers.Handler0 handler) {
    return on(key, handler == null ? null : Handlers.of(handler));
  }

  default <A> EmitStatus on(String key, Handlers.Handler1<A> handler) {
    return on(key, handler == null ? null : Handlers.of(handler));
  }

  default <A, B> EmitStatus on(String key, Handlers.Handler2<A, B> handler) {
    return on(key, handler == null ? null : Handlers.of(handler));
  }

  default <A, B, C> EmitStatus on(String key, Handlers.Handler3<A, B, C> handler) {
    return on(key, handler == null ? null : Handlers.of(handler));
  }

  default <A, B, C, D> EmitStatus on(String key, Handlers.Handler4<A, B, C, D> handler) {
    return on(key, handler == null ? null : Handlers.of(handler));
  }

  default EmitStatus on(String key, int arity, Handlers.ArgsHandler handler) {
    return on(key, handler == null ? null : Handlers.of(arity, handler));
  }

  default EmitStatus once(String key, Handlers.Handler0 handler) {
    return once(key, handler == null ? null : Handlers.of(handler));
  }

  default <A> EmitStatus once(String key, Handlers.Handler1<A> handler) {
    return once(key, handler == null ? null : Handlers.of(handler));
  }

  default <A, B> EmitStatus once(String key, Handlers.Handler2<A, B> handler) {
    return once(key, handler == null ? null : Handlers.of(handler));
  }

  default <A, B, C> EmitStatus once(String key, Handlers.Handler3<A, B, C> handler) {
    return once(key, handler == null ? null : Handlers.of(handler));
  }

  default <A, B, C, D> EmitStatus once(String key, Handlers.Handler4<A, B, C, D> handler) {
    return once(key, handler == null ? null : Handlers.of(handler));
  }

  default EmitStatus once(String key, int arity, Handlers.ArgsHandler handler) {
    return once(key, handler == null ? null : Handlers.of(arity, handler));
  }

  /**
   * Like {@link #send(String, Object...)} but throws for any outcome other than
   * {@link EmitStatus#OK}.
   *
   * @throws EmitterException carrying the failing status
   */
  default void sendOrThrow(String key, Object... args) {
    EmitStatus status = send(key, args);
    if (!status.isOk()) {
      throw new EmitterException(status, key);
    }
  }

  private static EmitStatus notCallable(String key) {
    Keys.check(key);
    return EmitStatus.NOT_CALLABLE;
  }
}
