/**
 * Root API for the emitter: an in-process registry of named event handlers, triggered by key.
 *
 * <h2>Core Design</h2>
 * <p>Handlers are fixed-arity commands ({@link emitter.EventHandler}); the arity is captured
 * when the handler is registered and every trigger is checked against it. Each key holds one
 * handler. {@code once} handlers run at most one time, decided by an atomic counter on the
 * registry entry, so concurrent triggers cannot run them twice. Handler failures are caught
 * at the invoker boundary and reported as {@link emitter.EmitStatus#HANDLER_FAILED}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>emitter-core</b> — API, registry, invoker, synchronous and asynchronous emitters
 *       (zero external deps)</li>
 *   <li><b>emitter-micrometer</b> — Micrometer binding for
 *       {@link emitter.spi.MetricsExporter}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Emitter events = new EventBus();
 * events.on("add", (Integer a, Integer b) -> System.out.println(a + b));
 * events.send("add", 1, 2);
 *
 * try (AsyncEventBus async = AsyncEventBus.builder()
 *     .metrics(new MicrometerMetricsExporter(meterRegistry))
 *     .build()) {
 *   async.once("ready", () -> startServing());
 *   async.send("ready");
 * }
 * }</pre>
 *
 * @see emitter.Emitter
 * @see emitter.Handlers
 * @see emitter.EmitStatus
 */
package emitter;
