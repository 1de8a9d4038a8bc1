/**
 * Handler storage keyed by event name.
 *
 * <p>The registry maps each key to a single {@link emitter.registry.HandlerEntry}. A second
 * registration under a live key is refused; the first one stays in place.
 *
 * @see emitter.registry.HandlerRegistry
 * @see emitter.registry.DefaultHandlerRegistry
 */
package emitter.registry;
