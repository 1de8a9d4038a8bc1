/**
 * Trigger dispatch: the failure-isolating {@link emitter.dispatch.Invoker} and the two
 * emitters built on it.
 *
 * <p>{@link emitter.dispatch.EventBus} runs handlers inline on the caller's thread.
 * {@link emitter.dispatch.AsyncEventBus} queues triggers for a background dispatch loop that
 * runs each handler as an independent task.
 *
 * @see emitter.dispatch.EventBus
 * @see emitter.dispatch.AsyncEventBus
 * @see emitter.dispatch.EventInterceptor
 */
package emitter.dispatch;
