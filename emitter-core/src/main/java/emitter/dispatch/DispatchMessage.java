package emitter.dispatch;

import emitter.registry.HandlerEntry;

/**
 * A claimed trigger waiting in the {@link AsyncEventBus} queue.
 *
 * @param entry the entry to execute, already claimed
 * @param args a private copy of the trigger arguments
 */
record DispatchMessage(HandlerEntry entry, Object[] args) {
}
