package emitter.registry;

import java.util.Set;

/**
 * Concurrent store of event handlers, at most one per key.
 *
 * <p>Each emitter owns its own registry; there is no shared global instance.
 * Implementations must be safe for arbitrary concurrent callers.
 *
 * @see HandlerEntry
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Inserts the entry only if no entry is currently registered under its key.
   * The check and the insert are a single atomic step.
   *
   * @param entry the entry to insert
   * @return {@code true} if inserted, {@code false} if the key was taken (the existing
   *     entry is left untouched)
   */
  boolean register(HandlerEntry entry);

  /**
   * Returns the entry registered under {@code key}.
   *
   * @param key the event key
   * @return the entry, or {@code null} if none
   */
  HandlerEntry lookup(String key);

  /**
   * Removes whatever is registered under {@code key}. Removing an absent key is a no-op.
   *
   * @param key the event key
   */
  void remove(String key);

  /**
   * Removes {@code entry} only if it is still the one registered under {@code key}.
   *
   * @param key the event key
   * @param entry the entry expected to be registered
   * @return {@code true} if the entry was removed
   */
  boolean remove(String key, HandlerEntry entry);

  /**
   * Returns a snapshot of the registered keys.
   *
   * @return immutable set of keys
   */
  Set<String> keys();

  default int size() {
    return keys().size();
  }
}
