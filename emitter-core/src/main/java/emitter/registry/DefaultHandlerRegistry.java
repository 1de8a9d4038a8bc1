package emitter.registry;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-backed handler registry.
 *
 * <p>Registration uses {@link ConcurrentHashMap#putIfAbsent}, so two concurrent registrations
 * of the same key can never both observe the key as free.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry();
 * registry.register(new HandlerEntry("add", false, Handlers.of((Integer a, Integer b) -> sum(a, b))));
 * HandlerEntry entry = registry.lookup("add");
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {

  private final Map<String, HandlerEntry> entries = new ConcurrentHashMap<>();

  @Override
  public boolean register(HandlerEntry entry) {
    Objects.requireNonNull(entry, "entry");
    return entries.putIfAbsent(entry.key(), entry) == null;
  }

  @Override
  public HandlerEntry lookup(String key) {
    Objects.requireNonNull(key, "key");
    return entries.get(key);
  }

  @Override
  public void remove(String key) {
    Objects.requireNonNull(key, "key");
    entries.remove(key);
  }

  @Override
  public boolean remove(String key, HandlerEntry entry) {
    Objects.requireNonNull(key, "key");
    if (entry == null) {
      return false;
    }
    return entries.remove(key, entry);
  }

  @Override
  public Set<String> keys() {
    return Set.copyOf(entries.keySet());
  }

  @Override
  public int size() {
    return entries.size();
  }
}
