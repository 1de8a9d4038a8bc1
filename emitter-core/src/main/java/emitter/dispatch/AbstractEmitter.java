package emitter.dispatch;

import emitter.EmitStatus;
import emitter.Emitter;
import emitter.EventHandler;
import emitter.registry.DefaultHandlerRegistry;
import emitter.registry.HandlerEntry;
import emitter.registry.HandlerRegistry;
import emitter.spi.MetricsExporter;
import emitter.util.Keys;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registration, lookup and argument checks shared by the synchronous and asynchronous
 * emitters. Subclasses decide how a validated trigger is executed.
 *
 * @see EventBus
 * @see AsyncEventBus
 */
public abstract class AbstractEmitter implements Emitter {
  private static final Logger logger = Logger.getLogger(AbstractEmitter.class.getName());
  private static final Object[] NO_ARGS = new Object[0];

  protected final HandlerRegistry registry;
  protected final Invoker invoker;
  protected final MetricsExporter metrics;

  protected AbstractEmitter(AbstractBuilder<?> builder) {
    this.registry = builder.registry != null ? builder.registry : new DefaultHandlerRegistry();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.invoker = new Invoker(builder.interceptors, metrics);
  }

  @Override
  public EmitStatus on(String key, EventHandler handler) {
    return register(key, false, handler);
  }

  @Override
  public EmitStatus once(String key, EventHandler handler) {
    return register(key, true, handler);
  }

  private EmitStatus register(String key, boolean once, EventHandler handler) {
    Keys.check(key);
    if (handler == null) {
      return EmitStatus.NOT_CALLABLE;
    }
    HandlerEntry entry = new HandlerEntry(key, once, handler);
    if (!registry.register(entry)) {
      logger.fine(() -> "Handler already registered for " + key);
      return EmitStatus.ALREADY_EXISTS;
    }
    logger.fine(() -> "Registered " + entry);
    return EmitStatus.OK;
  }

  @Override
  public EmitStatus send(String key, Object... args) {
    Keys.check(key);
    Object[] actual = args == null ? NO_ARGS : args;
    HandlerEntry entry = registry.lookup(key);
    if (entry == null) {
      metrics.incrementNotFound();
      return EmitStatus.NOT_FOUND;
    }
    if (!key.equals(entry.key())) {
      logger.log(Level.SEVERE, "Registry returned " + entry + " for key " + key);
      return EmitStatus.INVALID_ENTRY;
    }
    if (actual.length != entry.expectedArgCount()) {
      metrics.incrementArgsMismatch();
      return EmitStatus.ARGS_NOT_MATCH;
    }
    return dispatch(entry, actual);
  }

  /**
   * Executes a trigger whose key and argument count have been validated.
   *
   * @param entry the entry registered under the key
   * @param args the arguments, matching the entry's arity
   * @return the outcome reported to the caller of {@code send}
   */
  protected abstract EmitStatus dispatch(HandlerEntry entry, Object[] args);

  @Override
  public void remove(String key) {
    Keys.check(key);
    registry.remove(key);
    logger.fine(() -> "Removed " + key);
  }

  /**
   * Drops a once entry from the registry, unless the key has since been bound to a
   * different entry.
   */
  protected void retire(HandlerEntry entry) {
    if (entry.once()) {
      registry.remove(entry.key(), entry);
    }
  }

  public HandlerRegistry registry() {
    return registry;
  }

  /**
   * Base builder with the settings shared by both emitters.
   *
   * @param <B> the concrete builder type
   */
  public abstract static sealed class AbstractBuilder<B extends AbstractBuilder<B>>
      permits EventBus.Builder, AsyncEventBus.Builder {

    HandlerRegistry registry;
    MetricsExporter metrics;
    final List<EventInterceptor> interceptors = new ArrayList<>();

    AbstractBuilder() {}

    @SuppressWarnings("unchecked")
    B self() {
      return (B) this;
    }

    /**
     * Sets the handler registry.
     *
     * <p>Optional. Defaults to a new {@link DefaultHandlerRegistry}.
     *
     * @param registry the registry
     * @return this builder
     */
    public B registry(HandlerRegistry registry) {
      this.registry = registry;
      return self();
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public B metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return self();
    }

    /**
     * Appends an interceptor. Interceptors run in registration order before the handler
     * and in reverse order after it.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public B interceptor(EventInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return self();
    }

    /**
     * Appends multiple interceptors.
     *
     * @param interceptors the interceptors to add
     * @return this builder
     */
    public B interceptors(List<EventInterceptor> interceptors) {
      Objects.requireNonNull(interceptors, "interceptors");
      for (EventInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
      return self();
    }
  }
}
