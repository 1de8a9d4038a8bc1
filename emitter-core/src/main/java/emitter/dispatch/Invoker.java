package emitter.dispatch;

import emitter.EmitStatus;
import emitter.registry.HandlerEntry;
import emitter.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Performs one failure-isolated call of a handler.
 *
 * <p>The handler runs inside a protected region: whatever it throws is caught here, logged
 * together with the handler key and stack trace, and turned into
 * {@link EmitStatus#HANDLER_FAILED}, including a {@link StackOverflowError} from runaway
 * recursion. Only {@link OutOfMemoryError} and {@link InternalError} are let through.
 *
 * <p>This class is thread-safe.
 */
public final class Invoker {
  private static final Logger logger = Logger.getLogger(Invoker.class.getName());

  private final List<EventInterceptor> interceptors;
  private final MetricsExporter metrics;

  public Invoker(List<EventInterceptor> interceptors, MetricsExporter metrics) {
    this.interceptors = Collections.unmodifiableList(
        new ArrayList<>(Objects.requireNonNull(interceptors, "interceptors")));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Checks the argument count, claims the entry and executes it.
   *
   * @param entry the handler entry
   * @param args the trigger arguments
   * @return {@link EmitStatus#ARGS_NOT_MATCH} without touching the entry when the count is
   *     wrong, {@link EmitStatus#NOT_FOUND} when a once entry was already claimed, otherwise
   *     the result of {@link #execute}
   */
  public EmitStatus invoke(HandlerEntry entry, Object[] args) {
    return invoke(entry, args, null);
  }

  /**
   * Same as {@link #invoke(HandlerEntry, Object[])}, running {@code onClaimed} after a
   * successful claim and before the handler starts.
   *
   * @param entry the handler entry
   * @param args the trigger arguments
   * @param onClaimed callback for the winning caller, may be null
   * @return the outcome
   */
  public EmitStatus invoke(HandlerEntry entry, Object[] args, Runnable onClaimed) {
    if (args.length != entry.expectedArgCount()) {
      metrics.incrementArgsMismatch();
      return EmitStatus.ARGS_NOT_MATCH;
    }
    if (!entry.claim()) {
      metrics.incrementNotFound();
      return EmitStatus.NOT_FOUND;
    }
    if (onClaimed != null) {
      onClaimed.run();
    }
    return execute(entry, args);
  }

  /**
   * Runs the handler of an already-claimed entry inside the protected region.
   *
   * @param entry the handler entry
   * @param args the trigger arguments, matching the entry's arity
   * @return {@link EmitStatus#OK} or {@link EmitStatus#HANDLER_FAILED}
   */
  public EmitStatus execute(HandlerEntry entry, Object[] args) {
    long start = System.nanoTime();
    Throwable failure = null;
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeDispatch(entry.key(), args);
        completedBefore = i + 1;
      }
      entry.handler().onEvent(args);
    } catch (OutOfMemoryError | InternalError e) {
      throw e;
    } catch (Throwable t) {
      failure = t;
      if (t instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
    }
    metrics.recordHandlerDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    runAfterDispatch(entry.key(), args, failure, completedBefore);

    if (failure != null) {
      logger.log(Level.SEVERE, "Recovered failure in handler " + entry.key() + ": " + failure, failure);
      metrics.incrementDispatchFailure();
      return EmitStatus.HANDLER_FAILED;
    }
    metrics.incrementDispatchSuccess();
    return EmitStatus.OK;
  }

  private void runAfterDispatch(String key, Object[] args, Throwable error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(key, args, error);
      } catch (RuntimeException ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed for " + key, ex);
      }
    }
  }
}
