package emitter.micrometer;

import emitter.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code emitter.dispatch.success} — handler invocations that completed</li>
 *   <li>{@code emitter.dispatch.failure} — handler invocations that threw (recovered)</li>
 *   <li>{@code emitter.send.not.found} — triggers for keys with no live handler</li>
 *   <li>{@code emitter.send.args.mismatch} — triggers with a wrong argument count</li>
 *   <li>{@code emitter.enqueue} — triggers queued by an asynchronous bus</li>
 *   <li>{@code emitter.enqueue.rejected} — triggers refused (queue full or bus closed)</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code emitter.queue.depth} — current asynchronous queue depth</li>
 *   <li>{@code emitter.handler.duration} — handler execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter dispatchSuccess;
  private final Counter dispatchFailure;
  private final Counter notFound;
  private final Counter argsMismatch;
  private final Counter enqueued;
  private final Counter rejected;
  private final Gauge queueDepthGauge;
  private final Timer handlerDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "emitter"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "emitter");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several buses in one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.events"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.dispatchSuccess = Counter.builder(namePrefix + ".dispatch.success")
        .description("Handler invocations that completed")
        .register(registry);
    this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
        .description("Handler invocations that threw and were recovered")
        .register(registry);
    this.notFound = Counter.builder(namePrefix + ".send.not.found")
        .description("Triggers for keys with no live handler")
        .register(registry);
    this.argsMismatch = Counter.builder(namePrefix + ".send.args.mismatch")
        .description("Triggers with a wrong argument count")
        .register(registry);
    this.enqueued = Counter.builder(namePrefix + ".enqueue")
        .description("Triggers queued for asynchronous dispatch")
        .register(registry);
    this.rejected = Counter.builder(namePrefix + ".enqueue.rejected")
        .description("Triggers refused (queue full or bus closed)")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.handlerDuration = Timer.builder(namePrefix + ".handler.duration")
        .description("Handler execution time")
        .register(registry);
  }

  @Override
  public void incrementDispatchSuccess() {
    if (closed) return;
    dispatchSuccess.increment();
  }

  @Override
  public void incrementDispatchFailure() {
    if (closed) return;
    dispatchFailure.increment();
  }

  @Override
  public void incrementNotFound() {
    if (closed) return;
    notFound.increment();
  }

  @Override
  public void incrementArgsMismatch() {
    if (closed) return;
    argsMismatch.increment();
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    this.queueDepth.set(depth);
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this once the bus it was attached to is closed, to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(dispatchSuccess, dispatchFailure, notFound, argsMismatch,
        enqueued, rejected, queueDepthGauge, handlerDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
