package emitter.dispatch;

import emitter.EmitStatus;
import emitter.registry.HandlerEntry;
import emitter.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Asynchronous emitter: {@code send} queues the trigger and returns before the handler runs.
 *
 * <p>A single dispatch loop thread consumes the queue for the lifetime of the bus and hands
 * every message to a fresh task on a cached pool, so invocations are independent of each
 * other. The caller of {@code send} sees only registration and argument-count problems
 * ({@link EmitStatus#NOT_FOUND}, {@link EmitStatus#ARGS_NOT_MATCH}) and
 * {@link EmitStatus#REJECTED} when the queue is full or the bus is closed. Handler failures
 * are logged and counted, never reported back.
 *
 * <p>Once handlers are claimed and unbound inside {@code send}, so a second trigger gets
 * {@link EmitStatus#NOT_FOUND} immediately. A claimed message that is then rejected by a
 * full queue still counts as consumed.
 *
 * <h2>Shutdown</h2>
 * <p>{@link #close()} stops accepting triggers and stops the loop. With the default
 * {@code drainTimeoutMs} of 0, messages still queued and handlers already running are
 * abandoned. A positive drain timeout makes the loop empty the queue first and waits for
 * running handlers up to that timeout.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (AsyncEventBus events = AsyncEventBus.builder()
 *     .queueCapacity(10_000)
 *     .drainTimeoutMs(2_000)
 *     .build()) {
 *   events.on("order.placed", (String id) -> notifier.notify(id));
 *   events.send("order.placed", "order-123");
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class AsyncEventBus extends AbstractEmitter implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AsyncEventBus.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<DispatchMessage> queue;
  private final ExecutorService handlers;
  private final Thread loopThread;
  private final long drainTimeoutMs;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private AsyncEventBus(Builder builder) {
    super(builder);
    int queueCapacity = builder.queueCapacity;
    if (queueCapacity < 0) {
      throw new IllegalArgumentException("queueCapacity must be >= 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    String prefix = Objects.requireNonNull(builder.threadNamePrefix, "threadNamePrefix");
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.queue = queueCapacity == 0
        ? new LinkedBlockingQueue<>()
        : new LinkedBlockingQueue<>(queueCapacity);
    this.handlers = Executors.newCachedThreadPool(new DaemonThreadFactory(prefix + "handler-"));
    this.loopThread = new DaemonThreadFactory(prefix + "dispatch-loop-").newThread(this::dispatchLoop);
    this.loopThread.start();
  }

  public AsyncEventBus() {
    this(builder());
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  protected EmitStatus dispatch(HandlerEntry entry, Object[] args) {
    if (!accepting.get()) {
      metrics.incrementRejected();
      return EmitStatus.REJECTED;
    }
    if (!entry.claim()) {
      metrics.incrementNotFound();
      return EmitStatus.NOT_FOUND;
    }
    retire(entry);
    DispatchMessage message = new DispatchMessage(entry, args.clone());
    boolean enqueued = queue.offer(message);
    metrics.recordQueueDepth(queue.size());
    if (!enqueued) {
      metrics.incrementRejected();
      logger.warning(() -> "Dispatch queue full; dropped trigger for " + entry.key());
      return EmitStatus.REJECTED;
    }
    // close() may have started after the accepting check; the loop might already be gone
    if (!accepting.get() && queue.remove(message)) {
      metrics.incrementRejected();
      logger.fine(() -> "Bus closed during send; withdrew trigger for " + entry.key());
      return EmitStatus.REJECTED;
    }
    metrics.incrementEnqueued();
    return EmitStatus.OK;
  }

  private void dispatchLoop() {
    boolean drain = drainTimeoutMs > 0;
    while (running.get() || (drain && !queue.isEmpty())) {
      try {
        DispatchMessage message = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (message == null) {
          continue;
        }
        metrics.recordQueueDepth(queue.size());
        handOff(message);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Dispatch loop error", t);
      }
    }
    logger.fine(() -> "Dispatch loop stopped; abandoned " + queue.size() + " queued trigger(s)");
  }

  private void handOff(DispatchMessage message) {
    try {
      handlers.execute(() -> invoker.execute(message.entry(), message.args()));
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Handler pool shut down; dropped trigger for "
          + message.entry().key(), e);
    }
  }

  /**
   * Returns the number of triggers waiting in the queue.
   */
  public int queueDepth() {
    return queue.size();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Stops accepting triggers and stops the dispatch loop. Safe to call more than once;
   * later calls return immediately.
   *
   * <p>Without a drain timeout this returns as soon as the loop thread has exited, leaving
   * queued triggers unprocessed and running handlers to finish on their own. With a drain
   * timeout the loop first empties the queue, then running handlers are awaited; whatever
   * is still running when the timeout expires is interrupted. Both phases share the one
   * timeout.
   *
   * <p>A {@code send} racing this call either has its trigger processed by the drain or
   * gets {@link EmitStatus#REJECTED}.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    accepting.set(false);
    running.set(false);
    try {
      long loopWaitMs = drainTimeoutMs > 0 ? drainTimeoutMs : QUEUE_POLL_TIMEOUT_MS * 4;
      long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(loopWaitMs);
      loopThread.join(loopWaitMs);
      if (loopThread.isAlive()) {
        logger.log(Level.WARNING, "Dispatch loop did not stop in " + loopWaitMs
            + " ms; interrupting. Queued: " + queue.size());
        loopThread.interrupt();
      }
      handlers.shutdown();
      long remainingNanos = Math.max(0, deadline - System.nanoTime());
      if (drainTimeoutMs > 0 && !handlers.awaitTermination(remainingNanos, TimeUnit.NANOSECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting running handlers");
        handlers.shutdownNow();
      }
    } catch (InterruptedException e) {
      handlers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link AsyncEventBus}. */
  public static final class Builder extends AbstractBuilder<Builder> {
    private int queueCapacity = 0;
    private long drainTimeoutMs = 0;
    private String threadNamePrefix = "emitter-";

    private Builder() {}

    /**
     * Sets the capacity of the dispatch queue.
     *
     * <p>Optional. Defaults to {@code 0}, meaning unbounded. Must be &ge; 0.
     *
     * @param queueCapacity maximum number of queued triggers, or 0 for no limit
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets how long {@link AsyncEventBus#close()} may spend draining queued triggers and
     * waiting for running handlers.
     *
     * <p>Optional. Defaults to {@code 0}: no drain, queued work is abandoned.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the prefix for the loop and handler thread names.
     *
     * <p>Optional. Defaults to {@code "emitter-"}.
     *
     * @param threadNamePrefix the prefix
     * @return this builder
     */
    public Builder threadNamePrefix(String threadNamePrefix) {
      this.threadNamePrefix = threadNamePrefix;
      return this;
    }

    /**
     * Builds the bus and starts its dispatch loop.
     *
     * @return a running {@link AsyncEventBus}
     * @throws IllegalArgumentException if {@code queueCapacity} or {@code drainTimeoutMs}
     *     is negative
     */
    public AsyncEventBus build() {
      return new AsyncEventBus(this);
    }
  }
}
