package emitter.spi;

/**
 * Observability hook for exporting emitter counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge
 * into Micrometer or another monitoring system; see the {@code emitter-micrometer} module.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of handler invocations that completed normally.
     */
    void incrementDispatchSuccess();

    /**
     * Increments the count of handler invocations that threw and were recovered.
     */
    void incrementDispatchFailure();

    /**
     * Increments the count of triggers for a key with no live handler.
     */
    void incrementNotFound();

    /**
     * Increments the count of triggers rejected for a wrong argument count.
     */
    void incrementArgsMismatch();

    /**
     * Increments the count of dispatch messages accepted by the asynchronous queue.
     */
    void incrementEnqueued();

    /**
     * Increments the count of dispatch messages refused (queue full or bus closed).
     */
    void incrementRejected();

    /**
     * Records the current depth of the asynchronous dispatch queue.
     *
     * @param depth number of queued messages
     */
    void recordQueueDepth(int depth);

    /**
     * Records the time spent executing a handler.
     *
     * @param durationMs handler execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementNotFound() {
        }

        @Override
        public void incrementArgsMismatch() {
        }

        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementRejected() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
