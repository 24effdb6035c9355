package eventbus.spi;

/**
 * Observability hook for exporting bus counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of accepted emissions.
     */
    void incrementEmitted();

    /**
     * Increments the count of emissions dropped because the bus was not running.
     */
    void incrementDropped();

    /**
     * Increments the count of callback invocations that completed normally.
     */
    void incrementListenerSuccess();

    /**
     * Increments the count of callback invocations that failed and were handed to the
     * error handler.
     */
    void incrementListenerFailure();

    /**
     * Records the number of emissions waiting in a dispatch queue.
     *
     * @param depth queued emissions, not counting the one being dispatched
     */
    void recordQueueDepth(int depth);

    /**
     * Records the time spent executing one callback.
     *
     * @param durationMs callback execution time in milliseconds (always non-negative)
     */
    default void recordListenerDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEmitted() {
        }

        @Override
        public void incrementDropped() {
        }

        @Override
        public void incrementListenerSuccess() {
        }

        @Override
        public void incrementListenerFailure() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
