package taskqueue.spi;

import taskqueue.Priority;

/**
 * Observability hook for exporting queue counters and gauges to a metrics backend.
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
     * Increments the count of tasks accepted into a lane by a producer.
     *
     * @param priority the lane the task went to
     */
    void incrementEnqueued(Priority priority);

    /**
     * Increments the count of tasks whose handler succeeded.
     */
    void incrementProcessed();

    /**
     * Increments the count of failed attempts (retryable or not).
     */
    void incrementFailed();

    /**
     * Increments the count of failed tasks scheduled for another attempt.
     */
    void incrementRetried();

    /**
     * Increments the count of tasks moved to the dead-letter sink.
     */
    void incrementDeadLettered();

    /**
     * Records the current depth of each priority lane.
     */
    void recordLaneDepths(int high, int medium, int low);

    /**
     * Records how many tasks wait in the retry scheduler.
     *
     * @param pending number of scheduled entries
     */
    void recordRetryPending(int pending);

    /**
     * Records the time spent executing one handler call.
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
        public void incrementEnqueued(Priority priority) {
        }

        @Override
        public void incrementProcessed() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void incrementRetried() {
        }

        @Override
        public void incrementDeadLettered() {
        }

        @Override
        public void recordLaneDepths(int high, int medium, int low) {
        }

        @Override
        public void recordRetryPending(int pending) {
        }
    }
}
