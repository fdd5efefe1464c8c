package nudge.spi;

/**
 * Observability hook for exporting engine counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of rule evaluations that produced a queue entry.
     */
    void incrementTriggerEnqueued();

    /**
     * Increments the count of rule evaluations stopped by a gate.
     */
    void incrementTriggerRejected();

    /**
     * Increments the count of rule evaluations aborted by an error.
     */
    void incrementTriggerFailed();

    /**
     * Increments the count of queue entries written.
     */
    void incrementQueued();

    void incrementDeliverySuccess();

    void incrementDeliveryFailure();

    /**
     * Records the time a provider took for one delivery.
     *
     * @param latencyMs latency in milliseconds (always non-negative)
     */
    default void recordDeliveryLatencyMs(long latencyMs) {
    }

    /**
     * Records the number of entries picked up by the last batch.
     */
    default void recordBatchSize(int size) {
    }

    default void incrementJourneyStarted() {
    }

    default void incrementJourneyAdvanced() {
    }

    default void incrementJourneyCompleted() {
    }

    /**
     * Records the number of journey instances currently active.
     */
    default void recordActiveJourneys(int count) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementTriggerEnqueued() {
        }

        @Override
        public void incrementTriggerRejected() {
        }

        @Override
        public void incrementTriggerFailed() {
        }

        @Override
        public void incrementQueued() {
        }

        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryFailure() {
        }
    }
}
