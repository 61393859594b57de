package mailqueue.spi;

/**
 * Observability hook for exporting queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. See {@code mailqueue-micrometer} for a
 * Micrometer bridge.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Records the number of jobs claimed in one poll cycle.
     *
     * @param count claimed jobs (may be zero)
     */
    void recordClaimed(int count);

    /** A delivery succeeded and the job is SENT. */
    void incrementSent();

    /** A transient failure was rescheduled for another attempt. */
    void incrementRetryScheduled();

    /** A job reached FAILED (permanent error or exhausted retry budget). */
    void incrementPermanentlyFailed();

    /** A store operation failed after its internal retries. */
    void incrementStoreErrors();

    /**
     * A submission was rejected by the admission limiter.
     */
    default void incrementAdmissionRejected() {
    }

    /**
     * Records the number of deliveries currently in flight.
     *
     * @param inFlight in-flight deliveries
     */
    void recordInFlight(int inFlight);

    /**
     * Records how long the oldest job of the last claimed batch waited past its due time.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    void recordOldestLagMs(long lagMs);

    /**
     * Records the time spent inside the transport for one delivery.
     *
     * @param durationMs delivery time in milliseconds (always non-negative)
     */
    default void recordDeliveryDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void recordClaimed(int count) {
        }

        @Override
        public void incrementSent() {
        }

        @Override
        public void incrementRetryScheduled() {
        }

        @Override
        public void incrementPermanentlyFailed() {
        }

        @Override
        public void incrementStoreErrors() {
        }

        @Override
        public void recordInFlight(int inFlight) {
        }

        @Override
        public void recordOldestLagMs(long lagMs) {
        }
    }
}
