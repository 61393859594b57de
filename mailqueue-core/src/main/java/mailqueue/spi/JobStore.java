package mailqueue.spi;

import mailqueue.model.HealthStatus;
import mailqueue.model.Job;
import mailqueue.model.NewJob;
import mailqueue.model.QueueStats;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable job table and the single serialization point between workers.
 *
 * <p>Status transitions: PENDING → PROCESSING (claim), SCHEDULED → PROCESSING (claim),
 * PROCESSING → SENT | SCHEDULED | FAILED. Every mutating operation stamps a strictly
 * increasing {@code updated_at}.
 *
 * <p>Implementations retry transient connectivity failures internally a bounded number of
 * times and then raise {@link mailqueue.StoreException}; they never return an empty result in
 * place of a failure. Implementations live in the {@code mailqueue-jdbc} module.
 *
 * @see mailqueue.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore extends AutoCloseable {

    /** Upper bound applied to {@link #claimBatch(int)} limits. */
    int MAX_CLAIM_BATCH = 1000;

    /**
     * Inserts a new job with status PENDING.
     *
     * <p>{@code scheduledFor} defaults to the store's current time and {@code maxRetries} to
     * the store's configured default. When the job's message id already exists, the existing
     * job's id is returned and nothing is inserted.
     *
     * @param job the submission
     * @return the id of the stored job
     * @throws mailqueue.StoreException on constraint violations (e.g. empty recipient set)
     *                                  or exhausted retries
     */
    long enqueue(NewJob job);

    /**
     * Atomically claims up to {@code limit} due jobs and moves them to PROCESSING.
     *
     * <p>Candidates have status PENDING or SCHEDULED and {@code scheduled_for <= now}; they are
     * selected in {@code (priority, created_at)} order. Rows locked by a concurrent claimer are
     * skipped rather than waited on, and a job returned to one caller is never returned to
     * another caller while it stays in PROCESSING.
     *
     * @param limit maximum number of jobs to claim, clamped to {@code 1..}{@value #MAX_CLAIM_BATCH}
     * @return the claimed jobs, already in PROCESSING; empty when nothing is due
     */
    List<Job> claimBatch(int limit);

    /**
     * Marks a PROCESSING job as SENT.
     *
     * @return {@code true} if the row changed; {@code false} if it was not in PROCESSING
     */
    boolean markSent(long id, Instant sentAt);

    /**
     * Moves a PROCESSING job back to SCHEDULED for another attempt at {@code nextRetryAt}.
     *
     * @param id          the job id
     * @param error       error from the failed attempt (may be {@code null})
     * @param nextRetryAt earliest time of the next attempt
     * @param retryCount  new retry count; must not exceed the job's {@code max_retries}
     * @return {@code true} if the row changed
     */
    boolean markScheduled(long id, String error, Instant nextRetryAt, int retryCount);

    /**
     * Marks a PROCESSING job as permanently FAILED.
     *
     * @return {@code true} if the row changed
     */
    boolean markFailed(long id, String error);

    /**
     * Looks up a job by id.
     *
     * @return the job, or empty if no such job exists
     */
    Optional<Job> findById(long id);

    /**
     * Counts jobs per status. Read-only.
     */
    QueueStats stats();

    /**
     * Liveness probe independent of job semantics. Never throws.
     */
    HealthStatus health();

    /**
     * Releases the store's resources. Default is a no-op.
     */
    @Override
    default void close() {
    }
}
