package mailqueue;

import mailqueue.admission.AdmissionDecision;
import mailqueue.admission.SlidingWindowRateLimiter;
import mailqueue.dispatch.DispatchStats;
import mailqueue.dispatch.WorkerDispatcher;
import mailqueue.model.HealthStatus;
import mailqueue.model.Job;
import mailqueue.model.NewJob;
import mailqueue.model.QueueStats;
import mailqueue.spi.JobStore;
import mailqueue.spi.MetricsExporter;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link JobStore}, an optional {@link WorkerDispatcher}
 * and an optional {@link SlidingWindowRateLimiter} into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (MailQueue queue = MailQueue.builder()
 *     .jobStore(store)
 *     .rateLimiter(new SlidingWindowRateLimiter())
 *     .dispatcher(WorkerDispatcher.builder().jobStore(store).transport(smtp).build())
 *     .build()) {
 *   queue.start();
 *   SubmissionResult result = queue.submit(ClientKeys.fromAddress(ip), job);
 * }
 * }</pre>
 *
 * <p>Without a dispatcher the instance only accepts and reports jobs; delivery then runs
 * elsewhere against the same store.
 */
public final class MailQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MailQueue.class.getName());

  private final JobStore jobStore;
  private final WorkerDispatcher dispatcher;
  private final SlidingWindowRateLimiter rateLimiter;
  private final MetricsExporter metrics;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final boolean closeResources;

  private MailQueue(Builder builder) {
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.dispatcher = builder.dispatcher;
    this.closeResources = builder.closeResources;
    this.rateLimiter = builder.rateLimiter;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Admits and stores a job on behalf of {@code clientKey}.
   *
   * @param clientKey limiter key of the submitting client (see
   *                  {@link mailqueue.admission.ClientKeys})
   * @param job       the job to store
   * @return {@link SubmissionResult.Accepted} with the job id, or
   *     {@link SubmissionResult.Rejected} with a retry hint when the client is over its limit
   * @throws StoreException if the store rejects or cannot persist the job
   */
  public SubmissionResult submit(String clientKey, NewJob job) {
    Objects.requireNonNull(clientKey, "clientKey");
    Objects.requireNonNull(job, "job");
    ensureOpen();
    if (rateLimiter != null) {
      AdmissionDecision decision = rateLimiter.tryAcquire(clientKey);
      if (decision instanceof AdmissionDecision.RateLimited limited) {
        metrics.incrementAdmissionRejected();
        logger.log(Level.WARNING, "Rate limit exceeded for client {0} ({1} window), retry after {2} ms",
            new Object[]{clientKey, limited.window(), limited.retryAfter().toMillis()});
        return SubmissionResult.rejected(limited.retryAfter());
      }
    }
    return SubmissionResult.accepted(enqueue(job));
  }

  /**
   * Stores a job without admission control, for trusted internal producers.
   *
   * @return the stored job id
   * @throws StoreException if the store rejects or cannot persist the job
   */
  public long enqueue(NewJob job) {
    Objects.requireNonNull(job, "job");
    ensureOpen();
    long id = jobStore.enqueue(job);
    logger.log(Level.FINE, "Queued job {0} (messageId={1}, priority={2})",
        new Object[]{id, job.messageId(), job.priority()});
    return id;
  }

  public Optional<Job> status(long jobId) {
    return jobStore.findById(jobId);
  }

  public QueueStats stats() {
    return jobStore.stats();
  }

  public HealthStatus health() {
    return jobStore.health();
  }

  /**
   * Returns the dispatcher's counters, or {@link DispatchStats#EMPTY} without a dispatcher.
   */
  public DispatchStats dispatchStats() {
    return dispatcher != null ? dispatcher.stats() : DispatchStats.EMPTY;
  }

  public Optional<WorkerDispatcher> dispatcher() {
    return Optional.ofNullable(dispatcher);
  }

  public JobStore jobStore() {
    return jobStore;
  }

  /**
   * Starts background delivery. A no-op without a dispatcher.
   */
  public void start() {
    ensureOpen();
    if (dispatcher != null) {
      dispatcher.start();
    } else {
      logger.info("No dispatcher configured; jobs are accepted but not delivered by this instance");
    }
  }

  /**
   * Shuts down components in order: dispatcher (which closes the transport and the store),
   * limiter state, then the store when no dispatcher owns it, then the metrics exporter. With
   * {@link Builder#closeResources(boolean) closeResources(false)} only the dispatcher's threads
   * and the limiter state are released.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    if (dispatcher != null) {
      try {
        dispatcher.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    if (rateLimiter != null) {
      rateLimiter.clear();
    }
    if (dispatcher == null && closeResources) {
      try {
        jobStore.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (closeResources && metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("MailQueue has been closed");
    }
  }

  /** Builder for {@link MailQueue}. */
  public static final class Builder {
    private JobStore jobStore;
    private WorkerDispatcher dispatcher;
    private SlidingWindowRateLimiter rateLimiter;
    private MetricsExporter metrics;
    private boolean closeResources = true;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param jobStore the store jobs are written to and read from
     * @return this builder
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * Optional. Without a dispatcher the queue does not deliver.
     *
     * @param dispatcher a dispatcher built over the same store
     * @return this builder
     */
    public Builder dispatcher(WorkerDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /**
     * Optional. Without a limiter every submission is admitted.
     *
     * @param rateLimiter the per-client admission limiter
     * @return this builder
     */
    public Builder rateLimiter(SlidingWindowRateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the queue when it
     * implements {@link AutoCloseable}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Whether {@link MailQueue#close()} closes the store and the metrics exporter. Defaults to
     * {@code true}. A dispatcher decides for itself through
     * {@link WorkerDispatcher.Builder#closeResources(boolean)}.
     *
     * @param closeResources {@code false} when a container manages the store and the exporter
     * @return this builder
     */
    public Builder closeResources(boolean closeResources) {
      this.closeResources = closeResources;
      return this;
    }

    public MailQueue build() {
      return new MailQueue(this);
    }
  }
}
