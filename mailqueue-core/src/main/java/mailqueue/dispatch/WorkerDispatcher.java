package mailqueue.dispatch;

import mailqueue.StoreException;
import mailqueue.model.Job;
import mailqueue.retry.ExponentialBackoffRetryPolicy;
import mailqueue.retry.RetryDecision;
import mailqueue.retry.RetryPolicy;
import mailqueue.spi.JobStore;
import mailqueue.spi.MetricsExporter;
import mailqueue.transport.DeliveryResult;
import mailqueue.transport.OutboundMessage;
import mailqueue.transport.TransientErrorClassifier;
import mailqueue.transport.Transport;
import mailqueue.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background worker that claims due jobs from a {@link JobStore} and delivers them through
 * a {@link Transport}.
 *
 * <p>Each poll cycle claims up to {@code batchSize} jobs. Claimed jobs are delivered on a
 * pool with at most {@code concurrency} deliveries in flight; the cycle ends when every
 * delivery of the batch has been recorded. An empty claim puts the loop to sleep for
 * {@code pollInterval}; {@link #close()} cuts the sleep short.
 *
 * <p>A delivery slot is held until the transport call returns, not until the outcome is
 * recorded. A call that outlives {@code deliveryTimeout} is recorded as a transient failure
 * but keeps its slot until it ends, so a transport that ignores interrupts cannot push the
 * number of concurrent transport calls above {@code concurrency}. While every slot is held
 * no jobs are claimed.
 *
 * <p>Outcomes:
 * <ul>
 *   <li>delivered: {@link JobStore#markSent}</li>
 *   <li>transient failure (including a delivery exceeding {@code deliveryTimeout}): the
 *       {@link RetryPolicy} decides between {@link JobStore#markScheduled} and
 *       {@link JobStore#markFailed}</li>
 *   <li>permanent failure: {@link JobStore#markFailed} regardless of the retry budget</li>
 * </ul>
 *
 * <p>Store failures are logged and counted; the loop survives them and tries again on the
 * next cycle. Several dispatchers, in one process or many, may share a store: the claim is
 * the only coordination point between them.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class WorkerDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WorkerDispatcher.class.getName());

  private final JobStore jobStore;
  private final Transport transport;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int batchSize;
  private final int concurrency;
  private final Duration pollInterval;
  private final Duration deliveryTimeout;
  private final Duration drainTimeout;
  private final boolean closeResources;

  private final ExecutorService workers;
  private final ExecutorService sendExecutor;
  private final Semaphore slots;
  private final AtomicInteger inFlight = new AtomicInteger();

  private final LongAdder attempted = new LongAdder();
  private final LongAdder sent = new LongAdder();
  private final LongAdder retryScheduled = new LongAdder();
  private final LongAdder permanentlyFailed = new LongAdder();
  private final LongAdder storeErrors = new LongAdder();
  private final LongAdder cycles = new LongAdder();

  private final ReentrantLock sleepLock = new ReentrantLock();
  private final Condition wakeUp = sleepLock.newCondition();

  private volatile boolean running;
  private volatile boolean closed;
  private Thread pollThread;

  private WorkerDispatcher(Builder builder) {
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
    this.deliveryTimeout = Objects.requireNonNull(builder.deliveryTimeout, "deliveryTimeout");
    this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");

    if (builder.batchSize < 1 || builder.batchSize > JobStore.MAX_CLAIM_BATCH) {
      throw new IllegalArgumentException(
          "batchSize must be in 1.." + JobStore.MAX_CLAIM_BATCH + ", got: " + builder.batchSize);
    }
    if (builder.concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1, got: " + builder.concurrency);
    }
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    if (deliveryTimeout.isNegative() || deliveryTimeout.isZero()) {
      throw new IllegalArgumentException("deliveryTimeout must be positive");
    }
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    this.batchSize = builder.batchSize;
    this.concurrency = builder.concurrency;
    this.closeResources = builder.closeResources;

    this.slots = new Semaphore(concurrency);
    this.workers = Executors.newFixedThreadPool(concurrency, new DaemonThreadFactory("mailqueue-worker-"));
    this.sendExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("mailqueue-send-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the poll loop on a background thread. Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if the dispatcher has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("WorkerDispatcher has been closed");
    }
    if (pollThread != null) {
      return;
    }
    running = true;
    pollThread = new DaemonThreadFactory("mailqueue-poller-").newThread(this::pollLoop);
    pollThread.start();
    logger.log(Level.INFO, "Worker dispatcher started (batchSize={0}, concurrency={1}, pollInterval={2})",
        new Object[]{batchSize, concurrency, pollInterval});
  }

  public boolean isRunning() {
    return running;
  }

  /**
   * Runs one poll cycle on the calling thread: claims a batch and waits until every claimed
   * job has been delivered and recorded.
   *
   * @return number of jobs claimed, {@code 0} when nothing was due, the claim failed, every
   *     delivery slot is held, or the dispatcher is closed
   */
  public int pollOnce() {
    if (closed) {
      return 0;
    }
    cycles.increment();
    if (slots.availablePermits() == 0) {
      logger.fine("Every delivery slot is held by an unfinished transport call; skipping claim");
      return 0;
    }
    List<Job> jobs;
    try {
      jobs = jobStore.claimBatch(batchSize);
    } catch (StoreException e) {
      recordStoreError();
      logger.log(Level.SEVERE, "Failed to claim jobs; retrying next cycle", e);
      return 0;
    }
    metrics.recordClaimed(jobs.size());
    if (jobs.isEmpty()) {
      metrics.recordOldestLagMs(0L);
      return 0;
    }
    recordLag(jobs);
    logger.log(Level.FINE, "Claimed {0} jobs", jobs.size());
    dispatchBatch(jobs);
    return jobs.size();
  }

  /** Snapshot of the counters accumulated since construction. */
  public DispatchStats stats() {
    return new DispatchStats(attempted.sum(), sent.sum(), retryScheduled.sum(),
        permanentlyFailed.sum(), storeErrors.sum(), cycles.sum());
  }

  /** Transport calls currently in flight, including calls that outlived the delivery timeout. */
  public int inFlight() {
    return inFlight.get();
  }

  private void pollLoop() {
    while (running) {
      int claimed;
      try {
        claimed = pollOnce();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Poll cycle failed", t);
        claimed = 0;
      }
      if (claimed == 0) {
        sleepUntilNextPoll();
      }
    }
    logger.fine("Poll loop exited");
  }

  private void sleepUntilNextPoll() {
    long remaining = pollInterval.toNanos();
    sleepLock.lock();
    try {
      while (running && remaining > 0L) {
        remaining = wakeUp.awaitNanos(remaining);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running = false;
    } finally {
      sleepLock.unlock();
    }
  }

  private void dispatchBatch(List<Job> jobs) {
    List<Future<?>> pending = new ArrayList<>(jobs.size());
    int submitted = 0;
    try {
      for (Job job : jobs) {
        slots.acquire();
        try {
          pending.add(workers.submit(() -> runDelivery(job)));
        } catch (RejectedExecutionException e) {
          slots.release();
          throw e;
        }
        submitted++;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while dispatching; {0} claimed jobs were not started",
          jobs.size() - submitted);
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Worker pool shut down; {0} claimed jobs were not started",
          jobs.size() - submitted);
    }
    awaitAll(pending);
  }

  private void awaitAll(List<Future<?>> pending) {
    for (Future<?> future : pending) {
      try {
        future.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      } catch (ExecutionException e) {
        logger.log(Level.SEVERE, "Delivery task failed", e.getCause());
      }
    }
  }

  private void runDelivery(Job job) {
    attempted.increment();
    long startNanos = System.nanoTime();
    DeliveryResult result = deliver(job);
    metrics.recordDeliveryDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    try {
      if (result instanceof DeliveryResult.Rejected rejected) {
        handleFailure(job, rejected);
      } else {
        markSent(job);
      }
    } catch (StoreException e) {
      recordStoreError();
      logger.log(Level.SEVERE, "Failed to record delivery outcome for jobId=" + job.id()
          + "; the job stays PROCESSING", e);
    }
  }

  /** Runs the transport call; the caller's slot passes to the returned task's {@link SendTask#run}. */
  private DeliveryResult deliver(Job job) {
    SendTask task;
    try {
      task = new SendTask(transport, OutboundMessage.from(job));
      metrics.recordInFlight(inFlight.incrementAndGet());
      try {
        sendExecutor.execute(task);
      } catch (RejectedExecutionException e) {
        metrics.recordInFlight(inFlight.decrementAndGet());
        throw e;
      }
    } catch (RejectedExecutionException e) {
      slots.release();
      return DeliveryResult.transientFailure("Dispatcher is shutting down");
    } catch (RuntimeException e) {
      slots.release();
      return DeliveryResult.permanentFailure(describe(e));
    }
    try {
      DeliveryResult result = task.get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (result == null) {
        return DeliveryResult.permanentFailure("Transport returned no result");
      }
      return result;
    } catch (TimeoutException e) {
      task.cancel(true);
      logger.log(Level.WARNING, "Delivery of job {0} timed out; its slot stays held until the transport returns",
          job.id());
      return DeliveryResult.transientFailure("Delivery timed out after " + deliveryTimeout.toMillis() + " ms");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return new DeliveryResult.Rejected(describe(cause), TransientErrorClassifier.isTransient(cause));
    } catch (InterruptedException e) {
      task.cancel(true);
      Thread.currentThread().interrupt();
      return DeliveryResult.transientFailure("Delivery interrupted by shutdown");
    }
  }

  private void markSent(Job job) {
    if (jobStore.markSent(job.id(), clock.instant())) {
      sent.increment();
      metrics.incrementSent();
      logger.log(Level.FINE, "Job {0} sent", job.id());
    } else {
      logger.log(Level.WARNING, "Job {0} was no longer PROCESSING when marking SENT", job.id());
    }
  }

  private void handleFailure(Job job, DeliveryResult.Rejected rejected) {
    if (!rejected.transientFailure()) {
      markFailed(job, rejected.error(), "permanent failure");
      return;
    }
    RetryDecision decision = retryPolicy.decide(job.retryCount(), job.maxRetries(), clock.instant());
    if (decision instanceof RetryDecision.Retry retry) {
      if (retry.nextRetryCount() > job.maxRetries()) {
        markFailed(job, rejected.error(),
            "retry " + retry.nextRetryCount() + " exceeds budget of " + job.maxRetries());
      } else if (jobStore.markScheduled(job.id(), rejected.error(), retry.nextRetryAt(), retry.nextRetryCount())) {
        retryScheduled.increment();
        metrics.incrementRetryScheduled();
        logger.log(Level.WARNING, "Job {0} failed transiently (retry {1}/{2} at {3}): {4}",
            new Object[]{job.id(), retry.nextRetryCount(), job.maxRetries(), retry.nextRetryAt(), rejected.error()});
      } else {
        // refused by the store's budget guard; a job that left PROCESSING is left alone by markFailed too
        markFailed(job, rejected.error(), "retry refused by store");
      }
    } else {
      markFailed(job, rejected.error(), "retries exhausted after " + job.retryCount());
    }
  }

  private void markFailed(Job job, String error, String reason) {
    if (jobStore.markFailed(job.id(), error)) {
      permanentlyFailed.increment();
      metrics.incrementPermanentlyFailed();
      logger.log(Level.SEVERE, "Job {0} FAILED ({1}): {2}", new Object[]{job.id(), reason, error});
    } else {
      logger.log(Level.WARNING, "Job {0} was no longer PROCESSING when marking FAILED", job.id());
    }
  }

  private void recordStoreError() {
    storeErrors.increment();
    metrics.incrementStoreErrors();
  }

  private void recordLag(List<Job> jobs) {
    Instant now = clock.instant();
    Instant oldest = null;
    for (Job job : jobs) {
      Instant due = job.scheduledFor();
      if (due != null && (oldest == null || due.isBefore(oldest))) {
        oldest = due;
      }
    }
    if (oldest != null) {
      metrics.recordOldestLagMs(Math.max(0L, Duration.between(oldest, now).toMillis()));
    }
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getName();
    }
    return message;
  }

  /**
   * Stops claiming immediately, waits up to {@code drainTimeout} for in-flight deliveries and
   * for transport calls that outlived their timeout, then closes the transport and the store
   * unless {@link Builder#closeResources(boolean)} turned that off. Jobs still unrecorded when
   * the timeout expires stay PROCESSING. Idempotent.
   */
  @Override
  public void close() {
    Thread loop;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      running = false;
      loop = pollThread;
    }
    signalWakeUp();

    long deadline = System.nanoTime() + drainTimeout.toNanos();
    try {
      if (loop != null) {
        loop.join(remainingMillis(deadline));
        if (loop.isAlive()) {
          loop.interrupt();
        }
      }
      workers.shutdown();
      if (!workers.awaitTermination(remainingMillis(deadline), TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown with {0} deliveries in flight",
            inFlight.get());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      drainSends(deadline);
      if (closeResources) {
        closeQuietly("transport", transport);
        closeQuietly("job store", jobStore);
      }
    }
    logger.log(Level.INFO, "Worker dispatcher stopped: {0}", stats());
  }

  private void drainSends(long deadline) {
    sendExecutor.shutdown();
    try {
      if (!sendExecutor.awaitTermination(remainingMillis(deadline), TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Closing with {0} transport calls still running", inFlight.get());
        sendExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      sendExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void signalWakeUp() {
    sleepLock.lock();
    try {
      wakeUp.signalAll();
    } finally {
      sleepLock.unlock();
    }
  }

  private static long remainingMillis(long deadlineNanos) {
    return Math.max(1L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
  }

  private static void closeQuietly(String name, AutoCloseable resource) {
    try {
      resource.close();
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to close " + name, e);
    }
  }

  /** Transport call that gives back its delivery slot when it ends, whether or not anyone still waits for it. */
  private final class SendTask extends FutureTask<DeliveryResult> {
    SendTask(Transport transport, OutboundMessage message) {
      super(() -> transport.send(message));
    }

    @Override
    public void run() {
      try {
        super.run();
      } finally {
        metrics.recordInFlight(inFlight.decrementAndGet());
        slots.release();
      }
    }
  }

  /** Builder for {@link WorkerDispatcher}. */
  public static final class Builder {
    private JobStore jobStore;
    private Transport transport;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private int batchSize = 50;
    private int concurrency = 5;
    private Duration pollInterval = Duration.ofSeconds(10);
    private Duration deliveryTimeout = Duration.ofSeconds(30);
    private Duration drainTimeout = Duration.ofSeconds(30);
    private boolean closeResources = true;

    private Builder() {}

    /**
     * Sets the store jobs are claimed from and recorded in.
     *
     * <p><b>Required.</b>
     *
     * @param jobStore the persistence backend
     * @return this builder
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * Sets the delivery collaborator.
     *
     * <p><b>Required.</b>
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the policy applied to transient failures.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 300 s base.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used for sent and retry timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the maximum number of jobs claimed per cycle.
     *
     * <p>Optional. Defaults to {@code 50}. Must be in {@code 1..1000}.
     *
     * @param batchSize jobs per claim
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the maximum number of deliveries in flight.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param concurrency parallel deliveries
     * @return this builder
     */
    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /**
     * Sets how long the loop sleeps after an empty claim.
     *
     * <p>Optional. Defaults to 10 seconds.
     *
     * @param pollInterval idle sleep
     * @return this builder
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Sets the time after which a delivery is abandoned and treated as a transient failure.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param deliveryTimeout per-delivery timeout
     * @return this builder
     */
    public Builder deliveryTimeout(Duration deliveryTimeout) {
      this.deliveryTimeout = deliveryTimeout;
      return this;
    }

    /**
     * Sets how long {@link WorkerDispatcher#close()} waits for in-flight deliveries.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param drainTimeout drain timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Whether {@link WorkerDispatcher#close()} also closes the transport and the job store.
     *
     * <p>Optional. Defaults to {@code true}. Pass {@code false} when a container manages their
     * lifecycle.
     *
     * @param closeResources {@code false} to leave both open on close
     * @return this builder
     */
    public Builder closeResources(boolean closeResources) {
      this.closeResources = closeResources;
      return this;
    }

    /**
     * Builds the dispatcher. Call {@link WorkerDispatcher#start()} to begin polling, or drive
     * it with {@link WorkerDispatcher#pollOnce()}.
     *
     * @return a new dispatcher
     * @throws NullPointerException     if {@code jobStore} or {@code transport} is null
     * @throws IllegalArgumentException if a numeric or duration setting is out of range
     */
    public WorkerDispatcher build() {
      return new WorkerDispatcher(this);
    }
  }
}
