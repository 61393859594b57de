package mailqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import mailqueue.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code mailqueue.jobs.claimed}: jobs claimed by poll cycles</li>
 *   <li>{@code mailqueue.jobs.sent}: jobs delivered</li>
 *   <li>{@code mailqueue.jobs.retry.scheduled}: transient failures rescheduled</li>
 *   <li>{@code mailqueue.jobs.failed}: jobs marked FAILED</li>
 *   <li>{@code mailqueue.store.errors}: store operations that failed after retries</li>
 *   <li>{@code mailqueue.admission.rejected}: submissions refused by the rate limiter</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code mailqueue.dispatch.inflight}: deliveries in flight</li>
 *   <li>{@code mailqueue.lag.oldest.ms}: how far past due the oldest job of the last batch was</li>
 *   <li>{@code mailqueue.delivery.duration}: time spent in the transport per delivery</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter claimed;
  private final Counter sent;
  private final Counter retryScheduled;
  private final Counter failed;
  private final Counter storeErrors;
  private final Counter admissionRejected;
  private final Gauge inFlightGauge;
  private final Gauge lagGauge;
  private final Timer deliveryDuration;

  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicLong oldestLagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "mailqueue"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "mailqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several queues in one process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.mail"})
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
    this.claimed = Counter.builder(namePrefix + ".jobs.claimed")
        .description("Jobs claimed for delivery")
        .register(registry);
    this.sent = Counter.builder(namePrefix + ".jobs.sent")
        .description("Jobs delivered")
        .register(registry);
    this.retryScheduled = Counter.builder(namePrefix + ".jobs.retry.scheduled")
        .description("Transient failures rescheduled for another attempt")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".jobs.failed")
        .description("Jobs marked FAILED")
        .register(registry);
    this.storeErrors = Counter.builder(namePrefix + ".store.errors")
        .description("Store operations failed after internal retries")
        .register(registry);
    this.admissionRejected = Counter.builder(namePrefix + ".admission.rejected")
        .description("Submissions rejected by the rate limiter")
        .register(registry);

    this.inFlightGauge = Gauge.builder(namePrefix + ".dispatch.inflight", inFlight, AtomicInteger::get)
        .description("Deliveries in flight")
        .register(registry);
    this.lagGauge = Gauge.builder(namePrefix + ".lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .description("Lag of the oldest job in the last claimed batch")
        .register(registry);
    this.deliveryDuration = Timer.builder(namePrefix + ".delivery.duration")
        .description("Time spent in the transport per delivery")
        .register(registry);
  }

  @Override
  public void recordClaimed(int count) {
    if (closed || count <= 0) return;
    claimed.increment(count);
  }

  @Override
  public void incrementSent() {
    if (closed) return;
    sent.increment();
  }

  @Override
  public void incrementRetryScheduled() {
    if (closed) return;
    retryScheduled.increment();
  }

  @Override
  public void incrementPermanentlyFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementStoreErrors() {
    if (closed) return;
    storeErrors.increment();
  }

  @Override
  public void incrementAdmissionRejected() {
    if (closed) return;
    admissionRejected.increment();
  }

  @Override
  public void recordInFlight(int inFlight) {
    if (closed) return;
    this.inFlight.set(inFlight);
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    if (closed) return;
    this.oldestLagMs.set(lagMs);
  }

  @Override
  public void recordDeliveryDurationMs(long durationMs) {
    if (closed) return;
    deliveryDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(claimed, sent, retryScheduled, failed, storeErrors,
        admissionRejected, inFlightGauge, lagGauge, deliveryDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
