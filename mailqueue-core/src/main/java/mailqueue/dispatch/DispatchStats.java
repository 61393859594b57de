package mailqueue.dispatch;

import java.util.Locale;

/**
 * Point-in-time snapshot of a {@link WorkerDispatcher}'s counters.
 *
 * <p>{@code retryScheduled} and {@code permanentlyFailed} are disjoint: a job rescheduled for
 * a later attempt is never also counted as failed in the same attempt.
 *
 * @param attempted         deliveries started
 * @param sent              jobs marked SENT
 * @param retryScheduled    transient failures rescheduled
 * @param permanentlyFailed jobs marked FAILED
 * @param storeErrors       store operations that failed after their internal retries
 * @param cycles            poll cycles run
 */
public record DispatchStats(
    long attempted,
    long sent,
    long retryScheduled,
    long permanentlyFailed,
    long storeErrors,
    long cycles) {

  public static final DispatchStats EMPTY = new DispatchStats(0, 0, 0, 0, 0, 0);

  /** Jobs that reached a terminal state through this dispatcher. */
  public long completed() {
    return sent + permanentlyFailed;
  }

  /**
   * Sent jobs as a percentage of all attempts, or {@code 0} before the first attempt.
   */
  public double successRate() {
    return attempted == 0 ? 0.0 : sent * 100.0 / attempted;
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT,
        "attempted=%d, sent=%d, retryScheduled=%d, permanentlyFailed=%d, storeErrors=%d, "
            + "cycles=%d, successRate=%.1f%%",
        attempted, sent, retryScheduled, permanentlyFailed, storeErrors, cycles, successRate());
  }
}
