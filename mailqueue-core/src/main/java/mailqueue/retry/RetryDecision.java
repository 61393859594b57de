package mailqueue.retry;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a {@link RetryPolicy} evaluation for a failed delivery.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.Terminal {

  Terminal TERMINAL = new Terminal();

  static Retry retry(Instant nextRetryAt, int nextRetryCount) {
    return new Retry(nextRetryAt, nextRetryCount);
  }

  static Terminal terminal() {
    return TERMINAL;
  }

  /**
   * Schedule another attempt.
   *
   * @param nextRetryAt    earliest time of the next attempt
   * @param nextRetryCount retry count to persist with the job
   */
  record Retry(Instant nextRetryAt, int nextRetryCount) implements RetryDecision {
    public Retry {
      Objects.requireNonNull(nextRetryAt, "nextRetryAt");
      if (nextRetryCount < 1) {
        throw new IllegalArgumentException("nextRetryCount must be >= 1, got: " + nextRetryCount);
      }
    }
  }

  /** The retry budget is spent; the job fails. */
  record Terminal() implements RetryDecision {
  }
}
