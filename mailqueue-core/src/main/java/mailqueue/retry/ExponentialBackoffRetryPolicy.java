package mailqueue.retry;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Retry policy using exponential backoff without jitter.
 *
 * <p>Delay formula: {@code base * 2^retryCount}, optionally capped at {@code maxDelay}. With a
 * 300 second base, failures at retry counts 0, 1, 2 are retried after 300 s, 600 s and
 * 1200 s. Arithmetic saturates instead of overflowing.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final Duration DEFAULT_BASE = Duration.ofSeconds(300);

  private final Duration base;
  private final Duration maxDelay;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE);
  }

  /**
   * @param base delay before the first retry (must be positive)
   */
  public ExponentialBackoffRetryPolicy(Duration base) {
    this(base, null);
  }

  /**
   * @param base     delay before the first retry (must be positive)
   * @param maxDelay upper bound on any single delay, or {@code null} for none
   */
  public ExponentialBackoffRetryPolicy(Duration base, Duration maxDelay) {
    Objects.requireNonNull(base, "base");
    if (base.isZero() || base.isNegative()) {
      throw new IllegalArgumentException("base must be > 0, got: " + base);
    }
    if (maxDelay != null && maxDelay.compareTo(base) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= base, got: " + maxDelay);
    }
    this.base = base;
    this.maxDelay = maxDelay;
  }

  public static ExponentialBackoffRetryPolicy ofSeconds(long baseSeconds) {
    return new ExponentialBackoffRetryPolicy(Duration.ofSeconds(baseSeconds));
  }

  @Override
  public RetryDecision decide(int retryCount, int maxRetries, Instant now) {
    Objects.requireNonNull(now, "now");
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0, got: " + retryCount);
    }
    if (retryCount >= maxRetries) {
      return RetryDecision.terminal();
    }
    return RetryDecision.retry(plusSaturated(now, delayFor(retryCount)), retryCount + 1);
  }

  /**
   * Computes the backoff applied after a failure at the given retry count.
   *
   * @param retryCount retries already consumed (0-based)
   * @return the delay, never negative
   */
  public Duration delayFor(int retryCount) {
    Duration delay;
    if (retryCount >= 62) {
      delay = null;
    } else {
      try {
        delay = base.multipliedBy(1L << retryCount);
      } catch (ArithmeticException overflow) {
        delay = null;
      }
    }
    if (delay == null) {
      return maxDelay != null ? maxDelay : Duration.ofSeconds(Long.MAX_VALUE);
    }
    return maxDelay != null && delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
  }

  public Duration base() {
    return base;
  }

  private static Instant plusSaturated(Instant now, Duration delay) {
    try {
      return now.plus(delay);
    } catch (DateTimeException | ArithmeticException overflow) {
      return Instant.MAX;
    }
  }
}
