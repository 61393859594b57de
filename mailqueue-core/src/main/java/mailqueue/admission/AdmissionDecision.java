package mailqueue.admission;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of {@link SlidingWindowRateLimiter#tryAcquire(String)}.
 *
 * <p>A rejection is an expected outcome, not an error: the submission boundary answers it
 * with a retry-later signal carrying {@link RateLimited#retryAfter()}.
 */
public sealed interface AdmissionDecision permits AdmissionDecision.Allowed, AdmissionDecision.RateLimited {

  Allowed ALLOWED = new Allowed();

  static Allowed allowed() {
    return ALLOWED;
  }

  static RateLimited rateLimited(Duration retryAfter, Window window) {
    return new RateLimited(retryAfter, window);
  }

  default boolean isAllowed() {
    return this instanceof Allowed;
  }

  /** Granularities checked by the limiter. */
  enum Window {
    PER_SECOND(Duration.ofSeconds(1)),
    PER_MINUTE(Duration.ofMinutes(1));

    private final Duration length;

    Window(Duration length) {
      this.length = length;
    }

    public Duration length() {
      return length;
    }
  }

  record Allowed() implements AdmissionDecision {
  }

  /**
   * @param retryAfter time until the oldest request of {@code window} leaves it
   * @param window     the window whose ceiling was hit
   */
  record RateLimited(Duration retryAfter, Window window) implements AdmissionDecision {
    public RateLimited {
      Objects.requireNonNull(retryAfter, "retryAfter");
      Objects.requireNonNull(window, "window");
      if (retryAfter.isNegative() || retryAfter.isZero()) {
        throw new IllegalArgumentException("retryAfter must be positive");
      }
    }

    /** Whole seconds for a {@code Retry-After} header, rounded up. */
    public long retryAfterSeconds() {
      long seconds = retryAfter.getSeconds();
      return retryAfter.getNano() > 0 ? seconds + 1 : Math.max(1L, seconds);
    }
  }
}
