package mailqueue.retry;

import java.time.Instant;

/**
 * Pure decision function applied to transient delivery failures.
 *
 * <p>Implementations must not inspect the error: permanent failures never reach the policy.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * Decides what happens after a failed attempt.
   *
   * @param retryCount retries already consumed by the job (0 on the first failure)
   * @param maxRetries the job's retry budget
   * @param now        time of the failure
   * @return {@link RetryDecision.Retry} iff {@code retryCount < maxRetries}, otherwise
   *     {@link RetryDecision.Terminal}
   */
  RetryDecision decide(int retryCount, int maxRetries, Instant now);
}
