/**
 * Retry/backoff decisions for transient delivery failures.
 *
 * @see mailqueue.retry.RetryPolicy
 * @see mailqueue.retry.ExponentialBackoffRetryPolicy
 */
package mailqueue.retry;
