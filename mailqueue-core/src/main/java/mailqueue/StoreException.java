package mailqueue;

import java.util.OptionalLong;

/**
 * Unchecked exception raised by a {@link mailqueue.spi.JobStore} after its internal retries
 * are exhausted or on a non-retryable failure such as a constraint violation.
 *
 * <p>A store never reports a failure as an empty result; callers can rely on this exception
 * to distinguish "not found" from "could not look".
 */
public final class StoreException extends MailQueueException {
  private final Long jobId;
  private final boolean transientFailure;

  public StoreException(String message) {
    this(message, null, false, null);
  }

  public StoreException(String message, Throwable cause) {
    this(message, null, false, cause);
  }

  /**
   * @param message          description of the failed operation
   * @param jobId            affected job, or {@code null} when not applicable
   * @param transientFailure whether the last underlying failure was a connectivity problem
   * @param cause            the underlying failure (may be {@code null})
   */
  public StoreException(String message, Long jobId, boolean transientFailure, Throwable cause) {
    super(jobId == null ? message : message + " (jobId=" + jobId + ")", cause);
    this.jobId = jobId;
    this.transientFailure = transientFailure;
  }

  public OptionalLong jobId() {
    return jobId == null ? OptionalLong.empty() : OptionalLong.of(jobId);
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
