package mailqueue;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of {@link MailQueue#submit(String, mailqueue.model.NewJob)}.
 */
public sealed interface SubmissionResult permits SubmissionResult.Accepted, SubmissionResult.Rejected {

  static Accepted accepted(long jobId) {
    return new Accepted(jobId);
  }

  static Rejected rejected(Duration retryAfter) {
    return new Rejected(retryAfter);
  }

  default boolean isAccepted() {
    return this instanceof Accepted;
  }

  /** The job is stored (or already was, for a repeated message id). */
  record Accepted(long jobId) implements SubmissionResult {
  }

  /** The client is over its admission ceiling; nothing was stored. */
  record Rejected(Duration retryAfter) implements SubmissionResult {
    public Rejected {
      Objects.requireNonNull(retryAfter, "retryAfter");
    }
  }
}
