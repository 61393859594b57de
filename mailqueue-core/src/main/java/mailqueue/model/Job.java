package mailqueue.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only snapshot of a persisted job row, as returned by
 * {@link mailqueue.spi.JobStore#claimBatch} and {@link mailqueue.spi.JobStore#findById}.
 *
 * <p>The store is the only source of truth for {@link #status()}; a snapshot held in memory
 * says nothing about the row's current state.
 */
public record Job(
    long id,
    String messageId,
    String messageType,
    Recipients recipients,
    MessageContent content,
    Map<String, String> metadata,
    int priority,
    JobStatus status,
    int retryCount,
    int maxRetries,
    String lastError,
    Instant scheduledFor,
    Instant nextRetryAt,
    Instant sentAt,
    Instant createdAt,
    Instant updatedAt
) {
  public Job {
    Objects.requireNonNull(recipients, "recipients");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(status, "status");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /** Whether another failed attempt would still be scheduled for retry. */
  public boolean hasRetryBudget() {
    return retryCount < maxRetries;
  }
}
