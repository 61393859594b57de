package mailqueue.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a queued job.
 *
 * <p>The transition graph is closed and never re-enters {@link #PENDING}:
 * <pre>
 *   PENDING ──┐
 *             ├─→ PROCESSING ─→ SENT
 *   SCHEDULED ┘        │
 *        ↑             ├─→ FAILED
 *        └─────────────┘
 * </pre>
 */
public enum JobStatus {
  PENDING("pending"),
  SCHEDULED("scheduled"),
  PROCESSING("processing"),
  SENT("sent"),
  FAILED("failed");

  private final String dbValue;

  JobStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  /** Value persisted in the {@code status} column. */
  public String dbValue() {
    return dbValue;
  }

  public boolean isTerminal() {
    return this == SENT || this == FAILED;
  }

  /** Whether a worker may claim a job in this state. */
  public boolean isClaimable() {
    return this == PENDING || this == SCHEDULED;
  }

  public boolean canTransitionTo(JobStatus next) {
    return successors().contains(next);
  }

  private Set<JobStatus> successors() {
    switch (this) {
      case PENDING:
      case SCHEDULED:
        return EnumSet.of(PROCESSING);
      case PROCESSING:
        return EnumSet.of(SENT, SCHEDULED, FAILED);
      default:
        return EnumSet.noneOf(JobStatus.class);
    }
  }

  public static JobStatus fromDbValue(String value) {
    for (JobStatus status : values()) {
      if (status.dbValue.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + value);
  }
}
