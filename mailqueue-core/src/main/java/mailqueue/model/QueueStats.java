package mailqueue.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Job counts per status at the time of the query. Every status is present; absent statuses
 * count as zero.
 */
public final class QueueStats {
  private final Map<JobStatus, Long> counts;

  public QueueStats(Map<JobStatus, Long> counts) {
    EnumMap<JobStatus, Long> copy = new EnumMap<>(JobStatus.class);
    for (JobStatus status : JobStatus.values()) {
      Long count = counts == null ? null : counts.get(status);
      copy.put(status, count == null ? 0L : count);
    }
    this.counts = Collections.unmodifiableMap(copy);
  }

  public long count(JobStatus status) {
    return counts.get(status);
  }

  public Map<JobStatus, Long> asMap() {
    return counts;
  }

  public long total() {
    long total = 0;
    for (long count : counts.values()) {
      total += count;
    }
    return total;
  }

  /** Jobs still waiting for a worker, due now or later. */
  public long backlog() {
    return count(JobStatus.PENDING) + count(JobStatus.SCHEDULED);
  }

  /**
   * Percentage of terminal jobs that were sent; 0 when no job has reached a terminal state.
   */
  public double successRate() {
    long sent = count(JobStatus.SENT);
    long terminal = sent + count(JobStatus.FAILED);
    return terminal == 0 ? 0.0 : sent * 100.0 / terminal;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof QueueStats other && counts.equals(other.counts);
  }

  @Override
  public int hashCode() {
    return counts.hashCode();
  }

  @Override
  public String toString() {
    return "QueueStats" + counts;
  }
}
