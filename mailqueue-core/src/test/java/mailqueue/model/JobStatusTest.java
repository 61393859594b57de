package mailqueue.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusTest {

  @Test
  void claimableAndTerminalStates() {
    assertTrue(JobStatus.PENDING.isClaimable());
    assertTrue(JobStatus.SCHEDULED.isClaimable());
    assertFalse(JobStatus.PROCESSING.isClaimable());
    assertTrue(JobStatus.SENT.isTerminal());
    assertTrue(JobStatus.FAILED.isTerminal());
    assertFalse(JobStatus.SCHEDULED.isTerminal());
  }

  @Test
  void transitionsNeverReturnToPending() {
    assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.PROCESSING));
    assertTrue(JobStatus.SCHEDULED.canTransitionTo(JobStatus.PROCESSING));
    assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.SENT));
    assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.SCHEDULED));
    assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.FAILED));

    for (JobStatus status : JobStatus.values()) {
      assertFalse(status.canTransitionTo(JobStatus.PENDING), status + " -> PENDING");
      assertFalse(JobStatus.SENT.canTransitionTo(status));
      assertFalse(JobStatus.FAILED.canTransitionTo(status));
    }
    assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.SENT));
  }

  @Test
  void dbValueRoundTrip() {
    for (JobStatus status : JobStatus.values()) {
      assertEquals(status, JobStatus.fromDbValue(status.dbValue()));
    }
    assertEquals("processing", JobStatus.PROCESSING.dbValue());
    assertThrows(IllegalArgumentException.class, () -> JobStatus.fromDbValue("PENDING"));
  }

  @Test
  void queueStatsFillsMissingStatuses() {
    QueueStats stats = new QueueStats(Map.of(JobStatus.SENT, 3L, JobStatus.FAILED, 1L, JobStatus.PENDING, 2L));

    assertEquals(0, stats.count(JobStatus.PROCESSING));
    assertEquals(6, stats.total());
    assertEquals(2, stats.backlog());
    assertEquals(75.0, stats.successRate(), 0.001);
    assertEquals(0.0, new QueueStats(null).successRate());
  }
}
