package mailqueue.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Test
  void defaultBaseIsFiveMinutes() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(Duration.ofSeconds(300), policy.base());
    assertEquals(Duration.ofSeconds(300), policy.delayFor(0));
    assertEquals(Duration.ofSeconds(600), policy.delayFor(1));
    assertEquals(Duration.ofSeconds(1200), policy.delayFor(2));
  }

  @Test
  void retryWhileBudgetRemains() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.ofSeconds(300);

    RetryDecision decision = policy.decide(0, 3, NOW);

    var retry = assertInstanceOf(RetryDecision.Retry.class, decision);
    assertEquals(NOW.plusSeconds(300), retry.nextRetryAt());
    assertEquals(1, retry.nextRetryCount());
  }

  @Test
  void delayDoublesWithEachRetry() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.ofSeconds(60);

    for (int retryCount = 0; retryCount < 3; retryCount++) {
      var retry = (RetryDecision.Retry) policy.decide(retryCount, 10, NOW);
      assertEquals(NOW.plusSeconds(60L << retryCount), retry.nextRetryAt());
      assertEquals(retryCount + 1, retry.nextRetryCount());
    }
  }

  @Test
  void terminalWhenBudgetSpent() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertInstanceOf(RetryDecision.Terminal.class, policy.decide(3, 3, NOW));
    assertInstanceOf(RetryDecision.Terminal.class, policy.decide(4, 3, NOW));
  }

  @Test
  void lastRetryIsStillScheduled() {
    var retry = (RetryDecision.Retry) new ExponentialBackoffRetryPolicy().decide(2, 3, NOW);

    assertEquals(3, retry.nextRetryCount());
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy =
        new ExponentialBackoffRetryPolicy(Duration.ofMinutes(5), Duration.ofHours(1));

    assertEquals(Duration.ofMinutes(40), policy.delayFor(3));
    assertEquals(Duration.ofHours(1), policy.delayFor(4));
    assertEquals(Duration.ofHours(1), policy.delayFor(40));
  }

  @Test
  void hugeRetryCountSaturates() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    Duration delay = policy.delayFor(200);
    assertFalse(delay.isNegative());

    var retry = (RetryDecision.Retry) policy.decide(200, Integer.MAX_VALUE, NOW);
    assertEquals(Instant.MAX, retry.nextRetryAt());
  }

  @Test
  void rejectsNonPositiveBase() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(Duration.ofSeconds(-1)));
    assertThrows(NullPointerException.class, () -> new ExponentialBackoffRetryPolicy(null));
  }

  @Test
  void rejectsMaxDelayBelowBase() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoffRetryPolicy(Duration.ofMinutes(5), Duration.ofMinutes(1)));
  }

  @Test
  void rejectsNegativeRetryCount() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoffRetryPolicy().decide(-1, 3, NOW));
  }
}
