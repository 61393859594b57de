package mailqueue;

import mailqueue.admission.SlidingWindowRateLimiter;
import mailqueue.dispatch.DispatchStats;
import mailqueue.dispatch.WorkerDispatcher;
import mailqueue.model.JobStatus;
import mailqueue.model.MessageContent;
import mailqueue.model.NewJob;
import mailqueue.model.Recipients;
import mailqueue.testing.InMemoryJobStore;
import mailqueue.testing.MutableClock;
import mailqueue.testing.RecordingMetrics;
import mailqueue.transport.DeliveryResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MailQueueTest {

  private final MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
  private final InMemoryJobStore store = new InMemoryJobStore(clock);
  private final RecordingMetrics metrics = new RecordingMetrics();

  @Test
  void builderRequiresJobStore() {
    assertThrows(NullPointerException.class, () -> MailQueue.builder().build());
  }

  @Test
  void submitStoresPendingJob() {
    try (MailQueue queue = MailQueue.builder().jobStore(store).build()) {
      SubmissionResult result = queue.submit("client", job());

      var accepted = assertInstanceOf(SubmissionResult.Accepted.class, result);
      assertEquals(JobStatus.PENDING, queue.status(accepted.jobId()).orElseThrow().status());
      assertEquals(1, queue.stats().backlog());
      assertTrue(queue.health().isUp());
      assertEquals(DispatchStats.EMPTY, queue.dispatchStats());
      assertTrue(queue.dispatcher().isEmpty());
    }
  }

  @Test
  void repeatedMessageIdReturnsSameJob() {
    try (MailQueue queue = MailQueue.builder().jobStore(store).build()) {
      NewJob first = NewJob.builder(Recipients.to("a@example.com"))
          .messageId("order-42-confirmation")
          .content(MessageContent.inline("Order", null, "Thanks"))
          .build();

      long id = queue.enqueue(first);
      assertEquals(id, queue.enqueue(first));
      assertEquals(1, queue.stats().total());
    }
  }

  @Test
  void rateLimitedSubmissionIsRejectedWithoutStoring() {
    SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1, 60, clock);
    try (MailQueue queue = MailQueue.builder().jobStore(store).rateLimiter(limiter).metrics(metrics).build()) {
      assertTrue(queue.submit("client", job()).isAccepted());

      SubmissionResult second = queue.submit("client", job());

      var rejected = assertInstanceOf(SubmissionResult.Rejected.class, second);
      assertEquals(Duration.ofSeconds(1), rejected.retryAfter());
      assertEquals(1, queue.stats().total());
      assertEquals(1, metrics.admissionRejected.get());

      assertTrue(queue.submit("other", job()).isAccepted());
    }
  }

  @Test
  void enqueueBypassesLimiter() {
    SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1, 1, clock);
    try (MailQueue queue = MailQueue.builder().jobStore(store).rateLimiter(limiter).build()) {
      queue.enqueue(job());
      queue.enqueue(job());
      assertEquals(2, queue.stats().total());
      assertEquals(0, limiter.trackedClients());
    }
  }

  @Test
  void storeFailurePropagates() {
    try (MailQueue queue = MailQueue.builder().jobStore(store).build()) {
      NewJob noRecipients = NewJob.builder(Recipients.to(List.of()))
          .content(MessageContent.inline("Hi", null, "Hi"))
          .build();

      assertThrows(StoreException.class, () -> queue.submit("client", noRecipients));
    }
  }

  @Test
  void closeStopsDispatcherAndStore() {
    WorkerDispatcher dispatcher = WorkerDispatcher.builder()
        .jobStore(store)
        .transport(m -> DeliveryResult.delivered())
        .clock(clock)
        .build();
    SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(10, 60, clock);
    MailQueue queue = MailQueue.builder().jobStore(store).dispatcher(dispatcher).rateLimiter(limiter).build();
    queue.submit("client", job());
    assertEquals(1, limiter.trackedClients());

    queue.start();
    queue.close();
    queue.close();

    assertFalse(dispatcher.isRunning());
    assertTrue(store.closed.get());
    assertEquals(0, limiter.trackedClients());
    assertThrows(IllegalStateException.class, () -> queue.submit("client", job()));
  }

  @Test
  void closeWithoutDispatcherClosesStore() {
    MailQueue queue = MailQueue.builder().jobStore(store).build();
    queue.start();
    queue.close();

    assertTrue(store.closed.get());
  }

  private static NewJob job() {
    return NewJob.builder(Recipients.to("a@example.com"))
        .content(MessageContent.inline("Hello", null, "Body"))
        .build();
  }
}
