package mailqueue.dispatch;

import mailqueue.DeliveryException;
import mailqueue.model.Job;
import mailqueue.model.JobStatus;
import mailqueue.model.MessageContent;
import mailqueue.model.NewJob;
import mailqueue.model.Recipients;
import mailqueue.retry.ExponentialBackoffRetryPolicy;
import mailqueue.retry.RetryDecision;
import mailqueue.retry.RetryPolicy;
import mailqueue.testing.InMemoryJobStore;
import mailqueue.testing.MutableClock;
import mailqueue.testing.RecordingMetrics;
import mailqueue.transport.DeliveryResult;
import mailqueue.transport.OutboundMessage;
import mailqueue.transport.Transport;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerDispatcherTest {

    private final MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
    private final InMemoryJobStore store = new InMemoryJobStore(clock);
    private final RecordingMetrics metrics = new RecordingMetrics();

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMissingJobStore() {
        assertThrows(NullPointerException.class, () ->
                WorkerDispatcher.builder().transport(m -> DeliveryResult.delivered()).build());
    }

    @Test
    void builderRejectsMissingTransport() {
        assertThrows(NullPointerException.class, () ->
                WorkerDispatcher.builder().jobStore(store).build());
    }

    @Test
    void builderRejectsBatchSizeOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> builder(m -> DeliveryResult.delivered()).batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder(m -> DeliveryResult.delivered()).batchSize(1001).build());
    }

    @Test
    void builderRejectsNonPositiveSettings() {
        assertThrows(IllegalArgumentException.class, () -> builder(m -> DeliveryResult.delivered()).concurrency(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> builder(m -> DeliveryResult.delivered()).pollInterval(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> builder(m -> DeliveryResult.delivered()).deliveryTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> builder(m -> DeliveryResult.delivered()).drainTimeout(Duration.ofSeconds(-1)).build());
    }

    // ── Delivery outcomes ───────────────────────────────────────────

    @Test
    void successfulDeliveryMarksSent() {
        long id = store.enqueue(job("a@example.com"));
        List<OutboundMessage> delivered = new CopyOnWriteArrayList<>();

        try (WorkerDispatcher dispatcher = builder(m -> {
            delivered.add(m);
            return DeliveryResult.delivered();
        }).build()) {
            assertEquals(1, dispatcher.pollOnce());

            Job job = store.get(id);
            assertEquals(JobStatus.SENT, job.status());
            assertEquals(clock.instant(), job.sentAt());
            assertEquals(1, delivered.size());
            assertEquals(1, delivered.get(0).attempt());
            assertEquals(new DispatchStats(1, 1, 0, 0, 0, 1), dispatcher.stats());
            assertEquals(1, metrics.sent.get());
            assertEquals(1L, metrics.claimed.get());
        }
    }

    @Test
    void transientFailureSchedulesRetryWithBackoff() {
        long id = store.enqueue(job("a@example.com"));

        try (WorkerDispatcher dispatcher = builder(m -> DeliveryResult.transientFailure("421 try later")).build()) {
            dispatcher.pollOnce();

            Job job = store.get(id);
            assertEquals(JobStatus.SCHEDULED, job.status());
            assertEquals(1, job.retryCount());
            assertEquals("421 try later", job.lastError());
            assertEquals(clock.instant().plusSeconds(300), job.nextRetryAt());

            // not due yet
            assertEquals(0, dispatcher.pollOnce());
            clock.advance(Duration.ofSeconds(299));
            assertEquals(0, dispatcher.pollOnce());
            clock.advance(Duration.ofSeconds(1));
            assertEquals(1, dispatcher.pollOnce());

            Job second = store.get(id);
            assertEquals(2, second.retryCount());
            assertEquals(clock.instant().plusSeconds(600), second.nextRetryAt());
            assertEquals(2, dispatcher.stats().retryScheduled());
            assertEquals(0, dispatcher.stats().permanentlyFailed());
        }
    }

    @Test
    void retriesExhaustedMarksFailed() {
        long id = store.enqueue(NewJob.builder(Recipients.to("a@example.com"))
                .content(content())
                .maxRetries(1)
                .build());

        try (WorkerDispatcher dispatcher = builder(m -> DeliveryResult.transientFailure("timeout")).build()) {
            dispatcher.pollOnce();
            assertEquals(JobStatus.SCHEDULED, store.get(id).status());

            clock.advance(Duration.ofSeconds(300));
            dispatcher.pollOnce();

            Job job = store.get(id);
            assertEquals(JobStatus.FAILED, job.status());
            assertEquals(1, job.retryCount());
            assertEquals(1, dispatcher.stats().retryScheduled());
            assertEquals(1, dispatcher.stats().permanentlyFailed());
            assertEquals(1, metrics.retryScheduled.get());
            assertEquals(1, metrics.permanentlyFailed.get());

            // terminal jobs are never claimed again
            clock.advance(Duration.ofDays(1));
            assertEquals(0, dispatcher.pollOnce());
        }
    }

    @Test
    void retryBeyondBudgetMarksFailed() {
        long id = store.enqueue(NewJob.builder(Recipients.to("a@example.com"))
                .content(content())
                .maxRetries(1)
                .build());
        RetryPolicy alwaysRetry = (retryCount, maxRetries, now) -> RetryDecision.retry(now, retryCount + 1);

        try (WorkerDispatcher dispatcher = builder(m -> DeliveryResult.transientFailure("421 busy"))
                .retryPolicy(alwaysRetry)
                .build()) {
            dispatcher.pollOnce();
            assertEquals(JobStatus.SCHEDULED, store.get(id).status());

            dispatcher.pollOnce();
            Job job = store.get(id);
            assertEquals(JobStatus.FAILED, job.status());
            assertEquals(1, job.retryCount());
            assertEquals("421 busy", job.lastError());
            assertEquals(1, dispatcher.stats().retryScheduled());
            assertEquals(1, dispatcher.stats().permanentlyFailed());
            assertEquals(0, store.stats().count(JobStatus.PROCESSING));
        }
    }

    @Test
    void refusedRescheduleMarksFailed() {
        long id = store.enqueue(job("a@example.com"));
        store.refuseSchedule.set(true);

        try (WorkerDispatcher dispatcher = builder(m -> DeliveryResult.transientFailure("421 busy")).build()) {
            dispatcher.pollOnce();

            Job job = store.get(id);
            assertEquals(JobStatus.FAILED, job.status());
            assertEquals(0, job.retryCount());
            assertEquals(0, dispatcher.stats().retryScheduled());
            assertEquals(1, metrics.permanentlyFailed.get());
        }
    }

    @Test
    void permanentFailureSkipsRetries() {
        long id = store.enqueue(job("nobody@example.com"));

        try (WorkerDispatcher dispatcher = builder(m -> DeliveryResult.permanentFailure("550 no such user")).build()) {
            dispatcher.pollOnce();

            Job job = store.get(id);
            assertEquals(JobStatus.FAILED, job.status());
            assertEquals(0, job.retryCount());
            assertEquals("550 no such user", job.lastError());
            assertEquals(new DispatchStats(1, 0, 0, 1, 0, 1), dispatcher.stats());
        }
    }

    @Test
    void thrownExceptionsAreClassified() {
        long transientByType = store.enqueue(job("io@example.com"));
        long transientByFlag = store.enqueue(job("flag@example.com"));
        long permanent = store.enqueue(job("bad@example.com"));

        Transport transport = m -> {
            switch (m.recipients().to().get(0)) {
                case "io@example.com":
                    throw new IOException("socket closed");
                case "flag@example.com":
                    throw DeliveryException.transientFailure("greylisted");
                default:
                    throw new IllegalArgumentException("malformed recipient");
            }
        };
        try (WorkerDispatcher dispatcher = builder(transport).build()) {
            assertEquals(3, dispatcher.pollOnce());

            assertEquals(JobStatus.SCHEDULED, store.get(transientByType).status());
            assertEquals(JobStatus.SCHEDULED, store.get(transientByFlag).status());
            assertEquals("greylisted", store.get(transientByFlag).lastError());
            assertEquals(JobStatus.FAILED, store.get(permanent).status());
            assertEquals("malformed recipient", store.get(permanent).lastError());
        }
    }

    @Test
    void nullResultIsPermanentFailure() {
        long id = store.enqueue(job("a@example.com"));

        try (WorkerDispatcher dispatcher = builder(m -> null).build()) {
            dispatcher.pollOnce();

            assertEquals(JobStatus.FAILED, store.get(id).status());
        }
    }

    @Test
    void slowDeliveryTimesOutAsTransient() {
        long id = store.enqueue(job("slow@example.com"));
        Transport transport = m -> {
            Thread.sleep(10_000);
            return DeliveryResult.delivered();
        };
        try (WorkerDispatcher dispatcher = builder(transport).deliveryTimeout(Duration.ofMillis(100)).build()) {
            long start = System.nanoTime();
            dispatcher.pollOnce();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            Job job = store.get(id);
            assertEquals(JobStatus.SCHEDULED, job.status());
            assertTrue(job.lastError().contains("timed out"), job.lastError());
            assertTrue(elapsedMs < 5_000, "pollOnce took " + elapsedMs + " ms");
        }
    }

    @Test
    void priorityOrderIsRespected() {
        long low = store.enqueue(NewJob.builder(Recipients.to("low@example.com")).content(content()).priority(9).build());
        long high = store.enqueue(NewJob.builder(Recipients.to("high@example.com")).content(content()).priority(1).build());
        List<Long> order = new CopyOnWriteArrayList<>();

        try (WorkerDispatcher dispatcher = builder(m -> {
            order.add(m.jobId());
            return DeliveryResult.delivered();
        }).batchSize(1).build()) {
            dispatcher.pollOnce();
            dispatcher.pollOnce();
        }
        assertEquals(List.of(high, low), order);
    }

    @Test
    void concurrencyIsBounded() {
        for (int i = 0; i < 12; i++) {
            store.enqueue(job("user" + i + "@example.com"));
        }
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        Transport transport = m -> {
            int now = current.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(30);
            } finally {
                current.decrementAndGet();
            }
            return DeliveryResult.delivered();
        };
        try (WorkerDispatcher dispatcher = builder(transport).concurrency(3).build()) {
            assertEquals(12, dispatcher.pollOnce());
            assertEquals(12, dispatcher.stats().sent());
            assertEquals(0, dispatcher.inFlight());
        }
        assertTrue(peak.get() <= 3, "peak concurrency " + peak.get());
        assertTrue(peak.get() >= 2, "deliveries should overlap, peak " + peak.get());
    }

    @Test
    void timedOutSendKeepsItsSlotUntilTransportReturns() throws Exception {
        for (int i = 0; i < 5; i++) {
            store.enqueue(job("user" + i + "@example.com"));
        }
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        AtomicBoolean release = new AtomicBoolean();

        // spins through interrupts, like a socket write blocked on a stalled server
        Transport transport = m -> {
            calls.incrementAndGet();
            peak.accumulateAndGet(current.incrementAndGet(), Math::max);
            try {
                while (!release.get()) {
                    Thread.onSpinWait();
                }
            } finally {
                current.decrementAndGet();
            }
            return DeliveryResult.delivered();
        };
        try (WorkerDispatcher dispatcher = builder(transport)
                .concurrency(1)
                .batchSize(1)
                .deliveryTimeout(Duration.ofMillis(50))
                .build()) {
            assertEquals(1, dispatcher.pollOnce());
            for (int i = 0; i < 4; i++) {
                assertEquals(0, dispatcher.pollOnce());
            }
            assertEquals(1, calls.get());
            assertEquals(1, dispatcher.inFlight());
            assertEquals(1, store.stats().count(JobStatus.SCHEDULED));
            assertEquals(4, store.stats().count(JobStatus.PENDING));

            release.set(true);
            long deadline = System.currentTimeMillis() + 5_000;
            while (dispatcher.inFlight() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, dispatcher.inFlight());
            assertEquals(1, dispatcher.pollOnce());
            assertEquals(1, store.stats().count(JobStatus.SENT));
        }
        assertEquals(1, peak.get());
    }

    @Test
    void storeErrorDuringClaimIsSurvived() {
        long id = store.enqueue(job("a@example.com"));
        store.failNextClaims.set(1);

        try (WorkerDispatcher dispatcher = builder(m -> DeliveryResult.delivered()).build()) {
            assertEquals(0, dispatcher.pollOnce());
            assertEquals(1, dispatcher.stats().storeErrors());
            assertEquals(1, metrics.storeErrors.get());

            assertEquals(1, dispatcher.pollOnce());
            assertEquals(JobStatus.SENT, store.get(id).status());
        }
    }

    @Test
    void oldestLagIsReported() {
        store.enqueue(job("a@example.com"));
        clock.advance(Duration.ofSeconds(42));

        try (WorkerDispatcher dispatcher = builder(m -> DeliveryResult.delivered()).build()) {
            dispatcher.pollOnce();
        }
        assertEquals(42_000L, metrics.lastLagMs.get());
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @Test
    void backgroundLoopDeliversJobs() throws Exception {
        CountDownLatch delivered = new CountDownLatch(2);
        store.enqueue(job("a@example.com"));

        try (WorkerDispatcher dispatcher = builder(m -> {
            delivered.countDown();
            return DeliveryResult.delivered();
        }).pollInterval(Duration.ofMillis(20)).build()) {
            dispatcher.start();
            assertTrue(dispatcher.isRunning());
            store.enqueue(job("b@example.com"));

            assertTrue(delivered.await(5, TimeUnit.SECONDS));
        }
        assertEquals(2, store.stats().count(JobStatus.SENT));
    }

    @Test
    void closeInterruptsIdleSleep() throws Exception {
        WorkerDispatcher dispatcher = builder(m -> DeliveryResult.delivered())
                .pollInterval(Duration.ofHours(1))
                .build();
        dispatcher.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (store.claimCalls.get() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, store.claimCalls.get());

        long start = System.nanoTime();
        dispatcher.close();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs < 2_000, "close took " + elapsedMs + " ms");
        assertFalse(dispatcher.isRunning());
        assertTrue(store.closed.get());
    }

    @Test
    void closeWaitsForInFlightDelivery() throws Exception {
        long id = store.enqueue(job("a@example.com"));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean transportClosed = new AtomicBoolean();

        Transport transport = new Transport() {
            @Override
            public DeliveryResult send(OutboundMessage message) throws Exception {
                started.countDown();
                release.await();
                return DeliveryResult.delivered();
            }

            @Override
            public void close() {
                transportClosed.set(true);
            }
        };
        WorkerDispatcher dispatcher = builder(transport).pollInterval(Duration.ofMillis(20)).build();
        dispatcher.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        Thread closer = new Thread(dispatcher::close);
        closer.start();
        Thread.sleep(100);
        assertTrue(closer.isAlive(), "close should wait for the delivery in flight");

        release.countDown();
        closer.join(5_000);
        assertFalse(closer.isAlive());
        assertEquals(JobStatus.SENT, store.get(id).status());
        assertTrue(transportClosed.get());
        assertEquals(0, store.stats().count(JobStatus.PROCESSING));
    }

    @Test
    void closeWaitsForTimedOutSendBeforeClosingTransport() throws Exception {
        store.enqueue(job("a@example.com"));
        AtomicBoolean release = new AtomicBoolean();
        AtomicBoolean sending = new AtomicBoolean();
        AtomicBoolean closedWhileSending = new AtomicBoolean();

        Transport transport = new Transport() {
            @Override
            public DeliveryResult send(OutboundMessage message) {
                sending.set(true);
                while (!release.get()) {
                    Thread.onSpinWait();
                }
                sending.set(false);
                return DeliveryResult.delivered();
            }

            @Override
            public void close() {
                closedWhileSending.set(sending.get());
            }
        };
        WorkerDispatcher dispatcher = builder(transport).deliveryTimeout(Duration.ofMillis(50)).build();
        assertEquals(1, dispatcher.pollOnce());
        assertEquals(1, dispatcher.inFlight());

        Thread closer = new Thread(dispatcher::close);
        closer.start();
        Thread.sleep(100);
        assertTrue(closer.isAlive(), "close should wait for the timed-out transport call");

        release.set(true);
        closer.join(5_000);
        assertFalse(closer.isAlive());
        assertFalse(closedWhileSending.get());
        assertEquals(0, dispatcher.inFlight());
    }

    @Test
    void closeLeavesResourcesOpenWhenNotOwned() {
        AtomicBoolean transportClosed = new AtomicBoolean();
        Transport transport = new Transport() {
            @Override
            public DeliveryResult send(OutboundMessage message) {
                return DeliveryResult.delivered();
            }

            @Override
            public void close() {
                transportClosed.set(true);
            }
        };
        builder(transport).closeResources(false).build().close();

        assertFalse(transportClosed.get());
        assertFalse(store.closed.get());
    }

    @Test
    void closeIsIdempotentAndStopsPolling() {
        WorkerDispatcher dispatcher = builder(m -> DeliveryResult.delivered()).build();
        dispatcher.close();
        dispatcher.close();

        store.enqueue(job("a@example.com"));
        assertEquals(0, dispatcher.pollOnce());
        assertThrows(IllegalStateException.class, dispatcher::start);
    }

    private WorkerDispatcher.Builder builder(Transport transport) {
        return WorkerDispatcher.builder()
                .jobStore(store)
                .transport(transport)
                .retryPolicy(new ExponentialBackoffRetryPolicy())
                .metrics(metrics)
                .clock(clock)
                .drainTimeout(Duration.ofSeconds(5));
    }

    private static NewJob job(String to) {
        return NewJob.builder(Recipients.to(to)).content(content()).build();
    }

    private static MessageContent content() {
        return MessageContent.inline("Welcome", "<p>Hi</p>", "Hi");
    }
}
