/**
 * Asynchronous e-mail job queue.
 *
 * <p>{@link mailqueue.MailQueue} is the entry point: it admits submissions through a per-client
 * limiter, persists them in a {@link mailqueue.spi.JobStore} and runs a
 * {@link mailqueue.dispatch.WorkerDispatcher} that delivers due jobs with bounded
 * concurrency and exponential-backoff retries.
 */
package mailqueue;
