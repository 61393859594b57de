/**
 * Admission control for the submission boundary.
 *
 * <p>{@link mailqueue.admission.SlidingWindowRateLimiter} gates requests per client with
 * atomic check-and-record and self-evicting records. Its state is local to one process.
 */
package mailqueue.admission;
