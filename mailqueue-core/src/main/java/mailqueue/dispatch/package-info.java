/**
 * Background delivery: {@link mailqueue.dispatch.WorkerDispatcher} claims due jobs, delivers
 * them through a {@link mailqueue.transport.Transport} with bounded concurrency and records
 * each outcome in the store.
 */
package mailqueue.dispatch;
