/**
 * Job model: the persisted {@link mailqueue.model.Job} snapshot, the
 * {@link mailqueue.model.NewJob} submission value, and status/statistics types.
 */
package mailqueue.model;
