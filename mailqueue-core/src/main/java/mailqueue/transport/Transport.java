package mailqueue.transport;

/**
 * Delivery collaborator invoked by the worker dispatcher for each claimed job.
 *
 * <p>Implementations report the outcome as a {@link DeliveryResult}. They may instead throw;
 * a {@link mailqueue.DeliveryException} carries its own transient flag and any other exception
 * is classified by {@link TransientErrorClassifier}. The transient flag is the only input that
 * decides whether the retry policy applies.
 *
 * <p>Implementations must be thread-safe: up to {@code concurrency} sends run in parallel.
 */
@FunctionalInterface
public interface Transport extends AutoCloseable {

  /**
   * Delivers one message.
   *
   * @param message the message to deliver
   * @return the outcome
   * @throws Exception any delivery failure, classified by the dispatcher
   */
  DeliveryResult send(OutboundMessage message) throws Exception;

  /**
   * Releases connections held by the transport. Default is a no-op.
   */
  @Override
  default void close() {
  }
}
