package mailqueue;

/**
 * Thrown by a {@link mailqueue.transport.Transport} that prefers exceptions over
 * {@link mailqueue.transport.DeliveryResult} values. The transient flag decides whether the
 * job is retried or failed outright.
 */
public final class DeliveryException extends MailQueueException {
  private final boolean transientFailure;

  public DeliveryException(String message, boolean transientFailure) {
    super(message);
    this.transientFailure = transientFailure;
  }

  public DeliveryException(String message, boolean transientFailure, Throwable cause) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  public static DeliveryException transientFailure(String message) {
    return new DeliveryException(message, true);
  }

  public static DeliveryException permanentFailure(String message) {
    return new DeliveryException(message, false);
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
