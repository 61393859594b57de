package mailqueue;

/**
 * Base type for failures raised by the queue. Each subtype carries only the fields relevant
 * to its kind:
 * <ul>
 *   <li>{@link StoreException}: optional affected job id</li>
 *   <li>{@link DeliveryException}: transient flag</li>
 *   <li>{@link ConfigurationException}: invalid settings</li>
 * </ul>
 *
 * <p>Admission rejections are not exceptions; see
 * {@link mailqueue.admission.AdmissionDecision.RateLimited}.
 */
public abstract sealed class MailQueueException extends RuntimeException
    permits StoreException, DeliveryException, ConfigurationException {

  protected MailQueueException(String message) {
    super(message);
  }

  protected MailQueueException(String message, Throwable cause) {
    super(message, cause);
  }
}
