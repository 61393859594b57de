package mailqueue.transport;

import java.util.Objects;

/**
 * Outcome of {@link Transport#send(OutboundMessage)}.
 *
 * <ul>
 *   <li>{@link Delivered}: accepted by the downstream server; the job becomes SENT.</li>
 *   <li>{@link Rejected}: not delivered; {@code transientFailure} routes the job to the retry
 *       policy, otherwise it fails immediately regardless of its remaining retry budget.</li>
 * </ul>
 */
public sealed interface DeliveryResult permits DeliveryResult.Delivered, DeliveryResult.Rejected {

  Delivered DELIVERED = new Delivered();

  static Delivered delivered() {
    return DELIVERED;
  }

  static Rejected transientFailure(String error) {
    return new Rejected(error, true);
  }

  static Rejected permanentFailure(String error) {
    return new Rejected(error, false);
  }

  record Delivered() implements DeliveryResult {
  }

  /**
   * @param error            description of the failure (never null)
   * @param transientFailure whether a later attempt may succeed
   */
  record Rejected(String error, boolean transientFailure) implements DeliveryResult {
    public Rejected {
      Objects.requireNonNull(error, "error");
    }
  }
}
