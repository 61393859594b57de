/**
 * Delivery collaborator contract.
 *
 * <p>{@link mailqueue.transport.Transport} implementations (SMTP clients, HTTP e-mail APIs)
 * live outside this library; the queue only depends on the
 * {@link mailqueue.transport.DeliveryResult} they report.
 */
package mailqueue.transport;
