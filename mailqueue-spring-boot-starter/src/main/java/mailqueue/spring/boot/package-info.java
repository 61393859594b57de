/**
 * Spring Boot auto-configuration for the mail queue.
 *
 * <p>Bind {@code mailqueue.*} properties via {@link mailqueue.spring.boot.MailQueueProperties};
 * declare a {@link mailqueue.transport.Transport} bean to enable delivery.
 */
package mailqueue.spring.boot;
