package mailqueue;

/**
 * Invalid or incomplete queue configuration detected at startup.
 */
public final class ConfigurationException extends MailQueueException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
