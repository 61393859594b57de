package mailqueue.transport;

import mailqueue.DeliveryException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether an exception thrown by a transport is worth retrying.
 *
 * <p>{@link DeliveryException} reports its own flag. I/O and timeout exceptions anywhere in
 * the cause chain are transient. Otherwise the messages in the chain are matched against
 * keywords typical of temporary SMTP and network conditions.
 */
public final class TransientErrorClassifier {
  private static final List<String> TRANSIENT_KEYWORDS = List.of(
      "timeout",
      "timed out",
      "connection",
      "temporarily",
      "try again",
      "unavailable",
      "service",
      "refused",
      "reset",
      "broken pipe");
  private static final int MAX_CAUSE_DEPTH = 8;

  private TransientErrorClassifier() {}

  public static boolean isTransient(Throwable error) {
    if (error instanceof DeliveryException de) {
      return de.isTransient();
    }
    Throwable current = error;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof IOException || current instanceof TimeoutException) {
        return true;
      }
      if (matchesKeyword(current.getMessage())) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  static boolean matchesKeyword(String message) {
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (String keyword : TRANSIENT_KEYWORDS) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
