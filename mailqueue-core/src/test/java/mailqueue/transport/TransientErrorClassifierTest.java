package mailqueue.transport;

import mailqueue.DeliveryException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class TransientErrorClassifierTest {

  @Test
  void deliveryExceptionUsesItsOwnFlag() {
    assertTrue(TransientErrorClassifier.isTransient(DeliveryException.transientFailure("550 mailbox full")));
    assertFalse(TransientErrorClassifier.isTransient(DeliveryException.permanentFailure("Connection refused")));
  }

  @Test
  void ioAndTimeoutTypesAreTransient() {
    assertTrue(TransientErrorClassifier.isTransient(new IOException("boom")));
    assertTrue(TransientErrorClassifier.isTransient(new SocketTimeoutException("read")));
    assertTrue(TransientErrorClassifier.isTransient(new TimeoutException()));
  }

  @Test
  void causeChainIsInspected() {
    RuntimeException wrapped = new RuntimeException("send failed", new IOException("eof"));

    assertTrue(TransientErrorClassifier.isTransient(wrapped));
  }

  @Test
  void keywordsMarkTransientErrors() {
    assertTrue(TransientErrorClassifier.isTransient(new IllegalStateException("Connection reset by peer")));
    assertTrue(TransientErrorClassifier.isTransient(new IllegalStateException("421 Service not available")));
    assertTrue(TransientErrorClassifier.isTransient(new IllegalStateException("Please TRY AGAIN later")));
    assertTrue(TransientErrorClassifier.isTransient(new IllegalStateException("Broken pipe")));
    assertTrue(TransientErrorClassifier.isTransient(new IllegalStateException("temporarily deferred")));
  }

  @Test
  void otherErrorsArePermanent() {
    assertFalse(TransientErrorClassifier.isTransient(new IllegalArgumentException("550 No such user")));
    assertFalse(TransientErrorClassifier.isTransient(new NullPointerException()));
  }

  @Test
  void nullMessageDoesNotMatch() {
    assertFalse(TransientErrorClassifier.matchesKeyword(null));
  }
}
