package mailqueue.model;

import java.util.List;
import java.util.Objects;

/**
 * Addressees of a message. {@code to} must be non-empty for a job to be accepted by a store;
 * {@code cc} and {@code bcc} may be empty.
 */
public record Recipients(List<String> to, List<String> cc, List<String> bcc) {

  public Recipients {
    to = copyOf(to, "to");
    cc = cc == null ? List.of() : copyOf(cc, "cc");
    bcc = bcc == null ? List.of() : copyOf(bcc, "bcc");
  }

  public static Recipients to(String... addresses) {
    return new Recipients(List.of(addresses), List.of(), List.of());
  }

  public static Recipients to(List<String> addresses) {
    return new Recipients(addresses, List.of(), List.of());
  }

  public Recipients withCc(List<String> cc) {
    return new Recipients(to, cc, bcc);
  }

  public Recipients withBcc(List<String> bcc) {
    return new Recipients(to, cc, bcc);
  }

  public boolean isEmpty() {
    return to.isEmpty();
  }

  /** Total number of distinct delivery addresses across all fields. */
  public int size() {
    return to.size() + cc.size() + bcc.size();
  }

  private static List<String> copyOf(List<String> addresses, String field) {
    Objects.requireNonNull(addresses, field);
    for (String address : addresses) {
      if (address == null || address.isBlank()) {
        throw new IllegalArgumentException(field + " contains a blank address");
      }
    }
    return List.copyOf(addresses);
  }
}
