package mailqueue.admission;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives stable, non-reversible limiter keys from client network addresses.
 */
public final class ClientKeys {
  static final String UNKNOWN = "unknown";
  private static final int KEY_HEX_LENGTH = 16;

  private ClientKeys() {}

  /**
   * Hashes the originating address of a request. The first entry of a proxy
   * {@code X-Forwarded-For} list wins over the socket address.
   *
   * @param forwardedFor  value of the forwarded-for header, may be {@code null}
   * @param remoteAddress socket peer address, may be {@code null}
   * @return 16 hex characters of the SHA-256 digest of the address
   */
  public static String fromRequest(String forwardedFor, String remoteAddress) {
    String address = null;
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      address = forwardedFor.split(",", 2)[0].trim();
    }
    if (address == null || address.isEmpty()) {
      address = remoteAddress == null || remoteAddress.isBlank() ? UNKNOWN : remoteAddress.trim();
    }
    return fromAddress(address);
  }

  public static String fromAddress(String address) {
    String value = address == null ? UNKNOWN : address;
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash).substring(0, KEY_HEX_LENGTH);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
