package mailqueue.model;

import java.util.Objects;

/**
 * Result of a liveness probe against a store.
 */
public sealed interface HealthStatus permits HealthStatus.Up, HealthStatus.Down {

  Up UP = new Up();

  static Up up() {
    return UP;
  }

  static Down down(String reason) {
    return new Down(reason);
  }

  default boolean isUp() {
    return this instanceof Up;
  }

  record Up() implements HealthStatus {
  }

  record Down(String reason) implements HealthStatus {
    public Down {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
