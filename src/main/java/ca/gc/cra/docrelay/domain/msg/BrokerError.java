package ca.gc.cra.docrelay.domain.msg;

import java.util.Objects;

/**
 * Broker-reported fault attached to a poll result.
 *
 * @param code short error identifier (for Kafka, the exception simple name)
 * @param reason human-readable description; never {@code null}
 * @param retriable whether the client considers the condition transient
 * @since 0.1.0
 */
public record BrokerError(String code, String reason, boolean retriable) {

  public BrokerError {
    Objects.requireNonNull(code, "code");
    reason = reason == null ? "" : reason;
  }

  /**
   * Builds an error description from a client exception.
   *
   * @param cause exception raised by the broker client
   * @param retriable whether the exception is transient
   * @return error description
   */
  public static BrokerError from(Throwable cause, boolean retriable) {
    Objects.requireNonNull(cause, "cause");
    return new BrokerError(cause.getClass().getSimpleName(), cause.getMessage(), retriable);
  }

  @Override
  public String toString() {
    return code + ": " + reason;
  }
}
