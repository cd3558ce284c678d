package ca.gc.cra.docrelay.domain.msg;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Outcome of one produced record as acknowledged (or rejected) by the broker.
 * <p><strong>Role:</strong> Passed to {@link ca.gc.cra.docrelay.application.port.DeliveryReporter}s from the
 * producer I/O thread.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param topic destination topic
 * @param partition partition the record landed in, or {@code -1} when delivery failed before assignment
 * @param offset assigned offset, or {@code -1} when unknown
 * @param error delivery failure; empty on success
 * @since 0.1.0
 */
public record DeliveryReport(String topic, int partition, long offset, Optional<Exception> error) {

  public DeliveryReport {
    Objects.requireNonNull(topic, "topic");
    error = Objects.requireNonNullElse(error, Optional.empty());
  }

  /**
   * Creates a successful report.
   *
   * @param topic destination topic
   * @param partition assigned partition
   * @param offset assigned offset
   * @return success report
   */
  public static DeliveryReport delivered(String topic, int partition, long offset) {
    return new DeliveryReport(topic, partition, offset, Optional.empty());
  }

  /**
   * Creates a failure report.
   *
   * @param topic destination topic
   * @param partition partition if known, otherwise {@code -1}
   * @param error failure cause
   * @return failure report
   */
  public static DeliveryReport failed(String topic, int partition, Exception error) {
    return new DeliveryReport(topic, partition, -1L, Optional.of(Objects.requireNonNull(error, "error")));
  }

  /**
   * Indicates whether the broker acknowledged the record.
   *
   * @return {@code true} when no error was reported
   */
  public boolean succeeded() {
    return error.isEmpty();
  }
}
