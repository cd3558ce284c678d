package ca.gc.cra.docrelay.application.port;

import ca.gc.cra.docrelay.domain.msg.DeliveryReport;
import java.util.Objects;

/**
 * Receives the broker-side outcome of each produced record.
 *
 * <p>Invoked on the producer I/O thread, never on the publishing thread. Implementations must not
 * block and must not throw; failures are recorded, not raised.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DeliveryReporter {

  /**
   * Records one delivery outcome.
   *
   * @param report delivery outcome; never {@code null}
   */
  void onDelivery(DeliveryReport report);

  /**
   * Returns a reporter that notifies this reporter and then {@code next}.
   *
   * @param next reporter to call second
   * @return composed reporter
   */
  default DeliveryReporter andThen(DeliveryReporter next) {
    Objects.requireNonNull(next, "next");
    return report -> {
      onDelivery(report);
      next.onDelivery(report);
    };
  }
}
